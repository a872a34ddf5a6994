package com.eainde.comps.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.TimeoutException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;

/**
 * {@link TextGenerationClient} on top of a LangChain4j {@link ChatModel}.
 *
 * <p>Requests JSON output with the given schema, then parses the reply leniently:
 * markdown fences are stripped, the outermost {@code {...}} is cut out, and trailing
 * commas, comments and single quotes are tolerated. Anything still unparseable is
 * reported as {@link TextGenerationException.Kind#MALFORMED}.</p>
 */
@Slf4j
public class ChatModelTextGenerationClient implements TextGenerationClient {

    /** Tolerates trailing commas, comments and single quotes. */
    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ChatModel chatModel;

    public ChatModelTextGenerationClient(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public JsonNode generate(String prompt, JsonSchema schema) {
        ChatRequest.Builder request = ChatRequest.builder()
                .messages(UserMessage.from(prompt));
        if (schema != null) {
            request.responseFormat(ResponseFormat.builder()
                    .type(ResponseFormatType.JSON)
                    .jsonSchema(schema)
                    .build());
        }

        ChatResponse response;
        try {
            response = chatModel.chat(request.build());
        } catch (RateLimitException e) {
            throw new TextGenerationException(TextGenerationException.Kind.RATE_LIMITED,
                    "Rate limited: " + e.getMessage(), e);
        } catch (TimeoutException e) {
            throw new TextGenerationException(TextGenerationException.Kind.TIMEOUT,
                    "Timed out: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            TextGenerationException.Kind kind = isTimeout(e)
                    ? TextGenerationException.Kind.TIMEOUT
                    : TextGenerationException.Kind.UNAVAILABLE;
            throw new TextGenerationException(kind, rootCauseMessage(e), e);
        }

        String text = response != null && response.aiMessage() != null
                ? response.aiMessage().text()
                : null;
        return parse(text);
    }

    /**
     * Parses a model reply into JSON, tolerating fences and surrounding prose.
     */
    static JsonNode parse(String text) {
        if (text == null || text.isBlank()) {
            throw TextGenerationException.malformed("Empty response");
        }

        String cleaned = text.replace("```json", "").replace("```", "").strip();
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw TextGenerationException.malformed("No JSON object in response: " + abbreviate(cleaned));
        }

        try {
            return LENIENT_MAPPER.readTree(cleaned.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new TextGenerationException(TextGenerationException.Kind.MALFORMED,
                    "Invalid JSON in response: " + e.getOriginalMessage(), e);
        }
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException
                    || t instanceof HttpTimeoutException
                    || t instanceof java.util.concurrent.TimeoutException) {
                return true;
            }
        }
        return false;
    }

    private static String rootCauseMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return abbreviate(String.valueOf(cause.getMessage()));
    }

    private static String abbreviate(String msg) {
        return msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}
