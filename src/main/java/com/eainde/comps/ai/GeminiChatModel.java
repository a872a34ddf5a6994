package com.eainde.comps.ai;

import com.google.genai.Client;
import com.google.genai.errors.ApiException;
import com.google.genai.types.Candidate;
import com.google.genai.types.Content;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.GenerateContentResponseUsageMetadata;
import com.google.genai.types.HttpOptions;
import com.google.genai.types.Part;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.TimeoutException;
import dev.langchain4j.model.chat.Capability;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static java.util.Collections.emptyList;
import static java.util.Collections.singletonList;

/**
 * A LangChain4j {@link ChatModel} backed by the Google Gen AI SDK ({@code com.google.genai}).
 *
 * <p>Text-only: system messages become the system instruction, user and AI messages become
 * contents. A JSON response format switches the response MIME type to
 * {@code application/json}; its schema, when present, becomes the {@code responseSchema}.
 * Retrying is left to the caller; this class makes exactly one
 * call per request and translates HTTP 429 to {@link RateLimitException} and 408/504 to
 * {@link TimeoutException} so callers can tell transient failures apart.</p>
 */
public class GeminiChatModel implements ChatModel {

    private static final Logger log = LoggerFactory.getLogger(GeminiChatModel.class);

    /** Single generateContent call, swappable in tests. */
    @FunctionalInterface
    interface ContentGenerator {
        GenerateContentResponse generate(String model, List<Content> contents, GenerateContentConfig config);
    }

    private final ContentGenerator generator;
    private final String modelName;
    private final GenerateContentConfig defaultConfig;
    private final boolean logRequests;
    private final List<ChatModelListener> listeners;

    private GeminiChatModel(Builder builder) {
        if (builder.modelName == null || builder.modelName.isBlank()) {
            throw new IllegalArgumentException("modelName must not be blank");
        }
        this.modelName = builder.modelName;
        this.logRequests = builder.logRequests;
        this.listeners = builder.listeners == null ? emptyList() : List.copyOf(builder.listeners);

        if (builder.generator != null) {
            this.generator = builder.generator;
        } else if (builder.client != null) {
            this.generator = builder.client.models::generateContent;
        } else {
            this.generator = new LazyClientGenerator(builder.apiKey, builder.timeout);
        }

        GenerateContentConfig.Builder config = GenerateContentConfig.builder();
        if (builder.temperature != null) config.temperature(builder.temperature.floatValue());
        if (builder.maxOutputTokens != null) config.maxOutputTokens(builder.maxOutputTokens);
        this.defaultConfig = config.build();
    }

    /**
     * Builds the SDK client on first use, so the application starts without credentials.
     */
    private static final class LazyClientGenerator implements ContentGenerator {
        private final String apiKey;
        private final Duration timeout;
        private Client client;

        LazyClientGenerator(String apiKey, Duration timeout) {
            this.apiKey = apiKey;
            this.timeout = timeout;
        }

        @Override
        public GenerateContentResponse generate(String model, List<Content> contents, GenerateContentConfig config) {
            return client().models.generateContent(model, contents, config);
        }

        private synchronized Client client() {
            if (client == null) {
                HttpOptions.Builder httpOptions = HttpOptions.builder();
                if (timeout != null) {
                    httpOptions.timeout((int) timeout.toMillis());
                }
                Client.Builder clientBuilder = Client.builder().httpOptions(httpOptions.build());
                if (apiKey != null && !apiKey.isBlank()) {
                    clientBuilder.apiKey(apiKey);
                }
                client = clientBuilder.build();
            }
            return client;
        }
    }

    @Override
    public ChatResponse doChat(ChatRequest chatRequest) {
        List<Content> contents = new ArrayList<>();
        StringBuilder systemInstruction = new StringBuilder();

        for (ChatMessage message : chatRequest.messages()) {
            if (message instanceof SystemMessage system) {
                if (systemInstruction.length() > 0) systemInstruction.append("\n");
                systemInstruction.append(system.text());
            } else if (message instanceof UserMessage user) {
                contents.add(textContent("user", user.singleText()));
            } else if (message instanceof AiMessage ai) {
                contents.add(textContent("model", ai.text()));
            } else {
                throw new IllegalArgumentException("Unsupported message type: " + message.type());
            }
        }

        GenerateContentConfig.Builder config = defaultConfig.toBuilder();
        if (systemInstruction.length() > 0) {
            config.systemInstruction(textContent(null, systemInstruction.toString()));
        }
        ResponseFormat responseFormat = chatRequest.responseFormat();
        if (responseFormat != null && responseFormat.type() == ResponseFormatType.JSON) {
            config.responseMimeType("application/json");
            if (responseFormat.jsonSchema() != null) {
                config.responseSchema(GeminiSchemaMapper.toGeminiSchema(responseFormat.jsonSchema().rootElement()));
            }
        }
        if (chatRequest.temperature() != null) {
            config.temperature(chatRequest.temperature().floatValue());
        }

        if (logRequests) {
            log.info("Gemini request: model={}, messages={}, promptChars={}", modelName,
                    chatRequest.messages().size(), contents.stream().mapToInt(GeminiChatModel::length).sum());
        }

        GenerateContentResponse result;
        try {
            result = generator.generate(modelName, contents, config.build());
        } catch (ApiException e) {
            throw translate(e);
        }

        return ChatResponse.builder()
                .aiMessage(AiMessage.from(text(result)))
                .modelName(modelName)
                .tokenUsage(tokenUsage(result))
                .finishReason(FinishReason.STOP)
                .build();
    }

    @Override
    public List<ChatModelListener> listeners() {
        return listeners;
    }

    @Override
    public Set<Capability> supportedCapabilities() {
        return Set.of(Capability.RESPONSE_FORMAT_JSON_SCHEMA);
    }

    // =========================================================================
    //  Mapping helpers
    // =========================================================================

    static RuntimeException translate(ApiException e) {
        String message = "Gemini call failed with HTTP " + e.code() + ": " + e.getMessage();
        return switch (e.code()) {
            case 429 -> new RateLimitException(message, e);
            case 408, 504 -> new TimeoutException(message, e);
            default -> e;
        };
    }

    private static Content textContent(String role, String text) {
        Content.Builder content = Content.builder()
                .parts(singletonList(Part.builder().text(text == null ? "" : text).build()));
        if (role != null) content.role(role);
        return content.build();
    }

    private static int length(Content content) {
        return content.parts().orElse(emptyList()).stream()
                .mapToInt(p -> p.text().map(String::length).orElse(0))
                .sum();
    }

    private static String text(GenerateContentResponse response) {
        StringBuilder sb = new StringBuilder();
        Optional<Candidate> first = response.candidates()
                .filter(list -> !list.isEmpty())
                .map(list -> list.get(0));
        first.flatMap(Candidate::content)
                .flatMap(Content::parts)
                .ifPresent(parts -> parts.forEach(p -> p.text().ifPresent(sb::append)));
        return sb.toString();
    }

    private static TokenUsage tokenUsage(GenerateContentResponse response) {
        Optional<GenerateContentResponseUsageMetadata> usage = response.usageMetadata();
        if (usage.isEmpty()) return null;
        return new TokenUsage(
                usage.get().promptTokenCount().orElse(null),
                usage.get().candidatesTokenCount().orElse(null));
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Client client;
        private ContentGenerator generator;
        private String apiKey;
        private String modelName;
        private Double temperature;
        private Integer maxOutputTokens;
        private Duration timeout;
        private boolean logRequests;
        private List<ChatModelListener> listeners;

        public Builder client(Client client) { this.client = client; return this; }
        Builder generator(ContentGenerator generator) { this.generator = generator; return this; }
        public Builder apiKey(String apiKey) { this.apiKey = apiKey; return this; }
        public Builder modelName(String modelName) { this.modelName = modelName; return this; }
        public Builder temperature(Double temperature) { this.temperature = temperature; return this; }
        public Builder maxOutputTokens(Integer maxOutputTokens) { this.maxOutputTokens = maxOutputTokens; return this; }
        public Builder timeout(Duration timeout) { this.timeout = timeout; return this; }
        public Builder logRequests(boolean logRequests) { this.logRequests = logRequests; return this; }
        public Builder listeners(List<ChatModelListener> listeners) { this.listeners = listeners; return this; }

        public GeminiChatModel build() {
            return new GeminiChatModel(this);
        }
    }
}
