package com.eainde.comps.ai;

import com.google.genai.errors.ApiException;
import com.google.genai.types.Candidate;
import com.google.genai.types.Content;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.GenerateContentResponseUsageMetadata;
import com.google.genai.types.Part;
import com.google.genai.types.Schema;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.TimeoutException;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class GeminiChatModelTest {

    private final AtomicReference<GenerateContentConfig> lastConfig = new AtomicReference<>();
    private final List<Content> lastContents = new ArrayList<>();

    @Test
    void doChat_shouldReturnTextAndTokenUsage() {
        // GIVEN
        GeminiChatModel model = model(response("{\"companies\": []}", 10, 5), List.of());

        // WHEN
        ChatResponse response = model.doChat(ChatRequest.builder()
                .messages(UserMessage.from("Extract companies"))
                .build());

        // THEN
        assertThat(response.aiMessage().text()).isEqualTo("{\"companies\": []}");
        assertThat(response.tokenUsage().inputTokenCount()).isEqualTo(10);
        assertThat(response.tokenUsage().outputTokenCount()).isEqualTo(5);
        assertThat(lastContents).hasSize(1);
        assertThat(lastContents.get(0).role()).contains("user");
        assertThat(lastConfig.get().temperature()).contains(0.0f);
    }

    @Test
    void doChat_shouldMoveSystemMessageToConfigAndRequestJson() {
        GeminiChatModel model = model(response("{}", 1, 1), List.of());

        model.doChat(ChatRequest.builder()
                .messages(SystemMessage.from("Be precise"), UserMessage.from("Hi"))
                .responseFormat(ResponseFormat.JSON)
                .build());

        GenerateContentConfig config = lastConfig.get();
        assertThat(config.responseMimeType()).contains("application/json");
        assertThat(config.systemInstruction()).isPresent();
        assertThat(config.systemInstruction().get().parts().get().get(0).text()).contains("Be precise");
        assertThat(lastContents).hasSize(1);
    }

    @Test
    void doChat_shouldPassJsonSchemaAsResponseSchema() {
        // GIVEN
        GeminiChatModel model = model(response("{}", 1, 1), List.of());
        JsonSchema schema = JsonSchemaConverter.fromClasspath("CompetitorClassification", "schemas/classification.json");

        // WHEN
        model.doChat(ChatRequest.builder()
                .messages(UserMessage.from("Classify"))
                .responseFormat(ResponseFormat.builder().type(ResponseFormatType.JSON).jsonSchema(schema).build())
                .build());

        // THEN
        GenerateContentConfig config = lastConfig.get();
        assertThat(config.responseMimeType()).contains("application/json");
        assertThat(config.responseSchema()).isPresent();
        Schema root = config.responseSchema().get();
        assertThat(root.properties().get()).containsOnlyKeys("classifications", "reasoning");
        assertThat(root.required().get()).containsExactlyInAnyOrder("classifications", "reasoning");

        Schema entry = root.properties().get().get("classifications").items().get();
        assertThat(entry.properties().get()).containsOnlyKeys("name", "score", "reason");
        assertThat(entry.required().get()).containsExactlyInAnyOrder("name", "score", "reason");
    }

    @Test
    void doChat_shouldLeaveResponseSchemaUnset_forPlainJsonFormat() {
        GeminiChatModel model = model(response("{}", 1, 1), List.of());

        model.doChat(ChatRequest.builder()
                .messages(UserMessage.from("Hi"))
                .responseFormat(ResponseFormat.JSON)
                .build());

        assertThat(lastConfig.get().responseSchema()).isEmpty();
    }

    @Test
    void chat_shouldNotifyListeners() {
        ChatModelListener listener = mock(ChatModelListener.class);
        GeminiChatModel model = model(response("ok", 1, 1), List.of(listener));

        model.chat(ChatRequest.builder().messages(UserMessage.from("Hi")).build());

        verify(listener).onRequest(any());
        verify(listener).onResponse(any());
        verify(listener, never()).onError(any());
    }

    @Test
    void doChat_shouldTranslateRateLimitAndTimeoutStatuses() {
        ChatRequest request = ChatRequest.builder().messages(UserMessage.from("Hi")).build();

        GeminiChatModel limited = failingModel(new ApiException(429, "RESOURCE_EXHAUSTED", "quota exceeded"));
        assertThatThrownBy(() -> limited.doChat(request)).isInstanceOf(RateLimitException.class);

        GeminiChatModel slow = failingModel(new ApiException(504, "DEADLINE_EXCEEDED", "deadline"));
        assertThatThrownBy(() -> slow.doChat(request)).isInstanceOf(TimeoutException.class);

        GeminiChatModel broken = failingModel(new ApiException(500, "INTERNAL", "boom"));
        assertThatThrownBy(() -> broken.doChat(request)).isInstanceOf(ApiException.class);
    }

    @Test
    void builder_shouldRequireModelName() {
        assertThatThrownBy(() -> GeminiChatModel.builder().build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    private GeminiChatModel model(GenerateContentResponse response, List<ChatModelListener> listeners) {
        return GeminiChatModel.builder()
                .modelName("gemini-2.5-flash")
                .temperature(0.0)
                .listeners(listeners)
                .generator((name, contents, config) -> {
                    lastContents.clear();
                    lastContents.addAll(contents);
                    lastConfig.set(config);
                    return response;
                })
                .build();
    }

    private static GeminiChatModel failingModel(ApiException error) {
        return GeminiChatModel.builder()
                .modelName("gemini-2.5-flash")
                .generator((name, contents, config) -> {
                    throw error;
                })
                .build();
    }

    private static GenerateContentResponse response(String text, int promptTokens, int outputTokens) {
        return GenerateContentResponse.builder()
                .candidates(List.of(Candidate.builder()
                        .content(Content.builder()
                                .role("model")
                                .parts(List.of(Part.builder().text(text).build()))
                                .build())
                        .build()))
                .usageMetadata(GenerateContentResponseUsageMetadata.builder()
                        .promptTokenCount(promptTokens)
                        .candidatesTokenCount(outputTokens)
                        .build())
                .build();
    }
}
