package com.eainde.comps.config;

import com.eainde.comps.ai.ChatModelTextGenerationClient;
import com.eainde.comps.ai.GeminiChatModel;
import com.eainde.comps.ai.LoggingChatModelListener;
import com.eainde.comps.ai.ResilientGenerationCaller;
import com.eainde.comps.ai.RetryPolicy;
import com.eainde.comps.ai.TextGenerationClient;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Wires the Gemini chat model and the retrying generation caller used by extraction and
 * classification.
 */
@Slf4j
@Configuration
public class AiModelConfig {

    @Bean
    public ChatModel geminiChatModel(@Value("${comps.ai.api-key:}") String apiKey,
                                     @Value("${comps.ai.model-name:gemini-2.5-flash}") String modelName,
                                     @Value("${comps.ai.temperature:0.0}") double temperature,
                                     @Value("${comps.ai.timeout:PT120S}") Duration timeout,
                                     @Value("${comps.ai.log-requests:false}") boolean logRequests) {
        if (apiKey.isBlank()) {
            log.warn("comps.ai.api-key is empty; the Gen AI client will fall back to GOOGLE_API_KEY");
        }
        log.info("Gemini chat model: {} (temperature {}, timeout {})", modelName, temperature, timeout);
        return GeminiChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(temperature)
                .timeout(timeout)
                .logRequests(logRequests)
                .listeners(List.of(new LoggingChatModelListener()))
                .build();
    }

    @Bean
    public TextGenerationClient textGenerationClient(ChatModel chatModel) {
        return new ChatModelTextGenerationClient(chatModel);
    }

    @Bean
    public RetryPolicy retryPolicy(@Value("${comps.retry.max-attempts:3}") int maxAttempts,
                                   @Value("${comps.retry.initial-backoff:PT1S}") Duration initialBackoff,
                                   @Value("${comps.retry.multiplier:2.0}") double multiplier,
                                   @Value("${comps.retry.max-backoff:PT8S}") Duration maxBackoff) {
        return new RetryPolicy(maxAttempts, initialBackoff, multiplier, maxBackoff);
    }

    @Bean
    public ResilientGenerationCaller resilientGenerationCaller(TextGenerationClient client, RetryPolicy retryPolicy) {
        return new ResilientGenerationCaller(client, retryPolicy);
    }
}
