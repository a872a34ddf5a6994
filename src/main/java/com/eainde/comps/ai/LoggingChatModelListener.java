package com.eainde.comps.ai;

import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs latency and token usage of every model call.
 *
 * <p>The start time travels in the request attributes, so one listener instance serves
 * concurrent calls. MDC keys set by the pipeline (analysis id, fingerprint) show up in
 * these lines through the log pattern.</p>
 */
@Slf4j
public class LoggingChatModelListener implements ChatModelListener {

    static final String START_NANOS = "comps.start_nanos";

    @Override
    public void onRequest(ChatModelRequestContext context) {
        context.attributes().put(START_NANOS, System.nanoTime());
        log.debug("Model call started: {} message(s)", context.chatRequest().messages().size());
    }

    @Override
    public void onResponse(ChatModelResponseContext context) {
        TokenUsage usage = context.chatResponse().tokenUsage();
        log.info("Model call completed in {} ms (model={}, inputTokens={}, outputTokens={})",
                elapsedMillis(context.attributes().get(START_NANOS)),
                context.chatResponse().modelName(),
                usage != null ? usage.inputTokenCount() : null,
                usage != null ? usage.outputTokenCount() : null);
    }

    @Override
    public void onError(ChatModelErrorContext context) {
        log.warn("Model call failed after {} ms: {}",
                elapsedMillis(context.attributes().get(START_NANOS)),
                context.error().getMessage());
    }

    private static long elapsedMillis(Object startNanos) {
        if (!(startNanos instanceof Long start)) return -1;
        return (System.nanoTime() - start) / 1_000_000;
    }
}
