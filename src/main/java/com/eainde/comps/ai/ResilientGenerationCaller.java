package com.eainde.comps.ai;

import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Function;

/**
 * Calls a {@link TextGenerationClient} with retry and response validation.
 *
 * <p>Each attempt generates, then runs the caller's validator on the parsed JSON. A
 * validator signals a schema violation by throwing a {@link TextGenerationException} of kind
 * {@link TextGenerationException.Kind#MALFORMED}, which consumes an attempt exactly like a
 * timeout or rate limit. When all attempts fail, the last failure is rethrown.</p>
 *
 * <pre>
 * List&lt;String&gt; names = caller.call("extract " + chunk, prompt, schema, this::validate);
 * </pre>
 */
public class ResilientGenerationCaller {

    private static final Logger log = LoggerFactory.getLogger(ResilientGenerationCaller.class);

    /** Blocking pause between attempts, replaceable in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final TextGenerationClient client;
    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public ResilientGenerationCaller(TextGenerationClient client, RetryPolicy policy) {
        this(client, policy, d -> Thread.sleep(d.toMillis()));
    }

    public ResilientGenerationCaller(TextGenerationClient client, RetryPolicy policy, Sleeper sleeper) {
        this.client = client;
        this.policy = policy;
        this.sleeper = sleeper;
    }

    /**
     * @param operation label for log lines, e.g. the chunk identity
     * @param prompt    full prompt
     * @param schema    response schema
     * @param validator turns the JSON into the caller's type, throwing MALFORMED on violations
     * @return the validated value of the first successful attempt
     * @throws TextGenerationException the last failure once all attempts are used up
     */
    public <T> T call(String operation, String prompt, JsonSchema schema, Function<JsonNode, T> validator) {
        TextGenerationException lastError = null;

        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            if (attempt > 1) {
                pause(operation, policy.backoffBefore(attempt));
            }
            long start = System.nanoTime();
            try {
                T value = validator.apply(client.generate(prompt, schema));
                log.info("{}: attempt {}/{} succeeded in {} ms",
                        operation, attempt, policy.maxAttempts(), elapsedMillis(start));
                return value;
            } catch (TextGenerationException e) {
                lastError = e;
                log.warn("{}: attempt {}/{} failed after {} ms ({}: {})",
                        operation, attempt, policy.maxAttempts(), elapsedMillis(start),
                        e.getKind(), e.getMessage());
            }
        }

        log.error("{}: giving up after {} attempts", operation, policy.maxAttempts());
        throw lastError;
    }

    public RetryPolicy policy() {
        return policy;
    }

    private void pause(String operation, Duration backoff) {
        if (backoff.isZero()) return;
        log.debug("{}: retrying in {} ms", operation, backoff.toMillis());
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TextGenerationException(TextGenerationException.Kind.UNAVAILABLE,
                    operation + ": interrupted while backing off", e);
        }
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
