package com.eainde.comps.cache;

import com.eainde.comps.model.AnalysisResult;
import com.eainde.comps.model.CacheStats;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Scheduler;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Process-wide TTL cache of analysis results with single-flight computation.
 *
 * <h3>Entry lifecycle:</h3>
 * <pre>
 *   getOrCompute(k) miss → placeholder future inserted, computation starts on the executor
 *   concurrent getOrCompute(k) → joins the placeholder (same result, cached=false)
 *   computation succeeds → placeholder replaced by a completed future, TTL starts now
 *   computation fails    → placeholder removed, every waiter gets the failure
 *   lookup after TTL     → miss, entry evicted
 * </pre>
 *
 * <p>Backed by a Caffeine {@link AsyncCache} with {@code expireAfterWrite} and a size bound.
 * A scheduler sweeps expired entries in the background.</p>
 */
public class FingerprintCache {

    private static final Logger log = LoggerFactory.getLogger(FingerprintCache.class);

    private final AsyncCache<String, AnalysisResult> cache;
    private final ConcurrentMap<String, CompletableFuture<AnalysisResult>> entries;
    private final Executor executor;
    private final Duration ttl;
    private final long maxEntries;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public FingerprintCache(Duration ttl, long maxEntries, Executor executor) {
        this(ttl, maxEntries, executor, Ticker.systemTicker(), Scheduler.systemScheduler());
    }

    public FingerprintCache(Duration ttl, long maxEntries, Executor executor,
                            Ticker ticker, Scheduler scheduler) {
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.executor = executor;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxEntries)
                .ticker(ticker)
                .scheduler(scheduler)
                .executor(Runnable::run)
                .buildAsync();
        this.entries = cache.asMap();
        log.info("Result cache ready: ttl={}, maxEntries={}", ttl, maxEntries);
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Completed, unexpired result for the key. In-flight computations are not visible here.
     */
    public Optional<AnalysisResult> lookup(String key) {
        CompletableFuture<AnalysisResult> future = entries.get(key);
        if (isCompletedNormally(future)) {
            hits.incrementAndGet();
            return Optional.of(future.join().withCached(true));
        }
        misses.incrementAndGet();
        return Optional.empty();
    }

    /**
     * Inserts or overwrites the result; its TTL starts now.
     */
    public void store(String key, AnalysisResult result) {
        entries.put(key, CompletableFuture.completedFuture(result.withCached(false)));
    }

    /**
     * Returns the cached result or joins/starts the single computation for the key.
     *
     * <p>The returned future completes with {@code cached = true} for a stored hit and
     * {@code cached = false} for a fresh computation, including one started by another caller.
     * The computation keeps running when a caller stops waiting, so its result still lands
     * in the cache.</p>
     */
    public CompletableFuture<AnalysisResult> getOrCompute(String key, Supplier<AnalysisResult> computation) {
        CompletableFuture<AnalysisResult> created = new CompletableFuture<>();
        CompletableFuture<AnalysisResult> existing = entries.putIfAbsent(key, created);

        if (existing != null) {
            if (isCompletedNormally(existing)) {
                hits.incrementAndGet();
                log.info("Cache hit for {}", abbreviate(key));
                return CompletableFuture.completedFuture(existing.join().withCached(true));
            }
            misses.incrementAndGet();
            log.info("Joining in-flight analysis for {}", abbreviate(key));
            return existing.thenApply(result -> result.withCached(false));
        }

        misses.incrementAndGet();
        log.info("Cache miss for {}; starting analysis", abbreviate(key));
        try {
            executor.execute(() -> run(key, created, computation));
        } catch (RejectedExecutionException e) {
            entries.remove(key, created);
            created.completeExceptionally(e);
        }
        return created.thenApply(result -> result.withCached(false));
    }

    public CacheStats stats() {
        cache.synchronous().cleanUp();
        long completed = entries.values().stream().filter(FingerprintCache::isCompletedNormally).count();
        return new CacheStats(completed, hits.get(), misses.get(), maxEntries, ttl.toMinutes() / 60.0);
    }

    /**
     * Drops every entry. In-flight computations still complete their own callers.
     */
    public void clear() {
        entries.clear();
        log.info("Result cache cleared");
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private void run(String key, CompletableFuture<AnalysisResult> created, Supplier<AnalysisResult> computation) {
        AnalysisResult result;
        try {
            result = computation.get().withCached(false);
        } catch (Throwable t) {
            entries.remove(key, created);
            log.warn("Analysis for {} failed and was not cached: {}", abbreviate(key), t.toString());
            created.completeExceptionally(t);
            return;
        }
        // a completed future restarts expireAfterWrite at completion time
        entries.replace(key, created, CompletableFuture.completedFuture(result));
        created.complete(result);
    }

    private static boolean isCompletedNormally(CompletableFuture<?> future) {
        return future != null && future.isDone() && !future.isCompletedExceptionally();
    }

    private static String abbreviate(String key) {
        return key.length() > 12 ? key.substring(0, 12) : key;
    }
}
