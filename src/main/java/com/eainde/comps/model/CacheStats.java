package com.eainde.comps.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of the result cache counters.
 */
public record CacheStats(
        @JsonProperty("entry_count") long entryCount,
        @JsonProperty("hit_count")   long hitCount,
        @JsonProperty("miss_count")  long missCount,
        @JsonProperty("max_entries") long maxEntries,
        @JsonProperty("ttl_hours")   double ttlHours
) {}
