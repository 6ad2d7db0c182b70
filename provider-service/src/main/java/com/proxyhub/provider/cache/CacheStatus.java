package com.proxyhub.provider.cache;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Diagnostic snapshot of one cache slot. {@code fetchedAt} and {@code interval} are
 * {@code null} when nothing is cached.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CacheStatus(
    @JsonProperty("cached")     boolean cached,
    @JsonProperty("expired")    boolean expired,
    @JsonProperty("node_count") int nodeCount,
    @JsonProperty("fetched_at") Instant fetchedAt,
    @JsonProperty("interval")   Integer interval
) {
    public static CacheStatus missing() {
        return new CacheStatus(false, true, 0, null, null);
    }

    public static CacheStatus of(CacheEntry entry, boolean expired) {
        return new CacheStatus(true, expired, entry.nodeCount(), entry.fetchedAt(), entry.interval());
    }
}
