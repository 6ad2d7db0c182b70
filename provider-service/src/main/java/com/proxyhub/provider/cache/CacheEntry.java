package com.proxyhub.provider.cache;

import com.proxyhub.provider.client.RefreshResult;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Materialized provider document for one configuration, as produced by the last
 * successful refresh.
 *
 * <p>{@code nodes} and {@code nodeNames} are derived views of {@code document}. Only
 * {@code interval} may change without a refresh, via {@link #withInterval(int)}.
 */
public record CacheEntry(
    long configId,
    byte[] document,
    List<Map<String, Object>> nodes,
    List<String> nodeNames,
    String prefix,
    Instant fetchedAt,
    int interval,
    int nodeCount
) {
    public static final int DEFAULT_INTERVAL_SECONDS = 3600;

    public CacheEntry {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(fetchedAt, "fetchedAt");
        nodes     = List.copyOf(nodes);
        nodeNames = List.copyOf(nodeNames);
    }

    public static CacheEntry fromRefresh(long configId, RefreshResult result, String prefix,
                                         int interval, Instant fetchedAt) {
        return new CacheEntry(configId, result.document(), result.nodes(), result.nodeNames(),
                              prefix, fetchedAt, interval, result.nodeCount());
    }

    /** The configured interval, or one hour when unset or non-positive. */
    public Duration effectiveInterval() {
        return Duration.ofSeconds(interval > 0 ? interval : DEFAULT_INTERVAL_SECONDS);
    }

    /** Instant at which the scheduler considers this entry due again. */
    public Instant dueAt() {
        return fetchedAt.plus(effectiveInterval());
    }

    public boolean isDue(Instant now) {
        return !now.isBefore(dueAt());
    }

    public CacheEntry withInterval(int newInterval) {
        return new CacheEntry(configId, document, nodes, nodeNames, prefix, fetchedAt, newInterval, nodeCount);
    }
}
