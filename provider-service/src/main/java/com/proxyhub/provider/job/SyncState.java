package com.proxyhub.provider.job;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Retry bookkeeping for one configuration.
 *
 * <p>{@code blockUntil} is {@code null} exactly when {@code retryDelay} is zero: a configuration
 * either has no outstanding failure or is backing off until a known instant. Transitions are the
 * only way to move between the two.
 *
 * @param blockUntil earliest instant at which the configuration may be scheduled again
 * @param retryDelay delay applied after the most recent failure
 */
public record SyncState(Instant blockUntil, Duration retryDelay) {

    public static final SyncState CLEAR = new SyncState(null, Duration.ZERO);

    public SyncState {
        Objects.requireNonNull(retryDelay, "retryDelay");
        if ((blockUntil == null) != retryDelay.isZero()) {
            throw new IllegalArgumentException(
                "blockUntil and retryDelay must be set together: " + blockUntil + ", " + retryDelay);
        }
    }

    public boolean isBlocked(Instant now) {
        return blockUntil != null && now.isBefore(blockUntil);
    }

    public boolean hasFailures() {
        return !retryDelay.isZero();
    }

    /**
     * Next state after a failed attempt at {@code now}: {@code base} on the first failure,
     * doubling on each further one, never above {@code cap}.
     */
    public SyncState afterFailure(Instant now, Duration base, Duration cap) {
        Duration delay = retryDelay.isZero() ? base : retryDelay.multipliedBy(2);
        if (delay.compareTo(cap) > 0) {
            delay = cap;
        }
        return new SyncState(now.plus(delay), delay);
    }

    public SyncState afterSuccess() {
        return CLEAR;
    }
}
