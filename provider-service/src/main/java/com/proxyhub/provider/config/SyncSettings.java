package com.proxyhub.provider.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables for the background sync scheduler and its collaborators.
 *
 * <p>Bound from {@code provider.sync.*} in {@link ProviderServiceConfig}; tests build it
 * directly, usually from {@link #defaults()}.
 */
public record SyncSettings(
    boolean enabled,
    int workerPoolSize,
    Duration scanPeriod,
    Duration reloadPeriod,
    Duration retryBase,
    Duration retryCap,
    Duration refreshTimeout,
    Duration reloadTimeout,
    Duration lookupTimeout
) {
    public static final int DEFAULT_WORKER_POOL_SIZE = 4;
    public static final Duration DEFAULT_SCAN_PERIOD     = Duration.ofSeconds(15);
    public static final Duration DEFAULT_RELOAD_PERIOD   = Duration.ofMinutes(5);
    public static final Duration DEFAULT_RETRY_BASE      = Duration.ofSeconds(30);
    public static final Duration DEFAULT_RETRY_CAP       = Duration.ofMinutes(10);
    public static final Duration DEFAULT_REFRESH_TIMEOUT = Duration.ofMinutes(1);
    public static final Duration DEFAULT_RELOAD_TIMEOUT  = Duration.ofSeconds(30);
    public static final Duration DEFAULT_LOOKUP_TIMEOUT  = Duration.ofSeconds(30);

    public SyncSettings {
        if (workerPoolSize <= 0) {
            throw new IllegalArgumentException("workerPoolSize must be positive, was " + workerPoolSize);
        }
        requirePositive("scanPeriod", scanPeriod);
        requirePositive("reloadPeriod", reloadPeriod);
        requirePositive("retryBase", retryBase);
        requirePositive("retryCap", retryCap);
        requirePositive("refreshTimeout", refreshTimeout);
        requirePositive("reloadTimeout", reloadTimeout);
        requirePositive("lookupTimeout", lookupTimeout);
        if (retryBase.compareTo(retryCap) > 0) {
            throw new IllegalArgumentException("retryBase " + retryBase + " exceeds retryCap " + retryCap);
        }
    }

    public static SyncSettings defaults() {
        return new SyncSettings(true, DEFAULT_WORKER_POOL_SIZE,
            DEFAULT_SCAN_PERIOD, DEFAULT_RELOAD_PERIOD,
            DEFAULT_RETRY_BASE, DEFAULT_RETRY_CAP,
            DEFAULT_REFRESH_TIMEOUT, DEFAULT_RELOAD_TIMEOUT, DEFAULT_LOOKUP_TIMEOUT);
    }

    private static void requirePositive(String name, Duration value) {
        Objects.requireNonNull(value, name);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, was " + value);
        }
    }
}
