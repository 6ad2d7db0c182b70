package com.proxyhub.provider.job;

import com.proxyhub.provider.model.ProviderConfig;

/**
 * One unit of refresh work selected by a scan pass. Never persisted.
 *
 * @param reason diagnostic only: {@link #REASON_NO_CACHE} or {@link #REASON_INTERVAL_ELAPSED}
 */
public record ScheduledJob(ProviderConfig config, String reason) {

    public static final String REASON_NO_CACHE         = "no cache";
    public static final String REASON_INTERVAL_ELAPSED = "interval elapsed";

    public long configId() {
        return config.getId();
    }
}
