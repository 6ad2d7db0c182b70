package com.proxyhub.provider.job;

/** Lifecycle of {@link ProviderSyncScheduler}. {@code STOPPED} is terminal. */
public enum SchedulerState {
    IDLE,
    RELOADING,
    SCANNING,
    DISPATCHING,
    STOPPED
}
