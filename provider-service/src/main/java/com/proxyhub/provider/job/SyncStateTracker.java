package com.proxyhub.provider.job;

import com.proxyhub.provider.config.SyncSettings;
import com.proxyhub.provider.model.ProviderConfig;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;

/**
 * Per-configuration backoff state plus the set of configurations with a refresh in flight.
 *
 * <p>A single lock guards both structures so that job selection in
 * {@link #claimDueJobs} sees and updates them atomically; a configuration can never be
 * handed to two workers at once.
 */
@Component
public class SyncStateTracker {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, SyncState> states = new HashMap<>();
    private final Set<Long> running = new HashSet<>();

    private final Clock clock;
    private final Duration retryBase;
    private final Duration retryCap;

    public SyncStateTracker(Clock clock, SyncSettings settings) {
        this.clock     = Objects.requireNonNull(clock, "clock");
        this.retryBase = settings.retryBase();
        this.retryCap  = settings.retryCap();
    }

    public SyncState ensureState(long configId) {
        lock.lock();
        try {
            return states.computeIfAbsent(configId, id -> SyncState.CLEAR);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Extends the backoff window for {@code configId}.
     *
     * @return the state after the transition
     */
    public SyncState recordFailure(long configId) {
        Instant now = clock.instant();
        lock.lock();
        try {
            SyncState next = states.getOrDefault(configId, SyncState.CLEAR)
                .afterFailure(now, retryBase, retryCap);
            states.put(configId, next);
            return next;
        } finally {
            lock.unlock();
        }
    }

    public void recordSuccess(long configId) {
        lock.lock();
        try {
            states.put(configId, SyncState.CLEAR);
        } finally {
            lock.unlock();
        }
    }

    /** @return {@code false} if the configuration was already marked running */
    public boolean markRunning(long configId) {
        lock.lock();
        try {
            return running.add(configId);
        } finally {
            lock.unlock();
        }
    }

    public void markFinished(long configId) {
        lock.lock();
        try {
            running.remove(configId);
        } finally {
            lock.unlock();
        }
    }

    public boolean isRunning(long configId) {
        lock.lock();
        try {
            return running.contains(configId);
        } finally {
            lock.unlock();
        }
    }

    public int runningCount() {
        lock.lock();
        try {
            return running.size();
        } finally {
            lock.unlock();
        }
    }

    public Optional<SyncState> stateOf(long configId) {
        lock.lock();
        try {
            return Optional.ofNullable(states.get(configId));
        } finally {
            lock.unlock();
        }
    }

    /** Drops all bookkeeping for a configuration that no longer exists. */
    public void forget(long configId) {
        lock.lock();
        try {
            states.remove(configId);
            running.remove(configId);
        } finally {
            lock.unlock();
        }
    }

    /** Ids with backoff state or a refresh in flight. */
    public Set<Long> trackedIds() {
        lock.lock();
        try {
            Set<Long> ids = new HashSet<>(states.keySet());
            ids.addAll(running);
            return ids;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Selects the configurations to refresh now and marks each one running, all under one
     * critical section.
     *
     * <p>Running and backing-off configurations are skipped. For the rest, {@code dueReason}
     * decides: an empty result means "not due", a present one becomes the job's reason.
     * It is called with the lock held and must not block.
     */
    public List<ScheduledJob> claimDueJobs(Collection<ProviderConfig> configs,
                                           BiFunction<ProviderConfig, Instant, Optional<String>> dueReason) {
        Instant now = clock.instant();
        List<ScheduledJob> jobs = new ArrayList<>();
        lock.lock();
        try {
            for (ProviderConfig config : configs) {
                long id = config.getId();
                if (running.contains(id)) {
                    continue;
                }
                SyncState state = states.computeIfAbsent(id, key -> SyncState.CLEAR);
                if (state.isBlocked(now)) {
                    continue;
                }
                Optional<String> reason = dueReason.apply(config, now);
                if (reason.isEmpty()) {
                    continue;
                }
                running.add(id);
                jobs.add(new ScheduledJob(config, reason.get()));
            }
        } finally {
            lock.unlock();
        }
        return jobs;
    }
}
