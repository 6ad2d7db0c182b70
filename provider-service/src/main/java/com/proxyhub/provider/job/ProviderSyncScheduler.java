package com.proxyhub.provider.job;

import com.proxyhub.common.exception.ProviderException;
import com.proxyhub.common.trace.MdcBridge;
import com.proxyhub.provider.cache.CacheEntry;
import com.proxyhub.provider.cache.ProviderCacheStore;
import com.proxyhub.provider.client.ProviderRefresher;
import com.proxyhub.provider.client.RefreshResult;
import com.proxyhub.provider.config.SyncSettings;
import com.proxyhub.provider.model.ExternalSubscription;
import com.proxyhub.provider.model.ProviderConfig;
import com.proxyhub.provider.repository.ProviderConfigCatalog;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.Phaser;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps every server-processed configuration's provider document warm in {@link ProviderCacheStore}.
 *
 * <p>One control thread drives two timers:
 * <pre>
 *   reload (slow) → re-list configurations → push interval edits → drop removed configurations
 *   scan   (fast) → clear subscription cache → claim due jobs → dispatch to bounded workers
 * </pre>
 * Both run on the same thread, so a reload and a scan never overlap. Workers run on a separate
 * executor; a {@link Semaphore} bounds how many refresh at once.
 *
 * <p><strong>Failure isolation:</strong> a failed refresh only extends that configuration's backoff
 * window in {@link SyncStateTracker}; its previous cache entry stays servable. A failed reload keeps the
 * previous configuration set. Nothing short of {@link #stop()} ends the loop.
 */
@Component
public class ProviderSyncScheduler {

    private static final Logger log = LoggerFactory.getLogger(ProviderSyncScheduler.class);

    /** How long one slot wait lasts before re-checking for shutdown. */
    private static final long SLOT_POLL_MS = 250;

    private final ProviderCacheStore         cacheStore;
    private final SyncStateTracker           tracker;
    private final SubscriptionMetadataCache  subscriptionCache;
    private final ProviderConfigCatalog      catalog;
    private final ProviderRefresher          refresher;
    private final Executor                   workerExecutor;
    private final SyncSettings               settings;
    private final Clock                      clock;

    private final Semaphore workerSlots;
    /** Party 0 is the scheduler; each dispatched worker registers itself until it finishes. */
    private final Phaser inFlight = new Phaser(1);

    private final AtomicReference<SchedulerState> state = new AtomicReference<>(SchedulerState.IDLE);
    private final AtomicBoolean started  = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);

    /** Replaced wholesale by each successful reload; never mutated in place. */
    private volatile Map<Long, ProviderConfig> configs = Map.of();

    /**
     * Held while a reload publishes a new set and purges removed ids, and while a worker writes
     * its outcome back. A worker therefore sees either the set before a reload or the set after it.
     */
    private final ReentrantLock writeBack = new ReentrantLock();

    private volatile ScheduledExecutorService control;

    public ProviderSyncScheduler(ProviderCacheStore cacheStore,
                                 SyncStateTracker tracker,
                                 SubscriptionMetadataCache subscriptionCache,
                                 ProviderConfigCatalog catalog,
                                 ProviderRefresher refresher,
                                 @Qualifier("providerSyncWorkerExecutor") Executor providerSyncWorkerExecutor,
                                 SyncSettings settings,
                                 Clock clock) {
        this.cacheStore        = Objects.requireNonNull(cacheStore, "cacheStore");
        this.tracker           = Objects.requireNonNull(tracker, "tracker");
        this.subscriptionCache = Objects.requireNonNull(subscriptionCache, "subscriptionCache");
        this.catalog           = Objects.requireNonNull(catalog, "catalog");
        this.refresher         = Objects.requireNonNull(refresher, "refresher");
        this.workerExecutor    = Objects.requireNonNull(providerSyncWorkerExecutor, "workerExecutor");
        this.settings          = Objects.requireNonNull(settings, "settings");
        this.clock             = Objects.requireNonNull(clock, "clock");
        this.workerSlots       = new Semaphore(settings.workerPoolSize());
    }

    // ── lifecycle ─────────────────────────────────────────────────────────────

    /**
     * Starts both timers. The first reload and the first scan run immediately, which warms the
     * cache for every configuration at startup.
     */
    @PostConstruct
    public void start() {
        if (!settings.enabled()) {
            log.info("Provider sync scheduler disabled (provider.sync.enabled=false)");
            return;
        }
        if (stopping.get() || !started.compareAndSet(false, true)) {
            return;
        }
        control = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread t = new Thread(runnable, "provider-sync-control");
            t.setDaemon(true);
            return t;
        });
        control.scheduleWithFixedDelay(this::reloadTick,
            0, settings.reloadPeriod().toMillis(), TimeUnit.MILLISECONDS);
        control.scheduleWithFixedDelay(this::scanTick,
            0, settings.scanPeriod().toMillis(), TimeUnit.MILLISECONDS);

        log.info("Provider sync scheduler started. workers={} scanPeriodSeconds={} reloadPeriodSeconds={}",
                 settings.workerPoolSize(), settings.scanPeriod().toSeconds(), settings.reloadPeriod().toSeconds());
    }

    /**
     * Stops issuing new work, then blocks until every in-flight worker has released its slot.
     * Idempotent.
     */
    @PreDestroy
    public void stop() {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        log.info("Provider sync scheduler stopping. inFlight={}", inFlight.getRegisteredParties() - 1);

        ScheduledExecutorService loop = control;
        if (loop != null) {
            loop.shutdownNow();
            try {
                if (!loop.awaitTermination(settings.reloadTimeout().toMillis() + SLOT_POLL_MS,
                                           TimeUnit.MILLISECONDS)) {
                    log.warn("Control thread did not exit in time; draining workers anyway");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted waiting for the control thread; draining workers anyway");
            }
        }

        inFlight.arriveAndAwaitAdvance();
        state.set(SchedulerState.STOPPED);
        log.info("Provider sync scheduler stopped");
    }

    public SchedulerState state() {
        return state.get();
    }

    /** Snapshot of the configuration set from the last successful reload. */
    public Collection<ProviderConfig> knownConfigs() {
        return configs.values();
    }

    public int availableWorkerSlots() {
        return workerSlots.availablePermits();
    }

    // ── reload ────────────────────────────────────────────────────────────────

    /**
     * Runs one reload cycle on the calling thread.
     *
     * @return {@code false} if the catalog failed or timed out and the previous set was kept
     */
    public boolean reloadNow() {
        if (stopping.get()) {
            return false;
        }
        state.set(SchedulerState.RELOADING);
        try {
            List<ProviderConfig> listed;
            try {
                listed = catalog.listEligibleConfigs().timeout(settings.reloadTimeout()).block();
            } catch (RuntimeException e) {
                log.warn("RELOAD_FAILED keeping previous set. configs={} reason={}",
                         configs.size(), e.getMessage());
                return false;
            }

            Map<Long, ProviderConfig> next = new LinkedHashMap<>();
            if (listed != null) {
                for (ProviderConfig config : listed) {
                    if (config.getId() != null) {
                        next.put(config.getId(), config);
                    }
                }
            }

            Set<Long> removed;
            writeBack.lock();
            try {
                for (ProviderConfig config : next.values()) {
                    cacheStore.updateInterval(config.getId(), config.intervalSeconds());
                }

                removed = new HashSet<>(configs.keySet());
                removed.addAll(tracker.trackedIds());
                removed.addAll(cacheStore.cachedIds());
                removed.removeAll(next.keySet());
                for (Long id : removed) {
                    tracker.forget(id);
                    cacheStore.delete(id);
                }

                configs = Collections.unmodifiableMap(next);
            } finally {
                writeBack.unlock();
            }
            log.info("RELOAD_COMPLETE configs={} removed={}", next.size(), removed.size());
            return true;
        } finally {
            state.compareAndSet(SchedulerState.RELOADING, SchedulerState.IDLE);
        }
    }

    // ── scan ──────────────────────────────────────────────────────────────────

    /**
     * Runs one scan cycle on the calling thread: selects due configurations and hands each to a
     * worker, waiting for a free slot when all are busy.
     *
     * @return the jobs selected this cycle; some may be left undispatched if a stop arrives mid-cycle
     */
    public List<ScheduledJob> scanNow() {
        if (stopping.get()) {
            return List.of();
        }
        state.set(SchedulerState.SCANNING);
        try {
            subscriptionCache.clear();

            List<ScheduledJob> jobs = tracker.claimDueJobs(configs.values(), this::dueReason);
            if (jobs.isEmpty()) {
                log.debug("SCAN_COMPLETE due=0 known={}", configs.size());
                return jobs;
            }
            log.info("SCAN_COMPLETE due={} known={}", jobs.size(), configs.size());

            state.set(SchedulerState.DISPATCHING);
            for (int i = 0; i < jobs.size(); i++) {
                ScheduledJob job = jobs.get(i);
                if (!acquireSlot()) {
                    List<ScheduledJob> abandoned = jobs.subList(i, jobs.size());
                    abandoned.forEach(j -> tracker.markFinished(j.configId()));
                    log.info("DISPATCH_ABANDONED jobs={} (scheduler stopping)", abandoned.size());
                    break;
                }
                dispatch(job);
            }
            return jobs;
        } finally {
            state.compareAndSet(SchedulerState.SCANNING, SchedulerState.IDLE);
            state.compareAndSet(SchedulerState.DISPATCHING, SchedulerState.IDLE);
        }
    }

    private Optional<String> dueReason(ProviderConfig config, Instant now) {
        Optional<CacheEntry> entry = cacheStore.get(config.getId());
        if (entry.isEmpty()) {
            return Optional.of(ScheduledJob.REASON_NO_CACHE);
        }
        return entry.get().isDue(now)
            ? Optional.of(ScheduledJob.REASON_INTERVAL_ELAPSED)
            : Optional.empty();
    }

    private boolean acquireSlot() {
        try {
            while (!stopping.get()) {
                if (workerSlots.tryAcquire(SLOT_POLL_MS, TimeUnit.MILLISECONDS)) {
                    return true;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    private void dispatch(ScheduledJob job) {
        inFlight.register();
        try {
            workerExecutor.execute(() -> runWorker(job));
        } catch (RejectedExecutionException e) {
            log.error("DISPATCH_REJECTED configId={}", job.configId(), e);
            tracker.markFinished(job.configId());
            workerSlots.release();
            inFlight.arriveAndDeregister();
        }
    }

    // ── worker ────────────────────────────────────────────────────────────────

    private void runWorker(ScheduledJob job) {
        try {
            MdcBridge.withConfigId(job.configId(), () -> refresh(job));
        } catch (RuntimeException e) {
            log.error("SYNC_WORKER_ERROR configId={}", job.configId(), e);
        } finally {
            tracker.markFinished(job.configId());
            workerSlots.release();
            inFlight.arriveAndDeregister();
        }
    }

    private void refresh(ScheduledJob job) {
        ProviderConfig config = job.config();
        long configId = job.configId();
        Instant startedAt = clock.instant();

        ExternalSubscription subscription;
        try {
            SubscriptionMetadataCache.Lookup lookup =
                subscriptionCache.getOrFetch(config.getExternalSubscriptionId(), config.getUsername());
            subscription = lookup.subscription();
        } catch (RuntimeException e) {
            recordFailure(configId, "subscription", e);
            return;
        }

        RefreshResult result;
        try {
            result = refresher.refresh(subscription, config)
                .timeout(settings.refreshTimeout())
                .block();
            if (result == null) {
                throw new ProviderException(configId, "refresher completed without a result");
            }
        } catch (RuntimeException e) {
            recordFailure(configId, "refresh", e);
            return;
        }

        Instant fetchedAt;
        writeBack.lock();
        try {
            // Interval comes from the current set: a reload may have edited it mid-refresh.
            ProviderConfig current = configs.get(configId);
            if (current == null) {
                log.info("SYNC_DISCARDED configId={} configuration removed during refresh", configId);
                return;
            }
            fetchedAt = clock.instant();
            cacheStore.set(configId, CacheEntry.fromRefresh(
                configId, result, subscription.getName(), current.intervalSeconds(), fetchedAt));
            tracker.recordSuccess(configId);
        } finally {
            writeBack.unlock();
        }
        log.info("SYNC_SUCCESS configId={} reason={} nodeCount={} elapsedMs={}",
                 configId, job.reason(), result.nodeCount(),
                 Duration.between(startedAt, fetchedAt).toMillis());
    }

    private void recordFailure(long configId, String stage, RuntimeException e) {
        SyncState next;
        writeBack.lock();
        try {
            if (!configs.containsKey(configId)) {
                log.info("SYNC_DISCARDED configId={} stage={} configuration removed", configId, stage);
                return;
            }
            next = tracker.recordFailure(configId);
        } finally {
            writeBack.unlock();
        }
        log.warn("SYNC_FAILURE configId={} stage={} retryDelaySeconds={} blockUntil={} reason={}",
                 configId, stage, next.retryDelay().toSeconds(), next.blockUntil(), e.getMessage());
    }

    // ── timer bodies ──────────────────────────────────────────────────────────

    private void reloadTick() {
        try {
            reloadNow();
        } catch (RuntimeException e) {
            log.error("Reload cycle failed unexpectedly", e);
        }
    }

    private void scanTick() {
        try {
            scanNow();
        } catch (RuntimeException e) {
            log.error("Scan cycle failed unexpectedly", e);
        }
    }
}
