package com.proxyhub.provider.job;

import com.proxyhub.common.exception.ProviderException;
import com.proxyhub.provider.config.SyncSettings;
import com.proxyhub.provider.model.ExternalSubscription;
import com.proxyhub.provider.repository.SubscriptionLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Scan-cycle cache of upstream subscription records.
 *
 * <p>Many configurations can filter the same upstream subscription. The scheduler clears this
 * cache once at the start of every scan, so within a cycle each distinct subscription is looked
 * up at most once. Concurrent workers asking for the same id share the first caller's lookup;
 * the lookup itself runs outside the lock.
 *
 * <p>Failed or empty lookups are not retained: the next worker in the same cycle retries.
 */
@Component
public class SubscriptionMetadataCache {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionMetadataCache.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, CompletableFuture<ExternalSubscription>> entries = new HashMap<>();

    private final SubscriptionLookup lookup;
    private final Duration lookupTimeout;

    public SubscriptionMetadataCache(SubscriptionLookup lookup, SyncSettings settings) {
        this.lookup        = Objects.requireNonNull(lookup, "lookup");
        this.lookupTimeout = settings.lookupTimeout();
    }

    /**
     * @param subscription the resolved record
     * @param fromCache    {@code true} when another caller in this cycle already looked it up
     */
    public record Lookup(ExternalSubscription subscription, boolean fromCache) {}

    /**
     * Returns the subscription {@code subscriptionId} owned by {@code owner}, fetching it on first use
     * within the current cycle.
     *
     * @throws ProviderException when the subscription is missing, unusable, or the lookup fails or times out
     */
    public Lookup getOrFetch(Long subscriptionId, String owner) {
        if (subscriptionId == null || subscriptionId <= 0) {
            throw new ProviderException("configuration has no external subscription");
        }

        CompletableFuture<ExternalSubscription> pending;
        boolean fetcher = false;
        lock.lock();
        try {
            pending = entries.get(subscriptionId);
            if (pending == null) {
                pending = new CompletableFuture<>();
                entries.put(subscriptionId, pending);
                fetcher = true;
            }
        } finally {
            lock.unlock();
        }

        if (fetcher) {
            return new Lookup(fetch(subscriptionId, owner, pending), false);
        }
        return new Lookup(await(subscriptionId, pending), true);
    }

    /** Discards every record. Called once at the start of each scan cycle. */
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private ExternalSubscription fetch(long subscriptionId, String owner,
                                       CompletableFuture<ExternalSubscription> pending) {
        try {
            ExternalSubscription subscription = lookup.findSubscription(subscriptionId, owner)
                .timeout(lookupTimeout)
                .block();
            if (subscription == null || subscription.getId() == null) {
                throw new ProviderException("subscription " + subscriptionId + " not found for owner " + owner);
            }
            if (subscription.getUrl() == null || subscription.getUrl().isBlank()) {
                throw new ProviderException("subscription " + subscriptionId + " has no upstream URL");
            }
            pending.complete(subscription);
            log.debug("SUBSCRIPTION_LOOKUP subscriptionId={} name={}", subscriptionId, subscription.getName());
            return subscription;
        } catch (RuntimeException e) {
            lock.lock();
            try {
                entries.remove(subscriptionId, pending);
            } finally {
                lock.unlock();
            }
            pending.completeExceptionally(e);
            if (e instanceof ProviderException pe) {
                throw pe;
            }
            throw new ProviderException("subscription " + subscriptionId + " lookup failed: " + e.getMessage(), e);
        }
    }

    private ExternalSubscription await(long subscriptionId, CompletableFuture<ExternalSubscription> pending) {
        try {
            return pending.get(lookupTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProviderException pe) {
                throw pe;
            }
            throw new ProviderException("subscription " + subscriptionId + " lookup failed: " + cause, cause);
        } catch (TimeoutException e) {
            throw new ProviderException("subscription " + subscriptionId + " lookup timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("interrupted waiting for subscription " + subscriptionId, e);
        }
    }
}
