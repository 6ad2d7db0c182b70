package com.proxyhub.provider.service;

import com.proxyhub.common.exception.ProviderException;
import com.proxyhub.provider.cache.CacheEntry;
import com.proxyhub.provider.cache.CacheStatus;
import com.proxyhub.provider.cache.ProviderCacheStore;
import com.proxyhub.provider.client.ProviderRefresher;
import com.proxyhub.provider.model.ExternalSubscription;
import com.proxyhub.provider.model.ProviderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Serve-time access to provider documents, backed by {@link ProviderCacheStore}.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Check the cache for a non-expired entry.</li>
 *   <li>On hit → return it as {@code Mono.just(entry)} (no upstream call).</li>
 *   <li>On miss or expiry → call the {@link ProviderRefresher} synchronously for this request,
 *       store the result and return it.</li>
 * </ol>
 *
 * <p>This path never touches the sync scheduler's backoff or running set. It may race with a
 * background refresh of the same configuration; both write whole entries and the store keeps the newest.
 */
@Service
public class ProviderServeService {

    private static final Logger log = LoggerFactory.getLogger(ProviderServeService.class);

    private final ProviderCacheStore cacheStore;
    private final ProviderRefresher refresher;
    private final Clock clock;

    public ProviderServeService(ProviderCacheStore cacheStore, ProviderRefresher refresher, Clock clock) {
        this.cacheStore = cacheStore;
        this.refresher  = refresher;
        this.clock      = clock;
    }

    public Mono<CacheEntry> getOrRefresh(ProviderConfig config, ExternalSubscription subscription) {
        long configId = config.getId();

        return Mono.defer(() -> {
            Optional<CacheEntry> cached = cacheStore.get(configId);

            if (cached.isPresent() && !cacheStore.isExpired(cached.get())) {
                log.info("CACHE_HIT configId={} nodeCount={} fetchedAt={}",
                         configId, cached.get().nodeCount(), cached.get().fetchedAt());
                return Mono.just(cached.get());
            }

            log.info("CACHE_MISS configId={} state={}", configId, cached.isPresent() ? "expired" : "absent");
            return refreshAndStore(config, subscription);
        });
    }

    /** Refreshes regardless of cache state; backs the manual refresh endpoint. */
    public Mono<CacheEntry> forceRefresh(ProviderConfig config, ExternalSubscription subscription) {
        return Mono.defer(() -> {
            log.info("CACHE_FORCE_REFRESH configId={}", config.getId());
            return refreshAndStore(config, subscription);
        });
    }

    public CacheStatus status(long configId) {
        return cacheStore.status(configId);
    }

    /** Status for each configuration, keyed by id, in iteration order of {@code configs}. */
    public Map<Long, CacheStatus> statusFor(Collection<ProviderConfig> configs) {
        Map<Long, CacheStatus> result = new LinkedHashMap<>();
        for (ProviderConfig config : configs) {
            result.put(config.getId(), cacheStore.status(config.getId()));
        }
        return result;
    }

    /**
     * Display prefix for a configuration's nodes: the part of its name before the first {@code -},
     * wrapped in {@code 〖〗}.
     */
    public static String displayPrefix(String configName) {
        String name = configName == null ? "" : configName;
        int dash = name.indexOf('-');
        return "〖" + (dash > 0 ? name.substring(0, dash) : name) + "〗";
    }

    private Mono<CacheEntry> refreshAndStore(ProviderConfig config, ExternalSubscription subscription) {
        long configId = config.getId();
        return refresher.refresh(subscription, config)
            .switchIfEmpty(Mono.error(() -> new ProviderException(configId, "refresher completed without a result")))
            .map(result -> {
                CacheEntry entry = CacheEntry.fromRefresh(
                    configId, result, subscription.getName(), config.intervalSeconds(), clock.instant());
                if (cacheStore.set(configId, entry)) {
                    return entry;
                }
                return cacheStore.get(configId).orElse(entry);
            })
            .doOnError(e -> log.warn("SERVE_REFRESH_FAILED configId={} reason={}", configId, e.getMessage()));
    }
}
