package com.proxyhub.provider.service;

import com.proxyhub.common.exception.ProviderException;
import com.proxyhub.provider.cache.CacheEntry;
import com.proxyhub.provider.cache.CacheStatus;
import com.proxyhub.provider.cache.ProviderCacheStore;
import com.proxyhub.provider.model.ExternalSubscription;
import com.proxyhub.provider.model.ProviderConfig;
import com.proxyhub.provider.support.FakeRefresher;
import com.proxyhub.provider.support.Fixtures;
import com.proxyhub.provider.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProviderServeServiceTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    private MutableClock clock;
    private ProviderCacheStore cacheStore;
    private FakeRefresher refresher;
    private ProviderServeService service;

    private final ProviderConfig config = Fixtures.config(1, 10, 60);
    private final ExternalSubscription subscription = Fixtures.subscription(10);

    @BeforeEach
    void setUp() {
        clock      = new MutableClock(T0);
        cacheStore = new ProviderCacheStore(clock);
        refresher  = new FakeRefresher();
        service    = new ProviderServeService(cacheStore, refresher, clock);
    }

    @Nested
    @DisplayName("getOrRefresh()")
    class GetOrRefresh {

        @Test
        @DisplayName("fresh entry → returned without calling the refresher")
        void hitSkipsRefresher() {
            CacheEntry cached = Fixtures.entry(1, T0, 60);
            cacheStore.set(1, cached);

            StepVerifier.create(service.getOrRefresh(config, subscription))
                .expectNext(cached)
                .verifyComplete();
            assertEquals(0, refresher.calls());
        }

        @Test
        @DisplayName("absent entry → refreshed synchronously and stored")
        void missRefreshesAndStores() {
            StepVerifier.create(service.getOrRefresh(config, subscription))
                .assertNext(entry -> {
                    assertEquals(T0, entry.fetchedAt());
                    assertEquals(List.of("HK 01", "JP 02"), entry.nodeNames());
                    assertEquals(60, entry.interval());
                })
                .verifyComplete();
            assertTrue(cacheStore.get(1).isPresent());
            assertEquals(1, refresher.calls());
        }

        @Test
        @DisplayName("expired entry → replaced by a new one")
        void expiredIsReplaced() {
            cacheStore.set(1, Fixtures.entry(1, T0, 60));
            clock.advance(Duration.ofSeconds(61));

            CacheEntry entry = service.getOrRefresh(config, subscription).block();

            assertNotNull(entry);
            assertEquals(T0.plusSeconds(61), entry.fetchedAt());
            assertEquals(2, cacheStore.get(1).orElseThrow().nodeCount());
        }

        @Test
        @DisplayName("refresh failure surfaces to the caller and leaves the stale entry")
        void failureSurfaces() {
            CacheEntry stale = Fixtures.entry(1, T0, 60);
            cacheStore.set(1, stale);
            clock.advance(Duration.ofSeconds(61));
            refresher.failing(true);

            StepVerifier.create(service.getOrRefresh(config, subscription))
                .expectError(ProviderException.class)
                .verify();
            assertSame(stale, cacheStore.get(1).orElseThrow());
        }

        @Test
        void nothingHappensUntilSubscribed() {
            service.getOrRefresh(config, subscription);
            assertEquals(0, refresher.calls());
        }
    }

    @Nested
    @DisplayName("forceRefresh()")
    class ForceRefresh {

        @Test
        void refreshesEvenWhenFresh() {
            cacheStore.set(1, Fixtures.entry(1, T0.minusSeconds(5), 60));
            refresher.returning("SG 01", "US 02", "DE 03");

            CacheEntry entry = service.forceRefresh(config, subscription).block();

            assertNotNull(entry);
            assertEquals(3, entry.nodeCount());
            assertEquals(T0, cacheStore.get(1).orElseThrow().fetchedAt());
        }
    }

    @Nested
    @DisplayName("status")
    class Status {

        @Test
        void statusForKeepsInputOrder() {
            cacheStore.set(2, Fixtures.entry(2, T0, 60));

            Map<Long, CacheStatus> statuses = service.statusFor(List.of(Fixtures.config(3, 10, 60),
                                                                        Fixtures.config(2, 10, 60)));

            assertEquals(List.of(3L, 2L), List.copyOf(statuses.keySet()));
            assertFalse(statuses.get(3L).cached());
            assertTrue(statuses.get(2L).cached());
        }

        @Test
        void displayPrefixUsesTextBeforeFirstDash() {
            assertEquals("〖HK〗", ProviderServeService.displayPrefix("HK-Premium-1"));
            assertEquals("〖Plain〗", ProviderServeService.displayPrefix("Plain"));
            assertEquals("〖-lead〗", ProviderServeService.displayPrefix("-lead"));
            assertEquals("〖〗", ProviderServeService.displayPrefix(null));
        }
    }
}
