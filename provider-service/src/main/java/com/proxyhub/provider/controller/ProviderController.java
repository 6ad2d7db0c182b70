package com.proxyhub.provider.controller;

import com.proxyhub.common.exception.ProviderException;
import com.proxyhub.provider.cache.CacheEntry;
import com.proxyhub.provider.cache.CacheStatus;
import com.proxyhub.provider.model.ExternalSubscription;
import com.proxyhub.provider.model.ProviderConfig;
import com.proxyhub.provider.repository.ProviderConfigCatalog;
import com.proxyhub.provider.repository.SubscriptionLookup;
import com.proxyhub.provider.service.ProviderServeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Boundary between proxy clients / the admin UI and the provider cache.
 *
 * <p>Client-mode configurations are never rendered here: clients fetch their upstream directly,
 * so the document endpoint rejects them and the other endpoints report an empty cache.
 */
@RestController
@RequestMapping("/api/v1/proxy-provider")
public class ProviderController {

    private static final Logger log = LoggerFactory.getLogger(ProviderController.class);

    static final MediaType TEXT_YAML = MediaType.parseMediaType("text/yaml;charset=UTF-8");

    private final ProviderServeService serveService;
    private final ProviderConfigCatalog catalog;
    private final SubscriptionLookup subscriptionLookup;

    public ProviderController(ProviderServeService serveService,
                              ProviderConfigCatalog catalog,
                              SubscriptionLookup subscriptionLookup) {
        this.serveService       = serveService;
        this.catalog            = catalog;
        this.subscriptionLookup = subscriptionLookup;
    }

    /** The provider document proxy clients poll. */
    @GetMapping("/{id}/document")
    public Mono<ResponseEntity<byte[]>> document(@PathVariable long id) {
        return resolveConfig(id)
            .flatMap(config -> {
                if (!config.isServerProcessed()) {
                    return Mono.<CacheEntry>error(new ResponseStatusException(HttpStatus.BAD_REQUEST,
                        "config " + id + " is set to client processing mode"));
                }
                return resolveSubscription(config)
                    .flatMap(subscription -> serveService.getOrRefresh(config, subscription));
            })
            .map(entry -> ResponseEntity.ok().contentType(TEXT_YAML).body(entry.document()))
            .onErrorMap(ProviderException.class, e -> {
                log.error("Document endpoint error. configId={}", id, e);
                return new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e);
            });
    }

    /** Forces a refresh regardless of cache freshness. */
    @PostMapping("/{id}/refresh")
    public Mono<ResponseEntity<Map<String, Object>>> refresh(@PathVariable long id) {
        log.info("Manual refresh requested. configId={}", id);
        return resolveConfig(id)
            .flatMap(config -> {
                if (!config.isServerProcessed()) {
                    return Mono.just(ResponseEntity.ok(Map.<String, Object>of(
                        "message",    "client processing mode does not use the cache",
                        "cached",     false,
                        "node_count", 0)));
                }
                return resolveSubscription(config)
                    .flatMap(subscription -> serveService.forceRefresh(config, subscription))
                    .map(entry -> ResponseEntity.ok(Map.<String, Object>of(
                        "message",    "cache refreshed",
                        "cached",     true,
                        "node_count", entry.nodeCount(),
                        "fetched_at", entry.fetchedAt().toString())));
            })
            .onErrorMap(ProviderException.class, e -> {
                log.error("Refresh endpoint error. configId={}", id, e);
                return new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e);
            });
    }

    /** Node list and display prefix, used by the admin UI when building proxy groups. */
    @GetMapping("/{id}/nodes")
    public Mono<ResponseEntity<Map<String, Object>>> nodes(@PathVariable long id) {
        return resolveConfig(id)
            .flatMap(config -> {
                if (!config.isServerProcessed()) {
                    return Mono.just(ResponseEntity.ok(Map.<String, Object>of("nodes", List.of(), "prefix", "")));
                }
                return resolveSubscription(config)
                    .flatMap(subscription -> serveService.getOrRefresh(config, subscription))
                    .map(entry -> ResponseEntity.ok(nodesBody(config, entry)));
            })
            .onErrorMap(ProviderException.class, e -> {
                log.error("Nodes endpoint error. configId={}", id, e);
                return new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e);
            });
    }

    /** Cache status for every server-processed configuration, keyed by config id. */
    @GetMapping("/cache-status")
    public Mono<ResponseEntity<Map<String, CacheStatus>>> cacheStatus() {
        return catalog.listEligibleConfigs()
            .map(configs -> {
                Map<String, CacheStatus> body = new LinkedHashMap<>();
                serveService.statusFor(configs).forEach((id, status) -> body.put(String.valueOf(id), status));
                return ResponseEntity.ok(body);
            })
            .doOnError(e -> log.error("Cache status endpoint error", e));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private Mono<ProviderConfig> resolveConfig(long id) {
        return catalog.findConfig(id)
            .switchIfEmpty(Mono.error(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                "proxy provider config " + id + " not found")));
    }

    private Mono<ExternalSubscription> resolveSubscription(ProviderConfig config) {
        Long subscriptionId = config.getExternalSubscriptionId();
        if (subscriptionId == null) {
            return Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND, "external subscription not found"));
        }
        return subscriptionLookup.findSubscription(subscriptionId, config.getUsername())
            .switchIfEmpty(Mono.error(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                "external subscription not found")));
    }

    private Map<String, Object> nodesBody(ProviderConfig config, CacheEntry entry) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("nodes", entry.nodes());
        body.put("prefix", ProviderServeService.displayPrefix(config.getName()));
        return body;
    }
}
