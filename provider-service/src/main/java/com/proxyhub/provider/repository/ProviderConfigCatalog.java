package com.proxyhub.provider.repository;

import com.proxyhub.provider.model.ProviderConfig;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Source of the configurations the sync scheduler keeps warm.
 */
public interface ProviderConfigCatalog {

    /** Every configuration whose document is rendered and cached server-side. */
    Mono<List<ProviderConfig>> listEligibleConfigs();

    Mono<ProviderConfig> findConfig(long configId);
}
