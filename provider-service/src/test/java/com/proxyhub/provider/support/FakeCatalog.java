package com.proxyhub.provider.support;

import com.proxyhub.provider.model.ProviderConfig;
import com.proxyhub.provider.repository.ProviderConfigCatalog;
import reactor.core.publisher.Mono;

import java.util.List;

public class FakeCatalog implements ProviderConfigCatalog {

    private volatile List<ProviderConfig> configs = List.of();
    private volatile boolean failing;
    private volatile boolean hanging;

    public FakeCatalog with(ProviderConfig... configs) {
        this.configs = List.of(configs);
        return this;
    }

    public FakeCatalog failing(boolean failing) {
        this.failing = failing;
        return this;
    }

    public FakeCatalog hanging(boolean hanging) {
        this.hanging = hanging;
        return this;
    }

    @Override
    public Mono<List<ProviderConfig>> listEligibleConfigs() {
        if (hanging) {
            return Mono.never();
        }
        if (failing) {
            return Mono.error(new IllegalStateException("database is locked"));
        }
        return Mono.just(configs.stream().filter(ProviderConfig::isServerProcessed).toList());
    }

    @Override
    public Mono<ProviderConfig> findConfig(long configId) {
        return Mono.justOrEmpty(configs.stream().filter(c -> c.getId() == configId).findFirst());
    }
}
