package com.proxyhub.provider.repository;

import com.proxyhub.provider.model.ProviderConfig;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

@Component
public class R2dbcProviderConfigCatalog implements ProviderConfigCatalog {

    private final ProviderConfigRepository repository;

    public R2dbcProviderConfigCatalog(ProviderConfigRepository repository) {
        this.repository = repository;
    }

    @Override
    public Mono<List<ProviderConfig>> listEligibleConfigs() {
        return repository.findByProcessModeOrderByIdAsc(ProviderConfig.MODE_SERVER).collectList();
    }

    @Override
    public Mono<ProviderConfig> findConfig(long configId) {
        return repository.findById(configId);
    }
}
