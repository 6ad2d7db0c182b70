package com.proxyhub.provider.repository;

import com.proxyhub.provider.model.ProviderConfig;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface ProviderConfigRepository extends ReactiveCrudRepository<ProviderConfig, Long> {

    Flux<ProviderConfig> findByProcessModeOrderByIdAsc(String processMode);
}
