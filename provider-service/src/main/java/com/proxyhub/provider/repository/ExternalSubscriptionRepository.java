package com.proxyhub.provider.repository;

import com.proxyhub.provider.model.ExternalSubscription;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface ExternalSubscriptionRepository extends ReactiveCrudRepository<ExternalSubscription, Long> {

    Mono<ExternalSubscription> findByIdAndUsername(Long id, String username);
}
