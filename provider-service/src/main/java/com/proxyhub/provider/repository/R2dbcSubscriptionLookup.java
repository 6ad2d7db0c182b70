package com.proxyhub.provider.repository;

import com.proxyhub.provider.model.ExternalSubscription;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
public class R2dbcSubscriptionLookup implements SubscriptionLookup {

    private final ExternalSubscriptionRepository repository;

    public R2dbcSubscriptionLookup(ExternalSubscriptionRepository repository) {
        this.repository = repository;
    }

    @Override
    public Mono<ExternalSubscription> findSubscription(long subscriptionId, String owner) {
        return repository.findByIdAndUsername(subscriptionId, owner);
    }
}
