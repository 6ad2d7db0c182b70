package com.proxyhub.provider.repository;

import com.proxyhub.provider.model.ExternalSubscription;
import reactor.core.publisher.Mono;

/**
 * Resolves the upstream subscription a configuration points at.
 * Completes empty when the subscription does not exist or belongs to another owner.
 */
public interface SubscriptionLookup {

    Mono<ExternalSubscription> findSubscription(long subscriptionId, String owner);
}
