package com.proxyhub.provider.client;

import com.proxyhub.provider.model.ExternalSubscription;
import com.proxyhub.provider.model.ProviderConfig;
import reactor.core.publisher.Mono;

/**
 * Produces the provider document for one configuration from its upstream subscription.
 *
 * <p>Shared by the background scheduler and the serve-time fallback, so implementations
 * must be safe to call concurrently for different configurations and must not touch
 * shared state beyond their return value.
 */
public interface ProviderRefresher {
    Mono<RefreshResult> refresh(ExternalSubscription subscription, ProviderConfig config);
}
