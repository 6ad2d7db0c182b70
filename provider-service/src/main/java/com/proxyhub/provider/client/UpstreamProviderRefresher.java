package com.proxyhub.provider.client;

import com.proxyhub.common.exception.ProviderException;
import com.proxyhub.common.yaml.ProxyDocument;
import com.proxyhub.common.yaml.ProxyDocumentCodec;
import com.proxyhub.provider.model.ExternalSubscription;
import com.proxyhub.provider.model.ProviderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Fetches a subscription's upstream document over HTTP and re-renders its {@code proxies}
 * list as a provider document.
 *
 * <p>An empty upstream body is a valid, empty provider. Anything that does not decode as a
 * YAML mapping, and any HTTP failure, is reported as a {@link ProviderException} so the
 * caller can back off.
 */
@Component
public class UpstreamProviderRefresher implements ProviderRefresher {

    private static final Logger log = LoggerFactory.getLogger(UpstreamProviderRefresher.class);

    private final WebClient upstreamClient;
    private final String defaultUserAgent;

    public UpstreamProviderRefresher(
            WebClient upstreamWebClient,
            @Value("${provider.upstream.default-user-agent:clash.meta}") String defaultUserAgent) {
        this.upstreamClient   = upstreamWebClient;
        this.defaultUserAgent = defaultUserAgent;
    }

    @Override
    public Mono<RefreshResult> refresh(ExternalSubscription subscription, ProviderConfig config) {
        Long configId = config.getId();
        String url = subscription.getUrl();
        if (url == null || url.isBlank()) {
            return Mono.error(new ProviderException(configId,
                "subscription " + subscription.getId() + " has no upstream URL"));
        }
        String userAgent = subscription.getUserAgent() == null || subscription.getUserAgent().isBlank()
            ? defaultUserAgent
            : subscription.getUserAgent();

        return Mono.defer(() -> upstreamClient.get()
                .uri(URI.create(url.trim()))
                .header(HttpHeaders.USER_AGENT, userAgent)
                .retrieve()
                .bodyToMono(byte[].class))
            .defaultIfEmpty(new byte[0])
            .map(body -> render(configId, body))
            .doOnSuccess(result -> log.info("UPSTREAM_FETCHED configId={} subscription={} nodeCount={}",
                                            configId, subscription.getName(), result.nodeCount()))
            .onErrorMap(e -> !(e instanceof ProviderException),
                        e -> new ProviderException(configId, "upstream fetch failed: " + e.getMessage(), e));
    }

    static RefreshResult render(Long configId, byte[] body) {
        ProxyDocument parsed;
        try {
            parsed = ProxyDocumentCodec.decode(body);
        } catch (ProviderException e) {
            throw new ProviderException(configId, e.getMessage(), e);
        }
        if (parsed.isEmpty()) {
            log.info("UPSTREAM_EMPTY configId={} bytes={}", configId, body.length);
            return RefreshResult.empty();
        }
        return RefreshResult.of(ProxyDocumentCodec.encode(parsed.nodes()), parsed);
    }
}
