package com.proxyhub.provider.client;

import com.proxyhub.common.exception.ProviderException;
import com.proxyhub.provider.model.ExternalSubscription;
import com.proxyhub.provider.model.ProviderConfig;
import com.proxyhub.provider.support.Fixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class UpstreamProviderRefresherTest {

    private static final String UPSTREAM = """
        port: 7890
        proxies:
          - name: HK 01
            type: ss
            server: hk.example.com
            port: 443
          - name: JP 02
            type: vmess
            server: jp.example.com
            port: 443
        rules:
          - MATCH,DIRECT
        """;

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();
    private final ProviderConfig config = Fixtures.config(1, 10, 60);

    private UpstreamProviderRefresher refresherReturning(HttpStatus status, String body) {
        WebClient client = WebClient.builder()
            .exchangeFunction(request -> {
                lastRequest.set(request);
                ClientResponse.Builder response = ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, "text/plain;charset=UTF-8");
                if (body != null) {
                    response.body(body);
                }
                return Mono.just(response.build());
            })
            .build();
        return new UpstreamProviderRefresher(client, "clash.meta");
    }

    @Test
    @DisplayName("proxies list is extracted and re-rendered, other sections dropped")
    void rendersProxiesOnly() {
        RefreshResult result = refresherReturning(HttpStatus.OK, UPSTREAM)
            .refresh(Fixtures.subscription(10), config)
            .block();

        assertNotNull(result);
        assertEquals(2, result.nodeCount());
        assertEquals(List.of("HK 01", "JP 02"), result.nodeNames());
        String document = new String(result.document(), StandardCharsets.UTF_8);
        assertTrue(document.startsWith("proxies:"));
        assertFalse(document.contains("rules"));
        assertFalse(document.contains("7890"));
    }

    @Test
    void defaultUserAgentSentWhenSubscriptionHasNone() {
        refresherReturning(HttpStatus.OK, UPSTREAM).refresh(Fixtures.subscription(10), config).block();

        assertEquals("clash.meta", lastRequest.get().headers().getFirst(HttpHeaders.USER_AGENT));
        assertEquals("https://upstream.example.com/sub/10", lastRequest.get().url().toString());
    }

    @Test
    void subscriptionUserAgentWins() {
        ExternalSubscription subscription = Fixtures.subscription(10);
        subscription.setUserAgent("mihomo/1.18");

        refresherReturning(HttpStatus.OK, UPSTREAM).refresh(subscription, config).block();

        assertEquals("mihomo/1.18", lastRequest.get().headers().getFirst(HttpHeaders.USER_AGENT));
    }

    @Test
    @DisplayName("base64-wrapped subscription is unwrapped and rendered as YAML")
    void base64BodyRendered() {
        String encoded = Base64.getEncoder().encodeToString(UPSTREAM.getBytes(StandardCharsets.UTF_8));

        RefreshResult result = refresherReturning(HttpStatus.OK, encoded)
            .refresh(Fixtures.subscription(10), config)
            .block();

        assertNotNull(result);
        assertEquals(List.of("HK 01", "JP 02"), result.nodeNames());
        assertTrue(new String(result.document(), StandardCharsets.UTF_8).startsWith("proxies:"));
    }

    @Test
    @DisplayName("empty body → empty provider document, not an error")
    void emptyBodyIsEmptyResult() {
        RefreshResult result = refresherReturning(HttpStatus.OK, null)
            .refresh(Fixtures.subscription(10), config)
            .block();

        assertNotNull(result);
        assertEquals(0, result.nodeCount());
        assertEquals(RefreshResult.EMPTY_DOCUMENT, new String(result.document(), StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("body that is not a YAML mapping → ProviderException")
    void malformedBodyFails() {
        StepVerifier.create(refresherReturning(HttpStatus.OK, "just a line of text")
                .refresh(Fixtures.subscription(10), config))
            .expectError(ProviderException.class)
            .verify();
    }

    @Test
    @DisplayName("HTTP error status → ProviderException carrying the config id")
    void httpErrorWrapped() {
        StepVerifier.create(refresherReturning(HttpStatus.BAD_GATEWAY, "bad gateway")
                .refresh(Fixtures.subscription(10), config))
            .expectErrorSatisfies(e -> {
                assertInstanceOf(ProviderException.class, e);
                assertEquals(1L, ((ProviderException) e).getConfigId());
            })
            .verify();
    }

    @Test
    void missingUrlFailsWithoutRequest() {
        ExternalSubscription subscription = Fixtures.subscription(10);
        subscription.setUrl(null);

        StepVerifier.create(refresherReturning(HttpStatus.OK, UPSTREAM).refresh(subscription, config))
            .expectError(ProviderException.class)
            .verify();
        assertNull(lastRequest.get());
    }
}
