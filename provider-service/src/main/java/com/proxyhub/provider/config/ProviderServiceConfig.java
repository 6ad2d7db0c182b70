package com.proxyhub.provider.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ProviderServiceConfig {

    @Value("${provider.upstream.connect-timeout:10s}")
    private Duration upstreamConnectTimeout;

    @Value("${provider.upstream.read-timeout:30s}")
    private Duration upstreamReadTimeout;

    @Value("${provider.upstream.max-document-size:10MB}")
    private DataSize maxDocumentSize;

    @Bean
    public SyncSettings syncSettings(
            @Value("${provider.sync.enabled:true}")            boolean enabled,
            @Value("${provider.sync.worker-pool-size:4}")      int workerPoolSize,
            @Value("${provider.sync.scan-period:15s}")         Duration scanPeriod,
            @Value("${provider.sync.reload-period:5m}")        Duration reloadPeriod,
            @Value("${provider.sync.retry-base:30s}")          Duration retryBase,
            @Value("${provider.sync.retry-cap:10m}")           Duration retryCap,
            @Value("${provider.sync.refresh-timeout:60s}")     Duration refreshTimeout,
            @Value("${provider.sync.reload-timeout:30s}")      Duration reloadTimeout,
            @Value("${provider.sync.lookup-timeout:30s}")      Duration lookupTimeout) {
        return new SyncSettings(enabled, workerPoolSize, scanPeriod, reloadPeriod,
            retryBase, retryCap, refreshTimeout, reloadTimeout, lookupTimeout);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Threads for background refresh workers. Concurrency is bounded by the scheduler's
     * semaphore, not by this pool.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService providerSyncWorkerExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread t = new Thread(runnable, "provider-sync-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newCachedThreadPool(factory);
    }

    @Bean
    public WebClient upstreamWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) upstreamConnectTimeout.toMillis())
            .responseTimeout(upstreamReadTimeout)
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(upstreamReadTimeout.toMillis(), TimeUnit.MILLISECONDS))
            );

        return builder
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize((int) maxDocumentSize.toBytes()))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String uri = clientRequest.url().toString();
            String sanitized = uri.replaceAll("(token|key|password)=[^&]+", "$1=***");
            org.slf4j.LoggerFactory.getLogger(ProviderServiceConfig.class)
                .debug("Outbound request: {} {}", clientRequest.method(), sanitized);
            return Mono.just(clientRequest);
        });
    }
}
