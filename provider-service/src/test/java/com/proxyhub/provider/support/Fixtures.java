package com.proxyhub.provider.support;

import com.proxyhub.common.yaml.ProxyDocument;
import com.proxyhub.common.yaml.ProxyDocumentCodec;
import com.proxyhub.provider.cache.CacheEntry;
import com.proxyhub.provider.client.RefreshResult;
import com.proxyhub.provider.model.ExternalSubscription;
import com.proxyhub.provider.model.ProviderConfig;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Fixtures {

    public static final String OWNER = "alice";

    private Fixtures() {}

    public static ProviderConfig config(long id, long subscriptionId, int interval) {
        ProviderConfig config = new ProviderConfig();
        config.setId(id);
        config.setUsername(OWNER);
        config.setExternalSubscriptionId(subscriptionId);
        config.setName("HK-Premium-" + id);
        config.setType("http");
        config.setInterval(interval);
        config.setProcessMode(ProviderConfig.MODE_SERVER);
        return config;
    }

    public static ExternalSubscription subscription(long id) {
        ExternalSubscription sub = new ExternalSubscription();
        sub.setId(id);
        sub.setUsername(OWNER);
        sub.setName("airport-" + id);
        sub.setUrl("https://upstream.example.com/sub/" + id);
        return sub;
    }

    public static RefreshResult result(String... names) {
        List<Map<String, Object>> nodes = new ArrayList<>();
        for (String name : names) {
            Map<String, Object> node = new LinkedHashMap<>();
            node.put("name", name);
            node.put("type", "ss");
            node.put("server", name.toLowerCase() + ".example.com");
            nodes.add(node);
        }
        ProxyDocument parsed = new ProxyDocument(nodes, List.of(names));
        return RefreshResult.of(ProxyDocumentCodec.encode(nodes), parsed);
    }

    public static CacheEntry entry(long configId, Instant fetchedAt, int interval) {
        return CacheEntry.fromRefresh(configId, result("HK 01"), "airport", interval, fetchedAt);
    }
}
