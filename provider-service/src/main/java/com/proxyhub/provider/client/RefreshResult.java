package com.proxyhub.provider.client;

import com.proxyhub.common.yaml.ProxyDocument;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Output of one {@link ProviderRefresher#refresh} call: the rendered document plus
 * the parsed views used for previews and status.
 */
public record RefreshResult(
    byte[] document,
    List<Map<String, Object>> nodes,
    List<String> nodeNames,
    int nodeCount
) {
    /** Rendering used when the upstream returned nothing. */
    public static final String EMPTY_DOCUMENT = "proxies: []\n";

    public RefreshResult {
        nodes     = List.copyOf(nodes);
        nodeNames = List.copyOf(nodeNames);
    }

    public static RefreshResult empty() {
        return new RefreshResult(EMPTY_DOCUMENT.getBytes(StandardCharsets.UTF_8), List.of(), List.of(), 0);
    }

    public static RefreshResult of(byte[] document, ProxyDocument parsed) {
        return new RefreshResult(document, parsed.nodes(), parsed.nodeNames(), parsed.nodeCount());
    }
}
