package com.proxyhub.common.yaml;

import java.util.List;
import java.util.Map;

/**
 * Decoded view of a proxy-provider document: the {@code proxies} list and the
 * display names of its entries, in document order.
 *
 * <p>Entries without a string {@code name} are kept in {@code nodes} but contribute
 * nothing to {@code nodeNames}, so the two lists may differ in size.
 */
public record ProxyDocument(
    List<Map<String, Object>> nodes,
    List<String> nodeNames
) {
    public ProxyDocument {
        nodes     = List.copyOf(nodes);
        nodeNames = List.copyOf(nodeNames);
    }

    public static ProxyDocument empty() {
        return new ProxyDocument(List.of(), List.of());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
