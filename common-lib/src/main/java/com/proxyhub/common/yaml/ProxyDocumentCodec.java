package com.proxyhub.common.yaml;

import com.proxyhub.common.exception.ProviderException;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads and writes the {@code proxies:} section of a Clash-style provider document.
 *
 * <p>{@link Yaml} instances are not thread-safe, so each call builds its own.
 * Field order inside every node is preserved on both paths.
 */
public final class ProxyDocumentCodec {

    public static final String PROXIES_KEY = "proxies";

    /** Upper bound on aliases in one document; guards against "billion laughs" payloads. */
    private static final int MAX_ALIASES = 50;

    private static final Pattern BASE64_WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern BASE64_TOKEN      = Pattern.compile("[A-Za-z0-9+/_-]+={0,2}");

    private ProxyDocumentCodec() {}

    /**
     * Parses an upstream document.
     *
     * <p>A {@code null} or blank payload decodes to {@link ProxyDocument#empty()}.
     * A document without a {@code proxies} list also decodes to an empty document.
     * A base64-wrapped YAML document (standard or URL-safe alphabet, padded or not) is unwrapped first.
     *
     * @throws ProviderException when the payload is not YAML or its root is not a mapping
     */
    public static ProxyDocument decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            return ProxyDocument.empty();
        }
        String text = new String(payload, StandardCharsets.UTF_8);
        if (text.isBlank()) {
            return ProxyDocument.empty();
        }

        Object root = parse(text);
        if (!(root instanceof Map<?, ?>)) {
            Optional<String> unwrapped = unwrapBase64(text);
            if (unwrapped.isPresent() && !unwrapped.get().isBlank()) {
                root = parse(unwrapped.get());
            }
        }
        if (!(root instanceof Map<?, ?> rootMap)) {
            throw new ProviderException("Upstream document root is not a mapping: " + preview(text));
        }

        Object proxies = rootMap.get(PROXIES_KEY);
        if (!(proxies instanceof List<?> rawList)) {
            return ProxyDocument.empty();
        }

        List<Map<String, Object>> nodes = new ArrayList<>(rawList.size());
        List<String> names = new ArrayList<>(rawList.size());
        for (Object raw : rawList) {
            if (!(raw instanceof Map<?, ?> rawNode)) {
                continue;
            }
            Map<String, Object> node = new LinkedHashMap<>();
            rawNode.forEach((k, v) -> node.put(String.valueOf(k), v));
            nodes.add(Collections.unmodifiableMap(node));
            if (node.get("name") instanceof String name) {
                names.add(name);
            }
        }
        return new ProxyDocument(nodes, names);
    }

    /**
     * Renders {@code nodes} as a document with a single {@code proxies} key.
     */
    public static byte[] encode(List<Map<String, Object>> nodes) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put(PROXIES_KEY, nodes);
        return dumper().dump(root).getBytes(StandardCharsets.UTF_8);
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static Object parse(String text) {
        try {
            return loader().load(text);
        } catch (YAMLException e) {
            throw new ProviderException("Upstream document is not valid YAML: " + preview(text), e);
        }
    }

    /**
     * Decodes {@code text} as one base64 token. Empty when it is not base64 or does not
     * decode to UTF-8 text.
     */
    static Optional<String> unwrapBase64(String text) {
        String token = BASE64_WHITESPACE.matcher(text).replaceAll("");
        if (token.isEmpty() || !BASE64_TOKEN.matcher(token).matches()) {
            return Optional.empty();
        }
        String standard = token.replace('-', '+').replace('_', '/');
        while (standard.length() % 4 != 0) {
            standard = standard + "=";
        }
        byte[] decoded;
        try {
            decoded = Base64.getDecoder().decode(standard);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        try {
            return Optional.of(StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(decoded))
                .toString());
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }

    private static Yaml loader() {
        LoaderOptions options = new LoaderOptions();
        options.setMaxAliasesForCollections(MAX_ALIASES);
        return new Yaml(new SafeConstructor(options));
    }

    private static Yaml dumper() {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setAllowUnicode(true);
        options.setIndicatorIndent(2);
        options.setIndentWithIndicator(true);
        return new Yaml(options);
    }

    private static String preview(String text) {
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
