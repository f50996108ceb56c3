// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.internal;

import java.net.URI;
import java.util.Locale;
import java.util.Set;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Internal helpers shared by the RPC layer.
 *
 * <p>
 * <strong>Internal Use Only:</strong> not part of the public API.
 */
public final class RpcUtils {

    /**
     * Shared, thread-safe ObjectMapper instance for JSON serialization/deserialization.
     * <p>
     * CometBFT adds fields between releases, so unknown properties are ignored.
     */
    public static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static final Set<String> WS_SCHEMES = Set.of("ws", "wss");

    private RpcUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Parses and checks a node URL.
     *
     * @param url     the URL to validate
     * @param schemes accepted schemes, lowercase
     * @return the parsed URI
     * @throws IllegalArgumentException if the URL is blank, malformed, has no host or an unsupported scheme
     */
    public static URI validateUrl(final String url, final Set<String> schemes) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        final URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("malformed url: " + url, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!schemes.contains(scheme)) {
            throw new IllegalArgumentException("unsupported url scheme '" + scheme + "', expected one of " + schemes);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("url has no host: " + url);
        }
        return uri;
    }

    /**
     * Reads a CometBFT integer field, which is encoded as a JSON string ("12") or a number.
     *
     * @throws NumberFormatException if the node is missing or not an integer
     */
    public static long longValue(final JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new NumberFormatException("missing integer field");
        }
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        return Long.parseLong(node.asText());
    }
}
