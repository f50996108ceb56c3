// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.events;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;

import sh.pylon.rpc.internal.RpcUtils;

/**
 * JSON-RPC 2.0 {@code subscribe} request for a CometBFT event query.
 *
 * <pre>{@code
 * {"jsonrpc":"2.0","method":"subscribe","id":"q2Vz0aL1k5A=","params":{"query":"tm.event='NewBlock'"}}
 * }</pre>
 *
 * @param jsonrpc protocol version, always {@code "2.0"}
 * @param method  always {@code "subscribe"}
 * @param id      8 random bytes, base64 encoded
 * @param params  holds the single {@code query} parameter
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubscribeRequest(String jsonrpc, String method, String id, Map<String, String> params) {

    private static final SecureRandom RANDOM = new SecureRandom();

    /**
     * Builds a request for {@code query} with a fresh random id.
     */
    public static SubscribeRequest forQuery(final String query) {
        byte[] id = new byte[8];
        RANDOM.nextBytes(id);
        return new SubscribeRequest("2.0", "subscribe", Base64.getEncoder().encodeToString(id), Map.of("query", query));
    }

    /**
     * @return the request serialized as JSON
     */
    public byte[] toJsonBytes() {
        try {
            return RpcUtils.MAPPER.writeValueAsBytes(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize subscribe request", e);
        }
    }
}
