// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.events;

import java.io.IOException;

import com.fasterxml.jackson.databind.JsonNode;

import sh.pylon.core.error.EventDecodeException;
import sh.pylon.rpc.internal.RpcUtils;

/**
 * Unwraps CometBFT event frames.
 *
 * <p>
 * Every frame on a subscription socket is a JSON-RPC 2.0 response. Pushed
 * events carry their payload under {@code result.data}:
 *
 * <pre>{@code
 * {"jsonrpc":"2.0","id":"...","result":{
 *     "query":"tm.event='NewBlock'",
 *     "data":{"type":"tendermint/event/NewBlock","value":{...}},
 *     "events":{...}}}
 * }</pre>
 *
 * <p>
 * The acknowledgement of the subscribe request has an empty {@code result}
 * and is rejected as a decode failure, like any other frame that is not an
 * event.
 */
public final class JsonRpcEvents {

    private JsonRpcEvents() {
        // Utility class
    }

    /**
     * Parses a frame and returns its non-empty {@code result} object.
     *
     * @throws EventDecodeException if the frame is not JSON, carries an error or has an empty result
     */
    public static JsonNode result(final byte[] frame) {
        final JsonNode envelope;
        try {
            envelope = RpcUtils.MAPPER.readTree(frame);
        } catch (IOException e) {
            throw new EventDecodeException("frame is not valid JSON", e);
        }
        if (envelope == null || !envelope.isObject()) {
            throw new EventDecodeException("frame is not a JSON-RPC envelope");
        }
        JsonNode error = envelope.get("error");
        if (error != null && !error.isNull()) {
            throw new EventDecodeException("frame carries JSON-RPC error: " + error);
        }
        JsonNode result = envelope.get("result");
        if (result == null || result.isNull() || (result.isObject() && result.isEmpty())) {
            throw new EventDecodeException("frame has an empty result");
        }
        return result;
    }

    /**
     * Returns {@code result.data.value} of a frame whose {@code result.data.type}
     * equals {@code expectedType}.
     *
     * @param frame        the raw frame
     * @param expectedType e.g. {@code "tendermint/event/Tx"}
     * @throws EventDecodeException if the frame is not an event of that type
     */
    public static JsonNode eventValue(final byte[] frame, final String expectedType) {
        JsonNode data = result(frame).path("data");
        String type = data.path("type").asText("");
        if (!expectedType.equals(type)) {
            throw new EventDecodeException("expected event type " + expectedType + " but got '" + type + "'");
        }
        JsonNode value = data.get("value");
        if (value == null || value.isNull()) {
            throw new EventDecodeException("event " + expectedType + " has no value");
        }
        return value;
    }
}
