// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.tx;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

import sh.pylon.core.error.EventDecodeException;
import sh.pylon.core.util.Hex;
import sh.pylon.rpc.events.JsonRpcEvents;
import sh.pylon.rpc.internal.RpcUtils;

/**
 * A committed transaction, as announced by a {@code Tx} event.
 *
 * @param hash   SHA-256 of the encoded transaction, lowercase hex
 * @param height inclusion height
 * @param code   execution result code
 * @param log    execution log
 */
public record TxEvent(String hash, long height, long code, String log) {

    /** CometBFT event type of a committed transaction. */
    public static final String EVENT_TYPE = "tendermint/event/Tx";

    private static final String SENDER_QUERY = "tm.event='Tx' AND message.sender='%s'";

    public TxEvent {
        Objects.requireNonNull(hash, "hash");
        log = log == null ? "" : log;
    }

    /**
     * @return the subscription query matching transactions sent by {@code address}
     */
    public static String senderQuery(final String address) {
        return String.format(SENDER_QUERY, Objects.requireNonNull(address, "address"));
    }

    /**
     * Decodes a {@code Tx} event frame.
     *
     * @throws EventDecodeException if the frame is not a well-formed Tx event
     */
    public static TxEvent decode(final byte[] frame) {
        JsonNode txResult = JsonRpcEvents.eventValue(frame, EVENT_TYPE).path("TxResult");
        JsonNode tx = txResult.get("tx");
        if (tx == null || !tx.isTextual()) {
            throw new EventDecodeException("Tx event has no transaction bytes");
        }
        final byte[] txBytes;
        try {
            txBytes = Base64.getDecoder().decode(tx.asText());
        } catch (IllegalArgumentException e) {
            throw new EventDecodeException("Tx event transaction is not valid base64", e);
        }
        final long height;
        try {
            height = RpcUtils.longValue(txResult.get("height"));
        } catch (NumberFormatException e) {
            throw new EventDecodeException("Tx event has no valid height", e);
        }
        JsonNode result = txResult.path("result");
        long code = result.path("code").asLong(0);
        return new TxEvent(hash(txBytes), height, code, result.path("log").asText(""));
    }

    /**
     * @return the lowercase hex SHA-256 of {@code txBytes}
     */
    public static String hash(final byte[] txBytes) {
        try {
            return Hex.encodeNoPrefix(MessageDigest.getInstance("SHA-256").digest(txBytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
