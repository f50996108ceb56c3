// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.block;

import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

import sh.pylon.core.error.EventDecodeException;
import sh.pylon.core.util.Hex;
import sh.pylon.rpc.events.JsonRpcEvents;
import sh.pylon.rpc.internal.RpcUtils;

/**
 * A committed block, as announced by a {@code NewBlock} event.
 *
 * @param height the block height
 * @param hash   the block hash, lowercase hex; empty if the node did not report a block id
 */
public record Block(long height, String hash) {

    /** CometBFT event type of a new block. */
    public static final String EVENT_TYPE = "tendermint/event/NewBlock";

    public Block {
        if (height < 0) {
            throw new IllegalArgumentException("height must be >= 0, got: " + height);
        }
        Objects.requireNonNull(hash, "hash");
    }

    /**
     * Decodes a {@code NewBlock} event frame.
     *
     * @throws EventDecodeException if the frame is not a well-formed NewBlock event
     */
    public static Block decode(final byte[] frame) {
        JsonNode value = JsonRpcEvents.eventValue(frame, EVENT_TYPE);
        final long height;
        try {
            height = RpcUtils.longValue(value.path("block").path("header").get("height"));
        } catch (NumberFormatException e) {
            throw new EventDecodeException("NewBlock event has no valid height", e);
        }
        String rawHash = value.path("block_id").path("hash").asText("");
        try {
            return new Block(height, rawHash.isEmpty() ? "" : Hex.normalize(rawHash));
        } catch (IllegalArgumentException e) {
            throw new EventDecodeException("NewBlock event has a malformed block hash", e);
        }
    }
}
