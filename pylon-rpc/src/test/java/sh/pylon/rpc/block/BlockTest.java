// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.block;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import sh.pylon.core.error.EventDecodeException;
import sh.pylon.rpc.test.EventFrames;

class BlockTest {

    @Test
    void decodesHeightAndLowercasesHash() {
        Block block = Block.decode(EventFrames.newBlock(42, "AB12CD34"));

        assertEquals(42, block.height());
        assertEquals("ab12cd34", block.hash());
    }

    @Test
    void missingBlockIdGivesEmptyHash() {
        byte[] frame = EventFrames.bytes("{\"jsonrpc\":\"2.0\",\"id\":\"1\",\"result\":{\"data\":{"
                + "\"type\":\"tendermint/event/NewBlock\",\"value\":{\"block\":{\"header\":{\"height\":7}}}}}}");

        Block block = Block.decode(frame);

        assertEquals(7, block.height());
        assertEquals("", block.hash());
    }

    @Test
    void rejectsOtherEventTypes() {
        byte[] txFrame = EventFrames.tx(new byte[] {1, 2, 3}, 5, 0, "");

        assertThrows(EventDecodeException.class, () -> Block.decode(txFrame));
    }

    @Test
    void rejectsSubscribeAcknowledgement() {
        assertThrows(EventDecodeException.class, () -> Block.decode(EventFrames.subscribeAck()));
    }

    @Test
    void rejectsMissingHeight() {
        byte[] frame = EventFrames.bytes("{\"result\":{\"data\":{\"type\":\"tendermint/event/NewBlock\","
                + "\"value\":{\"block\":{\"header\":{}}}}}}");

        assertThrows(EventDecodeException.class, () -> Block.decode(frame));
    }

    @Test
    void rejectsMalformedHash() {
        assertThrows(EventDecodeException.class, () -> Block.decode(EventFrames.newBlock(1, "not-hex")));
    }
}
