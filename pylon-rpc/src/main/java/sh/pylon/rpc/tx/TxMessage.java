// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.tx;

/**
 * A message carried by a transaction.
 *
 * <p>
 * Implementations wrap the chain's own message type. The transaction client
 * only needs to validate them before submission and hand them to a
 * {@link TxBuilder}.
 */
public interface TxMessage {

    /**
     * @return the protobuf type URL, e.g. {@code /cosmos.bank.v1beta1.MsgSend}
     */
    String typeUrl();

    /**
     * Performs stateless validation of this message.
     *
     * @throws IllegalArgumentException if the message is malformed
     */
    void validateBasic();
}
