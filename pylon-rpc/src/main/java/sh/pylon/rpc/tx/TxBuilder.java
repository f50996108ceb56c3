// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.tx;

import java.util.List;

/**
 * Mutable assembly of an unsigned transaction, created by {@link TxContext#newTxBuilder()}.
 */
public interface TxBuilder {

    void setMessages(List<? extends TxMessage> messages);

    void setGasLimit(long gasLimit);

    void setFeeAmount(Coin fee);

    /**
     * Sets the last height at which the transaction may be included.
     */
    void setTimeoutHeight(long timeoutHeight);

    /**
     * Performs stateless validation of the assembled transaction.
     *
     * @throws IllegalArgumentException if the transaction is malformed
     */
    void validateBasic();
}
