// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.exception;

import sh.pylon.core.error.TxException;

/**
 * Thrown when a transaction could not be prepared or handed to the node.
 *
 * <p>
 * {@link #stage()} tells which step failed. None of these failures is
 * retried by the transaction client.
 */
public final class TxSubmitException extends TxException {

    /**
     * Steps of submitting a transaction, in order.
     */
    public enum Stage {
        /** Estimating gas by simulation. */
        SIMULATE,
        /** Assembling the unsigned transaction. */
        BUILD,
        /** Signing. */
        SIGN,
        /** Validating the signed transaction. */
        VALIDATE,
        /** Serializing the signed transaction. */
        ENCODE,
        /** Sending the transaction to the node. */
        BROADCAST
    }

    private final Stage stage;

    public TxSubmitException(final Stage stage, final String message, final Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public TxSubmitException(final Stage stage, final String message) {
        super(message);
        this.stage = stage;
    }

    public Stage stage() {
        return stage;
    }
}
