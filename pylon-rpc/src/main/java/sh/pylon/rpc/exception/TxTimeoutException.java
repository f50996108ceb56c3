// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.exception;

import org.jspecify.annotations.Nullable;

import sh.pylon.core.error.TxException;

/**
 * Delivered when a broadcast transaction was not seen committed by its timeout height.
 *
 * <p>
 * {@link #txLog()} holds the log of the transaction as queried from the node
 * after the timeout. If the status query itself failed the log is empty and
 * the query failure is the cause.
 */
public final class TxTimeoutException extends TxException {

    private final String txHash;
    private final long timeoutHeight;
    private final String txLog;

    public TxTimeoutException(final String txHash, final long timeoutHeight, final String txLog) {
        super(message(txHash, timeoutHeight, txLog));
        this.txHash = txHash;
        this.timeoutHeight = timeoutHeight;
        this.txLog = txLog;
    }

    public TxTimeoutException(final String txHash, final long timeoutHeight, final String detail,
            final @Nullable Throwable cause) {
        super(message(txHash, timeoutHeight, detail), cause);
        this.txHash = txHash;
        this.timeoutHeight = timeoutHeight;
        this.txLog = "";
    }

    public String txHash() {
        return txHash;
    }

    public long timeoutHeight() {
        return timeoutHeight;
    }

    public String txLog() {
        return txLog;
    }

    private static String message(final String txHash, final long timeoutHeight, final String detail) {
        return "transaction " + txHash + " timed out at height " + timeoutHeight
                + (detail == null || detail.isEmpty() ? "" : ": " + detail);
    }
}
