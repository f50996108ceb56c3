// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.exception;

import sh.pylon.core.error.TxException;

/**
 * Thrown when the node refuses a transaction into its mempool.
 *
 * <p>
 * Carries the admission result exactly as reported by the chain.
 */
public final class CheckTxException extends TxException {

    private final long code;
    private final String codespace;
    private final String rawLog;

    public CheckTxException(final long code, final String codespace, final String rawLog) {
        super("transaction rejected with code " + code
                + (codespace == null || codespace.isEmpty() ? "" : " (" + codespace + ")")
                + ": " + rawLog);
        this.code = code;
        this.codespace = codespace == null ? "" : codespace;
        this.rawLog = rawLog == null ? "" : rawLog;
    }

    public long code() {
        return code;
    }

    public String codespace() {
        return codespace;
    }

    public String rawLog() {
        return rawLog;
    }
}
