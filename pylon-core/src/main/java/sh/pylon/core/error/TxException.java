// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core.error;

/**
 * Base exception for transaction submission and lifecycle failures.
 */
public non-sealed class TxException extends PylonException {

    public TxException(final String message) {
        super(message);
    }

    public TxException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
