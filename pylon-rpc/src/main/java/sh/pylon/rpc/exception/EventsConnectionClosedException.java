// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.exception;

import sh.pylon.core.error.EventsException;

/**
 * Reports that a subscription's connection stopped delivering events.
 *
 * <p>
 * Published to observers as the final notification of a subscription whose
 * socket read failed, and used by replay clients to trigger a reconnect.
 */
public final class EventsConnectionClosedException extends EventsException {

    public EventsConnectionClosedException(final String query, final String message) {
        super(query, message);
    }

    public EventsConnectionClosedException(final String query, final String message, final Throwable cause) {
        super(query, message, cause);
    }
}
