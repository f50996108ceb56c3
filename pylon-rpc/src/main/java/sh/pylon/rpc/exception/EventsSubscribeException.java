// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.exception;

import sh.pylon.core.error.EventsException;

/**
 * Thrown when the subscribe request could not be sent on a fresh connection.
 * The connection has been closed by the time this is thrown.
 */
public final class EventsSubscribeException extends EventsException {

    public EventsSubscribeException(final String query, final Throwable cause) {
        super(query, "failed to send subscribe request for query " + query, cause);
    }
}
