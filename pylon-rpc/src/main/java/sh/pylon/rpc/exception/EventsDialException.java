// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.exception;

import sh.pylon.core.error.EventsException;

/**
 * Thrown when no connection to the node could be opened for a subscription.
 */
public final class EventsDialException extends EventsException {

    public EventsDialException(final String query, final String url, final Throwable cause) {
        super(query, "failed to dial " + url + " for query " + query, cause);
    }
}
