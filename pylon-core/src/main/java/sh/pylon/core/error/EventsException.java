// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core.error;

/**
 * Base exception for failures of an event subscription's transport.
 *
 * <p>
 * Carries the query string whose subscription failed.
 */
public non-sealed class EventsException extends PylonException {

    private final String query;

    public EventsException(final String query, final String message) {
        super(message);
        this.query = query;
    }

    public EventsException(final String query, final String message, final Throwable cause) {
        super(message, cause);
        this.query = query;
    }

    /**
     * @return the subscription query this failure belongs to
     */
    public String query() {
        return query;
    }
}
