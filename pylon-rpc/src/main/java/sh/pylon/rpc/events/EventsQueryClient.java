// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.events;

import sh.pylon.core.concurrent.Scope;
import sh.pylon.core.either.Either;
import sh.pylon.core.error.EventsException;
import sh.pylon.core.observable.Observable;

/**
 * Multiplexes event subscriptions by query string.
 *
 * <p>
 * At most one subscription, and so one socket, exists per distinct query. A
 * second request for the same query while the first is live returns the same
 * observable.
 *
 * @since 0.1.0
 */
public interface EventsQueryClient extends AutoCloseable {

    /**
     * Returns the raw event stream for {@code query}, subscribing if necessary.
     *
     * <p>
     * Each frame read from the socket is published as {@link Either.Success}.
     * A read failure is published once as {@link Either.Failure} and ends the
     * subscription. Cancelling {@code scope} tears the subscription down.
     *
     * @param scope owns a newly created subscription; ignored when an existing one is returned
     * @param query the event query, e.g. {@code tm.event='NewBlock'}
     * @return the observable of frames or errors
     * @throws EventsException if dialing or sending the subscribe request failed
     */
    Observable<Either<byte[]>> eventsBytes(Scope scope, String query);

    /**
     * Unsubscribes every observer of every query and closes every connection.
     * Safe to call more than once.
     */
    @Override
    void close();
}
