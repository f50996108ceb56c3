// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.events;

import java.util.List;

import sh.pylon.core.concurrent.Scope;
import sh.pylon.core.observable.ReplayObservable;

/**
 * A decoded, replayable stream of the events matching one query.
 *
 * <p>
 * Frames that cannot be decoded are skipped. Transport loss is handled by
 * reconnecting; observers see one continuous stream.
 *
 * @param <T> the event type
 * @since 0.1.0
 */
public interface EventsReplayClient<T> extends AutoCloseable {

    /**
     * @param scope bounds the caller's use of the stream
     * @return the decoded events; new observers first receive the replay backlog
     */
    ReplayObservable<T> eventsSequence(Scope scope);

    /**
     * Returns up to {@code n} of the most recent events, oldest first.
     * Blocks until at least one event has been received.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    List<T> lastNEvents(Scope scope, int n) throws InterruptedException;

    /**
     * Stops the stream and its reconnect loop. Idempotent.
     */
    @Override
    void close();
}
