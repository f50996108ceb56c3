// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core.observable;

import java.util.List;

import sh.pylon.core.concurrent.Scope;

/**
 * An {@link Observable} that remembers its most recent values.
 *
 * <p>
 * A new observer first receives the buffered backlog, oldest first, then
 * live values. The backlog holds at most {@link #replayBufferSize()} values;
 * older ones are evicted first-in first-out.
 *
 * @param <T> the value type
 * @since 0.1.0
 */
public interface ReplayObservable<T> extends Observable<T> {

    /**
     * Returns up to {@code n} of the most recently published values, oldest first.
     *
     * <p>
     * Blocks until at least one value has been published. Reading does not
     * consume values for any observer. A request larger than the replay
     * buffer is clamped to its size.
     *
     * @param scope cancelling it ends the wait with an empty list
     * @param n     maximum number of values to return; must be positive
     * @return the most recent values, oldest first
     * @throws InterruptedException if interrupted while waiting
     */
    List<T> last(Scope scope, int n) throws InterruptedException;

    int replayBufferSize();
}
