// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core.observable;

import sh.pylon.core.concurrent.Scope;

/**
 * A multicast source of values.
 *
 * <p>
 * Every observer receives each value published after it subscribed. All
 * observers present at the time of a publish see that value in the same
 * relative order.
 *
 * @param <T> the value type
 * @since 0.1.0
 */
public interface Observable<T> {

    /**
     * Subscribes a new observer that stays open until {@code scope} is cancelled.
     *
     * <p>
     * Subscribing to an observable that has already been unsubscribed-all
     * returns an observer that is closed from the start.
     *
     * @param scope bounds the lifetime of the subscription
     * @return the new observer
     */
    Observer<T> subscribe(Scope scope);

    /**
     * Closes every current observer and every future one. Publishing becomes a no-op.
     */
    void unsubscribeAll();
}
