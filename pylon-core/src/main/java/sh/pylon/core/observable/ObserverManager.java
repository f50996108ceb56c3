// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core.observable;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The set of observers attached to one observable.
 *
 * <p>
 * Iteration works on a snapshot, so observers may unsubscribe while a
 * publish is fanning out.
 */
final class ObserverManager<T> {

    private final List<ChannelObserver<T>> observers = new CopyOnWriteArrayList<>();

    void add(final ChannelObserver<T> observer) {
        observers.add(observer);
    }

    void remove(final ChannelObserver<T> observer) {
        observers.remove(observer);
    }

    void notifyObservers(final T value) {
        for (ChannelObserver<T> observer : observers) {
            observer.offer(value);
        }
    }

    void removeAll() {
        for (ChannelObserver<T> observer : observers) {
            observer.closeDelivery();
        }
        observers.clear();
    }

    int size() {
        return observers.size();
    }
}
