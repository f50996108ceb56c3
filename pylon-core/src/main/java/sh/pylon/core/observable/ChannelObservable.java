// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core.observable;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

import sh.pylon.core.concurrent.Scope;

/**
 * Lock-ordered multicast observable.
 *
 * <p>
 * Publishing and subscribing happen under one lock, so every observer sees
 * values in publish order and a subscriber can never observe a value twice
 * or miss one published after its subscription.
 */
class ChannelObservable<T> implements Observable<T> {

    protected final ReentrantLock lock = new ReentrantLock();
    private final ObserverManager<T> observers = new ObserverManager<>();
    private final int observerBufferSize;
    private final Publisher<T> publisher = new ChannelPublisher();
    // Completes on the first subscription or on close, whichever comes first
    private final CompletableFuture<Void> observed = new CompletableFuture<>();
    private boolean closed;

    ChannelObservable(final int observerBufferSize) {
        if (observerBufferSize < 1) {
            throw new IllegalArgumentException("observerBufferSize must be at least 1, got: " + observerBufferSize);
        }
        this.observerBufferSize = observerBufferSize;
    }

    @Override
    public Observer<T> subscribe(final Scope scope) {
        Objects.requireNonNull(scope, "scope");
        ChannelObserver<T> observer = new ChannelObserver<>(observerBufferSize, observers::remove);
        lock.lock();
        try {
            if (closed) {
                observer.closeDelivery();
                return observer;
            }
            onSubscribe(observer);
            observers.add(observer);
        } finally {
            lock.unlock();
        }
        observed.complete(null);
        observer.bindTo(scope);
        return observer;
    }

    @Override
    public void unsubscribeAll() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            onClose();
            observers.removeAll();
        } finally {
            lock.unlock();
        }
        observed.complete(null);
    }

    Publisher<T> publisher() {
        return publisher;
    }

    int observerCount() {
        return observers.size();
    }

    boolean publish(final T value) {
        Objects.requireNonNull(value, "value");
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            onPublish(value);
            observers.notifyObservers(value);
            return true;
        } finally {
            lock.unlock();
        }
    }

    boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /** Called under {@link #lock} before a new observer is registered. */
    protected void onSubscribe(final ChannelObserver<T> observer) {
    }

    /** Called under {@link #lock} before a value is fanned out. */
    protected void onPublish(final T value) {
    }

    /** Called under {@link #lock} when the observable closes. */
    protected void onClose() {
    }

    private final class ChannelPublisher implements Publisher<T> {

        @Override
        public boolean publish(final T value) {
            return ChannelObservable.this.publish(value);
        }

        @Override
        public boolean isClosed() {
            return ChannelObservable.this.isClosed();
        }

        @Override
        public CompletableFuture<Void> whenObserved() {
            return observed.copy();
        }

        @Override
        public void close() {
            unsubscribeAll();
        }
    }
}
