// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core.observable;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.pylon.core.concurrent.Scope;

/**
 * Bounded per-subscriber buffer backing an {@link Observer}.
 *
 * <p>
 * {@link #offer} never blocks: when the buffer is full the value is dropped
 * for this observer only, so one stalled consumer cannot hold up a publisher.
 */
final class ChannelObserver<T> implements Observer<T> {

    private static final Logger log = LoggerFactory.getLogger(ChannelObserver.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final ArrayDeque<T> buffer = new ArrayDeque<>();
    private final int capacity;
    private final Consumer<ChannelObserver<T>> onUnsubscribe;
    private final AtomicBoolean unsubscribed = new AtomicBoolean(false);
    private volatile Scope.@Nullable Registration scopeRegistration;
    private boolean closed;

    ChannelObserver(final int capacity, final Consumer<ChannelObserver<T>> onUnsubscribe) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1, got: " + capacity);
        }
        this.capacity = capacity;
        this.onUnsubscribe = onUnsubscribe;
    }

    /**
     * Ties this observer's lifetime to {@code scope}. Must be called after the
     * observer is registered with its manager, so that an already-cancelled
     * scope deregisters it again.
     */
    void bindTo(final Scope scope) {
        scopeRegistration = scope.onCancel(this::unsubscribe);
        if (unsubscribed.get()) {
            releaseScope();
        }
    }

    /**
     * @return {@code false} if the observer is closed or full and the value was dropped
     */
    boolean offer(final T value) {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            if (buffer.size() >= capacity) {
                log.warn("Observer buffer full ({} values), dropping value", capacity);
                return false;
            }
            buffer.addLast(value);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops accepting values and wakes blocked readers.
     */
    void closeDelivery() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<T> next() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty() && !closed) {
                notEmpty.await();
            }
            return Optional.ofNullable(buffer.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<T> next(final Duration timeout) throws InterruptedException, TimeoutException {
        long nanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty() && !closed) {
                if (nanos <= 0L) {
                    throw new TimeoutException("no value within " + timeout.toMillis() + "ms");
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return Optional.ofNullable(buffer.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void unsubscribe() {
        if (!unsubscribed.compareAndSet(false, true)) {
            return;
        }
        closeDelivery();
        onUnsubscribe.accept(this);
        releaseScope();
    }

    private void releaseScope() {
        Scope.Registration registration = scopeRegistration;
        if (registration != null) {
            scopeRegistration = null;
            registration.close();
        }
    }
}
