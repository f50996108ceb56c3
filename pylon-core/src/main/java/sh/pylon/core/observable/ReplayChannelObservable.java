// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core.observable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Condition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.pylon.core.concurrent.Scope;

/**
 * {@link ChannelObservable} with a bounded FIFO backlog replayed to new observers.
 */
final class ReplayChannelObservable<T> extends ChannelObservable<T> implements ReplayObservable<T> {

    private static final Logger log = LoggerFactory.getLogger(ReplayChannelObservable.class);

    private final int replayBufferSize;
    private final ArrayDeque<T> replayBuffer;
    private final Condition notEmpty = lock.newCondition();

    ReplayChannelObservable(final int replayBufferSize, final int observerBufferSize) {
        super(Math.max(replayBufferSize, observerBufferSize));
        if (replayBufferSize < 1) {
            throw new IllegalArgumentException("replayBufferSize must be at least 1, got: " + replayBufferSize);
        }
        this.replayBufferSize = replayBufferSize;
        this.replayBuffer = new ArrayDeque<>(replayBufferSize);
    }

    @Override
    public int replayBufferSize() {
        return replayBufferSize;
    }

    @Override
    public List<T> last(final Scope scope, final int n) throws InterruptedException {
        Objects.requireNonNull(scope, "scope");
        if (n < 1) {
            throw new IllegalArgumentException("n must be at least 1, got: " + n);
        }
        int limit = n;
        if (limit > replayBufferSize) {
            log.warn("Requested {} replayed values but the replay buffer holds {}; returning at most {}",
                    n, replayBufferSize, replayBufferSize);
            limit = replayBufferSize;
        }

        try (Scope.Registration ignored = scope.onCancel(this::wakeWaiters)) {
            lock.lockInterruptibly();
            try {
                while (replayBuffer.isEmpty() && !scope.isCancelled() && !isClosed()) {
                    notEmpty.await();
                }
                List<T> values = new ArrayList<>(replayBuffer);
                int from = Math.max(0, values.size() - limit);
                return List.copyOf(values.subList(from, values.size()));
            } finally {
                lock.unlock();
            }
        }
    }

    @Override
    protected void onSubscribe(final ChannelObserver<T> observer) {
        for (T value : replayBuffer) {
            observer.offer(value);
        }
    }

    @Override
    protected void onPublish(final T value) {
        if (replayBuffer.size() >= replayBufferSize) {
            replayBuffer.pollFirst();
        }
        replayBuffer.addLast(value);
        notEmpty.signalAll();
    }

    @Override
    protected void onClose() {
        notEmpty.signalAll();
    }

    private void wakeWaiters() {
        lock.lock();
        try {
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }
}
