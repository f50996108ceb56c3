// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core.concurrent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A cancellation scope bounding the lifetime of background work.
 *
 * <p>
 * Every long-running Pylon operation (a subscription, a replay stream, a
 * retry loop) takes a scope. Cancelling the scope stops the work and releases
 * the resources it holds. Scopes form a tree: a {@linkplain #child() child}
 * is cancelled whenever its parent is, but cancelling a child leaves the
 * parent untouched.
 *
 * <pre>{@code
 * try (Scope scope = Scope.root()) {
 *     Observer<Block> blocks = blockClient.committedBlocksSequence(scope).subscribe(scope);
 *     ...
 * } // cancelled here; the observer closes
 * }</pre>
 *
 * <p>
 * Thread-safe. Cancellation is idempotent and callbacks run exactly once, on
 * the thread that cancels.
 *
 * @since 0.1.0
 */
public final class Scope implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scope.class);

    private final Object lock = new Object();
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final CompletableFuture<Void> done = new CompletableFuture<>();
    private final Set<Callback> callbacks = new LinkedHashSet<>();
    private @Nullable Registration parentRegistration;
    private boolean isCancelled;

    private Scope() {
    }

    /**
     * Creates a scope with no parent. It is cancelled only explicitly.
     *
     * @return a new root scope
     */
    public static Scope root() {
        return new Scope();
    }

    /**
     * Creates a scope that is cancelled when this scope is cancelled.
     *
     * <p>
     * If this scope is already cancelled, the child is returned cancelled.
     *
     * @return a new child scope
     */
    public Scope child() {
        Scope child = new Scope();
        Registration registration = onCancel(child::cancel);
        synchronized (child.lock) {
            if (!child.isCancelled) {
                child.parentRegistration = registration;
            }
        }
        return child;
    }

    /**
     * Cancels this scope and every descendant.
     *
     * @return {@code true} if this call performed the cancellation, {@code false} if it was already cancelled
     */
    public boolean cancel() {
        final List<Callback> toRun;
        final @Nullable Registration fromParent;
        synchronized (lock) {
            if (isCancelled) {
                return false;
            }
            isCancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
            fromParent = parentRegistration;
            parentRegistration = null;
        }
        cancelled.countDown();
        if (fromParent != null) {
            fromParent.close();
        }
        for (Callback callback : toRun) {
            runCallback(callback.action);
        }
        done.complete(null);
        return true;
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Registers an action to run when this scope is cancelled.
     *
     * <p>
     * If the scope is already cancelled the action runs immediately on the
     * calling thread. The returned registration removes the action when closed.
     *
     * @param action the action to run on cancellation
     * @return a handle that deregisters the action
     */
    public Registration onCancel(final Runnable action) {
        Objects.requireNonNull(action, "action");
        Callback callback = new Callback(action);
        synchronized (lock) {
            if (!isCancelled) {
                callbacks.add(callback);
                return () -> {
                    synchronized (lock) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        runCallback(action);
        return () -> {
        };
    }

    /**
     * Blocks until this scope is cancelled.
     *
     * @throws InterruptedException if the calling thread is interrupted
     */
    public void await() throws InterruptedException {
        cancelled.await();
    }

    /**
     * Blocks until this scope is cancelled or the timeout elapses.
     *
     * <p>
     * Used as a cancellable sleep.
     *
     * @param timeout maximum time to wait
     * @return {@code true} if the scope was cancelled, {@code false} if the timeout elapsed
     * @throws InterruptedException if the calling thread is interrupted
     */
    public boolean await(final Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Returns a future that completes normally when this scope is cancelled.
     *
     * <p>
     * Each call returns a fresh dependent copy, so completing or cancelling
     * the returned future has no effect on the scope.
     *
     * @return a future completed on cancellation
     */
    public CompletableFuture<Void> whenCancelled() {
        return done.copy();
    }

    /**
     * Cancels this scope.
     */
    @Override
    public void close() {
        cancel();
    }

    private static void runCallback(final Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed", e);
        }
    }

    @Override
    public String toString() {
        return "Scope[cancelled=" + isCancelled() + "]";
    }

    /**
     * Handle returned by {@link #onCancel(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        /**
         * Removes the registered action. Has no effect if it already ran.
         */
        @Override
        void close();
    }

    // Identity-based wrapper so the same Runnable can be registered twice.
    private static final class Callback {
        private final Runnable action;

        private Callback(final Runnable action) {
            this.action = action;
        }
    }
}
