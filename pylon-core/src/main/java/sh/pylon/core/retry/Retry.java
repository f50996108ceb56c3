// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core.retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.pylon.core.concurrent.Scope;
import sh.pylon.core.error.RetryExhaustedException;

/**
 * Restarts a long-running operation whenever it reports an error.
 *
 * <p>
 * The operation is started once and hands back a future that stays pending
 * while it runs. The future's completion drives the retry loop:
 * <ul>
 * <li><strong>Exceptional completion</strong> - the operation failed. Unless
 * the retry limit is reached, wait {@code retryDelay} and start it again.</li>
 * <li><strong>Normal completion</strong> - the operation finished for good;
 * stop without error.</li>
 * <li><strong>Quiet period</strong> - after {@code retryResetTimeout} without
 * an error, the retry count goes back to zero, so only bursts of failures
 * count against the limit.</li>
 * </ul>
 *
 * <p>
 * Cancelling the scope ends the loop at once, without error.
 *
 * <pre>{@code
 * Retry.onError(scope, RetryConfig.defaults(), "publishEvents", () -> {
 *     CompletableFuture<Void> failed = new CompletableFuture<>();
 *     subscribe(failed::completeExceptionally);
 *     return failed;
 * });
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Retry {

    private static final Logger log = LoggerFactory.getLogger(Retry.class);

    private Retry() {
        // Utility class
    }

    /**
     * One attempt of a retried operation.
     */
    @FunctionalInterface
    public interface Work {
        /**
         * Starts the operation.
         *
         * @return a future completing exceptionally when the operation fails,
         *         or normally when it ends without needing a retry
         */
        CompletableFuture<Void> start();
    }

    /**
     * Runs {@code work} with the settings of {@code config}.
     *
     * @see #onError(Scope, int, Duration, Duration, String, Work)
     */
    public static void onError(final Scope scope, final RetryConfig config, final String workName, final Work work) {
        onError(scope, config.retryLimit(), config.retryDelay(), config.retryResetTimeout(), workName, work);
    }

    /**
     * Runs {@code work}, restarting it after each error until the limit is reached.
     *
     * <p>
     * With a limit of {@code L} and an operation that always fails, {@code work}
     * is started {@code L + 1} times. A {@code work} that throws instead of
     * returning a future counts as a failed attempt.
     *
     * @param scope             cancelling it stops the loop and returns normally
     * @param retryLimit        retries allowed after the first attempt; negative retries forever
     * @param retryDelay        pause before each retry
     * @param retryResetTimeout error-free time after which the retry count resets
     * @param workName          name used in log lines and errors
     * @param work              starts one attempt
     * @throws RetryExhaustedException if an error arrives after {@code retryLimit} retries
     */
    public static void onError(
            final Scope scope,
            final int retryLimit,
            final Duration retryDelay,
            final Duration retryResetTimeout,
            final String workName,
            final Work work) {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(work, "work");
        RetryConfig config = new RetryConfig(retryLimit, retryDelay, retryResetTimeout);

        final long startNanos = System.nanoTime();
        final List<Throwable> failures = new ArrayList<>();
        int retryCount = 0;
        int attempts = 1;
        final CompletableFuture<Void> cancelled = scope.whenCancelled();
        CompletableFuture<Void> attempt = start(work);
        CompletableFuture<Object> race = CompletableFuture.anyOf(attempt, cancelled);

        while (true) {
            try {
                race.get(config.retryResetTimeout().toNanos(), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                if (retryCount > 0) {
                    log.debug("No error from {} for {}ms, resetting retry count", workName,
                            config.retryResetTimeout().toMillis());
                }
                retryCount = 0;
                failures.clear();
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ExecutionException | CancellationException e) {
                // Inspected below through the attempt future itself
            }

            if (scope.isCancelled()) {
                return;
            }
            if (!attempt.isCompletedExceptionally()) {
                log.warn("{} completed without error, not retrying", workName);
                return;
            }

            Throwable error = failureOf(attempt);
            if (!config.isUnbounded()) {
                failures.add(error);
            }
            if (!config.isUnbounded() && retryCount >= config.retryLimit()) {
                throw exhausted(workName, attempts, startNanos, failures);
            }

            log.warn("Retrying {} in {}ms (retry {} of {}) after error: {}",
                    workName,
                    config.retryDelay().toMillis(),
                    retryCount + 1,
                    config.isUnbounded() ? "unbounded" : config.retryLimit(),
                    error.toString());
            try {
                if (scope.await(config.retryDelay())) {
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            retryCount++;
            attempts++;
            attempt = start(work);
            race = CompletableFuture.anyOf(attempt, cancelled);
        }
    }

    private static CompletableFuture<Void> start(final Work work) {
        try {
            CompletableFuture<Void> attempt = work.start();
            if (attempt == null) {
                return CompletableFuture.failedFuture(new NullPointerException("work returned a null future"));
            }
            return attempt;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Throwable failureOf(final CompletableFuture<Void> attempt) {
        try {
            attempt.join();
            throw new IllegalStateException("attempt did not fail");
        } catch (CompletionException e) {
            return e.getCause() != null ? e.getCause() : e;
        } catch (CancellationException e) {
            return e;
        }
    }

    private static RetryExhaustedException exhausted(
            final String workName,
            final int attempts,
            final long startNanos,
            final List<Throwable> failures) {
        long totalMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        Throwable last = failures.get(failures.size() - 1);
        RetryExhaustedException exception = new RetryExhaustedException(
                workName + " failed after " + attempts + " attempts over " + totalMs + "ms",
                attempts,
                totalMs,
                last);
        for (int i = 0; i < failures.size() - 1; i++) {
            exception.addSuppressed(failures.get(i));
        }
        return exception;
    }
}
