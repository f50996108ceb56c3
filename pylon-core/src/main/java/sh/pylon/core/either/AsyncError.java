// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core.either;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * The two-shot result of an operation that can fail now or later.
 *
 * <p>
 * Either holds a <em>synchronous</em> error, meaning the operation failed
 * before it got going, or a handle to the <em>asynchronous</em> outcome. The
 * handle is a future that completes normally on success and exceptionally
 * with the eventual error.
 *
 * <p>
 * Callers check the synchronous error first, then wait on the handle once:
 *
 * <pre>{@code
 * AsyncError result = txClient.signAndBroadcast(scope, msg);
 * Optional<Throwable> rejected = result.syncError();
 * if (rejected.isPresent()) {
 *     ...
 * }
 * result.asyncError().get(); // throws ExecutionException on timeout
 * }</pre>
 *
 * @since 0.1.0
 */
public final class AsyncError {

    private final Either<CompletableFuture<Void>> either;

    private AsyncError(final Either<CompletableFuture<Void>> either) {
        this.either = either;
    }

    /**
     * @param error the error that prevented the operation from starting
     * @return a synchronous failure
     */
    public static AsyncError sync(final Throwable error) {
        return new AsyncError(Either.failure(Objects.requireNonNull(error, "error")));
    }

    /**
     * @param outcome completes normally on success, exceptionally on failure
     * @return a handle to the asynchronous outcome
     */
    public static AsyncError async(final CompletableFuture<Void> outcome) {
        return new AsyncError(Either.success(Objects.requireNonNull(outcome, "outcome")));
    }

    public Either<CompletableFuture<Void>> either() {
        return either;
    }

    public boolean isSync() {
        return either.isFailure();
    }

    public Optional<Throwable> syncError() {
        return either.optionalError();
    }

    /**
     * Returns the handle to the asynchronous outcome.
     *
     * @return the outcome future
     * @throws IllegalStateException if this holds a synchronous error
     */
    public CompletableFuture<Void> asyncError() {
        return either.optionalValue()
                .orElseThrow(() -> new IllegalStateException(
                        "synchronous error present", either.optionalError().orElse(null)));
    }

    /**
     * Waits for the outcome, rethrowing whichever error occurred.
     *
     * <p>
     * Unchecked errors are rethrown as-is; checked ones are wrapped in a
     * {@link CompletionException}.
     *
     * @param timeout maximum time to wait for the asynchronous outcome
     * @throws InterruptedException if interrupted while waiting
     * @throws TimeoutException     if the outcome is not known within the timeout
     */
    public void await(final Duration timeout) throws InterruptedException, TimeoutException {
        if (either instanceof Either.Failure<CompletableFuture<Void>> failure) {
            throw unchecked(failure.error());
        }
        try {
            asyncError().get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw unchecked(e.getCause());
        }
    }

    private static RuntimeException unchecked(final Throwable error) {
        if (error instanceof RuntimeException runtime) {
            return runtime;
        }
        return new CompletionException(error);
    }

    @Override
    public String toString() {
        return isSync()
                ? "AsyncError[sync=" + either.optionalError().orElse(null) + "]"
                : "AsyncError[async]";
    }
}
