// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core.error;

/**
 * Thrown when a retried operation keeps failing after its retry limit.
 *
 * <p>
 * The {@linkplain #getCause() cause} is the error of the final attempt. Errors
 * of earlier attempts are attached as {@linkplain #getSuppressed() suppressed}
 * exceptions in the order they occurred.
 *
 * <pre>{@code
 * try {
 *     Retry.onError(scope, RetryConfig.builder().retryLimit(3).build(), "publishEvents", work);
 * } catch (RetryExhaustedException e) {
 *     log.error("gave up after {} attempts over {}ms", e.getAttemptCount(), e.getTotalRetryDurationMs());
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class RetryExhaustedException extends PylonException {

    private final int attemptCount;
    private final long totalRetryDurationMs;

    /**
     * @param message              description of the operation that gave up
     * @param attemptCount         number of attempts made, including the first
     * @param totalRetryDurationMs time from the first attempt until giving up
     * @param cause                the error of the last attempt
     */
    public RetryExhaustedException(
            final String message,
            final int attemptCount,
            final long totalRetryDurationMs,
            final Throwable cause) {
        super(message, cause);
        this.attemptCount = attemptCount;
        this.totalRetryDurationMs = totalRetryDurationMs;
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public long getTotalRetryDurationMs() {
        return totalRetryDurationMs;
    }
}
