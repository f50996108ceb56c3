// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for {@link Retry#onError}.
 *
 * <ul>
 *   <li>{@code retryLimit} - retries allowed after the first attempt; negative retries forever (default: -1)</li>
 *   <li>{@code retryDelay} - pause before each retry (default: 1s)</li>
 *   <li>{@code retryResetTimeout} - error-free time after which the retry count goes back to zero (default: 10s)</li>
 * </ul>
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * RetryConfig bounded = RetryConfig.builder()
 *     .retryLimit(5)
 *     .retryDelay(Duration.ofMillis(500))
 *     .build();
 * }</pre>
 *
 * @param retryLimit        maximum retries; negative for unbounded
 * @param retryDelay        delay before each retry (must be &gt;= 0)
 * @param retryResetTimeout quiet period resetting the retry count (must be &gt; 0)
 * @see Retry
 * @since 0.1.0
 */
public record RetryConfig(int retryLimit, Duration retryDelay, Duration retryResetTimeout) {

    /** Default retry limit: unbounded. */
    public static final int DEFAULT_RETRY_LIMIT = -1;

    /** Default retry delay: 1s. */
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);

    /** Default reset timeout: 10s. */
    public static final Duration DEFAULT_RETRY_RESET_TIMEOUT = Duration.ofSeconds(10);

    public RetryConfig {
        Objects.requireNonNull(retryDelay, "retryDelay");
        Objects.requireNonNull(retryResetTimeout, "retryResetTimeout");
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must be >= 0, got: " + retryDelay);
        }
        if (retryResetTimeout.isNegative() || retryResetTimeout.isZero()) {
            throw new IllegalArgumentException("retryResetTimeout must be > 0, got: " + retryResetTimeout);
        }
    }

    /**
     * @return unbounded retries, 1s delay, 10s reset
     */
    public static RetryConfig defaults() {
        return new RetryConfig(DEFAULT_RETRY_LIMIT, DEFAULT_RETRY_DELAY, DEFAULT_RETRY_RESET_TIMEOUT);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return {@code true} if the limit is negative
     */
    public boolean isUnbounded() {
        return retryLimit < 0;
    }

    /**
     * Builder for {@link RetryConfig}. All values start at their defaults.
     */
    public static final class Builder {
        private int retryLimit = DEFAULT_RETRY_LIMIT;
        private Duration retryDelay = DEFAULT_RETRY_DELAY;
        private Duration retryResetTimeout = DEFAULT_RETRY_RESET_TIMEOUT;

        private Builder() {}

        public Builder retryLimit(int retryLimit) {
            this.retryLimit = retryLimit;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder retryResetTimeout(Duration retryResetTimeout) {
            this.retryResetTimeout = retryResetTimeout;
            return this;
        }

        public RetryConfig build() {
            return new RetryConfig(retryLimit, retryDelay, retryResetTimeout);
        }
    }
}
