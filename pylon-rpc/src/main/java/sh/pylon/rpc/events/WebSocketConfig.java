// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.events;

import java.time.Duration;
import java.util.Objects;

import io.netty.channel.EventLoopGroup;
import org.jspecify.annotations.Nullable;

/**
 * Configuration for {@link WebSocketDialer}.
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * WebSocketConfig config = WebSocketConfig.builder()
 *         .connectTimeout(Duration.ofSeconds(5))
 *         .maxFrameSize(4 * 1024 * 1024)
 *         .build();
 *
 * try (WebSocketDialer dialer = WebSocketDialer.create(config)) {
 *     ...
 * }
 * }</pre>
 *
 * @param connectTimeout time allowed for TCP connect plus WebSocket handshake
 * @param writeTimeout   time allowed for a single frame write
 * @param maxFrameSize   largest (aggregated) frame accepted, in bytes. Default: 10MB,
 *                       since CometBFT block events can be large. Maximum: 64MB.
 * @param ioThreads      number of Netty I/O threads when the dialer creates its own group
 * @param eventLoopGroup optional externally managed event loop group; the dialer
 *                       never shuts down a group it did not create
 * @since 0.1.0
 */
public record WebSocketConfig(
        Duration connectTimeout,
        Duration writeTimeout,
        int maxFrameSize,
        int ioThreads,
        @Nullable EventLoopGroup eventLoopGroup) {

    /** Default connect timeout: 10s. */
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    /** Default write timeout: 10s. */
    public static final Duration DEFAULT_WRITE_TIMEOUT = Duration.ofSeconds(10);

    /** Default max frame size: 10MB. */
    public static final int DEFAULT_MAX_FRAME_SIZE = 10 * 1024 * 1024;

    /** Upper bound for {@code maxFrameSize}: 64MB. */
    public static final int MAX_FRAME_SIZE_LIMIT = 64 * 1024 * 1024;

    /** Default I/O threads: 1. */
    public static final int DEFAULT_IO_THREADS = 1;

    public WebSocketConfig {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(writeTimeout, "writeTimeout");
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive, got: " + connectTimeout);
        }
        if (writeTimeout.isNegative() || writeTimeout.isZero()) {
            throw new IllegalArgumentException("writeTimeout must be positive, got: " + writeTimeout);
        }
        if (maxFrameSize <= 0 || maxFrameSize > MAX_FRAME_SIZE_LIMIT) {
            throw new IllegalArgumentException(
                    "maxFrameSize must be in (0, " + MAX_FRAME_SIZE_LIMIT + "], got: " + maxFrameSize);
        }
        if (ioThreads < 1) {
            throw new IllegalArgumentException("ioThreads must be at least 1, got: " + ioThreads);
        }
    }

    public static WebSocketConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link WebSocketConfig}. All values start at their defaults.
     */
    public static final class Builder {
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration writeTimeout = DEFAULT_WRITE_TIMEOUT;
        private int maxFrameSize = DEFAULT_MAX_FRAME_SIZE;
        private int ioThreads = DEFAULT_IO_THREADS;
        private @Nullable EventLoopGroup eventLoopGroup;

        private Builder() {}

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder writeTimeout(Duration writeTimeout) {
            this.writeTimeout = writeTimeout;
            return this;
        }

        public Builder maxFrameSize(int maxFrameSize) {
            this.maxFrameSize = maxFrameSize;
            return this;
        }

        public Builder ioThreads(int ioThreads) {
            this.ioThreads = ioThreads;
            return this;
        }

        /**
         * Uses an existing event loop group instead of creating one.
         * The caller remains responsible for shutting it down.
         */
        public Builder eventLoopGroup(@Nullable EventLoopGroup eventLoopGroup) {
            this.eventLoopGroup = eventLoopGroup;
            return this;
        }

        public WebSocketConfig build() {
            return new WebSocketConfig(connectTimeout, writeTimeout, maxFrameSize, ioThreads, eventLoopGroup);
        }
    }
}
