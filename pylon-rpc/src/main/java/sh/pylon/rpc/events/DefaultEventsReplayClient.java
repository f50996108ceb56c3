// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.events;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.pylon.core.concurrent.PylonExecutors;
import sh.pylon.core.concurrent.Scope;
import sh.pylon.core.either.Either;
import sh.pylon.core.error.EventDecodeException;
import sh.pylon.core.error.EventsException;
import sh.pylon.core.error.RetryExhaustedException;
import sh.pylon.core.observable.Observable;
import sh.pylon.core.observable.Observables;
import sh.pylon.core.observable.Observer;
import sh.pylon.core.observable.ReplayObservable;
import sh.pylon.core.observable.ReplaySource;
import sh.pylon.core.retry.Retry;
import sh.pylon.core.retry.RetryConfig;
import sh.pylon.rpc.exception.EventsConnectionClosedException;

/**
 * {@link EventsReplayClient} decoding the frames of an {@link EventsQueryClient}.
 *
 * <p>
 * The client subscribes under {@link Retry#onError}: whenever the underlying
 * subscription reports an error or closes, it waits {@code retryDelay} and
 * subscribes again. Once {@code connRetryLimit} consecutive attempts have
 * failed, the stream is closed for good. The default limit of {@code -1}
 * reconnects forever.
 *
 * <pre>{@code
 * EventsReplayClient<TxEvent> txs = DefaultEventsReplayClient
 *         .builder(eventsClient, "tm.event='Tx'", TxEvent::decode)
 *         .replayBufferSize(16)
 *         .connRetryLimit(10)
 *         .build(scope);
 * List<TxEvent> latest = txs.lastNEvents(scope, 3);
 * }</pre>
 *
 * @param <T> the event type
 * @since 0.1.0
 */
public final class DefaultEventsReplayClient<T> implements EventsReplayClient<T> {

    private static final Logger log = LoggerFactory.getLogger(DefaultEventsReplayClient.class);

    /** Default connection retry limit: unbounded. */
    public static final int DEFAULT_CONN_RETRY_LIMIT = RetryConfig.DEFAULT_RETRY_LIMIT;

    private final EventsQueryClient eventsClient;
    private final String query;
    private final EventDecoder<T> decoder;
    private final RetryConfig retryConfig;
    private final Executor executor;
    private final Scope scope;
    private final ReplaySource<T> sequence;

    private DefaultEventsReplayClient(final Builder<T> builder, final Scope parent) {
        this.eventsClient = builder.eventsClient;
        this.query = builder.query;
        this.decoder = builder.decoder;
        this.retryConfig = new RetryConfig(builder.connRetryLimit, builder.retryDelay, builder.retryResetTimeout);
        this.executor = builder.executor;
        this.scope = parent.child();
        this.sequence = Observables.newReplayObservable(scope, builder.replayBufferSize);
    }

    /**
     * @param eventsClient source of raw frames; shared, never closed by this client
     * @param query        the event query
     * @param decoder      turns a frame into an event
     */
    public static <T> Builder<T> builder(
            final EventsQueryClient eventsClient,
            final String query,
            final EventDecoder<T> decoder) {
        return new Builder<>(eventsClient, query, decoder);
    }

    /**
     * Creates and starts a client with default retry settings.
     */
    public static <T> DefaultEventsReplayClient<T> create(
            final Scope scope,
            final EventsQueryClient eventsClient,
            final String query,
            final EventDecoder<T> decoder,
            final int replayBufferSize) {
        return builder(eventsClient, query, decoder).replayBufferSize(replayBufferSize).build(scope);
    }

    private void start() {
        executor.execute(this::publishEvents);
    }

    private void publishEvents() {
        try {
            Retry.onError(scope, retryConfig, "publishEvents(" + query + ")", this::subscribeAndDecode);
        } catch (RetryExhaustedException e) {
            log.error("Giving up on events query {} after {} attempts", query, e.getAttemptCount(), e.getCause());
            sequence.observable().unsubscribeAll();
        }
    }

    /**
     * One subscription attempt. The returned future fails when the
     * subscription reports an error or closes while the client is still open.
     */
    private CompletableFuture<Void> subscribeAndDecode() {
        final Scope attemptScope = scope.child();
        final Observable<Either<byte[]>> frames;
        try {
            frames = eventsClient.eventsBytes(attemptScope, query);
        } catch (EventsException e) {
            attemptScope.cancel();
            return CompletableFuture.failedFuture(e);
        }

        final Observer<Either<byte[]>> observer = frames.subscribe(attemptScope);
        final CompletableFuture<Void> attempt = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                Optional<Either<byte[]>> next;
                while ((next = observer.next()).isPresent()) {
                    Either<byte[]> frame = next.get();
                    if (frame instanceof Either.Failure<byte[]> failure) {
                        attempt.completeExceptionally(failure.error());
                        return;
                    }
                    frame.optionalValue().ifPresent(this::decodeAndPublish);
                }
                if (!scope.isCancelled()) {
                    attempt.completeExceptionally(
                            new EventsConnectionClosedException(query, "events subscription closed"));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                attempt.completeExceptionally(e);
            } finally {
                attemptScope.cancel();
            }
        });
        return attempt;
    }

    private void decodeAndPublish(final byte[] frame) {
        final T event;
        try {
            event = decoder.decode(frame);
        } catch (EventDecodeException e) {
            log.debug("Skipping frame on {}: {}", query, e.getMessage());
            return;
        } catch (Exception e) {
            log.warn("Failed to decode frame on {}, skipping: {}", query, e.toString());
            return;
        }
        if (event == null) {
            log.warn("Decoder for {} returned null, skipping frame", query);
            return;
        }
        sequence.publisher().publish(event);
    }

    @Override
    public ReplayObservable<T> eventsSequence(final Scope scope) {
        return sequence.observable();
    }

    @Override
    public List<T> lastNEvents(final Scope scope, final int n) throws InterruptedException {
        return sequence.observable().last(scope, n);
    }

    @Override
    public void close() {
        scope.cancel();
    }

    /**
     * Builder for {@link DefaultEventsReplayClient}.
     */
    public static final class Builder<T> {
        private final EventsQueryClient eventsClient;
        private final String query;
        private final EventDecoder<T> decoder;
        private int replayBufferSize = 1;
        private int connRetryLimit = DEFAULT_CONN_RETRY_LIMIT;
        private Duration retryDelay = RetryConfig.DEFAULT_RETRY_DELAY;
        private Duration retryResetTimeout = RetryConfig.DEFAULT_RETRY_RESET_TIMEOUT;
        private Executor executor = PylonExecutors.sharedIoExecutor();

        private Builder(final EventsQueryClient eventsClient, final String query, final EventDecoder<T> decoder) {
            this.eventsClient = Objects.requireNonNull(eventsClient, "eventsClient");
            this.decoder = Objects.requireNonNull(decoder, "decoder");
            if (query == null || query.isBlank()) {
                throw new IllegalArgumentException("query must not be blank");
            }
            this.query = query;
        }

        /**
         * @param replayBufferSize events replayed to new observers (default: 1)
         */
        public Builder<T> replayBufferSize(int replayBufferSize) {
            this.replayBufferSize = replayBufferSize;
            return this;
        }

        /**
         * @param connRetryLimit reconnect attempts before giving up; negative reconnects forever (default: -1)
         */
        public Builder<T> connRetryLimit(int connRetryLimit) {
            this.connRetryLimit = connRetryLimit;
            return this;
        }

        /**
         * @param retryDelay pause before each reconnect (default: 1s)
         */
        public Builder<T> retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        /**
         * @param retryResetTimeout error-free time after which the reconnect count resets (default: 10s)
         */
        public Builder<T> retryResetTimeout(Duration retryResetTimeout) {
            this.retryResetTimeout = retryResetTimeout;
            return this;
        }

        /**
         * @param executor runs the reconnect loop and the frame decoder
         */
        public Builder<T> executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        /**
         * Creates the client and starts subscribing.
         *
         * @param scope cancelling it closes the client
         */
        public DefaultEventsReplayClient<T> build(Scope scope) {
            Objects.requireNonNull(scope, "scope");
            DefaultEventsReplayClient<T> client = new DefaultEventsReplayClient<>(this, scope);
            client.start();
            return client;
        }
    }
}
