// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.events;

import static sh.pylon.rpc.internal.RpcUtils.WS_SCHEMES;
import static sh.pylon.rpc.internal.RpcUtils.validateUrl;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.pylon.core.DebugLogger;
import sh.pylon.core.LogFormatter;
import sh.pylon.core.concurrent.PylonExecutors;
import sh.pylon.core.concurrent.Scope;
import sh.pylon.core.either.Either;
import sh.pylon.core.observable.Observable;
import sh.pylon.core.observable.ObservableSource;
import sh.pylon.core.observable.Observables;
import sh.pylon.rpc.exception.EventsConnectionClosedException;
import sh.pylon.rpc.exception.EventsDialException;
import sh.pylon.rpc.exception.EventsSubscribeException;

/**
 * {@link EventsQueryClient} opening one connection per query.
 *
 * <p>
 * On the first request for a query the client dials the node, sends a
 * JSON-RPC {@code subscribe} request and starts a reader that republishes
 * every frame. The subscription lives until the requesting scope is
 * cancelled, the connection fails, or the client is closed; a later request
 * for the same query then opens a fresh one.
 *
 * <pre>{@code
 * EventsQueryClient events = DefaultEventsQueryClient.create(dialer, "wss://node.example/websocket");
 * Observer<Either<byte[]>> blocks = events.eventsBytes(scope, "tm.event='NewBlock'").subscribe(scope);
 * }</pre>
 *
 * <p>
 * Thread-safe.
 *
 * @since 0.1.0
 */
public final class DefaultEventsQueryClient implements EventsQueryClient {

    private static final Logger log = LoggerFactory.getLogger(DefaultEventsQueryClient.class);

    private final Dialer dialer;
    private final URI uri;
    private final Executor executor;
    private final AtomicLong nextConnId = new AtomicLong(1);
    private final ReentrantLock lock = new ReentrantLock();
    // Guarded by lock
    private final Map<String, EventsBytesSubscription> subscriptions = new HashMap<>();

    private DefaultEventsQueryClient(final Dialer dialer, final URI uri, final Executor executor) {
        this.dialer = dialer;
        this.uri = uri;
        this.executor = executor;
    }

    /**
     * @param dialer opens connections
     * @param url    the node's WebSocket endpoint, {@code ws://} or {@code wss://}
     */
    public static DefaultEventsQueryClient create(final Dialer dialer, final String url) {
        return create(dialer, url, PylonExecutors.sharedIoExecutor());
    }

    /**
     * @param executor runs one blocking reader per live subscription
     */
    public static DefaultEventsQueryClient create(final Dialer dialer, final String url, final Executor executor) {
        Objects.requireNonNull(dialer, "dialer");
        Objects.requireNonNull(executor, "executor");
        return new DefaultEventsQueryClient(dialer, validateUrl(url, WS_SCHEMES), executor);
    }

    @Override
    public Observable<Either<byte[]>> eventsBytes(final Scope scope, final String query) {
        Objects.requireNonNull(scope, "scope");
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }

        final EventsBytesSubscription subscription;
        lock.lock();
        try {
            EventsBytesSubscription existing = subscriptions.get(query);
            if (existing != null) {
                return existing.source.observable();
            }
            subscription = openSubscription(scope, query);
            subscriptions.put(query, subscription);
        } finally {
            lock.unlock();
        }

        subscription.scope.onCancel(() -> closeSubscription(subscription));
        executor.execute(() -> publishEventsBytes(subscription));
        return subscription.source.observable();
    }

    /**
     * Dials and subscribes. Called with {@link #lock} held so concurrent
     * requests for one query cannot both open a socket.
     */
    private EventsBytesSubscription openSubscription(final Scope scope, final String query) {
        final long connId = nextConnId.getAndIncrement();
        final Connection connection;
        try {
            connection = dialer.dial(scope, uri);
        } catch (IOException e) {
            throw new EventsDialException(query, uri.getHost(), e);
        }

        try {
            connection.send(SubscribeRequest.forQuery(query).toJsonBytes());
        } catch (IOException | RuntimeException e) {
            EventsSubscribeException failure = new EventsSubscribeException(query, e);
            try {
                connection.close();
            } catch (IOException closeError) {
                failure.addSuppressed(closeError);
            }
            throw failure;
        }

        log.info("Subscribed to events query {} (conn {})", query, connId);
        DebugLogger.logEvents(LogFormatter.formatSubscribe(connId, query, uri.toString()));
        ObservableSource<Either<byte[]>> source = Observables.newObservable();
        return new EventsBytesSubscription(query, connId, connection, source, scope.child());
    }

    /**
     * Reads frames until the connection fails or the subscription is torn down.
     * Reading starts only once the observable has an observer.
     */
    private void publishEventsBytes(final EventsBytesSubscription subscription) {
        try {
            CompletableFuture.anyOf(
                    subscription.source.publisher().whenObserved(),
                    subscription.scope.whenCancelled()).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeSubscription(subscription);
            return;
        } catch (ExecutionException e) {
            log.debug("Events subscription {} ended before its first observer: {}",
                    subscription.connId, e.toString());
        }
        while (!subscription.scope.isCancelled()) {
            final byte[] frame;
            try {
                frame = subscription.connection.receive();
            } catch (IOException | RuntimeException e) {
                // A failed read caused by our own teardown is not worth reporting
                if (!subscription.scope.isCancelled()) {
                    log.warn("Events connection {} for query {} failed: {}",
                            subscription.connId, subscription.query, e.toString());
                    DebugLogger.logEvents(LogFormatter.formatEventsError(
                            subscription.connId, subscription.query, String.valueOf(e.getMessage())));
                    subscription.source.publisher().publish(Either.failure(new EventsConnectionClosedException(
                            subscription.query, "events connection " + subscription.connId + " failed", e)));
                }
                subscription.scope.cancel();
                return;
            }
            DebugLogger.logEvents(LogFormatter.formatEventReceived(subscription.connId, frame.length));
            subscription.source.publisher().publish(Either.success(frame));
        }
    }

    private void closeSubscription(final EventsBytesSubscription subscription) {
        lock.lock();
        try {
            // A newer subscription may already own this query
            if (subscriptions.get(subscription.query) == subscription) {
                subscriptions.remove(subscription.query);
            }
        } finally {
            lock.unlock();
        }

        if (!subscription.closed.compareAndSet(false, true)) {
            return;
        }
        subscription.scope.cancel();
        subscription.source.publisher().close();
        try {
            subscription.connection.close();
        } catch (IOException e) {
            log.debug("Error closing events connection {}: {}", subscription.connId, e.toString());
        }
        log.info("Unsubscribed from events query {} (conn {})", subscription.query, subscription.connId);
        DebugLogger.logEvents(LogFormatter.formatUnsubscribe(subscription.connId, subscription.query));
    }

    @Override
    public void close() {
        final List<EventsBytesSubscription> open;
        lock.lock();
        try {
            open = new ArrayList<>(subscriptions.values());
            subscriptions.clear();
        } finally {
            lock.unlock();
        }
        for (EventsBytesSubscription subscription : open) {
            closeSubscription(subscription);
        }
    }

    /**
     * @return number of live query subscriptions
     */
    int subscriptionCount() {
        lock.lock();
        try {
            return subscriptions.size();
        } finally {
            lock.unlock();
        }
    }

    private static final class EventsBytesSubscription {
        private final String query;
        private final long connId;
        private final Connection connection;
        private final ObservableSource<Either<byte[]>> source;
        private final Scope scope;
        private final AtomicBoolean closed = new AtomicBoolean(false);

        private EventsBytesSubscription(
                final String query,
                final long connId,
                final Connection connection,
                final ObservableSource<Either<byte[]>> source,
                final Scope scope) {
            this.query = query;
            this.connId = connId;
            this.connection = connection;
            this.source = source;
            this.scope = scope;
        }
    }
}
