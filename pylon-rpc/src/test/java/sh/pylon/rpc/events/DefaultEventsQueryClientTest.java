// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import sh.pylon.core.concurrent.Scope;
import sh.pylon.core.either.Either;
import sh.pylon.core.observable.Observable;
import sh.pylon.core.observable.Observer;
import sh.pylon.rpc.exception.EventsConnectionClosedException;
import sh.pylon.rpc.exception.EventsDialException;
import sh.pylon.rpc.exception.EventsSubscribeException;
import sh.pylon.rpc.internal.RpcUtils;
import sh.pylon.rpc.test.Await;
import sh.pylon.rpc.test.FakeConnection;
import sh.pylon.rpc.test.FakeDialer;

class DefaultEventsQueryClientTest {

    private static final String URL = "ws://localhost:26657/websocket";
    private static final String QUERY = "tm.event='NewBlock'";
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private FakeDialer dialer;
    private DefaultEventsQueryClient client;
    private Scope scope;

    @BeforeEach
    void setUp() {
        dialer = new FakeDialer();
        client = DefaultEventsQueryClient.create(dialer, URL);
        scope = Scope.root();
    }

    @AfterEach
    void tearDown() {
        scope.cancel();
        client.close();
    }

    @Test
    void sendsSubscribeRequestForQuery() throws Exception {
        client.eventsBytes(scope, QUERY);

        assertEquals(List.of(URI.create(URL)), dialer.dialedUris());
        List<String> sent = dialer.lastConnection().sentMessages();
        assertEquals(1, sent.size());
        JsonNode request = RpcUtils.MAPPER.readTree(sent.get(0));
        assertEquals("2.0", request.get("jsonrpc").asText());
        assertEquals("subscribe", request.get("method").asText());
        assertEquals(QUERY, request.path("params").path("query").asText());
        assertFalse(request.get("id").asText().isEmpty());
    }

    @Test
    void sameQueryIsDialedOnce() {
        Observable<Either<byte[]>> first = client.eventsBytes(scope, QUERY);
        Observable<Either<byte[]>> second = client.eventsBytes(scope, QUERY);

        assertSame(first, second);
        assertEquals(1, dialer.dialCount());
        assertEquals(1, client.subscriptionCount());
    }

    @Test
    void distinctQueriesGetDistinctConnections() {
        client.eventsBytes(scope, QUERY);
        client.eventsBytes(scope, "tm.event='Tx'");

        assertEquals(2, dialer.dialCount());
        assertEquals(2, client.subscriptionCount());
    }

    @Test
    void everySubscriberReceivesFramesInOrder() throws Exception {
        Observer<Either<byte[]>> first = client.eventsBytes(scope, "q1").subscribe(scope);
        Observer<Either<byte[]>> second = client.eventsBytes(scope, "q1").subscribe(scope);
        FakeConnection connection = dialer.lastConnection();

        for (int i = 0; i < 5; i++) {
            connection.push("message_" + i);
        }

        for (Observer<Either<byte[]>> observer : List.of(first, second)) {
            List<String> received = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                Either<byte[]> frame = observer.next(TIMEOUT).orElseThrow();
                received.add(new String(frame.optionalValue().orElseThrow(), StandardCharsets.UTF_8));
            }
            assertEquals(List.of("message_0", "message_1", "message_2", "message_3", "message_4"), received);
        }
        assertEquals(1, dialer.dialCount());

        assertThrows(TimeoutException.class, () -> first.next(Duration.ofMillis(50)));
        scope.cancel();
        assertEquals(Optional.empty(), first.next(TIMEOUT));
    }

    @Test
    void dialFailureIsReportedAndNothingIsKept() {
        dialer.failWith(new IOException("connection refused"));

        EventsDialException ex = assertThrows(EventsDialException.class, () -> client.eventsBytes(scope, QUERY));

        assertEquals(QUERY, ex.query());
        assertInstanceOf(IOException.class, ex.getCause());
        assertEquals(0, client.subscriptionCount());
    }

    @Test
    void sendFailureClosesConnection() {
        FakeConnection connection = new FakeConnection().failSendWith(new IOException("broken pipe"));
        dialer.nextConnection(connection);

        EventsSubscribeException ex =
                assertThrows(EventsSubscribeException.class, () -> client.eventsBytes(scope, QUERY));

        assertEquals("broken pipe", ex.getCause().getMessage());
        assertTrue(connection.isClosed());
        assertEquals(0, client.subscriptionCount());
    }

    @Test
    void framesReadBeforeTheFirstObserverAreNotLost() throws Exception {
        Observable<Either<byte[]>> events = client.eventsBytes(scope, QUERY);
        dialer.lastConnection().push("subscribe-ack");
        Thread.sleep(50);

        Observer<Either<byte[]>> observer = events.subscribe(scope);

        Either<byte[]> frame = observer.next(TIMEOUT).orElseThrow();
        assertEquals("subscribe-ack", new String(frame.optionalValue().orElseThrow(), StandardCharsets.UTF_8));
    }

    @Test
    void readErrorIsPublishedOnceThenSubscriptionCloses() throws Exception {
        Observer<Either<byte[]>> observer = client.eventsBytes(scope, QUERY).subscribe(scope);
        FakeConnection connection = dialer.lastConnection();

        connection.push("frame");
        connection.pushFailure(new IOException("reset by peer"));

        assertTrue(observer.next(TIMEOUT).orElseThrow().isSuccess());
        Either<byte[]> failure = observer.next(TIMEOUT).orElseThrow();
        assertTrue(failure.isFailure());
        EventsConnectionClosedException error = assertInstanceOf(
                EventsConnectionClosedException.class, failure.optionalError().orElseThrow());
        assertEquals("reset by peer", error.getCause().getMessage());

        assertEquals(Optional.empty(), observer.next(TIMEOUT));
        assertEquals(0, client.subscriptionCount());
        Await.until(connection::isClosed, TIMEOUT, "connection closed");
    }

    @Test
    void queryIsResubscribedAfterConnectionFailure() throws Exception {
        Observer<Either<byte[]>> observer = client.eventsBytes(scope, QUERY).subscribe(scope);
        dialer.lastConnection().pushFailure(new IOException("gone"));
        while (observer.next(TIMEOUT).isPresent()) {
            // drain until the failed subscription closes
        }

        client.eventsBytes(scope, QUERY);

        assertEquals(2, dialer.dialCount());
        assertEquals(1, client.subscriptionCount());
    }

    @Test
    void cancellingScopeTearsDownSubscription() throws Exception {
        Scope subscriptionScope = scope.child();
        Observer<Either<byte[]>> observer = client.eventsBytes(subscriptionScope, QUERY).subscribe(scope);
        FakeConnection connection = dialer.lastConnection();

        subscriptionScope.cancel();

        assertTrue(connection.isClosed());
        assertEquals(0, client.subscriptionCount());
        assertEquals(Optional.empty(), observer.next(TIMEOUT));
    }

    @Test
    void teardownDoesNotPublishReadError() throws Exception {
        Scope subscriptionScope = scope.child();
        Observer<Either<byte[]>> observer = client.eventsBytes(subscriptionScope, QUERY).subscribe(scope);

        subscriptionScope.cancel();

        // the reader fails on the closed connection but must stay silent
        assertEquals(Optional.empty(), observer.next(TIMEOUT));
    }

    @Test
    void closeTearsDownAllSubscriptionsAndIsIdempotent() throws Exception {
        Observer<Either<byte[]>> blocks = client.eventsBytes(scope, QUERY).subscribe(scope);
        Observer<Either<byte[]>> txs = client.eventsBytes(scope, "tm.event='Tx'").subscribe(scope);

        client.close();
        client.close();

        assertEquals(0, client.subscriptionCount());
        for (FakeConnection connection : dialer.connections()) {
            assertTrue(connection.isClosed());
            assertEquals(1, connection.closeCalls());
        }
        assertEquals(Optional.empty(), blocks.next(TIMEOUT));
        assertEquals(Optional.empty(), txs.next(TIMEOUT));
    }

    @Test
    void rejectsBlankQueryAndNonWebSocketUrl() {
        assertThrows(IllegalArgumentException.class, () -> client.eventsBytes(scope, " "));
        assertThrows(IllegalArgumentException.class,
                () -> DefaultEventsQueryClient.create(dialer, "http://localhost:26657"));
    }
}
