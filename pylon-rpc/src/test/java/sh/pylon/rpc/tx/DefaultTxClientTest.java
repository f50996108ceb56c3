// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.tx;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.pylon.core.concurrent.Scope;
import sh.pylon.core.either.AsyncError;
import sh.pylon.core.either.Either;
import sh.pylon.core.observable.Publisher;
import sh.pylon.core.util.Hex;
import sh.pylon.rpc.exception.CheckTxException;
import sh.pylon.rpc.exception.InvalidMsgException;
import sh.pylon.rpc.exception.TxSubmitException;
import sh.pylon.rpc.exception.TxTimeoutException;
import sh.pylon.rpc.test.Await;
import sh.pylon.rpc.test.EventFrames;
import sh.pylon.rpc.test.FakeBlockClient;
import sh.pylon.rpc.test.FakeEventsQueryClient;

@ExtendWith(MockitoExtension.class)
class DefaultTxClientTest {

    private static final String KEY_NAME = "supplier1";
    private static final String ADDRESS = "pokt1supplier1address";
    private static final byte[] TX_BYTES = "signed-tx".getBytes(StandardCharsets.UTF_8);
    private static final String TX_HASH = TxEvent.hash(TX_BYTES);
    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final Duration QUIET = Duration.ofMillis(100);

    @Mock
    private TxContext txContext;
    @Mock
    private TxBuilder txBuilder;
    @Mock
    private TxMessage msg;

    private FakeEventsQueryClient eventsClient;
    private FakeBlockClient blockClient;
    private Scope scope;
    private DefaultTxClient client;
    private Publisher<Either<byte[]>> txFrames;

    @BeforeEach
    void setUp() throws Exception {
        when(txContext.keyAddress(KEY_NAME)).thenReturn(ADDRESS);
        lenient().when(txContext.newTxBuilder()).thenReturn(txBuilder);
        lenient().when(txContext.simulateGas(eq(KEY_NAME), anyList())).thenReturn(100_000L);
        lenient().when(txContext.encode(txBuilder)).thenReturn(TX_BYTES);
        lenient().when(txContext.broadcast(TX_BYTES))
                .thenReturn(new BroadcastResponse(TX_HASH.toUpperCase(), 0, "", ""));
        lenient().when(msg.typeUrl()).thenReturn("/cosmos.bank.v1beta1.MsgSend");

        eventsClient = new FakeEventsQueryClient();
        blockClient = new FakeBlockClient();
        blockClient.commit(100);
        scope = Scope.root();
        client = DefaultTxClient.builder(txContext, eventsClient, blockClient)
                .config(TxClientConfig.defaults(KEY_NAME))
                .build(scope);
        txFrames = eventsClient.awaitSubscribers(TxEvent.senderQuery(ADDRESS), 1, TIMEOUT);
    }

    @AfterEach
    void tearDown() {
        client.close();
        scope.cancel();
        blockClient.close();
    }

    private void commitTx(byte[] txBytes, long height) {
        txFrames.publish(Either.success(EventFrames.tx(txBytes, height, 0, "")));
    }

    @Test
    void buildsTransactionFromSimulationAndLatestBlock() throws Exception {
        AsyncError result = client.signAndBroadcast(scope, msg);

        assertFalse(result.isSync());
        verify(txBuilder).setMessages(List.of(msg));
        verify(txBuilder).setGasLimit(150_000L);
        verify(txBuilder).setFeeAmount(Coin.of(150, "upokt"));
        verify(txBuilder).setTimeoutHeight(105L);
        verify(txContext).sign(KEY_NAME, txBuilder);
        verify(txBuilder).validateBasic();
    }

    @Test
    void commitEventCompletesOutcome() throws Exception {
        AsyncError result = client.signAndBroadcast(scope, msg);

        commitTx(TX_BYTES, 101);

        result.await(TIMEOUT);
        assertTrue(result.asyncError().isDone());
        assertFalse(result.asyncError().isCompletedExceptionally());
        assertEquals(0, client.pendingCount());
    }

    @Test
    void commitEventsOfOtherTransactionsAreIgnored() throws Exception {
        AsyncError result = client.signAndBroadcast(scope, msg);

        commitTx("someone-else".getBytes(StandardCharsets.UTF_8), 101);
        Thread.sleep(QUIET.toMillis());

        assertFalse(result.asyncError().isDone());
        assertEquals(1, client.pendingCount());
    }

    @Test
    void explicitTimeoutHeightIsUsedAsIs() throws Exception {
        client.signAndBroadcastWithTimeoutHeight(scope, 200, msg);

        verify(txBuilder).setTimeoutHeight(200L);
    }

    @Test
    void timesOutExactlyOnceWhenTimeoutHeightIsReached() throws Exception {
        when(txContext.queryTx(any())).thenReturn(new TxQueryResult(TX_HASH, 0, 0, "tx not found"));
        AsyncError result = client.signAndBroadcast(scope, msg);

        for (long height = 101; height < 105; height++) {
            blockClient.commit(height);
        }
        Thread.sleep(QUIET.toMillis());
        assertFalse(result.asyncError().isDone());

        blockClient.commit(105);
        TxTimeoutException timeout = assertThrows(TxTimeoutException.class, () -> result.await(TIMEOUT));
        assertEquals(TX_HASH, timeout.txHash());
        assertEquals(105, timeout.timeoutHeight());
        assertEquals("tx not found", timeout.txLog());

        blockClient.commit(106);
        commitTx(TX_BYTES, 106);
        Thread.sleep(QUIET.toMillis());
        verify(txContext, times(1)).queryTx(Hex.decode(TX_HASH));
        assertEquals(0, client.pendingCount());
    }

    @Test
    void skippedHeightsStillExpireOlderTransactions() throws Exception {
        when(txContext.queryTx(any())).thenReturn(new TxQueryResult(TX_HASH, 0, 0, ""));
        AsyncError result = client.signAndBroadcastWithTimeoutHeight(scope, 102, msg);

        blockClient.commit(110);

        assertThrows(TxTimeoutException.class, () -> result.await(TIMEOUT));
    }

    @Test
    void failedStatusQueryStillTimesOut() throws Exception {
        when(txContext.queryTx(any())).thenThrow(new IOException("node unavailable"));
        AsyncError result = client.signAndBroadcastWithTimeoutHeight(scope, 101, msg);

        blockClient.commit(101);

        TxTimeoutException timeout = assertThrows(TxTimeoutException.class, () -> result.await(TIMEOUT));
        assertInstanceOf(IOException.class, timeout.getCause());
    }

    @Test
    void invalidMessagesAreAllReportedBeforeAnyNetworkCall(
            @Mock TxMessage first, @Mock TxMessage second) throws Exception {
        doThrow(new IllegalArgumentException("empty amount")).when(first).validateBasic();
        doThrow(new IllegalArgumentException("bad address")).when(second).validateBasic();

        AsyncError result = client.signAndBroadcast(scope, first, msg, second);

        assertTrue(result.isSync());
        InvalidMsgException error = assertInstanceOf(InvalidMsgException.class, result.syncError().orElseThrow());
        assertEquals(List.of(0, 2), error.invalidIndexes());
        assertEquals(2, error.getSuppressed().length);
        assertTrue(error.getMessage().contains("[0] empty amount"));
        assertTrue(error.getMessage().contains("[2] bad address"));
        verify(txContext, never()).simulateGas(any(), anyList());
        verify(txContext, never()).broadcast(any());
    }

    @Test
    void emptyMessageListIsInvalid() {
        AsyncError result = client.signAndBroadcast(scope);

        assertInstanceOf(InvalidMsgException.class, result.syncError().orElseThrow());
    }

    @Test
    void rejectedBroadcastIsReportedSynchronously() throws Exception {
        when(txContext.broadcast(TX_BYTES)).thenReturn(new BroadcastResponse(TX_HASH, 13, "sdk", "insufficient fee"));

        AsyncError result = client.signAndBroadcast(scope, msg);

        CheckTxException error = assertInstanceOf(CheckTxException.class, result.syncError().orElseThrow());
        assertEquals(13, error.code());
        assertEquals("sdk", error.codespace());
        assertEquals("insufficient fee", error.rawLog());
        assertEquals(0, client.pendingCount());
    }

    @Test
    void simulationFailureStopsBeforeSigning() throws Exception {
        when(txContext.simulateGas(eq(KEY_NAME), anyList())).thenThrow(new IOException("out of gas"));

        AsyncError result = client.signAndBroadcast(scope, msg);

        TxSubmitException error = assertInstanceOf(TxSubmitException.class, result.syncError().orElseThrow());
        assertEquals(TxSubmitException.Stage.SIMULATE, error.stage());
        verify(txContext, never()).sign(any(), any());
    }

    @Test
    void signingFailureIsReportedWithStage() throws Exception {
        doThrow(new IllegalArgumentException("key locked")).when(txContext).sign(KEY_NAME, txBuilder);

        AsyncError result = client.signAndBroadcast(scope, msg);

        TxSubmitException error = assertInstanceOf(TxSubmitException.class, result.syncError().orElseThrow());
        assertEquals(TxSubmitException.Stage.SIGN, error.stage());
        verify(txContext, never()).broadcast(any());
    }

    @Test
    void broadcastFailureIsReportedWithStage() throws Exception {
        when(txContext.broadcast(TX_BYTES)).thenThrow(new IOException("connection refused"));

        AsyncError result = client.signAndBroadcast(scope, msg);

        TxSubmitException error = assertInstanceOf(TxSubmitException.class, result.syncError().orElseThrow());
        assertEquals(TxSubmitException.Stage.BROADCAST, error.stage());
        assertEquals("connection refused", error.getCause().getMessage());
    }

    @Test
    void registeringSameHashTwiceReturnsSameOutcome() {
        CompletableFuture<Void> first = client.addPendingTransaction(TX_HASH, 110);
        CompletableFuture<Void> second = client.addPendingTransaction(TX_HASH, 120);

        assertSame(first, second);
        assertEquals(1, client.pendingCount());
    }

    @Test
    void racingCommitsAndTimeoutsDeliverEachOutcomeOnce() throws Exception {
        lenient().when(txContext.queryTx(any())).thenReturn(new TxQueryResult("", 0, 0, "expired"));
        int count = 50;
        List<byte[]> txs = new ArrayList<>();
        List<CompletableFuture<Void>> outcomes = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            byte[] tx = ("tx-" + i).getBytes(StandardCharsets.UTF_8);
            txs.add(tx);
            outcomes.add(client.addPendingTransaction(TxEvent.hash(tx), 101));
        }

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            pool.submit(() -> {
                start.await();
                txs.forEach(tx -> commitTx(tx, 101));
                return null;
            });
            pool.submit(() -> {
                start.await();
                blockClient.commit(101);
                return null;
            });
            start.countDown();

            Await.until(() -> outcomes.stream().allMatch(CompletableFuture::isDone), TIMEOUT, "all outcomes");
        } finally {
            pool.shutdownNow();
            pool.awaitTermination(1, TimeUnit.SECONDS);
        }

        long timedOut = outcomes.stream().filter(CompletableFuture::isCompletedExceptionally).count();
        verify(txContext, times((int) timedOut)).queryTx(any());
        assertEquals(0, client.pendingCount());
    }

    @Test
    void unknownSigningKeyFailsConstruction() {
        when(txContext.keyAddress("missing")).thenThrow(new IllegalArgumentException("key not found: missing"));

        assertThrows(IllegalArgumentException.class, () -> DefaultTxClient.builder(txContext, eventsClient, blockClient)
                .signingKeyName("missing")
                .build(scope));
    }

    @Test
    void closeAbandonsPendingTransactions() throws Exception {
        AsyncError result = client.signAndBroadcast(scope, msg);

        client.close();
        blockClient.commit(200);
        Thread.sleep(QUIET.toMillis());

        assertFalse(result.asyncError().isDone());
        assertEquals(0, client.pendingCount());
        assertFalse(eventsClient.isClosed());
    }
}
