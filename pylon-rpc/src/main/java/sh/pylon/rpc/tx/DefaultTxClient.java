// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.tx;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.pylon.core.DebugLogger;
import sh.pylon.core.LogFormatter;
import sh.pylon.core.concurrent.PylonExecutors;
import sh.pylon.core.concurrent.Scope;
import sh.pylon.core.either.AsyncError;
import sh.pylon.core.observable.Observables;
import sh.pylon.core.util.Hex;
import sh.pylon.rpc.block.Block;
import sh.pylon.rpc.block.BlockClient;
import sh.pylon.rpc.events.DefaultEventsReplayClient;
import sh.pylon.rpc.events.EventsQueryClient;
import sh.pylon.rpc.events.EventsReplayClient;
import sh.pylon.rpc.exception.CheckTxException;
import sh.pylon.rpc.exception.InvalidMsgException;
import sh.pylon.rpc.exception.TxSubmitException;
import sh.pylon.rpc.exception.TxSubmitException.Stage;
import sh.pylon.rpc.exception.TxTimeoutException;

/**
 * {@link TxClient} that follows its own transactions over the events API.
 *
 * <p>
 * On start the client subscribes to every transaction sent by its signing
 * address and to committed blocks. A broadcast transaction is tracked as
 * pending, keyed by hash and indexed by timeout height, until one of two
 * things happens:
 * <ul>
 *   <li>a matching transaction event arrives: the outcome completes normally</li>
 *   <li>a block at or past its timeout height arrives: the node is queried for
 *       the transaction log and the outcome completes with a
 *       {@link TxTimeoutException}</li>
 * </ul>
 * Whichever comes first removes the transaction, so each outcome is delivered
 * at most once.
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * try (Scope scope = Scope.root()) {
 *     TxClient txClient = DefaultTxClient.builder(txContext, eventsClient, blockClient)
 *             .config(TxClientConfig.defaults("supplier1"))
 *             .build(scope);
 *     AsyncError result = txClient.signAndBroadcast(scope, stakeMsg);
 *     result.await(Duration.ofMinutes(2));
 * }
 * }</pre>
 *
 * <p>
 * <strong>Thread Safety:</strong> all methods may be called concurrently.
 */
public final class DefaultTxClient implements TxClient {

    private static final Logger log = LoggerFactory.getLogger(DefaultTxClient.class);

    private final TxContext txContext;
    private final BlockClient blockClient;
    private final TxClientConfig config;
    private final Scope scope;
    private final EventsReplayClient<TxEvent> txEvents;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, PendingTx> pendingByHash = new HashMap<>();
    private final TreeMap<Long, Set<String>> pendingByTimeoutHeight = new TreeMap<>();

    private record PendingTx(String hash, long timeoutHeight, CompletableFuture<Void> outcome) {}

    private DefaultTxClient(final Builder builder, final Scope parent) {
        this.txContext = builder.txContext;
        this.blockClient = builder.blockClient;
        this.config = builder.config;
        final String signingAddress = txContext.keyAddress(config.signingKeyName());
        this.scope = parent.child();

        this.txEvents = DefaultEventsReplayClient
                .builder(builder.eventsClient, TxEvent.senderQuery(signingAddress), TxEvent::decode)
                .replayBufferSize(1)
                .connRetryLimit(config.connRetryLimit())
                .executor(builder.executor)
                .build(scope);

        Observables.forEach(scope, txEvents.eventsSequence(scope), this::onTxCommitted, builder.executor);
        Observables.forEach(scope, blockClient.committedBlocksSequence(scope), this::onBlockCommitted,
                builder.executor);
        log.info("Transaction client started for {} ({})", config.signingKeyName(), signingAddress);
    }

    /**
     * @param txContext    signing, encoding and node queries
     * @param eventsClient source of the own-transaction subscription; shared, never closed by this client
     * @param blockClient  committed blocks; shared, never closed by this client
     */
    public static Builder builder(
            final TxContext txContext,
            final EventsQueryClient eventsClient,
            final BlockClient blockClient) {
        return new Builder(txContext, eventsClient, blockClient);
    }

    @Override
    public AsyncError signAndBroadcast(final Scope scope, final TxMessage... messages) {
        return submit(scope, messages, null);
    }

    @Override
    public AsyncError signAndBroadcastWithTimeoutHeight(
            final Scope scope, final long timeoutHeight, final TxMessage... messages) {
        if (timeoutHeight <= 0) {
            return AsyncError.sync(new TxSubmitException(Stage.BUILD,
                    "timeout height must be > 0, got: " + timeoutHeight));
        }
        return submit(scope, messages, timeoutHeight);
    }

    private AsyncError submit(
            final Scope callScope, final TxMessage[] messages, final @Nullable Long explicitTimeoutHeight) {
        Objects.requireNonNull(callScope, "scope");
        Objects.requireNonNull(messages, "messages");
        final long start = System.nanoTime();

        final List<TxMessage> msgs = List.of(messages);
        InvalidMsgException invalid = validateMessages(msgs);
        if (invalid != null) {
            return AsyncError.sync(invalid);
        }

        final String keyName = config.signingKeyName();
        final long gasLimit;
        try {
            gasLimit = adjustGas(txContext.simulateGas(keyName, msgs));
        } catch (IOException | RuntimeException e) {
            return AsyncError.sync(new TxSubmitException(Stage.SIMULATE, "failed to simulate transaction", e));
        }

        final long timeoutHeight;
        if (explicitTimeoutHeight != null) {
            timeoutHeight = explicitTimeoutHeight;
        } else {
            try {
                timeoutHeight = blockClient.lastBlock(callScope).height() + config.commitTimeoutHeightOffset();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return AsyncError.sync(new TxSubmitException(Stage.BUILD,
                        "interrupted while waiting for the latest block", e));
            } catch (RuntimeException e) {
                return AsyncError.sync(new TxSubmitException(Stage.BUILD, "latest block height unavailable", e));
            }
        }

        final Coin fee = config.gasPrice().feeFor(gasLimit);
        final TxBuilder txBuilder;
        try {
            txBuilder = txContext.newTxBuilder();
            txBuilder.setMessages(msgs);
            txBuilder.setGasLimit(gasLimit);
            txBuilder.setFeeAmount(fee);
            txBuilder.setTimeoutHeight(timeoutHeight);
        } catch (RuntimeException e) {
            return AsyncError.sync(new TxSubmitException(Stage.BUILD, "failed to build transaction", e));
        }
        try {
            txContext.sign(keyName, txBuilder);
        } catch (RuntimeException e) {
            return AsyncError.sync(new TxSubmitException(Stage.SIGN, "failed to sign transaction", e));
        }
        try {
            txBuilder.validateBasic();
        } catch (RuntimeException e) {
            return AsyncError.sync(new TxSubmitException(Stage.VALIDATE, "signed transaction is invalid", e));
        }
        final byte[] txBytes;
        try {
            txBytes = txContext.encode(txBuilder);
        } catch (RuntimeException e) {
            return AsyncError.sync(new TxSubmitException(Stage.ENCODE, "failed to encode transaction", e));
        }

        final BroadcastResponse response;
        try {
            response = txContext.broadcast(txBytes);
        } catch (IOException | RuntimeException e) {
            return AsyncError.sync(new TxSubmitException(Stage.BROADCAST, "failed to broadcast transaction", e));
        }
        if (!response.isAccepted()) {
            DebugLogger.logTx(LogFormatter.formatTxRejected(response.code(), response.codespace(), response.rawLog()));
            return AsyncError.sync(new CheckTxException(response.code(), response.codespace(), response.rawLog()));
        }

        final String hash;
        try {
            hash = Hex.normalize(response.txHash());
        } catch (IllegalArgumentException e) {
            return AsyncError.sync(new TxSubmitException(Stage.BROADCAST,
                    "node returned a malformed transaction hash", e));
        }
        CompletableFuture<Void> outcome = addPendingTransaction(hash, timeoutHeight);
        DebugLogger.logTx(LogFormatter.formatTxSend(
                hash, gasLimit, fee, timeoutHeight, (System.nanoTime() - start) / 1_000));
        return AsyncError.async(outcome);
    }

    private static @Nullable InvalidMsgException validateMessages(final List<TxMessage> msgs) {
        if (msgs.isEmpty()) {
            return new InvalidMsgException("at least one message is required");
        }
        Map<Integer, RuntimeException> failures = new LinkedHashMap<>();
        for (int i = 0; i < msgs.size(); i++) {
            try {
                msgs.get(i).validateBasic();
            } catch (RuntimeException e) {
                failures.put(i, e);
            }
        }
        return failures.isEmpty() ? null : new InvalidMsgException(failures);
    }

    private long adjustGas(final long simulatedGas) {
        return BigDecimal.valueOf(simulatedGas)
                .multiply(BigDecimal.valueOf(config.gasAdjustment()))
                .setScale(0, RoundingMode.CEILING)
                .longValueExact();
    }

    /**
     * Starts tracking a broadcast transaction.
     *
     * <p>
     * Registering a hash that is already pending returns the existing outcome.
     */
    CompletableFuture<Void> addPendingTransaction(final String hash, final long timeoutHeight) {
        lock.lock();
        try {
            PendingTx existing = pendingByHash.get(hash);
            if (existing != null) {
                return existing.outcome();
            }
            PendingTx pending = new PendingTx(hash, timeoutHeight, new CompletableFuture<>());
            pendingByHash.put(hash, pending);
            pendingByTimeoutHeight.computeIfAbsent(timeoutHeight, h -> new LinkedHashSet<>()).add(hash);
            DebugLogger.logTx(LogFormatter.formatTxPending(hash, timeoutHeight));
            return pending.outcome();
        } finally {
            lock.unlock();
        }
    }

    int pendingCount() {
        lock.lock();
        try {
            return pendingByHash.size();
        } finally {
            lock.unlock();
        }
    }

    private void onTxCommitted(final TxEvent event) {
        final PendingTx pending;
        lock.lock();
        try {
            pending = pendingByHash.remove(event.hash());
            if (pending != null) {
                Set<String> atHeight = pendingByTimeoutHeight.get(pending.timeoutHeight());
                if (atHeight != null) {
                    atHeight.remove(pending.hash());
                    if (atHeight.isEmpty()) {
                        pendingByTimeoutHeight.remove(pending.timeoutHeight());
                    }
                }
            }
        } finally {
            lock.unlock();
        }
        if (pending == null) {
            log.debug("Ignoring commit of untracked transaction {}", event.hash());
            return;
        }
        DebugLogger.logTx(LogFormatter.formatTxCommit(event.hash(), event.height()));
        pending.outcome().complete(null);
    }

    private void onBlockCommitted(final Block block) {
        final List<PendingTx> expired = new ArrayList<>();
        lock.lock();
        try {
            NavigableMap<Long, Set<String>> due = pendingByTimeoutHeight.headMap(block.height(), true);
            for (Set<String> hashes : due.values()) {
                for (String hash : hashes) {
                    PendingTx pending = pendingByHash.remove(hash);
                    if (pending != null) {
                        expired.add(pending);
                    }
                }
            }
            due.clear();
        } finally {
            lock.unlock();
        }
        for (PendingTx pending : expired) {
            TxTimeoutException timeout = timeoutError(pending);
            DebugLogger.logTx(LogFormatter.formatTxTimeout(pending.hash(), pending.timeoutHeight(), timeout.txLog()));
            pending.outcome().completeExceptionally(timeout);
        }
    }

    private TxTimeoutException timeoutError(final PendingTx pending) {
        try {
            TxQueryResult result = txContext.queryTx(Hex.decode(pending.hash()));
            return new TxTimeoutException(pending.hash(), pending.timeoutHeight(), result.log());
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to query status of timed out transaction {}: {}", pending.hash(), e.toString());
            return new TxTimeoutException(pending.hash(), pending.timeoutHeight(),
                    "transaction status unavailable", e);
        }
    }

    @Override
    public void close() {
        if (!scope.cancel()) {
            return;
        }
        lock.lock();
        try {
            if (!pendingByHash.isEmpty()) {
                log.info("Closing transaction client with {} pending transactions", pendingByHash.size());
            }
            pendingByHash.clear();
            pendingByTimeoutHeight.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Builder for {@link DefaultTxClient}.
     */
    public static final class Builder {
        private final TxContext txContext;
        private final EventsQueryClient eventsClient;
        private final BlockClient blockClient;
        private @Nullable TxClientConfig config;
        private Executor executor = PylonExecutors.sharedIoExecutor();

        private Builder(final TxContext txContext, final EventsQueryClient eventsClient, final BlockClient blockClient) {
            this.txContext = Objects.requireNonNull(txContext, "txContext");
            this.eventsClient = Objects.requireNonNull(eventsClient, "eventsClient");
            this.blockClient = Objects.requireNonNull(blockClient, "blockClient");
        }

        public Builder config(TxClientConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /**
         * Shortcut for {@code config(TxClientConfig.defaults(signingKeyName))}.
         */
        public Builder signingKeyName(String signingKeyName) {
            return config(TxClientConfig.defaults(signingKeyName));
        }

        /**
         * @param executor runs the event loops of the client
         */
        public Builder executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        /**
         * Creates the client and starts following transactions and blocks.
         *
         * @param scope cancelling it closes the client
         * @throws IllegalStateException    if no configuration was given
         * @throws IllegalArgumentException if the signing key is unknown to the context
         */
        public DefaultTxClient build(Scope scope) {
            Objects.requireNonNull(scope, "scope");
            if (config == null) {
                throw new IllegalStateException("config (or signingKeyName) is required");
            }
            return new DefaultTxClient(this, scope);
        }
    }
}
