// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.tx;

import sh.pylon.core.concurrent.Scope;
import sh.pylon.core.either.AsyncError;

/**
 * Signs, broadcasts and follows transactions until they commit or time out.
 *
 * <p>
 * Each call returns an {@link AsyncError}. A failure before the transaction
 * reached the mempool is reported synchronously; otherwise the asynchronous
 * part completes normally on commit or exceptionally with a
 * {@link sh.pylon.rpc.exception.TxTimeoutException} once the timeout height
 * passes.
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * AsyncError result = txClient.signAndBroadcast(scope, msg);
 * if (result.isSync()) {
 *     throw result.syncError().get();
 * }
 * result.await(Duration.ofMinutes(1));
 * }</pre>
 */
public interface TxClient extends AutoCloseable {

    /**
     * Submits the messages with a timeout height derived from the latest block.
     */
    AsyncError signAndBroadcast(Scope scope, TxMessage... messages);

    /**
     * Submits the messages with an explicit timeout height.
     */
    AsyncError signAndBroadcastWithTimeoutHeight(Scope scope, long timeoutHeight, TxMessage... messages);

    /**
     * Stops following transactions. Outcomes of pending transactions are never delivered.
     */
    @Override
    void close();
}
