// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.tx;

import java.io.IOException;
import java.util.List;

/**
 * Chain-specific capabilities the transaction client relies on.
 *
 * <p>
 * A context knows the keyring, the transaction encoding and how to reach the
 * node over its request/response API. Signing and encoding are synchronous and
 * local; simulation, broadcast and query go to the node.
 */
public interface TxContext {

    /**
     * Resolves the bech32 address of a keyring entry.
     *
     * @throws IllegalArgumentException if no key of that name exists
     */
    String keyAddress(String keyName);

    TxBuilder newTxBuilder();

    /**
     * Simulates the messages as if signed by {@code keyName} and returns the gas used.
     */
    long simulateGas(String keyName, List<? extends TxMessage> messages) throws IOException;

    void sign(String keyName, TxBuilder builder);

    byte[] encode(TxBuilder builder);

    /**
     * Broadcasts in sync mode: returns once the node ran its admission check.
     */
    BroadcastResponse broadcast(byte[] txBytes) throws IOException;

    /**
     * Looks up a transaction by hash.
     *
     * @param txHash raw SHA-256 hash of the encoded transaction
     */
    TxQueryResult queryTx(byte[] txHash) throws IOException;
}
