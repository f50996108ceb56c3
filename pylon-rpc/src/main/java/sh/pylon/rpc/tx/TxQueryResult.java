// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.tx;

/**
 * A transaction as found by {@link TxContext#queryTx(byte[])}.
 *
 * @param txHash the transaction hash (hex)
 * @param height inclusion height, 0 if not included
 * @param code   execution result code
 * @param log    execution log
 */
public record TxQueryResult(String txHash, long height, long code, String log) {

    public TxQueryResult {
        log = log == null ? "" : log;
    }
}
