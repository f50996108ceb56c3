// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.tx;

import java.util.Objects;

/**
 * Result of a sync-mode broadcast.
 *
 * @param txHash    the transaction hash as reported by the node (hex)
 * @param code      admission result code; 0 means accepted
 * @param codespace module namespace of a non-zero code
 * @param rawLog    admission log
 */
public record BroadcastResponse(String txHash, long code, String codespace, String rawLog) {

    public BroadcastResponse {
        Objects.requireNonNull(txHash, "txHash");
        codespace = codespace == null ? "" : codespace;
        rawLog = rawLog == null ? "" : rawLog;
    }

    public boolean isAccepted() {
        return code == 0;
    }
}
