// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.exception;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import sh.pylon.core.error.TxException;

/**
 * Thrown when one or more transaction messages fail basic validation.
 *
 * <p>
 * All messages are validated before this is thrown. The failure of each
 * invalid message is attached as a {@linkplain #getSuppressed() suppressed}
 * exception, in message order.
 */
public final class InvalidMsgException extends TxException {

    private final List<Integer> invalidIndexes;

    /**
     * @param failures validation failure per message index, in index order
     */
    public InvalidMsgException(final Map<Integer, ? extends Throwable> failures) {
        super(describe(failures));
        this.invalidIndexes = List.copyOf(failures.keySet());
        failures.values().forEach(this::addSuppressed);
    }

    public InvalidMsgException(final String message) {
        super(message);
        this.invalidIndexes = List.of();
    }

    /**
     * @return indexes of the messages that failed validation
     */
    public List<Integer> invalidIndexes() {
        return invalidIndexes;
    }

    private static String describe(final Map<Integer, ? extends Throwable> failures) {
        return "invalid transaction messages: " + failures.entrySet().stream()
                .map(e -> "[" + e.getKey() + "] " + e.getValue().getMessage())
                .collect(Collectors.joining("; "));
    }
}
