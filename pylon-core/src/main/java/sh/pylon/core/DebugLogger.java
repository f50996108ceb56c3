// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger writing to the {@code sh.pylon.debug} SLF4J logger.
 *
 * <p>
 * Every line passes through {@link LogSanitizer} before it is written.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.pylon.debug");

    private DebugLogger() {
    }

    public static void logEvents(final String message, final Object... args) {
        if (!PylonDebug.isEventsLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logTx(final String message, final Object... args) {
        if (!PylonDebug.isTxLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!PylonDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
