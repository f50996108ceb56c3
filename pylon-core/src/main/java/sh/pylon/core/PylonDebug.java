// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core;

/**
 * Global toggle for verbose debug logging across Pylon modules.
 *
 * <p>Thread safety: the individual flags are volatile. The compound check in
 * {@link #isEnabled()} is not atomic, which is acceptable for best-effort
 * logging.
 */
public final class PylonDebug {

    private static volatile boolean eventsLogging = false;
    private static volatile boolean txLogging = false;

    private PylonDebug() {
    }

    /**
     * @return true if either events or transaction logging is enabled
     */
    public static boolean isEnabled() {
        return eventsLogging || txLogging;
    }

    public static void setEnabled(final boolean enabled) {
        eventsLogging = enabled;
        txLogging = enabled;
    }

    public static void setEventsLogging(final boolean enabled) {
        eventsLogging = enabled;
    }

    public static boolean isEventsLoggingEnabled() {
        return eventsLogging;
    }

    public static void setTxLogging(final boolean enabled) {
        txLogging = enabled;
    }

    public static boolean isTxLoggingEnabled() {
        return txLogging;
    }
}
