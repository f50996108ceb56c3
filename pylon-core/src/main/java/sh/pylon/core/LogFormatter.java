// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core;

/**
 * Formats Pylon's debug log lines.
 *
 * <h2>Conventions</h2>
 * <ul>
 * <li><b>Bracketed tags</b> - every line starts with {@code [OPERATION]}</li>
 * <li><b>Status symbols</b> - ✓ success, ✗ failure, ○ pending</li>
 * <li><b>Shortened hashes</b> - {@code a1b2c3...ef12}</li>
 * <li><b>Human-readable time</b> - {@code duration=1.50ms}</li>
 * </ul>
 *
 * <pre>{@code
 * DebugLogger.logTx(LogFormatter.formatTxSend(hash, gasLimit, fee, timeoutHeight, micros));
 * // [TX-SEND] hash=a1b2c3...ef12 gasLimit=120000 fee=120upokt timeoutHeight=105 duration=3.20ms
 * }</pre>
 *
 * <p>
 * All methods are pure and thread-safe.
 *
 * @see DebugLogger
 */
public final class LogFormatter {

    private static final int HASH_PREFIX_LENGTH = 6;

    private static final int HASH_SUFFIX_LENGTH = 4;

    private static final int HASH_SHORTEN_THRESHOLD = HASH_PREFIX_LENGTH + HASH_SUFFIX_LENGTH;

    private LogFormatter() {
    }

    /**
     * Format: [EVENTS-SUB] conn=3 query=tm.event='NewBlock' url=wss://node/websocket
     */
    public static String formatSubscribe(long connId, String query, String url) {
        return String.format("[EVENTS-SUB] conn=%d query=%s url=%s", connId, query, url);
    }

    /**
     * Format: [EVENTS-UNSUB] conn=3 query=tm.event='NewBlock'
     */
    public static String formatUnsubscribe(long connId, String query) {
        return String.format("[EVENTS-UNSUB] conn=%d query=%s", connId, query);
    }

    /**
     * Format: [EVENTS-RECV] conn=3 bytes=512
     */
    public static String formatEventReceived(long connId, int size) {
        return String.format("[EVENTS-RECV] conn=%d bytes=%d", connId, size);
    }

    /**
     * Format: ✗ [EVENTS-ERROR] conn=3 query=... message=connection reset
     */
    public static String formatEventsError(long connId, String query, String message) {
        return String.format("✗ [EVENTS-ERROR] conn=%d query=%s message=%s", connId, query, message);
    }

    /**
     * Format: [TX-SEND] hash=a1b2c3...ef12 gasLimit=120000 fee=120upokt timeoutHeight=105 duration=3.20ms
     */
    public static String formatTxSend(String hash, long gasLimit, Object fee, long timeoutHeight, long durationMicros) {
        return String.format(
                "[TX-SEND] hash=%s gasLimit=%d fee=%s timeoutHeight=%d %s",
                shortenHash(hash), gasLimit, fee, timeoutHeight, duration(durationMicros));
    }

    /**
     * Format: ✗ [TX-REJECTED] code=13 codespace=sdk log=insufficient fee
     */
    public static String formatTxRejected(long code, String codespace, String rawLog) {
        return String.format("✗ [TX-REJECTED] code=%d codespace=%s log=%s", code, codespace, rawLog);
    }

    /**
     * Format: ○ [TX-PENDING] hash=a1b2c3...ef12 timeoutHeight=105
     */
    public static String formatTxPending(String hash, long timeoutHeight) {
        return String.format("○ [TX-PENDING] hash=%s timeoutHeight=%d", shortenHash(hash), timeoutHeight);
    }

    /**
     * Format: ✓ [TX-COMMIT] hash=a1b2c3...ef12 height=101
     */
    public static String formatTxCommit(String hash, long height) {
        return String.format("✓ [TX-COMMIT] hash=%s height=%d", shortenHash(hash), height);
    }

    /**
     * Format: ✗ [TX-TIMEOUT] hash=a1b2c3...ef12 timeoutHeight=105 log=...
     */
    public static String formatTxTimeout(String hash, long timeoutHeight, String log) {
        return String.format("✗ [TX-TIMEOUT] hash=%s timeoutHeight=%d log=%s", shortenHash(hash), timeoutHeight, log);
    }

    private static String duration(long micros) {
        double ms = micros / 1000.0;
        String formatted;
        if (ms < 1000) {
            formatted = String.format("%.2fms", ms);
        } else {
            formatted = String.format("%.2fs", ms / 1000.0);
        }
        return "duration=" + formatted;
    }

    /**
     * Shortens a hash to {@code a1b2c3...ef12}. Values of up to
     * {@value #HASH_SHORTEN_THRESHOLD} characters are returned unchanged.
     */
    static String shortenHash(String fullHash) {
        if (fullHash == null || fullHash.length() <= HASH_SHORTEN_THRESHOLD) {
            return fullHash;
        }
        return fullHash.substring(0, HASH_PREFIX_LENGTH)
                + "..."
                + fullHash.substring(fullHash.length() - HASH_SUFFIX_LENGTH);
    }
}
