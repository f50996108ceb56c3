// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core.error;

/**
 * Base runtime exception for all Pylon failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * PylonException
 * ├── {@link EventDecodeException} - event payload could not be decoded
 * ├── {@link EventsException} - event subscription transport failures
 * ├── {@link RetryExhaustedException} - a retried operation gave up
 * └── {@link TxException} - transaction submission and lifecycle failures
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * AsyncError result = txClient.signAndBroadcast(scope, msg);
 * try {
 *     result.await(Duration.ofMinutes(1));
 * } catch (TxException e) {
 *     // Rejected, failed to build, or timed out
 * } catch (PylonException e) {
 *     // Catch-all for any other Pylon error
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class PylonException extends RuntimeException
        permits EventDecodeException,
        EventsException,
        RetryExhaustedException,
        TxException {

    public PylonException(final String message) {
        super(message);
    }

    public PylonException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
