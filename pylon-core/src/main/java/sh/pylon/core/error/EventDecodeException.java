// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core.error;

/**
 * Thrown by an event decoder when a payload is not an event of the decoder's type.
 *
 * <p>
 * Event streams routinely carry frames that belong to no decoder, such as the
 * acknowledgement of a subscribe request. Consumers skip such frames instead of
 * failing the stream.
 */
public final class EventDecodeException extends PylonException {

    public EventDecodeException(final String message) {
        super(message);
    }

    public EventDecodeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
