// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.events;

import sh.pylon.core.error.EventDecodeException;

/**
 * Decodes a raw event frame into a typed event.
 *
 * @param <T> the event type
 */
@FunctionalInterface
public interface EventDecoder<T> {

    /**
     * @param frame the raw frame as read from the socket
     * @return the decoded event, never null
     * @throws EventDecodeException if the frame is not an event of this type
     * @throws Exception            if the frame is malformed in any other way
     */
    T decode(byte[] frame) throws Exception;
}
