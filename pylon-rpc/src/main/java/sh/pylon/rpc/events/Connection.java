// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.events;

import java.io.Closeable;
import java.io.IOException;

/**
 * A bidirectional, message-framed connection.
 *
 * <p>
 * {@link #send} and {@link #receive} may be called from different threads.
 * Closing the connection makes a blocked {@link #receive} fail.
 */
public interface Connection extends Closeable {

    /**
     * Sends one message.
     *
     * @throws IOException if the message could not be written
     */
    void send(byte[] message) throws IOException;

    /**
     * Blocks until the next message arrives.
     *
     * @return the message payload
     * @throws IOException if the connection failed or was closed
     */
    byte[] receive() throws IOException;

    /**
     * Closes the connection. Idempotent.
     */
    @Override
    void close() throws IOException;
}
