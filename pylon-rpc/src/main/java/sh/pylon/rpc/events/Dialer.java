// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.events;

import java.io.IOException;
import java.net.URI;

import sh.pylon.core.concurrent.Scope;

/**
 * Opens message-framed connections to a node.
 *
 * <p>
 * The seam between the event clients and the network. The default
 * implementation is {@link WebSocketDialer}; tests substitute an in-memory one.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Dialer {

    /**
     * Opens a connection to {@code uri}.
     *
     * @param scope cancelling it aborts a dial in progress
     * @param uri   the node endpoint
     * @return an open connection
     * @throws IOException if the connection could not be established
     */
    Connection dial(Scope scope, URI uri) throws IOException;
}
