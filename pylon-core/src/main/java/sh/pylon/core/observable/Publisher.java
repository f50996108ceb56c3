// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core.observable;

import java.util.concurrent.CompletableFuture;

/**
 * The private write side of an observable, handed out only to its creator.
 *
 * @param <T> the value type
 */
public interface Publisher<T> extends AutoCloseable {

    /**
     * Delivers a value to every current observer.
     *
     * <p>
     * Never throws on a closed observable; the value is dropped instead.
     *
     * @param value the value; must not be null
     * @return {@code false} if the observable is closed and the value was dropped
     */
    boolean publish(T value);

    boolean isClosed();

    /**
     * Completes once the observable has its first observer, or once it closes.
     *
     * <p>
     * A producer that must not lose its first values waits on this before publishing.
     */
    CompletableFuture<Void> whenObserved();

    /**
     * Closes the observable, closing every observer.
     */
    @Override
    void close();
}
