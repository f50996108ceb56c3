// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core.observable;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * A single subscriber's delivery handle on an {@link Observable}.
 *
 * <p>
 * Values are buffered per observer, so a slow observer never delays the
 * others. The observer closes when its subscription scope is cancelled, when
 * it is {@linkplain #unsubscribe() unsubscribed}, or when the observable
 * {@linkplain Observable#unsubscribeAll() unsubscribes everyone}. Values
 * buffered before closing can still be drained.
 *
 * <pre>{@code
 * Observer<Block> blocks = blockClient.committedBlocksSequence(scope).subscribe(scope);
 * Optional<Block> next;
 * while ((next = blocks.next()).isPresent()) {
 *     onBlock(next.get());
 * }
 * }</pre>
 *
 * @param <T> the value type
 * @since 0.1.0
 */
public interface Observer<T> extends AutoCloseable {

    /**
     * Blocks until the next value is available.
     *
     * @return the next value, or empty once the observer is closed and drained
     * @throws InterruptedException if interrupted while waiting
     */
    Optional<T> next() throws InterruptedException;

    /**
     * Blocks until the next value is available or the timeout elapses.
     *
     * @param timeout maximum time to wait
     * @return the next value, or empty once the observer is closed and drained
     * @throws InterruptedException if interrupted while waiting
     * @throws TimeoutException     if no value arrived and the observer is still open
     */
    Optional<T> next(Duration timeout) throws InterruptedException, TimeoutException;

    /**
     * @return {@code true} once no further values will be delivered
     */
    boolean isClosed();

    /**
     * Stops delivery to this observer. Other observers are unaffected.
     * Idempotent.
     */
    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
