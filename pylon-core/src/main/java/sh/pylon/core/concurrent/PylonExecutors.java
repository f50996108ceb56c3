// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core.concurrent;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory methods for the executors that run Pylon's background tasks.
 *
 * <p>
 * Subscription readers, stream pumps and retry loops spend nearly all of their
 * time parked on a blocking read, so they run on an unbounded cached pool of
 * daemon threads. A pool that is never shut down therefore never keeps the JVM
 * alive.
 *
 * <pre>{@code
 * ExecutorService exec = PylonExecutors.newIoBoundExecutor("events-reader");
 * exec.execute(() -> pumpFrames(connection));
 * }</pre>
 *
 * @since 0.1.0
 */
public final class PylonExecutors {

    private static final AtomicInteger IO_THREAD_ID = new AtomicInteger(0);

    private PylonExecutors() {
        // Utility class
    }

    /**
     * Returns the process-wide executor used when a client is not given one.
     *
     * @return the shared I/O-bound executor
     */
    public static ExecutorService sharedIoExecutor() {
        return SharedHolder.INSTANCE;
    }

    /**
     * Creates an executor for blocking, I/O-bound work with a custom thread name prefix.
     *
     * @param namePrefix prefix for thread names; a {@code -N} suffix is appended
     * @return a cached thread pool of daemon threads
     */
    public static ExecutorService newIoBoundExecutor(final String namePrefix) {
        if (namePrefix == null || namePrefix.isBlank()) {
            throw new IllegalArgumentException("namePrefix must not be blank");
        }
        return Executors.newCachedThreadPool(r -> {
            // Mask off sign bit to ensure non-negative thread IDs even after integer overflow
            int id = IO_THREAD_ID.getAndIncrement() & 0x7FFFFFFF;
            Thread t = new Thread(r, namePrefix + "-" + id);
            t.setDaemon(true);
            return t;
        });
    }

    private static final class SharedHolder {
        private static final ExecutorService INSTANCE = newIoBoundExecutor("pylon-shared-io");
    }
}
