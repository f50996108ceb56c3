// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.test;

import java.time.Duration;
import java.util.function.BooleanSupplier;

public final class Await {

    private Await() {}

    /**
     * Polls {@code condition} until it holds, failing the test after {@code timeout}.
     */
    public static void until(BooleanSupplier condition, Duration timeout, String description)
            throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("timed out waiting for: " + description);
            }
            Thread.sleep(5);
        }
    }
}
