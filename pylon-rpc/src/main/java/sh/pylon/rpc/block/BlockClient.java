// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.block;

import sh.pylon.core.concurrent.Scope;
import sh.pylon.core.observable.ReplayObservable;

/**
 * Tracks the chain's committed blocks.
 *
 * @since 0.1.0
 */
public interface BlockClient extends AutoCloseable {

    /**
     * @return committed blocks in order; a new observer first receives the latest known block
     */
    ReplayObservable<Block> committedBlocksSequence(Scope scope);

    /**
     * Returns the latest committed block, waiting for the first one if none is known yet.
     *
     * @throws InterruptedException  if interrupted while waiting
     * @throws IllegalStateException if the scope was cancelled or the client closed before any block arrived
     */
    Block lastBlock(Scope scope) throws InterruptedException;

    @Override
    void close();
}
