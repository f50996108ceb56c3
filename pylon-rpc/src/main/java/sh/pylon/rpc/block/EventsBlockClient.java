// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.rpc.block;

import java.util.List;
import java.util.Objects;

import sh.pylon.core.concurrent.Scope;
import sh.pylon.core.observable.ReplayObservable;
import sh.pylon.rpc.events.DefaultEventsReplayClient;
import sh.pylon.rpc.events.EventsQueryClient;
import sh.pylon.rpc.events.EventsReplayClient;

/**
 * {@link BlockClient} fed by the node's {@code NewBlock} events.
 *
 * <pre>{@code
 * BlockClient blocks = EventsBlockClient.create(scope, eventsClient);
 * long height = blocks.lastBlock(scope).height();
 * }</pre>
 */
public final class EventsBlockClient implements BlockClient {

    /** Query selecting committed blocks. */
    public static final String NEW_BLOCK_QUERY = "tm.event='NewBlock'";

    /** Only the most recent block is replayed. */
    static final int REPLAY_BUFFER_SIZE = 1;

    private final EventsReplayClient<Block> replayClient;

    private EventsBlockClient(final EventsReplayClient<Block> replayClient) {
        this.replayClient = replayClient;
    }

    public static EventsBlockClient create(final Scope scope, final EventsQueryClient eventsClient) {
        Objects.requireNonNull(eventsClient, "eventsClient");
        return new EventsBlockClient(DefaultEventsReplayClient
                .builder(eventsClient, NEW_BLOCK_QUERY, Block::decode)
                .replayBufferSize(REPLAY_BUFFER_SIZE)
                .build(scope));
    }

    @Override
    public ReplayObservable<Block> committedBlocksSequence(final Scope scope) {
        return replayClient.eventsSequence(scope);
    }

    @Override
    public Block lastBlock(final Scope scope) throws InterruptedException {
        List<Block> last = replayClient.lastNEvents(scope, 1);
        if (last.isEmpty()) {
            throw new IllegalStateException("no block received before the block client stopped");
        }
        return last.get(0);
    }

    @Override
    public void close() {
        replayClient.close();
    }
}
