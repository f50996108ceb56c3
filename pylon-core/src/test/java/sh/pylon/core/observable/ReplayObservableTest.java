// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core.observable;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.Test;

import sh.pylon.core.concurrent.Scope;

class ReplayObservableTest {

    private static final Duration WAIT = Duration.ofSeconds(2);

    @Test
    void lateObserverReceivesBacklogBeforeLiveValues() throws Exception {
        Scope scope = Scope.root();
        ReplaySource<Integer> source = Observables.newReplayObservable(scope, 5);
        for (int i = 0; i < 3; i++) {
            source.publisher().publish(i);
        }

        Observer<Integer> late = source.observable().subscribe(scope);
        source.publisher().publish(3);

        for (int i = 0; i < 4; i++) {
            assertEquals(Optional.of(i), late.next(WAIT));
        }
        scope.cancel();
    }

    @Test
    void backlogKeepsOnlyTheMostRecentValues() throws Exception {
        Scope scope = Scope.root();
        int size = 3;
        ReplaySource<Integer> source = Observables.newReplayObservable(scope, size);
        for (int i = 0; i <= size; i++) {
            source.publisher().publish(i);
        }

        Observer<Integer> late = source.observable().subscribe(scope);

        assertEquals(Optional.of(1), late.next(WAIT));
        assertEquals(Optional.of(2), late.next(WAIT));
        assertEquals(Optional.of(3), late.next(WAIT));
        assertThrows(TimeoutException.class, () -> late.next(Duration.ofMillis(50)));
        scope.cancel();
    }

    @Test
    void lastReturnsMostRecentValuesWithoutConsumingThem() throws Exception {
        Scope scope = Scope.root();
        ReplaySource<String> source = Observables.newReplayObservable(scope, 4);
        Observer<String> observer = source.observable().subscribe(scope);
        source.publisher().publish("a");
        source.publisher().publish("b");
        source.publisher().publish("c");

        assertEquals(List.of("b", "c"), source.observable().last(scope, 2));
        assertEquals(List.of("a", "b", "c"), source.observable().last(scope, 3));
        assertEquals(Optional.of("a"), observer.next(WAIT));
        scope.cancel();
    }

    @Test
    void lastClampsToReplayBufferSize() throws Exception {
        Scope scope = Scope.root();
        ReplaySource<String> source = Observables.newReplayObservable(scope, 2);
        source.publisher().publish("a");
        source.publisher().publish("b");
        source.publisher().publish("c");

        assertEquals(List.of("b", "c"), source.observable().last(scope, 10));
        scope.cancel();
    }

    @Test
    void lastBlocksUntilFirstPublish() throws Exception {
        Scope scope = Scope.root();
        ReplaySource<String> source = Observables.newReplayObservable(scope, 2);

        CompletableFuture<List<String>> last = CompletableFuture.supplyAsync(() -> {
            try {
                return source.observable().last(scope, 1);
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(100);
        assertFalse(last.isDone());

        source.publisher().publish("first");

        assertEquals(List.of("first"), last.get(5, TimeUnit.SECONDS));
        scope.cancel();
    }

    @Test
    void lastReturnsEmptyWhenScopeCancelledWhileWaiting() throws Exception {
        Scope scope = Scope.root();
        Scope waitScope = scope.child();
        ReplaySource<String> source = Observables.newReplayObservable(scope, 2);

        CompletableFuture<List<String>> last = CompletableFuture.supplyAsync(() -> {
            try {
                return source.observable().last(waitScope, 1);
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(50);
        waitScope.cancel();

        assertEquals(List.of(), last.get(5, TimeUnit.SECONDS));
        scope.cancel();
    }

    @Test
    void cancellingOwningScopeUnsubscribesAll() throws Exception {
        Scope owner = Scope.root();
        Scope observerScope = Scope.root();
        ReplaySource<String> source = Observables.newReplayObservable(owner, 2);
        Observer<String> observer = source.observable().subscribe(observerScope);

        owner.cancel();

        assertTrue(observer.isClosed());
        assertEquals(Optional.empty(), observer.next(WAIT));
        observerScope.cancel();
    }

    @Test
    void rejectsNonPositiveSizes() {
        Scope scope = Scope.root();
        assertThrows(IllegalArgumentException.class, () -> Observables.newReplayObservable(scope, 0));
        ReplaySource<String> source = Observables.newReplayObservable(scope, 1);
        assertThrows(IllegalArgumentException.class, () -> source.observable().last(scope, 0));
        scope.cancel();
    }
}
