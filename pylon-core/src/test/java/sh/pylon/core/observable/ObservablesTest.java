// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core.observable;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import sh.pylon.core.concurrent.Scope;

class ObservablesTest {

    private static final Duration WAIT = Duration.ofSeconds(2);

    @Test
    void mapTransformsAndSkipsValues() throws Exception {
        Scope scope = Scope.root();
        ObservableSource<Integer> source = Observables.newObservable();
        Observable<String> evens = Observables.map(scope, source.observable(),
                i -> i % 2 == 0 ? Optional.of("even-" + i) : Optional.empty());
        Observer<String> observer = evens.subscribe(scope);

        for (int i = 0; i < 5; i++) {
            source.publisher().publish(i);
        }

        assertEquals(Optional.of("even-0"), observer.next(WAIT));
        assertEquals(Optional.of("even-2"), observer.next(WAIT));
        assertEquals(Optional.of("even-4"), observer.next(WAIT));
        scope.cancel();
    }

    @Test
    void mappedObservableClosesWithSource() throws Exception {
        Scope scope = Scope.root();
        ObservableSource<Integer> source = Observables.newObservable();
        Observable<Integer> doubled = Observables.map(scope, source.observable(), i -> Optional.of(i * 2));
        Observer<Integer> observer = doubled.subscribe(scope);

        source.publisher().publish(21);
        source.publisher().close();

        assertEquals(Optional.of(42), observer.next(WAIT));
        assertEquals(Optional.empty(), observer.next(WAIT));
        scope.cancel();
    }

    @Test
    void mapReplayReplaysMappedValues() throws Exception {
        Scope scope = Scope.root();
        ObservableSource<Integer> source = Observables.newObservable();
        ReplayObservable<String> mapped =
                Observables.mapReplay(scope, 2, source.observable(), i -> Optional.of("v" + i));

        source.publisher().publish(1);
        source.publisher().publish(2);
        source.publisher().publish(3);

        // last() waits for the pump to deliver at least one value
        List<String> recent = mapped.last(scope, 2);
        assertTrue(recent.size() >= 1);
        assertEquals(List.of("v2", "v3"), awaitLast(scope, mapped, List.of("v2", "v3")));
        scope.cancel();
    }

    @Test
    void forEachRunsUntilScopeCancelled() throws Exception {
        Scope scope = Scope.root();
        ObservableSource<String> source = Observables.newObservable();
        List<String> seen = new CopyOnWriteArrayList<>();

        CompletableFuture<Void> loop = Observables.forEach(scope, source.observable(), value -> {
            if ("bad".equals(value)) {
                throw new IllegalArgumentException("rejected");
            }
            seen.add(value);
        });
        source.publisher().publish("one");
        source.publisher().publish("bad");
        source.publisher().publish("two");

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (seen.size() < 2 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        scope.cancel();

        loop.get(5, TimeUnit.SECONDS);
        assertEquals(List.of("one", "two"), seen);
    }

    private static List<String> awaitLast(Scope scope, ReplayObservable<String> observable, List<String> expected)
            throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        List<String> last = observable.last(scope, expected.size());
        while (!last.equals(expected) && System.nanoTime() < deadline) {
            Thread.sleep(10);
            last = observable.last(scope, expected.size());
        }
        return last;
    }
}
