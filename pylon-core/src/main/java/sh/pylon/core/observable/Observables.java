// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core.observable;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.pylon.core.concurrent.PylonExecutors;
import sh.pylon.core.concurrent.Scope;

/**
 * Factories and combinators for {@link Observable}s.
 *
 * <pre>{@code
 * ReplaySource<Block> blocks = Observables.newReplayObservable(scope, 1);
 * blocks.publisher().publish(block);
 *
 * Observable<Long> heights = Observables.map(scope, blocks.observable(), b -> Optional.of(b.height()));
 * Observables.forEach(scope, heights, h -> log.info("height {}", h));
 * }</pre>
 *
 * @since 0.1.0
 */
public final class Observables {

    private static final Logger log = LoggerFactory.getLogger(Observables.class);

    /**
     * Values an observer may hold before further publishes to it are dropped.
     */
    public static final int DEFAULT_OBSERVER_BUFFER_SIZE = 1024;

    private Observables() {
        // Utility class
    }

    public static <T> ObservableSource<T> newObservable() {
        return newObservable(DEFAULT_OBSERVER_BUFFER_SIZE);
    }

    /**
     * @param observerBufferSize values each observer may buffer before drops occur
     */
    public static <T> ObservableSource<T> newObservable(final int observerBufferSize) {
        ChannelObservable<T> observable = new ChannelObservable<>(observerBufferSize);
        return new ObservableSource<>(observable, observable.publisher());
    }

    /**
     * Creates a replay observable bound to {@code scope}: cancelling the scope
     * unsubscribes every observer.
     *
     * @param scope            bounds the observable's lifetime
     * @param replayBufferSize number of recent values replayed to new observers
     */
    public static <T> ReplaySource<T> newReplayObservable(final Scope scope, final int replayBufferSize) {
        Objects.requireNonNull(scope, "scope");
        ReplayChannelObservable<T> observable =
                new ReplayChannelObservable<>(replayBufferSize, DEFAULT_OBSERVER_BUFFER_SIZE);
        scope.onCancel(observable::unsubscribeAll);
        return new ReplaySource<>(observable, observable.publisher());
    }

    /**
     * Drains {@code observable} on the shared I/O executor.
     *
     * @see #forEach(Scope, Observable, Consumer, Executor)
     */
    public static <T> CompletableFuture<Void> forEach(
            final Scope scope,
            final Observable<T> observable,
            final Consumer<? super T> consumer) {
        return forEach(scope, observable, consumer, PylonExecutors.sharedIoExecutor());
    }

    /**
     * Invokes {@code consumer} for each value until the scope is cancelled or
     * the observable closes.
     *
     * <p>
     * The subscription is made before this method returns, so no value
     * published afterwards is missed. A consumer that throws is logged and
     * the loop continues with the next value.
     *
     * @return a future completing when the loop ends
     */
    public static <T> CompletableFuture<Void> forEach(
            final Scope scope,
            final Observable<T> observable,
            final Consumer<? super T> consumer,
            final Executor executor) {
        Objects.requireNonNull(consumer, "consumer");
        Observer<T> observer = observable.subscribe(scope);
        return CompletableFuture.runAsync(() -> {
            try {
                Optional<T> next;
                while ((next = observer.next()).isPresent()) {
                    try {
                        consumer.accept(next.get());
                    } catch (RuntimeException e) {
                        log.warn("Observer callback failed, continuing with next value", e);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                observer.unsubscribe();
            }
        }, executor);
    }

    /**
     * Maps each value of {@code source}; an empty result skips the value.
     *
     * <p>
     * The mapped observable closes when {@code source} closes or {@code scope}
     * is cancelled.
     */
    public static <S, D> Observable<D> map(
            final Scope scope,
            final Observable<S> source,
            final Function<? super S, Optional<D>> mapper) {
        ObservableSource<D> mapped = newObservable();
        pipe(scope, source, mapper, mapped.publisher());
        return mapped.observable();
    }

    /**
     * Like {@link #map} but the result replays its last {@code replayBufferSize} values.
     */
    public static <S, D> ReplayObservable<D> mapReplay(
            final Scope scope,
            final int replayBufferSize,
            final Observable<S> source,
            final Function<? super S, Optional<D>> mapper) {
        ReplaySource<D> mapped = newReplayObservable(scope, replayBufferSize);
        pipe(scope, source, mapper, mapped.publisher());
        return mapped.observable();
    }

    private static <S, D> void pipe(
            final Scope scope,
            final Observable<S> source,
            final Function<? super S, Optional<D>> mapper,
            final Publisher<D> publisher) {
        Objects.requireNonNull(mapper, "mapper");
        forEach(scope, source, value -> mapper.apply(value).ifPresent(publisher::publish))
                .whenComplete((ignored, error) -> publisher.close());
    }
}
