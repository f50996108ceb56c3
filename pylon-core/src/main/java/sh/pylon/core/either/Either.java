// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pylon.core.either;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Holds exactly one of a value or an error.
 *
 * <p>
 * Used to carry failures through an {@link sh.pylon.core.observable.Observable}
 * without terminating the stream: observers receive a {@link Failure} as an
 * ordinary notification and decide for themselves whether to stop.
 *
 * <pre>{@code
 * if (next instanceof Either.Failure<byte[]> failure) {
 *     handle(failure.error());
 * } else if (next instanceof Either.Success<byte[]> success) {
 *     decode(success.value());
 * }
 * }</pre>
 *
 * @param <T> the value type
 * @since 0.1.0
 */
public sealed interface Either<T> permits Either.Success, Either.Failure {

    static <T> Either<T> success(final T value) {
        return new Success<>(value);
    }

    static <T> Either<T> failure(final Throwable error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * @return the value, or empty if this is a failure
     */
    Optional<T> optionalValue();

    /**
     * @return the error, or empty if this is a success
     */
    Optional<Throwable> optionalError();

    /**
     * Transforms the value of a success; a failure is passed through unchanged.
     */
    <R> Either<R> map(Function<? super T, ? extends R> mapper);

    /**
     * Collapses both variants into a single result.
     */
    <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super Throwable, ? extends R> onFailure);

    record Success<T>(T value) implements Either<T> {

        public Success {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<T> optionalValue() {
            return Optional.of(value);
        }

        @Override
        public Optional<Throwable> optionalError() {
            return Optional.empty();
        }

        @Override
        public <R> Either<R> map(final Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <R> R fold(
                final Function<? super T, ? extends R> onSuccess,
                final Function<? super Throwable, ? extends R> onFailure) {
            return onSuccess.apply(value);
        }
    }

    record Failure<T>(Throwable error) implements Either<T> {

        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<T> optionalValue() {
            return Optional.empty();
        }

        @Override
        public Optional<Throwable> optionalError() {
            return Optional.of(error);
        }

        @Override
        public <R> Either<R> map(final Function<? super T, ? extends R> mapper) {
            return new Failure<>(error);
        }

        @Override
        public <R> R fold(
                final Function<? super T, ? extends R> onSuccess,
                final Function<? super Throwable, ? extends R> onFailure) {
            return onFailure.apply(error);
        }
    }
}
