package com.hyperdesk.eventstore;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of an operation that can fail in an expected, typed way.
 *
 * <p>Expected failures (conflicts, missing aggregates, rejected transitions) travel as values so
 * callers must handle them. Faults (broken I/O, programming errors) are still exceptions.
 *
 * @param <T> success value type ({@link Void} for operations without a value)
 * @param <E> error type
 */
public sealed interface Result<T, E> permits Result.Success, Result.Failure {

    /** Successful outcome; the value may be {@code null} only for {@code Result<Void, E>}. */
    record Success<T, E>(T value) implements Result<T, E> {}

    /** Failed outcome carrying a typed error. */
    record Failure<T, E>(E error) implements Result<T, E> {
        public Failure {
            Objects.requireNonNull(error, "error must not be null");
        }
    }

    static <T, E> Result<T, E> success(T value) {
        return new Success<>(value);
    }

    static <E> Result<Void, E> success() {
        return new Success<>(null);
    }

    static <T, E> Result<T, E> failure(E error) {
        return new Failure<>(error);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isFailure() {
        return this instanceof Failure;
    }

    /**
     * Returns the success value.
     *
     * @throws IllegalStateException if this is a failure
     */
    default T value() {
        throw new IllegalStateException("Result is a failure: " + error());
    }

    /**
     * Returns the error.
     *
     * @throws IllegalStateException if this is a success
     */
    default E error() {
        throw new IllegalStateException("Result is a success, no error present");
    }

    default <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
        if (this instanceof Success<T, E> success) {
            return Result.success(mapper.apply(success.value()));
        }
        return Result.failure(error());
    }

    default <U> Result<U, E> flatMap(Function<? super T, Result<U, E>> mapper) {
        if (this instanceof Success<T, E> success) {
            return mapper.apply(success.value());
        }
        return Result.failure(error());
    }

    default <F> Result<T, F> mapError(Function<? super E, ? extends F> mapper) {
        if (this instanceof Failure<T, E> failure) {
            return Result.failure(mapper.apply(failure.error()));
        }
        return Result.success(value());
    }

    default Result<T, E> onSuccess(Consumer<? super T> action) {
        if (this instanceof Success<T, E> success) {
            action.accept(success.value());
        }
        return this;
    }

    default Result<T, E> onFailure(Consumer<? super E> action) {
        if (this instanceof Failure<T, E> failure) {
            action.accept(failure.error());
        }
        return this;
    }

    default <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super E, ? extends R> onFailure) {
        if (this instanceof Success<T, E> success) {
            return onSuccess.apply(success.value());
        }
        return onFailure.apply(error());
    }
}
