package org.javai.result;

import java.util.Objects;
import java.util.function.Function;

/**
 * Represents the result of an operation that may fail.
 * Either {@link Success} containing a value, or {@link Failure} containing a failure value.
 *
 * <p>A Result never changes after construction. Every combinator returns a new Result
 * (or a plain value), so instances can be shared freely between threads.
 *
 * <p>Failures are ordinary values handled with the combinators below. Only misuse of the
 * extraction accessors ({@link #unwrap()} on a failure, {@link #unwrapFailure()} on a success)
 * raises, and it raises {@link UnwrapException}.
 *
 * <pre>{@code
 * Result<Integer, String> parsed = parse(input);
 * int doubled = parsed
 *     .map(x -> x * 2)
 *     .andThen(x -> x > 100 ? Result.failure("too large") : Result.success(x))
 *     .unwrapOr(0);
 * }</pre>
 *
 * @param <T> The type of the success value
 * @param <E> The type of the failure value
 */
public sealed interface Result<T, E> permits Result.Success, Result.Failure {

    /**
     * A successful result containing a value.
     *
     * @param value the success value, never null
     */
    record Success<T, E>(T value) implements Result<T, E> {

        public Success {
            Objects.requireNonNull(value, "value must not be null, use Unit for value-less success");
        }

        @Override
        public Tag tag() {
            return Tag.SUCCESS;
        }

        @Override
        public boolean containsValue(T candidate) {
            return value.equals(candidate);
        }

        @Override
        public boolean containsFailure(E candidate) {
            return false;
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public E unwrapFailure() {
            throw new UnwrapException("unwrapFailure()", Tag.SUCCESS, value);
        }

        @Override
        public T unwrapOr(T defaultValue) {
            return value;
        }

        @Override
        public T unwrapOrElse(Function<? super E, ? extends T> fallback) {
            return value;
        }

        @Override
        public <U> Result<U, E> map(Function<? super T, ? extends U> op) {
            Objects.requireNonNull(op);
            return new Success<>(op.apply(value));
        }

        @Override
        public <F> Result<T, F> mapFailure(Function<? super E, ? extends F> op) {
            return new Success<>(value);
        }

        @Override
        public <U> U mapOr(U defaultValue, Function<? super T, ? extends U> op) {
            Objects.requireNonNull(op);
            return op.apply(value);
        }

        @Override
        public <U> U mapOrElse(Function<? super E, ? extends U> fallback, Function<? super T, ? extends U> op) {
            Objects.requireNonNull(op);
            return op.apply(value);
        }

        @Override
        public <U> Result<U, E> and(Result<U, E> next) {
            return Objects.requireNonNull(next, "next must not be null");
        }

        @Override
        public <U> Result<U, E> andThen(Function<? super T, ? extends Result<U, E>> op) {
            Objects.requireNonNull(op);
            return Objects.requireNonNull(op.apply(value), "andThen function returned null");
        }

        @Override
        public <F> Result<T, F> or(Result<T, F> next) {
            return new Success<>(value);
        }

        @Override
        public <F> Result<T, F> orElse(Function<? super E, ? extends Result<T, F>> op) {
            return new Success<>(value);
        }

        @Override
        public int hashCode() {
            return 31 * Tag.SUCCESS.label().hashCode() + value.hashCode();
        }

        @Override
        public String toString() {
            return Tag.SUCCESS.label() + "(" + value + ")";
        }
    }

    /**
     * A failed result containing a failure value.
     *
     * @param error the failure value, never null
     */
    record Failure<T, E>(E error) implements Result<T, E> {

        public Failure {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public Tag tag() {
            return Tag.FAILURE;
        }

        @Override
        public boolean containsValue(T candidate) {
            return false;
        }

        @Override
        public boolean containsFailure(E candidate) {
            return error.equals(candidate);
        }

        @Override
        public T unwrap() {
            throw new UnwrapException("unwrap()", Tag.FAILURE, error);
        }

        @Override
        public E unwrapFailure() {
            return error;
        }

        @Override
        public T unwrapOr(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T unwrapOrElse(Function<? super E, ? extends T> fallback) {
            Objects.requireNonNull(fallback);
            return fallback.apply(error);
        }

        @Override
        public <U> Result<U, E> map(Function<? super T, ? extends U> op) {
            return new Failure<>(error);
        }

        @Override
        public <F> Result<T, F> mapFailure(Function<? super E, ? extends F> op) {
            Objects.requireNonNull(op);
            return new Failure<>(op.apply(error));
        }

        @Override
        public <U> U mapOr(U defaultValue, Function<? super T, ? extends U> op) {
            return defaultValue;
        }

        @Override
        public <U> U mapOrElse(Function<? super E, ? extends U> fallback, Function<? super T, ? extends U> op) {
            Objects.requireNonNull(fallback);
            return fallback.apply(error);
        }

        @Override
        public <U> Result<U, E> and(Result<U, E> next) {
            return new Failure<>(error);
        }

        @Override
        public <U> Result<U, E> andThen(Function<? super T, ? extends Result<U, E>> op) {
            return new Failure<>(error);
        }

        @Override
        public <F> Result<T, F> or(Result<T, F> next) {
            return Objects.requireNonNull(next, "next must not be null");
        }

        @Override
        public <F> Result<T, F> orElse(Function<? super E, ? extends Result<T, F>> op) {
            Objects.requireNonNull(op);
            return Objects.requireNonNull(op.apply(error), "orElse function returned null");
        }

        @Override
        public int hashCode() {
            return 31 * Tag.FAILURE.label().hashCode() + error.hashCode();
        }

        @Override
        public String toString() {
            return Tag.FAILURE.label() + "(" + error + ")";
        }
    }

    // Query methods

    /**
     * Returns the discriminant of this result.
     */
    Tag tag();

    default boolean isSuccess() {
        return tag() == Tag.SUCCESS;
    }

    default boolean isFailure() {
        return tag() == Tag.FAILURE;
    }

    /**
     * Returns true if this is a success holding a value equal to {@code candidate}.
     */
    boolean containsValue(T candidate);

    /**
     * Returns true if this is a failure holding a value equal to {@code candidate}.
     */
    boolean containsFailure(E candidate);

    // Value extraction

    /**
     * Returns the success value.
     *
     * <p>Prefer {@link #unwrapOr}, {@link #unwrapOrElse} or an {@code instanceof} check; calling
     * this on a failure is a programming error.
     *
     * @throws UnwrapException if this is a failure
     */
    T unwrap();

    /**
     * Returns the failure value.
     *
     * @throws UnwrapException if this is a success
     */
    E unwrapFailure();

    /**
     * Returns the success value, or {@code defaultValue} if this is a failure.
     *
     * <p>The argument is evaluated by the caller before the call. Pass a function to
     * {@link #unwrapOrElse} when the default is expensive to compute.
     */
    T unwrapOr(T defaultValue);

    /**
     * Returns the success value, or applies {@code fallback} to the failure value.
     * The fallback is only invoked for a failure.
     */
    T unwrapOrElse(Function<? super E, ? extends T> fallback);

    // Transformations

    /**
     * Maps a {@code Result<T, E>} to {@code Result<U, E>} by applying {@code op} to the success value.
     * A failure is passed through with the same failure value.
     *
     * @throws NullPointerException if {@code op} returns null
     */
    <U> Result<U, E> map(Function<? super T, ? extends U> op);

    /**
     * Maps a {@code Result<T, E>} to {@code Result<T, F>} by applying {@code op} to the failure value.
     * A success is passed through with the same value.
     *
     * @throws NullPointerException if {@code op} returns null
     */
    <F> Result<T, F> mapFailure(Function<? super E, ? extends F> op);

    /**
     * Applies {@code op} to the success value, or returns {@code defaultValue} for a failure.
     *
     * <p>Like {@link #unwrapOr}, the default is evaluated eagerly whichever branch is taken;
     * use {@link #mapOrElse} to compute it lazily.
     */
    <U> U mapOr(U defaultValue, Function<? super T, ? extends U> op);

    /**
     * Applies {@code op} to the success value, or {@code fallback} to the failure value.
     * Exactly one of the two functions is invoked.
     */
    <U> U mapOrElse(Function<? super E, ? extends U> fallback, Function<? super T, ? extends U> op);

    // Chaining

    /**
     * Returns {@code next} if this is a success, otherwise this failure's value relabelled.
     *
     * <p>{@code next} is built before the call even when it is discarded. Use {@link #andThen}
     * when producing the next result has a cost or side effects.
     */
    <U> Result<U, E> and(Result<U, E> next);

    /**
     * Applies {@code op} to the success value and returns its result. A failure short-circuits
     * without invoking {@code op}.
     */
    <U> Result<U, E> andThen(Function<? super T, ? extends Result<U, E>> op);

    /**
     * Returns this success, or {@code next} if this is a failure.
     *
     * <p>{@code next} is evaluated eagerly; see {@link #orElse} for the lazy form.
     */
    <F> Result<T, F> or(Result<T, F> next);

    /**
     * Applies {@code op} to the failure value and returns its result. A success short-circuits
     * without invoking {@code op}.
     */
    <F> Result<T, F> orElse(Function<? super E, ? extends Result<T, F>> op);

    // Static factories

    static <E> Result<Unit, E> success() {
        return new Success<>(Unit.INSTANCE);
    }

    static <T, E> Result<T, E> success(T value) {
        return new Success<>(value);
    }

    static <T, E> Result<T, E> failure(E error) {
        return new Failure<>(error);
    }
}
