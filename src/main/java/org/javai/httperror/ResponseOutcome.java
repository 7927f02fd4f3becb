package org.javai.httperror;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The result of checking an HTTP exchange against the caller's expectations.
 * Either {@link Ok} containing a value, or {@link Fail} containing an {@link HttpError}.
 *
 * @param <T> The type of the successful value
 */
public sealed interface ResponseOutcome<T> permits ResponseOutcome.Ok, ResponseOutcome.Fail {

    /**
     * An accepted response.
     *
     * @param value the value read from the response
     */
    record Ok<T>(T value) implements ResponseOutcome<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public Optional<HttpError> error() {
            return Optional.empty();
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public <U> ResponseOutcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> ResponseOutcome<U> flatMap(Function<? super T, ? extends ResponseOutcome<U>> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public ResponseOutcome<T> recover(Function<? super HttpError, ? extends T> recovery) {
            return this;
        }

        @Override
        public ResponseOutcome<T> recoverWith(Function<? super HttpError, ? extends ResponseOutcome<T>> recovery) {
            return this;
        }
    }

    /**
     * A rejected response.
     *
     * @param failure why the response was rejected
     */
    record Fail<T>(HttpError failure) implements ResponseOutcome<T> {

        public Fail {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public Optional<HttpError> error() {
            return Optional.of(failure);
        }

        @Override
        public T getOrThrow() {
            throw failure.toException();
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public <U> ResponseOutcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(failure);
        }

        @Override
        public <U> ResponseOutcome<U> flatMap(Function<? super T, ? extends ResponseOutcome<U>> mapper) {
            return new Fail<>(failure);
        }

        @Override
        public ResponseOutcome<T> recover(Function<? super HttpError, ? extends T> recovery) {
            Objects.requireNonNull(recovery);
            return new Ok<>(recovery.apply(failure));
        }

        @Override
        public ResponseOutcome<T> recoverWith(Function<? super HttpError, ? extends ResponseOutcome<T>> recovery) {
            Objects.requireNonNull(recovery);
            return recovery.apply(failure);
        }
    }

    boolean isOk();

    default boolean isFail() {
        return !isOk();
    }

    /**
     * Returns the error if this outcome failed.
     */
    Optional<HttpError> error();

    /**
     * Returns the value, or throws {@link HttpErrorException} if this outcome failed.
     */
    T getOrThrow();
    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    <U> ResponseOutcome<U> map(Function<? super T, ? extends U> mapper);
    <U> ResponseOutcome<U> flatMap(Function<? super T, ? extends ResponseOutcome<U>> mapper);

    ResponseOutcome<T> recover(Function<? super HttpError, ? extends T> recovery);
    ResponseOutcome<T> recoverWith(Function<? super HttpError, ? extends ResponseOutcome<T>> recovery);

    static <T> ResponseOutcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> ResponseOutcome<T> fail(HttpError error) {
        return new Fail<>(error);
    }
}
