package org.pragmatica.veq.parser;

import org.pragmatica.veq.error.SyntaxError;

import java.util.function.Function;

/**
 * Result of parsing - either success with a value or failure with the first error found.
 */
public sealed interface ParseResult<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Parsed value. Calling this on a failure is a programming error.
     *
     * @throws IllegalStateException if this is a failure
     */
    T unwrap();

    <R> R fold(Function<? super SyntaxError, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess);

    default <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
        return flatMap(value -> success(mapper.apply(value)));
    }

    <R> ParseResult<R> flatMap(Function<? super T, ParseResult<R>> mapper);

    static <T> ParseResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> ParseResult<T> failure(SyntaxError error) {
        return new Failure<>(error);
    }

    /**
     * Successful parse.
     */
    record Success<T>(T value) implements ParseResult<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public <R> R fold(Function<? super SyntaxError, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess) {
            return onSuccess.apply(value);
        }

        @Override
        public <R> ParseResult<R> flatMap(Function<? super T, ParseResult<R>> mapper) {
            return mapper.apply(value);
        }
    }

    /**
     * Failed parse.
     */
    record Failure<T>(SyntaxError error) implements ParseResult<T> {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T unwrap() {
            throw new IllegalStateException("Parse failed: " + error.message());
        }

        @Override
        public <R> R fold(Function<? super SyntaxError, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess) {
            return onFailure.apply(error);
        }

        @Override
        public <R> ParseResult<R> flatMap(Function<? super T, ParseResult<R>> mapper) {
            return new Failure<>(error);
        }
    }
}
