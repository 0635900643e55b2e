package com.quarkparser;

import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of one front-end stage: either a value or the error that stopped the stage.
 *
 * @param <T> the stage output
 */
public sealed interface ParseResult<T> permits ParseResult.Success, ParseResult.Failure {

    record Success<T>(T value) implements ParseResult<T> {
    }

    record Failure<T>(ParseException cause) implements ParseResult<T> {
    }

    static <T> ParseResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> ParseResult<T> failure(ParseException error) {
        return new Failure<>(error);
    }

    default boolean succeeded() {
        return this instanceof Success;
    }

    default Optional<ParseException> error() {
        if (this instanceof Failure<T> failure) {
            return Optional.of(failure.cause());
        }
        return Optional.empty();
    }

    default <U> ParseResult<U> map(Function<? super T, ? extends U> mapper) {
        if (this instanceof Success<T> success) {
            return new Success<>(mapper.apply(success.value()));
        }
        return new Failure<>(((Failure<T>) this).cause());
    }

    /**
     * Runs the next stage on the value; a failure is passed through without running it.
     */
    default <U> ParseResult<U> flatMap(Function<? super T, ParseResult<U>> next) {
        if (this instanceof Success<T> success) {
            return next.apply(success.value());
        }
        return new Failure<>(((Failure<T>) this).cause());
    }

    /**
     * Returns the value or throws the stored error.
     */
    default T orElseThrow() {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        throw ((Failure<T>) this).cause();
    }
}
