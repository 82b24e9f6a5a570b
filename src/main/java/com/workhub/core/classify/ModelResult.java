package com.workhub.core.classify;

/**
 * Outcome of one model-assisted attempt: either a value or the reason there is none.
 *
 * @param <T> type of the successful value
 */
public sealed interface ModelResult<T> permits ModelResult.Ok, ModelResult.Err {

    static <T> ModelResult<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> ModelResult<T> err(ModelError error, String detail) {
        return new Err<>(error, detail);
    }

    record Ok<T>(T value) implements ModelResult<T> {}

    record Err<T>(ModelError error, String detail) implements ModelResult<T> {}
}
