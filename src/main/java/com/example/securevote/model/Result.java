package com.example.securevote.model;

import lombok.EqualsAndHashCode;
import lombok.NonNull;

import java.util.Optional;
import java.util.function.Function;

/**
 * Either a value or a {@link VoteError}. Every fallible core operation returns one of these
 * instead of throwing.
 *
 * @param <T> the type of the value on success
 */
@EqualsAndHashCode
public final class Result<T> {

    private final T value;
    private final VoteError error;
    private final String message;

    private Result(T value, VoteError error, String message) {
        this.value = value;
        this.error = error;
        this.message = message;
    }

    public static <T> Result<T> success(@NonNull T value) {
        return new Result<>(value, null, null);
    }

    public static <T> Result<T> failure(@NonNull VoteError error) {
        return new Result<>(null, error, error.getDefaultMessage());
    }

    public static <T> Result<T> failure(@NonNull VoteError error, String message) {
        return new Result<>(null, error, message != null ? message : error.getDefaultMessage());
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * Returns the value; callers must check {@link #isSuccess()} first.
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("No value on failed result: " + error);
        }
        return value;
    }

    public Optional<VoteError> getError() {
        return Optional.ofNullable(error);
    }

    public String getMessage() {
        return message;
    }

    /**
     * Maps the value if successful, preserves the failure otherwise.
     */
    public <U> Result<U> map(Function<T, U> mapper) {
        if (isSuccess()) {
            return Result.success(mapper.apply(value));
        }
        return new Result<>(null, error, message);
    }

    /**
     * Flat maps the value to another Result if successful, preserves the failure otherwise.
     */
    public <U> Result<U> flatMap(Function<T, Result<U>> mapper) {
        if (isSuccess()) {
            return mapper.apply(value);
        }
        return new Result<>(null, error, message);
    }

    /**
     * Re-types a failure so it can be returned from a method with a different value type.
     */
    public <U> Result<U> castFailure() {
        if (isSuccess()) {
            throw new IllegalStateException("castFailure on successful result");
        }
        return new Result<>(null, error, message);
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "Result.success(" + value + ")";
        }
        return "Result.failure(" + error + ", " + message + ")";
    }
}
