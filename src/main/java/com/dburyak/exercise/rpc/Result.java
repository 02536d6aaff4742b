package com.dburyak.exercise.rpc;

import lombok.Value;

/**
 * Outcome of serving a {@link Call}: either a success value or an error value. Handlers report failures by
 * returning a {@link Failure}, not by throwing.
 */
public interface Result {

    static Result success(Object value) {
        return new Success(value);
    }

    static Result failure(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new Failure(error);
    }

    default boolean isFailure() {
        return this instanceof Failure;
    }

    @Value
    class Success implements Result {
        Object value; // may be null
    }

    @Value
    class Failure implements Result {
        Throwable error;
    }
}
