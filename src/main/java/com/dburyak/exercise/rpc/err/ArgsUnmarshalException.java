package com.dburyak.exercise.rpc.err;

/**
 * Root of the errors a {@link com.dburyak.exercise.rpc.Call} reports when its arguments can't be unmarshalled.
 * Handlers catch it and return it as a failed {@link com.dburyak.exercise.rpc.Result}.
 */
public abstract class ArgsUnmarshalException extends Exception {

    protected ArgsUnmarshalException(String message) {
        super(message);
    }

    protected ArgsUnmarshalException(String message, Throwable cause) {
        super(message, cause);
    }
}
