package com.dburyak.exercise.rpc.err;

/**
 * Returned (not thrown) by {@link com.dburyak.exercise.rpc.ServeMux} for calls of unregistered methods. There's a
 * single shared instance, so it carries no stack trace.
 */
public class MethodNotFoundException extends RuntimeException {

    public MethodNotFoundException() {
        super("method not found", null, false, false);
    }
}
