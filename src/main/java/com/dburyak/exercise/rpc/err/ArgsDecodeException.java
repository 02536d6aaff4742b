package com.dburyak.exercise.rpc.err;

/**
 * Arguments payload is malformed or doesn't match the requested type.
 */
public class ArgsDecodeException extends ArgsUnmarshalException {

    public ArgsDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
