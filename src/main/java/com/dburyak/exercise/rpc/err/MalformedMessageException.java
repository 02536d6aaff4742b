package com.dburyak.exercise.rpc.err;

/**
 * Wire message (request or response) can't be parsed.
 */
public class MalformedMessageException extends RuntimeException {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
