package com.dburyak.exercise.rpc.err;

import lombok.Getter;

/**
 * Remote endpoint answered with an unexpected HTTP status, i.e. the call didn't even reach the RPC layer.
 */
@Getter
public class HttpStatusException extends RuntimeException {
    private final int httpStatusCode;
    private final String body;

    public HttpStatusException(int httpStatusCode, String body) {
        super("unexpected http status " + httpStatusCode + ": " + body);
        this.httpStatusCode = httpStatusCode;
        this.body = body;
    }
}
