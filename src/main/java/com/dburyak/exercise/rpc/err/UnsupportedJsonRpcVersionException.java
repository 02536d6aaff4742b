package com.dburyak.exercise.rpc.err;

public class UnsupportedJsonRpcVersionException extends MalformedMessageException {

    public UnsupportedJsonRpcVersionException(String badVersion) {
        super("Unsupported JSON-RPC version: " + badVersion);
    }
}
