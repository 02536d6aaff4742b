package com.dburyak.exercise.rpc;

/**
 * Processes incoming RPC calls. Any lambda of a matching shape is a handler.
 */
@FunctionalInterface
public interface RpcHandler {
    Result serve(Call call);
}
