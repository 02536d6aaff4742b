package com.dburyak.exercise.rpc;

import com.dburyak.exercise.rpc.err.ArgsUnmarshalException;

/**
 * RPC call currently being processed. Transport independent, created by a codec (or directly, see
 * {@link DirectCall}) and consumed by exactly one {@link RpcHandler} invocation.
 */
public interface Call {

    /**
     * Context of the call. May already have a deadline or attachments, depending on the implementation. The same
     * instance is returned on every invocation.
     */
    CallContext context();

    /**
     * Name of the called method. The same value is returned on every invocation.
     */
    String method();

    /**
     * Decodes the call arguments into an instance of the given type. Should be called only once per call.
     *
     * @throws ArgsUnmarshalException if the arguments can't be represented as the requested type
     */
    <T> T unmarshalArgs(Class<T> type) throws ArgsUnmarshalException;
}
