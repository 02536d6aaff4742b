package com.dburyak.exercise.rpc.http.json2;

import com.dburyak.exercise.rpc.Call;
import com.dburyak.exercise.rpc.CallContext;
import com.dburyak.exercise.rpc.err.ArgsDecodeException;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Call backed by a parsed JSON-RPC 2.0 request. Params are decoded with Jackson, absent params decode as JSON null.
 */
class Json2Call implements Call {
    private final CallContext context;
    private final Json2Request request;
    private final AtomicBoolean argsUnmarshalled = new AtomicBoolean(false);

    Json2Call(CallContext context, Json2Request request) {
        this.context = context;
        this.request = request;
    }

    @Override
    public CallContext context() {
        return context;
    }

    @Override
    public String method() {
        return request.getMethod();
    }

    @Override
    public <T> T unmarshalArgs(Class<T> type) throws ArgsDecodeException {
        if (!argsUnmarshalled.compareAndSet(false, true)) {
            throw new IllegalStateException("args of the call are already unmarshalled: method=" + method());
        }
        var params = request.getParams() != null ? request.getParams() : RawJson.NULL;
        try {
            return Json2Mapper.decode(params, type);
        } catch (JsonProcessingException e) {
            throw new ArgsDecodeException("can't decode params of " + method() + " as " + type.getName() + ": "
                    + e.getOriginalMessage(), e);
        }
    }
}
