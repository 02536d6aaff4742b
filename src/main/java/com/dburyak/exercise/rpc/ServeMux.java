package com.dburyak.exercise.rpc;

import com.dburyak.exercise.rpc.err.MethodNotFoundException;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Routes calls to the handler registered for their method name (exact match only), or fails them with
 * {@link #METHOD_NOT_FOUND}.
 * <pre>{@code
 * var mux = new ServeMux()
 *         .handle("foo", fooHandler)
 *         .handleFunc("bar", call -> Result.success("bar"));
 * }</pre>
 * Registration is not thread-safe, all the handlers must be registered before the mux starts serving.
 */
public class ServeMux implements RpcHandler {
    public static final MethodNotFoundException METHOD_NOT_FOUND = new MethodNotFoundException();

    private final Map<String, RpcHandler> handlers;

    public ServeMux() {
        this.handlers = new HashMap<>();
    }

    public ServeMux(Map<String, ? extends RpcHandler> handlers) {
        this.handlers = new HashMap<>(handlers);
    }

    @Override
    public Result serve(Call call) {
        var handler = handlers.get(call.method());
        if (handler == null) {
            return Result.failure(METHOD_NOT_FOUND);
        }
        return handler.serve(call);
    }

    /**
     * Registers the handler for the method, replacing any previous registration.
     *
     * @return this mux
     */
    public ServeMux handle(String method, RpcHandler handler) {
        if (method == null) {
            throw new IllegalArgumentException("method must not be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        handlers.put(method, handler);
        return this;
    }

    public ServeMux handleFunc(String method, Function<Call, Result> fn) {
        return handle(method, fn::apply);
    }
}
