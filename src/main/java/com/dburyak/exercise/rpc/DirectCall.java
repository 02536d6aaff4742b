package com.dburyak.exercise.rpc;

import com.dburyak.exercise.rpc.err.ArgsNotAssignableException;
import lombok.ToString;

import java.lang.invoke.MethodType;

/**
 * {@link Call} that is not backed by any transport. Used to invoke handlers in-process:
 * <pre>{@code
 * var res = handler.serve(new DirectCall(CallContext.background().withTimeout(Duration.ofSeconds(5)),
 *         "Method.Name", Map.of("foo", "bar")));
 * }</pre>
 * Unlike wire-backed calls, arguments of a direct call can be unmarshalled any number of times.
 */
@ToString
public class DirectCall implements Call {
    private final CallContext context;
    private final String method;
    private final Object args;

    /**
     * @param context context of the call, background context is used if null
     */
    public DirectCall(CallContext context, String method, Object args) {
        this.context = context != null ? context : CallContext.background();
        this.method = method;
        this.args = args;
    }

    public DirectCall(String method, Object args) {
        this(null, method, args);
    }

    @Override
    public CallContext context() {
        return context;
    }

    @Override
    public String method() {
        return method;
    }

    /**
     * Hands out the stored arguments as is, provided that the requested type is assignable from their type.
     */
    @Override
    public <T> T unmarshalArgs(Class<T> type) throws ArgsNotAssignableException {
        var targetType = type.isPrimitive() ? MethodType.methodType(type).wrap().returnType() : type;
        if (args == null) {
            if (type.isPrimitive()) {
                throw new ArgsNotAssignableException(null, type);
            }
            return null;
        }
        if (!targetType.isInstance(args)) {
            throw new ArgsNotAssignableException(args.getClass(), type);
        }
        return type.isPrimitive() ? (T) args : type.cast(args);
    }
}
