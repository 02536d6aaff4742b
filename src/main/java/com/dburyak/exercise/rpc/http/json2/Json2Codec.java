package com.dburyak.exercise.rpc.http.json2;

import com.dburyak.exercise.rpc.Call;
import com.dburyak.exercise.rpc.CallContext;
import com.dburyak.exercise.rpc.Result;
import com.dburyak.exercise.rpc.err.UnsupportedJsonRpcVersionException;
import com.dburyak.exercise.rpc.http.Codec;
import com.dburyak.exercise.rpc.http.HttpRpcHandler;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Single;
import io.vertx.rxjava3.core.http.HttpServerRequest;
import io.vertx.rxjava3.core.http.HttpServerResponse;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * {@link Codec} for the JSON-RPC 2.0 protocol over http:
 * <pre>{@code
 * var httpHandler = HttpRpcHandler.create(new Json2Codec(), mux);
 * }</pre>
 * Batch requests are not supported. A body which is not a JSON-RPC request object is answered with plain-text 400,
 * not with a JSON-RPC parse error.
 */
public class Json2Codec implements Codec {
    public static final String CONTENT_TYPE_JSON_UTF8 = "application/json; charset=utf-8";
    private static final CallContext.Key<Json2Request> REQUEST_KEY = CallContext.Key.create("json2.request");

    private final boolean strictVersion;

    public Json2Codec() {
        this(false);
    }

    /**
     * @param strictVersion whether to reject requests with "jsonrpc" other than "2.0"
     */
    public Json2Codec(boolean strictVersion) {
        this.strictVersion = strictVersion;
    }

    /**
     * Returns the request that a call created by this codec was parsed from, or null for any other context.
     */
    public static Json2Request contextRequest(CallContext ctx) {
        return ctx.get(REQUEST_KEY);
    }

    @Override
    public Single<Call> newCall(CallContext ctx, HttpServerResponse response, HttpServerRequest request) {
        return request.rxBody()
                .map(body -> {
                    var json2Req = Json2Request.parse(body.toString(UTF_8));
                    if (strictVersion && !Json2Request.VERSION_2_0.equals(json2Req.getVersion())) {
                        throw new UnsupportedJsonRpcVersionException(json2Req.getVersion());
                    }
                    return new Json2Call(ctx.withValue(REQUEST_KEY, json2Req), json2Req);
                });
    }

    @Override
    public Completable respond(Call call, Result result) {
        return Completable.defer(() -> {
            var json2Req = contextRequest(call.context());
            if (json2Req == null) {
                return Completable.error(new IllegalArgumentException(
                        "call was not created by " + Json2Codec.class.getSimpleName() + ": method=" + call.method()));
            }
            var response = HttpRpcHandler.contextResponse(call.context());
            if (response == null) {
                return Completable.error(new IllegalArgumentException(
                        "call has no http response attached: method=" + call.method()));
            }
            var json2Resp = toResponse(result, json2Req.getId());
            var body = json2Resp.toBuffer();
            return response
                    .putHeader(CONTENT_TYPE, CONTENT_TYPE_JSON_UTF8)
                    .rxEnd(body);
        });
    }

    static Json2Response toResponse(Result result, RawJson id) {
        if (result instanceof Result.Failure failure) {
            return Json2Response.failure(Json2Error.from(failure.getError()), id);
        }
        return Json2Response.success(((Result.Success) result).getValue(), id);
    }
}
