package com.dburyak.exercise.rpc.http;

import com.dburyak.exercise.rpc.Call;
import com.dburyak.exercise.rpc.CallContext;
import com.dburyak.exercise.rpc.Result;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Single;
import io.vertx.rxjava3.core.http.HttpServerRequest;
import io.vertx.rxjava3.core.http.HttpServerResponse;

/**
 * Translates http requests into {@link Call}s and results of those calls back into http responses, according to
 * some wire protocol.
 */
public interface Codec {

    /**
     * Translates the incoming http request into a call. The returned call must use the given context as its
     * context, or a child of it. A failed single is answered with 400 by {@link HttpRpcHandler}.
     */
    Single<Call> newCall(CallContext ctx, HttpServerResponse response, HttpServerRequest request);

    /**
     * Encodes the result of the call and writes it to the http response. A failed completable is answered with 500
     * by {@link HttpRpcHandler}, if the response is still writable.
     * <p>
     * The http response of the call is available via {@link HttpRpcHandler#contextResponse(CallContext)}.
     */
    Completable respond(Call call, Result result);
}
