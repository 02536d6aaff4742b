package com.dburyak.exercise.rpc.http;

import com.dburyak.exercise.rpc.Call;
import com.dburyak.exercise.rpc.CallContext;
import com.dburyak.exercise.rpc.Result;
import com.dburyak.exercise.rpc.RpcHandler;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.schedulers.Schedulers;
import io.vertx.core.Handler;
import io.vertx.rxjava3.core.http.HttpServerRequest;
import io.vertx.rxjava3.core.http.HttpServerResponse;
import lombok.extern.log4j.Log4j2;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.BAD_REQUEST;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;

/**
 * Http request handler that puts a {@link Codec} and an {@link RpcHandler} together:
 * <pre>{@code
 * vertx.createHttpServer()
 *         .requestHandler(HttpRpcHandler.create(new Json2Codec(), mux))
 *         .rxListen(8080);
 * }</pre>
 * Codec failures are answered with 400, failures to respond with 500. Failed results of the dispatcher are normal
 * results, it's up to the codec how to encode them.
 */
@Log4j2
public class HttpRpcHandler implements Handler<HttpServerRequest> {
    public static final String CONTENT_TYPE_TEXT_UTF8 = "text/plain; charset=utf-8";
    private static final String X_CONTENT_TYPE_OPTIONS_HEADER = "x-content-type-options";
    private static final CallContext.Key<HttpServerRequest> REQUEST_KEY = CallContext.Key.create("http.request");
    private static final CallContext.Key<HttpServerResponse> RESPONSE_KEY = CallContext.Key.create("http.response");

    private final Codec codec;
    private final RpcHandler dispatcher;
    private final boolean blockingDispatch;

    private HttpRpcHandler(Codec codec, RpcHandler dispatcher, boolean blockingDispatch) {
        if (codec == null) {
            throw new IllegalArgumentException("codec must not be null");
        }
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher must not be null");
        }
        this.codec = codec;
        this.dispatcher = dispatcher;
        this.blockingDispatch = blockingDispatch;
    }

    /**
     * Handler that serves calls on the event loop. Dispatcher must not block.
     */
    public static HttpRpcHandler create(Codec codec, RpcHandler dispatcher) {
        return new HttpRpcHandler(codec, dispatcher, false);
    }

    /**
     * @param blockingDispatch whether to serve calls on the io scheduler instead of the event loop
     */
    public static HttpRpcHandler create(Codec codec, RpcHandler dispatcher, boolean blockingDispatch) {
        return new HttpRpcHandler(codec, dispatcher, blockingDispatch);
    }

    /**
     * Returns the http request of a call produced by this handler, or null for any other context.
     */
    public static HttpServerRequest contextRequest(CallContext ctx) {
        return ctx.get(REQUEST_KEY);
    }

    /**
     * Returns the http response of a call produced by this handler, or null for any other context.
     */
    public static HttpServerResponse contextResponse(CallContext ctx) {
        return ctx.get(RESPONSE_KEY);
    }

    @Override
    public void handle(HttpServerRequest request) {
        var response = request.response();
        var cancellableCtx = CallContext.background().withCancel();
        response.closeHandler(ignr -> cancellableCtx.cancel());
        response.endHandler(ignr -> cancellableCtx.cancel());
        var ctx = cancellableCtx
                .withValue(REQUEST_KEY, request)
                .withValue(RESPONSE_KEY, response);
        Single.defer(() -> codec.newCall(ctx, response, request))
                .toMaybe()
                // if the Maybe is empty, it means that we've already responded with 400
                .onErrorResumeNext(err -> {
                    log.debug("failed to decode call: uri={}", request.uri(), err);
                    return httpError(response, BAD_REQUEST, err).andThen(Maybe.empty());
                })
                .flatMapCompletable(call -> dispatch(call)
                        .flatMapCompletable(result -> Completable.defer(() -> codec.respond(call, result))
                                .onErrorResumeNext(err -> {
                                    log.error("failed to respond: method={}", call.method(), err);
                                    return httpError(response, INTERNAL_SERVER_ERROR, err);
                                })))
                .subscribe(() -> {}, err -> {
                    log.error("unexpected error while serving rpc call, responding with 500", err);
                    httpError(response, INTERNAL_SERVER_ERROR, err)
                            .subscribe(() -> {}, err2 -> log.error("failed to respond with 500", err2));
                });
    }

    private Single<Result> dispatch(Call call) {
        var result = Single.fromCallable(() -> dispatcher.serve(call));
        return blockingDispatch ? result.subscribeOn(Schedulers.io()) : result;
    }

    private static Completable httpError(HttpServerResponse response, HttpResponseStatus status, Throwable err) {
        return Completable.defer(() -> {
            if (response.ended()) {
                log.warn("response already ended, can't respond with {}", status.code());
                return Completable.complete();
            }
            // this probably won't help if the codec has already started writing, but might as well try
            if (!response.headWritten()) {
                response.setStatusCode(status.code())
                        .putHeader(CONTENT_TYPE, CONTENT_TYPE_TEXT_UTF8)
                        .putHeader(X_CONTENT_TYPE_OPTIONS_HEADER, "nosniff");
            }
            return response.rxEnd(errorText(err) + "\n");
        });
    }

    private static String errorText(Throwable err) {
        var msg = err.getMessage();
        return (msg != null && !msg.isEmpty()) ? msg : err.getClass().getName();
    }
}
