package com.dburyak.exercise.rpc;

import com.dburyak.exercise.rpc.handlers.AccessLoggingHandler;
import com.dburyak.exercise.rpc.http.Codec;
import com.dburyak.exercise.rpc.http.HttpRpcHandler;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Single;
import io.vertx.rxjava3.core.AbstractVerticle;
import io.vertx.rxjava3.core.http.HttpServer;
import io.vertx.rxjava3.core.http.HttpServerRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpResponseStatus.NOT_FOUND;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Serves RPC calls over http on the configured API path. Each verticle has its own http server and its own handlers
 * chain, so handlers don't need to be thread-safe across verticles.
 */
@RequiredArgsConstructor
@Log4j2
public class RpcServerVerticle extends AbstractVerticle {
    private final Config cfg;
    private final Codec codec;
    private final RpcHandler dispatcher;

    private final List<AsyncCloseable> closeables = new ArrayList<>();
    private HttpServer httpServer;
    private volatile int actualPort = -1;

    @Override
    public Completable rxStart() {
        return Single.fromSupplier(this::buildRpcHandler)
                .flatMap(rpcHandler -> {
                    httpServer = vertx.createHttpServer();
                    return httpServer
                            .requestHandler(req -> route(req, rpcHandler))
                            .rxListen(cfg.getPort())
                            .doOnSuccess(srv -> {
                                actualPort = srv.actualPort();
                                log.info("verticle http server started: verticleId={}, port={}, apiPath={}",
                                        deploymentID(), srv.actualPort(), cfg.getApiPath());
                            });
                })
                .ignoreElement();
    }

    @Override
    public Completable rxStop() {
        return httpServer.rxShutdown(cfg.getGracefulShutdownTimeout().toMillis(), MILLISECONDS)
                .andThen(Observable.fromIterable(closeables))
                .flatMapCompletable(AsyncCloseable::closeAsync)
                .doOnComplete(() -> log.info("verticle stopped: verticleId={}", deploymentID()));
    }

    /**
     * Port the http server listens on, -1 until the verticle is started.
     */
    public int getActualPort() {
        return actualPort;
    }

    private HttpRpcHandler buildRpcHandler() {
        var handler = dispatcher;
        if (cfg.isAccessLogEnabled()) {
            var accessLoggingHandler = new AccessLoggingHandler(cfg, handler);
            closeables.add(accessLoggingHandler);
            handler = accessLoggingHandler;
        }
        return HttpRpcHandler.create(codec, handler, cfg.isBlockingDispatch());
    }

    private void route(HttpServerRequest req, HttpRpcHandler rpcHandler) {
        if (cfg.getApiPath().equals(req.path())) {
            rpcHandler.handle(req);
        } else {
            req.response()
                    .setStatusCode(NOT_FOUND.code())
                    .rxEnd()
                    .subscribe(() -> {}, err -> log.error("failed to respond with {}", NOT_FOUND.code(), err));
        }
    }
}
