package com.dburyak.exercise.rpc;

import com.dburyak.exercise.rpc.http.Codec;
import com.dburyak.exercise.rpc.http.json2.Json2Codec;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.plugins.RxJavaPlugins;
import io.vertx.config.ConfigRetrieverOptions;
import io.vertx.config.ConfigStoreOptions;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.rxjava3.config.ConfigRetriever;
import io.vertx.rxjava3.core.RxHelper;
import io.vertx.rxjava3.core.Vertx;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs an RPC server around the given dispatcher:
 * <pre>{@code
 * var app = new App(new ServeMux().handle("foo", fooHandler));
 * app.start().blockingAwait();
 * }</pre>
 * Configuration is read from {@code config.yaml} on the classpath overlaid with {@code RPC_*} env vars, see
 * {@link Config}.
 */
@Log4j2
public class App {
    private final Codec codec; // null means "JSON-RPC 2.0 as configured"
    private final RpcHandler dispatcher;
    private volatile Vertx vertx;
    private volatile Config cfg;
    private volatile List<String> verticleIds = List.of();
    private final AtomicBoolean isShuttingDown = new AtomicBoolean(false);

    public App(RpcHandler dispatcher) {
        this(null, dispatcher);
    }

    public App(Codec codec, RpcHandler dispatcher) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher must not be null");
        }
        this.codec = codec;
        this.dispatcher = dispatcher;
    }

    /**
     * Starts the server. Completes when all the verticles are deployed and listening.
     */
    public Completable start() {
        var startupStartedAt = Instant.now();
        log.debug("starting");
        vertx = Vertx.vertx();
        initRxSchedulers(vertx);
        return configRetriever(vertx).rxGetConfig()
                .map(Config::new)
                .flatMap(cfg -> {
                    this.cfg = cfg;
                    var appCodec = codec != null ? codec : new Json2Codec(cfg.isStrictJsonRpcVersion());
                    return Observable.range(0, cfg.getNumVerticles())
                            // handlers chain may be stateful, so each verticle builds its own
                            .flatMapSingle(i -> vertx.rxDeployVerticle(new RpcServerVerticle(cfg, appCodec,
                                    dispatcher)))
                            .toList();
                })
                .doOnSuccess(depIds -> {
                    verticleIds = depIds;
                    Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown));
                    log.info("app started: numVerticles={}, startupTime={}", depIds::size,
                            () -> Duration.between(startupStartedAt, Instant.now()));
                })
                .doOnError(err -> {
                    log.error("failed to start", err);
                    vertx.rxClose().subscribe(() -> {}, err2 -> log.error("failed to close vertx", err2));
                })
                .ignoreElement();
    }

    public void shutdown() {
        // shutdown may be called multiple times: from tests and from the shutdown hook
        if (!isShuttingDown.compareAndSet(false, true)) {
            log.warn("multiple shutdown calls, shutdown already in progress, ignoring");
            return;
        }
        if (vertx == null) {
            return;
        }
        var shutdownStartedAt = Instant.now();
        log.info("shutting down");
        // undeploy verticles first to let them stop accepting calls and flush their handlers, only then close vertx,
        // which would otherwise abruptly kill any in-flight calls
        Observable.fromIterable(verticleIds)
                .flatMapCompletable(vertx::rxUndeploy)
                .doOnComplete(() -> log.info("all verticles stopped, closing vertx"))
                .andThen(vertx.rxClose())
                .blockingAwait();
        log.info("shutdown complete: shutdownTime={}", () -> Duration.between(shutdownStartedAt, Instant.now()));
    }

    /**
     * Config the app was started with, null before it's loaded.
     */
    public Config getConfig() {
        return cfg;
    }

    private static void initRxSchedulers(Vertx vertx) {
        var elScheduler = RxHelper.scheduler(vertx);
        var workerScheduler = RxHelper.blockingScheduler(vertx, false);
        RxJavaPlugins.setComputationSchedulerHandler(ignr -> elScheduler);
        RxJavaPlugins.setIoSchedulerHandler(ignr -> workerScheduler);
        RxJavaPlugins.setNewThreadSchedulerHandler(ignr -> elScheduler);
    }

    private static ConfigRetriever configRetriever(Vertx vertx) {
        return ConfigRetriever.create(vertx, new ConfigRetrieverOptions()
                .addStore(new ConfigStoreOptions()
                        .setType("file")
                        .setFormat("yaml")
                        .setOptional(true)
                        .setConfig(new JsonObject()
                                .put("path", "config.yaml"))) // matches to the name of src/main/resources/config.yaml
                .addStore(new ConfigStoreOptions()
                        .setType("env")
                        .setConfig(new JsonObject()
                                .put("keys", new JsonArray(Config.ALL_ENV_VARS))))
        );
    }
}
