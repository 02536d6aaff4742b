package com.dburyak.exercise.rpc.handlers;

import com.dburyak.exercise.rpc.AsyncCloseable;
import com.dburyak.exercise.rpc.Call;
import com.dburyak.exercise.rpc.CallContext;
import com.dburyak.exercise.rpc.Config;
import com.dburyak.exercise.rpc.Result;
import com.dburyak.exercise.rpc.RpcHandler;
import com.dburyak.exercise.rpc.http.HttpRpcHandler;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.subjects.Subject;
import io.reactivex.rxjava3.subjects.UnicastSubject;
import lombok.Value;
import lombok.extern.log4j.Log4j2;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Decorates a dispatcher and logs access information of every served call.
 * <p>
 * IMPL NOTE: entries are written in batches from a separate subscription, so serving a call never waits for the
 * logging backend. The same approach would work for any other access log sink (database, syslog, etc.).
 */
@Log4j2
public class AccessLoggingHandler implements RpcHandler, AsyncCloseable {
    public static final String X_FORWARDED_FOR_HEADER = "x-forwarded-for";
    private static final String UNKNOWN_IP = "-";
    // this matches logger name in log4j2.yaml
    private static final Logger ACCESS_LOG = LogManager.getLogger("ACCESS_LOG");
    private static final Duration BATCH_WRITE_INTERVAL = Duration.ofSeconds(1); // this could be configurable
    private final RpcHandler delegate;
    private final Duration gracefulShutdownTimeout;
    // calls may be served on worker threads (blocking dispatch), so the subject must be serialized
    private final Subject<AccessLogEntry> accessLogEntries = UnicastSubject.<AccessLogEntry>create().toSerialized();
    private final AtomicInteger inFlightOps = new AtomicInteger(0);
    private final AtomicReference<Disposable> writerSubscription = new AtomicReference<>();

    public AccessLoggingHandler(Config cfg, RpcHandler delegate) {
        this.delegate = delegate;
        this.gracefulShutdownTimeout = cfg.getGracefulShutdownTimeout();
    }

    @Override
    public Result serve(Call call) {
        if (writerSubscription.get() == null) {
            startLogWriter();
        }
        var startedAt = Instant.now();
        var result = delegate.serve(call);
        var logEntry = new AccessLogEntry(startedAt, callersIp(call.context()), call.method(),
                result.isFailure() ? "FAILED" : "OK", Duration.between(startedAt, Instant.now()));
        inFlightOps.incrementAndGet();
        accessLogEntries.onNext(logEntry);
        return result;
    }

    @Override
    public Completable closeAsync() {
        log.debug("closing, inFlightOps={}", inFlightOps::get);
        if (inFlightOps.get() <= 0) {
            disposeWriter();
            return Completable.complete();
        }
        // there's a way to implement it with listeners/Promises without polling, but it's more complex and requires
        // more memory and CPU wasted on each call, so polling being ugly still is not a bad trade-off here
        return Observable.interval(0, 50, MILLISECONDS)
                .filter(ignr -> inFlightOps.get() <= 0)
                .take(1)
                .ignoreElements()
                .timeout(gracefulShutdownTimeout.toMillis(), MILLISECONDS, Completable.complete())
                .doFinally(this::disposeWriter);
    }

    @Value
    public static class AccessLogEntry {
        Instant timestamp;
        String ip;
        String method;
        String outcome;
        Duration duration;

        @Override
        public String toString() {
            return String.format("%s - %s - %s - %s - %dms", timestamp, ip, method, outcome, duration.toMillis());
        }
    }

    static String callersIp(CallContext ctx) {
        var request = HttpRpcHandler.contextRequest(ctx);
        if (request == null) {
            return UNKNOWN_IP;
        }
        var ipInHeader = request.getHeader(X_FORWARDED_FOR_HEADER);
        if (ipInHeader != null) {
            return ipInHeader;
        }
        var remoteAddress = request.remoteAddress();
        return remoteAddress != null ? remoteAddress.host() : UNKNOWN_IP;
    }

    private synchronized void startLogWriter() {
        if (writerSubscription.get() != null) {
            return;
        }
        log.debug("starting access log writer");
        writerSubscription.set(accessLogEntries.buffer(BATCH_WRITE_INTERVAL.toMillis(), MILLISECONDS)
                .filter(batch -> !batch.isEmpty())
                .subscribe(batch -> {
                    for (var entry : batch) {
                        ACCESS_LOG.info(entry);
                        inFlightOps.decrementAndGet();
                    }
                }, err -> log.error("unexpected error in access log writer, stopping the writer", err)));
    }

    private void disposeWriter() {
        var subscription = writerSubscription.get();
        if (subscription != null) {
            subscription.dispose();
        }
    }
}
