package com.dburyak.exercise.rpc.http;

import com.dburyak.exercise.rpc.Call;
import com.dburyak.exercise.rpc.CallContext;
import com.dburyak.exercise.rpc.DirectCall;
import com.dburyak.exercise.rpc.Result;
import com.dburyak.exercise.rpc.RpcHandler;
import com.dburyak.exercise.rpc.err.ArgsUnmarshalException;
import com.dburyak.exercise.rpc.err.MalformedMessageException;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Single;
import io.vertx.core.buffer.Buffer;
import io.vertx.rxjava3.core.Vertx;
import io.vertx.rxjava3.core.http.HttpServer;
import io.vertx.rxjava3.core.http.HttpServerRequest;
import io.vertx.rxjava3.core.http.HttpServerResponse;
import io.vertx.rxjava3.ext.web.client.HttpResponse;
import io.vertx.rxjava3.ext.web.client.WebClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpRpcHandlerTest {
    private Vertx vertx;
    private WebClient client;
    private HttpServer server;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        client = WebClient.create(vertx);
    }

    @AfterEach
    void tearDown() {
        client.close();
        vertx.rxClose().blockingAwait();
    }

    @Test
    void servesCallWithHttpObjectsInContext() {
        var seenRequest = new AtomicReference<HttpServerRequest>();
        var seenResponse = new AtomicReference<HttpServerResponse>();
        start(HttpRpcHandler.create(new PathCodec(), call -> {
            seenRequest.set(HttpRpcHandler.contextRequest(call.context()));
            seenResponse.set(HttpRpcHandler.contextResponse(call.context()));
            return echo(call);
        }));

        var resp = post("/Echo", "bar");

        assertThat(resp.statusCode()).isEqualTo(200);
        assertThat(resp.bodyAsString()).isEqualTo("Echo:bar");
        assertThat(seenRequest.get()).isNotNull();
        assertThat(seenRequest.get().path()).isEqualTo("/Echo");
        assertThat(seenResponse.get()).isNotNull();
    }

    @Test
    void contextAccessorsReturnNullForOtherContexts() {
        assertThat(HttpRpcHandler.contextRequest(CallContext.background())).isNull();
        assertThat(HttpRpcHandler.contextResponse(CallContext.background())).isNull();
    }

    @Test
    void failedResultIsUpToCodec() {
        start(HttpRpcHandler.create(new PathCodec(), call -> Result.failure(new IllegalStateException("boom"))));

        var resp = post("/m", "");

        assertThat(resp.statusCode()).isEqualTo(200);
        assertThat(resp.bodyAsString()).isEqualTo("error: boom");
    }

    @Test
    void codecFailureIsBadRequest() {
        var dispatched = new AtomicBoolean(false);
        var codec = new PathCodec() {
            @Override
            public Single<Call> newCall(CallContext ctx, HttpServerResponse response, HttpServerRequest request) {
                return Single.error(new MalformedMessageException("bad call"));
            }
        };
        start(HttpRpcHandler.create(codec, call -> {
            dispatched.set(true);
            return Result.success(null);
        }));

        var resp = post("/m", "whatever");

        assertThat(resp.statusCode()).isEqualTo(400);
        assertThat(resp.bodyAsString()).isEqualTo("bad call\n");
        assertThat(resp.getHeader("content-type")).isEqualTo(HttpRpcHandler.CONTENT_TYPE_TEXT_UTF8);
        assertThat(resp.getHeader("x-content-type-options")).isEqualTo("nosniff");
        assertThat(dispatched.get()).isFalse();
    }

    @Test
    void codecThrowingSynchronouslyIsBadRequest() {
        var codec = new PathCodec() {
            @Override
            public Single<Call> newCall(CallContext ctx, HttpServerResponse response, HttpServerRequest request) {
                throw new IllegalArgumentException("thrown");
            }
        };
        start(HttpRpcHandler.create(codec, call -> Result.success(null)));

        var resp = post("/m", "");

        assertThat(resp.statusCode()).isEqualTo(400);
        assertThat(resp.bodyAsString()).isEqualTo("thrown\n");
    }

    @Test
    void respondFailureIsInternalServerError() {
        var codec = new PathCodec() {
            @Override
            public Completable respond(Call call, Result result) {
                return Completable.error(new IllegalStateException("can't encode"));
            }
        };
        start(HttpRpcHandler.create(codec, HttpRpcHandlerTest::echo));

        var resp = post("/m", "");

        assertThat(resp.statusCode()).isEqualTo(500);
        assertThat(resp.bodyAsString()).isEqualTo("can't encode\n");
    }

    @Test
    void throwingHandlerIsInternalServerError() {
        start(HttpRpcHandler.create(new PathCodec(), call -> {
            throw new IllegalStateException("handler bug");
        }));

        var resp = post("/m", "");

        assertThat(resp.statusCode()).isEqualTo(500);
        assertThat(resp.bodyAsString()).isEqualTo("handler bug\n");
    }

    @Test
    void errorWithoutMessageIsReportedByClassName() {
        var codec = new PathCodec() {
            @Override
            public Single<Call> newCall(CallContext ctx, HttpServerResponse response, HttpServerRequest request) {
                return Single.error(new IllegalArgumentException());
            }
        };
        start(HttpRpcHandler.create(codec, call -> Result.success(null)));

        var resp = post("/m", "");

        assertThat(resp.statusCode()).isEqualTo(400);
        assertThat(resp.bodyAsString()).isEqualTo(IllegalArgumentException.class.getName() + "\n");
    }

    @Test
    void blockingDispatchServesOffEventLoop() {
        var servedOnEventLoop = new AtomicReference<Boolean>();
        start(HttpRpcHandler.create(new PathCodec(), call -> {
            servedOnEventLoop.set(io.vertx.core.Context.isOnEventLoopThread());
            return echo(call);
        }, true));

        var resp = post("/Echo", "foo");

        assertThat(resp.statusCode()).isEqualTo(200);
        assertThat(resp.bodyAsString()).isEqualTo("Echo:foo");
        assertThat(servedOnEventLoop.get()).isFalse();
    }

    @Test
    void contextIsCancelledOnceResponseIsSent() {
        var ctx = new AtomicReference<CallContext>();
        start(HttpRpcHandler.create(new PathCodec(), call -> {
            ctx.set(call.context());
            return echo(call);
        }));

        post("/Echo", "foo");

        assertThat(ctx.get().cancelled().blockingAwait(5, SECONDS)).isTrue();
    }

    @Test
    void clientDisconnectCancelsContext() throws Exception {
        var observedCancellation = new AtomicBoolean(false);
        var handlerDone = new CountDownLatch(1);
        start(HttpRpcHandler.create(new PathCodec(), call -> {
            try {
                observedCancellation.set(call.context().cancelled().blockingAwait(5, SECONDS));
                return Result.success("too late");
            } finally {
                handlerDone.countDown();
            }
        }, true));

        assertThatThrownBy(() -> client.post(server.actualPort(), "localhost", "/Slow")
                .timeout(300)
                .rxSendBuffer(Buffer.buffer("foo"))
                .blockingGet())
                .isNotNull();

        assertThat(handlerDone.await(10, SECONDS)).isTrue();
        assertThat(observedCancellation.get()).isTrue();
    }

    @Test
    void rejectsNulls() {
        RpcHandler dispatcher = call -> Result.success(null);
        assertThatThrownBy(() -> HttpRpcHandler.create(null, dispatcher))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> HttpRpcHandler.create(new PathCodec(), null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private void start(HttpRpcHandler handler) {
        server = vertx.createHttpServer()
                .requestHandler(handler)
                .rxListen(0)
                .blockingGet();
    }

    private HttpResponse<Buffer> post(String path, String body) {
        return client.post(server.actualPort(), "localhost", path)
                .rxSendBuffer(Buffer.buffer(body))
                .blockingGet();
    }

    private static Result echo(Call call) {
        try {
            return Result.success(call.method() + ":" + call.unmarshalArgs(String.class));
        } catch (ArgsUnmarshalException e) {
            return Result.failure(e);
        }
    }

    /**
     * Method is the request path without the leading slash, args are the request body as a string.
     */
    private static class PathCodec implements Codec {

        @Override
        public Single<Call> newCall(CallContext ctx, HttpServerResponse response, HttpServerRequest request) {
            return request.rxBody()
                    .map(body -> new DirectCall(ctx, request.path().substring(1), body.toString()));
        }

        @Override
        public Completable respond(Call call, Result result) {
            var response = HttpRpcHandler.contextResponse(call.context());
            var text = result instanceof Result.Success
                    ? String.valueOf(((Result.Success) result).getValue())
                    : "error: " + ((Result.Failure) result).getError().getMessage();
            return response.rxEnd(text);
        }
    }
}
