package com.dburyak.exercise.rpc.http.json2;

import com.dburyak.exercise.rpc.err.HttpStatusException;
import com.dburyak.exercise.rpc.err.MalformedMessageException;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Single;
import io.vertx.rxjava3.ext.web.client.WebClient;
import lombok.extern.log4j.Log4j2;

import java.util.Objects;

import static io.netty.handler.codec.http.HttpResponseStatus.OK;

/**
 * Minimal JSON-RPC 2.0 client over http. One request per call, no batching and no retries.
 */
@Log4j2
public class Json2Client {
    private static final String CONTENT_TYPE_HEADER = "content-type";
    private static final String ACCEPT_HEADER = "accept";

    private final WebClient webClient;
    private final String url;

    public Json2Client(WebClient webClient, String url) {
        this.webClient = webClient;
        this.url = url;
    }

    /**
     * Calls the method and decodes its result. Completes empty if the result is null, fails with {@link Json2Error}
     * if the server responded with an error object.
     */
    public <T> Maybe<T> call(String method, Object params, Class<T> resultType) {
        return Single.fromCallable(() -> Json2Request.create(method, params))
                .flatMap(this::send)
                .flatMapMaybe(resp -> {
                    if (resp.isFailure()) {
                        return Maybe.error(resp.getError());
                    }
                    var result = resp.resultAs(resultType);
                    return result != null ? Maybe.just(result) : Maybe.empty();
                });
    }

    /**
     * Sends the request as is and parses the response. Fails with {@link HttpStatusException} if the server didn't
     * answer with 200, and with {@link MalformedMessageException} if the response is not a valid response to this
     * request.
     */
    public Single<Json2Response> send(Json2Request request) {
        return webClient.postAbs(url)
                .putHeader(CONTENT_TYPE_HEADER, Json2Codec.CONTENT_TYPE_JSON_UTF8)
                .putHeader(ACCEPT_HEADER, "application/json")
                .rxSendBuffer(request.toBuffer())
                .map(httpResp -> {
                    var body = httpResp.bodyAsString();
                    if (httpResp.statusCode() != OK.code()) {
                        throw new HttpStatusException(httpResp.statusCode(), body);
                    }
                    if (body == null || body.isEmpty()) {
                        throw new MalformedMessageException("empty JSON-RPC response: method=" + request.getMethod());
                    }
                    var resp = Json2Response.parse(body);
                    if (!Objects.equals(resp.getId(), request.getId())) {
                        throw new MalformedMessageException("JSON-RPC response id " + resp.getId()
                                + " doesn't match request id " + request.getId());
                    }
                    log.debug("JSON-RPC call completed: method={}, failed={}", request::getMethod, resp::isFailure);
                    return resp;
                });
    }
}
