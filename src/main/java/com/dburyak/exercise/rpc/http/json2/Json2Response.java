package com.dburyak.exercise.rpc.http.json2;

import com.dburyak.exercise.rpc.err.MalformedMessageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import io.vertx.core.buffer.Buffer;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.io.IOException;

/**
 * JSON-RPC 2.0 response object. Holds either a result or an error, never both.
 * <p>
 * On the server side the result is whatever the handler returned. Responses parsed from the wire keep the result
 * as {@link RawJson} until {@link #resultAs(Class)} is called.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Json2Response {
    public static final String FIELD_VERSION = "jsonrpc";
    public static final String VERSION_2_0 = "2.0";
    public static final String FIELD_RESULT = "result";
    public static final String FIELD_ERROR = "error";
    public static final String FIELD_ID = "id";

    String version;
    Object result;
    Json2Error error;
    RawJson id; // null is written as JSON null

    public static Json2Response success(Object result, RawJson id) {
        return new Json2Response(VERSION_2_0, result, null, id);
    }

    public static Json2Response failure(Json2Error error, RawJson id) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new Json2Response(VERSION_2_0, null, error, id);
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * Decodes the result into the given type.
     *
     * @throws MalformedMessageException if the result can't be represented as the given type
     */
    public <T> T resultAs(Class<T> type) {
        if (result == null) {
            return null;
        }
        if (result instanceof RawJson raw) {
            try {
                return Json2Mapper.decode(raw, type);
            } catch (JsonProcessingException e) {
                throw new MalformedMessageException("can't decode result as " + type.getName() + ": "
                        + e.getOriginalMessage(), e);
            }
        }
        return type.cast(result);
    }

    public Buffer toBuffer() {
        return Json2Mapper.write(gen -> {
            gen.writeStartObject();
            gen.writeStringField(FIELD_VERSION, version);
            if (error != null) {
                gen.writeFieldName(FIELD_ERROR);
                error.writeTo(gen);
            } else {
                gen.writeFieldName(FIELD_RESULT);
                if (result instanceof RawJson raw) {
                    Json2Mapper.writeRaw(gen, raw);
                } else {
                    gen.writeObject(result);
                }
            }
            gen.writeFieldName(FIELD_ID);
            Json2Mapper.writeRaw(gen, id);
            gen.writeEndObject();
        });
    }

    /**
     * Parses a response object, as received by a client.
     *
     * @throws MalformedMessageException if the text is not a valid response object
     */
    public static Json2Response parse(String json) {
        try (var parser = Json2Mapper.MAPPER.getFactory().createParser(json)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new MalformedMessageException("JSON-RPC response must be a JSON object");
            }
            String version = null;
            RawJson result = null;
            Json2Error error = null;
            RawJson id = null;
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                var field = parser.currentName();
                var token = parser.nextToken();
                if (FIELD_VERSION.equals(field)) {
                    version = Json2Mapper.readString(parser, field);
                } else if (FIELD_RESULT.equals(field)) {
                    result = Json2Mapper.readRaw(parser, json);
                } else if (FIELD_ERROR.equals(field)) {
                    if (token != JsonToken.VALUE_NULL) {
                        error = Json2Error.fromJson(Json2Mapper.MAPPER.readTree(parser));
                    }
                } else if (FIELD_ID.equals(field)) {
                    id = Json2Mapper.readRaw(parser, json);
                } else {
                    parser.skipChildren();
                }
            }
            if (result != null && error != null) {
                throw new MalformedMessageException("JSON-RPC response has both result and error");
            }
            if (result == null && error == null) {
                throw new MalformedMessageException("JSON-RPC response has neither result nor error");
            }
            return new Json2Response(version, result, error, id);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("malformed JSON-RPC response: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedMessageException("failed to read JSON-RPC response", e);
        }
    }
}
