package com.dburyak.exercise.rpc.http.json2;

import com.dburyak.exercise.rpc.err.MalformedMessageException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import io.vertx.core.buffer.Buffer;
import lombok.Value;

import java.io.IOException;
import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * JSON-RPC 2.0 request object. Params and id are kept as raw JSON: the id is never type-checked and is echoed back
 * byte-for-byte, params are decoded only when the handler asks for them.
 */
@Value
public class Json2Request {
    public static final String FIELD_VERSION = "jsonrpc";
    public static final String VERSION_2_0 = "2.0";
    public static final String FIELD_METHOD = "method";
    public static final String FIELD_PARAMS = "params";
    public static final String FIELD_ID = "id";
    private static final int ID_BYTES = 16;
    private static final SecureRandom ID_RANDOM = new SecureRandom();

    String version;
    String method;
    RawJson params; // null if absent
    RawJson id; // null if absent, which is not the same as JSON null

    /**
     * Builds an outbound request with a random 16-byte hex-encoded id.
     */
    public static Json2Request create(String method, Object params) {
        var idBytes = new byte[ID_BYTES];
        ID_RANDOM.nextBytes(idBytes);
        var id = RawJson.of(HexFormat.of().formatHex(idBytes));
        return new Json2Request(VERSION_2_0, method, RawJson.of(params), id);
    }

    /**
     * Parses a request object. Unknown members are ignored, an absent method is read as an empty string.
     *
     * @throws MalformedMessageException if the text is not a JSON object, or members have wrong types
     */
    public static Json2Request parse(String json) {
        try (var parser = Json2Mapper.MAPPER.getFactory().createParser(json)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw new MalformedMessageException("JSON-RPC request must be a JSON object");
            }
            String version = null;
            String method = null;
            RawJson params = null;
            RawJson id = null;
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                var field = parser.currentName();
                parser.nextToken();
                if (FIELD_VERSION.equals(field)) {
                    version = Json2Mapper.readString(parser, field);
                } else if (FIELD_METHOD.equals(field)) {
                    method = Json2Mapper.readString(parser, field);
                } else if (FIELD_PARAMS.equals(field)) {
                    params = Json2Mapper.readRaw(parser, json);
                } else if (FIELD_ID.equals(field)) {
                    id = Json2Mapper.readRaw(parser, json);
                } else {
                    parser.skipChildren();
                }
            }
            return new Json2Request(version, method != null ? method : "", params, id);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("malformed JSON-RPC request: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedMessageException("failed to read JSON-RPC request", e);
        }
    }

    public Buffer toBuffer() {
        return Json2Mapper.write(gen -> {
            gen.writeStartObject();
            gen.writeStringField(FIELD_VERSION, version);
            gen.writeStringField(FIELD_METHOD, method);
            if (params != null) {
                gen.writeFieldName(FIELD_PARAMS);
                Json2Mapper.writeRaw(gen, params);
            }
            gen.writeFieldName(FIELD_ID);
            Json2Mapper.writeRaw(gen, id);
            gen.writeEndObject();
        });
    }
}
