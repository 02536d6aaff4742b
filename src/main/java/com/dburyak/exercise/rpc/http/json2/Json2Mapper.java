package com.dburyak.exercise.rpc.http.json2;

import com.dburyak.exercise.rpc.err.MalformedMessageException;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.EncodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Jackson plumbing shared by the JSON-RPC 2.0 entities. Knows how to (de)serialize Vert.x {@link JsonObject} and
 * {@link JsonArray}, so handlers can use them as params and results.
 */
final class Json2Mapper {
    static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(vertxJsonModule())
            // params must match the requested type, "42" is not an Integer and 1.5 is not an int
            .disable(MapperFeature.ALLOW_COERCION_OF_SCALARS)
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
            .build();

    private Json2Mapper() {
    }

    static <T> T decode(RawJson raw, Class<T> type) throws JsonProcessingException {
        return MAPPER.readValue(raw.getText(), type);
    }

    static String encodeToString(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new EncodeException("failed to encode " + value.getClass().getName() + " as JSON", e);
        }
    }

    static Buffer write(JsonWriter writer) {
        var out = new ByteArrayOutputStream();
        try (var gen = MAPPER.createGenerator(out, JsonEncoding.UTF8)) {
            writer.write(gen);
        } catch (IOException e) {
            throw new EncodeException("failed to encode JSON-RPC message: " + e.getMessage(), e);
        }
        return Buffer.buffer(out.toByteArray());
    }

    static void writeRaw(JsonGenerator gen, RawJson raw) throws IOException {
        if (raw == null) {
            gen.writeNull();
        } else {
            gen.writeRawValue(raw.getText());
        }
    }

    /**
     * Captures the current value of the parser as it appears in the source text, without re-encoding. The parser
     * must have been created from the given source.
     */
    static RawJson readRaw(JsonParser parser, String source) throws IOException {
        var start = (int) parser.currentTokenLocation().getCharOffset();
        if (parser.currentToken().isStructStart()) {
            parser.skipChildren();
        } else {
            // strings are parsed lazily, this makes the parser move past the closing quote
            parser.getText();
        }
        var end = (int) parser.currentLocation().getCharOffset();
        return new RawJson(source.substring(start, end));
    }

    static String readString(JsonParser parser, String field) throws IOException {
        var token = parser.currentToken();
        if (token == JsonToken.VALUE_NULL) {
            return null;
        }
        if (token != JsonToken.VALUE_STRING) {
            throw new MalformedMessageException("\"" + field + "\" must be a string, got " + token);
        }
        return parser.getText();
    }

    @FunctionalInterface
    interface JsonWriter {
        void write(JsonGenerator gen) throws IOException;
    }

    private static SimpleModule vertxJsonModule() {
        var module = new SimpleModule("vertx-json");
        module.addSerializer(JsonObject.class, new StdSerializer<JsonObject>(JsonObject.class) {
            @Override
            public void serialize(JsonObject value, JsonGenerator gen, SerializerProvider provider)
                    throws IOException {
                provider.defaultSerializeValue(value.getMap(), gen);
            }
        });
        module.addSerializer(JsonArray.class, new StdSerializer<JsonArray>(JsonArray.class) {
            @Override
            public void serialize(JsonArray value, JsonGenerator gen, SerializerProvider provider)
                    throws IOException {
                provider.defaultSerializeValue(value.getList(), gen);
            }
        });
        module.addDeserializer(JsonObject.class, new StdDeserializer<JsonObject>(JsonObject.class) {
            @Override
            public JsonObject deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
                return new JsonObject(ctxt.readValue(p, Map.class));
            }
        });
        module.addDeserializer(JsonArray.class, new StdDeserializer<JsonArray>(JsonArray.class) {
            @Override
            public JsonArray deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
                return new JsonArray(ctxt.readValue(p, List.class));
            }
        });
        return module;
    }
}
