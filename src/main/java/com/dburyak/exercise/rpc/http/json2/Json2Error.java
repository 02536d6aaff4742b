package com.dburyak.exercise.rpc.http.json2;

import com.dburyak.exercise.rpc.err.MalformedMessageException;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;

import java.io.IOException;

/**
 * JSON-RPC 2.0 error object. Handlers return it (wrapped into a failed result) to control the exact error code and
 * data sent to the client. Any other error is sent as {@link #SERVER_ERROR} with the error message.
 */
@Getter
public class Json2Error extends RuntimeException {
    public static final String FIELD_CODE = "code";
    public static final String FIELD_MESSAGE = "message";
    public static final String FIELD_DATA = "data";

    /**
     * Invalid JSON was received by the server.
     */
    public static final int PARSE_ERROR = -32700;
    /**
     * The JSON sent is not a valid request object.
     */
    public static final int INVALID_REQUEST = -32600;
    /**
     * The method does not exist or is not available.
     */
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;
    /**
     * Generic implementation-defined server error.
     */
    public static final int SERVER_ERROR = -32000;

    private final int code;
    private final Object data;

    public Json2Error(int code, String message) {
        this(code, message, null);
    }

    /**
     * @param data any value Jackson can encode, omitted from the wire if null
     */
    public Json2Error(int code, String message, Object data) {
        super(message, null, false, false);
        this.code = code;
        this.data = data;
    }

    /**
     * Returns the error as is if it's already a JSON-RPC error, otherwise wraps its message into a
     * {@link #SERVER_ERROR}.
     */
    public static Json2Error from(Throwable err) {
        if (err instanceof Json2Error json2Err) {
            return json2Err;
        }
        var msg = err.getMessage();
        return new Json2Error(SERVER_ERROR, msg != null ? msg : err.getClass().getName());
    }

    void writeTo(JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeNumberField(FIELD_CODE, code);
        gen.writeStringField(FIELD_MESSAGE, getMessage());
        if (data != null) {
            gen.writeFieldName(FIELD_DATA);
            gen.writeObject(data);
        }
        gen.writeEndObject();
    }

    static Json2Error fromJson(JsonNode json) throws IOException {
        if (!json.isObject()) {
            throw new MalformedMessageException("\"error\" must be an object");
        }
        var codeNode = json.get(FIELD_CODE);
        if (codeNode == null || !codeNode.isInt()) {
            throw new MalformedMessageException("\"error.code\" must be an integer");
        }
        var msgNode = json.get(FIELD_MESSAGE);
        if (msgNode != null && !msgNode.isTextual() && !msgNode.isNull()) {
            throw new MalformedMessageException("\"error.message\" must be a string");
        }
        var dataNode = json.get(FIELD_DATA);
        var data = (dataNode != null && !dataNode.isNull())
                ? Json2Mapper.MAPPER.treeToValue(dataNode, Object.class)
                : null;
        return new Json2Error(codeNode.intValue(), msgNode != null ? msgNode.textValue() : null, data);
    }

    @Override
    public String toString() {
        return "Json2Error{code=" + code + ", message=" + getMessage() + ", data=" + data + "}";
    }
}
