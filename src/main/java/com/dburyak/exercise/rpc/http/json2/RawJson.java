package com.dburyak.exercise.rpc.http.json2;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * JSON value kept exactly as it appeared on the wire. Used for request ids, which must be echoed back unchanged,
 * and for params, which are decoded only once the handler knows the target type.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class RawJson {
    public static final RawJson NULL = new RawJson("null");

    String text;

    /**
     * Encodes the given value as JSON.
     */
    public static RawJson of(Object value) {
        return new RawJson(Json2Mapper.encodeToString(value));
    }

    @Override
    public String toString() {
        return text;
    }
}
