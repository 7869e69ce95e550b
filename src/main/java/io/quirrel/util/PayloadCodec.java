package io.quirrel.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;

import java.io.IOException;
import java.util.Map;

/**
 * JSON encoding of job payloads. Decoding targets the payload type the queue was declared with.
 */
public final class PayloadCodec<T> {
    private final JavaType type;

    private PayloadCodec(JavaType type) {
        this.type = type;
    }

    public static <T> PayloadCodec<T> of(Class<T> type) {
        return new PayloadCodec<>(Jsons.compact().constructType(type));
    }

    public static <T> PayloadCodec<T> of(TypeReference<T> type) {
        return new PayloadCodec<>(Jsons.compact().constructType(type));
    }

    public String encode(Object payload) {
        return Jsons.toCompactJson(payload);
    }

    public T decode(String encoded) throws IOException {
        return Jsons.compact().readValue(encoded, type);
    }

    /**
     * Value handed to handlers when a delivery carries no body at all.
     */
    public T empty() {
        if (type.isMapLikeType() || type.hasRawClass(Object.class)) {
            return Jsons.compact().convertValue(Map.of(), type);
        }
        return null;
    }
}
