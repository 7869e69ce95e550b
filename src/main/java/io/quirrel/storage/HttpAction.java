package io.quirrel.storage;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP call a durable scheduler performs when an entry becomes due.
 *
 * <p>Stores serialize this with their own escaping primitives; values are never spliced
 * into store commands as raw text.
 */
public record HttpAction(
        String method,
        String url,
        Map<String, String> headers,
        String contentType,
        String body
) {
    public static final String JSON = "application/json";

    public HttpAction {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static HttpAction post(String url, Map<String, String> headers, String body) {
        return new HttpAction("POST", url, headers, JSON, body);
    }

    public HttpAction withHeader(String name, String value) {
        Map<String, String> next = new LinkedHashMap<>(headers);
        next.put(name, value);
        return new HttpAction(method, url, next, contentType, body);
    }
}
