package io.quirrel.delivery;

import java.util.Map;

public record DeliveryResponse(int status, Map<String, String> headers, String body) {

    public DeliveryResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static DeliveryResponse ok() {
        return new DeliveryResponse(200, Map.of(), "OK");
    }

    public static DeliveryResponse unauthorized(String reason) {
        return new DeliveryResponse(401, Map.of(), reason);
    }

    public static DeliveryResponse failed(Throwable error) {
        return new DeliveryResponse(500, Map.of(), String.valueOf(error));
    }

    public boolean successful() {
        return status >= 200 && status < 300;
    }
}
