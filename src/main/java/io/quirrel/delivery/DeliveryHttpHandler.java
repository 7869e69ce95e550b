package io.quirrel.delivery;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.quirrel.QuirrelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Exposes a {@link DeliveryResponder} as an {@link HttpServer} context accepting POST deliveries.
 */
public final class DeliveryHttpHandler implements HttpHandler {
    private static final Logger LOG = LoggerFactory.getLogger(DeliveryHttpHandler.class);

    private final DeliveryResponder<?> responder;

    public DeliveryHttpHandler(DeliveryResponder<?> responder) {
        this.responder = responder;
    }

    /**
     * Mounts the responder at {@code /<route>} (a leading slash in the route is kept as is).
     */
    public static void mount(HttpServer server, DeliveryResponder<?> responder) {
        String route = responder.route();
        server.createContext(route.startsWith("/") ? route : "/" + route, new DeliveryHttpHandler(responder));
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.getResponseHeaders().set("Allow", "POST");
                write(exchange, 405, "Method Not Allowed");
                return;
            }
            String body;
            try (InputStream in = exchange.getRequestBody()) {
                body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            DeliveryResponse response;
            try {
                response = responder.respond(body, flatten(exchange.getRequestHeaders()));
            } catch (QuirrelException e) {
                LOG.error("Delivery to {} could not be processed: {}", responder.route(), e.getMessage());
                response = DeliveryResponse.failed(e);
            } catch (RuntimeException e) {
                LOG.error("Delivery to {} could not be processed", responder.route(), e);
                response = DeliveryResponse.failed(e);
            }
            for (Map.Entry<String, String> header : response.headers().entrySet()) {
                exchange.getResponseHeaders().set(header.getKey(), header.getValue());
            }
            write(exchange, response.status(), response.body());
        } finally {
            exchange.close();
        }
    }

    static Map<String, String> flatten(Map<String, List<String>> headers) {
        Map<String, String> out = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null && !entry.getValue().isEmpty()) {
                out.put(entry.getKey(), entry.getValue().get(0));
            }
        }
        return out;
    }

    private static void write(HttpExchange exchange, int status, String text) throws IOException {
        byte[] bytes = (text == null ? "" : text).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
