package io.quirrel.delivery;

import io.quirrel.observability.AuditLogger;
import io.quirrel.security.DecryptionFailedException;
import io.quirrel.security.PayloadCrypto;
import io.quirrel.security.WebhookSignature;
import io.quirrel.util.PayloadCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Answers one inbound delivery of a route: authenticate, decrypt, parse metadata, run the handler.
 *
 * <p>Authentication failures become 401 responses and handler failures, errors included, 500
 * responses; neither is thrown. Audit trail failures are logged and never change the response. A {@link DecryptionFailedException} propagates unless a decryption fallback is installed.
 * The responder keeps no state between deliveries and never retries.
 */
public final class DeliveryResponder<T> {
    private static final Logger LOG = LoggerFactory.getLogger(DeliveryResponder.class);

    private final String route;
    private final JobHandler<T> handler;
    private final PayloadCodec<T> codec;
    private final PayloadCrypto crypto;
    private final String token;
    private final boolean production;
    private final Consumer<DecryptionFailedException> decryptionFallback;
    private final AuditLogger auditLogger;

    /**
     * @param crypto             null when payloads travel unencrypted
     * @param production         true enforces the signature header
     * @param decryptionFallback null lets decryption failures propagate
     * @param auditLogger        null disables the audit trail
     */
    public DeliveryResponder(
            String route,
            JobHandler<T> handler,
            PayloadCodec<T> codec,
            PayloadCrypto crypto,
            String token,
            boolean production,
            Consumer<DecryptionFailedException> decryptionFallback,
            AuditLogger auditLogger
    ) {
        this.route = route;
        this.handler = handler;
        this.codec = codec;
        this.crypto = crypto;
        this.token = token;
        this.production = production;
        this.decryptionFallback = decryptionFallback;
        this.auditLogger = auditLogger;
    }

    public String route() {
        return route;
    }

    /**
     * @param headers request headers; names are matched case-insensitively
     */
    public DeliveryResponse respond(String body, Map<String, String> headers) {
        if (production) {
            String signature = header(headers, WebhookSignature.HEADER);
            if (signature == null) {
                LOG.warn("Rejected delivery to {}: signature missing", route);
                audit("rejected", Map.of("reason", "signature_missing"));
                return DeliveryResponse.unauthorized("Signature missing");
            }
            if (!WebhookSignature.verify(body, token, signature)) {
                LOG.warn("Rejected delivery to {}: signature invalid", route);
                audit("rejected", Map.of("reason", "signature_invalid"));
                return DeliveryResponse.unauthorized("Signature invalid");
            }
        }

        String plaintext = decrypt(body);
        JobMeta meta = meta(header(headers, JobMeta.HEADER));
        LOG.debug("Received job {} (count {}) to {}", meta.id(), meta.count(), route);

        try {
            T payload = decode(plaintext);
            handler.handle(payload, meta);
        } catch (Throwable e) {
            if (e instanceof VirtualMachineError fatal) {
                throw fatal;
            }
            LOG.error("Job {} on {} failed", meta.id(), route, e);
            audit("failed", Map.of("id", String.valueOf(meta.id()), "error", String.valueOf(e)));
            return DeliveryResponse.failed(e);
        }
        audit("ok", Map.of("id", String.valueOf(meta.id())));
        return DeliveryResponse.ok();
    }

    /**
     * With a fallback installed, an undecryptable body is reported to the fallback and passed on
     * unchanged.
     */
    private String decrypt(String body) {
        if (crypto == null || body == null || body.isEmpty()) {
            return body;
        }
        try {
            return crypto.decrypt(body);
        } catch (DecryptionFailedException e) {
            if (decryptionFallback == null) {
                throw e;
            }
            LOG.warn("Decryption failed for a delivery to {}: {}", route, e.getMessage());
            decryptionFallback.accept(e);
            return body;
        }
    }

    private T decode(String plaintext) throws IOException {
        if (plaintext == null || plaintext.isEmpty()) {
            return codec.empty();
        }
        return codec.decode(plaintext);
    }

    private JobMeta meta(String raw) {
        try {
            return JobMeta.parse(raw);
        } catch (IllegalArgumentException e) {
            LOG.warn("Ignoring malformed {} header on a delivery to {}", JobMeta.HEADER, route);
            return JobMeta.empty();
        }
    }

    static String header(Map<String, String> headers, String name) {
        if (headers == null) {
            return null;
        }
        String direct = headers.get(name);
        if (direct != null) {
            return direct;
        }
        String wanted = name.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().toLowerCase(Locale.ROOT).equals(wanted)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private void audit(String result, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        try {
            auditLogger.log(AuditLogger.AuditEvent.of("job.deliver", route, result, details));
        } catch (RuntimeException e) {
            LOG.error("Audit trail write failed for a delivery to {} ({})", route, result, e);
        }
    }
}
