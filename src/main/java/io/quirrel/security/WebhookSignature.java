package io.quirrel.security;

import io.quirrel.util.Hashing;

import java.time.Duration;
import java.time.Instant;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Signs and verifies delivery bodies.
 *
 * <p>Signature format is {@code v=<epochMillis>,d=<hex HMAC-SHA256(secret, body + epochMillis)>}.
 * The timestamp is bound into the digest, so a signature cannot be re-attached to a different
 * moment; receivers that want replay protection pass a maximum age to {@link #verify}.
 */
public final class WebhookSignature {
    public static final String HEADER = "x-quirrel-signature";
    private static final Pattern FORMAT = Pattern.compile("^v=(\\d{1,19}),d=([0-9a-f]{64})$");

    private WebhookSignature() {
    }

    public static String sign(String body, String secret) {
        return sign(body, secret, Instant.now());
    }

    public static String sign(String body, String secret, Instant timestamp) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("signing secret is required");
        }
        long ts = timestamp.toEpochMilli();
        String digest = Hashing.hmacSha256Hex(secret, (body == null ? "" : body) + ts);
        return "v=" + ts + ",d=" + digest;
    }

    public static boolean verify(String body, String secret, String signature) {
        return verify(body, secret, signature, null, Instant.now());
    }

    /**
     * @param maxAge null disables the age check
     * @return false on any mismatch or malformed input; never throws
     */
    public static boolean verify(String body, String secret, String signature, Duration maxAge, Instant now) {
        if (secret == null || secret.isEmpty() || signature == null) {
            return false;
        }
        Matcher m = FORMAT.matcher(signature.trim());
        if (!m.matches()) {
            return false;
        }
        long ts;
        try {
            ts = Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            return false;
        }
        if (maxAge != null && Math.abs(now.toEpochMilli() - ts) > maxAge.toMillis()) {
            return false;
        }
        String expected = Hashing.hmacSha256Hex(secret, (body == null ? "" : body) + ts);
        return Hashing.constantTimeEquals(expected, m.group(2));
    }
}
