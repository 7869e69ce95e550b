package io.quirrel.security;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

final class WebhookSignatureTest {
    private static final String SECRET = "token-for-tests";

    @Test
    void signedBodyVerifies() {
        String body = "{\"foo\":\"bar\"}";
        String signature = WebhookSignature.sign(body, SECRET);
        Assertions.assertTrue(signature.startsWith("v="));
        Assertions.assertTrue(WebhookSignature.verify(body, SECRET, signature));
    }

    @Test
    void anySingleBitMutationIsRejected() {
        String body = "{\"foo\":\"bar\"}";
        String signature = WebhookSignature.sign(body, SECRET, Instant.ofEpochMilli(1_700_000_000_000L));
        for (int i = 0; i < body.length(); i++) {
            char[] chars = body.toCharArray();
            chars[i] = (char) (chars[i] ^ 1);
            Assertions.assertFalse(WebhookSignature.verify(new String(chars), SECRET, signature), "body bit at " + i);
        }
        for (int i = 0; i < signature.length(); i++) {
            char[] chars = signature.toCharArray();
            chars[i] = (char) (chars[i] ^ 1);
            Assertions.assertFalse(WebhookSignature.verify(body, SECRET, new String(chars)), "signature bit at " + i);
        }
    }

    @Test
    void malformedSignaturesAreRejectedWithoutThrowing() {
        String body = "payload";
        String signature = WebhookSignature.sign(body, SECRET);
        Assertions.assertFalse(WebhookSignature.verify(body, SECRET, "bogus"));
        Assertions.assertFalse(WebhookSignature.verify(body, SECRET, ""));
        Assertions.assertFalse(WebhookSignature.verify(body, SECRET, null));
        Assertions.assertFalse(WebhookSignature.verify(body, SECRET, signature.substring(0, signature.length() - 1)));
        Assertions.assertFalse(WebhookSignature.verify(body, "other-secret", signature));
        Assertions.assertFalse(WebhookSignature.verify(body, null, signature));
    }

    @Test
    void maxAgeRejectsStaleSignatures() {
        Instant signedAt = Instant.parse("2024-01-01T00:00:00Z");
        String signature = WebhookSignature.sign("x", SECRET, signedAt);
        Duration maxAge = Duration.ofMinutes(5);
        Assertions.assertTrue(WebhookSignature.verify("x", SECRET, signature, maxAge, signedAt.plusSeconds(60)));
        Assertions.assertFalse(WebhookSignature.verify("x", SECRET, signature, maxAge, signedAt.plusSeconds(600)));
        Assertions.assertTrue(WebhookSignature.verify("x", SECRET, signature, null, signedAt.plusSeconds(600)));
    }
}
