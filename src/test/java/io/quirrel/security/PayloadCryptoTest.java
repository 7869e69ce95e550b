package io.quirrel.security;

import io.quirrel.config.ConfigurationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class PayloadCryptoTest {
    private static final String SECRET_A = "01234567890123456789012345678901";
    private static final String SECRET_B = "abcdefghijklmnopqrstuvwxyz012345";

    @Test
    void roundTripsAndRandomizesCiphertext() {
        PayloadCrypto crypto = new PayloadCrypto(SECRET_A, List.of());
        String first = crypto.encrypt("{\"foo\":\"bar\"}");
        String second = crypto.encrypt("{\"foo\":\"bar\"}");
        Assertions.assertNotEquals(first, second);
        Assertions.assertFalse(first.contains("foo"));
        Assertions.assertEquals("{\"foo\":\"bar\"}", crypto.decrypt(first));
        Assertions.assertEquals("{\"foo\":\"bar\"}", crypto.decrypt(second));
    }

    @Test
    void rotatedSecretStillDecryptsOldCiphertext() {
        PayloadCrypto before = new PayloadCrypto(SECRET_A, List.of());
        String sealedBefore = before.encrypt("payload");

        PayloadCrypto after = new PayloadCrypto(SECRET_B, List.of(SECRET_A));
        String sealedAfter = after.encrypt("payload");
        Assertions.assertEquals("payload", after.decrypt(sealedBefore));
        Assertions.assertEquals("payload", after.decrypt(sealedAfter));
        Assertions.assertEquals(2, after.status().totalKeys());
        Assertions.assertNotEquals(before.status().activeKid(), after.status().activeKid());

        Assertions.assertThrows(DecryptionFailedException.class, () -> before.decrypt(sealedAfter));
    }

    @Test
    void tamperedOrForeignInputFails() {
        PayloadCrypto crypto = new PayloadCrypto(SECRET_A, List.of());
        String sealed = crypto.encrypt("payload");
        String tampered = sealed.replace("\"ct\":\"", "\"ct\":\"AAAA");
        Assertions.assertThrows(DecryptionFailedException.class, () -> crypto.decrypt(tampered));
        Assertions.assertThrows(DecryptionFailedException.class, () -> crypto.decrypt("plain text"));
        Assertions.assertThrows(DecryptionFailedException.class, () -> crypto.decrypt("{\"enc\":\"other\"}"));
        Assertions.assertThrows(DecryptionFailedException.class, () -> crypto.decrypt(""));
    }

    @Test
    void secretLengthIsEnforced() {
        Assertions.assertThrows(ConfigurationException.class, () -> new PayloadCrypto("too-short", List.of()));
        Assertions.assertThrows(ConfigurationException.class, () -> new PayloadCrypto(SECRET_A, List.of("short")));
    }
}
