package io.quirrel.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.quirrel.config.ConfigurationException;
import io.quirrel.config.QuirrelConfig;
import io.quirrel.util.Hashing;
import io.quirrel.util.Jsons;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * End-to-end payload encryption with one active secret and any number of retired ones.
 *
 * <p>Ciphertext is a compact JSON envelope {@code {"enc","kid","iv","ct"}} sealed with AES-256-GCM.
 * A fresh IV is drawn for every call, so equal plaintexts never produce equal ciphertexts, and the
 * GCM tag rejects any tampered envelope. Decryption tries the key named by {@code kid} first, then
 * the active secret, then each retired secret in configuration order.
 */
public final class PayloadCrypto {
    private static final String SCHEMA = "quirrel.aesgcm.v1";
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_IV_BYTES = 12;

    private final SecureRandom secureRandom;
    private final Keyring keyring;

    public PayloadCrypto(String activeSecret, List<String> retiredSecrets) {
        if (activeSecret == null || activeSecret.length() != QuirrelConfig.ENCRYPTION_SECRET_LENGTH) {
            throw new ConfigurationException(
                    "encryption secret must be exactly " + QuirrelConfig.ENCRYPTION_SECRET_LENGTH + " characters long");
        }
        List<NamedKey> keys = new ArrayList<>();
        keys.add(namedKey(activeSecret));
        if (retiredSecrets != null) {
            for (String retired : retiredSecrets) {
                if (retired == null || retired.length() != QuirrelConfig.ENCRYPTION_SECRET_LENGTH) {
                    throw new ConfigurationException(
                            "retired secrets must be exactly " + QuirrelConfig.ENCRYPTION_SECRET_LENGTH + " characters long");
                }
                if (!retired.equals(activeSecret)) {
                    keys.add(namedKey(retired));
                }
            }
        }
        this.secureRandom = new SecureRandom();
        this.keyring = new Keyring(keys.get(0), List.copyOf(keys));
    }

    /**
     * @return null when encryption is not configured, so callers can pass payloads through
     */
    public static PayloadCrypto fromConfig(QuirrelConfig config) {
        if (config.encryptionSecret() == null) {
            return null;
        }
        return new PayloadCrypto(config.encryptionSecret(), config.oldSecrets());
    }

    public String encrypt(String plaintext) {
        if (plaintext == null) {
            return null;
        }
        NamedKey active = keyring.active();
        byte[] iv = new byte[GCM_IV_BYTES];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, active.key(), new GCMParameterSpec(GCM_TAG_BITS, iv));
            byte[] cipherText = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            ObjectNode row = Jsons.compact().createObjectNode();
            row.put("enc", SCHEMA);
            row.put("kid", active.kid());
            row.put("iv", Base64.getEncoder().encodeToString(iv));
            row.put("ct", Base64.getEncoder().encodeToString(cipherText));
            return Jsons.toCompactJson(row);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt payload", e);
        }
    }

    public String decrypt(String envelope) {
        if (envelope == null || envelope.isBlank()) {
            throw new DecryptionFailedException("Encrypted payload is empty");
        }
        JsonNode node;
        try {
            node = Jsons.compact().readTree(envelope.trim());
        } catch (Exception e) {
            throw new DecryptionFailedException("Encrypted payload is not a valid envelope", e);
        }
        if (node == null || !SCHEMA.equals(node.path("enc").asText(""))) {
            throw new DecryptionFailedException("Unknown encryption schema");
        }
        String ivBase64 = node.path("iv").asText("");
        String ctBase64 = node.path("ct").asText("");
        if (ivBase64.isBlank() || ctBase64.isBlank()) {
            throw new DecryptionFailedException("Invalid encrypted payload format: missing iv/ct");
        }
        byte[] iv;
        byte[] cipherText;
        try {
            iv = Base64.getDecoder().decode(ivBase64);
            cipherText = Base64.getDecoder().decode(ctBase64);
        } catch (IllegalArgumentException e) {
            throw new DecryptionFailedException("Invalid encrypted payload encoding", e);
        }
        String kid = node.path("kid").asText("");
        for (NamedKey candidate : keyring.candidatesFor(kid)) {
            try {
                return decrypt(cipherText, iv, candidate.key());
            } catch (GeneralSecurityException ignored) {
                // Tag mismatch: the payload was sealed with another secret in the ring.
            }
        }
        throw new DecryptionFailedException("Unable to decrypt payload with any configured secret");
    }

    public KeyringStatus status() {
        return new KeyringStatus(keyring.active().kid(), keyring.keys().size());
    }

    private static String decrypt(byte[] cipherText, byte[] iv, SecretKeySpec key) throws GeneralSecurityException {
        Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
        cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
        byte[] plain = cipher.doFinal(cipherText);
        return new String(plain, StandardCharsets.UTF_8);
    }

    private static NamedKey namedKey(String secret) {
        // Key material and key id come from domain-separated digests of the secret.
        byte[] raw = Hashing.sha256("quirrel.key:" + secret);
        String kid = "k" + Hashing.sha256Hex("quirrel.kid:" + secret).substring(0, 12);
        return new NamedKey(kid, new SecretKeySpec(raw, "AES"));
    }

    private record NamedKey(String kid, SecretKeySpec key) {
    }

    private record Keyring(NamedKey active, List<NamedKey> keys) {
        List<NamedKey> candidatesFor(String kid) {
            if (kid == null || kid.isBlank()) {
                return keys;
            }
            List<NamedKey> ordered = new ArrayList<>(keys.size());
            for (NamedKey key : keys) {
                if (key.kid().equals(kid)) {
                    ordered.add(key);
                }
            }
            for (NamedKey key : keys) {
                if (!key.kid().equals(kid)) {
                    ordered.add(key);
                }
            }
            return ordered;
        }
    }

    public record KeyringStatus(String activeKid, int totalKeys) {
    }
}
