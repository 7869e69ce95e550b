package io.quirrel.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.quirrel.config.QuirrelConfig;
import io.quirrel.security.SensitiveDataMasker;
import io.quirrel.util.Hashing;
import io.quirrel.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL audit trail of registry mutations and deliveries.
 *
 * <p>Each row carries the hash of the previous row, so a truncated or edited file no longer
 * verifies. When a signing secret is set the row hash is additionally HMAC-signed.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final String owner;
    private final String signingSecret;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, String owner, String signingSecret, Clock clock) {
        this.auditFile = auditFile;
        this.owner = owner == null || owner.isBlank() ? QuirrelConfig.DEFAULT_OWNER : owner.trim();
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        this.clock = clock;
        try {
            Path parent = auditFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    /**
     * @return null when the configuration names no audit file
     */
    public static AuditLogger fromConfig(QuirrelConfig config, Clock clock) {
        if (config.auditLogFile() == null) {
            return null;
        }
        return new AuditLogger(config.auditLogFile(), config.owner(), config.token(), clock);
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("owner", owner);
        row.put("action", event.action());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Re-computes the hash chain of the whole file.
     *
     * @return false if any row was altered, removed or reordered
     */
    public synchronized boolean verifyChain() {
        String expectedPrev = "";
        try {
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            for (String line : lines) {
                if (line.isBlank()) {
                    continue;
                }
                @SuppressWarnings("unchecked")
                Map<String, Object> row = Jsons.compact().readValue(line, LinkedHashMap.class);
                Object hash = row.remove("hash");
                row.remove("signature");
                if (!expectedPrev.equals(row.get("prev_hash"))) {
                    return false;
                }
                String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(row));
                if (!recomputed.equals(hash)) {
                    return false;
                }
                expectedPrev = recomputed;
            }
            return true;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read audit log", e);
        }
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = Jsons.compact().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read audit log: " + auditFile, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.compact().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.compact().convertValue(masked, LinkedHashMap.class);
    }

    public record AuditEvent(String action, String resource, String result, Map<String, Object> details) {
        public static AuditEvent of(String action, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, resource, result, details == null ? Map.of() : details);
        }
    }
}
