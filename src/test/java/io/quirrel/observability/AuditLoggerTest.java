package io.quirrel.observability;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    @Test
    void chainVerifiesAndSurvivesReopen() throws Exception {
        Path root = Files.createTempDirectory("quirrel-test-audit");
        try {
            Path file = root.resolve("logs").resolve("audit.log");
            AuditLogger logger = new AuditLogger(file, "worker-1", "secret", CLOCK);
            Assertions.assertEquals("", logger.currentHash());
            logger.log(AuditLogger.AuditEvent.of("job.enqueue", "job:api/a:1", "created", Map.of("route", "api/a")));
            logger.log(AuditLogger.AuditEvent.of("job.delete", "api/a/1", "deleted", null));
            String head = logger.currentHash();
            Assertions.assertTrue(logger.verifyChain());

            AuditLogger reopened = new AuditLogger(file, "worker-1", "secret", CLOCK);
            Assertions.assertEquals(head, reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.of("job.delete_all", "*", "deleted", Map.of("count", 0)));
            Assertions.assertTrue(reopened.verifyChain());

            String last = Files.readAllLines(file, StandardCharsets.UTF_8).get(2);
            Assertions.assertTrue(last.contains("\"signature\""));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void detectsTamperingAndMasksSecrets() throws Exception {
        Path root = Files.createTempDirectory("quirrel-test-audit");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger logger = new AuditLogger(file, null, null, CLOCK);
            logger.log(AuditLogger.AuditEvent.of("job.deliver", "api/a", "ok", Map.of("token", "hunter2")));
            logger.log(AuditLogger.AuditEvent.of("job.deliver", "api/a", "failed", Map.of("id", "1")));

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            Assertions.assertFalse(lines.get(0).contains("hunter2"));
            Assertions.assertFalse(lines.get(0).contains("\"signature\""));

            Files.write(file, List.of(lines.get(0), lines.get(1).replace("\"failed\"", "\"ok\"")), StandardCharsets.UTF_8);
            Assertions.assertFalse(logger.verifyChain());

            Files.write(file, List.of(lines.get(1)), StandardCharsets.UTF_8);
            Assertions.assertFalse(logger.verifyChain());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException ignored) {
                }
            });
        }
    }
}
