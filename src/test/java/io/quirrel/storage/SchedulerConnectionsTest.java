package io.quirrel.storage;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class SchedulerConnectionsTest {
    private static final int THREADS = 16;

    private Path root;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("quirrel-test-connections");
    }

    @AfterEach
    void tearDown() throws Exception {
        SchedulerConnections.closeAll();
        deleteRecursively(root);
    }

    @Test
    void racingCallersShareOneHandle() throws Exception {
        String url = "sqlite:" + root.resolve("quirrel.db");
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch gate = new CountDownLatch(1);
        List<DurableScheduler> handles = new ArrayList<>();
        try {
            List<Future<DurableScheduler>> futures = new ArrayList<>();
            for (int i = 0; i < THREADS; i++) {
                futures.add(pool.submit(() -> {
                    gate.await();
                    return SchedulerConnections.shared(url, "worker");
                }));
            }
            gate.countDown();
            for (Future<DurableScheduler> future : futures) {
                handles.add(future.get(30, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        DurableScheduler first = handles.get(0);
        Assertions.assertInstanceOf(SqliteScheduler.class, first);
        for (DurableScheduler handle : handles) {
            Assertions.assertSame(first, handle);
        }
        Assertions.assertSame(first, SchedulerConnections.shared(url, "worker"));
    }

    @Test
    void ownersGetSeparateHandles() {
        String url = "sqlite:" + root.resolve("quirrel.db");
        DurableScheduler a = SchedulerConnections.shared(url, "a");
        DurableScheduler b = SchedulerConnections.shared(url, "b");
        Assertions.assertNotSame(a, b);

        SchedulerConnections.closeAll();
        Assertions.assertNotSame(a, SchedulerConnections.shared(url, "a"));
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
