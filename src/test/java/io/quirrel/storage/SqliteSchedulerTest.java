package io.quirrel.storage;

import io.quirrel.schedule.Schedule;
import io.quirrel.schedule.ScheduleKind;
import io.quirrel.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

final class SqliteSchedulerTest {
    private static final Instant START = Instant.parse("2024-05-01T12:00:30Z");

    private Path root;
    private Database database;
    private MutableClock clock;
    private SqliteScheduler scheduler;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("quirrel-test-sqlite");
        database = Database.forUrl("sqlite:" + root.resolve("quirrel.db"));
        clock = new MutableClock(START);
        scheduler = new SqliteScheduler(database, "test", clock);
    }

    @AfterEach
    void tearDown() throws Exception {
        deleteRecursively(root);
    }

    @Test
    void replaceKeepsOneEntryPerName() {
        long first = scheduler.replace(entry("job:api/a:1", "api/a", "1", once(0L, List.of())));
        long second = scheduler.replace(entry("job:api/a:1", "api/a", "1", once(5_000L, List.of())));

        Assertions.assertNotEquals(first, second);
        Assertions.assertTrue(scheduler.findById(first).isEmpty());
        StoredJob stored = scheduler.findByName("job:api/a:1").orElseThrow();
        Assertions.assertEquals(second, stored.id());
        Assertions.assertEquals(START.plusMillis(5_000L), stored.runAt());
        Assertions.assertEquals(1, scheduler.page(null, 0L, 10).size());
    }

    @Test
    void createIfAbsentKeepsExistingEntry() {
        Assertions.assertTrue(scheduler.createIfAbsent(entry("job:api/a:1", "api/a", "1", once(0L, List.of()))).isPresent());
        Assertions.assertTrue(scheduler.createIfAbsent(entry("job:api/a:1", "api/a", "1", once(9_000L, List.of()))).isEmpty());
        Assertions.assertEquals(START, scheduler.findByName("job:api/a:1").orElseThrow().runAt());
    }

    @Test
    void pagesByRouteWithKeysetCursor() {
        for (int i = 0; i < 5; i++) {
            scheduler.replace(entry("job:api/a:" + i, "api/a", Integer.toString(i), once(0L, List.of())));
        }
        scheduler.replace(entry("job:api/b:x", "api/b", "x", once(0L, List.of())));

        List<StoredJob> first = scheduler.page("api/a", 0L, 2);
        List<StoredJob> second = scheduler.page("api/a", first.get(1).id(), 2);
        List<StoredJob> third = scheduler.page("api/a", second.get(1).id(), 2);
        Assertions.assertEquals(2, first.size());
        Assertions.assertEquals(2, second.size());
        Assertions.assertEquals(1, third.size());
        Assertions.assertEquals("4", third.get(0).externalId());
        Assertions.assertTrue(scheduler.page("api/a", third.get(0).id(), 2).isEmpty());
        Assertions.assertEquals(6, scheduler.page(null, 0L, 100).size());
    }

    @Test
    void claimsOnlyDueUnleasedEntries() {
        scheduler.replace(entry("job:api/a:now", "api/a", "now", once(0L, List.of())));
        scheduler.replace(entry("job:api/a:later", "api/a", "later", once(60_000L, List.of())));

        List<StoredJob> claimed = scheduler.claimDue(10, 30_000L, true, Set.of());
        Assertions.assertEquals(1, claimed.size());
        Assertions.assertEquals("now", claimed.get(0).externalId());
        Assertions.assertTrue(scheduler.claimDue(10, 30_000L, true, Set.of()).isEmpty());

        clock.advance(Duration.ofSeconds(61));
        List<StoredJob> later = scheduler.claimDue(10, 30_000L, true, Set.of());
        Assertions.assertEquals(2, later.size(), "expired lease makes the first entry claimable again");
    }

    @Test
    void oversizedOffsetsNeverWrapIntoThePast() {
        Schedule far = new Schedule(ScheduleKind.ONCE, Long.MAX_VALUE, Instant.MAX, null, null, null, List.of(), false);
        scheduler.replace(entry("job:api/a:far", "api/a", "far", far));
        Assertions.assertTrue(scheduler.claimDue(10, 30_000L, true, Set.of()).isEmpty());
        Assertions.assertEquals(Long.MAX_VALUE, scheduler.findByName("job:api/a:far").orElseThrow().runAt().toEpochMilli());

        Assertions.assertEquals(Long.MAX_VALUE, SqliteScheduler.saturatedAdd(START.toEpochMilli(), Long.MAX_VALUE));
        Assertions.assertEquals(START.toEpochMilli() + 1_000L, SqliteScheduler.saturatedAdd(START.toEpochMilli(), 1_000L));
    }

    @Test
    void busyRoutesAreSkipped() {
        scheduler.replace(entry("job:api/a:1", "api/a", "1", once(0L, List.of())));
        scheduler.replace(entry("job:api/b:1", "api/b", "1", once(0L, List.of())));

        List<StoredJob> claimed = scheduler.claimDue(10, 30_000L, true, Set.of("api/a"));
        Assertions.assertEquals(1, claimed.size());
        Assertions.assertEquals("api/b", claimed.get(0).route());
    }

    @Test
    void cronEntriesCanBeExcluded() {
        Schedule cron = new Schedule(ScheduleKind.CRON, 0L, START, null, null, "* * * * *", List.of(), false);
        long id = scheduler.replace(entry("cron-job:api/c", "api/c", "@cron", cron));
        Assertions.assertEquals(Instant.parse("2024-05-01T12:01:00Z"), scheduler.findById(id).orElseThrow().runAt());

        clock.advance(Duration.ofMinutes(2));
        Assertions.assertTrue(scheduler.claimDue(10, 30_000L, false, Set.of()).isEmpty());
        Assertions.assertEquals(1, scheduler.claimDue(10, 30_000L, true, Set.of()).size());
    }

    @Test
    void failedOneShotWalksRetryLadder() {
        long id = scheduler.replace(entry("job:api/a:r", "api/a", "r", once(0L, List.of(1_000L, 2_000L))));

        StoredJob attempt1 = scheduler.claimDue(10, 30_000L, true, Set.of()).get(0);
        Assertions.assertEquals(1, attempt1.count());
        Assertions.assertTrue(scheduler.completeFailure(attempt1));
        StoredJob afterFirst = scheduler.findById(id).orElseThrow();
        Assertions.assertEquals(2, afterFirst.count());
        Assertions.assertEquals(START.plusMillis(1_000L), afterFirst.runAt());

        clock.advance(Duration.ofSeconds(1));
        StoredJob attempt2 = scheduler.claimDue(10, 30_000L, true, Set.of()).get(0);
        Assertions.assertTrue(scheduler.completeFailure(attempt2));
        Assertions.assertEquals(clock.instant().plusMillis(2_000L), scheduler.findById(id).orElseThrow().runAt());

        clock.advance(Duration.ofSeconds(2));
        StoredJob attempt3 = scheduler.claimDue(10, 30_000L, true, Set.of()).get(0);
        Assertions.assertEquals(3, attempt3.count());
        Assertions.assertFalse(scheduler.completeFailure(attempt3));
        Assertions.assertTrue(scheduler.findById(id).isEmpty());
    }

    @Test
    void repeatingEntryStopsAfterTimes() {
        Schedule every = new Schedule(ScheduleKind.EVERY, 0L, START, 10_000L, 2, null, List.of(), false);
        long id = scheduler.replace(entry("job:api/e:1", "api/e", "1", every));

        StoredJob first = scheduler.claimDue(10, 30_000L, true, Set.of()).get(0);
        Assertions.assertEquals(clock.instant().plusMillis(10_000L), scheduler.nextRepetition(first));
        scheduler.completeSuccess(first);
        StoredJob advanced = scheduler.findById(id).orElseThrow();
        Assertions.assertEquals(2, advanced.count());
        Assertions.assertEquals(START.plusMillis(10_000L), advanced.runAt());

        clock.advance(Duration.ofSeconds(10));
        StoredJob second = scheduler.claimDue(10, 30_000L, true, Set.of()).get(0);
        Assertions.assertNull(scheduler.nextRepetition(second));
        scheduler.completeSuccess(second);
        Assertions.assertTrue(scheduler.findById(id).isEmpty());
    }

    @Test
    void triggerNowMakesEntryDue() {
        long id = scheduler.replace(entry("job:api/a:t", "api/a", "t", once(3_600_000L, List.of())));
        Assertions.assertTrue(scheduler.claimDue(10, 30_000L, true, Set.of()).isEmpty());
        Assertions.assertTrue(scheduler.triggerNow(id));
        Assertions.assertEquals(1, scheduler.claimDue(10, 30_000L, true, Set.of()).size());
        Assertions.assertFalse(scheduler.triggerNow(id + 100));
    }

    @Test
    void ownersAreIsolated() {
        SqliteScheduler other = new SqliteScheduler(database, "other", clock);
        scheduler.replace(entry("job:api/a:1", "api/a", "1", once(0L, List.of())));
        other.replace(entry("job:api/a:1", "api/a", "1", once(0L, List.of())));

        Assertions.assertEquals(1, scheduler.unscheduleAll());
        Assertions.assertTrue(scheduler.findByName("job:api/a:1").isEmpty());
        Assertions.assertTrue(other.findByName("job:api/a:1").isPresent());
        Assertions.assertEquals(1, other.page(null, 0L, 10).size());
    }

    @Test
    void corruptRowsAreReported() throws Exception {
        long id = scheduler.replace(entry("job:api/a:1", "api/a", "1", once(0L, List.of())));
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("UPDATE scheduled_jobs SET retry_json='not json' WHERE job_id=?")) {
            ps.setLong(1, id);
            ps.executeUpdate();
        }
        Assertions.assertThrows(CorruptRegistryEntryException.class, () -> scheduler.findById(id));
    }

    @Test
    void storesHttpAction() {
        HttpAction action = new HttpAction("POST", "http://localhost:3000/api/a", Map.of("Authorization", "Bearer t"),
                HttpAction.JSON, "{\"a\":1}");
        long id = scheduler.replace(new ScheduledEntry("job:api/a:1", "api/a", "1", once(0L, List.of()), action));
        StoredJob stored = scheduler.findById(id).orElseThrow();
        Assertions.assertEquals(action, stored.action());
        Assertions.assertEquals("http://localhost:3000/api/a", stored.endpoint());
        Assertions.assertTrue(stored.active());
    }

    private static Schedule once(long delayMs, List<Long> retry) {
        return new Schedule(ScheduleKind.ONCE, delayMs, START.plusMillis(delayMs), null, null, null, retry, false);
    }

    private static ScheduledEntry entry(String name, String route, String id, Schedule schedule) {
        return new ScheduledEntry(name, route, id, schedule,
                HttpAction.post("http://localhost:3000/" + route, Map.of(), "{}"));
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
