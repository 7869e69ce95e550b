package io.quirrel.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import io.quirrel.schedule.CronExpressions;
import io.quirrel.schedule.Schedule;
import io.quirrel.schedule.ScheduleKind;
import io.quirrel.util.Jsons;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable scheduler backed by a local SQLite file.
 *
 * <p>Supports every schedule kind. Entries are fired by a {@link io.quirrel.delivery.Dispatcher}
 * that claims due rows with a short lease, so a crashed dispatcher only delays a delivery until the
 * lease runs out (at-least-once). The unique index on {@code (owner, job_name)} backs the
 * one-live-entry-per-name invariant.
 */
public final class SqliteScheduler implements DurableScheduler {
    private static final TypeReference<List<Long>> RETRY_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, String>> HEADERS_TYPE = new TypeReference<>() {
    };
    private static final String COLUMNS = "job_id,job_name,route,external_id,kind,cron,every_ms,times_limit,retry_json,"
            + "exclusive,run_count,next_run_at_ms,active,method,url,headers_json,content_type,body";

    private final Database database;
    private final String owner;
    private final Clock clock;
    private final Object schemaLock = new Object();
    private volatile boolean schemaReady;

    public SqliteScheduler(Database database, String owner, Clock clock) {
        if (database.dialect() != Database.Dialect.SQLITE) {
            throw new IllegalArgumentException("SqliteScheduler requires a SQLite database, got " + database.dialect());
        }
        this.database = database;
        this.owner = owner;
        this.clock = clock;
    }

    public String owner() {
        return owner;
    }

    /**
     * Creates the schema on first use. Safe to call from racing threads.
     */
    public void init() {
        if (schemaReady) {
            return;
        }
        synchronized (schemaLock) {
            if (schemaReady) {
                return;
            }
            try (Connection c = database.openConnection(); Statement st = c.createStatement()) {
                st.execute("PRAGMA journal_mode=WAL");
                st.execute("""
                        CREATE TABLE IF NOT EXISTS scheduled_jobs (
                            job_id INTEGER PRIMARY KEY AUTOINCREMENT,
                            owner TEXT NOT NULL,
                            job_name TEXT NOT NULL,
                            route TEXT NOT NULL,
                            external_id TEXT,
                            kind TEXT NOT NULL,
                            cron TEXT,
                            every_ms INTEGER,
                            times_limit INTEGER,
                            retry_json TEXT NOT NULL DEFAULT '[]',
                            exclusive INTEGER NOT NULL DEFAULT 0,
                            run_count INTEGER NOT NULL DEFAULT 1,
                            next_run_at_ms INTEGER NOT NULL,
                            active INTEGER NOT NULL DEFAULT 1,
                            lease_until_ms INTEGER NOT NULL DEFAULT 0,
                            method TEXT NOT NULL,
                            url TEXT NOT NULL,
                            headers_json TEXT NOT NULL DEFAULT '{}',
                            content_type TEXT NOT NULL,
                            body TEXT,
                            created_at_ms INTEGER NOT NULL,
                            updated_at_ms INTEGER NOT NULL
                        )
                        """);
                st.execute("CREATE UNIQUE INDEX IF NOT EXISTS ux_scheduled_jobs_owner_name ON scheduled_jobs(owner, job_name)");
                st.execute("CREATE INDEX IF NOT EXISTS idx_scheduled_jobs_due ON scheduled_jobs(active, next_run_at_ms)");
                st.execute("CREATE INDEX IF NOT EXISTS idx_scheduled_jobs_route ON scheduled_jobs(owner, route, job_id)");
            } catch (SQLException e) {
                throw unavailable("initialize schema", e);
            }
            schemaReady = true;
        }
    }

    @Override
    public long replace(ScheduledEntry entry) {
        return write(entry, true).orElseThrow(() -> new RegistryUnavailableException(
                "Scheduler store failed to replace " + entry.name() + ": no row written", null));
    }

    /**
     * Creates {@code entry} only if no entry with its name exists. The unique name index decides, so
     * racing writers from other processes cannot both create it.
     */
    @Override
    public Optional<Long> createIfAbsent(ScheduledEntry entry) {
        return write(entry, false);
    }

    private Optional<Long> write(ScheduledEntry entry, boolean replaceExisting) {
        init();
        Schedule s = entry.schedule();
        long now = clock.millis();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement del = c.prepareStatement(
                    "DELETE FROM scheduled_jobs WHERE owner=? AND job_name=?");
                 PreparedStatement ins = c.prepareStatement(
                         "INSERT INTO scheduled_jobs(owner,job_name,route,external_id,kind,cron,every_ms,times_limit,retry_json,"
                                 + "exclusive,run_count,next_run_at_ms,active,method,url,headers_json,content_type,body,"
                                 + "created_at_ms,updated_at_ms) VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?) "
                                 + "ON CONFLICT(owner, job_name) DO NOTHING",
                         Statement.RETURN_GENERATED_KEYS)) {
                if (replaceExisting) {
                    del.setString(1, owner);
                    del.setString(2, entry.name());
                    del.executeUpdate();
                }

                HttpAction action = entry.action();
                ins.setString(1, owner);
                ins.setString(2, entry.name());
                ins.setString(3, entry.route());
                ins.setString(4, entry.externalId());
                ins.setString(5, s.kind().name());
                ins.setString(6, s.cron());
                setNullableLong(ins, 7, s.everyMs());
                setNullableLong(ins, 8, s.times() == null ? null : s.times().longValue());
                ins.setString(9, Jsons.toCompactJson(s.retry()));
                ins.setInt(10, s.exclusive() ? 1 : 0);
                ins.setInt(11, 1);
                ins.setLong(12, firstDue(s, now));
                ins.setInt(13, 1);
                ins.setString(14, action.method());
                ins.setString(15, action.url());
                ins.setString(16, Jsons.toCompactJson(action.headers()));
                ins.setString(17, action.contentType());
                ins.setString(18, action.body());
                ins.setLong(19, now);
                ins.setLong(20, now);
                if (ins.executeUpdate() == 0) {
                    c.commit();
                    return Optional.empty();
                }
                long id;
                try (ResultSet keys = ins.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new SQLException("No generated key for " + entry.name());
                    }
                    id = keys.getLong(1);
                }
                c.commit();
                return Optional.of(id);
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw unavailable((replaceExisting ? "replace " : "create ") + entry.name(), e);
        }
    }

    @Override
    public Optional<StoredJob> findById(long id) {
        init();
        return queryOne("SELECT " + COLUMNS + " FROM scheduled_jobs WHERE owner=? AND job_id=?", owner, id);
    }

    @Override
    public Optional<StoredJob> findByName(String name) {
        init();
        return queryOne("SELECT " + COLUMNS + " FROM scheduled_jobs WHERE owner=? AND job_name=?", owner, name);
    }

    @Override
    public List<StoredJob> page(String route, long afterId, int limit) {
        init();
        String sql = route == null
                ? "SELECT " + COLUMNS + " FROM scheduled_jobs WHERE owner=? AND job_id>? ORDER BY job_id LIMIT ?"
                : "SELECT " + COLUMNS + " FROM scheduled_jobs WHERE owner=? AND route=? AND job_id>? ORDER BY job_id LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int i = 1;
            ps.setString(i++, owner);
            if (route != null) {
                ps.setString(i++, route);
            }
            ps.setLong(i++, afterId);
            ps.setInt(i, Math.max(1, limit));
            List<StoredJob> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw unavailable("list entries", e);
        }
    }

    @Override
    public int unscheduleByName(String name) {
        init();
        return update("DELETE FROM scheduled_jobs WHERE owner=? AND job_name=?", owner, name);
    }

    @Override
    public boolean unscheduleById(long id) {
        init();
        return update("DELETE FROM scheduled_jobs WHERE owner=? AND job_id=?", owner, id) > 0;
    }

    @Override
    public int unscheduleAll() {
        init();
        return update("DELETE FROM scheduled_jobs WHERE owner=?", owner);
    }

    @Override
    public boolean triggerNow(long id) {
        init();
        long now = clock.millis();
        return update(
                "UPDATE scheduled_jobs SET next_run_at_ms=?, updated_at_ms=? WHERE owner=? AND job_id=? AND active=1",
                now, now, owner, id
        ) > 0;
    }

    /**
     * Leases up to {@code limit} due entries. Rows already leased by another dispatcher are skipped.
     *
     * @param includeCron false leaves cron-kind entries untouched
     * @param busyRoutes  routes with an exclusive job in flight; none of their entries are claimed
     */
    public List<StoredJob> claimDue(int limit, long leaseMs, boolean includeCron, Set<String> busyRoutes) {
        init();
        long now = clock.millis();
        List<StoredJob> candidates = new ArrayList<>();
        String sql = "SELECT " + COLUMNS + " FROM scheduled_jobs WHERE owner=? AND active=1 AND next_run_at_ms<=? "
                + "AND lease_until_ms<=? " + (includeCron ? "" : "AND kind<>'CRON' ")
                + "ORDER BY next_run_at_ms, job_id LIMIT ?";
        try (Connection c = database.openConnection()) {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, owner);
                ps.setLong(2, now);
                ps.setLong(3, now);
                ps.setInt(4, Math.max(1, limit));
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        candidates.add(map(rs));
                    }
                }
            }
            List<StoredJob> claimed = new ArrayList<>();
            try (PreparedStatement lease = c.prepareStatement(
                    "UPDATE scheduled_jobs SET lease_until_ms=?, updated_at_ms=? WHERE job_id=? AND lease_until_ms<=?")) {
                for (StoredJob job : candidates) {
                    if (busyRoutes.contains(job.route())) {
                        continue;
                    }
                    lease.setLong(1, now + leaseMs);
                    lease.setLong(2, now);
                    lease.setLong(3, job.id());
                    lease.setLong(4, now);
                    if (lease.executeUpdate() == 1) {
                        claimed.add(job);
                    }
                }
            }
            return claimed;
        } catch (SQLException e) {
            throw unavailable("claim due entries", e);
        }
    }

    /**
     * Records a successful delivery: repeating entries advance, one-shot entries are removed.
     */
    public void completeSuccess(StoredJob job) {
        advanceOrRemove(job);
    }

    /**
     * Records a failed delivery. The retry ladder decides the next attempt; once it is exhausted a
     * one-shot entry is removed and a repeating entry moves on to its next repetition.
     *
     * @return true if another attempt was scheduled from the retry ladder
     */
    public boolean completeFailure(StoredJob job) {
        int attempt = job.count();
        if (job.kind() == ScheduleKind.ONCE && attempt - 1 < job.retry().size()) {
            long now = clock.millis();
            long next = saturatedAdd(now, job.retry().get(attempt - 1));
            update("UPDATE scheduled_jobs SET run_count=?, next_run_at_ms=?, lease_until_ms=0, updated_at_ms=? WHERE job_id=?",
                    attempt + 1, next, now, job.id());
            return true;
        }
        advanceOrRemove(job);
        return false;
    }

    /**
     * Drops the lease of a claimed entry that was not fired, making it claimable again.
     */
    public void release(StoredJob job) {
        update("UPDATE scheduled_jobs SET lease_until_ms=0 WHERE job_id=?", job.id());
    }

    /**
     * Removes an entry whose repetition bound was reached before it could fire.
     */
    public void retire(StoredJob job) {
        update("DELETE FROM scheduled_jobs WHERE job_id=?", job.id());
    }

    /**
     * @return when the repetition after the current one is due, or null if there is none
     */
    public Instant nextRepetition(StoredJob job) {
        if (job.kind() == ScheduleKind.ONCE) {
            return null;
        }
        if (job.times() != null && job.count() >= job.times()) {
            return null;
        }
        Instant now = clock.instant();
        if (job.kind() == ScheduleKind.EVERY) {
            return Instant.ofEpochMilli(saturatedAdd(now.toEpochMilli(), job.everyMs()));
        }
        return CronExpressions.nextExecution(job.cron(), now).orElse(null);
    }

    @Override
    public void close() {
        // Connections are per operation; nothing is held open.
    }

    private void advanceOrRemove(StoredJob job) {
        Instant next = nextRepetition(job);
        if (next == null) {
            update("DELETE FROM scheduled_jobs WHERE job_id=?", job.id());
            return;
        }
        long now = clock.millis();
        update("UPDATE scheduled_jobs SET run_count=?, next_run_at_ms=?, lease_until_ms=0, updated_at_ms=? WHERE job_id=?",
                job.count() + 1, next.toEpochMilli(), now, job.id());
    }

    private static long firstDue(Schedule s, long now) {
        long due = saturatedAdd(now, s.delayMs());
        if (s.kind() == ScheduleKind.CRON && s.delayMs() == 0L) {
            return CronExpressions.nextExecution(s.cron(), Instant.ofEpochMilli(now))
                    .map(Instant::toEpochMilli)
                    .orElse(due);
        }
        return due;
    }

    /**
     * Due times past the end of representable time stay there instead of wrapping into the past.
     */
    static long saturatedAdd(long now, long offsetMs) {
        try {
            return Math.addExact(now, offsetMs);
        } catch (ArithmeticException e) {
            return offsetMs > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
    }

    private Optional<StoredJob> queryOne(String sql, Object... args) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            bind(ps, args);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw unavailable("read entry", e);
        }
    }

    private int update(String sql, Object... args) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            bind(ps, args);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw unavailable("update entries", e);
        }
    }

    private static void bind(PreparedStatement ps, Object... args) throws SQLException {
        for (int i = 0; i < args.length; i++) {
            Object arg = args[i];
            if (arg instanceof String s) {
                ps.setString(i + 1, s);
            } else if (arg instanceof Long l) {
                ps.setLong(i + 1, l);
            } else if (arg instanceof Integer n) {
                ps.setInt(i + 1, n);
            } else {
                throw new IllegalArgumentException("Unsupported bind type: " + arg);
            }
        }
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value);
        }
    }

    private static StoredJob map(ResultSet rs) throws SQLException {
        long id = rs.getLong("job_id");
        try {
            long every = rs.getLong("every_ms");
            Long everyMs = rs.wasNull() ? null : every;
            long times = rs.getLong("times_limit");
            Integer timesLimit = rs.wasNull() ? null : (int) times;
            List<Long> retry = Jsons.compact().readValue(rs.getString("retry_json"), RETRY_TYPE);
            Map<String, String> headers = Jsons.compact().readValue(rs.getString("headers_json"), HEADERS_TYPE);
            HttpAction action = new HttpAction(
                    rs.getString("method"),
                    rs.getString("url"),
                    headers,
                    rs.getString("content_type"),
                    rs.getString("body")
            );
            return new StoredJob(
                    id,
                    rs.getString("job_name"),
                    rs.getString("route"),
                    rs.getString("external_id"),
                    ScheduleKind.valueOf(rs.getString("kind")),
                    rs.getString("cron"),
                    everyMs,
                    timesLimit,
                    retry,
                    rs.getInt("exclusive") == 1,
                    rs.getInt("run_count"),
                    Instant.ofEpochMilli(rs.getLong("next_run_at_ms")),
                    rs.getInt("active") == 1,
                    action
            );
        } catch (IOException | IllegalArgumentException e) {
            throw new CorruptRegistryEntryException("Stored entry " + id + " cannot be read", e);
        }
    }

    private static RegistryUnavailableException unavailable(String operation, SQLException e) {
        return new RegistryUnavailableException("Scheduler store failed to " + operation + ": " + e.getMessage(), e);
    }
}
