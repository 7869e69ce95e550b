package io.quirrel.storage;

import io.quirrel.schedule.CronExpressions;
import io.quirrel.schedule.Schedule;
import io.quirrel.schedule.ScheduleKind;
import io.quirrel.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Durable scheduler on PostgreSQL with the {@code pg_cron} and {@code http} extensions.
 *
 * <p>Every value reaches the server as a bind parameter; the HTTP call is assembled server-side with
 * {@code format('%L')}, so route and header content are always quoted by the database.
 *
 * <p>Supported schedules: cron without a repetition bound, and one-shot jobs without retry. A
 * one-shot job becomes a minute-granularity cron entry for its due minute (UTC, rounded up) that
 * unschedules itself when it fires. Interval repetition and retry ladders fail with
 * {@link UnsupportedScheduleException}.
 */
public final class PgCronScheduler implements DurableScheduler {
    private static final Logger LOG = LoggerFactory.getLogger(PgCronScheduler.class);
    private static final Pattern ENDPOINT = Pattern.compile("'(https?://.*?)'");
    private static final Duration MAX_AHEAD = Duration.ofDays(365);
    private static final String HTTP_CALL = "format('SELECT status FROM http((%L,%L,"
            + "(SELECT coalesce(array_agg(http_header(h.key,h.value)),ARRAY[]::http_header[]) FROM json_each_text(%L::json) h),"
            + "%L,%L)::http_request)', ?, ?, ?, ?, ?)";
    private static final String SCHEDULE_SQL = "SELECT cron.schedule(?, ?, " + HTTP_CALL + ")";
    private static final String SCHEDULE_ONCE_SQL =
            "SELECT cron.schedule(?, ?, format('SELECT cron.unschedule(%L); ', ?) || " + HTTP_CALL + ")";
    private static final String OWNED = "(jobname LIKE 'cron-job:%' OR jobname LIKE 'job:%')";
    private static final String COLUMNS = "jobid, jobname, schedule, command, active";

    private final Database database;
    private final Clock clock;

    public PgCronScheduler(Database database, Clock clock) {
        if (database.dialect() != Database.Dialect.POSTGRES) {
            throw new IllegalArgumentException("PgCronScheduler requires a PostgreSQL database, got " + database.dialect());
        }
        this.database = database;
        this.clock = clock;
    }

    /**
     * Fails fast when the database or the required extensions cannot be reached.
     */
    public void ping() {
        try (Connection c = database.openConnection(); Statement st = c.createStatement()) {
            st.executeQuery("SELECT count(*) FROM cron.job").close();
        } catch (SQLException e) {
            throw unavailable("reach cron.job", e);
        }
    }

    @Override
    public long replace(ScheduledEntry entry) {
        return schedule(entry, true).orElseThrow(() -> new RegistryUnavailableException(
                "Scheduler store failed to schedule " + entry.name() + ": no job created", null));
    }

    @Override
    public Optional<Long> createIfAbsent(ScheduledEntry entry) {
        return schedule(entry, false);
    }

    /**
     * Runs under a transaction-scoped advisory lock on the entry name, so writers of the same name
     * in any process take turns.
     */
    private Optional<Long> schedule(ScheduledEntry entry, boolean replaceExisting) {
        Schedule s = entry.schedule();
        String cron = cronFor(entry.name(), s);
        boolean once = s.kind() == ScheduleKind.ONCE;
        HttpAction action = entry.action();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement lock = c.prepareStatement("SELECT pg_advisory_xact_lock(hashtext(?))");
                 PreparedStatement existing = c.prepareStatement("SELECT 1 FROM cron.job WHERE jobname=?");
                 PreparedStatement del = c.prepareStatement("DELETE FROM cron.job WHERE jobname=?");
                 PreparedStatement ps = c.prepareStatement(once ? SCHEDULE_ONCE_SQL : SCHEDULE_SQL)) {
                lock.setString(1, entry.name());
                lock.executeQuery().close();
                if (replaceExisting) {
                    del.setString(1, entry.name());
                    int removed = del.executeUpdate();
                    if (removed > 0) {
                        LOG.info("Deleted {} existing job(s) for {}", removed, entry.name());
                    }
                } else {
                    existing.setString(1, entry.name());
                    try (ResultSet rs = existing.executeQuery()) {
                        if (rs.next()) {
                            c.commit();
                            return Optional.empty();
                        }
                    }
                }
                int i = 1;
                ps.setString(i++, entry.name());
                ps.setString(i++, cron);
                if (once) {
                    ps.setString(i++, entry.name());
                }
                ps.setString(i++, action.method());
                ps.setString(i++, action.url());
                ps.setString(i++, Jsons.toCompactJson(action.headers()));
                ps.setString(i++, action.contentType());
                ps.setString(i, action.body() == null ? "" : action.body());
                long id;
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        throw new SQLException("cron.schedule returned no job id for " + entry.name());
                    }
                    id = rs.getLong(1);
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
            throw unavailable("schedule " + entry.name(), e);
        }
    }

    @Override
    public Optional<StoredJob> findById(long id) {
        return queryOne("SELECT " + COLUMNS + " FROM cron.job WHERE jobid=? AND " + OWNED, ps -> ps.setLong(1, id));
    }

    @Override
    public Optional<StoredJob> findByName(String name) {
        return queryOne("SELECT " + COLUMNS + " FROM cron.job WHERE jobname=?", ps -> ps.setString(1, name));
    }

    @Override
    public List<StoredJob> page(String route, long afterId, int limit) {
        String sql = route == null
                ? "SELECT " + COLUMNS + " FROM cron.job WHERE jobid>? AND " + OWNED + " ORDER BY jobid LIMIT ?"
                : "SELECT " + COLUMNS + " FROM cron.job WHERE jobid>? AND (jobname=? OR jobname LIKE ? ESCAPE '\\') "
                + "ORDER BY jobid LIMIT ?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int i = 1;
            ps.setLong(i++, afterId);
            if (route != null) {
                ps.setString(i++, JobNames.cron(route));
                ps.setString(i++, JobNames.jobLikePattern(route));
            }
            ps.setInt(i, Math.max(1, limit));
            List<StoredJob> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw unavailable("list cron.job", e);
        }
    }

    @Override
    public int unscheduleByName(String name) {
        return update("DELETE FROM cron.job WHERE jobname=?", ps -> ps.setString(1, name));
    }

    @Override
    public boolean unscheduleById(long id) {
        return update("DELETE FROM cron.job WHERE jobid=? AND " + OWNED, ps -> ps.setLong(1, id)) > 0;
    }

    @Override
    public int unscheduleAll() {
        return update("DELETE FROM cron.job WHERE " + OWNED, ps -> {
        });
    }

    /**
     * Runs the stored command in the caller's session. A one-shot entry unschedules itself as usual.
     */
    @Override
    public boolean triggerNow(long id) {
        try (Connection c = database.openConnection()) {
            String command;
            try (PreparedStatement ps = c.prepareStatement("SELECT command FROM cron.job WHERE jobid=? AND " + OWNED)) {
                ps.setLong(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return false;
                    }
                    command = rs.getString(1);
                }
            }
            try (Statement st = c.createStatement()) {
                st.execute(command);
            }
            return true;
        } catch (SQLException e) {
            throw unavailable("trigger job " + id, e);
        }
    }

    @Override
    public void close() {
        // Connections are per operation; nothing is held open.
    }

    String cronFor(String name, Schedule s) {
        if (!s.retry().isEmpty()) {
            throw new UnsupportedScheduleException("retry is not supported by the pg_cron scheduler (" + name + ")");
        }
        switch (s.kind()) {
            case EVERY:
                throw new UnsupportedScheduleException("repeat.every is not supported by the pg_cron scheduler (" + name + ")");
            case CRON:
                if (s.times() != null) {
                    throw new UnsupportedScheduleException("repeat.times is not supported by the pg_cron scheduler (" + name + ")");
                }
                if (s.delayMs() > 0L) {
                    throw new UnsupportedScheduleException("delayed cron jobs are not supported by the pg_cron scheduler (" + name + ")");
                }
                return s.cron();
            case ONCE:
            default:
                return minuteCron(s.runAt());
        }
    }

    String minuteCron(Instant due) {
        Instant now = clock.instant();
        if (due.isAfter(now.plus(MAX_AHEAD))) {
            throw new UnsupportedScheduleException("Cannot schedule more than 1 year in advance");
        }
        ZonedDateTime at = ZonedDateTime.ofInstant(due, ZoneOffset.UTC);
        ZonedDateTime minute = at.truncatedTo(ChronoUnit.MINUTES);
        if (minute.isBefore(at)) {
            minute = minute.plusMinutes(1);
        }
        return minute.getMinute() + " " + minute.getHour() + " " + minute.getDayOfMonth() + " "
                + minute.getMonthValue() + " *";
    }

    private StoredJob map(ResultSet rs) throws SQLException {
        long id = rs.getLong("jobid");
        String name = rs.getString("jobname");
        String schedule = rs.getString("schedule");
        String command = rs.getString("command");
        Matcher m = ENDPOINT.matcher(command == null ? "" : command);
        if (!m.find()) {
            throw new CorruptRegistryEntryException("Failed to parse job endpoint of cron.job " + id);
        }
        String endpoint = m.group(1);
        boolean once = command.contains("cron.unschedule(");
        Instant next;
        try {
            next = CronExpressions.nextExecution(schedule, clock.instant()).orElse(null);
        } catch (RuntimeException e) {
            throw new CorruptRegistryEntryException("cron.job " + id + " has an unreadable schedule: " + schedule, e);
        }
        JobNames.Parsed parsed = JobNames.parse(name);
        return new StoredJob(
                id,
                name,
                parsed.route(),
                parsed.externalId(),
                once ? ScheduleKind.ONCE : ScheduleKind.CRON,
                once ? null : schedule,
                null,
                null,
                List.of(),
                false,
                1,
                next,
                rs.getBoolean("active"),
                HttpAction.post(endpoint, null, "")
        );
    }

    private Optional<StoredJob> queryOne(String sql, Binder binder) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw unavailable("read cron.job", e);
        }
    }

    private int update(String sql, Binder binder) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw unavailable("update cron.job", e);
        }
    }

    private static RegistryUnavailableException unavailable(String operation, SQLException e) {
        return new RegistryUnavailableException("pg_cron scheduler failed to " + operation + ": " + e.getMessage(), e);
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }
}
