package io.quirrel.storage;

import io.quirrel.config.QuirrelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide cache of scheduler handles, one per database URL and owner.
 *
 * <p>Handles are built lazily and exactly once per key even when callers race; everything else in
 * the engine receives its scheduler as a constructor argument.
 */
public final class SchedulerConnections {
    private static final Logger LOG = LoggerFactory.getLogger(SchedulerConnections.class);
    private static final Map<String, DurableScheduler> SHARED = new ConcurrentHashMap<>();

    private SchedulerConnections() {
    }

    public static DurableScheduler shared(QuirrelConfig config) {
        return shared(config.requireDatabaseUrl(), config.owner());
    }

    public static DurableScheduler shared(String databaseUrl, String owner) {
        return SHARED.computeIfAbsent(owner + "@" + databaseUrl, key -> open(databaseUrl, owner, Clock.systemUTC()));
    }

    /**
     * Builds an unshared scheduler for the URL's dialect.
     */
    public static DurableScheduler open(String databaseUrl, String owner, Clock clock) {
        Database database = Database.forUrl(databaseUrl);
        LOG.info("Opening {} scheduler at {}", database.dialect(), Database.redact(databaseUrl));
        if (database.dialect() == Database.Dialect.POSTGRES) {
            PgCronScheduler scheduler = new PgCronScheduler(database, clock);
            scheduler.ping();
            return scheduler;
        }
        SqliteScheduler scheduler = new SqliteScheduler(database, owner, clock);
        scheduler.init();
        return scheduler;
    }

    /**
     * Closes and forgets every shared handle.
     */
    public static void closeAll() {
        for (String key : SHARED.keySet()) {
            DurableScheduler scheduler = SHARED.remove(key);
            if (scheduler != null) {
                scheduler.close();
            }
        }
    }
}
