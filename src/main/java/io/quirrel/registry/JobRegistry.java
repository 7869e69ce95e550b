package io.quirrel.registry;

import io.quirrel.delivery.JobMeta;
import io.quirrel.observability.AuditLogger;
import io.quirrel.schedule.Schedule;
import io.quirrel.schedule.ScheduleKind;
import io.quirrel.schedule.ScheduleNormalizer.NormalizedJob;
import io.quirrel.security.WebhookSignature;
import io.quirrel.storage.CorruptRegistryEntryException;
import io.quirrel.storage.DurableScheduler;
import io.quirrel.storage.HttpAction;
import io.quirrel.storage.JobNames;
import io.quirrel.storage.ScheduledEntry;
import io.quirrel.storage.StoredJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Translates normalized jobs into durable scheduler entries and answers lookups by reference.
 *
 * <p>Registrations under the same derived name are serialized across every registry of the
 * process, and the store keeps that guarantee across processes; different names proceed in
 * parallel. A cron registration always replaces the route's recurring entry. An id'd registration
 * replaces an existing entry only when {@code override} is set, otherwise the existing entry wins.
 */
public final class JobRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(JobRegistry.class);
    public static final String CLIENT_VERSION = "0.1.0";
    public static final String VERSION_HEADER = "X-QuirrelClient-Version";
    private static final int LOCK_STRIPES = 64;
    private static final Object[] LOCKS = new Object[LOCK_STRIPES];

    static {
        for (int i = 0; i < LOCK_STRIPES; i++) {
            LOCKS[i] = new Object();
        }
    }

    private final DurableScheduler scheduler;
    private final String token;
    private final AuditLogger auditLogger;
    private final Clock clock;

    /**
     * @param token       bearer token and signing secret, null to send unsigned deliveries
     * @param auditLogger null disables the audit trail
     */
    public JobRegistry(DurableScheduler scheduler, String token, AuditLogger auditLogger, Clock clock) {
        this.scheduler = scheduler;
        this.token = token == null || token.isBlank() ? null : token;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    public DurableScheduler scheduler() {
        return scheduler;
    }

    public Registration register(String route, String endpoint, NormalizedJob job) {
        Schedule schedule = job.schedule();
        boolean cron = schedule.kind() == ScheduleKind.CRON;
        String externalId = cron ? JobNames.CRON_ID : (job.id() == null ? UUID.randomUUID().toString() : job.id());
        String name = cron ? JobNames.cron(route) : JobNames.job(route, externalId);
        HttpAction action = HttpAction.post(endpoint, deliveryHeaders(externalId, schedule, job.body()), job.body());
        ScheduledEntry entry = new ScheduledEntry(name, route, externalId, schedule, action);

        synchronized (lockFor(name)) {
            long storeId;
            if (!cron && job.id() != null && !job.override()) {
                Optional<Long> created = scheduler.createIfAbsent(entry);
                if (created.isEmpty()) {
                    Optional<StoredJob> existing = scheduler.findByName(name);
                    if (existing.isPresent()) {
                        LOG.info("Job {} already exists on route {}, keeping it", externalId, route);
                        audit("job.enqueue", name, "kept", Map.of("route", route, "id", externalId));
                        return new Registration(existing.get(), false);
                    }
                    storeId = scheduler.replace(entry);
                } else {
                    storeId = created.get();
                }
            } else {
                storeId = scheduler.replace(entry);
            }
            StoredJob stored = scheduler.findById(storeId)
                    .orElseThrow(() -> new CorruptRegistryEntryException("Entry " + storeId + " vanished after registration"));
            LOG.info("Enqueued job {} on route {} as {} ({})", externalId, route, name, schedule.kind());
            audit("job.enqueue", name, "created", Map.of(
                    "route", route,
                    "id", externalId,
                    "kind", schedule.kind().name(),
                    "store_id", storeId
            ));
            return new Registration(stored, true);
        }
    }

    public Optional<StoredJob> get(JobReference ref) {
        if (ref.kind() == JobReference.Kind.STORE_ID) {
            return scheduler.findById(ref.storeId());
        }
        return scheduler.findByName(ref.entryName());
    }

    /**
     * @param route null for every entry of this registry
     */
    public List<StoredJob> page(String route, long afterId, int limit) {
        return scheduler.page(route, afterId, limit);
    }

    /**
     * @return true iff an entry existed and was removed
     */
    public boolean delete(JobReference ref) {
        boolean removed;
        if (ref.kind() == JobReference.Kind.STORE_ID) {
            removed = scheduler.unscheduleById(ref.storeId());
        } else {
            String name = ref.entryName();
            synchronized (lockFor(name)) {
                removed = scheduler.unscheduleByName(name) > 0;
            }
        }
        if (removed) {
            LOG.info("Deleted job {}", ref);
        }
        audit("job.delete", ref.toString(), removed ? "deleted" : "not_found", Map.of());
        return removed;
    }

    /**
     * Removes every entry this registry owns.
     *
     * @return number of removed entries
     */
    public int deleteAll() {
        int count = scheduler.unscheduleAll();
        if (count > 0) {
            LOG.info("Deleted {} job(s) during cleanup", count);
        }
        audit("job.delete_all", "*", "deleted", Map.of("count", count));
        return count;
    }

    /**
     * Makes an entry due now. Repeating entries keep their schedule.
     *
     * @return false if the entry no longer exists
     */
    public boolean invoke(JobReference ref) {
        Optional<StoredJob> job = get(ref);
        if (job.isEmpty()) {
            return false;
        }
        boolean triggered = scheduler.triggerNow(job.get().id());
        if (triggered) {
            LOG.info("Invoked job {}", ref);
        }
        audit("job.invoke", ref.toString(), triggered ? "invoked" : "not_found", Map.of());
        return triggered;
    }

    Map<String, String> deliveryHeaders(String externalId, Schedule schedule, String body) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (token != null) {
            headers.put("Authorization", "Bearer " + token);
        }
        headers.put(VERSION_HEADER, CLIENT_VERSION);
        JobMeta meta = new JobMeta(
                externalId,
                1,
                schedule.retry(),
                null,
                schedule.exclusive()
        );
        headers.put(JobMeta.HEADER, meta.toHeader());
        if (token != null) {
            headers.put(WebhookSignature.HEADER, WebhookSignature.sign(body, token, clock.instant()));
        }
        return headers;
    }

    private static Object lockFor(String name) {
        return LOCKS[Math.floorMod(name.hashCode(), LOCK_STRIPES)];
    }

    private void audit(String action, String resource, String result, Map<String, Object> details) {
        if (auditLogger != null) {
            auditLogger.log(AuditLogger.AuditEvent.of(action, resource, result, details));
        }
    }

    /**
     * @param created false when an existing id'd entry was kept
     */
    public record Registration(StoredJob job, boolean created) {
    }
}
