package io.quirrel.registry;

import io.quirrel.ErrorCode;
import io.quirrel.schedule.ValidationException;
import io.quirrel.storage.JobNames;

/**
 * Resolved handle to one registry entry of a route.
 *
 * <ul>
 *   <li>{@link Kind#ROUTE_CRON}: the route's recurring job, addressed by name</li>
 *   <li>{@link Kind#EXTERNAL_ID}: a job enqueued with a caller-supplied or engine-assigned id</li>
 *   <li>{@link Kind#STORE_ID}: the durable scheduler's own numeric id</li>
 * </ul>
 */
public record JobReference(Kind kind, String route, String externalId, long storeId) {

    public static JobReference routeCron(String route) {
        return new JobReference(Kind.ROUTE_CRON, requireRoute(route), JobNames.CRON_ID, 0L);
    }

    public static JobReference byId(String route, String externalId) {
        if (externalId == null || externalId.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_JOB_ID, "job id must not be blank");
        }
        return new JobReference(Kind.EXTERNAL_ID, requireRoute(route), externalId, 0L);
    }

    public static JobReference byStoreId(long storeId) {
        if (storeId < 1L) {
            throw new ValidationException(ErrorCode.INVALID_JOB_ID, "store id must be positive, got " + storeId);
        }
        return new JobReference(Kind.STORE_ID, null, null, storeId);
    }

    /**
     * {@code "@cron"} selects the route's recurring job; anything else is a job id.
     */
    public static JobReference parse(String raw, String route) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_JOB_ID, "job id must not be blank");
        }
        String value = raw.trim();
        if (JobNames.CRON_ID.equals(value)) {
            return routeCron(route);
        }
        return byId(route, value);
    }

    /**
     * @return the derived entry name, or null for {@link Kind#STORE_ID}
     */
    public String entryName() {
        switch (kind) {
            case ROUTE_CRON:
                return JobNames.cron(route);
            case EXTERNAL_ID:
                return JobNames.job(route, externalId);
            default:
                return null;
        }
    }

    @Override
    public String toString() {
        return kind == Kind.STORE_ID ? "#" + storeId : route + "/" + externalId;
    }

    private static String requireRoute(String route) {
        if (route == null || route.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_JOB_ID, "route must not be blank");
        }
        return route;
    }

    public enum Kind {
        ROUTE_CRON,
        EXTERNAL_ID,
        STORE_ID
    }
}
