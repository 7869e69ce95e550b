package io.quirrel.storage;

import io.quirrel.schedule.ScheduleKind;

import java.time.Instant;
import java.util.List;

/**
 * Entry as read back from a durable scheduler. Fields a backend cannot report are null.
 */
public record StoredJob(
        long id,
        String name,
        String route,
        String externalId,
        ScheduleKind kind,
        String cron,
        Long everyMs,
        Integer times,
        List<Long> retry,
        boolean exclusive,
        int count,
        Instant runAt,
        boolean active,
        HttpAction action
) {
    public StoredJob {
        retry = retry == null ? List.of() : List.copyOf(retry);
    }

    public String endpoint() {
        return action.url();
    }
}
