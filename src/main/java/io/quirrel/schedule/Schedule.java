package io.quirrel.schedule;

import java.time.Instant;
import java.util.List;

/**
 * Canonical schedule: exactly one firing mode plus the orthogonal retry ladder.
 *
 * @param delayMs   delay before the first execution, never negative
 * @param runAt     first due instant, resolved once at normalization
 * @param everyMs   interval for {@link ScheduleKind#EVERY}, else null
 * @param times     maximum executions for repeating kinds, null for unbounded
 * @param cron      expression for {@link ScheduleKind#CRON}, else null
 * @param retry     backoff ladder in ms, empty for repeating kinds
 */
public record Schedule(
        ScheduleKind kind,
        long delayMs,
        Instant runAt,
        Long everyMs,
        Integer times,
        String cron,
        List<Long> retry,
        boolean exclusive
) {
    public Schedule {
        retry = retry == null ? List.of() : List.copyOf(retry);
    }

    public boolean repeating() {
        return kind != ScheduleKind.ONCE;
    }
}
