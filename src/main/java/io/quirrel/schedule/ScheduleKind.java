package io.quirrel.schedule;

public enum ScheduleKind {
    /** Fires once after a delay; may carry a retry ladder. */
    ONCE,
    /** Fires at a fixed interval, optionally bounded by {@code times}. */
    EVERY,
    /** Fires per a 5-field cron expression, optionally bounded by {@code times}. */
    CRON
}
