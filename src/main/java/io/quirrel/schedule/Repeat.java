package io.quirrel.schedule;

/**
 * Repetition request as given by the caller. At most one of {@code every} and {@code cron}.
 */
public record Repeat(TimeSpan every, Integer times, String cron) {

    public static Repeat every(TimeSpan every) {
        return new Repeat(every, null, null);
    }

    public static Repeat every(TimeSpan every, int times) {
        return new Repeat(every, times, null);
    }

    public static Repeat cron(String cron) {
        return new Repeat(null, null, cron);
    }

    public static Repeat cron(String cron, int times) {
        return new Repeat(null, times, cron);
    }
}
