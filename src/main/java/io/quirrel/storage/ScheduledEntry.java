package io.quirrel.storage;

import io.quirrel.schedule.Schedule;

/**
 * Entry to be created in a durable scheduler.
 *
 * @param name       derived name, unique per owner
 * @param route      queue route the entry belongs to
 * @param externalId caller-facing job id ({@code "@cron"} for a route's recurring job)
 */
public record ScheduledEntry(
        String name,
        String route,
        String externalId,
        Schedule schedule,
        HttpAction action
) {
}
