package io.quirrel.client;

import io.quirrel.registry.JobReference;

import java.time.Instant;
import java.util.List;

/**
 * A scheduled job as seen by its queue, with its payload decoded.
 */
public final class Job<T> {
    private final String id;
    private final long storeId;
    private final String route;
    private final String endpoint;
    private final T body;
    private final Instant runAt;
    private final boolean exclusive;
    private final List<Long> retry;
    private final int count;
    private final Repeat repeat;
    private final QuirrelClient<?> client;

    Job(
            String id,
            long storeId,
            String route,
            String endpoint,
            T body,
            Instant runAt,
            boolean exclusive,
            List<Long> retry,
            int count,
            Repeat repeat,
            QuirrelClient<?> client
    ) {
        this.id = id;
        this.storeId = storeId;
        this.route = route;
        this.endpoint = endpoint;
        this.body = body;
        this.runAt = runAt;
        this.exclusive = exclusive;
        this.retry = retry == null ? List.of() : List.copyOf(retry);
        this.count = count;
        this.repeat = repeat;
        this.client = client;
    }

    /**
     * Caller-facing id; {@code "@cron"} for a route's recurring job.
     */
    public String id() {
        return id;
    }

    public long storeId() {
        return storeId;
    }

    public String route() {
        return route;
    }

    public String endpoint() {
        return endpoint;
    }

    public T body() {
        return body;
    }

    /**
     * Next execution; for repeating jobs this moves forward with every repetition.
     */
    public Instant runAt() {
        return runAt;
    }

    public boolean exclusive() {
        return exclusive;
    }

    public List<Long> retry() {
        return retry;
    }

    public int count() {
        return count;
    }

    /**
     * @return null for one-shot jobs
     */
    public Repeat repeat() {
        return repeat;
    }

    public JobReference reference() {
        return JobReference.byStoreId(storeId);
    }

    /**
     * @return false if the job was already gone
     */
    public boolean delete() {
        return client.delete(reference());
    }

    /**
     * Schedules this job for immediate execution. A repeating job keeps its schedule.
     *
     * @return false if the job was deleted in the meantime
     */
    public boolean invoke() {
        return client.invoke(reference());
    }

    @Override
    public String toString() {
        return "Job{" + route + "/" + id + ", runAt=" + runAt + ", count=" + count + "}";
    }

    /**
     * @param every interval in milliseconds, null for cron jobs
     */
    public record Repeat(Long every, Integer times, String cron) {
    }
}
