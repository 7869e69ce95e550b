package io.quirrel.delivery;

/**
 * User code run for every delivery of a route. Returning normally acknowledges the delivery;
 * throwing fails it, and the durable scheduler applies the job's retry ladder.
 */
@FunctionalInterface
public interface JobHandler<T> {
    void handle(T payload, JobMeta meta) throws Exception;
}
