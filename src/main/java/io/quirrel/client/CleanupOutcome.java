package io.quirrel.client;

/**
 * Result of {@link QuirrelClient#shutdown()}. Cleanup never throws; a failure is reported here.
 *
 * @param error null when cleanup completed
 */
public record CleanupOutcome(boolean completed, int deleted, String error) {

    public static CleanupOutcome completed(int deleted) {
        return new CleanupOutcome(true, deleted, null);
    }

    public static CleanupOutcome failed(Throwable error) {
        return new CleanupOutcome(false, 0, String.valueOf(error));
    }
}
