package io.quirrel;

public enum ErrorCode {
    MISSING_PAYLOAD,
    CONFLICTING_SCHEDULE,
    INVALID_RETRY,
    SCHEDULE_IN_PAST,
    INVALID_DURATION,
    INVALID_REPEAT,
    INVALID_CRON_EXPRESSION,
    INVALID_JOB_ID,
    DECRYPTION_FAILED,
    REGISTRY_UNAVAILABLE,
    CORRUPT_REGISTRY_ENTRY,
    UNSUPPORTED_OPERATION,
    INVALID_CONFIGURATION
}
