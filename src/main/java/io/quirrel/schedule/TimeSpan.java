package io.quirrel.schedule;

import io.quirrel.ErrorCode;
import io.quirrel.util.Durations;

/**
 * A duration as the caller wrote it: either a number of milliseconds or a text span like "5min".
 */
public record TimeSpan(Long millis, String text) {
    /**
     * Longest span accepted anywhere a duration is resolved: 1000 years.
     */
    public static final long MAX_MILLIS = 31_557_600_000_000L;

    public static TimeSpan ofMillis(long millis) {
        return new TimeSpan(millis, null);
    }

    public static TimeSpan of(String text) {
        return new TimeSpan(null, text);
    }

    /**
     * Resolves to a strictly positive number of milliseconds no larger than {@link #MAX_MILLIS}.
     *
     * @param field name used in the error message
     */
    public long resolve(String field) {
        Long value = millis != null ? millis : Durations.parse(text);
        if (value == null) {
            throw new ValidationException(ErrorCode.INVALID_DURATION, field + " is required");
        }
        if (value < 1L) {
            throw new ValidationException(ErrorCode.INVALID_DURATION, field + " must be positive");
        }
        if (value > MAX_MILLIS) {
            throw new ValidationException(ErrorCode.INVALID_DURATION, field + " must not exceed 1000 years, got " + this);
        }
        return value;
    }

    @Override
    public String toString() {
        return millis != null ? millis + "ms" : text;
    }
}
