package io.quirrel.util;

import io.quirrel.ErrorCode;
import io.quirrel.schedule.ValidationException;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves human-readable time spans ("500", "5min", "1.5h", "2 days") to milliseconds.
 */
public final class Durations {
    private static final Pattern SPAN = Pattern.compile(
            "^(-?(?:\\d+)?\\.?\\d+) *(milliseconds?|msecs?|ms|seconds?|secs?|s|minutes?|mins?|m"
                    + "|hours?|hrs?|h|days?|d|weeks?|w|years?|yrs?|y)?$",
            Pattern.CASE_INSENSITIVE
    );
    private static final double SECOND = 1_000d;
    private static final double MINUTE = SECOND * 60d;
    private static final double HOUR = MINUTE * 60d;
    private static final double DAY = HOUR * 24d;
    private static final double WEEK = DAY * 7d;
    private static final double YEAR = DAY * 365.25d;

    private Durations() {
    }

    /**
     * @return milliseconds, or {@code null} when {@code raw} is null
     * @throws ValidationException with {@link ErrorCode#INVALID_DURATION} if the text is not a time span
     */
    public static Long parse(String raw) {
        if (raw == null) {
            return null;
        }
        Matcher m = SPAN.matcher(raw.trim());
        if (!m.matches()) {
            throw new ValidationException(
                    ErrorCode.INVALID_DURATION,
                    "Invalid time span '" + raw + "', expected e.g. 500, 5s, 10min, 1h, 2d, 1w or 1y"
            );
        }
        double magnitude = Double.parseDouble(m.group(1));
        String unit = m.group(2) == null ? "ms" : m.group(2).toLowerCase(Locale.ROOT);
        return Math.round(magnitude * multiplier(unit));
    }

    private static double multiplier(String unit) {
        switch (unit) {
            case "years":
            case "year":
            case "yrs":
            case "yr":
            case "y":
                return YEAR;
            case "weeks":
            case "week":
            case "w":
                return WEEK;
            case "days":
            case "day":
            case "d":
                return DAY;
            case "hours":
            case "hour":
            case "hrs":
            case "hr":
            case "h":
                return HOUR;
            case "minutes":
            case "minute":
            case "mins":
            case "min":
            case "m":
                return MINUTE;
            case "seconds":
            case "second":
            case "secs":
            case "sec":
            case "s":
                return SECOND;
            default:
                return 1d;
        }
    }
}
