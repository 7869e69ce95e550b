package io.quirrel.schedule;

import io.quirrel.ErrorCode;
import io.quirrel.security.PayloadCrypto;
import io.quirrel.util.PayloadCodec;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates enqueue options and merges them into one {@link Schedule} plus the encoded body.
 *
 * <p>Rules are checked in a fixed order and the first violation wins. Nothing here touches the
 * registry; the only collaborator invoked is the optional {@link PayloadCrypto}.
 */
public final class ScheduleNormalizer {
    public static final int MAX_RETRY_STEPS = 10;

    private final Clock clock;
    private final PayloadCodec<?> codec;
    private final PayloadCrypto crypto;

    /**
     * @param crypto null to store bodies as encoded plaintext
     */
    public ScheduleNormalizer(Clock clock, PayloadCodec<?> codec, PayloadCrypto crypto) {
        this.clock = clock;
        this.codec = codec;
        this.crypto = crypto;
    }

    public NormalizedJob normalize(Object payload, EnqueueOptions options) {
        EnqueueOptions opts = options == null ? EnqueueOptions.none() : options;
        if (payload == null) {
            throw new ValidationException(ErrorCode.MISSING_PAYLOAD, "Passing null as payload is not allowed");
        }
        List<TimeSpan> rawRetry = opts.retry();
        boolean hasRetry = rawRetry != null && !rawRetry.isEmpty();
        if (opts.repeat() != null && hasRetry) {
            throw new ValidationException(ErrorCode.CONFLICTING_SCHEDULE, "retry and repeat cannot be used together");
        }
        List<Long> retry = resolveRetry(rawRetry);

        Instant now = clock.instant();
        long delayMs;
        if (opts.runAt() != null) {
            if (opts.runAt().isBefore(now)) {
                throw new ValidationException(ErrorCode.SCHEDULE_IN_PAST, "runAt must not be in the past");
            }
            if (opts.runAt().isAfter(now.plusMillis(TimeSpan.MAX_MILLIS))) {
                throw new ValidationException(ErrorCode.INVALID_DURATION, "runAt must be within 1000 years");
            }
            delayMs = opts.runAt().toEpochMilli() - now.toEpochMilli();
        } else {
            delayMs = opts.delay() == null ? 0L : opts.delay().resolve("delay");
        }

        ScheduleKind kind = ScheduleKind.ONCE;
        Long everyMs = null;
        Integer times = null;
        String cron = null;
        Repeat repeat = opts.repeat();
        if (repeat != null) {
            if (repeat.every() != null && repeat.cron() != null) {
                throw new ValidationException(ErrorCode.INVALID_REPEAT, "repeat.every and repeat.cron cannot be used together");
            }
            if (repeat.every() == null && repeat.cron() == null) {
                throw new ValidationException(ErrorCode.INVALID_REPEAT, "repeat requires either every or cron");
            }
            if (repeat.every() != null) {
                everyMs = repeat.every().resolve("repeat.every");
                kind = ScheduleKind.EVERY;
            }
            if (repeat.times() != null) {
                if (repeat.times() < 0) {
                    throw new ValidationException(ErrorCode.INVALID_REPEAT, "repeat.times must not be negative");
                }
                times = repeat.times();
            }
            if (repeat.cron() != null) {
                cron = CronExpressions.validate(repeat.cron());
                kind = ScheduleKind.CRON;
            }
        }

        Schedule schedule = new Schedule(
                kind,
                delayMs,
                now.plusMillis(delayMs),
                everyMs,
                times,
                cron,
                retry,
                Boolean.TRUE.equals(opts.exclusive())
        );
        String body = codec.encode(payload);
        if (crypto != null) {
            body = crypto.encrypt(body);
        }
        return new NormalizedJob(opts.id(), Boolean.TRUE.equals(opts.override()), schedule, body);
    }

    private static List<Long> resolveRetry(List<TimeSpan> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        if (raw.size() > MAX_RETRY_STEPS) {
            throw new ValidationException(
                    ErrorCode.INVALID_RETRY,
                    "retry accepts at most " + MAX_RETRY_STEPS + " steps, got " + raw.size()
            );
        }
        List<Long> out = new ArrayList<>(raw.size());
        for (TimeSpan span : raw) {
            if (span == null) {
                throw new ValidationException(ErrorCode.INVALID_RETRY, "retry steps must not be null");
            }
            out.add(span.resolve("retry"));
        }
        return out;
    }

    /**
     * Normalized enqueue request, ready for the registry.
     *
     * @param body encoded payload, encrypted when a secret is configured
     */
    public record NormalizedJob(String id, boolean override, Schedule schedule, String body) {
    }
}
