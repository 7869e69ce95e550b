package io.quirrel.schedule;

import io.quirrel.ErrorCode;
import io.quirrel.security.PayloadCrypto;
import io.quirrel.util.PayloadCodec;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

final class ScheduleNormalizerTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private final ScheduleNormalizer normalizer = new ScheduleNormalizer(CLOCK, PayloadCodec.of(Map.class), null);

    @Test
    void defaultsToImmediateOneShot() {
        ScheduleNormalizer.NormalizedJob job = normalizer.normalize(Map.of("foo", "bar"), EnqueueOptions.none());
        Assertions.assertEquals(ScheduleKind.ONCE, job.schedule().kind());
        Assertions.assertEquals(0L, job.schedule().delayMs());
        Assertions.assertEquals(NOW, job.schedule().runAt());
        Assertions.assertEquals("{\"foo\":\"bar\"}", job.body());
        Assertions.assertNull(job.id());
        Assertions.assertFalse(job.override());
    }

    @Test
    void runAtResolvesToExactDelay() {
        Instant runAt = NOW.plusSeconds(90);
        ScheduleNormalizer.NormalizedJob job = normalizer.normalize("x", EnqueueOptions.builder().runAt(runAt).delay("1h").build());
        Assertions.assertEquals(90_000L, job.schedule().delayMs());
        Assertions.assertEquals(runAt, job.schedule().runAt());
    }

    @Test
    void delayAcceptsSpansAndMillis() {
        Assertions.assertEquals(300_000L, normalizer.normalize("x", EnqueueOptions.builder().delay("5min").build()).schedule().delayMs());
        Assertions.assertEquals(1_500L, normalizer.normalize("x", EnqueueOptions.builder().delay(1_500L).build()).schedule().delayMs());
        ValidationException zero = Assertions.assertThrows(ValidationException.class,
                () -> normalizer.normalize("x", EnqueueOptions.builder().delay(0L).build()));
        Assertions.assertEquals(ErrorCode.INVALID_DURATION, zero.code());
    }

    @Test
    void rejectsSpansBeyondThousandYears() {
        ValidationException text = Assertions.assertThrows(ValidationException.class,
                () -> normalizer.normalize("x", EnqueueOptions.builder().delay("300000000y").build()));
        Assertions.assertEquals(ErrorCode.INVALID_DURATION, text.code());
        ValidationException millis = Assertions.assertThrows(ValidationException.class,
                () -> normalizer.normalize("x", EnqueueOptions.builder().delay(Long.MAX_VALUE).build()));
        Assertions.assertEquals(ErrorCode.INVALID_DURATION, millis.code());
        ValidationException every = Assertions.assertThrows(ValidationException.class,
                () -> normalizer.normalize("x", EnqueueOptions.builder().repeat(Repeat.every(TimeSpan.of("2000y"))).build()));
        Assertions.assertEquals(ErrorCode.INVALID_DURATION, every.code());
        ValidationException runAt = Assertions.assertThrows(ValidationException.class,
                () -> normalizer.normalize("x", EnqueueOptions.builder().runAt(Instant.MAX).build()));
        Assertions.assertEquals(ErrorCode.INVALID_DURATION, runAt.code());

        Assertions.assertEquals(TimeSpan.MAX_MILLIS,
                normalizer.normalize("x", EnqueueOptions.builder().delay("1000y").build()).schedule().delayMs());
    }

    @Test
    void missingPayloadComesFirst() {
        EnqueueOptions conflicting = EnqueueOptions.builder().retry("1s").repeat(Repeat.cron("* * * * *")).build();
        ValidationException e = Assertions.assertThrows(ValidationException.class, () -> normalizer.normalize(null, conflicting));
        Assertions.assertEquals(ErrorCode.MISSING_PAYLOAD, e.code());
    }

    @Test
    void repeatAndRetryConflict() {
        EnqueueOptions options = EnqueueOptions.builder()
                .retry("10s")
                .repeat(Repeat.every(TimeSpan.of("1h")))
                .runAt(NOW.minusSeconds(3600))
                .build();
        ValidationException e = Assertions.assertThrows(ValidationException.class, () -> normalizer.normalize("x", options));
        Assertions.assertEquals(ErrorCode.CONFLICTING_SCHEDULE, e.code());
    }

    @Test
    void emptyRetryIsTreatedAsAbsent() {
        EnqueueOptions options = EnqueueOptions.builder()
                .retry(Collections.emptyList())
                .repeat(Repeat.every(TimeSpan.of("1h")))
                .build();
        ScheduleNormalizer.NormalizedJob job = normalizer.normalize("x", options);
        Assertions.assertEquals(ScheduleKind.EVERY, job.schedule().kind());
        Assertions.assertTrue(job.schedule().retry().isEmpty());
    }

    @Test
    void retryLadderIsBoundedAndResolved() {
        ScheduleNormalizer.NormalizedJob job = normalizer.normalize("x", EnqueueOptions.builder().retry("10s", "1min", "1h").build());
        Assertions.assertEquals(List.of(10_000L, 60_000L, 3_600_000L), job.schedule().retry());

        List<TimeSpan> eleven = new ArrayList<>();
        for (int i = 0; i < 11; i++) {
            eleven.add(TimeSpan.ofMillis(1_000L));
        }
        ValidationException tooMany = Assertions.assertThrows(ValidationException.class,
                () -> normalizer.normalize("x", EnqueueOptions.builder().retry(eleven).build()));
        Assertions.assertEquals(ErrorCode.INVALID_RETRY, tooMany.code());

        ValidationException badStep = Assertions.assertThrows(ValidationException.class,
                () -> normalizer.normalize("x", EnqueueOptions.builder().retry("10s", "whenever").build()));
        Assertions.assertEquals(ErrorCode.INVALID_DURATION, badStep.code());
    }

    @Test
    void runAtInThePastIsRejected() {
        ValidationException e = Assertions.assertThrows(ValidationException.class,
                () -> normalizer.normalize("x", EnqueueOptions.builder().runAt(NOW.minusSeconds(3600)).build()));
        Assertions.assertEquals(ErrorCode.SCHEDULE_IN_PAST, e.code());
    }

    @Test
    void repeatEveryWithBound() {
        ScheduleNormalizer.NormalizedJob job = normalizer.normalize("x",
                EnqueueOptions.builder().repeat(Repeat.every(TimeSpan.of("1h"), 3)).exclusive(true).build());
        Assertions.assertEquals(ScheduleKind.EVERY, job.schedule().kind());
        Assertions.assertEquals(3_600_000L, job.schedule().everyMs());
        Assertions.assertEquals(3, job.schedule().times());
        Assertions.assertTrue(job.schedule().exclusive());
        Assertions.assertTrue(job.schedule().repeating());

        ValidationException negative = Assertions.assertThrows(ValidationException.class,
                () -> normalizer.normalize("x", EnqueueOptions.builder().repeat(new Repeat(TimeSpan.of("1h"), -1, null)).build()));
        Assertions.assertEquals(ErrorCode.INVALID_REPEAT, negative.code());
        ValidationException both = Assertions.assertThrows(ValidationException.class,
                () -> normalizer.normalize("x", EnqueueOptions.builder().repeat(new Repeat(TimeSpan.of("1h"), null, "* * * * *")).build()));
        Assertions.assertEquals(ErrorCode.INVALID_REPEAT, both.code());
    }

    @Test
    void cronIsValidated() {
        ScheduleNormalizer.NormalizedJob job = normalizer.normalize("x", EnqueueOptions.builder().repeat(Repeat.cron("*/5 * * * *")).build());
        Assertions.assertEquals(ScheduleKind.CRON, job.schedule().kind());
        Assertions.assertEquals("*/5 * * * *", job.schedule().cron());

        ValidationException e = Assertions.assertThrows(ValidationException.class,
                () -> normalizer.normalize("x", EnqueueOptions.builder().repeat(Repeat.cron("every monday")).build()));
        Assertions.assertEquals(ErrorCode.INVALID_CRON_EXPRESSION, e.code());
    }

    @Test
    void encryptsBodyWhenConfigured() {
        PayloadCrypto crypto = new PayloadCrypto("01234567890123456789012345678901", List.of());
        ScheduleNormalizer encrypting = new ScheduleNormalizer(CLOCK, PayloadCodec.of(Map.class), crypto);
        ScheduleNormalizer.NormalizedJob job = encrypting.normalize(Map.of("foo", "bar"), EnqueueOptions.none());
        Assertions.assertFalse(job.body().contains("bar"));
        Assertions.assertEquals("{\"foo\":\"bar\"}", crypto.decrypt(job.body()));
    }

    @Test
    void defaultsFillOnlyUnsetFields() {
        EnqueueOptions defaults = EnqueueOptions.builder().exclusive(true).retry("1s").build();
        EnqueueOptions merged = EnqueueOptions.builder().exclusive(false).build().withDefaults(defaults);
        Assertions.assertEquals(Boolean.FALSE, merged.exclusive());
        Assertions.assertEquals(1, merged.retry().size());

        EnqueueOptions repeating = EnqueueOptions.builder().repeat(Repeat.cron("* * * * *")).build().withDefaults(defaults);
        Assertions.assertNull(repeating.retry());
        Assertions.assertEquals(Boolean.TRUE, repeating.exclusive());
    }
}
