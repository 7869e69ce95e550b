package io.quirrel.schedule;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;

final class CronExpressionsTest {

    @Test
    void nextExecutionIsEvaluatedInUtc() {
        Instant after = Instant.parse("2024-05-01T12:00:30Z");
        Assertions.assertEquals(Instant.parse("2024-05-01T12:01:00Z"), CronExpressions.nextExecution("* * * * *", after).orElseThrow());
        Assertions.assertEquals(Instant.parse("2024-05-02T03:00:00Z"), CronExpressions.nextExecution("0 3 * * *", after).orElseThrow());
    }

    @Test
    void onlyFiveFieldExpressionsAreAccepted() {
        Assertions.assertEquals("0 3 * * 1", CronExpressions.validate("  0 3 * * 1 "));
        Assertions.assertThrows(ValidationException.class, () -> CronExpressions.validate("0 0 3 * * ?"));
        Assertions.assertThrows(ValidationException.class, () -> CronExpressions.validate("61 * * * *"));
        Assertions.assertThrows(ValidationException.class, () -> CronExpressions.validate(null));
    }
}
