package io.quirrel.util;

import io.quirrel.ErrorCode;
import io.quirrel.schedule.ValidationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class DurationsTest {

    @Test
    void parsesUnitsCaseInsensitively() {
        Assertions.assertEquals(500L, Durations.parse("500"));
        Assertions.assertEquals(500L, Durations.parse("500ms"));
        Assertions.assertEquals(5_000L, Durations.parse("5s"));
        Assertions.assertEquals(300_000L, Durations.parse("5min"));
        Assertions.assertEquals(3_600_000L, Durations.parse("1H"));
        Assertions.assertEquals(5_400_000L, Durations.parse("1.5h"));
        Assertions.assertEquals(172_800_000L, Durations.parse("2 days"));
        Assertions.assertEquals(604_800_000L, Durations.parse("1w"));
        Assertions.assertEquals(31_557_600_000L, Durations.parse("1y"));
    }

    @Test
    void absentInputResolvesToNull() {
        Assertions.assertNull(Durations.parse(null));
    }

    @Test
    void rejectsTextOutsideTheGrammar() {
        ValidationException e = Assertions.assertThrows(ValidationException.class, () -> Durations.parse("soon"));
        Assertions.assertEquals(ErrorCode.INVALID_DURATION, e.code());
        Assertions.assertThrows(ValidationException.class, () -> Durations.parse("5 fortnights"));
        Assertions.assertThrows(ValidationException.class, () -> Durations.parse(""));
    }
}
