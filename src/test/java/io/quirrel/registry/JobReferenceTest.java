package io.quirrel.registry;

import io.quirrel.ErrorCode;
import io.quirrel.schedule.ValidationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class JobReferenceTest {

    @Test
    void cronSentinelSelectsRecurringEntry() {
        JobReference ref = JobReference.parse(" @cron ", "api/reports");
        Assertions.assertEquals(JobReference.Kind.ROUTE_CRON, ref.kind());
        Assertions.assertEquals("cron-job:api/reports", ref.entryName());
        Assertions.assertEquals("api/reports/@cron", ref.toString());
    }

    @Test
    void plainIdsAddressJobs() {
        JobReference ref = JobReference.parse("welcome-1", "api/emails");
        Assertions.assertEquals(JobReference.Kind.EXTERNAL_ID, ref.kind());
        Assertions.assertEquals("job:api/emails:welcome-1", ref.entryName());
    }

    @Test
    void storeIdsHaveNoName() {
        JobReference ref = JobReference.byStoreId(17L);
        Assertions.assertNull(ref.entryName());
        Assertions.assertEquals("#17", ref.toString());
        Assertions.assertThrows(ValidationException.class, () -> JobReference.byStoreId(0L));
    }

    @Test
    void blankIdsAreRejected() {
        ValidationException e = Assertions.assertThrows(ValidationException.class, () -> JobReference.parse("  ", "api/emails"));
        Assertions.assertEquals(ErrorCode.INVALID_JOB_ID, e.code());
        Assertions.assertThrows(ValidationException.class, () -> JobReference.parse("1", " "));
    }
}
