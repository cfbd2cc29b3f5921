package com.batchpredict.worker.resume;

import com.batchpredict.model.DispatchErrorCode;
import com.batchpredict.model.DispatchResult;
import com.batchpredict.model.ResumptionHandle;
import io.temporal.client.ActivityCanceledException;
import io.temporal.client.ActivityCompletionFailureException;
import io.temporal.client.ActivityNotExistsException;
import io.temporal.testing.TestWorkflowEnvironment;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TemporalWorkflowResumerTest {

    private TestWorkflowEnvironment testEnv;

    @BeforeEach
    void setUp() {
        testEnv = TestWorkflowEnvironment.newInstance();
    }

    @AfterEach
    void tearDown() {
        testEnv.close();
    }

    @Test
    void succeed_withExpiredHandleDeliversNothing() {
        TemporalWorkflowResumer resumer =
                new TemporalWorkflowResumer(testEnv.getWorkflowClient().newActivityCompletionClient(), () -> 2_000L);

        assertFalse(resumer.succeed(ResumptionHandle.of(new byte[] {1}, 1_000L), DispatchResult.noRecords(null)));
        assertFalse(resumer.fail(ResumptionHandle.of(new byte[] {1}, 1_000L), DispatchErrorCode.JOB_FAILED, "late"));
    }

    @Test
    void isRejection_separatesGoneActivityFromUnreachableService() {
        assertTrue(TemporalWorkflowResumer.isRejection(new ActivityNotExistsException(new RuntimeException("NOT_FOUND"))));
        assertTrue(TemporalWorkflowResumer.isRejection(new ActivityCanceledException()));
        assertFalse(TemporalWorkflowResumer.isRejection(
                new ActivityCompletionFailureException(new RuntimeException("UNAVAILABLE: io exception"))));
    }
}
