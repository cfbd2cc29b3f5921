package com.batchpredict.worker.trigger;

import com.batchpredict.config.PredictConfig;
import io.temporal.api.common.v1.WorkflowExecution;
import io.temporal.client.WorkflowOptions;
import io.temporal.testing.TestWorkflowEnvironment;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PredictionWorkflowStarterTest {

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
    void workflowOptions_withCronUseFixedIdAndRunTimeout() {
        PredictConfig config = PredictConfig.builder()
                .taskQueue("batch-predict")
                .cronSchedule("0 2 * * *")
                .executionTimeout(Duration.ofHours(12))
                .build();

        WorkflowOptions options = new PredictionWorkflowStarter(testEnv.getWorkflowClient(), config).workflowOptions();

        assertEquals(PredictionWorkflowStarter.SCHEDULED_WORKFLOW_ID, options.getWorkflowId());
        assertEquals("0 2 * * *", options.getCronSchedule());
        assertEquals(Duration.ofHours(12), options.getWorkflowRunTimeout());
        assertNull(options.getWorkflowExecutionTimeout());
        assertEquals("batch-predict", options.getTaskQueue());
    }

    @Test
    void workflowOptions_withoutCronUseFreshIds() {
        PredictionWorkflowStarter starter =
                new PredictionWorkflowStarter(testEnv.getWorkflowClient(), PredictConfig.builder().build());

        WorkflowOptions first = starter.workflowOptions();
        WorkflowOptions second = starter.workflowOptions();

        assertNull(first.getCronSchedule());
        assertTrue(first.getWorkflowId().startsWith("batch-predict-"));
        assertNotEquals(first.getWorkflowId(), second.getWorkflowId());
    }

    @Test
    void start_registersScheduledRunOnlyOnce() {
        PredictConfig config = PredictConfig.builder()
                .taskQueue("batch-predict")
                .cronSchedule("0 2 * * *")
                .build();
        PredictionWorkflowStarter starter = new PredictionWorkflowStarter(testEnv.getWorkflowClient(), config);

        WorkflowExecution first = starter.start();
        WorkflowExecution second = starter.start();

        assertNotNull(first);
        assertEquals(PredictionWorkflowStarter.SCHEDULED_WORKFLOW_ID, first.getWorkflowId());
        assertNull(second);
    }
}
