package com.batchpredict.worker.workflow;

import com.batchpredict.config.PredictConfig;
import com.batchpredict.model.DispatchResult;
import com.batchpredict.model.JobCompletionEvent;
import com.batchpredict.model.JobMetadata;
import com.batchpredict.model.QueryResult;
import com.batchpredict.model.WriteResult;
import com.batchpredict.storage.StorageException;
import com.batchpredict.worker.activity.PredictionActivities;
import com.batchpredict.worker.activity.PredictionActivitiesImpl;
import com.batchpredict.worker.activity.WorkflowSubmissionListener;
import com.batchpredict.worker.completion.CompletionHandler;
import com.batchpredict.worker.completion.CompletionResponse;
import com.batchpredict.worker.dispatch.JobDispatcher;
import com.batchpredict.worker.query.QueryStage;
import com.batchpredict.worker.resume.TemporalWorkflowResumer;
import com.batchpredict.worker.resume.WorkflowResumer;
import com.batchpredict.worker.support.FakeCandidateRepository;
import com.batchpredict.worker.support.FakePredictionService;
import com.batchpredict.worker.support.InMemoryJobMetadataStore;
import com.batchpredict.worker.support.InMemoryObjectStore;
import com.batchpredict.worker.writer.DbWriter;
import io.temporal.activity.Activity;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowOptions;
import io.temporal.client.WorkflowStub;
import io.temporal.testing.TestWorkflowEnvironment;
import io.temporal.worker.Worker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

class PredictionWorkflowTest {

    private static final String TASK_QUEUE = "batch-predict-test";
    private static final PredictionRunRequest REQUEST = new PredictionRunRequest(24, 60, 600, 60);

    private final PredictConfig config = PredictConfig.builder().modelId("canvas-model-1").build();

    private TestWorkflowEnvironment testEnv;
    private Worker worker;
    private WorkflowClient client;

    private InMemoryObjectStore objects;
    private FakePredictionService predictionService;
    private InMemoryJobMetadataStore metadataStore;
    private WorkflowResumer resumer;

    @BeforeEach
    void setUp() {
        testEnv = TestWorkflowEnvironment.newInstance();
        worker = testEnv.newWorker(TASK_QUEUE);
        worker.registerWorkflowImplementationTypes(PredictionWorkflowImpl.class);
        client = testEnv.getWorkflowClient();

        objects = new InMemoryObjectStore();
        predictionService = new FakePredictionService();
        metadataStore = new InMemoryJobMetadataStore();
        resumer = new TemporalWorkflowResumer(client.newActivityCompletionClient());
    }

    @AfterEach
    void tearDown() {
        testEnv.close();
    }

    private void startWith(PredictConfig config, FakeCandidateRepository repository) {
        JobDispatcher dispatcher = new JobDispatcher(config, objects, predictionService, metadataStore, resumer,
                Clock.systemUTC());
        worker.registerActivitiesImplementations(new PredictionActivitiesImpl(
                new QueryStage(repository, objects, Clock.systemUTC()),
                dispatcher,
                new DbWriter(config, objects, repository),
                resumer,
                new WorkflowSubmissionListener(client)));
        testEnv.start();
    }

    private void startWith(PredictionActivities activities) {
        worker.registerActivitiesImplementations(activities);
        testEnv.start();
    }

    private PredictionWorkflow newWorkflow() {
        return client.newWorkflowStub(PredictionWorkflow.class,
                WorkflowOptions.newBuilder().setTaskQueue(TASK_QUEUE).build());
    }

    private CompletionHandler completionHandler() {
        return new CompletionHandler(config, objects, predictionService, metadataStore, resumer);
    }

    private static void await(String what, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting for " + what);
            }
            Thread.sleep(20);
        }
    }

    private JobMetadata awaitSubmittedJob() throws InterruptedException {
        await("job submission", () -> metadataStore.anyJobName().isPresent());
        return metadataStore.get(metadataStore.anyJobName().get()).orElseThrow();
    }

    @Test
    void run_withNoCandidatesEndsWithoutDispatch() {
        startWith(config, new FakeCandidateRepository());

        PredictionRunResult result = newWorkflow().run(REQUEST);

        assertEquals(WorkflowStage.NO_RECORDS, result.getStage());
        assertEquals(204, result.getStatusCode());
        assertNull(result.getErrorCode());
        assertTrue(predictionService.submitted().isEmpty());
        assertTrue(objects.snapshot().isEmpty());
    }

    @Test
    void run_suspendsUntilCompletionEventThenWritesPredictions() throws InterruptedException {
        FakeCandidateRepository repository = FakeCandidateRepository.withRows(10);
        startWith(config, repository);
        PredictionWorkflow workflow = newWorkflow();
        WorkflowClient.start(workflow::run, REQUEST);

        JobMetadata metadata = awaitSubmittedJob();
        await("awaiting stage", () -> workflow.currentStage() == WorkflowStage.AWAITING_COMPLETION);
        StringBuilder output = new StringBuilder();
        for (int i = 1; i <= 10; i++) {
            output.append(i).append(".005\n");
        }
        objects.writeObject(metadata.getOutputFileKey(), output.toString());

        CompletionResponse response = completionHandler().handle(new JobCompletionEvent(metadata.getJobName(), "Completed"));
        assertTrue(response.isResumed());

        PredictionRunResult result = WorkflowStub.fromTyped(workflow).getResult(PredictionRunResult.class);
        assertEquals(WorkflowStage.DONE, result.getStage());
        assertEquals(200, result.getStatusCode());
        assertEquals(10, result.getRecords());
        assertEquals(10, result.getUpdatedRecords());
        assertTrue(result.getFileKey().startsWith("predicted_values_output/output_results_"));
        assertEquals(10, repository.updates().size());
        assertEquals("1.01", repository.updates().get("1").toPlainString());
        assertEquals(WorkflowStage.DONE, workflow.currentStage());
        assertFalse(metadataStore.contains(metadata.getJobName()));
    }

    @Test
    void run_reportsFailedJobAsJobFailure() throws InterruptedException {
        startWith(config, FakeCandidateRepository.withRows(3));
        PredictionWorkflow workflow = newWorkflow();
        WorkflowClient.start(workflow::run, REQUEST);

        JobMetadata metadata = awaitSubmittedJob();
        completionHandler().handle(new JobCompletionEvent(metadata.getJobName(), "Failed"));

        PredictionRunResult result = WorkflowStub.fromTyped(workflow).getResult(PredictionRunResult.class);
        assertEquals(WorkflowStage.JOB_FAILED, result.getStage());
        assertEquals("JobFailed", result.getErrorCode());
        assertEquals("BatchTransformFailed: Batch transform job failed with status: Failed", result.getErrorDetail());
        assertEquals(0, result.getUpdatedRecords());
    }

    @Test
    void run_reportsShortOutputAsJobFailure() throws InterruptedException {
        FakeCandidateRepository repository = FakeCandidateRepository.withRows(10);
        startWith(config, repository);
        PredictionWorkflow workflow = newWorkflow();
        WorkflowClient.start(workflow::run, REQUEST);

        JobMetadata metadata = awaitSubmittedJob();
        objects.writeObject(metadata.getOutputFileKey(), "1\n2\n3\n4\n5\n6\n7\n8\n");
        completionHandler().handle(new JobCompletionEvent(metadata.getJobName(), "Completed"));

        PredictionRunResult result = WorkflowStub.fromTyped(workflow).getResult(PredictionRunResult.class);
        assertEquals(WorkflowStage.JOB_FAILED, result.getStage());
        assertTrue(result.getErrorDetail().startsWith("BatchResultProcessingFailed: "));
        assertTrue(repository.updates().isEmpty());
    }

    @Test
    void run_reportsMissingModelAsDispatchFailure() {
        startWith(PredictConfig.builder().build(), FakeCandidateRepository.withRows(3));

        PredictionRunResult result = newWorkflow().run(REQUEST);

        assertEquals(WorkflowStage.DISPATCH_FAILED, result.getStage());
        assertEquals("DispatchFailed", result.getErrorCode());
        assertTrue(result.getErrorDetail().startsWith("MissingModelId: "));
        assertTrue(predictionService.submitted().isEmpty());
    }

    @Test
    void run_reportsQueryFaultAsQueryFailure() {
        FakeCandidateRepository repository = FakeCandidateRepository.withRows(3);
        repository.failQuery();
        startWith(config, repository);

        PredictionRunResult result = newWorkflow().run(REQUEST);

        assertEquals(WorkflowStage.QUERY_FAILED, result.getStage());
        assertEquals("QueryFailed", result.getErrorCode());
        assertEquals(500, result.getStatusCode());
        assertTrue(result.getErrorDetail().contains("connection refused"));
    }

    @Test
    void run_timesOutWhenNoCompletionArrivesAndIgnoresLateEvent() throws InterruptedException {
        startWith(config, FakeCandidateRepository.withRows(3));
        PredictionWorkflow workflow = newWorkflow();
        WorkflowClient.start(workflow::run, REQUEST);
        JobMetadata metadata = awaitSubmittedJob();
        await("awaiting stage", () -> workflow.currentStage() == WorkflowStage.AWAITING_COMPLETION);

        PredictionRunResult result = WorkflowStub.fromTyped(workflow).getResult(PredictionRunResult.class);

        assertEquals(WorkflowStage.DISPATCH_FAILED, result.getStage());
        assertEquals("DispatchTimeout", result.getErrorCode());
        assertTrue(result.getErrorDetail().contains(metadata.getJobName()));

        CompletionResponse late = completionHandler().handle(new JobCompletionEvent(metadata.getJobName(), "Failed"));
        assertFalse(late.isResumed());
    }

    @Test
    void run_reportsStalledQueryAsQueryTimeout() {
        startWith(new ScriptedActivities(Stage.QUERY, false));

        PredictionRunResult result = newWorkflow().run(REQUEST);

        assertEquals(WorkflowStage.QUERY_FAILED, result.getStage());
        assertEquals("QueryTimeout", result.getErrorCode());
    }

    @Test
    void run_reportsWriteFaultAsWriteFailure() {
        startWith(new ScriptedActivities(Stage.WRITE, true));

        PredictionRunResult result = newWorkflow().run(REQUEST);

        assertEquals(WorkflowStage.WRITE_FAILED, result.getStage());
        assertEquals("WriteFailed", result.getErrorCode());
        assertEquals(3, result.getRecords());
        assertTrue(result.getErrorDetail().contains("No predictions found"));
    }

    @Test
    void run_reportsStalledWriteAsWriteTimeout() {
        startWith(new ScriptedActivities(Stage.WRITE, false));

        PredictionRunResult result = newWorkflow().run(REQUEST);

        assertEquals(WorkflowStage.WRITE_FAILED, result.getStage());
        assertEquals("WriteTimeout", result.getErrorCode());
    }

    private enum Stage { QUERY, WRITE }

    /** Runs every stage synchronously except one, which either throws or never completes. */
    static class ScriptedActivities implements PredictionActivities {

        private final Stage target;
        private final boolean throwing;

        ScriptedActivities(Stage target, boolean throwing) {
            this.target = target;
            this.throwing = throwing;
        }

        @Override
        public QueryResult queryCandidates(int durationHours) {
            if (target == Stage.QUERY) {
                return misbehave();
            }
            return QueryResult.found(3, "retrieved_from_db/query_results_20240601_120000.csv", durationHours);
        }

        @Override
        public DispatchResult dispatchJob(QueryResult queryResult) {
            return DispatchResult.completed(3, "predicted_values_output/output_results_20240601_120000.csv",
                    "batch-transform-0a1b2c3d-20240601-120000");
        }

        @Override
        public WriteResult writePredictions(String fileKey, int records) {
            if (target == Stage.WRITE) {
                return misbehave();
            }
            return new WriteResult(records, records);
        }

        private <T> T misbehave() {
            if (throwing) {
                throw new StorageException("No predictions found in stalled file");
            }
            Activity.getExecutionContext().doNotCompleteOnReturn();
            return null;
        }
    }
}
