package com.batchpredict.worker.completion;

import com.batchpredict.config.PredictConfig;
import com.batchpredict.model.DispatchErrorCode;
import com.batchpredict.model.DispatchResult;
import com.batchpredict.model.JobCompletionEvent;
import com.batchpredict.model.JobMetadata;
import com.batchpredict.model.QueryResult;
import com.batchpredict.model.ResumptionHandle;
import com.batchpredict.model.StatusCodes;
import com.batchpredict.model.csv.CsvRecordCodec;
import com.batchpredict.worker.dispatch.DispatchResponse;
import com.batchpredict.worker.dispatch.JobDispatcher;
import com.batchpredict.worker.support.FakeCandidateRepository;
import com.batchpredict.worker.support.FakePredictionService;
import com.batchpredict.worker.support.InMemoryJobMetadataStore;
import com.batchpredict.worker.support.InMemoryObjectStore;
import com.batchpredict.worker.support.RecordingResumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompletionHandlerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);
    private static final String QUERY_KEY = "retrieved_from_db/query_results_20240601_115900.csv";
    private static final String FINAL_KEY = "predicted_values_output/output_results_20240601_120000.csv";
    private static final int ROWS = 10;

    private final PredictConfig config = PredictConfig.builder().modelId("canvas-model-1").build();

    private InMemoryObjectStore objects;
    private FakePredictionService predictionService;
    private InMemoryJobMetadataStore metadataStore;
    private RecordingResumer resumer;
    private CompletionHandler handler;
    private String jobName;

    @BeforeEach
    void setUp() {
        objects = new InMemoryObjectStore();
        predictionService = new FakePredictionService();
        metadataStore = new InMemoryJobMetadataStore();
        resumer = new RecordingResumer();
        handler = new CompletionHandler(config, objects, predictionService, metadataStore, resumer);

        objects.writeObject(QUERY_KEY, CsvRecordCodec.writeTable(FakeCandidateRepository.withRows(ROWS).findCandidates()));
        DispatchResponse response = new JobDispatcher(config, objects, predictionService, metadataStore, resumer, CLOCK)
                .dispatch(QueryResult.found(ROWS, QUERY_KEY, 24), ResumptionHandle.of(new byte[] {1, 2, 3}, 0L));
        assertTrue(response.isAccepted());
        jobName = response.getJobName();
    }

    private JobMetadata metadata() {
        return metadataStore.get(jobName).orElseThrow();
    }

    private void writeOutput(int lines) {
        StringBuilder out = new StringBuilder();
        for (int i = 1; i <= lines; i++) {
            out.append(i).append(".125\n");
        }
        objects.writeObject(metadata().getOutputFileKey(), out.toString());
    }

    @Test
    void handle_completedJobWritesMergedFileAndResumesWithIt() {
        writeOutput(ROWS);

        CompletionResponse response = handler.handle(new JobCompletionEvent(jobName, "Completed"));

        assertEquals(StatusCodes.OK, response.getStatusCode());
        assertTrue(response.isResumed());
        DispatchResult result = resumer.only().result;
        assertEquals(DispatchResult.STATUS_COMPLETED, result.getStatus());
        assertEquals(ROWS, result.getRecords());
        assertEquals(FINAL_KEY, result.getFileKey());
        assertEquals(jobName, result.getJobName());
        assertFalse(metadataStore.contains(jobName));

        List<Map<String, String>> rows = CsvRecordCodec.readRows(objects.readObject(FINAL_KEY));
        assertEquals(ROWS, rows.size());
        List<String> expectedColumns = new ArrayList<>(FakeCandidateRepository.COLUMNS);
        expectedColumns.add("predicted_value");
        assertEquals(expectedColumns, new ArrayList<>(rows.get(0).keySet()));
        for (int i = 0; i < ROWS; i++) {
            Map<String, String> row = rows.get(i);
            assertEquals(String.valueOf(i + 1), row.get("id"));
            assertEquals((i + 1) + ".125", row.get("predicted_value"));
            assertEquals("TRUE", row.get("predicted_label"));
            assertEquals("dev-" + (i + 1), row.get("device_id"));
        }
    }

    @Test
    void handle_appendsFlagColumnWhenSourceLacksIt() {
        objects.writeObject(QUERY_KEY, "id,timestamp,parameter,device_id,location_id,deployment_date\n"
                + "1,t,pm25,d,l,2023-01-15\n2,t,pm25,d,l,2023-01-15\n");
        objects.writeObject(metadata().getOutputFileKey(), "0.5\n0.75\n");

        handler.handle(new JobCompletionEvent(jobName, "Completed"));

        List<Map<String, String>> rows = CsvRecordCodec.readRows(objects.readObject(FINAL_KEY));
        assertEquals(List.of("id", "timestamp", "parameter", "device_id", "location_id", "deployment_date",
                "predicted_value", "predicted_label"), new ArrayList<>(rows.get(0).keySet()));
        assertEquals("TRUE", rows.get(1).get("predicted_label"));
        assertEquals(2, resumer.only().result.getRecords());
    }

    @Test
    void handle_truncatesSurplusPredictions() {
        writeOutput(ROWS + 2);

        handler.handle(new JobCompletionEvent(jobName, "Completed"));

        assertEquals(ROWS, resumer.only().result.getRecords());
        assertEquals(ROWS, CsvRecordCodec.readRows(objects.readObject(FINAL_KEY)).size());
    }

    @Test
    void handle_failedJobSignalsJobFailureWithStatus() {
        CompletionResponse response = handler.handle(new JobCompletionEvent(jobName, "Failed"));

        RecordingResumer.Delivery delivery = resumer.only();
        assertEquals(DispatchErrorCode.JOB_FAILED, delivery.errorCode);
        assertEquals("Batch transform job failed with status: Failed", delivery.cause);
        assertEquals(StatusCodes.OK, response.getStatusCode());
        assertFalse(metadataStore.contains(jobName));
        assertTrue(objects.keysUnder("predicted_values_output/").isEmpty());
    }

    @Test
    void handle_failedJobIncludesReasonWhenServiceReportsOne() {
        predictionService.failureReason("ClientError: model container exited");

        handler.handle(new JobCompletionEvent(jobName, "Stopped"));

        assertEquals("Batch transform job failed with status: Stopped. Reason: ClientError: model container exited",
                resumer.only().cause);
    }

    @Test
    void handle_shortOutputSignalsResultProcessingFailure() {
        writeOutput(8);

        CompletionResponse response = handler.handle(new JobCompletionEvent(jobName, "Completed"));

        RecordingResumer.Delivery delivery = resumer.only();
        assertEquals(DispatchErrorCode.RESULT_PROCESSING_FAILED, delivery.errorCode);
        assertTrue(delivery.cause.startsWith("Failed to process batch results: "));
        assertTrue(delivery.cause.contains("8 rows for 10 input rows"));
        assertEquals(StatusCodes.INTERNAL_ERROR, response.getStatusCode());
        assertTrue(objects.keysUnder("predicted_values_output/").isEmpty());
        assertFalse(metadataStore.contains(jobName));
    }

    @Test
    void handle_missingOutputListsWhatIsThere() {
        objects.writeObject("output_batch/other_20240531_120000.csv.out", "1\n");

        handler.handle(new JobCompletionEvent(jobName, "Completed"));

        RecordingResumer.Delivery delivery = resumer.only();
        assertEquals(DispatchErrorCode.RESULT_PROCESSING_FAILED, delivery.errorCode);
        assertTrue(delivery.cause.contains("Output file not found: " + "output_batch/"));
        assertTrue(delivery.cause.contains("output_batch/other_20240531_120000.csv.out"));
    }

    @Test
    void handle_unknownJobIsNotFoundAndResumesNothing() {
        CompletionResponse response = handler.handle(new JobCompletionEvent("batch-transform-ffffffff-20240101-000000", "Completed"));

        assertEquals(StatusCodes.NOT_FOUND, response.getStatusCode());
        assertFalse(response.isResumed());
        assertTrue(resumer.deliveries().isEmpty());
        assertTrue(metadataStore.contains(jobName));
    }

    @Test
    void handle_redeliveredEventIsNotFound() {
        writeOutput(ROWS);
        handler.handle(new JobCompletionEvent(jobName, "Completed"));

        CompletionResponse second = handler.handle(new JobCompletionEvent(jobName, "Completed"));

        assertEquals(StatusCodes.NOT_FOUND, second.getStatusCode());
        assertEquals(1, resumer.deliveries().size());
    }

    @Test
    void handle_keepsMetadataWhenWorkflowCannotBeReached() {
        writeOutput(ROWS);
        resumer.unavailable(true);

        CompletionResponse first = handler.handle(new JobCompletionEvent(jobName, "Completed"));

        assertEquals(StatusCodes.INTERNAL_ERROR, first.getStatusCode());
        assertFalse(first.isResumed());
        assertTrue(resumer.deliveries().isEmpty());
        assertTrue(metadataStore.contains(jobName));

        resumer.unavailable(false);
        CompletionResponse retried = handler.handle(new JobCompletionEvent(jobName, "Completed"));

        assertEquals(StatusCodes.OK, retried.getStatusCode());
        assertTrue(retried.isResumed());
        assertEquals(ROWS, resumer.only().result.getRecords());
        assertFalse(metadataStore.contains(jobName));
    }

    @Test
    void handle_keepsMetadataWhenFailureCannotBeDelivered() {
        resumer.unavailable(true);

        CompletionResponse response = handler.handle(new JobCompletionEvent(jobName, "Failed"));

        assertEquals(StatusCodes.INTERNAL_ERROR, response.getStatusCode());
        assertTrue(metadataStore.contains(jobName));
    }

    @Test
    void handle_eventWithoutJobNameIsBadRequest() {
        CompletionResponse response = handler.handle(new JobCompletionEvent(" ", "Completed"));

        assertEquals(StatusCodes.BAD_REQUEST, response.getStatusCode());
        assertTrue(resumer.deliveries().isEmpty());
    }

    @Test
    void handle_metadataLookupFaultIsInternalError() {
        metadataStore.failReads();

        CompletionResponse response = handler.handle(new JobCompletionEvent(jobName, "Completed"));

        assertEquals(StatusCodes.INTERNAL_ERROR, response.getStatusCode());
        assertTrue(resumer.deliveries().isEmpty());
    }

    @Test
    void handle_deleteFaultDoesNotChangeOutcome() {
        writeOutput(ROWS);
        metadataStore.failDeletes();

        CompletionResponse response = handler.handle(new JobCompletionEvent(jobName, "Completed"));

        assertEquals(StatusCodes.OK, response.getStatusCode());
        assertTrue(resumer.only().isSuccess());
    }
}
