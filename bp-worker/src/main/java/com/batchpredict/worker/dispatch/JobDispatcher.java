package com.batchpredict.worker.dispatch;

import com.batchpredict.config.PredictConfig;
import com.batchpredict.model.DispatchErrorCode;
import com.batchpredict.model.DispatchResult;
import com.batchpredict.model.JobMetadata;
import com.batchpredict.model.QueryResult;
import com.batchpredict.model.RecordTable;
import com.batchpredict.model.ResumptionHandle;
import com.batchpredict.model.csv.CsvRecordCodec;
import com.batchpredict.storage.metadata.JobMetadataStore;
import com.batchpredict.storage.object.ObjectStore;
import com.batchpredict.storage.prediction.BatchJobRequest;
import com.batchpredict.storage.prediction.PredictionService;
import com.batchpredict.worker.FileKeys;
import com.batchpredict.worker.metrics.PredictionMetrics;
import com.batchpredict.worker.resume.ResumptionUnavailableException;
import com.batchpredict.worker.resume.WorkflowResumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Prepares the prediction input for an exported record set, submits the batch job and records what the
 * completion handler needs to finish the run. Returns without resuming the workflow only when a job was
 * submitted (202); every other path delivers exactly one outcome through the {@link WorkflowResumer}, or throws
 * {@link ResumptionUnavailableException} when it cannot be delivered.
 */
public final class JobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private final PredictConfig config;
    private final ObjectStore objects;
    private final PredictionService predictionService;
    private final JobMetadataStore metadataStore;
    private final WorkflowResumer resumer;
    private final Clock clock;

    public JobDispatcher(PredictConfig config, ObjectStore objects, PredictionService predictionService,
                         JobMetadataStore metadataStore, WorkflowResumer resumer, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.objects = Objects.requireNonNull(objects, "objects");
        this.predictionService = Objects.requireNonNull(predictionService, "predictionService");
        this.metadataStore = Objects.requireNonNull(metadataStore, "metadataStore");
        this.resumer = Objects.requireNonNull(resumer, "resumer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public DispatchResponse dispatch(QueryResult queryResult, ResumptionHandle handle) {
        if (handle == null) {
            log.error("No task token provided; cannot resume the workflow");
            PredictionMetrics.dispatchCompleted(DispatchErrorCode.MISSING_TASK_TOKEN.getType());
            return DispatchResponse.failed(DispatchErrorCode.MISSING_TASK_TOKEN, "No task token provided");
        }
        String modelId = config.getModelId();
        if (modelId == null || modelId.isBlank()) {
            return signalFailure(handle, DispatchErrorCode.MISSING_MODEL_ID, "Model id is not configured");
        }
        String fileKey = queryResult != null ? queryResult.getFileKey() : null;
        if (fileKey == null || fileKey.isBlank()) {
            return signalFailure(handle, DispatchErrorCode.MISSING_FILE_KEY, "No file key provided in query result");
        }
        if (queryResult.getRecords() == 0) {
            return signalNoRecords(handle, fileKey);
        }
        try {
            RecordTable table = CsvRecordCodec.readTable(objects.readObject(fileKey), config.getIdColumn());
            log.info("Read exported records | key={} records={}", fileKey, table.size());
            if (table.isEmpty()) {
                return signalNoRecords(handle, fileKey);
            }
            return submit(queryResult, table, modelId, handle);
        } catch (DispatchException e) {
            return signalFailure(handle, e.getErrorCode(), e.getMessage());
        } catch (ResumptionUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Batch transform initiation failed: {}", e.getMessage(), e);
            return signalFailure(handle, DispatchErrorCode.INITIATION_FAILED,
                    "Error during batch transform initiation: " + e.getMessage());
        }
    }

    private DispatchResponse submit(QueryResult queryResult, RecordTable table, String modelId,
                                    ResumptionHandle handle) {
        List<String> featureColumns = config.getFeatureColumns();
        List<List<String>> features = FeatureProjection.project(table, featureColumns);

        Instant now = clock.instant();
        String timestamp = FileKeys.timestamp(now);
        String batchId = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        String inputKey = FileKeys.inputBatch(batchId, timestamp);
        objects.writeObject(inputKey, CsvRecordCodec.writeRows(featureColumns, features, false));

        if (!predictionService.modelExists(modelId)) {
            throw new DispatchException(DispatchErrorCode.MODEL_NOT_FOUND,
                    "Model " + modelId + " not found. Provide a valid model name.");
        }

        BatchJobRequest request = new BatchJobRequest(
                FileKeys.jobName(batchId, now),
                modelId,
                objects.uri(inputKey),
                objects.uri(PredictConfig.OUTPUT_BATCH_PREFIX),
                config.getInstanceType(),
                config.getInstanceCount());
        String jobName = predictionService.submitJob(request);

        metadataStore.put(JobMetadata.builder()
                .jobName(jobName)
                .batchId(batchId)
                .createdAtMillis(now.toEpochMilli())
                .timestamp(timestamp)
                .resumption(handle)
                .inputFileKey(inputKey)
                .outputFileKey(FileKeys.outputFor(inputKey))
                .outputPrefix(PredictConfig.OUTPUT_BATCH_PREFIX)
                .sourceFileKey(queryResult.getFileKey())
                .recordCount(table.size())
                .originalColumns(table.getColumns())
                .bucket(objects.getBucket())
                .modelId(modelId)
                .durationHours(queryResult.getDurationHours())
                .build());

        log.info("Batch transform job {} started for {} records; waiting for completion event", jobName, table.size());
        PredictionMetrics.dispatchCompleted("accepted");
        return DispatchResponse.accepted(jobName, table.size());
    }

    private DispatchResponse signalNoRecords(ResumptionHandle handle, String fileKey) {
        log.info("No records to process | key={}", fileKey);
        resumer.succeed(handle, DispatchResult.noRecords(fileKey));
        PredictionMetrics.dispatchCompleted("no_records");
        return DispatchResponse.noRecords();
    }

    private DispatchResponse signalFailure(ResumptionHandle handle, DispatchErrorCode code, String message) {
        log.error("Dispatch failed | error={} message={}", code.getType(), message);
        resumer.fail(handle, code, message);
        PredictionMetrics.dispatchCompleted(code.getType());
        return DispatchResponse.failed(code, message);
    }
}
