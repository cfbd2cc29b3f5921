package com.batchpredict.worker.completion;

import com.batchpredict.config.PredictConfig;
import com.batchpredict.model.DispatchErrorCode;
import com.batchpredict.model.DispatchResult;
import com.batchpredict.model.JobCompletionEvent;
import com.batchpredict.model.JobMetadata;
import com.batchpredict.model.JobStatus;
import com.batchpredict.model.PredictionRecord;
import com.batchpredict.model.RecordTable;
import com.batchpredict.model.ReconciledRecord;
import com.batchpredict.model.ResumptionHandle;
import com.batchpredict.model.StatusCodes;
import com.batchpredict.model.csv.CsvRecordCodec;
import com.batchpredict.storage.metadata.JobMetadataStore;
import com.batchpredict.storage.object.ObjectStore;
import com.batchpredict.storage.prediction.PredictionService;
import com.batchpredict.worker.FileKeys;
import com.batchpredict.worker.metrics.PredictionMetrics;
import com.batchpredict.worker.resume.ResumptionUnavailableException;
import com.batchpredict.worker.resume.WorkflowResumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Handles the terminal-status event of a batch job: resumes the suspended workflow with either the
 * reconciled predictions file or a failure, then deletes the job's metadata.
 * <p>
 * An event for a job with no metadata (unknown, expired or already handled) is reported as 404 and touches
 * nothing, which makes a redelivered event harmless. When the orchestration service cannot be reached the
 * metadata is kept and 500 is returned, so a redelivered event can still resume the workflow.
 */
public final class CompletionHandler {

    static final String PREDICTED_VALUE_COLUMN = "predicted_value";
    static final String FLAG_TRUE = "TRUE";
    private static final String FLAG_FALSE = "FALSE";
    private static final int DIAGNOSTIC_LISTING_LIMIT = 10;

    private static final Logger log = LoggerFactory.getLogger(CompletionHandler.class);

    private final PredictConfig config;
    private final ObjectStore objects;
    private final PredictionService predictionService;
    private final JobMetadataStore metadataStore;
    private final WorkflowResumer resumer;

    public CompletionHandler(PredictConfig config, ObjectStore objects, PredictionService predictionService,
                             JobMetadataStore metadataStore, WorkflowResumer resumer) {
        this.config = Objects.requireNonNull(config, "config");
        this.objects = Objects.requireNonNull(objects, "objects");
        this.predictionService = Objects.requireNonNull(predictionService, "predictionService");
        this.metadataStore = Objects.requireNonNull(metadataStore, "metadataStore");
        this.resumer = Objects.requireNonNull(resumer, "resumer");
    }

    public CompletionResponse handle(JobCompletionEvent event) {
        String jobName = event != null ? event.getJobName() : null;
        if (jobName == null || jobName.isBlank()) {
            log.error("Completion event without job name: {}", event);
            return CompletionResponse.badRequest("Job name not provided in event");
        }
        log.info("Completion event received | jobName={} status={}", jobName, event.getRawStatus());

        Optional<JobMetadata> found;
        try {
            found = metadataStore.get(jobName);
        } catch (RuntimeException e) {
            log.error("Job metadata lookup failed | jobName={}: {}", jobName, e.getMessage(), e);
            return new CompletionResponse(StatusCodes.INTERNAL_ERROR, "Metadata lookup failed: " + e.getMessage(), false);
        }
        if (found.isEmpty()) {
            log.warn("No job metadata for {}; it was never submitted by this pipeline, expired, or was already handled",
                    jobName);
            return CompletionResponse.notFound("No metadata found for job " + jobName);
        }

        JobMetadata metadata = found.get();
        boolean retainMetadata = false;
        try {
            ResumptionHandle handle = metadata.getResumption();
            if (handle == null) {
                log.error("Job metadata for {} has no resumption handle; workflow cannot be resumed", jobName);
                return new CompletionResponse(StatusCodes.INTERNAL_ERROR, "No resumption handle for job " + jobName, false);
            }
            if (event.getStatus() != JobStatus.COMPLETED) {
                return signalJobFailure(jobName, event.getRawStatus(), handle);
            }
            return signalResults(metadata, handle);
        } catch (ResumptionUnavailableException e) {
            retainMetadata = true;
            log.error("Could not resume workflow for job {}; metadata kept for a redelivered event: {}",
                    jobName, e.getMessage(), e);
            return new CompletionResponse(StatusCodes.INTERNAL_ERROR,
                    "Workflow could not be resumed, retry the event: " + e.getMessage(), false);
        } finally {
            if (!retainMetadata) {
                deleteMetadata(jobName);
            }
        }
    }

    private CompletionResponse signalJobFailure(String jobName, String rawStatus, ResumptionHandle handle) {
        String cause = "Batch transform job failed with status: " + rawStatus;
        try {
            Optional<String> reason = predictionService.describeFailure(jobName);
            if (reason.isPresent()) {
                cause = cause + ". Reason: " + reason.get();
            }
        } catch (RuntimeException e) {
            log.warn("Could not describe failed job {}: {}", jobName, e.getMessage());
        }
        log.error("Batch transform job {} did not complete | {}", jobName, cause);
        boolean resumed = resumer.fail(handle, DispatchErrorCode.JOB_FAILED, cause);
        PredictionMetrics.completionHandled(rawStatus);
        return new CompletionResponse(StatusCodes.OK, cause, resumed);
    }

    private CompletionResponse signalResults(JobMetadata metadata, ResumptionHandle handle) {
        DispatchResult result;
        try {
            result = reconcile(metadata);
        } catch (RuntimeException e) {
            log.error("Failed to process results of job {}: {}", metadata.getJobName(), e.getMessage(), e);
            String cause = "Failed to process batch results: " + e.getMessage();
            boolean resumed = resumer.fail(handle, DispatchErrorCode.RESULT_PROCESSING_FAILED, cause);
            PredictionMetrics.completionHandled(DispatchErrorCode.RESULT_PROCESSING_FAILED.getType());
            return new CompletionResponse(StatusCodes.INTERNAL_ERROR, cause, resumed);
        }
        boolean resumed = resumer.succeed(handle, result);
        PredictionMetrics.completionHandled(JobStatus.COMPLETED.getExternalName());
        return new CompletionResponse(StatusCodes.OK, result.getMessage(), resumed);
    }

    /** Reads input and output, joins them by position and writes the final predictions file. */
    DispatchResult reconcile(JobMetadata metadata) {
        RecordTable table = CsvRecordCodec.readTable(objects.readObject(metadata.getSourceFileKey()), config.getIdColumn());
        if (table.size() != metadata.getRecordCount()) {
            log.warn("Source file {} has {} rows but {} were submitted", metadata.getSourceFileKey(), table.size(),
                    metadata.getRecordCount());
        }
        if (!metadata.getOriginalColumns().isEmpty() && !metadata.getOriginalColumns().equals(table.getColumns())) {
            log.warn("Source columns {} differ from recorded columns {}", table.getColumns(), metadata.getOriginalColumns());
        }

        String outputKey = metadata.getOutputFileKey();
        if (!objects.exists(outputKey)) {
            String prefix = metadata.getOutputPrefix() != null ? metadata.getOutputPrefix() : PredictConfig.OUTPUT_BATCH_PREFIX;
            List<String> available = objects.listObjects(prefix + "/", DIAGNOSTIC_LISTING_LIMIT);
            throw new ReconciliationException("Output file not found: " + outputKey
                    + ". Available files under " + prefix + "/: " + available);
        }
        List<PredictionRecord> predictions = CsvRecordCodec.readPredictions(objects.readObject(outputKey));
        log.info("Read {} predictions for {} input rows | job={}", predictions.size(), table.size(), metadata.getJobName());

        List<ReconciledRecord> joined = PositionalJoin.join(table.getRows(), predictions);

        String finalKey = FileKeys.finalOutput(metadata.getTimestamp());
        objects.writeObject(finalKey, mergedCsv(table, joined));
        log.info("Predictions written | key={} records={}", finalKey, joined.size());
        return DispatchResult.completed(joined.size(), finalKey, metadata.getJobName());
    }

    /**
     * Original columns in original order, the flag column set in place, then {@code predicted_value}, then
     * the flag column if the source did not carry it.
     */
    private String mergedCsv(RecordTable table, List<ReconciledRecord> joined) {
        String flagColumn = config.getPredictedFlagColumn();
        boolean flagPresent = table.getColumns().contains(flagColumn);
        List<String> columns = new ArrayList<>(table.getColumns());
        columns.add(PREDICTED_VALUE_COLUMN);
        if (!flagPresent) {
            columns.add(flagColumn);
        }
        List<List<String>> rows = new ArrayList<>(joined.size());
        for (ReconciledRecord r : joined) {
            String flag = r.isPredicted() ? FLAG_TRUE : FLAG_FALSE;
            List<String> cells = new ArrayList<>(columns.size());
            for (String column : table.getColumns()) {
                cells.add(column.equals(flagColumn) ? flag : table.cell(r.getCandidate(), column));
            }
            cells.add(r.getPredictedValue());
            if (!flagPresent) {
                cells.add(flag);
            }
            rows.add(cells);
        }
        return CsvRecordCodec.writeRows(columns, rows, true);
    }

    private void deleteMetadata(String jobName) {
        try {
            metadataStore.delete(jobName);
        } catch (RuntimeException e) {
            log.warn("Failed to delete job metadata for {}: {}", jobName, e.getMessage());
        }
    }
}
