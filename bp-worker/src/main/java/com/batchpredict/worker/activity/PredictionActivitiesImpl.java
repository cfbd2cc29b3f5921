package com.batchpredict.worker.activity;

import com.batchpredict.model.DispatchErrorCode;
import com.batchpredict.model.DispatchResult;
import com.batchpredict.model.QueryResult;
import com.batchpredict.model.ResumptionHandle;
import com.batchpredict.model.WriteResult;
import com.batchpredict.worker.dispatch.DispatchResponse;
import com.batchpredict.worker.dispatch.JobDispatcher;
import com.batchpredict.worker.query.QueryStage;
import com.batchpredict.worker.resume.ResumptionUnavailableException;
import com.batchpredict.worker.resume.WorkflowResumer;
import com.batchpredict.worker.writer.DbWriter;
import io.temporal.activity.Activity;
import io.temporal.activity.ActivityExecutionContext;
import io.temporal.activity.ActivityInfo;
import io.temporal.failure.ApplicationFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Activity implementation delegating to the stage components. The dispatch activity never completes on
 * return: its task token becomes the run's resumption handle. If an outcome cannot be delivered by token the
 * activity fails itself instead, through the worker's own completion path.
 */
public class PredictionActivitiesImpl implements PredictionActivities {

    private static final Logger log = LoggerFactory.getLogger(PredictionActivitiesImpl.class);

    private final QueryStage queryStage;
    private final JobDispatcher dispatcher;
    private final DbWriter dbWriter;
    private final WorkflowResumer resumer;
    private final SubmissionListener submissionListener;

    public PredictionActivitiesImpl(QueryStage queryStage, JobDispatcher dispatcher, DbWriter dbWriter,
                                    WorkflowResumer resumer, SubmissionListener submissionListener) {
        this.queryStage = Objects.requireNonNull(queryStage, "queryStage");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.dbWriter = Objects.requireNonNull(dbWriter, "dbWriter");
        this.resumer = Objects.requireNonNull(resumer, "resumer");
        this.submissionListener = submissionListener != null ? submissionListener : SubmissionListener.NONE;
    }

    @Override
    public QueryResult queryCandidates(int durationHours) {
        return queryStage.run(durationHours);
    }

    @Override
    public DispatchResult dispatchJob(QueryResult queryResult) {
        ActivityExecutionContext ctx = Activity.getExecutionContext();
        ctx.doNotCompleteOnReturn();
        ActivityInfo info = ctx.getInfo();
        ResumptionHandle handle = ResumptionHandle.of(ctx.getTaskToken(), expiresAt(info));
        try {
            DispatchResponse response = dispatcher.dispatch(queryResult, handle);
            log.info("Dispatch returned | workflowId={} {}", info.getWorkflowId(), response);
            if (response.isAccepted()) {
                submissionListener.jobSubmitted(info.getWorkflowId(), response.getJobName());
            }
        } catch (ResumptionUnavailableException e) {
            log.error("Dispatch outcome not delivered | workflowId={}: {}", info.getWorkflowId(), e.getMessage(), e);
            throw ApplicationFailure.newNonRetryableFailure(e.getMessage(), DispatchErrorCode.INITIATION_FAILED.getType());
        } catch (RuntimeException e) {
            log.error("Dispatch threw | workflowId={}: {}", info.getWorkflowId(), e.getMessage(), e);
            resumer.fail(handle, DispatchErrorCode.INITIATION_FAILED,
                    "Error during batch transform initiation: " + e.getMessage());
        }
        return null;
    }

    @Override
    public WriteResult writePredictions(String fileKey, int records) {
        return dbWriter.write(fileKey, records);
    }

    /** Instant the workflow stops waiting for this attempt; 0 when no schedule-to-close timeout is set. */
    static long expiresAt(ActivityInfo info) {
        Duration scheduleToClose = info.getScheduleToCloseTimeout();
        if (scheduleToClose == null || scheduleToClose.isZero()) {
            return 0L;
        }
        return info.getScheduledTimestamp() + scheduleToClose.toMillis();
    }
}
