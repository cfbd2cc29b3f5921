package com.batchpredict.worker.workflow;

import com.batchpredict.model.DispatchErrorCode;
import com.batchpredict.model.DispatchResult;
import com.batchpredict.model.QueryResult;
import com.batchpredict.model.StatusCodes;
import com.batchpredict.model.WriteResult;
import com.batchpredict.worker.activity.PredictionActivities;
import io.temporal.activity.ActivityOptions;
import io.temporal.common.RetryOptions;
import io.temporal.failure.ActivityFailure;
import io.temporal.failure.ApplicationFailure;
import io.temporal.failure.TimeoutFailure;
import io.temporal.workflow.Workflow;
import org.slf4j.Logger;

/**
 * Linear prediction run. Each active stage is one activity with its own timeout and a single attempt;
 * the next scheduled run is the retry. The dispatch activity stays open across the external job, so its
 * timeout bounds submission plus the wait for the completion event.
 */
public class PredictionWorkflowImpl implements PredictionWorkflow {

    private static final Logger log = Workflow.getLogger(PredictionWorkflowImpl.class);
    private static final RetryOptions NO_RETRY = RetryOptions.newBuilder().setMaximumAttempts(1).build();

    private WorkflowStage stage = WorkflowStage.QUERYING;
    private String jobName;

    @Override
    public PredictionRunResult run(PredictionRunRequest request) {
        log.info("Prediction run started | {}", request);
        PredictionActivities queryActivities = Workflow.newActivityStub(PredictionActivities.class,
                ActivityOptions.newBuilder()
                        .setStartToCloseTimeout(request.queryTimeout())
                        .setRetryOptions(NO_RETRY)
                        .build());
        PredictionActivities dispatchActivities = Workflow.newActivityStub(PredictionActivities.class,
                ActivityOptions.newBuilder()
                        .setScheduleToCloseTimeout(request.dispatchTimeout())
                        .setRetryOptions(NO_RETRY)
                        .build());
        PredictionActivities writeActivities = Workflow.newActivityStub(PredictionActivities.class,
                ActivityOptions.newBuilder()
                        .setStartToCloseTimeout(request.writeTimeout())
                        .setRetryOptions(NO_RETRY)
                        .build());

        stage = WorkflowStage.QUERYING;
        QueryResult query;
        try {
            query = queryActivities.queryCandidates(request.getDurationHours());
        } catch (ActivityFailure e) {
            return fail(WorkflowStage.QUERY_FAILED,
                    isTimeout(e) ? RunErrorCode.QUERY_TIMEOUT : RunErrorCode.QUERY_FAILED,
                    StatusCodes.INTERNAL_ERROR, detail(e), 0);
        }
        if (query.isError()) {
            return fail(WorkflowStage.QUERY_FAILED, RunErrorCode.QUERY_FAILED, query.getStatusCode(),
                    query.getMessage(), 0);
        }
        if (query.isNoContent() || query.getRecords() == 0) {
            return finish(WorkflowStage.NO_RECORDS, StatusCodes.NO_CONTENT, 0, 0, null);
        }
        stage = WorkflowStage.HAS_RECORDS;
        log.info("Candidates exported | records={} key={}", query.getRecords(), query.getFileKey());

        stage = WorkflowStage.DISPATCHING;
        DispatchResult dispatch;
        try {
            dispatch = dispatchActivities.dispatchJob(query);
        } catch (ActivityFailure e) {
            if (isTimeout(e)) {
                return fail(WorkflowStage.DISPATCH_FAILED, RunErrorCode.DISPATCH_TIMEOUT, StatusCodes.INTERNAL_ERROR,
                        "No completion received" + (jobName != null ? " for job " + jobName : "") + ": " + detail(e),
                        query.getRecords());
            }
            DispatchErrorCode code = errorCode(e);
            if (code != null && code.isJobFailure()) {
                return fail(WorkflowStage.JOB_FAILED, RunErrorCode.JOB_FAILED, code.getStatusCode(), detail(e),
                        query.getRecords());
            }
            return fail(WorkflowStage.DISPATCH_FAILED, RunErrorCode.DISPATCH_FAILED,
                    code != null ? code.getStatusCode() : StatusCodes.INTERNAL_ERROR, detail(e), query.getRecords());
        }
        stage = WorkflowStage.COMPLETED;
        int records = dispatch != null ? dispatch.getRecords() : 0;
        String fileKey = dispatch != null ? dispatch.getFileKey() : null;
        log.info("Dispatch completed | {}", dispatch);

        stage = WorkflowStage.WRITING;
        WriteResult write;
        try {
            write = writeActivities.writePredictions(fileKey, records);
        } catch (ActivityFailure e) {
            return fail(WorkflowStage.WRITE_FAILED,
                    isTimeout(e) ? RunErrorCode.WRITE_TIMEOUT : RunErrorCode.WRITE_FAILED,
                    StatusCodes.INTERNAL_ERROR, detail(e), records);
        }
        return finish(WorkflowStage.DONE, StatusCodes.OK, write.getTotalRecords(), write.getUpdatedRecords(), fileKey);
    }

    @Override
    public WorkflowStage currentStage() {
        return stage;
    }

    @Override
    public void jobSubmitted(String jobName) {
        this.jobName = jobName;
        if (stage == WorkflowStage.DISPATCHING) {
            stage = WorkflowStage.AWAITING_COMPLETION;
            log.info("Awaiting completion of job {}", jobName);
        }
    }

    private PredictionRunResult finish(WorkflowStage terminal, int statusCode, int records, int updated,
                                       String fileKey) {
        stage = terminal;
        log.info("Prediction run finished | stage={} records={} updated={}", terminal, records, updated);
        return new PredictionRunResult(terminal, statusCode, null, null, records, updated, fileKey);
    }

    private PredictionRunResult fail(WorkflowStage terminal, RunErrorCode code, int statusCode, String detail,
                                     int records) {
        stage = terminal;
        log.error("Prediction run failed | stage={} error={} detail={}", terminal, code.getCode(), detail);
        return new PredictionRunResult(terminal, statusCode, code.getCode(), detail, records, 0, null);
    }

    private static boolean isTimeout(ActivityFailure e) {
        return e.getCause() instanceof TimeoutFailure;
    }

    private static DispatchErrorCode errorCode(ActivityFailure e) {
        if (e.getCause() instanceof ApplicationFailure) {
            return DispatchErrorCode.fromType(((ApplicationFailure) e.getCause()).getType());
        }
        return null;
    }

    /** "type: message" of the activity's own failure. */
    private static String detail(ActivityFailure e) {
        Throwable cause = e.getCause();
        if (cause instanceof ApplicationFailure) {
            ApplicationFailure af = (ApplicationFailure) cause;
            return af.getType() + ": " + af.getOriginalMessage();
        }
        if (cause instanceof TimeoutFailure) {
            return "Timeout " + ((TimeoutFailure) cause).getTimeoutType();
        }
        return cause != null ? cause.getMessage() : e.getMessage();
    }
}
