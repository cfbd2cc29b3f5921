package com.batchpredict.worker.workflow;

import io.temporal.workflow.QueryMethod;
import io.temporal.workflow.SignalMethod;
import io.temporal.workflow.WorkflowInterface;
import io.temporal.workflow.WorkflowMethod;

/**
 * Batch prediction run: query candidates, dispatch a batch job and wait for its completion event, then
 * write predictions back.
 */
@WorkflowInterface
public interface PredictionWorkflow {

    @WorkflowMethod
    PredictionRunResult run(PredictionRunRequest request);

    @QueryMethod
    WorkflowStage currentStage();

    /**
     * Sent by the dispatch activity once the job is submitted, while the activity itself stays open until
     * the completion event arrives.
     */
    @SignalMethod
    void jobSubmitted(String jobName);
}
