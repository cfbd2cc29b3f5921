package com.batchpredict.worker.activity;

import com.batchpredict.worker.workflow.PredictionWorkflow;
import io.temporal.client.WorkflowClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/** Signals {@link PredictionWorkflow#jobSubmitted(String)}. Only moves the visible stage, so failures are logged. */
public final class WorkflowSubmissionListener implements SubmissionListener {

    private static final Logger log = LoggerFactory.getLogger(WorkflowSubmissionListener.class);

    private final WorkflowClient client;

    public WorkflowSubmissionListener(WorkflowClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public void jobSubmitted(String workflowId, String jobName) {
        try {
            client.newWorkflowStub(PredictionWorkflow.class, workflowId).jobSubmitted(jobName);
        } catch (RuntimeException e) {
            log.warn("Could not signal job submission to workflow {} (job {}): {}", workflowId, jobName, e.getMessage());
        }
    }
}
