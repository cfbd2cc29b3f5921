package com.batchpredict.worker.trigger;

import com.batchpredict.config.PredictConfig;
import com.batchpredict.worker.workflow.PredictionRunRequest;
import com.batchpredict.worker.workflow.PredictionWorkflow;
import io.temporal.api.common.v1.WorkflowExecution;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowClientOptions;
import io.temporal.client.WorkflowExecutionAlreadyStarted;
import io.temporal.client.WorkflowOptions;
import io.temporal.serviceclient.WorkflowServiceStubs;
import io.temporal.serviceclient.WorkflowServiceStubsOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.UUID;

/**
 * Starts prediction runs. With a cron schedule configured the run is registered once under a fixed
 * workflow id and Temporal repeats it; otherwise a single run starts under a fresh id.
 */
public final class PredictionWorkflowStarter {

    static final String SCHEDULED_WORKFLOW_ID = "batch-predict-scheduled";

    private static final Logger log = LoggerFactory.getLogger(PredictionWorkflowStarter.class);

    private final WorkflowClient client;
    private final PredictConfig config;

    public PredictionWorkflowStarter(WorkflowClient client, PredictConfig config) {
        this.client = Objects.requireNonNull(client, "client");
        this.config = Objects.requireNonNull(config, "config");
    }

    /** @return the started execution, or null when the scheduled run is already registered */
    public WorkflowExecution start() {
        WorkflowOptions options = workflowOptions();
        PredictionWorkflow workflow = client.newWorkflowStub(PredictionWorkflow.class, options);
        PredictionRunRequest request = PredictionRunRequest.fromConfig(config);
        try {
            WorkflowExecution execution = WorkflowClient.start(workflow::run, request);
            log.info("Prediction run started | workflowId={} runId={} cron={}",
                    execution.getWorkflowId(), execution.getRunId(), config.getCronSchedule());
            return execution;
        } catch (WorkflowExecutionAlreadyStarted e) {
            log.info("Scheduled prediction run already registered | workflowId={}", options.getWorkflowId());
            return null;
        }
    }

    WorkflowOptions workflowOptions() {
        String cron = config.getCronSchedule();
        boolean scheduled = cron != null && !cron.isBlank();
        WorkflowOptions.Builder builder = WorkflowOptions.newBuilder()
                .setTaskQueue(config.getTaskQueue())
                .setWorkflowId(scheduled ? SCHEDULED_WORKFLOW_ID : "batch-predict-" + UUID.randomUUID())
                .setWorkflowRunTimeout(config.getExecutionTimeout());
        if (scheduled) {
            builder.setCronSchedule(cron);
        }
        return builder.build();
    }

    /** Starts one run (or registers the scheduled run) against the configured Temporal service. */
    public static void main(String[] args) {
        PredictConfig config = PredictConfig.fromEnvironment();
        WorkflowServiceStubs service = WorkflowServiceStubs.newServiceStubs(
                WorkflowServiceStubsOptions.newBuilder()
                        .setTarget(config.getTemporalTarget())
                        .build());
        WorkflowClient client = WorkflowClient.newInstance(service,
                WorkflowClientOptions.newBuilder()
                        .setNamespace(config.getTemporalNamespace())
                        .build());
        try {
            new PredictionWorkflowStarter(client, config).start();
        } finally {
            service.shutdown();
        }
    }
}
