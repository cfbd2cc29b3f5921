package com.batchpredict.worker;

import com.batchpredict.config.PredictConfig;
import com.batchpredict.worker.activity.PredictionActivitiesImpl;
import com.batchpredict.worker.activity.WorkflowSubmissionListener;
import com.batchpredict.worker.trigger.PredictionWorkflowStarter;
import com.batchpredict.worker.workflow.PredictionWorkflowImpl;
import io.temporal.worker.Worker;
import io.temporal.worker.WorkerFactory;
import io.temporal.worker.WorkerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Batch prediction worker: registers the prediction workflow and its activities on the task queue and,
 * when a cron schedule is configured, makes sure the scheduled run exists.
 */
public final class PredictWorkerApplication {

    private static final Logger log = LoggerFactory.getLogger(PredictWorkerApplication.class);
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;

    private PredictWorkerApplication() {
    }

    public static void main(String[] args) {
        PredictConfig config = PredictConfig.fromEnvironment();
        PredictWorkerComponents components = PredictWorkerComponents.create(config);

        WorkerFactory factory = WorkerFactory.newInstance(components.getClient());
        WorkerOptions workerOptions = WorkerOptions.newBuilder()
                .setMaxConcurrentActivityExecutionSize(10)
                .setMaxConcurrentWorkflowTaskExecutionSize(10)
                .build();
        Worker worker = factory.newWorker(config.getTaskQueue(), workerOptions);
        worker.registerWorkflowImplementationTypes(PredictionWorkflowImpl.class);
        worker.registerActivitiesImplementations(new PredictionActivitiesImpl(
                components.queryStage(),
                components.jobDispatcher(),
                components.dbWriter(),
                components.getResumer(),
                new WorkflowSubmissionListener(components.getClient())));

        log.info("Starting worker | Temporal: {} | namespace: {} | queue: {} | Cache: {}:{} | DB: {}:{} | bucket: {} | model: {}",
                config.getTemporalTarget(), config.getTemporalNamespace(), config.getTaskQueue(),
                config.getCacheHost(), config.getCachePort(),
                config.getDbHost(), config.getDbPort(),
                config.getSourceBucket(), config.getModelId());
        if (config.getModelId() == null) {
            log.warn("BP_MODEL_ID is not set; every dispatch will fail with MissingModelId");
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down worker...");
            shutdown(factory);
            components.getService().shutdown();
        }));

        factory.start();

        if (config.getCronSchedule() != null) {
            new PredictionWorkflowStarter(components.getClient(), config).start();
        }

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Interrupted, shutting down worker...");
            shutdown(factory);
        }
    }

    private static void shutdown(WorkerFactory factory) {
        factory.shutdown();
        try {
            factory.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (Exception e) {
            log.error("Error during worker shutdown: {}", e.getMessage());
        }
    }
}
