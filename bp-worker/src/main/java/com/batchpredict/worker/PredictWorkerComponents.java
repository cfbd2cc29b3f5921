package com.batchpredict.worker;

import com.batchpredict.config.PredictConfig;
import com.batchpredict.storage.db.CandidateRepository;
import com.batchpredict.storage.db.JdbcCandidateRepository;
import com.batchpredict.storage.db.JdbcConnectionProvider;
import com.batchpredict.storage.metadata.JobMetadataStore;
import com.batchpredict.storage.metadata.RedisJobMetadataStore;
import com.batchpredict.storage.object.ObjectStore;
import com.batchpredict.storage.object.S3ObjectStore;
import com.batchpredict.storage.prediction.PredictionService;
import com.batchpredict.storage.prediction.SageMakerPredictionService;
import com.batchpredict.worker.completion.CompletionHandler;
import com.batchpredict.worker.dispatch.JobDispatcher;
import com.batchpredict.worker.query.QueryStage;
import com.batchpredict.worker.resume.TemporalWorkflowResumer;
import com.batchpredict.worker.resume.WorkflowResumer;
import com.batchpredict.worker.writer.DbWriter;
import io.temporal.client.WorkflowClient;
import io.temporal.client.WorkflowClientOptions;
import io.temporal.serviceclient.WorkflowServiceStubs;
import io.temporal.serviceclient.WorkflowServiceStubsOptions;

import java.time.Clock;

/**
 * Wires the stage components for one process from a {@link PredictConfig}. Shared by the worker and the
 * completion-event entry point.
 */
public final class PredictWorkerComponents {

    private final PredictConfig config;
    private final WorkflowServiceStubs service;
    private final WorkflowClient client;
    private final ObjectStore objects;
    private final PredictionService predictionService;
    private final JobMetadataStore metadataStore;
    private final CandidateRepository repository;
    private final WorkflowResumer resumer;
    private final Clock clock = Clock.systemUTC();

    private PredictWorkerComponents(PredictConfig config) {
        this.config = config;
        this.service = WorkflowServiceStubs.newServiceStubs(
                WorkflowServiceStubsOptions.newBuilder()
                        .setTarget(config.getTemporalTarget())
                        .build());
        this.client = WorkflowClient.newInstance(service,
                WorkflowClientOptions.newBuilder()
                        .setNamespace(config.getTemporalNamespace())
                        .build());
        this.objects = S3ObjectStore.create(config.getAwsRegion(), config.getSourceBucket());
        this.predictionService = SageMakerPredictionService.create(config.getAwsRegion());
        this.metadataStore = new RedisJobMetadataStore(config);
        this.repository = new JdbcCandidateRepository(config, new JdbcConnectionProvider(config));
        this.resumer = new TemporalWorkflowResumer(client.newActivityCompletionClient());
    }

    public static PredictWorkerComponents create(PredictConfig config) {
        return new PredictWorkerComponents(config);
    }

    public PredictConfig getConfig() {
        return config;
    }

    public WorkflowServiceStubs getService() {
        return service;
    }

    public WorkflowClient getClient() {
        return client;
    }

    public WorkflowResumer getResumer() {
        return resumer;
    }

    public QueryStage queryStage() {
        return new QueryStage(repository, objects, clock);
    }

    public JobDispatcher jobDispatcher() {
        return new JobDispatcher(config, objects, predictionService, metadataStore, resumer, clock);
    }

    public CompletionHandler completionHandler() {
        return new CompletionHandler(config, objects, predictionService, metadataStore, resumer);
    }

    public DbWriter dbWriter() {
        return new DbWriter(config, objects, repository);
    }
}
