package com.batchpredict.storage.prediction;

import java.util.Optional;

/**
 * External prediction service running batch jobs. Faults surface as
 * {@link com.batchpredict.storage.StorageException} carrying the service's message.
 */
public interface PredictionService {

    boolean modelExists(String modelId);

    /**
     * Starts a batch job and returns immediately; the job's outcome arrives later as a completion event.
     *
     * @return the job name the service will report in that event
     */
    String submitJob(BatchJobRequest request);

    /** The service's failure reason for a job, when it has one. */
    Optional<String> describeFailure(String jobName);
}
