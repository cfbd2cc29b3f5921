package com.batchpredict.storage.metadata;

import com.batchpredict.model.JobMetadata;

import java.util.Optional;

/**
 * Durable hand-off of {@link JobMetadata} between the dispatcher and the completion handler, keyed by
 * external job name. Store faults surface as {@link com.batchpredict.storage.StorageException}.
 */
public interface JobMetadataStore {

    void put(JobMetadata metadata);

    /** Empty when no metadata exists for the job (never submitted, expired, or already handled). */
    Optional<JobMetadata> get(String jobName);

    void delete(String jobName);
}
