package com.batchpredict.worker.activity;

/** Told when the dispatch activity has submitted a job and is now waiting for it. */
@FunctionalInterface
public interface SubmissionListener {

    SubmissionListener NONE = (workflowId, jobName) -> { };

    void jobSubmitted(String workflowId, String jobName);
}
