package com.batchpredict.storage.prediction;

import java.util.Objects;

/** Parameters of one batch transform submission. Input and output are absolute object-store locations. */
public final class BatchJobRequest {

    private final String jobName;
    private final String modelId;
    private final String inputUri;
    private final String outputUri;
    private final String instanceType;
    private final int instanceCount;

    public BatchJobRequest(String jobName, String modelId, String inputUri, String outputUri,
                           String instanceType, int instanceCount) {
        this.jobName = Objects.requireNonNull(jobName, "jobName");
        this.modelId = Objects.requireNonNull(modelId, "modelId");
        this.inputUri = Objects.requireNonNull(inputUri, "inputUri");
        this.outputUri = Objects.requireNonNull(outputUri, "outputUri");
        this.instanceType = Objects.requireNonNull(instanceType, "instanceType");
        if (instanceCount < 1) {
            throw new IllegalArgumentException("instanceCount must be >= 1: " + instanceCount);
        }
        this.instanceCount = instanceCount;
    }

    public String getJobName() {
        return jobName;
    }

    public String getModelId() {
        return modelId;
    }

    public String getInputUri() {
        return inputUri;
    }

    public String getOutputUri() {
        return outputUri;
    }

    public String getInstanceType() {
        return instanceType;
    }

    public int getInstanceCount() {
        return instanceCount;
    }

    @Override
    public String toString() {
        return "BatchJobRequest{jobName=" + jobName + ", modelId=" + modelId + ", input=" + inputUri
                + ", output=" + outputUri + ", instances=" + instanceCount + "x" + instanceType + "}";
    }
}
