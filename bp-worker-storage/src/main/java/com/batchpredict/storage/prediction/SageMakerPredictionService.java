package com.batchpredict.storage.prediction;

import com.batchpredict.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sagemaker.SageMakerClient;
import software.amazon.awssdk.services.sagemaker.model.AssemblyType;
import software.amazon.awssdk.services.sagemaker.model.CreateTransformJobRequest;
import software.amazon.awssdk.services.sagemaker.model.CreateTransformJobResponse;
import software.amazon.awssdk.services.sagemaker.model.DescribeModelRequest;
import software.amazon.awssdk.services.sagemaker.model.DescribeTransformJobRequest;
import software.amazon.awssdk.services.sagemaker.model.DescribeTransformJobResponse;
import software.amazon.awssdk.services.sagemaker.model.S3DataType;
import software.amazon.awssdk.services.sagemaker.model.SageMakerException;
import software.amazon.awssdk.services.sagemaker.model.SplitType;
import software.amazon.awssdk.services.sagemaker.model.TransformDataSource;
import software.amazon.awssdk.services.sagemaker.model.TransformInput;
import software.amazon.awssdk.services.sagemaker.model.TransformOutput;
import software.amazon.awssdk.services.sagemaker.model.TransformResources;
import software.amazon.awssdk.services.sagemaker.model.TransformS3DataSource;

import java.util.Objects;
import java.util.Optional;

/** {@link PredictionService} backed by SageMaker batch transform, CSV in and out, one record per line. */
public final class SageMakerPredictionService implements PredictionService {

    private static final Logger log = LoggerFactory.getLogger(SageMakerPredictionService.class);
    private static final String CONTENT_TYPE_CSV = "text/csv";
    private static final String VALIDATION_ERROR = "ValidationException";

    private final SageMakerClient client;

    public SageMakerPredictionService(SageMakerClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public static SageMakerPredictionService create(String region) {
        return new SageMakerPredictionService(SageMakerClient.builder().region(Region.of(region)).build());
    }

    @Override
    public boolean modelExists(String modelId) {
        try {
            client.describeModel(DescribeModelRequest.builder().modelName(modelId).build());
            return true;
        } catch (SageMakerException e) {
            // describeModel reports an unknown model as a validation error
            if (e.awsErrorDetails() != null && VALIDATION_ERROR.equals(e.awsErrorDetails().errorCode())) {
                log.warn("Model not found | modelId={} reason={}", modelId, e.awsErrorDetails().errorMessage());
                return false;
            }
            throw new StorageException("Failed to describe model " + modelId + ": " + e.getMessage(), e);
        } catch (SdkException e) {
            throw new StorageException("Failed to describe model " + modelId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String submitJob(BatchJobRequest request) {
        CreateTransformJobRequest create = CreateTransformJobRequest.builder()
                .transformJobName(request.getJobName())
                .modelName(request.getModelId())
                .transformInput(TransformInput.builder()
                        .dataSource(TransformDataSource.builder()
                                .s3DataSource(TransformS3DataSource.builder()
                                        .s3DataType(S3DataType.S3_PREFIX)
                                        .s3Uri(request.getInputUri())
                                        .build())
                                .build())
                        .contentType(CONTENT_TYPE_CSV)
                        .splitType(SplitType.LINE)
                        .build())
                .transformOutput(TransformOutput.builder()
                        .s3OutputPath(request.getOutputUri())
                        .accept(CONTENT_TYPE_CSV)
                        .assembleWith(AssemblyType.LINE)
                        .build())
                .transformResources(TransformResources.builder()
                        .instanceType(request.getInstanceType())
                        .instanceCount(request.getInstanceCount())
                        .build())
                .build();
        try {
            CreateTransformJobResponse response = client.createTransformJob(create);
            log.info("Batch transform submitted | jobName={} arn={}", request.getJobName(), response.transformJobArn());
            return request.getJobName();
        } catch (SdkException e) {
            throw new StorageException("Failed to create transform job " + request.getJobName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> describeFailure(String jobName) {
        try {
            DescribeTransformJobResponse response = client.describeTransformJob(
                    DescribeTransformJobRequest.builder().transformJobName(jobName).build());
            String reason = response.failureReason();
            return reason == null || reason.isBlank() ? Optional.empty() : Optional.of(reason);
        } catch (SdkException e) {
            throw new StorageException("Failed to describe transform job " + jobName + ": " + e.getMessage(), e);
        }
    }
}
