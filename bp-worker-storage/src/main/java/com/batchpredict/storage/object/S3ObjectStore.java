package com.batchpredict.storage.object;

import com.batchpredict.storage.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** {@link ObjectStore} over one S3 bucket. */
public final class S3ObjectStore implements ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(S3ObjectStore.class);
    private static final String CONTENT_TYPE_CSV = "text/csv";
    private static final int STATUS_NOT_FOUND = 404;

    private final S3Client s3Client;
    private final String bucket;

    public S3ObjectStore(S3Client s3Client, String bucket) {
        this.s3Client = Objects.requireNonNull(s3Client, "s3Client");
        this.bucket = Objects.requireNonNull(bucket, "bucket");
    }

    public static S3ObjectStore create(String region, String bucket) {
        return new S3ObjectStore(S3Client.builder().region(Region.of(region)).build(), bucket);
    }

    @Override
    public String getBucket() {
        return bucket;
    }

    @Override
    public String readObject(String key) {
        log.debug("Reading s3://{}/{}", bucket, key);
        try {
            return s3Client.getObjectAsBytes(GetObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .build())
                    .asUtf8String();
        } catch (SdkException e) {
            throw new StorageException("Failed to read s3://" + bucket + "/" + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void writeObject(String key, String content) {
        log.info("Uploading to s3://{}/{}", bucket, key);
        try {
            s3Client.putObject(
                    PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .contentType(CONTENT_TYPE_CSV)
                            .build(),
                    RequestBody.fromString(content != null ? content : "", StandardCharsets.UTF_8));
        } catch (SdkException e) {
            throw new StorageException("Failed to write s3://" + bucket + "/" + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean exists(String key) {
        try {
            s3Client.headObject(HeadObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == STATUS_NOT_FOUND) {
                return false;
            }
            throw new StorageException("Failed to check s3://" + bucket + "/" + key + ": " + e.getMessage(), e);
        } catch (SdkException e) {
            throw new StorageException("Failed to check s3://" + bucket + "/" + key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> listObjects(String prefix, int maxKeys) {
        try {
            ListObjectsV2Response response = s3Client.listObjectsV2(ListObjectsV2Request.builder()
                    .bucket(bucket)
                    .prefix(prefix)
                    .maxKeys(maxKeys)
                    .build());
            return response.contents().stream()
                    .map(S3Object::key)
                    .collect(Collectors.toList());
        } catch (SdkException e) {
            throw new StorageException("Failed to list s3://" + bucket + "/" + prefix + ": " + e.getMessage(), e);
        }
    }
}
