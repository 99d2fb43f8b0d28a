package com.flagship.media_ledger.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.time.Duration;

@Slf4j
@Service
@ConditionalOnProperty(name = "storage.s3.enabled", havingValue = "true")
public class S3ObjectStore implements ObjectStore {

    private final S3Client s3Client;
    private final S3Presigner s3Presigner;
    private final String bucket;

    public S3ObjectStore(S3Client s3Client,
                         S3Presigner s3Presigner,
                         @Value("${storage.s3.bucket}") String bucket) {
        this.s3Client = s3Client;
        this.s3Presigner = s3Presigner;
        this.bucket = bucket;
        log.info("S3 object store initialized for bucket {}", bucket);
    }

    @Override
    public void put(String path, byte[] data, String contentType) {
        try {
            s3Client.putObject(PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(path)
                            .contentType(contentType)
                            .build(),
                    RequestBody.fromBytes(data));
            log.info("Stored object {}/{} ({} bytes)", bucket, path, data.length);
        } catch (S3Exception e) {
            throw new ObjectStoreException("Failed to store " + path, e);
        }
    }

    @Override
    public boolean exists(String path) {
        try {
            s3Client.headObject(HeadObjectRequest.builder()
                    .bucket(bucket)
                    .key(path)
                    .build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            // HEAD responses carry no body, so a missing key often surfaces as a bare 404
            if (e.statusCode() == 404) {
                return false;
            }
            throw new ObjectStoreException("Failed to check existence of " + path, e);
        }
    }

    @Override
    public void delete(String path) {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder()
                    .bucket(bucket)
                    .key(path)
                    .build());
            log.info("Deleted object {}/{}", bucket, path);
        } catch (S3Exception e) {
            throw new ObjectStoreException("Failed to delete " + path, e);
        }
    }

    @Override
    public String generateTimeLimitedUrl(String path, Duration ttl) {
        try {
            GetObjectPresignRequest request = GetObjectPresignRequest.builder()
                    .signatureDuration(ttl)
                    .getObjectRequest(GetObjectRequest.builder()
                            .bucket(bucket)
                            .key(path)
                            .build())
                    .build();
            return s3Presigner.presignGetObject(request).url().toString();
        } catch (S3Exception e) {
            throw new ObjectStoreException("Failed to presign " + path, e);
        }
    }
}
