package com.bbthechange.gallery.service.impl;

import com.bbthechange.gallery.config.AwsProperties;
import com.bbthechange.gallery.exception.StorageException;
import com.bbthechange.gallery.service.PhotoStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;

@Service
@Slf4j
public class S3PhotoStorage implements PhotoStorage {

    private final S3Client s3Client;
    private final S3Presigner s3Presigner;
    private final String bucketName;

    @Autowired
    public S3PhotoStorage(S3Client s3Client, S3Presigner s3Presigner, AwsProperties awsProperties) {
        this.s3Client = s3Client;
        this.s3Presigner = s3Presigner;
        this.bucketName = awsProperties.getS3().getBucket();
    }

    @Override
    public void put(String key, InputStream content, long contentLength, String contentType) {
        try {
            s3Client.putObject(putRequest(key, contentType), RequestBody.fromInputStream(content, contentLength));
            log.debug("Stored {} ({} bytes) in bucket {}", key, contentLength, bucketName);
        } catch (SdkException e) {
            log.error("Error storing object {}: {}", key, e.getMessage(), e);
            throw new StorageException("Failed to store object " + key, e);
        }
    }

    @Override
    public void putFile(String key, Path file, String contentType) {
        try {
            s3Client.putObject(putRequest(key, contentType), RequestBody.fromFile(file));
            log.debug("Stored file {} as {}", file, key);
        } catch (SdkException e) {
            log.error("Error storing file {} as {}: {}", file, key, e.getMessage(), e);
            throw new StorageException("Failed to store object " + key, e);
        }
    }

    @Override
    public InputStream open(String key) {
        try {
            return s3Client.getObject(GetObjectRequest.builder()
                    .bucket(bucketName)
                    .key(key)
                    .build());
        } catch (SdkException e) {
            log.error("Error reading object {}: {}", key, e.getMessage(), e);
            throw new StorageException("Failed to read object " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        if (key == null || key.isEmpty()) {
            return;
        }
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder()
                    .bucket(bucketName)
                    .key(key)
                    .build());
        } catch (SdkException e) {
            log.warn("Could not delete object {}: {}", key, e.getMessage());
        }
    }

    @Override
    public String presignedGetUrl(String key, Duration ttl) {
        try {
            GetObjectPresignRequest presignRequest = GetObjectPresignRequest.builder()
                    .signatureDuration(ttl)
                    .getObjectRequest(GetObjectRequest.builder()
                            .bucket(bucketName)
                            .key(key)
                            .build())
                    .build();
            return s3Presigner.presignGetObject(presignRequest).url().toString();
        } catch (SdkException e) {
            log.error("Error presigning object {}: {}", key, e.getMessage(), e);
            throw new StorageException("Failed to generate download URL", e);
        }
    }

    private PutObjectRequest putRequest(String key, String contentType) {
        return PutObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .contentType(contentType)
                .build();
    }
}
