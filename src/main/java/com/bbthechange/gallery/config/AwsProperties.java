package com.bbthechange.gallery.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;

import java.net.URI;
import java.util.Optional;

/**
 * Region, endpoints and local credentials shared by the DynamoDB and S3 clients.
 * An endpoint is only set when running against DynamoDB Local or LocalStack.
 */
@Component
@ConfigurationProperties(prefix = "aws")
public class AwsProperties {

    private String region = "us-east-1";

    /**
     * Credentials sent to a local endpoint. Local emulators accept any pair.
     */
    private String localAccessKey = "local";
    private String localSecretKey = "local";

    private final Service dynamodb = new Service();
    private final S3 s3 = new S3();

    public Region awsRegion() {
        return Region.of(region);
    }

    /**
     * Static local credentials when the service has an endpoint override, otherwise the default chain.
     */
    public AwsCredentialsProvider credentialsFor(Service service) {
        if (service.localEndpoint().isPresent()) {
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(localAccessKey, localSecretKey));
        }
        return DefaultCredentialsProvider.create();
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getLocalAccessKey() {
        return localAccessKey;
    }

    public void setLocalAccessKey(String localAccessKey) {
        this.localAccessKey = localAccessKey;
    }

    public String getLocalSecretKey() {
        return localSecretKey;
    }

    public void setLocalSecretKey(String localSecretKey) {
        this.localSecretKey = localSecretKey;
    }

    public Service getDynamodb() {
        return dynamodb;
    }

    public S3 getS3() {
        return s3;
    }

    public static class Service {

        private String endpoint;

        public Optional<URI> localEndpoint() {
            if (endpoint == null || endpoint.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(URI.create(endpoint.trim()));
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }
    }

    public static class S3 extends Service {

        private String bucket = "gallery-photos";

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket;
        }
    }
}
