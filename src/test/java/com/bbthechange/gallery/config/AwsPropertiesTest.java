package com.bbthechange.gallery.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;

import java.net.URI;

import static org.assertj.core.api.Assertions.*;

class AwsPropertiesTest {

    private AwsProperties awsProperties;

    @BeforeEach
    void setUp() {
        awsProperties = new AwsProperties();
        awsProperties.setRegion("eu-west-1");
    }

    @Nested
    class CredentialsTests {

        @Test
        void credentialsFor_WithLocalEndpoint_ShouldUseStaticLocalPair() {
            awsProperties.getDynamodb().setEndpoint("http://localhost:8000");
            awsProperties.setLocalAccessKey("dev");
            awsProperties.setLocalSecretKey("dev-secret");

            AwsCredentials credentials = awsProperties.credentialsFor(awsProperties.getDynamodb()).resolveCredentials();

            assertThat(credentials.accessKeyId()).isEqualTo("dev");
            assertThat(credentials.secretAccessKey()).isEqualTo("dev-secret");
        }

        @Test
        void credentialsFor_WithoutEndpoint_ShouldUseDefaultChain() {
            awsProperties.getS3().setEndpoint("  ");

            assertThat(awsProperties.getS3().localEndpoint()).isEmpty();
            assertThat(awsProperties.credentialsFor(awsProperties.getS3())).isInstanceOf(DefaultCredentialsProvider.class);
        }

        @Test
        void endpoints_ShouldBeIndependentPerService() {
            awsProperties.getS3().setEndpoint("http://localhost:4566");

            assertThat(awsProperties.credentialsFor(awsProperties.getS3())).isInstanceOf(StaticCredentialsProvider.class);
            assertThat(awsProperties.credentialsFor(awsProperties.getDynamodb())).isInstanceOf(DefaultCredentialsProvider.class);
            assertThat(awsProperties.getS3().getBucket()).isEqualTo("gallery-photos");
        }
    }

    @Nested
    class ClientTests {

        @Test
        void dynamoDbClient_ShouldApplyRegionAndLocalEndpoint() {
            awsProperties.getDynamodb().setEndpoint("http://localhost:8000");

            try (DynamoDbClient client = new DynamoDBConfig().dynamoDbClient(awsProperties)) {
                assertThat(client.serviceClientConfiguration().region()).isEqualTo(Region.EU_WEST_1);
                assertThat(client.serviceClientConfiguration().endpointOverride())
                    .contains(URI.create("http://localhost:8000"));
            }
        }

        @Test
        void s3Client_ShouldApplyLocalEndpoint() {
            awsProperties.getS3().setEndpoint("http://localhost:4566");

            try (S3Client client = new S3Config().s3Client(awsProperties)) {
                assertThat(client.serviceClientConfiguration().endpointOverride())
                    .contains(URI.create("http://localhost:4566"));
            }
        }
    }
}
