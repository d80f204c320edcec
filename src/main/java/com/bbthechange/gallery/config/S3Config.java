package com.bbthechange.gallery.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * S3 client and presigner for the photo bucket. LocalStack needs path-style addressing.
 */
@Configuration
public class S3Config {

    private static final Logger logger = LoggerFactory.getLogger(S3Config.class);

    @Bean
    public S3Client s3Client(AwsProperties awsProperties) {
        AwsProperties.S3 s3 = awsProperties.getS3();
        S3ClientBuilder builder = S3Client.builder()
                .region(awsProperties.awsRegion())
                .credentialsProvider(awsProperties.credentialsFor(s3));

        s3.localEndpoint().ifPresent(endpoint -> {
            logger.info("Using local S3 endpoint {} for bucket {}", endpoint, s3.getBucket());
            builder.endpointOverride(endpoint).forcePathStyle(true);
        });
        return builder.build();
    }

    @Bean
    public S3Presigner s3Presigner(AwsProperties awsProperties) {
        AwsProperties.S3 s3 = awsProperties.getS3();
        S3Presigner.Builder builder = S3Presigner.builder()
                .region(awsProperties.awsRegion())
                .credentialsProvider(awsProperties.credentialsFor(s3));

        s3.localEndpoint().ifPresent(endpoint -> builder.endpointOverride(endpoint)
                .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build()));
        return builder.build();
    }
}
