package com.bbthechange.gallery.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;

/**
 * DynamoDB clients for the single GalleryTable.
 */
@Configuration
public class DynamoDBConfig {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBConfig.class);

    @Bean
    public DynamoDbClient dynamoDbClient(AwsProperties awsProperties) {
        AwsProperties.Service dynamodb = awsProperties.getDynamodb();
        DynamoDbClientBuilder builder = DynamoDbClient.builder()
                .region(awsProperties.awsRegion())
                .credentialsProvider(awsProperties.credentialsFor(dynamodb));

        dynamodb.localEndpoint().ifPresent(endpoint -> {
            logger.info("Using local DynamoDB endpoint {}", endpoint);
            builder.endpointOverride(endpoint);
        });
        return builder.build();
    }

    @Bean
    public DynamoDbEnhancedClient dynamoDbEnhancedClient(DynamoDbClient dynamoDbClient) {
        return DynamoDbEnhancedClient.builder()
                .dynamoDbClient(dynamoDbClient)
                .build();
    }
}
