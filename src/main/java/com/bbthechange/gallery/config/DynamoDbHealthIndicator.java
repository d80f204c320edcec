package com.bbthechange.gallery.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/**
 * Reports the GalleryTable status on the actuator health endpoint.
 */
@Component
public class DynamoDbHealthIndicator implements HealthIndicator {

    private final DynamoDbClient dynamoDbClient;

    @Autowired
    public DynamoDbHealthIndicator(DynamoDbClient dynamoDbClient) {
        this.dynamoDbClient = dynamoDbClient;
    }

    @Override
    public Health health() {
        try {
            DescribeTableResponse response = dynamoDbClient.describeTable(
                DescribeTableRequest.builder().tableName(DynamoDBTableInitializer.TABLE_NAME).build()
            );
            TableStatus status = response.table().tableStatus();

            if (status == TableStatus.ACTIVE) {
                return Health.up()
                    .withDetail("galleryTable", "ACTIVE")
                    .withDetail("galleryTableGsiCount", response.table().globalSecondaryIndexes().size())
                    .build();
            }
            return Health.down()
                .withDetail("galleryTable", String.valueOf(status))
                .withDetail("reason", "GalleryTable not active")
                .build();

        } catch (Exception e) {
            return Health.down()
                .withDetail("error", "DynamoDB connection failed")
                .withDetail("message", e.getMessage())
                .build();
        }
    }
}
