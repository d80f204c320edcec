package com.bbthechange.gallery.config;

import com.bbthechange.gallery.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.EnhancedGlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.model.Projection;
import software.amazon.awssdk.services.dynamodb.model.ProjectionType;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * Creates the GalleryTable and its indexes on startup when missing (local development).
 */
@Component
@ConditionalOnProperty(name = "dynamodb.table.init.enabled", havingValue = "true", matchIfMissing = true)
public class DynamoDBTableInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);
    static final String TABLE_NAME = "GalleryTable";

    @Autowired
    private DynamoDbEnhancedClient dynamoDbEnhancedClient;

    @Override
    public void run(ApplicationArguments args) {
        // Event carries every key attribute and index annotation of the single-table layout.
        DynamoDbTable<Event> table = dynamoDbEnhancedClient.table(TABLE_NAME, TableSchema.fromBean(Event.class));
        try {
            table.describeTable();
            logger.info("Table {} already exists", TABLE_NAME);
        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", TABLE_NAME);
            table.createTable(CreateTableEnhancedRequest.builder()
                .provisionedThroughput(throughput())
                .globalSecondaryIndices(
                    createGSI("HostIndex"),
                    createGSI("ShareTokenIndex")
                )
                .build());
            logger.info("Table {} created successfully with GSIs", TABLE_NAME);
        }
    }

    private EnhancedGlobalSecondaryIndex createGSI(String indexName) {
        return EnhancedGlobalSecondaryIndex.builder()
            .indexName(indexName)
            .provisionedThroughput(throughput())
            .projection(Projection.builder()
                .projectionType(ProjectionType.ALL)
                .build())
            .build();
    }

    private static ProvisionedThroughput throughput() {
        return ProvisionedThroughput.builder()
            .readCapacityUnits(5L)
            .writeCapacityUnits(5L)
            .build();
    }
}
