package com.bbthechange.gallery.repository.impl;

import com.bbthechange.gallery.exception.RepositoryException;
import com.bbthechange.gallery.model.ExportJob;
import com.bbthechange.gallery.repository.ExportJobRepository;
import com.bbthechange.gallery.util.GalleryKeyFactory;
import com.bbthechange.gallery.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.Map;
import java.util.Optional;

@Repository
public class ExportJobRepositoryImpl implements ExportJobRepository {

    private static final Logger logger = LoggerFactory.getLogger(ExportJobRepositoryImpl.class);
    private static final String TABLE_NAME = "GalleryTable";

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<ExportJob> exportJobSchema;
    private final QueryPerformanceTracker queryTracker;

    @Autowired
    public ExportJobRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker queryTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.exportJobSchema = TableSchema.fromBean(ExportJob.class);
    }

    @Override
    public ExportJob save(ExportJob job) {
        return queryTracker.trackQuery("PutItem", TABLE_NAME, () -> {
            try {
                job.touch();
                dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .item(exportJobSchema.itemToMap(job, true))
                    .build());
                logger.debug("Saved export job {} ({})", job.getJobId(), job.getStatus());
                return job;

            } catch (DynamoDbException e) {
                logger.error("Failed to save export job {}", job.getJobId(), e);
                throw new RepositoryException("Failed to save export job", e);
            }
        });
    }

    @Override
    public Optional<ExportJob> findById(String eventId, String jobId) {
        return queryTracker.trackQuery("GetItem", TABLE_NAME, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(Map.of(
                        "pk", AttributeValue.builder().s(GalleryKeyFactory.getEventPk(eventId)).build(),
                        "sk", AttributeValue.builder().s(GalleryKeyFactory.getExportSk(jobId)).build()
                    ))
                    .build());

                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(exportJobSchema.mapToItem(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to find export job {}", jobId, e);
                throw new RepositoryException("Failed to find export job", e);
            }
        });
    }
}
