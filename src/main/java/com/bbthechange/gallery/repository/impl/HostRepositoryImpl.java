package com.bbthechange.gallery.repository.impl;

import com.bbthechange.gallery.exception.RepositoryException;
import com.bbthechange.gallery.model.Host;
import com.bbthechange.gallery.model.HostStatus;
import com.bbthechange.gallery.model.SubjectLink;
import com.bbthechange.gallery.repository.HostRepository;
import com.bbthechange.gallery.util.GalleryKeyFactory;
import com.bbthechange.gallery.util.PageTokenCodec;
import com.bbthechange.gallery.util.PaginatedResult;
import com.bbthechange.gallery.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Host and subject-link persistence in the GalleryTable.
 */
@Repository
public class HostRepositoryImpl implements HostRepository {

    private static final Logger logger = LoggerFactory.getLogger(HostRepositoryImpl.class);
    private static final String TABLE_NAME = "GalleryTable";

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<Host> hostSchema;
    private final TableSchema<SubjectLink> subjectLinkSchema;
    private final QueryPerformanceTracker queryTracker;

    @Autowired
    public HostRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker queryTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.hostSchema = TableSchema.fromBean(Host.class);
        this.subjectLinkSchema = TableSchema.fromBean(SubjectLink.class);
    }

    @Override
    public Optional<Host> findById(String hostId) {
        return queryTracker.trackQuery("GetItem", TABLE_NAME, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(metadataKey(GalleryKeyFactory.getHostPk(hostId)))
                    .consistentRead(true)
                    .build());

                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(hostSchema.mapToItem(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to find host {}", hostId, e);
                throw new RepositoryException("Failed to find host", e);
            }
        });
    }

    @Override
    public Optional<Host> findBySubjectId(String subjectId) {
        Optional<SubjectLink> link = queryTracker.trackQuery("GetItem", TABLE_NAME, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(metadataKey(GalleryKeyFactory.getSubjectPk(subjectId)))
                    .consistentRead(true)
                    .build());

                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.<SubjectLink>empty();
                }
                return Optional.of(subjectLinkSchema.mapToItem(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to find subject link for {}", subjectId, e);
                throw new RepositoryException("Failed to find subject link", e);
            }
        });
        return link.flatMap(l -> findById(l.getHostId()));
    }

    @Override
    public boolean createWithSubjectLink(Host host) {
        SubjectLink link = new SubjectLink(host.getSubjectId(), host.getHostId());

        return queryTracker.trackQuery("TransactWriteItems", TABLE_NAME, () -> {
            try {
                TransactWriteItemsRequest request = TransactWriteItemsRequest.builder()
                    .transactItems(
                        // 1. Claim the subject
                        TransactWriteItem.builder()
                            .put(Put.builder()
                                .tableName(TABLE_NAME)
                                .item(subjectLinkSchema.itemToMap(link, true))
                                .conditionExpression("attribute_not_exists(pk)")
                                .build())
                            .build(),
                        // 2. Host record
                        TransactWriteItem.builder()
                            .put(Put.builder()
                                .tableName(TABLE_NAME)
                                .item(hostSchema.itemToMap(host, true))
                                .conditionExpression("attribute_not_exists(pk)")
                                .build())
                            .build()
                    )
                    .build();

                dynamoDbClient.transactWriteItems(request);
                logger.info("Created host {} for subject {}", host.getHostId(), host.getSubjectId());
                return true;

            } catch (TransactionCanceledException e) {
                if (TransactionReasons.failedCondition(e, 0)) {
                    logger.info("Subject {} already linked to another host", host.getSubjectId());
                    return false;
                }
                logger.error("Host creation transaction cancelled: {}", e.cancellationReasons());
                throw new RepositoryException("Failed to create host", e);
            } catch (DynamoDbException e) {
                logger.error("Failed to create host for subject {}", host.getSubjectId(), e);
                throw new RepositoryException("Failed to create host", e);
            }
        });
    }

    @Override
    public Host updateProfile(Host host) {
        return queryTracker.trackQuery("UpdateItem", TABLE_NAME, () -> {
            try {
                host.touch();
                Map<String, AttributeValue> values = new HashMap<>();
                values.put(":displayName", stringOrNull(host.getDisplayName()));
                values.put(":email", stringOrNull(host.getEmail()));
                values.put(":now", number(host.getUpdatedAt().toEpochMilli()));

                dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(metadataKey(GalleryKeyFactory.getHostPk(host.getHostId())))
                    .updateExpression("SET displayName = :displayName, email = :email, updatedAt = :now")
                    .conditionExpression("attribute_exists(pk)")
                    .expressionAttributeValues(values)
                    .build());
                return host;

            } catch (DynamoDbException e) {
                logger.error("Failed to update host {}", host.getHostId(), e);
                throw new RepositoryException("Failed to update host", e);
            }
        });
    }

    @Override
    public boolean updateStatus(String hostId, HostStatus expected, HostStatus target) {
        return queryTracker.trackQuery("UpdateItem", TABLE_NAME, () -> {
            try {
                dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(metadataKey(GalleryKeyFactory.getHostPk(hostId)))
                    .updateExpression("SET #st = :target, updatedAt = :now")
                    .conditionExpression("#st = :expected")
                    .expressionAttributeNames(Map.of("#st", "status"))
                    .expressionAttributeValues(Map.of(
                        ":target", AttributeValue.builder().s(target.name()).build(),
                        ":expected", AttributeValue.builder().s(expected.name()).build(),
                        ":now", number(Instant.now().toEpochMilli())
                    ))
                    .build());
                logger.info("Host {} status {} -> {}", hostId, expected, target);
                return true;

            } catch (ConditionalCheckFailedException e) {
                logger.info("Host {} status is no longer {}", hostId, expected);
                return false;
            } catch (DynamoDbException e) {
                logger.error("Failed to update status of host {}", hostId, e);
                throw new RepositoryException("Failed to update host status", e);
            }
        });
    }

    @Override
    public boolean reserveStorage(String hostId, long bytes, long quota) {
        if (bytes > quota) {
            return false;
        }
        return queryTracker.trackQuery("UpdateItem", TABLE_NAME, () -> {
            try {
                dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(metadataKey(GalleryKeyFactory.getHostPk(hostId)))
                    .updateExpression("SET uploadedBytes = if_not_exists(uploadedBytes, :zero) + :bytes")
                    .conditionExpression("attribute_exists(pk) AND (attribute_not_exists(uploadedBytes) OR uploadedBytes <= :ceiling)")
                    .expressionAttributeValues(Map.of(
                        ":zero", number(0),
                        ":bytes", number(bytes),
                        ":ceiling", number(quota - bytes)
                    ))
                    .build());
                return true;

            } catch (ConditionalCheckFailedException e) {
                logger.info("Host {} storage quota would be exceeded by {} bytes", hostId, bytes);
                return false;
            } catch (DynamoDbException e) {
                logger.error("Failed to reserve storage for host {}", hostId, e);
                throw new RepositoryException("Failed to reserve storage", e);
            }
        });
    }

    @Override
    public void releaseStorage(String hostId, long bytes) {
        queryTracker.trackQuery("UpdateItem", TABLE_NAME, () -> {
            try {
                dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(metadataKey(GalleryKeyFactory.getHostPk(hostId)))
                    .updateExpression("SET uploadedBytes = uploadedBytes - :bytes")
                    .conditionExpression("uploadedBytes >= :bytes")
                    .expressionAttributeValues(Map.of(":bytes", number(bytes)))
                    .build());

            } catch (ConditionalCheckFailedException e) {
                logger.warn("Host {} storage counter is below {} bytes, not released", hostId, bytes);
            } catch (DynamoDbException e) {
                logger.error("Failed to release storage for host {}", hostId, e);
                throw new RepositoryException("Failed to release storage", e);
            }
            return null;
        });
    }

    @Override
    public PaginatedResult<Host> findAll(int limit, String nextToken) {
        return queryTracker.trackQuery("Scan", TABLE_NAME, () -> {
            try {
                ScanResponse response = dynamoDbClient.scan(ScanRequest.builder()
                    .tableName(TABLE_NAME)
                    .filterExpression("itemType = :type")
                    .expressionAttributeValues(Map.of(
                        ":type", AttributeValue.builder().s(GalleryKeyFactory.HOST_ITEM).build()))
                    .limit(limit)
                    .exclusiveStartKey(PageTokenCodec.decode(nextToken))
                    .build());

                List<Host> hosts = new ArrayList<>();
                for (Map<String, AttributeValue> item : response.items()) {
                    hosts.add(hostSchema.mapToItem(item));
                }
                return new PaginatedResult<>(hosts, PageTokenCodec.encode(response.lastEvaluatedKey()));

            } catch (DynamoDbException e) {
                logger.error("Failed to list hosts", e);
                throw new RepositoryException("Failed to list hosts", e);
            }
        });
    }

    @Override
    public long countAll() {
        return queryTracker.trackQuery("Scan", TABLE_NAME, () -> {
            try {
                long total = 0;
                Map<String, AttributeValue> startKey = null;
                do {
                    ScanResponse response = dynamoDbClient.scan(ScanRequest.builder()
                        .tableName(TABLE_NAME)
                        .filterExpression("itemType = :type")
                        .expressionAttributeValues(Map.of(
                            ":type", AttributeValue.builder().s(GalleryKeyFactory.HOST_ITEM).build()))
                        .select(Select.COUNT)
                        .exclusiveStartKey(startKey)
                        .build());
                    total += response.count();
                    startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                        ? response.lastEvaluatedKey() : null;
                } while (startKey != null);
                return total;

            } catch (DynamoDbException e) {
                logger.error("Failed to count hosts", e);
                throw new RepositoryException("Failed to count hosts", e);
            }
        });
    }

    private static Map<String, AttributeValue> metadataKey(String pk) {
        return Map.of(
            "pk", AttributeValue.builder().s(pk).build(),
            "sk", AttributeValue.builder().s(GalleryKeyFactory.getMetadataSk()).build()
        );
    }

    private static AttributeValue number(long value) {
        return AttributeValue.builder().n(String.valueOf(value)).build();
    }

    private static AttributeValue stringOrNull(String value) {
        return value == null
            ? AttributeValue.builder().nul(true).build()
            : AttributeValue.builder().s(value).build();
    }
}
