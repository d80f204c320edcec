package com.bbthechange.gallery.repository.impl;

import com.bbthechange.gallery.exception.RepositoryException;
import com.bbthechange.gallery.model.Event;
import com.bbthechange.gallery.model.EventStatus;
import com.bbthechange.gallery.repository.EventRepository;
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
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Event persistence. Status changes are compare-and-swap updates on the {@code status} attribute.
 */
@Repository
public class EventRepositoryImpl implements EventRepository {

    private static final Logger logger = LoggerFactory.getLogger(EventRepositoryImpl.class);
    private static final String TABLE_NAME = "GalleryTable";
    private static final String HOST_INDEX = "HostIndex";
    private static final String SHARE_TOKEN_INDEX = "ShareTokenIndex";
    private static final int BATCH_WRITE_LIMIT = 25;
    private static final int MAX_BATCH_RETRIES = 5;

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<Event> eventSchema;
    private final QueryPerformanceTracker queryTracker;

    @Autowired
    public EventRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker queryTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.eventSchema = TableSchema.fromBean(Event.class);
    }

    @Override
    public void create(Event event) {
        queryTracker.trackQuery("PutItem", TABLE_NAME, () -> {
            try {
                dynamoDbClient.putItem(PutItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .item(eventSchema.itemToMap(event, true))
                    .conditionExpression("attribute_not_exists(pk)")
                    .build());
                logger.info("Created event {} for host {}", event.getEventId(), event.getHostId());
                return null;

            } catch (DynamoDbException e) {
                logger.error("Failed to create event {}", event.getEventId(), e);
                throw new RepositoryException("Failed to create event", e);
            }
        });
    }

    @Override
    public Optional<Event> findById(String eventId) {
        return queryTracker.trackQuery("GetItem", TABLE_NAME, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(metadataKey(eventId))
                    .consistentRead(true)
                    .build());

                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(eventSchema.mapToItem(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to find event {}", eventId, e);
                throw new RepositoryException("Failed to find event", e);
            }
        });
    }

    @Override
    public Optional<Event> findByShareToken(String shareToken) {
        if (!GalleryKeyFactory.isValidShareToken(shareToken)) {
            return Optional.empty();
        }
        return queryTracker.trackQuery("Query", TABLE_NAME, () -> {
            try {
                QueryResponse response = dynamoDbClient.query(QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .indexName(SHARE_TOKEN_INDEX)
                    .keyConditionExpression("gsi2pk = :gsi2pk")
                    .expressionAttributeValues(Map.of(
                        ":gsi2pk", AttributeValue.builder().s(GalleryKeyFactory.getShareTokenGsi2pk(shareToken)).build()
                    ))
                    .build());

                if (response.items().isEmpty()) {
                    return Optional.empty();
                }
                // Index projections are eventually consistent; re-read the base item for current status.
                Event indexed = eventSchema.mapToItem(response.items().get(0));
                return findById(indexed.getEventId());

            } catch (DynamoDbException e) {
                logger.error("Failed to find event by share token", e);
                throw new RepositoryException("Failed to find event by share token", e);
            }
        });
    }

    @Override
    public boolean shareTokenExists(String shareToken) {
        return queryTracker.trackQuery("Query", TABLE_NAME, () -> {
            try {
                QueryResponse response = dynamoDbClient.query(QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .indexName(SHARE_TOKEN_INDEX)
                    .keyConditionExpression("gsi2pk = :gsi2pk")
                    .expressionAttributeValues(Map.of(
                        ":gsi2pk", AttributeValue.builder().s(GalleryKeyFactory.getShareTokenGsi2pk(shareToken)).build()
                    ))
                    .select(Select.COUNT)
                    .build());
                return response.count() > 0;

            } catch (DynamoDbException e) {
                logger.error("Failed to check share token", e);
                throw new RepositoryException("Failed to check share token", e);
            }
        });
    }

    @Override
    public PaginatedResult<Event> findByHostId(String hostId, boolean includeDeleted, int limit, String nextToken) {
        return queryTracker.trackQuery("Query", TABLE_NAME, () -> {
            try {
                Map<String, AttributeValue> values = new HashMap<>();
                values.put(":gsi1pk", AttributeValue.builder().s(GalleryKeyFactory.getHostEventsGsi1pk(hostId)).build());
                values.put(":prefix", AttributeValue.builder().s(GalleryKeyFactory.CREATED_PREFIX + "#").build());

                QueryRequest.Builder request = QueryRequest.builder()
                    .tableName(TABLE_NAME)
                    .indexName(HOST_INDEX)
                    .keyConditionExpression("gsi1pk = :gsi1pk AND begins_with(gsi1sk, :prefix)")
                    .scanIndexForward(false)
                    .limit(limit)
                    .exclusiveStartKey(PageTokenCodec.decode(nextToken));

                if (!includeDeleted) {
                    values.put(":deleted", AttributeValue.builder().s(EventStatus.DELETED.name()).build());
                    request.filterExpression("#st <> :deleted")
                        .expressionAttributeNames(Map.of("#st", "status"));
                }

                QueryResponse response = dynamoDbClient.query(request.expressionAttributeValues(values).build());

                List<Event> events = new ArrayList<>();
                for (Map<String, AttributeValue> item : response.items()) {
                    events.add(eventSchema.mapToItem(item));
                }
                logger.debug("Found {} events for host {}", events.size(), hostId);
                return new PaginatedResult<>(events, PageTokenCodec.encode(response.lastEvaluatedKey()));

            } catch (DynamoDbException e) {
                logger.error("Failed to list events for host {}", hostId, e);
                throw new RepositoryException("Failed to list events for host", e);
            }
        });
    }

    @Override
    public boolean transitionStatus(String eventId, EventStatus expected, EventStatus target) {
        return queryTracker.trackQuery("UpdateItem", TABLE_NAME, () -> {
            try {
                dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(metadataKey(eventId))
                    .updateExpression("SET #st = :target, updatedAt = :now")
                    .conditionExpression("#st = :expected")
                    .expressionAttributeNames(Map.of("#st", "status"))
                    .expressionAttributeValues(Map.of(
                        ":target", AttributeValue.builder().s(target.name()).build(),
                        ":expected", AttributeValue.builder().s(expected.name()).build(),
                        ":now", AttributeValue.builder().n(String.valueOf(Instant.now().toEpochMilli())).build()
                    ))
                    .build());
                logger.info("Event {} status {} -> {}", eventId, expected, target);
                return true;

            } catch (ConditionalCheckFailedException e) {
                logger.info("Event {} status is no longer {}, transition to {} rejected", eventId, expected, target);
                return false;
            } catch (DynamoDbException e) {
                logger.error("Failed to transition event {}", eventId, e);
                throw new RepositoryException("Failed to update event status", e);
            }
        });
    }

    @Override
    public boolean updateMetadata(String eventId, EventStatus expected, Map<String, AttributeValue> updates) {
        return queryTracker.trackQuery("UpdateItem", TABLE_NAME, () -> {
            try {
                List<String> setClauses = new ArrayList<>();
                List<String> removeClauses = new ArrayList<>();
                Map<String, String> expressionAttributeNames = new HashMap<>();
                Map<String, AttributeValue> expressionAttributeValues = new HashMap<>();
                expressionAttributeNames.put("#st", "status");
                expressionAttributeValues.put(":expected", AttributeValue.builder().s(expected.name()).build());
                expressionAttributeValues.put(":now",
                    AttributeValue.builder().n(String.valueOf(Instant.now().toEpochMilli())).build());
                setClauses.add("updatedAt = :now");

                int index = 0;
                for (Map.Entry<String, AttributeValue> update : updates.entrySet()) {
                    String nameAlias = "#attr" + index;
                    expressionAttributeNames.put(nameAlias, update.getKey());
                    if (Boolean.TRUE.equals(update.getValue().nul())) {
                        removeClauses.add(nameAlias);
                    } else {
                        String valueAlias = ":val" + index;
                        setClauses.add(nameAlias + " = " + valueAlias);
                        expressionAttributeValues.put(valueAlias, update.getValue());
                    }
                    index++;
                }

                StringBuilder updateExpression = new StringBuilder("SET ").append(String.join(", ", setClauses));
                if (!removeClauses.isEmpty()) {
                    updateExpression.append(" REMOVE ").append(String.join(", ", removeClauses));
                }

                dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(metadataKey(eventId))
                    .updateExpression(updateExpression.toString())
                    .conditionExpression("#st = :expected")
                    .expressionAttributeNames(expressionAttributeNames)
                    .expressionAttributeValues(expressionAttributeValues)
                    .build());
                logger.debug("Updated {} metadata attributes of event {}", updates.size(), eventId);
                return true;

            } catch (ConditionalCheckFailedException e) {
                logger.info("Event {} changed status during metadata update", eventId);
                return false;
            } catch (DynamoDbException e) {
                logger.error("Failed to update event {}", eventId, e);
                throw new RepositoryException("Failed to update event", e);
            }
        });
    }

    @Override
    public Optional<List<String>> forceDelete(String eventId, EventStatus expected) {
        boolean deleted = queryTracker.trackQuery("DeleteItem", TABLE_NAME, () -> {
            try {
                dynamoDbClient.deleteItem(DeleteItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(metadataKey(eventId))
                    .conditionExpression("#st = :expected")
                    .expressionAttributeNames(Map.of("#st", "status"))
                    .expressionAttributeValues(Map.of(
                        ":expected", AttributeValue.builder().s(expected.name()).build()
                    ))
                    .build());
                return true;

            } catch (ConditionalCheckFailedException e) {
                logger.info("Event {} status is no longer {}, force delete rejected", eventId, expected);
                return false;
            } catch (DynamoDbException e) {
                logger.error("Failed to delete event {}", eventId, e);
                throw new RepositoryException("Failed to delete event", e);
            }
        });
        if (!deleted) {
            return Optional.empty();
        }

        List<Map<String, AttributeValue>> children = findPartitionItems(eventId);
        List<String> storageRefs = new ArrayList<>();
        List<WriteRequest> deletes = new ArrayList<>();
        for (Map<String, AttributeValue> item : children) {
            addRef(storageRefs, item.get("storageRef"));
            addRef(storageRefs, item.get("archiveRef"));
            deletes.add(WriteRequest.builder()
                .deleteRequest(DeleteRequest.builder()
                    .key(Map.of("pk", item.get("pk"), "sk", item.get("sk")))
                    .build())
                .build());
        }
        for (int i = 0; i < deletes.size(); i += BATCH_WRITE_LIMIT) {
            batchDelete(deletes.subList(i, Math.min(i + BATCH_WRITE_LIMIT, deletes.size())));
        }
        logger.info("Force-deleted event {} with {} child items", eventId, children.size());
        return Optional.of(storageRefs);
    }

    @Override
    public PaginatedResult<Event> findAll(EventStatus statusFilter, int limit, String nextToken) {
        return queryTracker.trackQuery("Scan", TABLE_NAME, () -> {
            try {
                Map<String, AttributeValue> values = new HashMap<>();
                values.put(":type", AttributeValue.builder().s(GalleryKeyFactory.EVENT_ITEM).build());
                ScanRequest.Builder request = ScanRequest.builder()
                    .tableName(TABLE_NAME)
                    .limit(limit)
                    .exclusiveStartKey(PageTokenCodec.decode(nextToken));

                if (statusFilter != null) {
                    values.put(":status", AttributeValue.builder().s(statusFilter.name()).build());
                    request.filterExpression("itemType = :type AND #st = :status")
                        .expressionAttributeNames(Map.of("#st", "status"));
                } else {
                    request.filterExpression("itemType = :type");
                }

                ScanResponse response = dynamoDbClient.scan(request.expressionAttributeValues(values).build());

                List<Event> events = new ArrayList<>();
                for (Map<String, AttributeValue> item : response.items()) {
                    events.add(eventSchema.mapToItem(item));
                }
                return new PaginatedResult<>(events, PageTokenCodec.encode(response.lastEvaluatedKey()));

            } catch (DynamoDbException e) {
                logger.error("Failed to list events", e);
                throw new RepositoryException("Failed to list events", e);
            }
        });
    }

    @Override
    public Map<EventStatus, Long> countByStatus() {
        return queryTracker.trackQuery("Scan", TABLE_NAME, () -> {
            try {
                Map<EventStatus, Long> counts = new EnumMap<>(EventStatus.class);
                for (EventStatus status : EventStatus.values()) {
                    counts.put(status, 0L);
                }
                Map<String, AttributeValue> startKey = null;
                do {
                    ScanResponse response = dynamoDbClient.scan(ScanRequest.builder()
                        .tableName(TABLE_NAME)
                        .filterExpression("itemType = :type")
                        .projectionExpression("#st")
                        .expressionAttributeNames(Map.of("#st", "status"))
                        .expressionAttributeValues(Map.of(
                            ":type", AttributeValue.builder().s(GalleryKeyFactory.EVENT_ITEM).build()))
                        .exclusiveStartKey(startKey)
                        .build());
                    for (Map<String, AttributeValue> item : response.items()) {
                        AttributeValue status = item.get("status");
                        if (status != null && status.s() != null) {
                            counts.merge(EventStatus.valueOf(status.s()), 1L, Long::sum);
                        }
                    }
                    startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                        ? response.lastEvaluatedKey() : null;
                } while (startKey != null);
                return counts;

            } catch (DynamoDbException e) {
                logger.error("Failed to count events", e);
                throw new RepositoryException("Failed to count events", e);
            }
        });
    }

    private List<Map<String, AttributeValue>> findPartitionItems(String eventId) {
        return queryTracker.trackQuery("Query", TABLE_NAME, () -> {
            try {
                List<Map<String, AttributeValue>> items = new ArrayList<>();
                Map<String, AttributeValue> startKey = null;
                do {
                    QueryResponse response = dynamoDbClient.query(QueryRequest.builder()
                        .tableName(TABLE_NAME)
                        .keyConditionExpression("pk = :pk")
                        .projectionExpression("pk, sk, storageRef, archiveRef")
                        .expressionAttributeValues(Map.of(
                            ":pk", AttributeValue.builder().s(GalleryKeyFactory.getEventPk(eventId)).build()))
                        .exclusiveStartKey(startKey)
                        .build());
                    items.addAll(response.items());
                    startKey = response.hasLastEvaluatedKey() && !response.lastEvaluatedKey().isEmpty()
                        ? response.lastEvaluatedKey() : null;
                } while (startKey != null);
                return items;

            } catch (DynamoDbException e) {
                logger.error("Failed to read partition of event {}", eventId, e);
                throw new RepositoryException("Failed to read event items", e);
            }
        });
    }

    private void batchDelete(List<WriteRequest> deletes) {
        queryTracker.trackQuery("BatchWriteItem", TABLE_NAME, () -> {
            try {
                Map<String, List<WriteRequest>> pending = Map.of(TABLE_NAME, deletes);
                int attempt = 0;
                while (!pending.isEmpty() && attempt < MAX_BATCH_RETRIES) {
                    BatchWriteItemResponse response = dynamoDbClient.batchWriteItem(BatchWriteItemRequest.builder()
                        .requestItems(pending)
                        .build());
                    pending = response.hasUnprocessedItems() ? response.unprocessedItems() : Map.of();
                    attempt++;
                }
                if (!pending.isEmpty()) {
                    throw new RepositoryException("Unprocessed deletes remain after " + MAX_BATCH_RETRIES + " attempts");
                }
                return null;

            } catch (DynamoDbException e) {
                logger.error("Batch delete failed", e);
                throw new RepositoryException("Failed to delete event items", e);
            }
        });
    }

    private static void addRef(List<String> refs, AttributeValue value) {
        if (value != null && value.s() != null && !value.s().isEmpty()) {
            refs.add(value.s());
        }
    }

    private static Map<String, AttributeValue> metadataKey(String eventId) {
        return Map.of(
            "pk", AttributeValue.builder().s(GalleryKeyFactory.getEventPk(eventId)).build(),
            "sk", AttributeValue.builder().s(GalleryKeyFactory.getMetadataSk()).build()
        );
    }
}
