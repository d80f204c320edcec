package com.bbthechange.gallery.repository.impl;

import com.bbthechange.gallery.dto.PhotoStats;
import com.bbthechange.gallery.exception.RepositoryException;
import com.bbthechange.gallery.model.EventStatus;
import com.bbthechange.gallery.model.Photo;
import com.bbthechange.gallery.model.PhotoStatus;
import com.bbthechange.gallery.repository.ConditionalWriteResult;
import com.bbthechange.gallery.repository.PhotoRepository;
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
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Photo persistence. Writes that depend on the owning event run as a two-item transaction:
 * item 0 is a condition check on the event, item 1 is the photo write.
 */
@Repository
public class PhotoRepositoryImpl implements PhotoRepository {

    private static final Logger logger = LoggerFactory.getLogger(PhotoRepositoryImpl.class);
    private static final String TABLE_NAME = "GalleryTable";
    private static final int EVENT_CHECK = 0;
    private static final int PHOTO_WRITE = 1;

    private final DynamoDbClient dynamoDbClient;
    private final TableSchema<Photo> photoSchema;
    private final QueryPerformanceTracker queryTracker;

    @Autowired
    public PhotoRepositoryImpl(DynamoDbClient dynamoDbClient, QueryPerformanceTracker queryTracker) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.photoSchema = TableSchema.fromBean(Photo.class);
    }

    @Override
    public ConditionalWriteResult create(Photo photo) {
        TransactWriteItem eventCheck = TransactWriteItem.builder()
            .conditionCheck(ConditionCheck.builder()
                .tableName(TABLE_NAME)
                .key(eventKey(photo.getEventId()))
                .conditionExpression("#st = :active")
                .expressionAttributeNames(Map.of("#st", "status"))
                .expressionAttributeValues(Map.of(
                    ":active", AttributeValue.builder().s(EventStatus.ACTIVE.name()).build()))
                .build())
            .build();
        TransactWriteItem put = TransactWriteItem.builder()
            .put(Put.builder()
                .tableName(TABLE_NAME)
                .item(photoSchema.itemToMap(photo, true))
                .conditionExpression("attribute_not_exists(pk)")
                .build())
            .build();

        ConditionalWriteResult result = transact("create photo " + photo.getPhotoId(), eventCheck, put);
        if (result == ConditionalWriteResult.APPLIED) {
            logger.info("Stored photo {} for event {}", photo.getPhotoId(), photo.getEventId());
        }
        return result;
    }

    @Override
    public Optional<Photo> findById(String eventId, String photoId) {
        return queryTracker.trackQuery("GetItem", TABLE_NAME, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(TABLE_NAME)
                    .key(photoKey(eventId, photoId))
                    .consistentRead(true)
                    .build());

                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(photoSchema.mapToItem(response.item()));

            } catch (DynamoDbException e) {
                logger.error("Failed to find photo {} of event {}", photoId, eventId, e);
                throw new RepositoryException("Failed to find photo", e);
            }
        });
    }

    @Override
    public PaginatedResult<Photo> findByEvent(String eventId, PhotoStatus statusFilter, int limit, String nextToken) {
        return queryTracker.trackQuery("Query", TABLE_NAME, () -> {
            try {
                // Limit counts items read before the status filter, so keep reading until the page is full.
                List<Photo> photos = new ArrayList<>();
                Map<String, AttributeValue> startKey = PageTokenCodec.decode(nextToken);
                do {
                    QueryResponse response = dynamoDbClient.query(photoQuery(eventId, statusFilter)
                        .limit(limit)
                        .exclusiveStartKey(startKey)
                        .build());
                    for (Map<String, AttributeValue> item : response.items()) {
                        if (photos.size() == limit) {
                            break;
                        }
                        photos.add(photoSchema.mapToItem(item));
                    }
                    startKey = nextStartKey(response.hasLastEvaluatedKey(), response.lastEvaluatedKey());
                } while (photos.size() < limit && startKey != null);

                String token = null;
                if (photos.size() == limit) {
                    token = PageTokenCodec.encode(photoKey(eventId, photos.get(photos.size() - 1).getPhotoId()));
                }
                return new PaginatedResult<>(photos, token);

            } catch (DynamoDbException e) {
                logger.error("Failed to list photos of event {}", eventId, e);
                throw new RepositoryException("Failed to list photos", e);
            }
        });
    }

    @Override
    public List<Photo> findAllByEvent(String eventId, PhotoStatus statusFilter) {
        return queryTracker.trackQuery("Query", TABLE_NAME, () -> {
            try {
                List<Photo> photos = new ArrayList<>();
                Map<String, AttributeValue> startKey = null;
                do {
                    QueryResponse response = dynamoDbClient.query(photoQuery(eventId, statusFilter)
                        .exclusiveStartKey(startKey)
                        .build());
                    for (Map<String, AttributeValue> item : response.items()) {
                        photos.add(photoSchema.mapToItem(item));
                    }
                    startKey = nextStartKey(response.hasLastEvaluatedKey(), response.lastEvaluatedKey());
                } while (startKey != null);
                return photos;

            } catch (DynamoDbException e) {
                logger.error("Failed to read photos of event {}", eventId, e);
                throw new RepositoryException("Failed to read photos", e);
            }
        });
    }

    @Override
    public long countByEvent(String eventId, PhotoStatus statusFilter) {
        return queryTracker.trackQuery("Query", TABLE_NAME, () -> {
            try {
                long total = 0;
                Map<String, AttributeValue> startKey = null;
                do {
                    QueryResponse response = dynamoDbClient.query(photoQuery(eventId, statusFilter)
                        .select(Select.COUNT)
                        .exclusiveStartKey(startKey)
                        .build());
                    total += response.count();
                    startKey = nextStartKey(response.hasLastEvaluatedKey(), response.lastEvaluatedKey());
                } while (startKey != null);
                return total;

            } catch (DynamoDbException e) {
                logger.error("Failed to count photos of event {}", eventId, e);
                throw new RepositoryException("Failed to count photos", e);
            }
        });
    }

    @Override
    public ConditionalWriteResult transitionApproval(String eventId, String photoId, PhotoStatus expected,
                                                     PhotoStatus target, String moderatedBy, Instant moderatedAt) {
        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":expected", AttributeValue.builder().s(expected.name()).build());
        values.put(":target", AttributeValue.builder().s(target.name()).build());
        values.put(":by", AttributeValue.builder().s(moderatedBy).build());
        values.put(":at", AttributeValue.builder().n(String.valueOf(moderatedAt.toEpochMilli())).build());

        TransactWriteItem update = TransactWriteItem.builder()
            .update(Update.builder()
                .tableName(TABLE_NAME)
                .key(photoKey(eventId, photoId))
                .updateExpression("SET approvalStatus = :target, moderatedBy = :by, moderatedAt = :at, updatedAt = :at")
                .conditionExpression("attribute_exists(pk) AND approvalStatus = :expected")
                .expressionAttributeValues(values)
                .build())
            .build();

        ConditionalWriteResult result = transact("moderate photo " + photoId, eventNotDeleted(eventId), update);
        if (result == ConditionalWriteResult.APPLIED) {
            logger.info("Photo {} of event {} {} -> {} by {}", photoId, eventId, expected, target, moderatedBy);
        }
        return result;
    }

    @Override
    public ConditionalWriteResult updateCaption(String eventId, String photoId, String caption) {
        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":now", AttributeValue.builder().n(String.valueOf(Instant.now().toEpochMilli())).build());

        Update.Builder update = Update.builder()
            .tableName(TABLE_NAME)
            .key(photoKey(eventId, photoId))
            .conditionExpression("attribute_exists(pk)");
        if (caption == null) {
            update.updateExpression("SET updatedAt = :now REMOVE caption");
        } else {
            values.put(":caption", AttributeValue.builder().s(caption).build());
            update.updateExpression("SET caption = :caption, updatedAt = :now");
        }

        return transact("caption photo " + photoId, eventNotDeleted(eventId),
            TransactWriteItem.builder().update(update.expressionAttributeValues(values).build()).build());
    }

    @Override
    public ConditionalWriteResult delete(String eventId, String photoId, PhotoStatus expected) {
        TransactWriteItem delete = TransactWriteItem.builder()
            .delete(Delete.builder()
                .tableName(TABLE_NAME)
                .key(photoKey(eventId, photoId))
                .conditionExpression("attribute_exists(pk) AND approvalStatus = :expected")
                .expressionAttributeValues(Map.of(
                    ":expected", AttributeValue.builder().s(expected.name()).build()))
                .build())
            .build();

        ConditionalWriteResult result = transact("remove photo " + photoId, eventNotDeleted(eventId), delete);
        if (result == ConditionalWriteResult.APPLIED) {
            logger.info("Removed photo {} of event {}", photoId, eventId);
        }
        return result;
    }

    @Override
    public List<Photo> findRecent(int limit) {
        return queryTracker.trackQuery("Scan", TABLE_NAME, () -> {
            try {
                // Keep only the newest `limit` photos while scanning.
                PriorityQueue<Photo> newest = new PriorityQueue<>(
                    Comparator.comparing(Photo::getUploadedAt, Comparator.nullsFirst(Comparator.naturalOrder())));
                Map<String, AttributeValue> startKey = null;
                do {
                    ScanResponse response = dynamoDbClient.scan(photoScan(startKey));
                    for (Map<String, AttributeValue> item : response.items()) {
                        newest.add(photoSchema.mapToItem(item));
                        if (newest.size() > limit) {
                            newest.poll();
                        }
                    }
                    startKey = nextStartKey(response.hasLastEvaluatedKey(), response.lastEvaluatedKey());
                } while (startKey != null);

                List<Photo> result = new ArrayList<>(newest);
                result.sort(Comparator.comparing(Photo::getUploadedAt,
                    Comparator.nullsLast(Comparator.<Instant>naturalOrder())).reversed());
                return result;

            } catch (DynamoDbException e) {
                logger.error("Failed to read recent uploads", e);
                throw new RepositoryException("Failed to read recent uploads", e);
            }
        });
    }

    @Override
    public PhotoStats summarize() {
        return queryTracker.trackQuery("Scan", TABLE_NAME, () -> {
            try {
                Map<PhotoStatus, Long> counts = new EnumMap<>(PhotoStatus.class);
                long totalBytes = 0;
                Map<String, AttributeValue> startKey = null;
                do {
                    ScanResponse response = dynamoDbClient.scan(photoScan(startKey).toBuilder()
                        .projectionExpression("approvalStatus, fileSize")
                        .build());
                    for (Map<String, AttributeValue> item : response.items()) {
                        AttributeValue status = item.get("approvalStatus");
                        if (status != null && status.s() != null) {
                            counts.merge(PhotoStatus.valueOf(status.s()), 1L, Long::sum);
                        }
                        AttributeValue size = item.get("fileSize");
                        if (size != null && size.n() != null) {
                            totalBytes += Long.parseLong(size.n());
                        }
                    }
                    startKey = nextStartKey(response.hasLastEvaluatedKey(), response.lastEvaluatedKey());
                } while (startKey != null);
                return new PhotoStats(counts, totalBytes);

            } catch (DynamoDbException e) {
                logger.error("Failed to summarize photos", e);
                throw new RepositoryException("Failed to summarize photos", e);
            }
        });
    }

    private ConditionalWriteResult transact(String description, TransactWriteItem eventCheck, TransactWriteItem photoWrite) {
        return queryTracker.trackQuery("TransactWriteItems", TABLE_NAME, () -> {
            try {
                dynamoDbClient.transactWriteItems(TransactWriteItemsRequest.builder()
                    .transactItems(eventCheck, photoWrite)
                    .build());
                return ConditionalWriteResult.APPLIED;

            } catch (TransactionCanceledException e) {
                if (TransactionReasons.failedCondition(e, EVENT_CHECK)) {
                    logger.info("Owning event rejected {}", description);
                    return ConditionalWriteResult.PARENT_UNAVAILABLE;
                }
                if (TransactionReasons.failedCondition(e, PHOTO_WRITE) || TransactionReasons.conflicted(e, PHOTO_WRITE)) {
                    logger.info("Photo state changed, rejected {}", description);
                    return ConditionalWriteResult.STALE;
                }
                logger.error("Transaction cancelled for {}: {}", description, e.cancellationReasons());
                throw new RepositoryException("Failed to " + description, e);
            } catch (DynamoDbException e) {
                logger.error("Failed to {}", description, e);
                throw new RepositoryException("Failed to " + description, e);
            }
        });
    }

    private TransactWriteItem eventNotDeleted(String eventId) {
        return TransactWriteItem.builder()
            .conditionCheck(ConditionCheck.builder()
                .tableName(TABLE_NAME)
                .key(eventKey(eventId))
                .conditionExpression("attribute_exists(pk) AND #st <> :deleted")
                .expressionAttributeNames(Map.of("#st", "status"))
                .expressionAttributeValues(Map.of(
                    ":deleted", AttributeValue.builder().s(EventStatus.DELETED.name()).build()))
                .build())
            .build();
    }

    private QueryRequest.Builder photoQuery(String eventId, PhotoStatus statusFilter) {
        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":pk", AttributeValue.builder().s(GalleryKeyFactory.getEventPk(eventId)).build());
        values.put(":prefix", AttributeValue.builder().s(GalleryKeyFactory.getPhotoPrefix()).build());

        QueryRequest.Builder request = QueryRequest.builder()
            .tableName(TABLE_NAME)
            .keyConditionExpression("pk = :pk AND begins_with(sk, :prefix)");
        if (statusFilter != null) {
            values.put(":status", AttributeValue.builder().s(statusFilter.name()).build());
            request.filterExpression("approvalStatus = :status");
        }
        return request.expressionAttributeValues(values);
    }

    private ScanRequest photoScan(Map<String, AttributeValue> startKey) {
        return ScanRequest.builder()
            .tableName(TABLE_NAME)
            .filterExpression("itemType = :type")
            .expressionAttributeValues(Map.of(
                ":type", AttributeValue.builder().s(GalleryKeyFactory.PHOTO_ITEM).build()))
            .exclusiveStartKey(startKey)
            .build();
    }

    private static Map<String, AttributeValue> nextStartKey(boolean hasKey, Map<String, AttributeValue> key) {
        return hasKey && !key.isEmpty() ? key : null;
    }

    private static Map<String, AttributeValue> eventKey(String eventId) {
        return Map.of(
            "pk", AttributeValue.builder().s(GalleryKeyFactory.getEventPk(eventId)).build(),
            "sk", AttributeValue.builder().s(GalleryKeyFactory.getMetadataSk()).build()
        );
    }

    private static Map<String, AttributeValue> photoKey(String eventId, String photoId) {
        return Map.of(
            "pk", AttributeValue.builder().s(GalleryKeyFactory.getEventPk(eventId)).build(),
            "sk", AttributeValue.builder().s(GalleryKeyFactory.getPhotoSk(photoId)).build()
        );
    }
}
