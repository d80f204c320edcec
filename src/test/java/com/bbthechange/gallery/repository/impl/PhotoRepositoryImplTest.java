package com.bbthechange.gallery.repository.impl;

import com.bbthechange.gallery.dto.PhotoStats;
import com.bbthechange.gallery.exception.RepositoryException;
import com.bbthechange.gallery.model.Photo;
import com.bbthechange.gallery.model.PhotoStatus;
import com.bbthechange.gallery.repository.ConditionalWriteResult;
import com.bbthechange.gallery.testutil.GalleryTestData;
import com.bbthechange.gallery.util.PageTokenCodec;
import com.bbthechange.gallery.util.PaginatedResult;
import com.bbthechange.gallery.util.QueryPerformanceTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PhotoRepositoryImplTest {

    private static final String EVENT_ID = "12345678-1234-1234-1234-123456789012";

    @Mock
    private DynamoDbClient dynamoDbClient;

    @Mock
    private QueryPerformanceTracker queryPerformanceTracker;

    private PhotoRepositoryImpl repository;

    @BeforeEach
    void setUp() {
        repository = new PhotoRepositoryImpl(dynamoDbClient, queryPerformanceTracker);

        lenient().when(queryPerformanceTracker.trackQuery(anyString(), anyString(), any()))
            .thenAnswer(invocation -> {
                Supplier<?> supplier = invocation.getArgument(2);
                return supplier.get();
            });
    }

    private static TransactionCanceledException cancelled(String eventReason, String photoReason) {
        return TransactionCanceledException.builder()
            .message("Transaction cancelled")
            .cancellationReasons(
                CancellationReason.builder().code(eventReason).build(),
                CancellationReason.builder().code(photoReason).build())
            .build();
    }

    @Nested
    class ConditionalWriteTests {

        @Test
        void create_ShouldCheckActiveEventBeforePut() {
            // Given
            Photo photo = GalleryTestData.photo(EVENT_ID, PhotoStatus.PENDING);

            // When
            ConditionalWriteResult result = repository.create(photo);

            // Then
            assertThat(result).isEqualTo(ConditionalWriteResult.APPLIED);
            ArgumentCaptor<TransactWriteItemsRequest> captor = ArgumentCaptor.forClass(TransactWriteItemsRequest.class);
            verify(dynamoDbClient).transactWriteItems(captor.capture());
            List<TransactWriteItem> items = captor.getValue().transactItems();
            assertThat(items).hasSize(2);
            assertThat(items.get(0).conditionCheck().conditionExpression()).isEqualTo("#st = :active");
            assertThat(items.get(0).conditionCheck().expressionAttributeValues().get(":active").s()).isEqualTo("ACTIVE");
            assertThat(items.get(1).put().item().get("sk").s()).isEqualTo("PHOTO#" + photo.getPhotoId());
            assertThat(items.get(1).put().conditionExpression()).isEqualTo("attribute_not_exists(pk)");
        }

        @Test
        void create_WhenEventCheckFails_ShouldReportParentUnavailable() {
            when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
                .thenThrow(cancelled("ConditionalCheckFailed", "None"));

            assertThat(repository.create(GalleryTestData.photo(EVENT_ID, PhotoStatus.PENDING)))
                .isEqualTo(ConditionalWriteResult.PARENT_UNAVAILABLE);
        }

        @Test
        void transitionApproval_ShouldConditionOnExpectedStatus() {
            String photoId = UUID.randomUUID().toString();

            repository.transitionApproval(EVENT_ID, photoId, PhotoStatus.PENDING, PhotoStatus.APPROVED,
                "host-1", Instant.ofEpochMilli(1000));

            ArgumentCaptor<TransactWriteItemsRequest> captor = ArgumentCaptor.forClass(TransactWriteItemsRequest.class);
            verify(dynamoDbClient).transactWriteItems(captor.capture());
            List<TransactWriteItem> items = captor.getValue().transactItems();
            assertThat(items.get(0).conditionCheck().conditionExpression()).contains("#st <> :deleted");
            Update update = items.get(1).update();
            assertThat(update.conditionExpression()).isEqualTo("attribute_exists(pk) AND approvalStatus = :expected");
            assertThat(update.expressionAttributeValues().get(":expected").s()).isEqualTo("PENDING");
            assertThat(update.expressionAttributeValues().get(":target").s()).isEqualTo("APPROVED");
            assertThat(update.expressionAttributeValues().get(":at").n()).isEqualTo("1000");
        }

        @Test
        void transitionApproval_WhenPhotoConditionFails_ShouldReportStale() {
            when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
                .thenThrow(cancelled("None", "ConditionalCheckFailed"));

            assertThat(repository.transitionApproval(EVENT_ID, UUID.randomUUID().toString(), PhotoStatus.PENDING,
                PhotoStatus.REJECTED, "host-1", Instant.now()))
                .isEqualTo(ConditionalWriteResult.STALE);
        }

        @Test
        void delete_WhenConflicting_ShouldReportStale() {
            when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
                .thenThrow(cancelled("None", "TransactionConflict"));

            assertThat(repository.delete(EVENT_ID, UUID.randomUUID().toString(), PhotoStatus.APPROVED))
                .isEqualTo(ConditionalWriteResult.STALE);
        }

        @Test
        void updateCaption_WithNull_ShouldRemoveAttribute() {
            repository.updateCaption(EVENT_ID, UUID.randomUUID().toString(), null);

            ArgumentCaptor<TransactWriteItemsRequest> captor = ArgumentCaptor.forClass(TransactWriteItemsRequest.class);
            verify(dynamoDbClient).transactWriteItems(captor.capture());
            assertThat(captor.getValue().transactItems().get(1).update().updateExpression()).contains("REMOVE caption");
        }

        @Test
        void unexplainedCancellation_ShouldBeRepositoryFailure() {
            when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
                .thenThrow(cancelled("None", "ThrottlingError"));

            assertThatThrownBy(() -> repository.delete(EVENT_ID, UUID.randomUUID().toString(), PhotoStatus.PENDING))
                .isInstanceOf(RepositoryException.class);
        }
    }

    @Nested
    class ReadTests {

        @Test
        void findById_ShouldMapStoredItem() {
            Photo photo = GalleryTestData.photo(EVENT_ID, PhotoStatus.APPROVED);
            photo.setCaption("First dance");
            Map<String, AttributeValue> item = TableSchema.fromBean(Photo.class).itemToMap(photo, true);
            when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().item(item).build());

            Optional<Photo> found = repository.findById(EVENT_ID, photo.getPhotoId());

            assertThat(found).hasValueSatisfying(p -> {
                assertThat(p.getPhotoId()).isEqualTo(photo.getPhotoId());
                assertThat(p.getApprovalStatus()).isEqualTo(PhotoStatus.APPROVED);
                assertThat(p.getCaption()).isEqualTo("First dance");
            });
        }

        @Test
        void findById_Missing_ShouldBeEmpty() {
            when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().build());

            assertThat(repository.findById(EVENT_ID, UUID.randomUUID().toString())).isEmpty();
        }

        @Test
        void findByEvent_WithStatus_ShouldKeepReadingUntilPageIsFull() {
            // Given a first read whose items were all filtered out
            TableSchema<Photo> schema = TableSchema.fromBean(Photo.class);
            Photo first = GalleryTestData.photo(EVENT_ID, PhotoStatus.APPROVED);
            Photo second = GalleryTestData.photo(EVENT_ID, PhotoStatus.APPROVED);
            Photo third = GalleryTestData.photo(EVENT_ID, PhotoStatus.APPROVED);
            when(dynamoDbClient.query(any(QueryRequest.class)))
                .thenReturn(QueryResponse.builder()
                    .items(List.of())
                    .lastEvaluatedKey(Map.of(
                        "pk", AttributeValue.builder().s("EVENT#" + EVENT_ID).build(),
                        "sk", AttributeValue.builder().s("PHOTO#x").build()))
                    .build())
                .thenReturn(QueryResponse.builder()
                    .items(List.of(schema.itemToMap(first, true), schema.itemToMap(second, true),
                        schema.itemToMap(third, true)))
                    .build());

            // When
            PaginatedResult<Photo> page = repository.findByEvent(EVENT_ID, PhotoStatus.APPROVED, 2, null);

            // Then
            assertThat(page.getResults()).extracting(Photo::getPhotoId)
                .containsExactly(first.getPhotoId(), second.getPhotoId());
            ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
            verify(dynamoDbClient, times(2)).query(captor.capture());
            assertThat(captor.getAllValues().get(0).filterExpression()).isEqualTo("approvalStatus = :status");
            assertThat(captor.getAllValues().get(0).limit()).isEqualTo(2);
            assertThat(captor.getAllValues().get(1).exclusiveStartKey().get("sk").s()).isEqualTo("PHOTO#x");
            assertThat(PageTokenCodec.decode(page.getNextToken()).get("sk").s())
                .isEqualTo("PHOTO#" + second.getPhotoId());
        }

        @Test
        void findByEvent_WhenPartitionExhausted_ShouldReturnNoToken() {
            Photo only = GalleryTestData.photo(EVENT_ID, PhotoStatus.PENDING);
            when(dynamoDbClient.query(any(QueryRequest.class))).thenReturn(QueryResponse.builder()
                .items(List.of(TableSchema.fromBean(Photo.class).itemToMap(only, true)))
                .build());

            PaginatedResult<Photo> page = repository.findByEvent(EVENT_ID, null, 10, null);

            assertThat(page.getResults()).hasSize(1);
            assertThat(page.getNextToken()).isNull();
            verify(dynamoDbClient, times(1)).query(any(QueryRequest.class));
        }

        @Test
        void countByEvent_ShouldFollowPages() {
            when(dynamoDbClient.query(any(QueryRequest.class)))
                .thenReturn(QueryResponse.builder().count(3)
                    .lastEvaluatedKey(Map.of("pk", AttributeValue.builder().s("EVENT#" + EVENT_ID).build()))
                    .build())
                .thenReturn(QueryResponse.builder().count(2).build());

            assertThat(repository.countByEvent(EVENT_ID, null)).isEqualTo(5);
            verify(dynamoDbClient, times(2)).query(any(QueryRequest.class));
        }

        @Test
        void summarize_ShouldTotalCountsAndBytes() {
            when(dynamoDbClient.scan(any(ScanRequest.class))).thenReturn(ScanResponse.builder()
                .items(
                    Map.of("approvalStatus", AttributeValue.builder().s("APPROVED").build(),
                        "fileSize", AttributeValue.builder().n("100").build()),
                    Map.of("approvalStatus", AttributeValue.builder().s("PENDING").build(),
                        "fileSize", AttributeValue.builder().n("50").build()))
                .build());

            PhotoStats stats = repository.summarize();

            assertThat(stats.getTotalCount()).isEqualTo(2);
            assertThat(stats.getTotalBytes()).isEqualTo(150);
            assertThat(stats.getCountByStatus()).containsEntry(PhotoStatus.APPROVED, 1L);
        }

        @Test
        void dynamoFailure_ShouldBeWrapped() {
            when(dynamoDbClient.getItem(any(GetItemRequest.class)))
                .thenThrow(DynamoDbException.builder().message("boom").build());

            assertThatThrownBy(() -> repository.findById(EVENT_ID, UUID.randomUUID().toString()))
                .isInstanceOf(RepositoryException.class);
        }
    }
}
