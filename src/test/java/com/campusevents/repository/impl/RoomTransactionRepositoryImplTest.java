package com.campusevents.repository.impl;

import com.campusevents.exception.RepositoryException;
import com.campusevents.exception.VersionConflictException;
import com.campusevents.model.Room;
import com.campusevents.model.RoomRental;
import com.campusevents.util.QueryPerformanceTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static com.campusevents.testutil.RentalTestBuilder.aRental;
import static com.campusevents.testutil.RoomTestBuilder.aRoom;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RoomTransactionRepositoryImplTest {

    private static final Instant NOW = Instant.parse("2026-05-01T08:00:00Z");

    @Mock
    private DynamoDbClient dynamoDbClient;

    @Mock
    private QueryPerformanceTracker performanceTracker;

    private RoomTransactionRepositoryImpl repository;

    @BeforeEach
    void setUp() {
        repository = new RoomTransactionRepositoryImpl(dynamoDbClient, performanceTracker,
                Clock.fixed(NOW, ZoneOffset.UTC));

        // Mock performance tracker to execute the supplier directly
        lenient().when(performanceTracker.trackQuery(anyString(), anyString(), any()))
            .thenAnswer(invocation -> {
                Supplier<?> supplier = invocation.getArgument(2);
                return supplier.get();
            });
    }

    private TransactWriteItemsRequest capturedRequest() {
        ArgumentCaptor<TransactWriteItemsRequest> captor = ArgumentCaptor.forClass(TransactWriteItemsRequest.class);
        verify(dynamoDbClient).transactWriteItems(captor.capture());
        return captor.getValue();
    }

    private static TransactionCanceledException cancelled(String... codes) {
        List<CancellationReason> reasons = new ArrayList<>();
        for (String code : codes) {
            reasons.add(CancellationReason.builder().code(code).build());
        }
        return TransactionCanceledException.builder()
            .message("Transaction cancelled")
            .cancellationReasons(reasons)
            .build();
    }

    @Test
    void saveRoomWithRentals_GuardsRoomVersionAndBumpsIt() {
        // Given
        Room room = aRoom().build();
        room.setVersion(3L);
        RoomRental rental = aRental().forRoom(room.getRoomId()).build();

        // When
        repository.saveRoomWithRentals(room, List.of(rental));

        // Then
        List<TransactWriteItem> items = capturedRequest().transactItems();
        assertThat(items).hasSize(2);

        Put roomPut = items.get(0).put();
        assertThat(roomPut.tableName()).isEqualTo("CampusTable");
        assertThat(roomPut.conditionExpression()).isEqualTo("#ver = :expectedVersion");
        assertThat(roomPut.expressionAttributeNames()).containsEntry("#ver", "version");
        assertThat(roomPut.expressionAttributeValues().get(":expectedVersion").n()).isEqualTo("3");
        assertThat(roomPut.item().get("version").n()).isEqualTo("4");
        assertThat(roomPut.item().get("pk").s()).isEqualTo("ROOM#" + room.getRoomId());
        assertThat(room.getVersion()).isEqualTo(4L);

        Put rentalPut = items.get(1).put();
        assertThat(rentalPut.conditionExpression()).isNull();
        assertThat(rentalPut.item().get("sk").s()).isEqualTo("RENTAL#" + rental.getRentalId());
        assertThat(rentalPut.item().get("status").s()).isEqualTo("PENDING");
        assertThat(rentalPut.item().get("updatedAt").n()).isEqualTo(String.valueOf(NOW.toEpochMilli()));
    }

    @Test
    void createRoom_RequiresAbsentItemAndStartsAtVersionOne() {
        Room room = aRoom().build();
        room.setVersion(null);

        repository.createRoom(room);

        Put put = capturedRequest().transactItems().get(0).put();
        assertThat(put.conditionExpression()).isEqualTo("attribute_not_exists(pk)");
        assertThat(put.item().get("version").n()).isEqualTo("1");
    }

    @Test
    void saveRoomWithRentals_ConditionFailure_ThrowsVersionConflict() {
        Room room = aRoom().build();
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
            .thenThrow(cancelled("ConditionalCheckFailed", "None"));

        assertThatThrownBy(() -> repository.saveRoomWithRentals(room, List.of()))
            .isInstanceOf(VersionConflictException.class);
    }

    @Test
    void saveRoomWithRentals_OtherCancellation_ThrowsRepositoryException() {
        Room room = aRoom().build();
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
            .thenThrow(cancelled("ValidationError"));

        assertThatThrownBy(() -> repository.saveRoomWithRentals(room, List.of()))
            .isInstanceOf(RepositoryException.class)
            .hasMessageContaining("transaction cancelled");
    }

    @Test
    void saveRoomWithRentals_DynamoDbError_ThrowsRepositoryException() {
        Room room = aRoom().build();
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
            .thenThrow(DynamoDbException.builder().message("Service unavailable").build());

        assertThatThrownBy(() -> repository.saveRoomWithRentals(room, List.of()))
            .isInstanceOf(RepositoryException.class)
            .hasCauseInstanceOf(DynamoDbException.class);
    }

    @Test
    void saveRoomWithRentals_TooManyRentals_IsRejectedBeforeWriting() {
        Room room = aRoom().build();
        List<RoomRental> rentals = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            rentals.add(aRental().forRoom(room.getRoomId()).build());
        }

        assertThatThrownBy(() -> repository.saveRoomWithRentals(room, rentals))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(dynamoDbClient);
    }
}
