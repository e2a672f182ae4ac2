package com.campusevents.repository.impl;

import com.campusevents.exception.VersionConflictException;
import com.campusevents.model.CarpoolOffer;
import com.campusevents.model.CarpoolPassenger;
import com.campusevents.model.Driver;
import com.campusevents.model.DriverClaim;
import com.campusevents.model.DriverType;
import com.campusevents.model.VehicleType;
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
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CarpoolTransactionRepositoryImplTest {

    private static final Instant NOW = Instant.parse("2026-05-01T08:00:00Z");

    @Mock
    private DynamoDbClient dynamoDbClient;

    @Mock
    private QueryPerformanceTracker performanceTracker;

    private CarpoolTransactionRepositoryImpl repository;

    private final String eventId = UUID.randomUUID().toString();

    @BeforeEach
    void setUp() {
        repository = new CarpoolTransactionRepositoryImpl(dynamoDbClient, performanceTracker,
                Clock.fixed(NOW, ZoneOffset.UTC));
        lenient().when(performanceTracker.trackQuery(anyString(), anyString(), any()))
            .thenAnswer(invocation -> {
                Supplier<?> supplier = invocation.getArgument(2);
                return supplier.get();
            });
    }

    private List<TransactWriteItem> capturedItems() {
        ArgumentCaptor<TransactWriteItemsRequest> captor = ArgumentCaptor.forClass(TransactWriteItemsRequest.class);
        verify(dynamoDbClient).transactWriteItems(captor.capture());
        return captor.getValue().transactItems();
    }

    private CarpoolOffer offer(long version) {
        CarpoolOffer offer = new CarpoolOffer(UUID.randomUUID().toString(), UUID.randomUUID().toString(),
                UUID.randomUUID().toString(), eventId, 2);
        offer.setVersion(version);
        return offer;
    }

    @Test
    void createDriver_WritesDriverAndClaimConditionally() {
        String userId = UUID.randomUUID().toString();
        Driver driver = new Driver(UUID.randomUUID().toString(), userId, 4, VehicleType.SUV, DriverType.STUDENT);

        repository.createDriver(driver, new DriverClaim(userId, driver.getDriverId()));

        List<TransactWriteItem> items = capturedItems();
        assertThat(items).hasSize(2);
        assertThat(items).allSatisfy(item ->
            assertThat(item.put().conditionExpression()).isEqualTo("attribute_not_exists(pk)"));
        assertThat(items.get(1).put().item().get("pk").s()).isEqualTo("USER#" + userId);
        assertThat(items.get(1).put().item().get("sk").s()).isEqualTo("DRIVER");
        assertThat(driver.getVersion()).isEqualTo(1L);
    }

    @Test
    void movePassenger_RekeysRecordAndGuardsBothOffers() {
        CarpoolOffer source = offer(5L);
        CarpoolOffer target = offer(2L);
        CarpoolPassenger passenger = new CarpoolPassenger(UUID.randomUUID().toString(), source,
                UUID.randomUUID().toString(), NOW);
        String oldSk = passenger.getSk();

        repository.movePassenger(passenger, source, target);

        List<TransactWriteItem> items = capturedItems();
        assertThat(items).hasSize(4);

        Delete delete = items.get(0).delete();
        assertThat(delete.key().get("sk").s()).isEqualTo(oldSk);
        assertThat(delete.conditionExpression()).isEqualTo("attribute_exists(pk)");

        Put moved = items.get(1).put();
        assertThat(moved.item().get("pk").s()).isEqualTo("DRIVER#" + target.getDriverId());
        assertThat(moved.item().get("sk").s())
            .isEqualTo("OFFER#" + target.getOfferId() + "#PASSENGER#" + passenger.getPassengerRecordId());
        assertThat(moved.item().get("offerId").s()).isEqualTo(target.getOfferId());

        assertThat(items.get(2).put().expressionAttributeValues().get(":expectedVersion").n()).isEqualTo("5");
        assertThat(items.get(3).put().expressionAttributeValues().get(":expectedVersion").n()).isEqualTo("2");
    }

    @Test
    void saveOfferWithPassengers_TransactionConflict_ThrowsVersionConflict() {
        CarpoolOffer offer = offer(1L);
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
            .thenThrow(TransactionCanceledException.builder()
                .message("Transaction cancelled")
                .cancellationReasons(CancellationReason.builder().code("TransactionConflict").build())
                .build());

        assertThatThrownBy(() -> repository.saveOfferWithPassengers(offer, List.of()))
            .isInstanceOf(VersionConflictException.class);
    }

    @Test
    void saveDriverWithOffers_VersionedPutRequiresPersistedItems() {
        Driver driver = new Driver(UUID.randomUUID().toString(), UUID.randomUUID().toString(), 3,
                VehicleType.SEDAN, DriverType.STUDENT);

        assertThatThrownBy(() -> repository.saveDriverWithOffers(driver, List.of()))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(dynamoDbClient);
    }
}
