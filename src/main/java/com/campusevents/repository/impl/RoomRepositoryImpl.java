package com.campusevents.repository.impl;

import com.campusevents.config.CampusTables;
import com.campusevents.exception.RepositoryException;
import com.campusevents.model.BaseItem;
import com.campusevents.model.Room;
import com.campusevents.model.RoomRental;
import com.campusevents.repository.RoomRepository;
import com.campusevents.util.CampusKeyFactory;
import com.campusevents.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.GetItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.ScanEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * DynamoDB implementation of RoomRepository.
 * Uses Enhanced Client with QueryPerformanceTracker for monitoring.
 */
@Repository
public class RoomRepositoryImpl implements RoomRepository {

    private static final Logger logger = LoggerFactory.getLogger(RoomRepositoryImpl.class);
    private static final String TABLE_NAME = CampusTables.CAMPUS_TABLE;

    private final DynamoDbTable<Room> roomTable;
    private final DynamoDbTable<RoomRental> rentalTable;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public RoomRepositoryImpl(DynamoDbEnhancedClient enhancedClient, QueryPerformanceTracker performanceTracker) {
        this.roomTable = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(Room.class));
        this.rentalTable = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(RoomRental.class));
        this.performanceTracker = performanceTracker;
    }

    @Override
    public Optional<Room> findById(String roomId) {
        Key key = Key.builder()
                .partitionValue(CampusKeyFactory.getRoomPk(roomId))
                .sortValue(CampusKeyFactory.getMetadataSk())
                .build();
        return track("findRoomById", () -> Optional.ofNullable(roomTable.getItem(
                GetItemEnhancedRequest.builder().key(key).consistentRead(true).build())));
    }

    @Override
    public List<RoomRental> findRentalsByRoom(String roomId) {
        QueryConditional conditional = QueryConditional.sortBeginsWith(Key.builder()
                .partitionValue(CampusKeyFactory.getRoomPk(roomId))
                .sortValue(CampusKeyFactory.getRentalQueryPrefix())
                .build());

        return track("findRentalsByRoom", () -> {
            List<RoomRental> rentals = rentalTable.query(QueryEnhancedRequest.builder()
                            .queryConditional(conditional)
                            .consistentRead(true)
                            .build())
                    .items().stream()
                    .collect(Collectors.toList());
            logger.debug("Found {} rentals for room {}", rentals.size(), roomId);
            return rentals;
        });
    }

    @Override
    public Optional<RoomRental> findRentalById(String rentalId) {
        QueryConditional conditional = QueryConditional.keyEqualTo(Key.builder()
                .partitionValue(CampusKeyFactory.getRentalGsi2Pk(rentalId))
                .build());

        Optional<RoomRental> located = track("locateRental", () ->
                rentalTable.index(BaseItem.ID_INDEX)
                        .query(QueryEnhancedRequest.builder().queryConditional(conditional).limit(1).build())
                        .stream()
                        .flatMap(page -> page.items().stream())
                        .findFirst());

        if (located.isEmpty()) {
            return Optional.empty();
        }
        Key key = Key.builder()
                .partitionValue(located.get().getPk())
                .sortValue(located.get().getSk())
                .build();
        return track("findRentalById", () -> Optional.ofNullable(rentalTable.getItem(
                GetItemEnhancedRequest.builder().key(key).consistentRead(true).build())));
    }

    @Override
    public List<Room> findByOrganizer(String organizerId) {
        QueryConditional conditional = QueryConditional.sortBeginsWith(Key.builder()
                .partitionValue(CampusKeyFactory.getUserGsi1Pk(organizerId))
                .sortValue(CampusKeyFactory.ROOM_PREFIX + "#")
                .build());

        return track("findRoomsByOrganizer", () -> roomTable.index(BaseItem.LOOKUP_INDEX)
                .query(QueryEnhancedRequest.builder().queryConditional(conditional).build())
                .stream()
                .flatMap(page -> page.items().stream())
                .collect(Collectors.toList()));
    }

    @Override
    public List<Room> findAll() {
        return track("findAllRooms", () -> roomTable.scan(byItemType(CampusKeyFactory.ROOM_TYPE))
                .items().stream()
                .collect(Collectors.toList()));
    }

    @Override
    public List<RoomRental> findRentalsByRenter(String renterId) {
        QueryConditional conditional = QueryConditional.sortBeginsWith(Key.builder()
                .partitionValue(CampusKeyFactory.getUserGsi1Pk(renterId))
                .sortValue(CampusKeyFactory.getRentalQueryPrefix())
                .build());

        return track("findRentalsByRenter", () -> rentalTable.index(BaseItem.LOOKUP_INDEX)
                .query(QueryEnhancedRequest.builder().queryConditional(conditional).build())
                .stream()
                .flatMap(page -> page.items().stream())
                .collect(Collectors.toList()));
    }

    @Override
    public List<RoomRental> findAllRentals() {
        return track("findAllRentals", () -> rentalTable.scan(byItemType(CampusKeyFactory.RENTAL_TYPE))
                .items().stream()
                .collect(Collectors.toList()));
    }

    static ScanEnhancedRequest byItemType(String itemType) {
        return ScanEnhancedRequest.builder()
                .filterExpression(Expression.builder()
                        .expression("itemType = :itemType")
                        .putExpressionValue(":itemType", AttributeValue.builder().s(itemType).build())
                        .build())
                .build();
    }

    private <T> T track(String operation, Supplier<T> query) {
        try {
            return performanceTracker.trackQuery(operation, TABLE_NAME, query);
        } catch (DynamoDbException e) {
            logger.error("DynamoDB error during {}", operation, e);
            throw new RepositoryException("Failed to " + operation, e);
        }
    }
}
