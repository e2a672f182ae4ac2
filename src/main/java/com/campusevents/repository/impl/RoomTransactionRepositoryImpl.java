package com.campusevents.repository.impl;

import com.campusevents.config.CampusTables;
import com.campusevents.model.Room;
import com.campusevents.model.RoomRental;
import com.campusevents.repository.RoomTransactionRepository;
import com.campusevents.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Versioned TransactWriteItems for rooms and rentals.
 */
@Repository
public class RoomTransactionRepositoryImpl implements RoomTransactionRepository {

    private static final Logger logger = LoggerFactory.getLogger(RoomTransactionRepositoryImpl.class);
    private static final String TABLE_NAME = CampusTables.CAMPUS_TABLE;

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker performanceTracker;
    private final Clock clock;
    private final TableSchema<Room> roomSchema = TableSchema.fromBean(Room.class);
    private final TableSchema<RoomRental> rentalSchema = TableSchema.fromBean(RoomRental.class);

    @Autowired
    public RoomTransactionRepositoryImpl(DynamoDbClient dynamoDbClient,
                                         QueryPerformanceTracker performanceTracker,
                                         Clock clock) {
        this.dynamoDbClient = dynamoDbClient;
        this.performanceTracker = performanceTracker;
        this.clock = clock;
    }

    @Override
    public void createRoom(Room room) {
        List<TransactWriteItem> items = List.of(TransactionItems.newItemPut(TABLE_NAME, roomSchema, room));
        TransactionItems.execute(dynamoDbClient, performanceTracker, TABLE_NAME, "createRoom", items);
        logger.debug("Created room {}", room.getRoomId());
    }

    @Override
    public void saveRoomWithRentals(Room room, List<RoomRental> rentals) {
        if (rentals.size() > MAX_RENTALS_PER_WRITE) {
            throw new IllegalArgumentException("Cannot save " + rentals.size() + " rentals in one transaction");
        }
        Instant now = clock.instant();
        List<TransactWriteItem> items = new ArrayList<>();
        items.add(TransactionItems.versionedPut(TABLE_NAME, roomSchema, room, now));
        for (RoomRental rental : rentals) {
            items.add(TransactionItems.put(TABLE_NAME, rentalSchema, rental, now));
        }
        TransactionItems.execute(dynamoDbClient, performanceTracker, TABLE_NAME, "saveRoomWithRentals", items);
        logger.debug("Saved room {} at version {} with {} rentals", room.getRoomId(), room.getVersion(), rentals.size());
    }
}
