package com.campusevents.repository.impl;

import com.campusevents.config.CampusTables;
import com.campusevents.exception.RepositoryException;
import com.campusevents.model.Driver;
import com.campusevents.model.DriverClaim;
import com.campusevents.repository.DriverRepository;
import com.campusevents.util.CampusKeyFactory;
import com.campusevents.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.GetItemEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

@Repository
public class DriverRepositoryImpl implements DriverRepository {

    private static final Logger logger = LoggerFactory.getLogger(DriverRepositoryImpl.class);
    private static final String TABLE_NAME = CampusTables.CAMPUS_TABLE;

    private final DynamoDbTable<Driver> driverTable;
    private final DynamoDbTable<DriverClaim> claimTable;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public DriverRepositoryImpl(DynamoDbEnhancedClient enhancedClient, QueryPerformanceTracker performanceTracker) {
        this.driverTable = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(Driver.class));
        this.claimTable = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(DriverClaim.class));
        this.performanceTracker = performanceTracker;
    }

    @Override
    public Optional<Driver> findById(String driverId) {
        Key key = Key.builder()
                .partitionValue(CampusKeyFactory.getDriverPk(driverId))
                .sortValue(CampusKeyFactory.getMetadataSk())
                .build();
        return track("findDriverById", () -> Optional.ofNullable(driverTable.getItem(
                GetItemEnhancedRequest.builder().key(key).consistentRead(true).build())));
    }

    @Override
    public Optional<Driver> findByUserId(String userId) {
        Key key = Key.builder()
                .partitionValue(CampusKeyFactory.getUserPk(userId))
                .sortValue(CampusKeyFactory.getDriverClaimSk())
                .build();
        DriverClaim claim = track("findDriverClaim", () -> claimTable.getItem(
                GetItemEnhancedRequest.builder().key(key).consistentRead(true).build()));
        if (claim == null) {
            return Optional.empty();
        }
        return findById(claim.getDriverId());
    }

    @Override
    public List<Driver> findAll() {
        return track("findAllDrivers", () -> driverTable.scan(RoomRepositoryImpl.byItemType(CampusKeyFactory.DRIVER_TYPE))
                .items().stream()
                .collect(Collectors.toList()));
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
