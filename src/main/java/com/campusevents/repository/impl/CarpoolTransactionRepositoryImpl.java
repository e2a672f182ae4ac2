package com.campusevents.repository.impl;

import com.campusevents.config.CampusTables;
import com.campusevents.model.CarpoolOffer;
import com.campusevents.model.CarpoolPassenger;
import com.campusevents.model.Driver;
import com.campusevents.model.DriverClaim;
import com.campusevents.repository.CarpoolTransactionRepository;
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
 * Versioned TransactWriteItems for drivers, offers and passenger records.
 */
@Repository
public class CarpoolTransactionRepositoryImpl implements CarpoolTransactionRepository {

    private static final Logger logger = LoggerFactory.getLogger(CarpoolTransactionRepositoryImpl.class);
    private static final String TABLE_NAME = CampusTables.CAMPUS_TABLE;

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker performanceTracker;
    private final Clock clock;
    private final TableSchema<Driver> driverSchema = TableSchema.fromBean(Driver.class);
    private final TableSchema<DriverClaim> claimSchema = TableSchema.fromBean(DriverClaim.class);
    private final TableSchema<CarpoolOffer> offerSchema = TableSchema.fromBean(CarpoolOffer.class);
    private final TableSchema<CarpoolPassenger> passengerSchema = TableSchema.fromBean(CarpoolPassenger.class);

    @Autowired
    public CarpoolTransactionRepositoryImpl(DynamoDbClient dynamoDbClient,
                                            QueryPerformanceTracker performanceTracker,
                                            Clock clock) {
        this.dynamoDbClient = dynamoDbClient;
        this.performanceTracker = performanceTracker;
        this.clock = clock;
    }

    @Override
    public void createDriver(Driver driver, DriverClaim claim) {
        List<TransactWriteItem> items = List.of(
                TransactionItems.newItemPut(TABLE_NAME, driverSchema, driver),
                TransactionItems.newItemPut(TABLE_NAME, claimSchema, claim));
        TransactionItems.execute(dynamoDbClient, performanceTracker, TABLE_NAME, "createDriver", items);
        logger.debug("Created driver {} for user {}", driver.getDriverId(), driver.getUserId());
    }

    @Override
    public void saveDriverWithOffers(Driver driver, List<CarpoolOffer> offers) {
        Instant now = clock.instant();
        List<TransactWriteItem> items = new ArrayList<>();
        items.add(TransactionItems.versionedPut(TABLE_NAME, driverSchema, driver, now));
        for (CarpoolOffer offer : offers) {
            items.add(TransactionItems.versionedPut(TABLE_NAME, offerSchema, offer, now));
        }
        TransactionItems.execute(dynamoDbClient, performanceTracker, TABLE_NAME, "saveDriverWithOffers", items);
        logger.debug("Saved driver {} with {} offers", driver.getDriverId(), offers.size());
    }

    @Override
    public void createOffer(Driver driver, CarpoolOffer offer) {
        Instant now = clock.instant();
        List<TransactWriteItem> items = List.of(
                TransactionItems.versionedPut(TABLE_NAME, driverSchema, driver, now),
                TransactionItems.newItemPut(TABLE_NAME, offerSchema, offer));
        TransactionItems.execute(dynamoDbClient, performanceTracker, TABLE_NAME, "createOffer", items);
        logger.debug("Created offer {} for driver {}", offer.getOfferId(), driver.getDriverId());
    }

    @Override
    public void saveOfferWithPassengers(CarpoolOffer offer, List<CarpoolPassenger> passengers) {
        Instant now = clock.instant();
        List<TransactWriteItem> items = new ArrayList<>();
        items.add(TransactionItems.versionedPut(TABLE_NAME, offerSchema, offer, now));
        for (CarpoolPassenger passenger : passengers) {
            items.add(TransactionItems.put(TABLE_NAME, passengerSchema, passenger, now));
        }
        TransactionItems.execute(dynamoDbClient, performanceTracker, TABLE_NAME, "saveOfferWithPassengers", items);
        logger.debug("Saved offer {} ({} seats) with {} passenger records",
                offer.getOfferId(), offer.getSeatsAvailable(), passengers.size());
    }

    @Override
    public void movePassenger(CarpoolPassenger passenger, CarpoolOffer source, CarpoolOffer target) {
        Instant now = clock.instant();
        List<TransactWriteItem> items = new ArrayList<>();
        items.add(TransactionItems.existingDelete(TABLE_NAME, passenger));
        passenger.assignTo(target);
        items.add(TransactionItems.put(TABLE_NAME, passengerSchema, passenger, now));
        items.add(TransactionItems.versionedPut(TABLE_NAME, offerSchema, source, now));
        items.add(TransactionItems.versionedPut(TABLE_NAME, offerSchema, target, now));
        TransactionItems.execute(dynamoDbClient, performanceTracker, TABLE_NAME, "movePassenger", items);
        logger.debug("Moved passenger record {} from offer {} to offer {}",
                passenger.getPassengerRecordId(), source.getOfferId(), target.getOfferId());
    }
}
