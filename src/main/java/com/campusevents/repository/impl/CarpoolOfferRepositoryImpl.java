package com.campusevents.repository.impl;

import com.campusevents.config.CampusTables;
import com.campusevents.exception.RepositoryException;
import com.campusevents.model.BaseItem;
import com.campusevents.model.CarpoolOffer;
import com.campusevents.model.CarpoolPassenger;
import com.campusevents.repository.CarpoolOfferRepository;
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
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * DynamoDB implementation of CarpoolOfferRepository.
 *
 * Offers and their passengers share the driver partition; offer queries on that
 * partition drop passenger rows by sort key.
 */
@Repository
public class CarpoolOfferRepositoryImpl implements CarpoolOfferRepository {

    private static final Logger logger = LoggerFactory.getLogger(CarpoolOfferRepositoryImpl.class);
    private static final String TABLE_NAME = CampusTables.CAMPUS_TABLE;

    private final DynamoDbTable<CarpoolOffer> offerTable;
    private final DynamoDbTable<CarpoolPassenger> passengerTable;
    private final QueryPerformanceTracker performanceTracker;

    @Autowired
    public CarpoolOfferRepositoryImpl(DynamoDbEnhancedClient enhancedClient, QueryPerformanceTracker performanceTracker) {
        this.offerTable = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(CarpoolOffer.class));
        this.passengerTable = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(CarpoolPassenger.class));
        this.performanceTracker = performanceTracker;
    }

    @Override
    public Optional<CarpoolOffer> findById(String offerId) {
        Optional<CarpoolOffer> located = track("locateOffer", () ->
                firstFromIdIndex(offerTable, CampusKeyFactory.getOfferGsi2Pk(offerId)));
        if (located.isEmpty()) {
            return Optional.empty();
        }
        return track("findOfferById", () -> Optional.ofNullable(offerTable.getItem(
                consistentGet(located.get()))));
    }

    @Override
    public List<CarpoolOffer> findByDriver(String driverId) {
        QueryConditional conditional = QueryConditional.sortBeginsWith(Key.builder()
                .partitionValue(CampusKeyFactory.getDriverPk(driverId))
                .sortValue(CampusKeyFactory.getOfferQueryPrefix())
                .build());

        return track("findOffersByDriver", () -> offerTable.query(QueryEnhancedRequest.builder()
                        .queryConditional(conditional)
                        .consistentRead(true)
                        .build())
                .items().stream()
                .filter(offer -> CampusKeyFactory.isOffer(offer.getSk()))
                .collect(Collectors.toList()));
    }

    @Override
    public List<CarpoolOffer> findByEvent(String eventId) {
        QueryConditional conditional = QueryConditional.sortBeginsWith(Key.builder()
                .partitionValue(CampusKeyFactory.getEventGsi1Pk(eventId))
                .sortValue(CampusKeyFactory.getOfferQueryPrefix())
                .build());

        return track("findOffersByEvent", () -> {
            List<CarpoolOffer> offers = offerTable.index(BaseItem.LOOKUP_INDEX)
                    .query(QueryEnhancedRequest.builder().queryConditional(conditional).build())
                    .stream()
                    .flatMap(page -> page.items().stream())
                    .collect(Collectors.toList());
            logger.debug("Found {} offers for event {}", offers.size(), eventId);
            return offers;
        });
    }

    @Override
    public List<CarpoolPassenger> findPassengers(String driverId, String offerId) {
        QueryConditional conditional = QueryConditional.sortBeginsWith(Key.builder()
                .partitionValue(CampusKeyFactory.getDriverPk(driverId))
                .sortValue(CampusKeyFactory.getPassengerQueryPrefix(offerId))
                .build());

        return track("findPassengersByOffer", () -> passengerTable.query(QueryEnhancedRequest.builder()
                        .queryConditional(conditional)
                        .consistentRead(true)
                        .build())
                .items().stream()
                .collect(Collectors.toList()));
    }

    @Override
    public Optional<CarpoolPassenger> findPassengerById(String passengerRecordId) {
        Optional<CarpoolPassenger> located = track("locatePassenger", () ->
                firstFromIdIndex(passengerTable, CampusKeyFactory.getPassengerGsi2Pk(passengerRecordId)));
        if (located.isEmpty()) {
            return Optional.empty();
        }
        return track("findPassengerById", () -> Optional.ofNullable(passengerTable.getItem(
                consistentGet(located.get()))));
    }

    @Override
    public List<CarpoolPassenger> findPassengersByUser(String userId) {
        QueryConditional conditional = QueryConditional.sortBeginsWith(Key.builder()
                .partitionValue(CampusKeyFactory.getUserGsi1Pk(userId))
                .sortValue(CampusKeyFactory.PASSENGER_PREFIX + "#")
                .build());

        return track("findPassengersByUser", () -> passengerTable.index(BaseItem.LOOKUP_INDEX)
                .query(QueryEnhancedRequest.builder().queryConditional(conditional).build())
                .stream()
                .flatMap(page -> page.items().stream())
                .collect(Collectors.toList()));
    }

    @Override
    public List<CarpoolPassenger> findAllPassengers() {
        return track("findAllPassengers", () -> passengerTable.scan(
                        RoomRepositoryImpl.byItemType(CampusKeyFactory.PASSENGER_TYPE))
                .items().stream()
                .collect(Collectors.toList()));
    }

    private <T extends BaseItem> Optional<T> firstFromIdIndex(DynamoDbTable<T> table, String gsi2pk) {
        QueryConditional conditional = QueryConditional.keyEqualTo(Key.builder().partitionValue(gsi2pk).build());
        return table.index(BaseItem.ID_INDEX)
                .query(QueryEnhancedRequest.builder().queryConditional(conditional).limit(1).build())
                .stream()
                .flatMap(page -> page.items().stream())
                .findFirst();
    }

    private GetItemEnhancedRequest consistentGet(BaseItem located) {
        return GetItemEnhancedRequest.builder()
                .key(Key.builder().partitionValue(located.getPk()).sortValue(located.getSk()).build())
                .consistentRead(true)
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
