package com.campusevents.model;

import com.campusevents.util.CampusKeyFactory;
import com.campusevents.util.InstantAsLongAttributeConverter;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;

import java.time.Instant;

/**
 * CarpoolPassenger entity for the CampusTable.
 * A user's seat on an offer. Stored under the offer's driver partition so the
 * offer and its passengers can be read in one consistent query.
 *
 * Key Pattern: PK = DRIVER#{driverId}, SK = OFFER#{offerId}#PASSENGER#{recordId}
 * LookupIndex: USER#{passengerId} / PASSENGER#{recordId}
 * IdIndex: PASSENGER#{recordId}
 */
@ToString
@NoArgsConstructor
@DynamoDbBean
public class CarpoolPassenger extends BaseItem {

    @Getter @Setter
    private String passengerRecordId;
    @Getter @Setter
    private String offerId;
    @Getter @Setter
    private String driverId;
    @Getter @Setter
    private String eventId;
    @Getter @Setter
    private String passengerId;
    @Getter @Setter
    private PassengerStatus status;
    @Getter @Setter
    private String pickupLocation;
    @Getter @Setter
    private String notes;
    private Instant joinedAt;

    public CarpoolPassenger(String passengerRecordId, CarpoolOffer offer, String passengerId, Instant joinedAt) {
        super();
        setItemType(CampusKeyFactory.PASSENGER_TYPE);
        this.passengerRecordId = passengerRecordId;
        this.passengerId = passengerId;
        this.joinedAt = joinedAt;
        this.status = PassengerStatus.CONFIRMED;
        setGsi1pk(CampusKeyFactory.getUserGsi1Pk(passengerId));
        setGsi1sk(CampusKeyFactory.getPassengerGsi1Sk(passengerRecordId));
        setGsi2pk(CampusKeyFactory.getPassengerGsi2Pk(passengerRecordId));
        assignTo(offer);
    }

    /**
     * Point this record at an offer, rewriting its primary key.
     */
    public void assignTo(CarpoolOffer offer) {
        this.offerId = offer.getOfferId();
        this.driverId = offer.getDriverId();
        this.eventId = offer.getEventId();
        setPk(CampusKeyFactory.getDriverPk(driverId));
        setSk(CampusKeyFactory.getPassengerSk(offerId, passengerRecordId));
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getJoinedAt() {
        return joinedAt;
    }

    public void setJoinedAt(Instant joinedAt) {
        this.joinedAt = joinedAt;
    }
}
