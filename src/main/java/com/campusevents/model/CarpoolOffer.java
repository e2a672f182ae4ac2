package com.campusevents.model;

import com.campusevents.util.CampusKeyFactory;
import com.campusevents.util.InstantAsLongAttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;

import java.time.Instant;

/**
 * CarpoolOffer entity for the CampusTable.
 * A driver's ride to one event. Capacity is the driver's capacity at creation
 * time; seatsAvailable is capacity minus confirmed passengers.
 *
 * Key Pattern: PK = DRIVER#{driverId}, SK = OFFER#{offerId}
 * LookupIndex: EVENT#{eventId} / OFFER#{offerId}
 * IdIndex: OFFER#{offerId}
 */
@DynamoDbBean
public class CarpoolOffer extends BaseItem implements Versioned {

    private String offerId;
    private String driverId;
    private String driverUserId;        // Denormalized for self-join and ownership checks
    private String eventId;
    private Integer capacity;
    private Integer seatsAvailable;
    private String departureInfo;
    private String departureAddress;
    private Double latitude;
    private Double longitude;
    private Instant departureTime;
    private CarpoolOfferStatus status;
    private Long version;

    // Default constructor for DynamoDB
    public CarpoolOffer() {
        super();
    }

    public CarpoolOffer(String offerId, String driverId, String driverUserId, String eventId, int capacity) {
        super();
        setItemType(CampusKeyFactory.OFFER_TYPE);
        this.offerId = offerId;
        this.driverId = driverId;
        this.driverUserId = driverUserId;
        this.eventId = eventId;
        this.capacity = capacity;
        this.seatsAvailable = capacity;
        this.status = CarpoolOfferStatus.ACTIVE;

        setPk(CampusKeyFactory.getDriverPk(driverId));
        setSk(CampusKeyFactory.getOfferSk(offerId));
        setGsi1pk(CampusKeyFactory.getEventGsi1Pk(eventId));
        setGsi1sk(CampusKeyFactory.getOfferSk(offerId));
        setGsi2pk(CampusKeyFactory.getOfferGsi2Pk(offerId));
    }

    public String getOfferId() {
        return offerId;
    }

    public void setOfferId(String offerId) {
        this.offerId = offerId;
    }

    public String getDriverId() {
        return driverId;
    }

    public void setDriverId(String driverId) {
        this.driverId = driverId;
    }

    public String getDriverUserId() {
        return driverUserId;
    }

    public void setDriverUserId(String driverUserId) {
        this.driverUserId = driverUserId;
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public Integer getCapacity() {
        return capacity;
    }

    public void setCapacity(Integer capacity) {
        this.capacity = capacity;
    }

    public Integer getSeatsAvailable() {
        return seatsAvailable;
    }

    public void setSeatsAvailable(Integer seatsAvailable) {
        this.seatsAvailable = seatsAvailable;
    }

    public String getDepartureInfo() {
        return departureInfo;
    }

    public void setDepartureInfo(String departureInfo) {
        this.departureInfo = departureInfo;
    }

    public String getDepartureAddress() {
        return departureAddress;
    }

    public void setDepartureAddress(String departureAddress) {
        this.departureAddress = departureAddress;
    }

    public Double getLatitude() {
        return latitude;
    }

    public void setLatitude(Double latitude) {
        this.latitude = latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public void setLongitude(Double longitude) {
        this.longitude = longitude;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getDepartureTime() {
        return departureTime;
    }

    public void setDepartureTime(Instant departureTime) {
        this.departureTime = departureTime;
    }

    public CarpoolOfferStatus getStatus() {
        return status;
    }

    public void setStatus(CarpoolOfferStatus status) {
        this.status = status;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }

    /**
     * Take one seat, flipping to FULL when the last one goes.
     */
    public void takeSeat() {
        this.seatsAvailable = seatsAvailable - 1;
        if (seatsAvailable == 0) {
            this.status = CarpoolOfferStatus.FULL;
        }
    }

    /**
     * Give one seat back, reopening a FULL offer.
     */
    public void releaseSeat() {
        this.seatsAvailable = seatsAvailable + 1;
        if (status == CarpoolOfferStatus.FULL) {
            this.status = CarpoolOfferStatus.ACTIVE;
        }
    }
}
