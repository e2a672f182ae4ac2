package com.campusevents.model;

import com.campusevents.util.CampusKeyFactory;
import com.campusevents.util.InstantAsLongAttributeConverter;
import com.campusevents.util.TimeRange;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * RoomRental entity for the CampusTable.
 * A request to occupy a room for [startTime, endTime). Rentals live in the
 * room's partition so one consistent query returns the whole booking set.
 *
 * Key Pattern: PK = ROOM#{roomId}, SK = RENTAL#{rentalId}
 * LookupIndex: USER#{renterId} / RENTAL#{rentalId}
 * IdIndex: RENTAL#{rentalId}
 */
@ToString
@NoArgsConstructor
@DynamoDbBean
public class RoomRental extends BaseItem {

    @Getter @Setter
    private String rentalId;
    @Getter @Setter
    private String roomId;
    @Getter @Setter
    private String renterId;
    @Getter @Setter
    private RentalStatus status;
    @Getter @Setter
    private String purpose;
    @Getter @Setter
    private Integer expectedAttendees;
    @Getter @Setter
    private BigDecimal totalCost;
    @Getter @Setter
    private String adminNotes;
    private Instant startTime;
    private Instant endTime;

    public RoomRental(String rentalId, String roomId, String renterId, Instant startTime, Instant endTime) {
        super();
        setItemType(CampusKeyFactory.RENTAL_TYPE);
        this.rentalId = rentalId;
        this.roomId = roomId;
        this.renterId = renterId;
        this.startTime = startTime;
        this.endTime = endTime;
        this.status = RentalStatus.PENDING;

        setPk(CampusKeyFactory.getRoomPk(roomId));
        setSk(CampusKeyFactory.getRentalSk(rentalId));
        setGsi1pk(CampusKeyFactory.getUserGsi1Pk(renterId));
        setGsi1sk(CampusKeyFactory.getRentalSk(rentalId));
        setGsi2pk(CampusKeyFactory.getRentalGsi2Pk(rentalId));
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getStartTime() {
        return startTime;
    }

    public void setStartTime(Instant startTime) {
        this.startTime = startTime;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getEndTime() {
        return endTime;
    }

    public void setEndTime(Instant endTime) {
        this.endTime = endTime;
    }

    @DynamoDbIgnore
    public TimeRange getTimeRange() {
        return TimeRange.of(startTime, endTime);
    }

    @DynamoDbIgnore
    public boolean overlaps(Instant start, Instant end) {
        return getTimeRange().overlaps(TimeRange.of(start, end));
    }
}
