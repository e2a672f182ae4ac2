package com.campusevents.model;

import com.campusevents.util.CampusKeyFactory;
import com.campusevents.util.InstantAsLongAttributeConverter;
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
 * Room entity for the CampusTable.
 * A bookable space owned by an organizer. The version guards the room's whole
 * booking set: every rental write for the room bumps it in the same transaction.
 *
 * Key Pattern: PK = ROOM#{roomId}, SK = METADATA
 * LookupIndex: USER#{organizerId} / ROOM#{roomId}
 */
@ToString
@NoArgsConstructor
@DynamoDbBean
public class Room extends BaseItem implements Versioned {

    @Getter @Setter
    private String roomId;
    @Getter @Setter
    private String organizerId;
    @Getter @Setter
    private String name;
    @Getter @Setter
    private String address;
    @Getter @Setter
    private String roomInfo;
    @Getter @Setter
    private Integer capacity;
    @Getter @Setter
    private String amenities;
    @Getter @Setter
    private BigDecimal hourlyRate;
    @Getter @Setter
    private RoomStatus status;
    private Instant availabilityStart;
    private Instant availabilityEnd;
    private Long version;

    public Room(String roomId, String organizerId, String name, int capacity) {
        super();
        setItemType(CampusKeyFactory.ROOM_TYPE);
        this.roomId = roomId;
        this.organizerId = organizerId;
        this.name = name;
        this.capacity = capacity;
        this.status = RoomStatus.ENABLED;

        setPk(CampusKeyFactory.getRoomPk(roomId));
        setSk(CampusKeyFactory.getMetadataSk());
        setGsi1pk(CampusKeyFactory.getUserGsi1Pk(organizerId));
        setGsi1sk(CampusKeyFactory.getRoomGsi1Sk(roomId));
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getAvailabilityStart() {
        return availabilityStart;
    }

    public void setAvailabilityStart(Instant availabilityStart) {
        this.availabilityStart = availabilityStart;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getAvailabilityEnd() {
        return availabilityEnd;
    }

    public void setAvailabilityEnd(Instant availabilityEnd) {
        this.availabilityEnd = availabilityEnd;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }

    @DynamoDbIgnore
    public boolean isEnabled() {
        return status == RoomStatus.ENABLED;
    }
}
