package com.campusevents.model;

import com.campusevents.util.CampusKeyFactory;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.util.ArrayList;
import java.util.List;

/**
 * Driver entity for the CampusTable.
 * A user registered to offer rides. The version guards registration, offer
 * creation and suspension, so a suspend cannot interleave with a new offer.
 *
 * Key Pattern: PK = DRIVER#{driverId}, SK = METADATA
 */
@ToString
@NoArgsConstructor
@DynamoDbBean
public class Driver extends BaseItem implements Versioned {

    @Getter @Setter
    private String driverId;
    @Getter @Setter
    private String userId;
    @Getter @Setter
    private Integer capacity;
    @Getter @Setter
    private VehicleType vehicleType;
    @Getter @Setter
    private DriverType driverType;
    @Getter @Setter
    private String licensePlate;
    @Getter @Setter
    private String accessibilityFeatures;
    @Getter @Setter
    private DriverStatus status;
    @Getter @Setter
    private List<String> securityFlags = new ArrayList<>();   // Append-only audit trail
    private Long version;

    public Driver(String driverId, String userId, int capacity, VehicleType vehicleType, DriverType driverType) {
        super();
        setItemType(CampusKeyFactory.DRIVER_TYPE);
        this.driverId = driverId;
        this.userId = userId;
        this.capacity = capacity;
        this.vehicleType = vehicleType;
        this.driverType = driverType;
        this.status = DriverStatus.PENDING;

        setPk(CampusKeyFactory.getDriverPk(driverId));
        setSk(CampusKeyFactory.getMetadataSk());
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }

    public void addSecurityFlag(String flag) {
        if (securityFlags == null) {
            securityFlags = new ArrayList<>();
        }
        securityFlags.add(flag);
    }
}
