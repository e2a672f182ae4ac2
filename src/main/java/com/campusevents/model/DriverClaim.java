package com.campusevents.model;

import com.campusevents.util.CampusKeyFactory;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

/**
 * Marker that reserves a user's single driver registration.
 * Written with attribute_not_exists(pk) in the same transaction as the Driver.
 *
 * Key Pattern: PK = USER#{userId}, SK = DRIVER
 */
@NoArgsConstructor
@DynamoDbBean
public class DriverClaim extends BaseItem {

    @Getter @Setter
    private String userId;
    @Getter @Setter
    private String driverId;

    public DriverClaim(String userId, String driverId) {
        super();
        setItemType(CampusKeyFactory.DRIVER_CLAIM_TYPE);
        this.userId = userId;
        this.driverId = driverId;

        setPk(CampusKeyFactory.getUserPk(userId));
        setSk(CampusKeyFactory.getDriverClaimSk());
    }
}
