package com.campusevents.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * Platform account, read from the Users table. The booking core only needs
 * identity and role.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class User {
    private String id;
    private String displayName;
    private UserRole role;

    @DynamoDbPartitionKey
    public String getId() {
        return id;
    }
}
