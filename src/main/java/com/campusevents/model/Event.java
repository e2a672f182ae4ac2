package com.campusevents.model;

import com.campusevents.util.InstantAsLongAttributeConverter;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
public class Event {
    private String id;
    private String title;
    private Instant eventDate;

    @DynamoDbPartitionKey
    public String getId() {
        return id;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getEventDate() {
        return eventDate;
    }
}
