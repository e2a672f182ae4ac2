package com.campusevents.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/**
 * Reports DOWN unless the CampusTable is ACTIVE. Booking writes are impossible without it.
 */
@Component
public class DynamoDbHealthIndicator implements HealthIndicator {

    private final DynamoDbClient dynamoDbClient;
    private final String region;

    @Autowired
    public DynamoDbHealthIndicator(DynamoDbClient dynamoDbClient,
                                   @Value("${aws.region:us-east-1}") String region) {
        this.dynamoDbClient = dynamoDbClient;
        this.region = region;
    }

    @Override
    public Health health() {
        try {
            TableDescription campusTable = dynamoDbClient.describeTable(
                DescribeTableRequest.builder().tableName(CampusTables.CAMPUS_TABLE).build()
            ).table();

            if (campusTable.tableStatus() != TableStatus.ACTIVE) {
                return Health.down()
                    .withDetail("campusTable", campusTable.tableStatusAsString())
                    .withDetail("region", region)
                    .build();
            }
            return Health.up()
                .withDetail("campusTable", "ACTIVE")
                .withDetail("campusTableGsiCount", campusTable.globalSecondaryIndexes().size())
                .withDetail("region", region)
                .build();

        } catch (SdkException e) {
            return Health.down(e)
                .withDetail("error", "DynamoDB connection failed")
                .build();
        }
    }
}
