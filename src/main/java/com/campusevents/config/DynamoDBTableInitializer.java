package com.campusevents.config;

import com.campusevents.model.BaseItem;
import com.campusevents.model.Event;
import com.campusevents.model.Room;
import com.campusevents.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.CreateTableEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.EnhancedGlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.model.Projection;
import software.amazon.awssdk.services.dynamodb.model.ProjectionType;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughput;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;

/**
 * Creates the CampusTable and the read-only collaborator tables on startup
 * when they are missing. Disable with dynamodb.table.init.enabled=false.
 */
@Component
@ConditionalOnProperty(name = "dynamodb.table.init.enabled", havingValue = "true", matchIfMissing = true)
public class DynamoDBTableInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDBTableInitializer.class);

    private final DynamoDbEnhancedClient dynamoDbEnhancedClient;

    @Autowired
    public DynamoDBTableInitializer(DynamoDbEnhancedClient dynamoDbEnhancedClient) {
        this.dynamoDbEnhancedClient = dynamoDbEnhancedClient;
    }

    @Override
    public void run(ApplicationArguments args) {
        createTableIfNotExists(CampusTables.USERS_TABLE, TableSchema.fromBean(User.class));
        createTableIfNotExists(CampusTables.EVENTS_TABLE, TableSchema.fromBean(Event.class));

        // Any concrete BaseItem carries the full key and index layout
        createTableIfNotExists(CampusTables.CAMPUS_TABLE, TableSchema.fromBean(Room.class));
    }

    <T> void createTableIfNotExists(String tableName, TableSchema<T> schema) {
        DynamoDbTable<T> table = dynamoDbEnhancedClient.table(tableName, schema);
        try {
            table.describeTable();
            logger.info("Table {} already exists", tableName);
        } catch (ResourceNotFoundException e) {
            logger.info("Creating table: {}", tableName);
            table.createTable(buildCreateRequest(tableName));
            logger.info("Table {} created successfully", tableName);
        }
    }

    CreateTableEnhancedRequest buildCreateRequest(String tableName) {
        CreateTableEnhancedRequest.Builder requestBuilder = CreateTableEnhancedRequest.builder()
            .provisionedThroughput(throughput());

        if (CampusTables.CAMPUS_TABLE.equals(tableName)) {
            requestBuilder.globalSecondaryIndices(
                createGSI(BaseItem.LOOKUP_INDEX),
                createGSI(BaseItem.ID_INDEX)
            );
        }
        return requestBuilder.build();
    }

    private EnhancedGlobalSecondaryIndex createGSI(String indexName) {
        return EnhancedGlobalSecondaryIndex.builder()
            .indexName(indexName)
            .provisionedThroughput(throughput())
            .projection(Projection.builder()
                .projectionType(ProjectionType.ALL)
                .build())
            .build();
    }

    private ProvisionedThroughput throughput() {
        return ProvisionedThroughput.builder()
            .readCapacityUnits(5L)
            .writeCapacityUnits(5L)
            .build();
    }
}
