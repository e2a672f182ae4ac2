package com.campusevents.integration;

import com.campusevents.config.CampusTables;
import com.campusevents.model.Event;
import com.campusevents.model.User;
import com.campusevents.model.UserRole;
import org.junit.jupiter.api.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.localstack.LocalStackContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

import java.time.Instant;
import java.util.UUID;

import static org.testcontainers.containers.localstack.LocalStackContainer.Service.DYNAMODB;

/**
 * Base class for integration tests against LocalStack DynamoDB.
 * Tables are created by DynamoDBTableInitializer when the context starts.
 * Run with: mvn test -Dintegration.tests.excluded= -Dgroups=integration
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers
@Tag("integration")
public abstract class BaseIntegrationTest {

    @Container
    static LocalStackContainer localstack = new LocalStackContainer(DockerImageName.parse("localstack/localstack:3.0"))
            .withServices(DYNAMODB);

    @Autowired
    protected DynamoDbEnhancedClient dynamoDbEnhancedClient;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("aws.dynamodb.endpoint", () -> localstack.getEndpointOverride(DYNAMODB).toString());
        registry.add("aws.region", () -> localstack.getRegion());
    }

    protected String createUser(UserRole role) {
        User user = new User(UUID.randomUUID().toString(), role.name().toLowerCase() + " user", role);
        dynamoDbEnhancedClient.table(CampusTables.USERS_TABLE, TableSchema.fromBean(User.class)).putItem(user);
        return user.getId();
    }

    protected String createEvent(String title, Instant eventDate) {
        Event event = new Event(UUID.randomUUID().toString(), title, eventDate);
        dynamoDbEnhancedClient.table(CampusTables.EVENTS_TABLE, TableSchema.fromBean(Event.class)).putItem(event);
        return event.getId();
    }
}
