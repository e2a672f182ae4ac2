package com.campusevents.config;

import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

import java.net.URI;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class DynamoDBConfigTest {

    private static DynamoDBConfig config(String region, String endpoint) {
        DynamoDBConfig config = new DynamoDBConfig();
        ReflectionTestUtils.setField(config, "region", region);
        ReflectionTestUtils.setField(config, "endpoint", endpoint);
        ReflectionTestUtils.setField(config, "apiCallTimeout", Duration.ofSeconds(5));
        ReflectionTestUtils.setField(config, "apiCallAttemptTimeout", Duration.ofSeconds(2));
        return config;
    }

    @Test
    void dynamoDbClient_BoundsEveryCall() {
        try (DynamoDbClient client = config("eu-west-1", "").dynamoDbClient()) {
            var clientConfig = client.serviceClientConfiguration();

            assertThat(clientConfig.region()).isEqualTo(Region.EU_WEST_1);
            assertThat(clientConfig.overrideConfiguration().apiCallTimeout()).contains(Duration.ofSeconds(5));
            assertThat(clientConfig.overrideConfiguration().apiCallAttemptTimeout()).contains(Duration.ofSeconds(2));
            assertThat(clientConfig.endpointOverride()).isEmpty();
        }
    }

    @Test
    void dynamoDbClient_WithLocalEndpoint_OverridesEndpoint() {
        try (DynamoDbClient client = config("us-east-1", "http://localhost:4566").dynamoDbClient()) {
            assertThat(client.serviceClientConfiguration().endpointOverride())
                    .contains(URI.create("http://localhost:4566"));
        }
    }

    @Test
    void dynamoDbEnhancedClient_WrapsLowLevelClient() {
        DynamoDbEnhancedClient enhancedClient = config("us-east-1", "").dynamoDbEnhancedClient(mock(DynamoDbClient.class));

        assertThat(enhancedClient).isNotNull();
    }
}
