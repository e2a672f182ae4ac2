package com.campusevents.repository;

import com.campusevents.config.CampusTables;
import com.campusevents.model.Event;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

import java.util.Optional;

@Repository
public class EventRepository {

    private final DynamoDbTable<Event> eventTable;

    @Autowired
    public EventRepository(DynamoDbEnhancedClient dynamoDbEnhancedClient) {
        this.eventTable = dynamoDbEnhancedClient.table(CampusTables.EVENTS_TABLE, TableSchema.fromBean(Event.class));
    }

    public Optional<Event> findById(String eventId) {
        Event event = eventTable.getItem(Key.builder().partitionValue(eventId).build());
        return Optional.ofNullable(event);
    }
}
