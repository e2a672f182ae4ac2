package com.campusevents.repository;

import com.campusevents.config.CampusTables;
import com.campusevents.model.User;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

import java.util.Optional;

/**
 * Read access to the platform's Users table. Accounts are managed elsewhere.
 */
@Repository
public class UserRepository {

    private final DynamoDbTable<User> userTable;

    @Autowired
    public UserRepository(DynamoDbEnhancedClient dynamoDbEnhancedClient) {
        this.userTable = dynamoDbEnhancedClient.table(CampusTables.USERS_TABLE, TableSchema.fromBean(User.class));
    }

    public Optional<User> findById(String id) {
        User user = userTable.getItem(Key.builder().partitionValue(id).build());
        return Optional.ofNullable(user);
    }
}
