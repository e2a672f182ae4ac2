package com.campusevents.repository.impl;

import com.campusevents.exception.RepositoryException;
import com.campusevents.exception.VersionConflictException;
import com.campusevents.model.BaseItem;
import com.campusevents.model.Versioned;
import com.campusevents.util.QueryPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.CancellationReason;
import software.amazon.awssdk.services.dynamodb.model.Delete;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.Put;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItemsRequest;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the conditional TransactWriteItems used by the transaction repositories
 * and maps their failures onto repository exceptions.
 */
final class TransactionItems {

    private static final Logger logger = LoggerFactory.getLogger(TransactionItems.class);

    /** DynamoDB rejects transactions with more actions than this. */
    static final int MAX_TRANSACTION_ITEMS = 100;

    private static final String CONDITIONAL_CHECK_FAILED = "ConditionalCheckFailed";
    private static final String TRANSACTION_CONFLICT = "TransactionConflict";

    private TransactionItems() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Put an aggregate root only if its stored version still equals the one it
     * was read with. The item's version is bumped in place before it is mapped.
     */
    static <T extends BaseItem & Versioned> TransactWriteItem versionedPut(String tableName, TableSchema<T> schema,
                                                                         T item, Instant now) {
        if (item.getVersion() == null) {
            throw new IllegalArgumentException("Versioned put requires a persisted item: " + item.getPk());
        }
        long expectedVersion = item.getVersion();
        item.setVersion(expectedVersion + 1);
        item.touch(now);

        Map<String, AttributeValue> values = new HashMap<>();
        values.put(":expectedVersion", AttributeValue.builder().n(String.valueOf(expectedVersion)).build());

        return TransactWriteItem.builder()
                .put(Put.builder()
                        .tableName(tableName)
                        .item(schema.itemToMap(item, true))
                        .conditionExpression("#ver = :expectedVersion")
                        .expressionAttributeNames(Map.of("#ver", "version"))
                        .expressionAttributeValues(values)
                        .build())
                .build();
    }

    /**
     * Put an item that must not exist yet. Aggregate roots start at version 1.
     */
    static <T extends BaseItem> TransactWriteItem newItemPut(String tableName, TableSchema<T> schema, T item) {
        if (item instanceof Versioned) {
            ((Versioned) item).setVersion(1L);
        }
        return TransactWriteItem.builder()
                .put(Put.builder()
                        .tableName(tableName)
                        .item(schema.itemToMap(item, true))
                        .conditionExpression("attribute_not_exists(pk)")
                        .build())
                .build();
    }

    /**
     * Put a child item whose consistency is guarded by its aggregate's versioned put
     * in the same transaction.
     */
    static <T extends BaseItem> TransactWriteItem put(String tableName, TableSchema<T> schema, T item, Instant now) {
        item.touch(now);
        return TransactWriteItem.builder()
                .put(Put.builder()
                        .tableName(tableName)
                        .item(schema.itemToMap(item, true))
                        .build())
                .build();
    }

    static TransactWriteItem existingDelete(String tableName, BaseItem item) {
        Map<String, AttributeValue> key = new HashMap<>();
        key.put("pk", AttributeValue.builder().s(item.getPk()).build());
        key.put("sk", AttributeValue.builder().s(item.getSk()).build());

        return TransactWriteItem.builder()
                .delete(Delete.builder()
                        .tableName(tableName)
                        .key(key)
                        .conditionExpression("attribute_exists(pk)")
                        .build())
                .build();
    }

    /**
     * Commit the items as one transaction.
     *
     * @throws VersionConflictException when a condition failed or another transaction held an item
     * @throws RepositoryException for any other DynamoDB failure
     */
    static void execute(DynamoDbClient dynamoDbClient, QueryPerformanceTracker performanceTracker,
                        String tableName, String operation, List<TransactWriteItem> items) {
        if (items.size() > MAX_TRANSACTION_ITEMS) {
            throw new IllegalArgumentException("Transaction " + operation + " has " + items.size()
                    + " items; DynamoDB allows " + MAX_TRANSACTION_ITEMS);
        }
        try {
            performanceTracker.trackQuery(operation, tableName, () ->
                    dynamoDbClient.transactWriteItems(TransactWriteItemsRequest.builder()
                            .transactItems(items)
                            .build()));
        } catch (TransactionCanceledException e) {
            if (isRetryable(e)) {
                logger.debug("Transaction {} cancelled by a concurrent write: {}", operation, e.cancellationReasons());
                throw new VersionConflictException("Concurrent modification during " + operation, e);
            }
            logger.error("Transaction {} cancelled: {}", operation, e.cancellationReasons());
            throw new RepositoryException("Failed to " + operation + " atomically - transaction cancelled", e);
        } catch (DynamoDbException e) {
            logger.error("DynamoDB error during {}", operation, e);
            throw new RepositoryException("Failed to " + operation + " due to DynamoDB error", e);
        }
    }

    private static boolean isRetryable(TransactionCanceledException e) {
        if (!e.hasCancellationReasons()) {
            return false;
        }
        for (CancellationReason reason : e.cancellationReasons()) {
            if (CONDITIONAL_CHECK_FAILED.equals(reason.code()) || TRANSACTION_CONFLICT.equals(reason.code())) {
                return true;
            }
        }
        return false;
    }
}
