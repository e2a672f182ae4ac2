package com.campusevents.model;

import com.campusevents.util.InstantAsLongAttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.*;

import java.time.Instant;

/**
 * Base class for all items stored in the CampusTable.
 * Provides the key attributes shared by the single-table design.
 */
@DynamoDbBean
public abstract class BaseItem {

    public static final String LOOKUP_INDEX = "LookupIndex";
    public static final String ID_INDEX = "IdIndex";

    private String pk;          // Partition Key
    private String sk;          // Sort Key
    private String gsi1pk;      // LookupIndex partition: owner, organizer or event
    private String gsi1sk;      // LookupIndex sort
    private String gsi2pk;      // IdIndex partition (hash-only): the item's own id
    private String itemType;    // Type discriminator
    private Instant createdAt;
    private Instant updatedAt;

    public BaseItem() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @DynamoDbPartitionKey
    public String getPk() {
        return pk;
    }

    public void setPk(String pk) {
        this.pk = pk;
    }

    @DynamoDbSortKey
    public String getSk() {
        return sk;
    }

    public void setSk(String sk) {
        this.sk = sk;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = LOOKUP_INDEX)
    public String getGsi1pk() {
        return gsi1pk;
    }

    public void setGsi1pk(String gsi1pk) {
        this.gsi1pk = gsi1pk;
    }

    @DynamoDbSecondarySortKey(indexNames = LOOKUP_INDEX)
    public String getGsi1sk() {
        return gsi1sk;
    }

    public void setGsi1sk(String gsi1sk) {
        this.gsi1sk = gsi1sk;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = ID_INDEX)
    public String getGsi2pk() {
        return gsi2pk;
    }

    public void setGsi2pk(String gsi2pk) {
        this.gsi2pk = gsi2pk;
    }

    @DynamoDbAttribute("itemType")
    public String getItemType() {
        return itemType;
    }

    public void setItemType(String itemType) {
        this.itemType = itemType;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    /**
     * Stamp updatedAt before the item is written.
     */
    public void touch(Instant now) {
        this.updatedAt = now;
    }
}
