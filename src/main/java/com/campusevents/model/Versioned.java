package com.campusevents.model;

/**
 * An aggregate root whose version attribute guards a set of related items.
 * Transaction repositories condition every write on the version read and
 * bump it in the same request. {@code TransactionItems.versionedPut} owns the
 * counter; the enhanced client's versioning extension is not used.
 */
public interface Versioned {

    Long getVersion();

    void setVersion(Long version);
}
