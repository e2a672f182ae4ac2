package com.campusevents.config;

/**
 * DynamoDB table names. Rooms, rentals and the carpool ledger share
 * {@link #CAMPUS_TABLE}; users and events are owned elsewhere and only read here.
 */
public final class CampusTables {

    public static final String CAMPUS_TABLE = "CampusTable";
    public static final String USERS_TABLE = "Users";
    public static final String EVENTS_TABLE = "Events";

    private CampusTables() {
        throw new UnsupportedOperationException("Utility class");
    }
}
