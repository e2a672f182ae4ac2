package com.campusevents.model;

public enum DriverStatus {
    PENDING,
    ACTIVE,
    SUSPENDED
}
