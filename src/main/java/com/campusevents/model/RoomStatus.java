package com.campusevents.model;

public enum RoomStatus {
    ENABLED,
    DISABLED,
    UNDER_MAINTENANCE
}
