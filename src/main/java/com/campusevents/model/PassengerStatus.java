package com.campusevents.model;

public enum PassengerStatus {
    CONFIRMED,
    CANCELLED
}
