package com.campusevents.model;

public enum VehicleType {
    MINI,
    SEDAN,
    SUV,
    VAN,
    BUS
}
