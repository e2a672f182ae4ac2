package com.campusevents.model;

public enum DriverType {
    STUDENT,
    ORGANIZER
}
