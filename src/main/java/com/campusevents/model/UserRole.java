package com.campusevents.model;

public enum UserRole {
    STUDENT,
    ORGANIZER,
    ADMIN
}
