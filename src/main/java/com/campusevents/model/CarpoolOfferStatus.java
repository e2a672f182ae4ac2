package com.campusevents.model;

public enum CarpoolOfferStatus {
    ACTIVE,
    FULL,
    CANCELLED,
    COMPLETED;

    // ACTIVE and FULL offers still carry passengers
    public boolean isOpen() {
        return this == ACTIVE || this == FULL;
    }
}
