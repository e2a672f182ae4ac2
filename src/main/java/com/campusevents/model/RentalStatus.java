package com.campusevents.model;

/**
 * Lifecycle of a room rental. REJECTED, CANCELLED and COMPLETED are terminal.
 */
public enum RentalStatus {
    PENDING,
    APPROVED,
    REJECTED,
    CANCELLED,
    COMPLETED;

    /**
     * Rentals in these states hold their time slot against new requests.
     */
    public boolean holdsSlot() {
        return this == PENDING || this == APPROVED;
    }
}
