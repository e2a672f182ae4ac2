package com.campusevents.util;

import com.campusevents.exception.InvalidKeyException;
import java.util.regex.Pattern;

/**
 * Type-safe key factory for DynamoDB single-table design.
 * Provides validated key generation for the CampusTable with consistent patterns.
 */
public final class CampusKeyFactory {
    private static final String DELIMITER = "#";
    private static final Pattern UUID_PATTERN = Pattern.compile(
        "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}",
        Pattern.CASE_INSENSITIVE
    );

    public static final String ROOM_PREFIX = "ROOM";
    public static final String RENTAL_PREFIX = "RENTAL";
    public static final String USER_PREFIX = "USER";
    public static final String EVENT_PREFIX = "EVENT";
    public static final String DRIVER_PREFIX = "DRIVER";
    public static final String OFFER_PREFIX = "OFFER";
    public static final String PASSENGER_PREFIX = "PASSENGER";
    public static final String METADATA_SUFFIX = "METADATA";
    public static final String DRIVER_CLAIM_SUFFIX = "DRIVER";

    // Item type discriminators
    public static final String ROOM_TYPE = "ROOM";
    public static final String RENTAL_TYPE = "RENTAL";
    public static final String DRIVER_TYPE = "DRIVER";
    public static final String DRIVER_CLAIM_TYPE = "DRIVER_CLAIM";
    public static final String OFFER_TYPE = "CARPOOL_OFFER";
    public static final String PASSENGER_TYPE = "CARPOOL_PASSENGER";

    private CampusKeyFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    private static void validateId(String id, String type) {
        if (id == null || id.trim().isEmpty()) {
            throw new InvalidKeyException(type + " ID cannot be null or empty");
        }
        if (!UUID_PATTERN.matcher(id).matches()) {
            throw new InvalidKeyException("Invalid " + type + " ID format: " + id);
        }
    }

    public static String getMetadataSk() {
        return METADATA_SUFFIX;
    }

    // Room Keys
    public static String getRoomPk(String roomId) {
        validateId(roomId, "Room");
        return ROOM_PREFIX + DELIMITER + roomId;
    }

    public static String getRoomGsi1Sk(String roomId) {
        validateId(roomId, "Room");
        return ROOM_PREFIX + DELIMITER + roomId;
    }

    public static String getRentalSk(String rentalId) {
        validateId(rentalId, "Rental");
        return RENTAL_PREFIX + DELIMITER + rentalId;
    }

    public static String getRentalGsi2Pk(String rentalId) {
        validateId(rentalId, "Rental");
        return RENTAL_PREFIX + DELIMITER + rentalId;
    }

    public static String getRentalQueryPrefix() {
        return RENTAL_PREFIX + DELIMITER;
    }

    // Carpool Keys
    public static String getDriverPk(String driverId) {
        validateId(driverId, "Driver");
        return DRIVER_PREFIX + DELIMITER + driverId;
    }

    public static String getDriverClaimSk() {
        return DRIVER_CLAIM_SUFFIX;
    }

    public static String getOfferSk(String offerId) {
        validateId(offerId, "Offer");
        return OFFER_PREFIX + DELIMITER + offerId;
    }

    public static String getOfferGsi2Pk(String offerId) {
        validateId(offerId, "Offer");
        return OFFER_PREFIX + DELIMITER + offerId;
    }

    public static String getOfferQueryPrefix() {
        return OFFER_PREFIX + DELIMITER;
    }

    public static String getPassengerSk(String offerId, String recordId) {
        validateId(offerId, "Offer");
        validateId(recordId, "Passenger");
        return String.join(DELIMITER, OFFER_PREFIX, offerId, PASSENGER_PREFIX, recordId);
    }

    public static String getPassengerQueryPrefix(String offerId) {
        validateId(offerId, "Offer");
        return String.join(DELIMITER, OFFER_PREFIX, offerId, PASSENGER_PREFIX) + DELIMITER;
    }

    public static String getPassengerGsi1Sk(String recordId) {
        validateId(recordId, "Passenger");
        return PASSENGER_PREFIX + DELIMITER + recordId;
    }

    public static String getPassengerGsi2Pk(String recordId) {
        validateId(recordId, "Passenger");
        return PASSENGER_PREFIX + DELIMITER + recordId;
    }

    // GSI Keys
    public static String getUserPk(String userId) {
        validateId(userId, "User");
        return USER_PREFIX + DELIMITER + userId;
    }

    public static String getUserGsi1Pk(String userId) {
        validateId(userId, "User");
        return USER_PREFIX + DELIMITER + userId;
    }

    public static String getEventGsi1Pk(String eventId) {
        validateId(eventId, "Event");
        return EVENT_PREFIX + DELIMITER + eventId;
    }

    // Helper methods for type-safe filtering
    public static boolean isMetadata(String sortKey) {
        return METADATA_SUFFIX.equals(sortKey);
    }

    public static boolean isRental(String sortKey) {
        return sortKey != null && sortKey.startsWith(RENTAL_PREFIX + DELIMITER);
    }

    public static boolean isOffer(String sortKey) {
        return sortKey != null && sortKey.startsWith(OFFER_PREFIX + DELIMITER)
                && !sortKey.contains(DELIMITER + PASSENGER_PREFIX + DELIMITER);
    }

    public static boolean isPassenger(String sortKey) {
        return sortKey != null && sortKey.contains(DELIMITER + PASSENGER_PREFIX + DELIMITER);
    }
}
