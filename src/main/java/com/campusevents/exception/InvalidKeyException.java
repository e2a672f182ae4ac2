package com.campusevents.exception;

/**
 * Exception thrown when DynamoDB key validation fails.
 * Used by CampusKeyFactory to reject malformed ids before they reach a key.
 */
public class InvalidKeyException extends RuntimeException {

    public InvalidKeyException(String message) {
        super(message);
    }

    public InvalidKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
