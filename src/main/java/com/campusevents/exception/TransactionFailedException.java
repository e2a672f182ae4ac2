package com.campusevents.exception;

/**
 * Exception thrown when an optimistic write could not be committed
 * after the maximum number of attempts.
 */
public class TransactionFailedException extends RuntimeException {

    public TransactionFailedException(String message) {
        super(message);
    }

    public TransactionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
