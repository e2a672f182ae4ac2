package com.campusevents.exception;

/**
 * Thrown by transaction repositories when a conditional write was cancelled
 * because the owning aggregate's version moved on since it was read.
 *
 * Services catch this inside their retry loops; it should rarely reach callers.
 */
public class VersionConflictException extends RuntimeException {

    public VersionConflictException(String message) {
        super(message);
    }

    public VersionConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
