package com.campusevents.service;

/**
 * Outcome of a booking or carpool operation. Business-rule failures are
 * reported here instead of being thrown.
 */
public class OperationResult<T> {

    public enum Outcome {
        SUCCESS,
        VALIDATION_ERROR,
        NOT_FOUND,
        CONFLICT,
        UNAUTHORIZED
    }

    private final Outcome outcome;
    private final String message;
    private final T data;

    private OperationResult(Outcome outcome, String message, T data) {
        this.outcome = outcome;
        this.message = message;
        this.data = data;
    }

    public static <T> OperationResult<T> success(String message, T data) {
        return new OperationResult<>(Outcome.SUCCESS, message, data);
    }

    public static <T> OperationResult<T> validationError(String message) {
        return new OperationResult<>(Outcome.VALIDATION_ERROR, message, null);
    }

    public static <T> OperationResult<T> notFound(String message) {
        return new OperationResult<>(Outcome.NOT_FOUND, message, null);
    }

    public static <T> OperationResult<T> conflict(String message) {
        return new OperationResult<>(Outcome.CONFLICT, message, null);
    }

    public static <T> OperationResult<T> unauthorized(String message) {
        return new OperationResult<>(Outcome.UNAUTHORIZED, message, null);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public String getMessage() {
        return message;
    }

    public T getData() {
        return data;
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    @Override
    public String toString() {
        return "OperationResult{" + outcome + ": " + message + "}";
    }
}
