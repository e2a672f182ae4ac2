package com.campusevents.service;

import com.campusevents.model.TicketPayload;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

public class TicketValidationResult {
    public enum Status {
        VALID,
        MALFORMED,
        SIGNATURE_INVALID,
        UNSUPPORTED_VERSION,
        EXPIRED
    }

    private static final DateTimeFormatter EXPIRY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    private final Status status;
    private final String errorMessage;
    private final TicketPayload payload;

    private TicketValidationResult(Status status, String errorMessage, TicketPayload payload) {
        this.status = status;
        this.errorMessage = errorMessage;
        this.payload = payload;
    }

    public static TicketValidationResult valid(TicketPayload payload) {
        return new TicketValidationResult(Status.VALID, null, payload);
    }

    public static TicketValidationResult malformed() {
        return new TicketValidationResult(Status.MALFORMED, "Malformed token", null);
    }

    public static TicketValidationResult signatureInvalid() {
        return new TicketValidationResult(Status.SIGNATURE_INVALID,
                "Invalid signature - token may be forged or tampered", null);
    }

    public static TicketValidationResult unsupportedVersion(int version) {
        return new TicketValidationResult(Status.UNSUPPORTED_VERSION, "Unsupported token version: " + version, null);
    }

    public static TicketValidationResult expired(Instant expiry) {
        return new TicketValidationResult(Status.EXPIRED, "Token expired on " + EXPIRY_FORMAT.format(expiry) + " UTC", null);
    }

    public Status getStatus() {
        return status;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public TicketPayload getPayload() {
        return payload;
    }

    public boolean isValid() {
        return status == Status.VALID;
    }
}
