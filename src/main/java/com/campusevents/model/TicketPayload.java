package com.campusevents.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Claims carried inside a signed ticket token. Never persisted.
 */
@Getter
@ToString
@AllArgsConstructor
public class TicketPayload {
    private final int version;
    private final String eventId;
    private final String ticketId;
    private final String uniqueCode;
    private final Instant expiry;
}
