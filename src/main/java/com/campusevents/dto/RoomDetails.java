package com.campusevents.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Organizer-editable room fields used by create and update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoomDetails {
    private String name;
    private String address;
    private String roomInfo;
    private Integer capacity;
    private String amenities;
    private BigDecimal hourlyRate;
    private Instant availabilityStart;
    private Instant availabilityEnd;
}
