package com.campusevents.dto;

import com.campusevents.model.Room;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Result of an administrative room disable.
 */
@Data
@AllArgsConstructor
public class RoomDisableSummary {
    private Room room;
    private List<String> rejectedRentalIds;        // PENDING rentals turned REJECTED
    private List<String> affectedApprovedRentalIds; // APPROVED rentals that have not ended
}
