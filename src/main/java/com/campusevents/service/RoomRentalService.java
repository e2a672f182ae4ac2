package com.campusevents.service;

import com.campusevents.dto.RoomDetails;
import com.campusevents.dto.RoomDisableSummary;
import com.campusevents.model.RentalStatus;
import com.campusevents.model.Room;
import com.campusevents.model.RoomRental;
import com.campusevents.model.RoomStatus;

import java.time.Instant;
import java.util.List;

/**
 * Rooms and their rental requests.
 *
 * Rental writes are validated against a consistent read of the room's booking
 * set and committed under the room's version, so two requests for the same
 * slot cannot both pass their overlap check.
 */
public interface RoomRentalService {

    // Rooms

    OperationResult<Room> createRoom(String organizerId, RoomDetails details);

    /**
     * Apply the non-null fields of details. Only the room's organizer may update it.
     */
    OperationResult<Room> updateRoom(String roomId, String userId, RoomDetails details);

    /**
     * Browse rooms ordered by name. The window filter applies only when both bounds are given.
     */
    List<Room> getRooms(boolean onlyEnabled, Integer minCapacity, Instant availableFrom, Instant availableTo);

    List<Room> getOrganizerRooms(String organizerId);

    /**
     * Admin listing, most recent first. A null status returns every room.
     */
    List<Room> getAllRooms(RoomStatus status);

    OperationResult<Room> enableRoom(String roomId);

    /**
     * Disable a room and reject every pending rental on it. Approved rentals stay
     * approved; renters of those that have not ended are reported to the
     * notification service.
     */
    OperationResult<RoomDisableSummary> disableRoom(String roomId, String reason);

    // Rentals

    /**
     * Request a room for [startTime, endTime). Checks run in order and the first
     * failure is returned: room exists, room enabled, end after start, start in
     * the future, inside the availability window, attendees within capacity, no
     * pending or approved rental overlapping the slot.
     */
    OperationResult<RoomRental> requestRental(String roomId, String renterId, Instant startTime, Instant endTime,
                                              String purpose, Integer expectedAttendees);

    /**
     * Approve a pending rental. Room status and overlap with approved rentals are
     * re-checked against current state; the first approval of a contested slot wins.
     */
    OperationResult<RoomRental> approveRental(String rentalId, String approverId, boolean isAdmin);

    OperationResult<RoomRental> rejectRental(String rentalId, String rejecterId, String adminNotes, boolean isAdmin);

    /**
     * Renter-initiated cancel of a pending or approved rental.
     */
    OperationResult<RoomRental> cancelRental(String rentalId, String userId);

    OperationResult<RoomRental> adminCancelRental(String rentalId, String reason);

    OperationResult<RoomRental> completeRental(String rentalId, String approverId, boolean isAdmin);

    /**
     * Enabled rooms that fit the slot's window and capacity and have no pending or
     * approved rental overlapping it.
     */
    List<Room> getAvailableRooms(Instant startTime, Instant endTime, Integer minCapacity);

    List<RoomRental> getUserRentals(String userId);

    List<RoomRental> getPendingRentalsForOrganizer(String organizerId);

    List<RoomRental> getAllRentals(RentalStatus status);
}
