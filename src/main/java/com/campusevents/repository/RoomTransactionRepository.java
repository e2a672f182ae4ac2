package com.campusevents.repository;

import com.campusevents.model.Room;
import com.campusevents.model.RoomRental;

import java.util.List;

/**
 * Atomic writes for a room's booking set. Every write is conditioned on the
 * room version read by the caller and bumps it.
 *
 * Both methods throw VersionConflictException when the room changed underneath
 * the caller, and RepositoryException for other storage failures.
 */
public interface RoomTransactionRepository {

    /** One slot of DynamoDB's 100-action limit is taken by the room itself. */
    int MAX_RENTALS_PER_WRITE = 99;

    /**
     * Insert a new room at version 1.
     */
    void createRoom(Room room);

    /**
     * Save the room and the given rentals (new or changed) in one transaction.
     * At most {@link #MAX_RENTALS_PER_WRITE} rentals fit in a single call.
     */
    void saveRoomWithRentals(Room room, List<RoomRental> rentals);
}
