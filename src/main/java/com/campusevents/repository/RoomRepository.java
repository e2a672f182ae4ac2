package com.campusevents.repository;

import com.campusevents.model.Room;
import com.campusevents.model.RoomRental;

import java.util.List;
import java.util.Optional;

/**
 * Reads for rooms and their rentals.
 *
 * findById, findRentalsByRoom and findRentalById are strongly consistent and
 * safe to validate writes against. Listings go through the LookupIndex or a
 * scan and may lag.
 */
public interface RoomRepository {

    Optional<Room> findById(String roomId);

    /**
     * All rentals of a room, whatever their status. Strongly consistent.
     */
    List<RoomRental> findRentalsByRoom(String roomId);

    /**
     * Locate a rental by its id, then read it consistently from the room partition.
     */
    Optional<RoomRental> findRentalById(String rentalId);

    List<Room> findByOrganizer(String organizerId);

    List<Room> findAll();

    List<RoomRental> findRentalsByRenter(String renterId);

    List<RoomRental> findAllRentals();
}
