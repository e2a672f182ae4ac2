package com.campusevents.service;

import com.campusevents.dto.UserCarpools;
import com.campusevents.model.CarpoolOffer;
import com.campusevents.model.CarpoolPassenger;
import com.campusevents.model.Driver;
import com.campusevents.model.DriverStatus;
import com.campusevents.model.DriverType;
import com.campusevents.model.VehicleType;

import java.time.Instant;
import java.util.List;

/**
 * Driver registration, ride offers and seat bookkeeping.
 *
 * Every write keeps an offer's seatsAvailable equal to its capacity minus its
 * confirmed passengers, and flips the offer between ACTIVE and FULL as seats run
 * out or free up.
 */
public interface CarpoolService {

    /**
     * Register a user as a driver. New drivers wait for admin approval.
     */
    OperationResult<Driver> registerDriver(String userId, int capacity, VehicleType vehicleType, DriverType driverType,
                                           String licensePlate, String accessibilityFeatures);

    /**
     * Apply the non-null fields. Existing offers keep the capacity they were created with.
     */
    OperationResult<Driver> updateDriver(String driverId, Integer capacity, VehicleType vehicleType,
                                         String licensePlate, String accessibilityFeatures);

    OperationResult<CarpoolOffer> createOffer(String driverId, String eventId, String departureInfo,
                                              Instant departureTime, String departureAddress,
                                              Double latitude, Double longitude);

    /**
     * Active offers for an event, most free seats first.
     */
    List<CarpoolOffer> getEventOffers(String eventId);

    /**
     * Take a seat. Creates a confirmed passenger record and debits the offer in one transaction.
     */
    OperationResult<CarpoolPassenger> joinOffer(String offerId, String passengerId, String pickupLocation, String notes);

    OperationResult<CarpoolPassenger> leaveOffer(String offerId, String passengerId);

    /**
     * Driver-initiated cancel. Refused while any passenger is confirmed.
     */
    OperationResult<CarpoolOffer> cancelOffer(String offerId, String requesterId);

    OperationResult<CarpoolOffer> completeOffer(String offerId, String requesterId);

    UserCarpools getUserCarpools(String userId);

    // Admin operations

    OperationResult<Driver> approveDriver(String driverId);

    /**
     * Suspend a driver, record one audit flag and cancel every active offer,
     * passengers or not, in a single transaction.
     */
    OperationResult<Driver> suspendDriver(String driverId, String reason);

    OperationResult<Driver> unsuspendDriver(String driverId);

    List<Driver> getAllDrivers(DriverStatus status);

    /**
     * Drivers with any flagged or suspended audit entry.
     */
    List<Driver> getFlaggedDrivers();

    List<CarpoolPassenger> getAllPassengers(String eventId);

    /**
     * Move a passenger record to another offer for the same event. The target is
     * debited, the source is credited if the record held a confirmed seat, and the
     * record ends up confirmed, all in one transaction.
     */
    OperationResult<CarpoolPassenger> reassignPassenger(String passengerRecordId, String newOfferId);
}
