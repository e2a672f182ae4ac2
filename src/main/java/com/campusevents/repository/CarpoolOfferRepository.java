package com.campusevents.repository;

import com.campusevents.model.CarpoolOffer;
import com.campusevents.model.CarpoolPassenger;

import java.util.List;
import java.util.Optional;

/**
 * Reads for carpool offers and their passenger records.
 *
 * Lookups by id locate the item through the IdIndex and then read it
 * consistently from the driver partition. Event and user listings come from the
 * LookupIndex and may lag.
 */
public interface CarpoolOfferRepository {

    Optional<CarpoolOffer> findById(String offerId);

    /**
     * Every offer of a driver, whatever its status. Strongly consistent.
     */
    List<CarpoolOffer> findByDriver(String driverId);

    List<CarpoolOffer> findByEvent(String eventId);

    /**
     * Every passenger record of an offer, cancelled ones included. Strongly consistent.
     */
    List<CarpoolPassenger> findPassengers(String driverId, String offerId);

    Optional<CarpoolPassenger> findPassengerById(String passengerRecordId);

    List<CarpoolPassenger> findPassengersByUser(String userId);

    List<CarpoolPassenger> findAllPassengers();
}
