package com.campusevents.repository;

import com.campusevents.model.CarpoolOffer;
import com.campusevents.model.CarpoolPassenger;
import com.campusevents.model.Driver;
import com.campusevents.model.DriverClaim;

import java.util.List;

/**
 * Atomic writes for the carpool ledger. Drivers and offers are written under
 * their version; passenger records ride along with their offer's versioned put.
 *
 * Every method throws VersionConflictException when a guarded item changed
 * since it was read, and RepositoryException for other storage failures.
 */
public interface CarpoolTransactionRepository {

    /**
     * Insert a driver with the claim that reserves the user's single registration.
     */
    void createDriver(Driver driver, DriverClaim claim);

    /**
     * Save a driver and any of its offers in one transaction.
     */
    void saveDriverWithOffers(Driver driver, List<CarpoolOffer> offers);

    /**
     * Insert an offer, bumping the driver so concurrent creations and suspensions serialize.
     */
    void createOffer(Driver driver, CarpoolOffer offer);

    /**
     * Save an offer and the passenger records whose seats it accounts for.
     */
    void saveOfferWithPassengers(CarpoolOffer offer, List<CarpoolPassenger> passengers);

    /**
     * Move a passenger record between offers: delete it under its current key,
     * re-key it to the target offer, write it and save both offers.
     */
    void movePassenger(CarpoolPassenger passenger, CarpoolOffer source, CarpoolOffer target);
}
