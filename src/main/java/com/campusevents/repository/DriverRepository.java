package com.campusevents.repository;

import com.campusevents.model.Driver;

import java.util.List;
import java.util.Optional;

public interface DriverRepository {

    Optional<Driver> findById(String driverId);

    /**
     * Follow the user's driver claim to their registration. Strongly consistent.
     */
    Optional<Driver> findByUserId(String userId);

    List<Driver> findAll();
}
