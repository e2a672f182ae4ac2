package com.campusevents.service.impl;

import com.campusevents.dto.UserCarpools;
import com.campusevents.exception.TransactionFailedException;
import com.campusevents.exception.VersionConflictException;
import com.campusevents.model.CarpoolOffer;
import com.campusevents.model.CarpoolOfferStatus;
import com.campusevents.model.CarpoolPassenger;
import com.campusevents.model.Driver;
import com.campusevents.model.DriverClaim;
import com.campusevents.model.DriverStatus;
import com.campusevents.model.DriverType;
import com.campusevents.model.PassengerStatus;
import com.campusevents.model.User;
import com.campusevents.model.UserRole;
import com.campusevents.model.VehicleType;
import com.campusevents.repository.CarpoolOfferRepository;
import com.campusevents.repository.CarpoolTransactionRepository;
import com.campusevents.repository.DriverRepository;
import com.campusevents.repository.EventRepository;
import com.campusevents.service.CarpoolService;
import com.campusevents.service.OperationResult;
import com.campusevents.service.UserService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Implementation of CarpoolService on the CampusTable.
 *
 * Seat counts change only inside versioned offer writes; offer creation and
 * suspension are serialized through the driver's version.
 */
@Service
public class CarpoolServiceImpl implements CarpoolService {

    private static final Logger logger = LoggerFactory.getLogger(CarpoolServiceImpl.class);
    private static final int MAX_RETRIES = 5;
    static final int MIN_CAPACITY = 1;
    static final int MAX_CAPACITY = 50;
    private static final DateTimeFormatter FLAG_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private final DriverRepository driverRepository;
    private final CarpoolOfferRepository offerRepository;
    private final CarpoolTransactionRepository transactionRepository;
    private final EventRepository eventRepository;
    private final UserService userService;
    private final Clock clock;

    @Autowired
    public CarpoolServiceImpl(DriverRepository driverRepository,
                              CarpoolOfferRepository offerRepository,
                              CarpoolTransactionRepository transactionRepository,
                              EventRepository eventRepository,
                              UserService userService,
                              Clock clock) {
        this.driverRepository = driverRepository;
        this.offerRepository = offerRepository;
        this.transactionRepository = transactionRepository;
        this.eventRepository = eventRepository;
        this.userService = userService;
        this.clock = clock;
    }

    // ===== Drivers =====

    @Override
    public OperationResult<Driver> registerDriver(String userId, int capacity, VehicleType vehicleType,
                                                  DriverType driverType, String licensePlate,
                                                  String accessibilityFeatures) {
        logger.info("User {} registering as {} driver with {} seats", userId, driverType, capacity);

        Optional<User> user = userService.getUserById(userId);
        if (user.isEmpty()) {
            return OperationResult.notFound("User not found");
        }

        return withRetries("register driver for user " + userId, () -> {
            if (driverRepository.findByUserId(userId).isPresent()) {
                return OperationResult.conflict("User is already registered as a driver");
            }
            if (driverType == DriverType.STUDENT && user.get().getRole() != UserRole.STUDENT) {
                return OperationResult.validationError("Only students can register as student drivers");
            }
            if (driverType == DriverType.ORGANIZER && user.get().getRole() != UserRole.ORGANIZER) {
                return OperationResult.validationError("Only organizers can register as organizer drivers");
            }
            if (!capacityInRange(capacity)) {
                return OperationResult.validationError("Capacity must be between 1 and 50");
            }

            Driver driver = new Driver(UUID.randomUUID().toString(), userId, capacity, vehicleType, driverType);
            driver.setLicensePlate(licensePlate);
            driver.setAccessibilityFeatures(accessibilityFeatures != null ? accessibilityFeatures : "");

            // The claim's attribute_not_exists condition loses a concurrent registration; the retry reports it
            transactionRepository.createDriver(driver, new DriverClaim(userId, driver.getDriverId()));
            logger.info("Registered driver {} for user {}", driver.getDriverId(), userId);
            return OperationResult.success("Driver registration successful. Pending admin approval.", driver);
        });
    }

    @Override
    public OperationResult<Driver> updateDriver(String driverId, Integer capacity, VehicleType vehicleType,
                                                String licensePlate, String accessibilityFeatures) {
        logger.info("Updating driver {}", driverId);

        return withRetries("update driver " + driverId, () -> {
            Optional<Driver> found = driverRepository.findById(driverId);
            if (found.isEmpty()) {
                return OperationResult.notFound("Driver not found");
            }
            Driver driver = found.get();
            if (capacity != null) {
                if (!capacityInRange(capacity)) {
                    return OperationResult.validationError("Capacity must be between 1 and 50");
                }
                driver.setCapacity(capacity);
            }
            if (vehicleType != null) driver.setVehicleType(vehicleType);
            if (licensePlate != null) driver.setLicensePlate(licensePlate);
            if (accessibilityFeatures != null) driver.setAccessibilityFeatures(accessibilityFeatures);

            transactionRepository.saveDriverWithOffers(driver, List.of());
            return OperationResult.success("Driver profile updated successfully", driver);
        });
    }

    // ===== Offers =====

    @Override
    public OperationResult<CarpoolOffer> createOffer(String driverId, String eventId, String departureInfo,
                                                     Instant departureTime, String departureAddress,
                                                     Double latitude, Double longitude) {
        logger.info("Driver {} creating offer for event {}", driverId, eventId);

        OperationResult<CarpoolOffer> result = withRetries("create offer for driver " + driverId, () -> {
            Optional<Driver> found = driverRepository.findById(driverId);
            if (found.isEmpty()) {
                return OperationResult.notFound("Driver not found");
            }
            Driver driver = found.get();
            if (driver.getStatus() != DriverStatus.ACTIVE) {
                return OperationResult.unauthorized("Driver account is not active. Contact administrator.");
            }
            if (eventRepository.findById(eventId).isEmpty()) {
                return OperationResult.notFound("Event not found");
            }
            boolean hasOpenOffer = offerRepository.findByDriver(driverId).stream()
                    .anyMatch(offer -> offer.getEventId().equals(eventId) && offer.getStatus().isOpen());
            if (hasOpenOffer) {
                return OperationResult.conflict("You already have an active offer for this event");
            }

            CarpoolOffer offer = new CarpoolOffer(UUID.randomUUID().toString(), driverId, driver.getUserId(),
                    eventId, driver.getCapacity());
            offer.setDepartureInfo(departureInfo);
            offer.setDepartureTime(departureTime);
            offer.setDepartureAddress(departureAddress);
            offer.setLatitude(latitude);
            offer.setLongitude(longitude);

            transactionRepository.createOffer(driver, offer);
            return OperationResult.success("Carpool offer created successfully", offer);
        });

        if (result.isSuccess()) {
            logger.info("Created offer {} with {} seats for event {}",
                    result.getData().getOfferId(), result.getData().getCapacity(), eventId);
        }
        return result;
    }

    @Override
    public List<CarpoolOffer> getEventOffers(String eventId) {
        logger.debug("Getting active offers for event {}", eventId);
        return offerRepository.findByEvent(eventId).stream()
                .filter(offer -> offer.getStatus() == CarpoolOfferStatus.ACTIVE)
                .sorted(Comparator.comparing(CarpoolOffer::getSeatsAvailable).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public OperationResult<CarpoolPassenger> joinOffer(String offerId, String passengerId, String pickupLocation,
                                                       String notes) {
        logger.info("User {} joining offer {}", passengerId, offerId);

        OperationResult<CarpoolPassenger> result = withRetries("join offer " + offerId, () -> {
            Optional<CarpoolOffer> found = offerRepository.findById(offerId);
            if (found.isEmpty()) {
                return OperationResult.notFound("Carpool offer not found");
            }
            CarpoolOffer offer = found.get();
            if (offer.getStatus() != CarpoolOfferStatus.ACTIVE) {
                return OperationResult.validationError("This carpool offer is no longer active");
            }
            if (offer.getSeatsAvailable() <= 0) {
                return OperationResult.conflict("No seats available");
            }
            if (offer.getDriverUserId().equals(passengerId)) {
                return OperationResult.validationError("You cannot join your own carpool offer");
            }
            boolean alreadyJoined = offerRepository.findPassengers(offer.getDriverId(), offerId).stream()
                    .anyMatch(p -> p.getPassengerId().equals(passengerId) && p.getStatus() != PassengerStatus.CANCELLED);
            if (alreadyJoined) {
                return OperationResult.conflict("You have already joined this carpool");
            }

            CarpoolPassenger passenger = new CarpoolPassenger(UUID.randomUUID().toString(), offer, passengerId,
                    clock.instant());
            passenger.setPickupLocation(pickupLocation);
            passenger.setNotes(notes);
            offer.takeSeat();

            transactionRepository.saveOfferWithPassengers(offer, List.of(passenger));
            return OperationResult.success("Successfully joined carpool", passenger);
        });

        if (result.isSuccess()) {
            logger.info("User {} joined offer {}", passengerId, offerId);
        }
        return result;
    }

    @Override
    public OperationResult<CarpoolPassenger> leaveOffer(String offerId, String passengerId) {
        logger.info("User {} leaving offer {}", passengerId, offerId);

        return withRetries("leave offer " + offerId, () -> {
            Optional<CarpoolOffer> found = offerRepository.findById(offerId);
            if (found.isEmpty()) {
                return OperationResult.notFound("Carpool offer not found");
            }
            CarpoolOffer offer = found.get();
            Optional<CarpoolPassenger> record = offerRepository.findPassengers(offer.getDriverId(), offerId).stream()
                    .filter(p -> p.getPassengerId().equals(passengerId) && p.getStatus() == PassengerStatus.CONFIRMED)
                    .findFirst();
            if (record.isEmpty()) {
                return OperationResult.notFound("You are not part of this carpool");
            }

            CarpoolPassenger passenger = record.get();
            passenger.setStatus(PassengerStatus.CANCELLED);
            offer.releaseSeat();

            transactionRepository.saveOfferWithPassengers(offer, List.of(passenger));
            return OperationResult.success("Successfully left carpool", passenger);
        });
    }

    @Override
    public OperationResult<CarpoolOffer> cancelOffer(String offerId, String requesterId) {
        logger.info("User {} cancelling offer {}", requesterId, offerId);

        return withRetries("cancel offer " + offerId, () -> {
            Optional<CarpoolOffer> found = offerRepository.findById(offerId);
            if (found.isEmpty()) {
                return OperationResult.notFound("Carpool offer not found");
            }
            CarpoolOffer offer = found.get();
            if (!offer.getDriverUserId().equals(requesterId)) {
                return OperationResult.unauthorized("Only the driver can cancel this offer");
            }
            if (!offer.getStatus().isOpen()) {
                return OperationResult.validationError("This carpool offer is no longer active");
            }
            long confirmed = offerRepository.findPassengers(offer.getDriverId(), offerId).stream()
                    .filter(p -> p.getStatus() == PassengerStatus.CONFIRMED)
                    .count();
            if (confirmed > 0) {
                return OperationResult.conflict(String.format(
                        "Cannot cancel: %d passengers have confirmed. Please contact them first.", confirmed));
            }

            offer.setStatus(CarpoolOfferStatus.CANCELLED);
            transactionRepository.saveOfferWithPassengers(offer, List.of());
            return OperationResult.success("Carpool offer cancelled successfully", offer);
        });
    }

    @Override
    public OperationResult<CarpoolOffer> completeOffer(String offerId, String requesterId) {
        logger.info("User {} completing offer {}", requesterId, offerId);

        return withRetries("complete offer " + offerId, () -> {
            Optional<CarpoolOffer> found = offerRepository.findById(offerId);
            if (found.isEmpty()) {
                return OperationResult.notFound("Carpool offer not found");
            }
            CarpoolOffer offer = found.get();
            if (!offer.getDriverUserId().equals(requesterId)) {
                return OperationResult.unauthorized("Only the driver can complete this offer");
            }
            if (!offer.getStatus().isOpen()) {
                return OperationResult.validationError("This carpool offer is no longer active");
            }

            offer.setStatus(CarpoolOfferStatus.COMPLETED);
            transactionRepository.saveOfferWithPassengers(offer, List.of());
            return OperationResult.success("Carpool offer completed", offer);
        });
    }

    @Override
    public UserCarpools getUserCarpools(String userId) {
        logger.debug("Getting carpools for user {}", userId);

        List<CarpoolOffer> asDriver = driverRepository.findByUserId(userId)
                .map(driver -> offerRepository.findByDriver(driver.getDriverId()))
                .orElseGet(List::of).stream()
                .sorted(Comparator.comparing(CarpoolOffer::getCreatedAt).reversed())
                .collect(Collectors.toList());

        List<CarpoolPassenger> rides = offerRepository.findPassengersByUser(userId).stream()
                .filter(p -> p.getStatus() != PassengerStatus.CANCELLED)
                .sorted(Comparator.comparing(CarpoolPassenger::getJoinedAt).reversed())
                .collect(Collectors.toList());

        return new UserCarpools(asDriver, rides);
    }

    // ===== Admin =====

    @Override
    public OperationResult<Driver> approveDriver(String driverId) {
        logger.info("Admin approving driver {}", driverId);
        return setDriverStatus(driverId, DriverStatus.ACTIVE, "Driver approved successfully");
    }

    @Override
    public OperationResult<Driver> suspendDriver(String driverId, String reason) {
        logger.info("Admin suspending driver {}: {}", driverId, reason);

        OperationResult<Driver> result = withRetries("suspend driver " + driverId, () -> {
            Optional<Driver> found = driverRepository.findById(driverId);
            if (found.isEmpty()) {
                return OperationResult.notFound("Driver not found");
            }
            Driver driver = found.get();
            driver.setStatus(DriverStatus.SUSPENDED);
            driver.addSecurityFlag("suspended:" + FLAG_DATE.format(clock.instant()) + ":" + reason);

            List<CarpoolOffer> cancelled = new ArrayList<>();
            for (CarpoolOffer offer : offerRepository.findByDriver(driverId)) {
                if (offer.getStatus() == CarpoolOfferStatus.ACTIVE) {
                    offer.setStatus(CarpoolOfferStatus.CANCELLED);
                    cancelled.add(offer);
                }
            }

            transactionRepository.saveDriverWithOffers(driver, cancelled);
            logger.info("Suspended driver {} and cancelled {} active offers", driverId, cancelled.size());
            return OperationResult.success("Driver suspended successfully", driver);
        });

        if (!result.isSuccess()) {
            logger.warn("Could not suspend driver {}: {}", driverId, result.getMessage());
        }
        return result;
    }

    @Override
    public OperationResult<Driver> unsuspendDriver(String driverId) {
        logger.info("Admin unsuspending driver {}", driverId);
        return setDriverStatus(driverId, DriverStatus.ACTIVE, "Driver unsuspended successfully");
    }

    @Override
    public List<Driver> getAllDrivers(DriverStatus status) {
        return driverRepository.findAll().stream()
                .filter(driver -> status == null || driver.getStatus() == status)
                .sorted(Comparator.comparing(Driver::getCreatedAt).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public List<Driver> getFlaggedDrivers() {
        return driverRepository.findAll().stream()
                .filter(driver -> driver.getSecurityFlags() != null && driver.getSecurityFlags().stream()
                        .anyMatch(flag -> flag.contains("flagged") || flag.contains("suspended")))
                .sorted(Comparator.comparing(Driver::getCreatedAt).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public List<CarpoolPassenger> getAllPassengers(String eventId) {
        List<CarpoolPassenger> passengers;
        if (eventId == null) {
            passengers = offerRepository.findAllPassengers();
        } else {
            passengers = offerRepository.findByEvent(eventId).stream()
                    .flatMap(offer -> offerRepository.findPassengers(offer.getDriverId(), offer.getOfferId()).stream())
                    .collect(Collectors.toList());
        }
        return passengers.stream()
                .sorted(Comparator.comparing(CarpoolPassenger::getJoinedAt).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public OperationResult<CarpoolPassenger> reassignPassenger(String passengerRecordId, String newOfferId) {
        logger.info("Admin reassigning passenger record {} to offer {}", passengerRecordId, newOfferId);

        return withRetries("reassign passenger " + passengerRecordId, () -> {
            Optional<CarpoolPassenger> record = offerRepository.findPassengerById(passengerRecordId);
            if (record.isEmpty()) {
                return OperationResult.notFound("Passenger record not found");
            }
            CarpoolPassenger passenger = record.get();

            Optional<CarpoolOffer> targetFound = offerRepository.findById(newOfferId);
            if (targetFound.isEmpty()) {
                return OperationResult.notFound("Target carpool offer not found");
            }
            CarpoolOffer target = targetFound.get();
            if (target.getOfferId().equals(passenger.getOfferId())) {
                return OperationResult.validationError("Passenger is already assigned to this carpool offer");
            }
            if (!target.getEventId().equals(passenger.getEventId())) {
                return OperationResult.validationError("Cannot reassign passenger to a carpool for a different event");
            }
            if (target.getSeatsAvailable() <= 0) {
                return OperationResult.conflict("Target carpool offer is full");
            }
            if (!target.getStatus().isOpen()) {
                return OperationResult.validationError("Target carpool offer is not active");
            }
            if (target.getDriverUserId().equals(passenger.getPassengerId())) {
                return OperationResult.validationError("Cannot reassign a driver into their own carpool offer");
            }
            boolean alreadyOnTarget = offerRepository.findPassengers(target.getDriverId(), newOfferId).stream()
                    .anyMatch(p -> p.getPassengerId().equals(passenger.getPassengerId())
                            && p.getStatus() != PassengerStatus.CANCELLED);
            if (alreadyOnTarget) {
                return OperationResult.conflict("Passenger is already part of the target carpool");
            }

            Optional<CarpoolOffer> sourceFound = offerRepository.findById(passenger.getOfferId());
            if (sourceFound.isEmpty()) {
                return OperationResult.notFound("Carpool offer not found");
            }
            CarpoolOffer source = sourceFound.get();

            // Only a confirmed record holds a seat on its current offer
            if (passenger.getStatus() == PassengerStatus.CONFIRMED) {
                source.releaseSeat();
            }
            target.takeSeat();
            passenger.setStatus(PassengerStatus.CONFIRMED);

            transactionRepository.movePassenger(passenger, source, target);
            logger.info("Reassigned passenger record {} from offer {} to offer {}",
                    passengerRecordId, source.getOfferId(), newOfferId);
            return OperationResult.success("Passenger reassigned successfully to the new carpool", passenger);
        });
    }

    // ===== Helpers =====

    private OperationResult<Driver> setDriverStatus(String driverId, DriverStatus status, String message) {
        return withRetries("set driver " + driverId + " " + status, () -> {
            Optional<Driver> found = driverRepository.findById(driverId);
            if (found.isEmpty()) {
                return OperationResult.notFound("Driver not found");
            }
            Driver driver = found.get();
            driver.setStatus(status);
            transactionRepository.saveDriverWithOffers(driver, List.of());
            return OperationResult.success(message, driver);
        });
    }

    private <T> OperationResult<T> withRetries(String operation, Supplier<OperationResult<T>> attempt) {
        for (int i = 1; i <= MAX_RETRIES; i++) {
            try {
                return attempt.get();
            } catch (VersionConflictException e) {
                logger.debug("Version conflict during {} (attempt {}/{})", operation, i, MAX_RETRIES);
            }
        }
        logger.warn("Max retries exceeded for {} after {} attempts", operation, MAX_RETRIES);
        throw new TransactionFailedException("Failed to " + operation + " after " + MAX_RETRIES
                + " attempts due to concurrent modifications");
    }

    private static boolean capacityInRange(int capacity) {
        return capacity >= MIN_CAPACITY && capacity <= MAX_CAPACITY;
    }
}
