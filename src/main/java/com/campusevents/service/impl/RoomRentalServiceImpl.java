package com.campusevents.service.impl;

import com.campusevents.dto.RoomDetails;
import com.campusevents.dto.RoomDisableSummary;
import com.campusevents.exception.TransactionFailedException;
import com.campusevents.exception.VersionConflictException;
import com.campusevents.model.RentalStatus;
import com.campusevents.model.Room;
import com.campusevents.model.RoomRental;
import com.campusevents.model.RoomStatus;
import com.campusevents.model.User;
import com.campusevents.model.UserRole;
import com.campusevents.repository.RoomRepository;
import com.campusevents.repository.RoomTransactionRepository;
import com.campusevents.service.BookingNotificationService;
import com.campusevents.service.OperationResult;
import com.campusevents.service.RoomRentalService;
import com.campusevents.service.UserService;
import com.campusevents.util.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Implementation of RoomRentalService on the CampusTable.
 */
@Service
public class RoomRentalServiceImpl implements RoomRentalService {

    private static final Logger logger = LoggerFactory.getLogger(RoomRentalServiceImpl.class);
    private static final int MAX_RETRIES = 5;
    private static final DateTimeFormatter WINDOW_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);
    private static final BigDecimal MILLIS_PER_HOUR = BigDecimal.valueOf(3_600_000L);

    private final RoomRepository roomRepository;
    private final RoomTransactionRepository transactionRepository;
    private final UserService userService;
    private final BookingNotificationService notificationService;
    private final Clock clock;

    @Autowired
    public RoomRentalServiceImpl(RoomRepository roomRepository,
                                 RoomTransactionRepository transactionRepository,
                                 UserService userService,
                                 BookingNotificationService notificationService,
                                 Clock clock) {
        this.roomRepository = roomRepository;
        this.transactionRepository = transactionRepository;
        this.userService = userService;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    // ===== Rooms =====

    @Override
    public OperationResult<Room> createRoom(String organizerId, RoomDetails details) {
        logger.info("User {} creating room '{}'", organizerId, details.getName());

        Optional<User> user = userService.getUserById(organizerId);
        if (user.isEmpty()) {
            return OperationResult.notFound("User not found");
        }
        if (user.get().getRole() != UserRole.ORGANIZER) {
            return OperationResult.unauthorized("Only organizers can create rooms");
        }
        if (details.getCapacity() == null || details.getCapacity() < 1) {
            return OperationResult.validationError("Capacity must be at least 1");
        }
        if (!windowIsOrdered(details.getAvailabilityStart(), details.getAvailabilityEnd())) {
            return OperationResult.validationError("Availability end time must be after start time");
        }

        Room room = new Room(UUID.randomUUID().toString(), organizerId, details.getName(), details.getCapacity());
        room.setAddress(details.getAddress());
        room.setRoomInfo(details.getRoomInfo());
        room.setAmenities(details.getAmenities() != null ? details.getAmenities() : "");
        room.setHourlyRate(details.getHourlyRate());
        room.setAvailabilityStart(details.getAvailabilityStart());
        room.setAvailabilityEnd(details.getAvailabilityEnd());

        transactionRepository.createRoom(room);
        logger.info("Created room {} for organizer {}", room.getRoomId(), organizerId);
        return OperationResult.success("Room created successfully", room);
    }

    @Override
    public OperationResult<Room> updateRoom(String roomId, String userId, RoomDetails details) {
        logger.info("User {} updating room {}", userId, roomId);

        return withRetries("update room " + roomId, () -> {
            Optional<Room> found = roomRepository.findById(roomId);
            if (found.isEmpty()) {
                return OperationResult.notFound("Room not found");
            }
            Room room = found.get();
            if (!room.getOrganizerId().equals(userId)) {
                return OperationResult.unauthorized("Only the room organizer can update this room");
            }
            if (details.getCapacity() != null && details.getCapacity() < 1) {
                return OperationResult.validationError("Capacity must be at least 1");
            }

            if (details.getName() != null) room.setName(details.getName());
            if (details.getAddress() != null) room.setAddress(details.getAddress());
            if (details.getCapacity() != null) room.setCapacity(details.getCapacity());
            if (details.getRoomInfo() != null) room.setRoomInfo(details.getRoomInfo());
            if (details.getAmenities() != null) room.setAmenities(details.getAmenities());
            if (details.getHourlyRate() != null) room.setHourlyRate(details.getHourlyRate());
            if (details.getAvailabilityStart() != null) room.setAvailabilityStart(details.getAvailabilityStart());
            if (details.getAvailabilityEnd() != null) room.setAvailabilityEnd(details.getAvailabilityEnd());

            if (!windowIsOrdered(room.getAvailabilityStart(), room.getAvailabilityEnd())) {
                return OperationResult.validationError("Availability end time must be after start time");
            }

            transactionRepository.saveRoomWithRentals(room, List.of());
            return OperationResult.success("Room updated successfully", room);
        });
    }

    @Override
    public List<Room> getRooms(boolean onlyEnabled, Integer minCapacity, Instant availableFrom, Instant availableTo) {
        logger.debug("Listing rooms: onlyEnabled={}, minCapacity={}, window={}..{}",
                onlyEnabled, minCapacity, availableFrom, availableTo);

        return roomRepository.findAll().stream()
                .filter(room -> !onlyEnabled || room.isEnabled())
                .filter(room -> minCapacity == null || room.getCapacity() >= minCapacity)
                .filter(room -> availableFrom == null || availableTo == null
                        || TimeRange.of(availableFrom, availableTo)
                                .within(room.getAvailabilityStart(), room.getAvailabilityEnd()))
                .sorted(Comparator.comparing(Room::getName, Comparator.nullsLast(String::compareToIgnoreCase)))
                .collect(Collectors.toList());
    }

    @Override
    public List<Room> getOrganizerRooms(String organizerId) {
        return roomRepository.findByOrganizer(organizerId).stream()
                .sorted(Comparator.comparing(Room::getCreatedAt).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public List<Room> getAllRooms(RoomStatus status) {
        return roomRepository.findAll().stream()
                .filter(room -> status == null || room.getStatus() == status)
                .sorted(Comparator.comparing(Room::getCreatedAt).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public OperationResult<Room> enableRoom(String roomId) {
        logger.info("Admin enabling room {}", roomId);

        return withRetries("enable room " + roomId, () -> {
            Optional<Room> found = roomRepository.findById(roomId);
            if (found.isEmpty()) {
                return OperationResult.notFound("Room not found");
            }
            Room room = found.get();
            room.setStatus(RoomStatus.ENABLED);
            transactionRepository.saveRoomWithRentals(room, List.of());
            return OperationResult.success("Room enabled successfully", room);
        });
    }

    @Override
    public OperationResult<RoomDisableSummary> disableRoom(String roomId, String reason) {
        logger.info("Admin disabling room {}: {}", roomId, reason);

        // Survives retries: chunks committed by an earlier attempt are no longer PENDING on re-read
        Set<String> rejectedIds = new LinkedHashSet<>();
        OperationResult<RoomDisableSummary> result = withRetries("disable room " + roomId, () -> {
            Optional<Room> found = roomRepository.findById(roomId);
            if (found.isEmpty()) {
                return OperationResult.notFound("Room not found");
            }
            Room room = found.get();
            List<RoomRental> rentals = roomRepository.findRentalsByRoom(roomId);
            Instant now = clock.instant();

            List<RoomRental> rejected = new ArrayList<>();
            List<String> affectedApproved = new ArrayList<>();
            for (RoomRental rental : rentals) {
                if (rental.getStatus() == RentalStatus.PENDING) {
                    rental.setStatus(RentalStatus.REJECTED);
                    rental.setAdminNotes("Room disabled by admin: " + reason);
                    rejected.add(rental);
                } else if (rental.getStatus() == RentalStatus.APPROVED && rental.getEndTime().isAfter(now)) {
                    affectedApproved.add(rental.getRentalId());
                }
            }

            room.setStatus(RoomStatus.DISABLED);
            saveInChunks(room, rejected, rejectedIds);

            return OperationResult.success("Room disabled successfully. All pending rentals have been rejected.",
                    new RoomDisableSummary(room, new ArrayList<>(rejectedIds), affectedApproved));
        });

        if (result.isSuccess()) {
            RoomDisableSummary summary = result.getData();
            logger.info("Room {} disabled; rejected {} pending rentals", roomId, summary.getRejectedRentalIds().size());
            for (String rentalId : summary.getRejectedRentalIds()) {
                notificationService.notifyRentalRejected(rentalId, "Room disabled by admin: " + reason);
            }
            notificationService.notifyRoomDisabled(roomId, summary.getAffectedApprovedRentalIds());
        }
        return result;
    }

    /**
     * The first chunk carries the status change; once the room is DISABLED no
     * request or approval can land, so later chunks only finish the rejections.
     * Ids of each committed chunk are added to {@code committed}.
     */
    private void saveInChunks(Room room, List<RoomRental> rentals, Set<String> committed) {
        int chunkSize = RoomTransactionRepository.MAX_RENTALS_PER_WRITE;
        if (rentals.size() <= chunkSize) {
            transactionRepository.saveRoomWithRentals(room, rentals);
            rentals.forEach(rental -> committed.add(rental.getRentalId()));
            return;
        }
        logger.warn("Room {} has {} pending rentals; rejecting them in chunks of {}",
                room.getRoomId(), rentals.size(), chunkSize);
        for (int from = 0; from < rentals.size(); from += chunkSize) {
            List<RoomRental> chunk = rentals.subList(from, Math.min(from + chunkSize, rentals.size()));
            transactionRepository.saveRoomWithRentals(room, chunk);
            chunk.forEach(rental -> committed.add(rental.getRentalId()));
        }
    }

    // ===== Rentals =====

    @Override
    public OperationResult<RoomRental> requestRental(String roomId, String renterId, Instant startTime, Instant endTime,
                                                     String purpose, Integer expectedAttendees) {
        logger.info("User {} requesting room {} for {} - {}", renterId, roomId, startTime, endTime);

        OperationResult<RoomRental> result = withRetries("request rental of room " + roomId, () -> {
            Optional<Room> found = roomRepository.findById(roomId);
            if (found.isEmpty()) {
                return OperationResult.notFound("Room not found");
            }
            Room room = found.get();
            if (!room.isEnabled()) {
                return OperationResult.validationError("Room is currently disabled");
            }
            if (startTime == null || endTime == null) {
                return OperationResult.validationError("Start time and end time are required");
            }
            if (!endTime.isAfter(startTime)) {
                return OperationResult.validationError("End time must be after start time");
            }
            if (!startTime.isAfter(clock.instant())) {
                return OperationResult.validationError("Cannot book time in the past");
            }
            if (room.getAvailabilityStart() != null && startTime.isBefore(room.getAvailabilityStart())) {
                return OperationResult.validationError(
                        "Room is not available before " + WINDOW_FORMAT.format(room.getAvailabilityStart()));
            }
            if (room.getAvailabilityEnd() != null && endTime.isAfter(room.getAvailabilityEnd())) {
                return OperationResult.validationError(
                        "Room is not available after " + WINDOW_FORMAT.format(room.getAvailabilityEnd()));
            }
            if (expectedAttendees != null && expectedAttendees > room.getCapacity()) {
                return OperationResult.validationError(String.format(
                        "Expected attendees (%d) exceeds room capacity (%d)", expectedAttendees, room.getCapacity()));
            }

            boolean slotTaken = roomRepository.findRentalsByRoom(roomId).stream()
                    .anyMatch(existing -> existing.getStatus().holdsSlot() && existing.overlaps(startTime, endTime));
            if (slotTaken) {
                return OperationResult.conflict("Room is already booked for this time slot");
            }

            RoomRental rental = new RoomRental(UUID.randomUUID().toString(), roomId, renterId, startTime, endTime);
            rental.setPurpose(purpose);
            rental.setExpectedAttendees(expectedAttendees);
            rental.setTotalCost(totalCost(room, startTime, endTime));

            transactionRepository.saveRoomWithRentals(room, List.of(rental));
            return OperationResult.success("Rental request submitted successfully. Pending approval.", rental);
        });

        if (result.isSuccess()) {
            logger.info("Created pending rental {} on room {}", result.getData().getRentalId(), roomId);
        }
        return result;
    }

    @Override
    public OperationResult<RoomRental> approveRental(String rentalId, String approverId, boolean isAdmin) {
        logger.info("User {} approving rental {} (admin={})", approverId, rentalId, isAdmin);

        OperationResult<RoomRental> result = mutateRental(rentalId, "approve", "Rental request not found",
                (room, rentals, rental) -> {
                    if (!isAdmin && !room.getOrganizerId().equals(approverId)) {
                        return OperationResult.unauthorized("Only the room organizer or admin can approve this rental");
                    }
                    if (rental.getStatus() != RentalStatus.PENDING) {
                        return OperationResult.validationError("Only pending rentals can be approved");
                    }
                    if (!room.isEnabled()) {
                        return OperationResult.validationError("Room has been disabled by administrator");
                    }
                    boolean conflict = rentals.stream()
                            .filter(other -> !other.getRentalId().equals(rentalId))
                            .anyMatch(other -> other.getStatus() == RentalStatus.APPROVED
                                    && other.overlaps(rental.getStartTime(), rental.getEndTime()));
                    if (conflict) {
                        return OperationResult.conflict("Cannot approve: conflicting rental was already approved");
                    }
                    rental.setStatus(RentalStatus.APPROVED);
                    return OperationResult.success("Rental approved successfully", rental);
                });

        if (result.isSuccess()) {
            logger.info("Rental {} approved", rentalId);
            notificationService.notifyRentalApproved(rentalId);
        }
        return result;
    }

    @Override
    public OperationResult<RoomRental> rejectRental(String rentalId, String rejecterId, String adminNotes, boolean isAdmin) {
        logger.info("User {} rejecting rental {} (admin={})", rejecterId, rentalId, isAdmin);

        OperationResult<RoomRental> result = mutateRental(rentalId, "reject", "Rental request not found",
                (room, rentals, rental) -> {
                    if (!isAdmin && !room.getOrganizerId().equals(rejecterId)) {
                        return OperationResult.unauthorized("Only the room organizer or admin can reject this rental");
                    }
                    if (rental.getStatus() != RentalStatus.PENDING) {
                        return OperationResult.validationError("Only pending rentals can be rejected");
                    }
                    rental.setStatus(RentalStatus.REJECTED);
                    rental.setAdminNotes(adminNotes);
                    return OperationResult.success("Rental rejected", rental);
                });

        if (result.isSuccess()) {
            logger.info("Rental {} rejected", rentalId);
            notificationService.notifyRentalRejected(rentalId, adminNotes);
        }
        return result;
    }

    @Override
    public OperationResult<RoomRental> cancelRental(String rentalId, String userId) {
        logger.info("User {} cancelling rental {}", userId, rentalId);

        return mutateRental(rentalId, "cancel", "Rental not found", (room, rentals, rental) -> {
            if (!rental.getRenterId().equals(userId)) {
                return OperationResult.unauthorized("Only the renter can cancel this rental");
            }
            if (!rental.getStatus().holdsSlot()) {
                return OperationResult.validationError("Cannot cancel rental with current status");
            }
            rental.setStatus(RentalStatus.CANCELLED);
            return OperationResult.success("Rental cancelled successfully", rental);
        });
    }

    @Override
    public OperationResult<RoomRental> adminCancelRental(String rentalId, String reason) {
        logger.info("Admin cancelling rental {}: {}", rentalId, reason);

        return mutateRental(rentalId, "admin cancel", "Rental not found", (room, rentals, rental) -> {
            if (!rental.getStatus().holdsSlot()) {
                return OperationResult.validationError("Cannot cancel rental with current status");
            }
            rental.setStatus(RentalStatus.CANCELLED);
            if (reason != null && !reason.isBlank()) {
                rental.setAdminNotes("Cancelled by admin: " + reason);
            }
            return OperationResult.success("Rental cancelled successfully by administrator", rental);
        });
    }

    @Override
    public OperationResult<RoomRental> completeRental(String rentalId, String approverId, boolean isAdmin) {
        logger.info("User {} completing rental {} (admin={})", approverId, rentalId, isAdmin);

        return mutateRental(rentalId, "complete", "Rental not found", (room, rentals, rental) -> {
            if (!isAdmin && !room.getOrganizerId().equals(approverId)) {
                return OperationResult.unauthorized("Only the room organizer or admin can complete this rental");
            }
            if (rental.getStatus() != RentalStatus.APPROVED) {
                return OperationResult.validationError("Only approved rentals can be completed");
            }
            rental.setStatus(RentalStatus.COMPLETED);
            return OperationResult.success("Rental completed", rental);
        });
    }

    @Override
    public List<Room> getAvailableRooms(Instant startTime, Instant endTime, Integer minCapacity) {
        if (startTime == null || endTime == null) {
            logger.debug("Available room search without a complete time range");
            return List.of();
        }
        return getRooms(true, minCapacity, startTime, endTime).stream()
                .filter(room -> roomRepository.findRentalsByRoom(room.getRoomId()).stream()
                        .noneMatch(rental -> rental.getStatus().holdsSlot() && rental.overlaps(startTime, endTime)))
                .collect(Collectors.toList());
    }

    @Override
    public List<RoomRental> getUserRentals(String userId) {
        return roomRepository.findRentalsByRenter(userId).stream()
                .sorted(Comparator.comparing(RoomRental::getCreatedAt).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public List<RoomRental> getPendingRentalsForOrganizer(String organizerId) {
        return roomRepository.findByOrganizer(organizerId).stream()
                .flatMap(room -> roomRepository.findRentalsByRoom(room.getRoomId()).stream())
                .filter(rental -> rental.getStatus() == RentalStatus.PENDING)
                .sorted(Comparator.comparing(RoomRental::getStartTime))
                .collect(Collectors.toList());
    }

    @Override
    public List<RoomRental> getAllRentals(RentalStatus status) {
        return roomRepository.findAllRentals().stream()
                .filter(rental -> status == null || rental.getStatus() == status)
                .sorted(Comparator.comparing(RoomRental::getCreatedAt).reversed())
                .collect(Collectors.toList());
    }

    // ===== Helpers =====

    @FunctionalInterface
    private interface RentalChange {
        /**
         * Validate and apply a change to rental. A successful result is committed
         * together with the room; any other result is returned untouched.
         */
        OperationResult<RoomRental> apply(Room room, List<RoomRental> rentals, RoomRental rental);
    }

    private OperationResult<RoomRental> mutateRental(String rentalId, String action, String notFoundMessage,
                                                     RentalChange change) {
        Optional<RoomRental> located = roomRepository.findRentalById(rentalId);
        if (located.isEmpty()) {
            return OperationResult.notFound(notFoundMessage);
        }
        String roomId = located.get().getRoomId();

        return withRetries(action + " rental " + rentalId, () -> {
            // Room first: a rental write landing after this read moves the version and fails our commit
            Optional<Room> room = roomRepository.findById(roomId);
            if (room.isEmpty()) {
                return OperationResult.notFound("Room not found");
            }
            List<RoomRental> rentals = roomRepository.findRentalsByRoom(roomId);
            Optional<RoomRental> rental = rentals.stream()
                    .filter(r -> r.getRentalId().equals(rentalId))
                    .findFirst();
            if (rental.isEmpty()) {
                return OperationResult.notFound(notFoundMessage);
            }

            OperationResult<RoomRental> result = change.apply(room.get(), rentals, rental.get());
            if (result.isSuccess()) {
                transactionRepository.saveRoomWithRentals(room.get(), List.of(rental.get()));
            }
            return result;
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

    private static boolean windowIsOrdered(Instant start, Instant end) {
        return start == null || end == null || end.isAfter(start);
    }

    private static BigDecimal totalCost(Room room, Instant startTime, Instant endTime) {
        if (room.getHourlyRate() == null) {
            return null;
        }
        BigDecimal hours = BigDecimal.valueOf(TimeRange.of(startTime, endTime).duration().toMillis())
                .divide(MILLIS_PER_HOUR, 6, RoundingMode.HALF_UP);
        return room.getHourlyRate().multiply(hours).setScale(2, RoundingMode.HALF_UP);
    }
}
