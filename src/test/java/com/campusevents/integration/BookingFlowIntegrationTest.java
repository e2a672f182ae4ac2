package com.campusevents.integration;

import com.campusevents.dto.RoomDetails;
import com.campusevents.exception.VersionConflictException;
import com.campusevents.model.CarpoolOffer;
import com.campusevents.model.CarpoolOfferStatus;
import com.campusevents.model.CarpoolPassenger;
import com.campusevents.model.Driver;
import com.campusevents.model.DriverType;
import com.campusevents.model.RentalStatus;
import com.campusevents.model.Room;
import com.campusevents.model.RoomRental;
import com.campusevents.model.UserRole;
import com.campusevents.model.VehicleType;
import com.campusevents.repository.CarpoolOfferRepository;
import com.campusevents.repository.RoomRepository;
import com.campusevents.repository.RoomTransactionRepository;
import com.campusevents.service.CarpoolService;
import com.campusevents.service.OperationResult;
import com.campusevents.service.RoomRentalService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end booking flows against real DynamoDB transactions and indexes.
 */
class BookingFlowIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private RoomRentalService roomRentalService;

    @Autowired
    private CarpoolService carpoolService;

    @Autowired
    private RoomRepository roomRepository;

    @Autowired
    private RoomTransactionRepository roomTransactionRepository;

    @Autowired
    private CarpoolOfferRepository offerRepository;

    private final Instant tomorrow = Instant.now().plus(Duration.ofDays(1)).truncatedTo(ChronoUnit.HOURS);

    @Test
    void rentalLifecycle_PersistsAndFindsRentalsByIdAndRenter() {
        String organizer = createUser(UserRole.ORGANIZER);
        String renter = createUser(UserRole.STUDENT);
        Room room = roomRentalService.createRoom(organizer,
                RoomDetails.builder().name("Integration Hall").capacity(40).build()).getData();

        OperationResult<RoomRental> requested = roomRentalService.requestRental(room.getRoomId(), renter,
                tomorrow, tomorrow.plus(Duration.ofHours(2)), "Workshop", 25);
        assertThat(requested.isSuccess()).as(requested.getMessage()).isTrue();
        String rentalId = requested.getData().getRentalId();

        OperationResult<RoomRental> overlapping = roomRentalService.requestRental(room.getRoomId(), renter,
                tomorrow.plus(Duration.ofHours(1)), tomorrow.plus(Duration.ofHours(3)), "Workshop", 25);
        assertThat(overlapping.getOutcome()).isEqualTo(OperationResult.Outcome.CONFLICT);

        assertThat(roomRentalService.approveRental(rentalId, organizer, false).isSuccess()).isTrue();

        RoomRental stored = roomRepository.findRentalById(rentalId).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(RentalStatus.APPROVED);
        assertThat(stored.getStartTime()).isEqualTo(tomorrow);
        assertThat(roomRepository.findById(room.getRoomId()).orElseThrow().getVersion()).isEqualTo(3L);
    }

    @Test
    void staleRoomVersion_IsRejectedByDynamoDb() {
        String organizer = createUser(UserRole.ORGANIZER);
        Room room = roomRentalService.createRoom(organizer,
                RoomDetails.builder().name("Stale Room").capacity(10).build()).getData();

        Room first = roomRepository.findById(room.getRoomId()).orElseThrow();
        Room second = roomRepository.findById(room.getRoomId()).orElseThrow();
        roomTransactionRepository.saveRoomWithRentals(first, List.of());

        assertThatThrownBy(() -> roomTransactionRepository.saveRoomWithRentals(second, List.of()))
                .isInstanceOf(VersionConflictException.class);
    }

    @Test
    void carpoolReassignment_MovesRecordAcrossDriverPartitions() {
        String eventId = createEvent("Integration Gala", tomorrow);
        Driver firstDriver = approvedDriver(createUser(UserRole.STUDENT), 1);
        Driver secondDriver = approvedDriver(createUser(UserRole.STUDENT), 2);
        CarpoolOffer source = createOffer(firstDriver, eventId);
        CarpoolOffer target = createOffer(secondDriver, eventId);

        String rider = createUser(UserRole.STUDENT);
        CarpoolPassenger record = carpoolService.joinOffer(source.getOfferId(), rider, "Dorm C", null).getData();
        assertThat(offerRepository.findById(source.getOfferId()).orElseThrow().getStatus())
                .isEqualTo(CarpoolOfferStatus.FULL);

        OperationResult<CarpoolPassenger> moved =
                carpoolService.reassignPassenger(record.getPassengerRecordId(), target.getOfferId());

        assertThat(moved.isSuccess()).as(moved.getMessage()).isTrue();
        assertThat(offerRepository.findById(source.getOfferId()).orElseThrow().getSeatsAvailable()).isEqualTo(1);
        assertThat(offerRepository.findById(target.getOfferId()).orElseThrow().getSeatsAvailable()).isEqualTo(1);
        assertThat(offerRepository.findPassengers(source.getDriverId(), source.getOfferId())).isEmpty();
        assertThat(offerRepository.findPassengers(target.getDriverId(), target.getOfferId()))
                .extracting(CarpoolPassenger::getPassengerId)
                .containsExactly(rider);
    }

    private Driver approvedDriver(String userId, int capacity) {
        Driver driver = carpoolService.registerDriver(userId, capacity, VehicleType.SEDAN, DriverType.STUDENT,
                "INT-" + capacity, null).getData();
        carpoolService.approveDriver(driver.getDriverId());
        return driver;
    }

    private CarpoolOffer createOffer(Driver driver, String eventId) {
        OperationResult<CarpoolOffer> result = carpoolService.createOffer(driver.getDriverId(), eventId,
                "North gate", tomorrow, null, null, null);
        assertThat(result.isSuccess()).as(result.getMessage()).isTrue();
        return result.getData();
    }
}
