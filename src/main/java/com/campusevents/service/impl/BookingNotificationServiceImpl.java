package com.campusevents.service.impl;

import com.campusevents.model.RoomRental;
import com.campusevents.repository.RoomRepository;
import com.campusevents.service.BookingNotificationService;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Records booking notifications. Message wording and delivery channels live
 * outside this service; here each notification is resolved to its recipient,
 * logged and counted.
 */
@Service
public class BookingNotificationServiceImpl implements BookingNotificationService {

    private static final Logger logger = LoggerFactory.getLogger(BookingNotificationServiceImpl.class);
    static final String METRIC_NAME = "booking.notifications";

    private final RoomRepository roomRepository;
    private final MeterRegistry meterRegistry;

    @Autowired
    public BookingNotificationServiceImpl(RoomRepository roomRepository, MeterRegistry meterRegistry) {
        this.roomRepository = roomRepository;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void notifyRentalApproved(String rentalId) {
        notifyRenter("rental_approved", rentalId, null);
    }

    @Override
    public void notifyRentalRejected(String rentalId, String reason) {
        notifyRenter("rental_rejected", rentalId, reason);
    }

    @Override
    public void notifyRoomDisabled(String roomId, List<String> affectedRentalIds) {
        try {
            logger.info("Room {} disabled; {} approved upcoming rentals affected: {}",
                    roomId, affectedRentalIds.size(), affectedRentalIds);
            meterRegistry.counter(METRIC_NAME, "type", "room_disabled", "status", "success").increment();
        } catch (Exception e) {
            logger.error("Error sending room disabled notification for {}: {}", roomId, e.getMessage(), e);
            meterRegistry.counter(METRIC_NAME, "type", "room_disabled", "status", "error").increment();
        }
    }

    private void notifyRenter(String type, String rentalId, String reason) {
        try {
            Optional<RoomRental> rental = roomRepository.findRentalById(rentalId);
            if (rental.isEmpty()) {
                logger.warn("Skipping {} notification: rental {} not found", type, rentalId);
                meterRegistry.counter(METRIC_NAME, "type", type, "status", "skipped").increment();
                return;
            }
            logger.info("Notifying renter {} of {} for rental {}{}", rental.get().getRenterId(), type, rentalId,
                    reason != null ? " (" + reason + ")" : "");
            meterRegistry.counter(METRIC_NAME, "type", type, "status", "success").increment();
        } catch (Exception e) {
            // Notifications never break a committed booking change
            logger.error("Error sending {} notification for rental {}: {}", type, rentalId, e.getMessage(), e);
            meterRegistry.counter(METRIC_NAME, "type", type, "status", "error").increment();
        }
    }
}
