package com.campusevents.service;

import java.util.List;

/**
 * Tells renters about decisions on their bookings. Called after the deciding
 * transaction commits, once per transition. Implementations must not throw:
 * a failed notification never undoes a committed booking change.
 */
public interface BookingNotificationService {

    void notifyRentalApproved(String rentalId);

    void notifyRentalRejected(String rentalId, String reason);

    /**
     * Sent once when an administrator disables a room.
     *
     * @param roomId the disabled room
     * @param affectedRentalIds approved rentals that have not started yet and now need attention
     */
    void notifyRoomDisabled(String roomId, List<String> affectedRentalIds);
}
