package com.campusevents.util;

import com.campusevents.exception.InvalidKeyException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CampusKeyFactoryTest {

    private static final String ROOM_ID = "11111111-1111-1111-1111-111111111111";
    private static final String OFFER_ID = "22222222-2222-2222-2222-222222222222";
    private static final String RECORD_ID = "33333333-3333-3333-3333-333333333333";

    @Test
    void getRoomPk_WithValidId_ShouldReturnPrefixedKey() {
        assertThat(CampusKeyFactory.getRoomPk(ROOM_ID)).isEqualTo("ROOM#" + ROOM_ID);
    }

    @Test
    void getRoomPk_WithNonUuid_ShouldThrowException() {
        assertThatThrownBy(() -> CampusKeyFactory.getRoomPk("room-1"))
            .isInstanceOf(InvalidKeyException.class)
            .hasMessageContaining("Invalid Room ID format");
    }

    @Test
    void getRentalSk_WithNullId_ShouldThrowException() {
        assertThatThrownBy(() -> CampusKeyFactory.getRentalSk(null))
            .isInstanceOf(InvalidKeyException.class)
            .hasMessageContaining("cannot be null or empty");
    }

    @Test
    void getPassengerSk_ShouldNestUnderOffer() {
        // When
        String sk = CampusKeyFactory.getPassengerSk(OFFER_ID, RECORD_ID);

        // Then
        assertThat(sk).isEqualTo("OFFER#" + OFFER_ID + "#PASSENGER#" + RECORD_ID);
        assertThat(sk).startsWith(CampusKeyFactory.getPassengerQueryPrefix(OFFER_ID));
    }

    @Test
    void offerAndPassengerPredicates_ShouldNotOverlap() {
        String offerSk = CampusKeyFactory.getOfferSk(OFFER_ID);
        String passengerSk = CampusKeyFactory.getPassengerSk(OFFER_ID, RECORD_ID);

        assertThat(CampusKeyFactory.isOffer(offerSk)).isTrue();
        assertThat(CampusKeyFactory.isPassenger(offerSk)).isFalse();
        assertThat(CampusKeyFactory.isOffer(passengerSk)).isFalse();
        assertThat(CampusKeyFactory.isPassenger(passengerSk)).isTrue();
    }

    @Test
    void isRental_ShouldMatchOnlyRentalKeys() {
        assertThat(CampusKeyFactory.isRental(CampusKeyFactory.getRentalSk(RECORD_ID))).isTrue();
        assertThat(CampusKeyFactory.isRental(CampusKeyFactory.getMetadataSk())).isFalse();
        assertThat(CampusKeyFactory.isRental(null)).isFalse();
    }

    @Test
    void isMetadata_ShouldMatchMetadataSortKey() {
        assertThat(CampusKeyFactory.isMetadata("METADATA")).isTrue();
        assertThat(CampusKeyFactory.isMetadata(CampusKeyFactory.getDriverClaimSk())).isFalse();
    }
}
