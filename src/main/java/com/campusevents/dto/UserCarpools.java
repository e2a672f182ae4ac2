package com.campusevents.dto;

import com.campusevents.model.CarpoolOffer;
import com.campusevents.model.CarpoolPassenger;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * A user's carpool involvement: offers they drive and seats they hold.
 */
@Data
@AllArgsConstructor
public class UserCarpools {
    private List<CarpoolOffer> offersAsDriver;
    private List<CarpoolPassenger> rides;
}
