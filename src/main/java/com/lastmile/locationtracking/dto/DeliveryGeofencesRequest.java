package com.lastmile.locationtracking.dto;

import com.lastmile.locationtracking.entity.Coordinates;
import lombok.*;

/**
 * Pickup and drop-off points of a delivery; each present point gets a circular geofence.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeliveryGeofencesRequest {

    private String deliveryNumber;
    private Coordinates pickupLocation;
    private Double pickupRadiusM;
    private Coordinates deliveryLocation;
    private Double deliveryRadiusM;
}
