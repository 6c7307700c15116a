package com.lastmile.locationtracking.dto;

import com.lastmile.locationtracking.entity.GeofenceEvent;
import com.lastmile.locationtracking.entity.LocationSample;
import lombok.*;

import java.util.List;

/**
 * Outcome of ingesting one sample.
 */
@Getter
@AllArgsConstructor
@Builder
public class IngestResult {

    private final Long sampleId;

    /** Privacy-filtered view of the sample, as cached and exposed to watchers */
    private final LocationSample filteredSample;

    /** Haversine distance from the previous sample of the same (trip, user); 0 for the first one */
    private final double distanceDeltaKm;

    /** Derived speed when the device did not report one; null if it could not be derived */
    private final Double calculatedSpeedKmh;

    private final double totalDistanceKm;

    private final List<GeofenceEvent> geofenceEvents;
}
