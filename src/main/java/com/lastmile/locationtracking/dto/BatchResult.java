package com.lastmile.locationtracking.dto;

import com.lastmile.locationtracking.entity.GeofenceEvent;
import com.lastmile.locationtracking.entity.LocationSample;
import lombok.*;

import java.util.List;

@Getter
@AllArgsConstructor
@Builder
public class BatchResult {

    private final int processed;
    private final int successful;
    private final int failed;

    /** Distance added by the accepted samples, chained from the last stored sample */
    private final double totalDistanceKm;

    /** Filtered view of the latest accepted sample; null when nothing was accepted */
    private final LocationSample latestSample;

    private final List<GeofenceEvent> geofenceEvents;

    /** One entry per submitted item, in submission order */
    private final List<BatchItemResult> results;
}
