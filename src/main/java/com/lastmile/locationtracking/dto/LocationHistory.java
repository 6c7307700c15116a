package com.lastmile.locationtracking.dto;

import com.lastmile.locationtracking.entity.LocationSample;
import lombok.*;

import java.time.Instant;
import java.util.List;

/**
 * Samples of a trip within a time range, oldest first, with route statistics.
 */
@Getter
@AllArgsConstructor
@Builder
public class LocationHistory {

    private final String tripId;
    private final Instant from;
    private final Instant to;
    private final List<LocationSample> samples;
    private final RouteSummary summary;

    @Getter
    @AllArgsConstructor
    @Builder
    public static class RouteSummary {
        private final int totalPoints;
        private final double totalDistanceKm;
        private final double durationMin;
        private final double averageSpeedKmh;
        private final double maxSpeedKmh;

        public static RouteSummary empty() {
            return new RouteSummary(0, 0, 0, 0, 0);
        }
    }
}
