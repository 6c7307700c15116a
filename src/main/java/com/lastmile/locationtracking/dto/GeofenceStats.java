package com.lastmile.locationtracking.dto;

import com.lastmile.locationtracking.entity.GeofenceEventType;
import lombok.*;

import java.time.Instant;
import java.util.Map;

/**
 * Event counts of one geofence, overall and per transition kind.
 * Dwell figures only consider events that carry a dwell duration.
 */
@Getter
@AllArgsConstructor
@Builder
public class GeofenceStats {

    private final Long geofenceId;
    private final long totalEvents;
    private final long uniqueUsers;
    private final Instant firstEventAt;
    private final Instant lastEventAt;
    private final Map<GeofenceEventType, KindStats> byKind;

    @Getter
    @AllArgsConstructor
    @Builder
    public static class KindStats {
        private final long count;
        /** null when no event of this kind recorded a dwell */
        private final Double averageDwellSec;
        private final Long maxDwellSec;
    }
}
