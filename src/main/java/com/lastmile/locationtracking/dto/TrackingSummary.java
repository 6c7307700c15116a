package com.lastmile.locationtracking.dto;

import com.lastmile.locationtracking.entity.TrackingSession;
import com.lastmile.locationtracking.entity.TrackingStatus;
import lombok.*;

import java.time.Instant;

/**
 * Totals of a finished (stopped or completed) tracking session.
 */
@Getter
@AllArgsConstructor
@Builder
public class TrackingSummary {

    private final String tripId;
    private final TrackingStatus status;
    private final String reason;
    private final long totalUpdates;
    private final double totalDistanceKm;
    private final Double totalDurationMin;
    private final Instant startedAt;
    private final Instant stoppedAt;

    public static TrackingSummary of(TrackingSession session) {
        return TrackingSummary.builder()
                .tripId(session.getTripId())
                .status(session.getStatus())
                .reason(session.getStopReason())
                .totalUpdates(session.getTotalUpdates())
                .totalDistanceKm(session.getTotalDistanceKm())
                .totalDurationMin(session.getTotalDurationMin())
                .startedAt(session.getStartedAt())
                .stoppedAt(session.getStoppedAt())
                .build();
    }
}
