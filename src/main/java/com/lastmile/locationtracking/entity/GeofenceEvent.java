package com.lastmile.locationtracking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Append-only log of detected geofence transitions.
 *
 * {@code triggeredAt} is the instant of the sample that caused the
 * transition, so replays of buffered batches keep their original timing.
 */
@Entity
@Table(
    name = "geofence_events",
    indexes = {
        @Index(name = "idx_geofence_event_geofence", columnList = "geofence_id, triggered_at"),
        @Index(name = "idx_geofence_event_trip",     columnList = "trip_id, triggered_at")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GeofenceEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "geofence_id", nullable = false)
    private Long geofenceId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "trip_id")
    private String tripId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false)
    private GeofenceEventType kind;

    @Embedded
    private Coordinates coordinates;

    /** Seconds spent inside; set on DWELL events only */
    private Long dwellSeconds;

    @Column(name = "triggered_at", nullable = false)
    private Instant triggeredAt;
}
