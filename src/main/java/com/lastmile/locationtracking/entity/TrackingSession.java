package com.lastmile.locationtracking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Entity representing the tracking session of one delivery trip.
 *
 * There is exactly one row per trip: a stopped or paused session is resumed
 * in place rather than replaced, so the counters accumulate across resumes.
 */
@Entity
@Table(
    name = "tracking_sessions",
    uniqueConstraints = @UniqueConstraint(name = "uk_tracking_session_trip", columnNames = "trip_id")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class TrackingSession {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trip_id", nullable = false)
    private String tripId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TrackingStatus status;

    @Column(nullable = false)
    private Instant startedAt;

    private Instant stoppedAt;

    private String stopReason;

    // Number of samples accepted (single + batch)
    @Column(nullable = false)
    private long totalUpdates;

    // Sum of haversine deltas between consecutive samples
    @Column(nullable = false)
    private double totalDistanceKm;

    // Set on stop / complete
    private Double totalDurationMin;

    @Embedded
    private TrackingSettings settings;

    @Embedded
    private PrivacySettings privacySettings;

    @Version
    private Long version;

    public boolean isActive() {
        return status == TrackingStatus.ACTIVE;
    }

    /** Effective privacy level; PRECISE when none was configured. */
    public TrackingLevel trackingLevel() {
        return privacySettings != null && privacySettings.getTrackingLevel() != null
                ? privacySettings.getTrackingLevel() : TrackingLevel.PRECISE;
    }

    /** Copy detached from the persistence context, safe to hand to caches and callers. */
    public TrackingSession snapshot() {
        return toBuilder()
                .settings(settings != null ? settings.toBuilder().build() : null)
                .privacySettings(privacySettings != null ? new PrivacySettings(privacySettings.getTrackingLevel()) : null)
                .build();
    }
}
