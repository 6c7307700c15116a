package com.lastmile.locationtracking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Entity for one GPS sample reported by a courier device.
 *
 * Persisted samples are never updated. Ordering is by {@code timestamp}
 * (device time), not by insertion order, so late batches slot in correctly.
 * Privacy-filtered copies use the same type but are never persisted.
 */
@Entity
@Table(
    name = "location_samples",
    indexes = {
        @Index(name = "idx_location_sample_trip_ts",      columnList = "trip_id, sample_timestamp"),
        @Index(name = "idx_location_sample_trip_user_ts", columnList = "trip_id, user_id, sample_timestamp")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class LocationSample {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trip_id", nullable = false)
    private String tripId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Embedded
    private Coordinates coordinates;

    private Double accuracyM;

    private Double altitudeM;

    private Double bearingDeg;

    private Double speedMps;

    private Integer batteryPct;

    private String networkType;

    @Column(name = "sample_timestamp", nullable = false)
    private Instant timestamp;

    /** Speed in km/h, or null when unknown. */
    public Double speedKmh() {
        return speedMps != null ? speedMps * 3.6 : null;
    }
}
