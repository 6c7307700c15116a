package com.lastmile.locationtracking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Entity representing a geofence watched during delivery trips.
 *
 * Geometry is a tagged union stored in one row:
 *  - CIRCLE : center + radiusM
 *  - POLYGON: polygonRing, a JSON array of [lat,lon] pairs forming a closed ring
 *             e.g. [[12.970,77.593],[12.972,77.593],[12.972,77.596],[12.970,77.593]]
 *
 * A null tripId makes the geofence apply to every trip (e.g. restricted zones).
 * The optional active window is expressed in local time of {@code timezone}.
 */
@Entity
@Table(
    name = "geofences",
    indexes = @Index(name = "idx_geofence_trip_active", columnList = "trip_id, active")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Geofence {

    public static final String DEFAULT_TIMEZONE = "UTC";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** Human-readable label, e.g. "Pickup - DLV-1042" */
    private String name;

    @Column(name = "trip_id")
    private String tripId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private GeofenceKind kind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private GeometryType geometryType;

    @Embedded
    @AttributeOverrides({
        @AttributeOverride(name = "latitude",  column = @Column(name = "center_latitude")),
        @AttributeOverride(name = "longitude", column = @Column(name = "center_longitude"))
    })
    private Coordinates center;

    private Double radiusM;

    @Column(columnDefinition = "TEXT")
    private String polygonRing;

    @Embedded
    private NotificationPolicy notificationPolicy;

    private LocalDateTime activeFrom;

    private LocalDateTime activeUntil;

    private String timezone;

    @Column(nullable = false)
    private boolean active;

    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    /** Zone in which the active window is interpreted; UTC when unset. */
    public ZoneId zone() {
        return timezone == null || timezone.isBlank() ? ZoneOffset.UTC : ZoneId.of(timezone);
    }

    /**
     * True when the geofence is switched on and {@code at}, converted to the
     * geofence's own timezone, falls inside [activeFrom, activeUntil].
     */
    public boolean isActiveAt(Instant at) {
        if (!active) return false;
        LocalDateTime local = LocalDateTime.ofInstant(at, zone());
        if (activeFrom != null && local.isBefore(activeFrom)) return false;
        return activeUntil == null || !local.isAfter(activeUntil);
    }

    /** True once the active window has closed for good. */
    public boolean isExpiredAt(Instant at) {
        return activeUntil != null && LocalDateTime.ofInstant(at, zone()).isAfter(activeUntil);
    }

    public NotificationPolicy policy() {
        return notificationPolicy != null ? notificationPolicy : new NotificationPolicy();
    }
}
