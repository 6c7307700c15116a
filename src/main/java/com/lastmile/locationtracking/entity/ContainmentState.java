package com.lastmile.locationtracking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;

/**
 * Last known containment of a user in a geofence.
 *
 * {@code since} is when the current inside/outside period began and only
 * moves on a state flip. {@code dwellNotified} records that a DWELL was
 * already raised for the current inside period; it cannot be re-derived
 * from the elapsed time alone.
 */
@Entity
@Table(name = "containment_states")
@IdClass(ContainmentState.Key.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ContainmentState {

    @Id
    @Column(name = "user_id")
    private String userId;

    @Id
    @Column(name = "geofence_id")
    private Long geofenceId;

    @Column(nullable = false)
    private boolean inside;

    @Column(nullable = false)
    private Instant since;

    @Column(nullable = false)
    private boolean dwellNotified;

    @Column(nullable = false)
    private Instant updatedAt;

    /** A state not refreshed within {@code ttl} is treated as unknown. */
    public boolean isExpired(Instant now, Duration ttl) {
        return updatedAt == null || updatedAt.plus(ttl).isBefore(now);
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode
    public static class Key implements Serializable {
        private String userId;
        private Long geofenceId;
    }
}
