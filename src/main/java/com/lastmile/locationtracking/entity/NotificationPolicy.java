package com.lastmile.locationtracking.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * Which geofence transitions are forwarded to the notification sink,
 * and how long a user must stay inside before a dwell is raised.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class NotificationPolicy {

    public static final int DEFAULT_DWELL_SECONDS = 300;

    @Column(name = "notify_on_entry", nullable = false)
    private boolean onEntry;

    @Column(name = "notify_on_exit", nullable = false)
    private boolean onExit;

    @Column(name = "dwell_enabled", nullable = false)
    private boolean dwellEnabled;

    @Column(name = "dwell_duration_sec", nullable = false)
    @Builder.Default
    private int dwellDurationSec = DEFAULT_DWELL_SECONDS;

    public boolean allows(GeofenceEventType type) {
        switch (type) {
            case ENTER:
                return onEntry;
            case EXIT:
                return onExit;
            case DWELL:
                return dwellEnabled;
            default:
                return false;
        }
    }
}
