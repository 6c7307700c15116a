package com.lastmile.locationtracking.service.notification;

import com.lastmile.locationtracking.entity.Geofence;
import com.lastmile.locationtracking.entity.GeofenceEvent;

/**
 * Outbound channel for geofence notifications (push, SMS, e-mail ...).
 *
 * Called only for transitions the geofence's notification policy allows.
 * Implementations may throw; the caller logs the failure and keeps the event.
 */
public interface NotificationSink {

    void notify(GeofenceEvent event, Geofence geofence);
}
