package com.lastmile.locationtracking.service.notification;

import com.lastmile.locationtracking.entity.Geofence;
import com.lastmile.locationtracking.entity.GeofenceEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Default notification sink: writes the notification to the application log.
 *
 * Runs on the "notificationTaskExecutor" pool so delivery never holds the
 * caller's containment lock. Swap in a push/SMS provider by registering
 * another {@link NotificationSink} bean.
 */
@Service
@Slf4j
public class LoggingNotificationSink implements NotificationSink {

    @Async("notificationTaskExecutor")
    @Override
    public void notify(GeofenceEvent event, Geofence geofence) {
        String text;
        switch (event.getKind()) {
            case ENTER:
                text = "Courier has arrived at " + label(geofence);
                break;
            case EXIT:
                text = "Courier has left " + label(geofence);
                break;
            case DWELL:
                text = "Courier has been at " + label(geofence) + " for " + event.getDwellSeconds() + "s";
                break;
            default:
                text = event.getKind() + " at " + label(geofence);
        }
        log.info("[NOTIFICATION] {} — user: {}, trip: {}, geofence #{} ({}), loc: ({}, {})",
                text, event.getUserId(), event.getTripId(), geofence.getId(), geofence.getKind(),
                String.format("%.5f", event.getCoordinates().getLatitude()),
                String.format("%.5f", event.getCoordinates().getLongitude()));
    }

    private static String label(Geofence geofence) {
        return geofence.getName() != null ? geofence.getName() : geofence.getKind() + " #" + geofence.getId();
    }
}
