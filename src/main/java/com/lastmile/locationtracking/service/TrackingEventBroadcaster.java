package com.lastmile.locationtracking.service;

import com.lastmile.locationtracking.dto.TrackingEvent;
import com.lastmile.locationtracking.dto.TrackingEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes engine events to STOMP subscribers.
 *
 *   /topic/tracking/{tripId}  - every event of the trip
 *   /topic/geofence-events    - geofence_event only, all trips
 *
 * Broadcasting is best effort: a broker failure is logged and never fails
 * the operation that produced the event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TrackingEventBroadcaster {

    public static final String TRIP_TOPIC_PREFIX = "/topic/tracking/";
    public static final String GEOFENCE_TOPIC = "/topic/geofence-events";

    private final SimpMessagingTemplate messagingTemplate;

    public void publish(TrackingEvent event) {
        try {
            messagingTemplate.convertAndSend(TRIP_TOPIC_PREFIX + event.getTripId(), event);
            if (event.getType() == TrackingEventType.GEOFENCE_EVENT) {
                messagingTemplate.convertAndSend(GEOFENCE_TOPIC, event);
            }
            log.debug("WS {} pushed for trip {}", event.getType(), event.getTripId());
        } catch (MessagingException e) {
            log.warn("WS: Failed to push {} for trip {} — {}", event.getType(), event.getTripId(), e.getMessage());
        }
    }
}
