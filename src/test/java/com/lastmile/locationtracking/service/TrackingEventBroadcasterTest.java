package com.lastmile.locationtracking.service;

import com.lastmile.locationtracking.dto.TrackingEvent;
import com.lastmile.locationtracking.dto.TrackingEventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TrackingEventBroadcaster: topic routing and broker failures.
 */
@ExtendWith(MockitoExtension.class)
class TrackingEventBroadcasterTest {

    @Mock private SimpMessagingTemplate messagingTemplate;

    @InjectMocks
    private TrackingEventBroadcaster broadcaster;

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    @DisplayName("Location updates go to the trip topic only")
    void locationUpdateToTripTopic() {
        TrackingEvent event = TrackingEvent.of(TrackingEventType.LOCATION_UPDATED, "TRIP-1", "courier-7", NOW);

        broadcaster.publish(event);

        verify(messagingTemplate).convertAndSend("/topic/tracking/TRIP-1", (Object) event);
        verifyNoMoreInteractions(messagingTemplate);
    }

    @Test
    @DisplayName("Geofence events also go to the shared geofence topic")
    void geofenceEventToBothTopics() {
        TrackingEvent event = TrackingEvent.of(TrackingEventType.GEOFENCE_EVENT, "TRIP-1", "courier-7", NOW);

        broadcaster.publish(event);

        verify(messagingTemplate).convertAndSend("/topic/tracking/TRIP-1", (Object) event);
        verify(messagingTemplate).convertAndSend("/topic/geofence-events", (Object) event);
    }

    @Test
    @DisplayName("Broker failure is swallowed with a warning")
    void brokerFailureDoesNotPropagate() {
        doThrow(new MessageDeliveryException("broker down"))
                .when(messagingTemplate).convertAndSend(anyString(), any(Object.class));

        assertThatCode(() -> broadcaster.publish(
                TrackingEvent.of(TrackingEventType.TRACKING_STOPPED, "TRIP-1", "courier-7", NOW)))
                .doesNotThrowAnyException();
    }
}
