package com.lastmile.locationtracking.dto;

import lombok.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Engine-emitted event handed to the broadcast channel.
 */
@Getter
@AllArgsConstructor
@Builder
public class TrackingEvent {

    private final TrackingEventType type;
    private final String tripId;
    private final String userId;
    private final Map<String, Object> payload;
    private final Instant occurredAt;

    public static TrackingEvent of(TrackingEventType type, String tripId, String userId, Instant at,
                                   Object... keyValues) {
        Map<String, Object> payload = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            payload.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return new TrackingEvent(type, tripId, userId, payload, at);
    }
}
