package com.lastmile.locationtracking.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrackingEventType {
    TRACKING_STARTED("tracking_started"),
    LOCATION_UPDATED("location_updated"),
    TRACKING_STOPPED("tracking_stopped"),
    GEOFENCE_EVENT("geofence_event");

    private final String wireName;

    TrackingEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
