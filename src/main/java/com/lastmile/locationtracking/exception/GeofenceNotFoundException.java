package com.lastmile.locationtracking.exception;

public class GeofenceNotFoundException extends TrackingException {

    public GeofenceNotFoundException(Long geofenceId) {
        super(ErrorCode.GEOFENCE_NOT_FOUND, "Geofence not found with ID: " + geofenceId);
    }
}
