package com.lastmile.locationtracking.exception;

/** Malformed geofence geometry or schedule, detected when the geofence is created. */
public class GeofenceGeometryException extends TrackingException {

    public GeofenceGeometryException(String message) {
        super(ErrorCode.GEOFENCE_GEOMETRY_ERROR, message);
    }

    public GeofenceGeometryException(String message, Throwable cause) {
        super(ErrorCode.GEOFENCE_GEOMETRY_ERROR, message, cause);
    }
}
