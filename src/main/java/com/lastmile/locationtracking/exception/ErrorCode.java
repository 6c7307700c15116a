package com.lastmile.locationtracking.exception;

/**
 * Machine-readable error kinds surfaced to callers.
 */
public enum ErrorCode {

    // Input validation: reject the one sample, a batch carries on
    INVALID_COORDINATES,
    INVALID_ACCURACY,
    INVALID_SPEED,

    // Session state machine violations: never retried by the engine
    SESSION_NOT_ACTIVE,
    SESSION_ALREADY_ACTIVE,
    SESSION_NOT_FOUND,

    // Geofence administration
    GEOFENCE_GEOMETRY_ERROR,
    GEOFENCE_NOT_FOUND,

    // Infrastructure
    STORAGE_UNAVAILABLE,
    CACHE_UNAVAILABLE,
    LOCK_TIMEOUT
}
