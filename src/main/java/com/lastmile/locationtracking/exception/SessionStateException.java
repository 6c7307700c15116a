package com.lastmile.locationtracking.exception;

import lombok.Getter;

/**
 * The requested operation is not allowed in the session's current state.
 */
@Getter
public class SessionStateException extends TrackingException {

    private final String tripId;

    public SessionStateException(ErrorCode errorCode, String tripId, String message) {
        super(errorCode, message);
        this.tripId = tripId;
    }

    public static SessionStateException notActive(String tripId, Object status) {
        return new SessionStateException(ErrorCode.SESSION_NOT_ACTIVE, tripId,
                "Location tracking is not active for trip " + tripId + " (status: " + status + ")");
    }

    public static SessionStateException alreadyActive(String tripId) {
        return new SessionStateException(ErrorCode.SESSION_ALREADY_ACTIVE, tripId,
                "Tracking is already active for trip " + tripId);
    }

    public static SessionStateException notFound(String tripId) {
        return new SessionStateException(ErrorCode.SESSION_NOT_FOUND, tripId,
                "No tracking session found for trip " + tripId);
    }
}
