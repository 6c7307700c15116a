package com.lastmile.locationtracking.exception;

/** The persistence layer failed or timed out. Writes are aborted, never dropped silently. */
public class StorageUnavailableException extends TrackingException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(ErrorCode.STORAGE_UNAVAILABLE, message, cause);
    }
}
