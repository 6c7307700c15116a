package com.lastmile.locationtracking.exception;

/** The cache failed; callers degrade to the persistence layer. */
public class CacheUnavailableException extends TrackingException {

    public CacheUnavailableException(String message, Throwable cause) {
        super(ErrorCode.CACHE_UNAVAILABLE, message, cause);
    }
}
