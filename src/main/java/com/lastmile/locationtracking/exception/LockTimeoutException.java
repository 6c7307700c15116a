package com.lastmile.locationtracking.exception;

/** A per-key lock could not be acquired within the configured timeout. */
public class LockTimeoutException extends TrackingException {

    public LockTimeoutException(String key, long timeoutMs) {
        super(ErrorCode.LOCK_TIMEOUT, "Timed out after " + timeoutMs + " ms waiting for " + key);
    }
}
