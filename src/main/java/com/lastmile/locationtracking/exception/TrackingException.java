package com.lastmile.locationtracking.exception;

import lombok.Getter;

/**
 * Base class of every error raised by the tracking engine.
 */
@Getter
public class TrackingException extends RuntimeException {

    private final ErrorCode errorCode;

    public TrackingException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TrackingException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
