package com.lastmile.locationtracking.exception;

import com.lastmile.locationtracking.dto.LocationSampleRequest;
import lombok.Getter;

/**
 * A sample failed input validation. Carries the rejected input so that it
 * can be echoed back to the device for correction.
 */
@Getter
public class InvalidLocationException extends TrackingException {

    private final transient LocationSampleRequest rejected;

    public InvalidLocationException(ErrorCode errorCode, String message, LocationSampleRequest rejected) {
        super(errorCode, message);
        this.rejected = rejected;
    }
}
