package com.lastmile.locationtracking.service;

import com.lastmile.locationtracking.dto.LocationSampleRequest;
import com.lastmile.locationtracking.exception.ErrorCode;
import com.lastmile.locationtracking.exception.InvalidLocationException;
import com.lastmile.locationtracking.util.GeoMath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Range checks for raw GPS samples.
 *
 *   latitude   [-90, 90]     required
 *   longitude  [-180, 180]   required
 *   accuracyM  [0, 10000]    optional
 *   speedMps   [0, 500]      optional
 */
@Component
@RequiredArgsConstructor
public class LocationSampleValidator {

    public static final double MAX_ACCURACY_METERS = 10000;
    public static final double MAX_SPEED_MPS = 500;

    private final Clock clock;

    /**
     * @return the sample, with the server time filled in when the device sent none
     * @throws InvalidLocationException carrying the rejected input
     */
    public LocationSampleRequest validate(LocationSampleRequest raw) {
        if (raw == null || !GeoMath.isValidLatitude(raw.getLatitude()) || !GeoMath.isValidLongitude(raw.getLongitude())) {
            throw new InvalidLocationException(ErrorCode.INVALID_COORDINATES,
                    raw == null ? "Location sample is required"
                            : "Invalid coordinates: (" + raw.getLatitude() + ", " + raw.getLongitude() + ")",
                    raw);
        }
        if (raw.getAccuracyM() != null && !inRange(raw.getAccuracyM(), MAX_ACCURACY_METERS)) {
            throw new InvalidLocationException(ErrorCode.INVALID_ACCURACY,
                    "Accuracy must be between 0 and " + (int) MAX_ACCURACY_METERS + " meters", raw);
        }
        if (raw.getSpeedMps() != null && !inRange(raw.getSpeedMps(), MAX_SPEED_MPS)) {
            throw new InvalidLocationException(ErrorCode.INVALID_SPEED,
                    "Speed must be between 0 and " + (int) MAX_SPEED_MPS + " m/s", raw);
        }
        if (raw.getTimestamp() != null) {
            return raw;
        }
        return raw.toBuilder().timestamp(clock.instant()).build();
    }

    private static boolean inRange(double value, double max) {
        return !Double.isNaN(value) && value >= 0 && value <= max;
    }
}
