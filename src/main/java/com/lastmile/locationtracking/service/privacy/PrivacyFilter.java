package com.lastmile.locationtracking.service.privacy;

import com.lastmile.locationtracking.entity.LocationSample;
import com.lastmile.locationtracking.entity.TrackingLevel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Produces the privacy-reduced view of a sample that leaves the engine
 * (current-location cache, history, broadcasts). The raw sample is never
 * modified; persistence and distance metrics always use the raw values.
 *
 *   PRECISE     - pass-through
 *   APPROXIMATE - ~500 m position, 5-minute timestamps, no bearing/battery/network
 *   MINIMAL     - ~5 km position, 30-minute timestamps, no speed/bearing/altitude/battery/network
 *
 * Reported accuracy is raised to at least the generalization radius.
 */
@Service
@RequiredArgsConstructor
public class PrivacyFilter {

    public static final double APPROXIMATE_RADIUS_METERS = 500;
    public static final double MINIMAL_RADIUS_METERS = 5000;
    public static final int APPROXIMATE_BUCKET_MINUTES = 5;
    public static final int MINIMAL_BUCKET_MINUTES = 30;

    private final CoordinateGeneralizer generalizer;

    public LocationSample filter(LocationSample sample, TrackingLevel level) {
        if (sample == null) return null;
        TrackingLevel effective = level != null ? level : TrackingLevel.PRECISE;

        switch (effective) {
            case APPROXIMATE:
                return applyApproximate(sample);
            case MINIMAL:
                return applyMinimal(sample);
            case PRECISE:
            default:
                return sample;
        }
    }

    private LocationSample applyApproximate(LocationSample sample) {
        return sample.toBuilder()
                .coordinates(generalizer.generalize(sample.getCoordinates(), APPROXIMATE_RADIUS_METERS))
                .accuracyM(atLeast(sample.getAccuracyM(), APPROXIMATE_RADIUS_METERS))
                .timestamp(floorToBucket(sample.getTimestamp(), APPROXIMATE_BUCKET_MINUTES))
                .bearingDeg(null)
                .batteryPct(null)
                .networkType(null)
                .build();
    }

    private LocationSample applyMinimal(LocationSample sample) {
        return sample.toBuilder()
                .coordinates(generalizer.generalize(sample.getCoordinates(), MINIMAL_RADIUS_METERS))
                .accuracyM(atLeast(sample.getAccuracyM(), MINIMAL_RADIUS_METERS))
                .timestamp(floorToBucket(sample.getTimestamp(), MINIMAL_BUCKET_MINUTES))
                .speedMps(null)
                .bearingDeg(null)
                .altitudeM(null)
                .batteryPct(null)
                .networkType(null)
                .build();
    }

    private static double atLeast(Double accuracy, double radius) {
        return Math.max(accuracy != null ? accuracy : 0, radius);
    }

    /** Rounds down to the start of the enclosing N-minute bucket (epoch aligned). */
    static Instant floorToBucket(Instant timestamp, int bucketMinutes) {
        if (timestamp == null) return null;
        long bucketSeconds = bucketMinutes * 60L;
        return Instant.ofEpochSecond(Math.floorDiv(timestamp.getEpochSecond(), bucketSeconds) * bucketSeconds);
    }
}
