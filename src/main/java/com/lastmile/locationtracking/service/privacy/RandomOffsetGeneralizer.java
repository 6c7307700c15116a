package com.lastmile.locationtracking.service.privacy;

import com.lastmile.locationtracking.entity.Coordinates;
import com.lastmile.locationtracking.util.GeoMath;

import java.util.Random;

/**
 * Moves the point by a random distance (uniform in [0, radius]) in a random
 * direction, using a local equirectangular approximation:
 *
 *   latOffset = d·cos(θ) / 111320
 *   lonOffset = d·sin(θ) / (111320·cos(lat))
 *
 * Pass a seeded {@link Random} for reproducible output.
 */
public class RandomOffsetGeneralizer implements CoordinateGeneralizer {

    // Keeps the longitude offset finite at the poles
    private static final double MIN_COS_LATITUDE = 1e-6;

    private final Random random;

    public RandomOffsetGeneralizer(Random random) {
        this.random = random;
    }

    @Override
    public Coordinates generalize(Coordinates coordinates, double radiusMeters) {
        double angle = random.nextDouble() * 2 * Math.PI;
        double distance = random.nextDouble() * radiusMeters;

        double latitude = coordinates.getLatitude();
        double cosLat = Math.max(Math.cos(Math.toRadians(latitude)), MIN_COS_LATITUDE);

        double latOffset = distance * Math.cos(angle) / GeoMath.METERS_PER_DEGREE;
        double lonOffset = distance * Math.sin(angle) / (GeoMath.METERS_PER_DEGREE * cosLat);

        return Coordinates.of(
                Math.max(-90, Math.min(90, latitude + latOffset)),
                GeoMath.normalizeLongitude(coordinates.getLongitude() + lonOffset));
    }
}
