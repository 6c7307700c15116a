package com.lastmile.locationtracking.service.privacy;

import com.lastmile.locationtracking.entity.Coordinates;
import com.lastmile.locationtracking.util.GeoMath;

/**
 * Deterministic alternative to random offsets: snaps the point to the centre
 * of a square grid cell whose side equals the privacy radius. Every point in
 * a cell maps to the same output, which lies at most radius·√2/2 away.
 */
public class GridSnapGeneralizer implements CoordinateGeneralizer {

    private static final double MIN_COS_LATITUDE = 1e-6;

    @Override
    public Coordinates generalize(Coordinates coordinates, double radiusMeters) {
        double latitude = coordinates.getLatitude();
        double longitude = coordinates.getLongitude();

        double latCell = radiusMeters / GeoMath.METERS_PER_DEGREE;
        double cosLat = Math.max(Math.cos(Math.toRadians(latitude)), MIN_COS_LATITUDE);
        double lonCell = radiusMeters / (GeoMath.METERS_PER_DEGREE * cosLat);

        double snappedLat = Math.floor(latitude / latCell) * latCell + latCell / 2;
        double snappedLon = Math.floor(longitude / lonCell) * lonCell + lonCell / 2;

        return Coordinates.of(
                Math.max(-90, Math.min(90, snappedLat)),
                GeoMath.normalizeLongitude(snappedLon));
    }
}
