package com.lastmile.locationtracking.service.geofence;

import com.lastmile.locationtracking.entity.Coordinates;
import com.lastmile.locationtracking.util.GeoMath;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CircleGeometry implements GeofenceGeometry {

    private final Coordinates center;
    private final double radiusMeters;

    @Override
    public boolean contains(Coordinates point) {
        return GeoMath.isWithinRadius(point, center, radiusMeters);
    }

    @Override
    public double distanceMeters(Coordinates point) {
        return Math.max(0, GeoMath.distanceMeters(point, center) - radiusMeters);
    }
}
