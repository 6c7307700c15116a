package com.lastmile.locationtracking.service.geofence;

import com.lastmile.locationtracking.entity.Coordinates;
import com.lastmile.locationtracking.util.GeoMath;
import lombok.Getter;

import java.util.List;

/**
 * Simple polygon given as a closed ring of vertices (first == last).
 */
@Getter
public class PolygonGeometry implements GeofenceGeometry {

    private final List<Coordinates> ring;

    public PolygonGeometry(List<Coordinates> ring) {
        this.ring = List.copyOf(ring);
    }

    @Override
    public boolean contains(Coordinates point) {
        return GeoMath.isWithinPolygon(point, ring);
    }

    /** Distance to the closest edge, 0 when inside. */
    @Override
    public double distanceMeters(Coordinates point) {
        if (contains(point)) return 0;
        double min = Double.MAX_VALUE;
        for (int i = 0; i < ring.size() - 1; i++) {
            min = Math.min(min, GeoMath.closestPointOnSegment(point, ring.get(i), ring.get(i + 1)).getDistanceMeters());
        }
        return min;
    }
}
