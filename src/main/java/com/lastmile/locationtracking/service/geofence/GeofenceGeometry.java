package com.lastmile.locationtracking.service.geofence;

import com.lastmile.locationtracking.entity.Coordinates;

/**
 * Shape of a geofence: either a {@link CircleGeometry} or a {@link PolygonGeometry}.
 */
public interface GeofenceGeometry {

    /** Whether the point lies inside the shape; the boundary counts as inside. */
    boolean contains(Coordinates point);

    /** Distance in meters from the point to the shape; 0 when inside. */
    double distanceMeters(Coordinates point);
}
