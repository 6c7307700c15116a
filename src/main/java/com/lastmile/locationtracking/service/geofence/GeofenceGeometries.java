package com.lastmile.locationtracking.service.geofence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lastmile.locationtracking.entity.Coordinates;
import com.lastmile.locationtracking.entity.Geofence;
import com.lastmile.locationtracking.entity.GeometryType;
import com.lastmile.locationtracking.exception.GeofenceGeometryException;
import com.lastmile.locationtracking.util.GeoMath;

import java.util.ArrayList;
import java.util.List;

/**
 * Validation and (de)serialization of geofence geometry.
 *
 * Polygon rings are stored as a JSON array of [lat, lon] pairs:
 *   e.g. [[12.970,77.593],[12.972,77.593],[12.972,77.596],[12.970,77.593]]
 *
 * Malformed geometry is an error, never "outside".
 */
public final class GeofenceGeometries {

    public static final double MAX_RADIUS_METERS = 10000;
    public static final int MIN_RING_VERTICES = 4;

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private GeofenceGeometries() {
    }

    /** Builds the geometry of a stored geofence. */
    public static GeofenceGeometry of(Geofence geofence) {
        if (geofence.getGeometryType() == GeometryType.POLYGON) {
            return new PolygonGeometry(parseRing(geofence.getPolygonRing()));
        }
        return new CircleGeometry(geofence.getCenter(), geofence.getRadiusM());
    }

    public static void validateCircle(Coordinates center, Double radiusM) {
        if (!GeoMath.isValidCoordinates(center)) {
            throw new GeofenceGeometryException("Circle geometry requires a valid center");
        }
        if (radiusM == null || radiusM.isNaN() || radiusM <= 0 || radiusM > MAX_RADIUS_METERS) {
            throw new GeofenceGeometryException("Radius must be between 1 and " + (int) MAX_RADIUS_METERS + " meters");
        }
    }

    public static void validateRing(List<Coordinates> ring) {
        if (ring == null || ring.size() < MIN_RING_VERTICES) {
            throw new GeofenceGeometryException("Polygon must have at least " + MIN_RING_VERTICES + " points");
        }
        for (Coordinates vertex : ring) {
            if (!GeoMath.isValidCoordinates(vertex)) {
                throw new GeofenceGeometryException("Invalid polygon coordinates: " + vertex);
            }
        }
        if (!ring.get(0).equals(ring.get(ring.size() - 1))) {
            throw new GeofenceGeometryException("Polygon ring must be closed (first point == last point)");
        }
    }

    public static String toJson(List<Coordinates> ring) {
        double[][] pairs = new double[ring.size()][];
        for (int i = 0; i < ring.size(); i++) {
            pairs[i] = new double[] {ring.get(i).getLatitude(), ring.get(i).getLongitude()};
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(pairs);
        } catch (JsonProcessingException e) {
            throw new GeofenceGeometryException("Polygon ring could not be serialized", e);
        }
    }

    public static List<Coordinates> parseRing(String json) {
        if (json == null || json.isBlank()) {
            throw new GeofenceGeometryException("Polygon geometry requires a ring");
        }
        double[][] pairs;
        try {
            pairs = OBJECT_MAPPER.readValue(json, double[][].class);
        } catch (JsonProcessingException e) {
            throw new GeofenceGeometryException("Malformed polygon ring JSON", e);
        }
        List<Coordinates> ring = new ArrayList<>(pairs.length);
        for (double[] pair : pairs) {
            if (pair == null || pair.length != 2) {
                throw new GeofenceGeometryException("Invalid polygon coordinate format");
            }
            ring.add(Coordinates.of(pair[0], pair[1]));
        }
        validateRing(ring);
        return ring;
    }
}
