package com.lastmile.locationtracking.util;

import com.lastmile.locationtracking.entity.Coordinates;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Duration;
import java.util.List;

/**
 * Pure geometry helpers for GPS coordinates.
 *
 * Distances use the haversine formula on a spherical earth (R = 6371 km).
 * Polygon checks work in the lat/lon plane, which is accurate enough for
 * geofences a few kilometres across.
 */
public final class GeoMath {

    // Earth's radius in meters
    public static final double EARTH_RADIUS_METERS = 6371000;

    /** Metres per degree of latitude used by local equirectangular approximations. */
    public static final double METERS_PER_DEGREE = 111320;

    // Tolerance, in degrees, for treating a point as lying on a polygon edge (~0.1 mm)
    private static final double EDGE_EPSILON_DEGREES = 1e-9;

    private GeoMath() {
    }

    /**
     * Calculate distance between two GPS coordinates using Haversine formula
     *
     * @param lat1 Latitude of first point
     * @param lon1 Longitude of first point
     * @param lat2 Latitude of second point
     * @param lon2 Longitude of second point
     * @return Distance in meters
     */
    public static double distanceMeters(double lat1, double lon1, double lat2, double lon2) {
        double lat1Rad = Math.toRadians(lat1);
        double lat2Rad = Math.toRadians(lat2);
        double deltaLat = lat2Rad - lat1Rad;
        double deltaLon = Math.toRadians(lon2 - lon1);

        double a = Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2) +
                   Math.cos(lat1Rad) * Math.cos(lat2Rad) *
                   Math.sin(deltaLon / 2) * Math.sin(deltaLon / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }

    public static double distanceMeters(Coordinates from, Coordinates to) {
        return distanceMeters(from.getLatitude(), from.getLongitude(), to.getLatitude(), to.getLongitude());
    }

    public static double distanceKm(Coordinates from, Coordinates to) {
        return distanceMeters(from, to) / 1000.0;
    }

    /**
     * Initial great-circle bearing from one point towards another.
     *
     * @return bearing in degrees, normalised to [0, 360)
     */
    public static double bearing(Coordinates from, Coordinates to) {
        double lat1 = Math.toRadians(from.getLatitude());
        double lat2 = Math.toRadians(to.getLatitude());
        double deltaLon = Math.toRadians(to.getLongitude() - from.getLongitude());

        double y = Math.sin(deltaLon) * Math.cos(lat2);
        double x = Math.cos(lat1) * Math.sin(lat2) - Math.sin(lat1) * Math.cos(lat2) * Math.cos(deltaLon);
        return (Math.toDegrees(Math.atan2(y, x)) + 360) % 360;
    }

    /**
     * Point reached by travelling {@code distanceMeters} from {@code start}
     * along the great circle with the given initial bearing.
     */
    public static Coordinates destination(Coordinates start, double bearingDegrees, double distanceMeters) {
        double angular = distanceMeters / EARTH_RADIUS_METERS;
        double theta = Math.toRadians(bearingDegrees);
        double lat1 = Math.toRadians(start.getLatitude());
        double lon1 = Math.toRadians(start.getLongitude());

        double lat2 = Math.asin(Math.sin(lat1) * Math.cos(angular)
                + Math.cos(lat1) * Math.sin(angular) * Math.cos(theta));
        double lon2 = lon1 + Math.atan2(Math.sin(theta) * Math.sin(angular) * Math.cos(lat1),
                Math.cos(angular) - Math.sin(lat1) * Math.sin(lat2));

        return Coordinates.of(Math.toDegrees(lat2), normalizeLongitude(Math.toDegrees(lon2)));
    }

    /**
     * Check if a point is within a circular geofence. The boundary counts as inside.
     *
     * @param point        point to check
     * @param center       geofence center
     * @param radiusMeters radius of geofence in meters
     */
    public static boolean isWithinRadius(Coordinates point, Coordinates center, double radiusMeters) {
        return distanceMeters(point, center) <= radiusMeters;
    }

    /**
     * Check if a point is inside a polygon using the Ray-Casting algorithm.
     *
     * Cast a horizontal ray from the test point and count how many polygon
     * edges it crosses; an odd count means the point is inside. Points lying
     * on an edge or a vertex are reported as inside, matching the inclusive
     * circle check.
     *
     * @param point the point to test
     * @param ring  polygon vertices, closed or open (minimum 3 distinct vertices)
     */
    public static boolean isWithinPolygon(Coordinates point, List<Coordinates> ring) {
        if (ring == null || ring.size() < 3) return false;
        if (isOnBoundary(point, ring)) return true;

        double lat = point.getLatitude();
        double lon = point.getLongitude();
        int n = ring.size();
        boolean inside = false;
        for (int i = 0, j = n - 1; i < n; j = i++) {
            double latI = ring.get(i).getLatitude(), lonI = ring.get(i).getLongitude();
            double latJ = ring.get(j).getLatitude(), lonJ = ring.get(j).getLongitude();
            // Does the edge cross the horizontal line through (lat, lon)?
            if (((lonI > lon) != (lonJ > lon)) &&
                    (lat < (latJ - latI) * (lon - lonI) / (lonJ - lonI) + latI)) {
                inside = !inside;
            }
        }
        return inside;
    }

    private static boolean isOnBoundary(Coordinates point, List<Coordinates> ring) {
        int n = ring.size();
        for (int i = 0, j = n - 1; i < n; j = i++) {
            if (isOnSegment(point, ring.get(j), ring.get(i))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isOnSegment(Coordinates p, Coordinates a, Coordinates b) {
        double cross = (b.getLatitude() - a.getLatitude()) * (p.getLongitude() - a.getLongitude())
                - (b.getLongitude() - a.getLongitude()) * (p.getLatitude() - a.getLatitude());
        if (Math.abs(cross) > EDGE_EPSILON_DEGREES) return false;

        return p.getLatitude() >= Math.min(a.getLatitude(), b.getLatitude()) - EDGE_EPSILON_DEGREES
                && p.getLatitude() <= Math.max(a.getLatitude(), b.getLatitude()) + EDGE_EPSILON_DEGREES
                && p.getLongitude() >= Math.min(a.getLongitude(), b.getLongitude()) - EDGE_EPSILON_DEGREES
                && p.getLongitude() <= Math.max(a.getLongitude(), b.getLongitude()) + EDGE_EPSILON_DEGREES;
    }

    /**
     * Closest point to {@code point} on the segment a-b.
     *
     * The segment is projected onto a local equirectangular plane centred on
     * {@code point}; the returned distance is the haversine distance to the
     * projected foot.
     */
    public static ClosestPoint closestPointOnSegment(Coordinates point, Coordinates a, Coordinates b) {
        double cosLat = Math.cos(Math.toRadians(point.getLatitude()));

        double ax = (a.getLongitude() - point.getLongitude()) * cosLat * METERS_PER_DEGREE;
        double ay = (a.getLatitude() - point.getLatitude()) * METERS_PER_DEGREE;
        double bx = (b.getLongitude() - point.getLongitude()) * cosLat * METERS_PER_DEGREE;
        double by = (b.getLatitude() - point.getLatitude()) * METERS_PER_DEGREE;

        double dx = bx - ax;
        double dy = by - ay;
        double lengthSquared = dx * dx + dy * dy;
        double t = lengthSquared == 0 ? 0 : (-ax * dx - ay * dy) / lengthSquared;
        t = Math.max(0, Math.min(1, t));

        Coordinates foot = Coordinates.of(
                a.getLatitude() + t * (b.getLatitude() - a.getLatitude()),
                a.getLongitude() + t * (b.getLongitude() - a.getLongitude()));
        return new ClosestPoint(foot, distanceMeters(point, foot));
    }

    /** Total length of a path through the given points, in meters. */
    public static double routeDistanceMeters(List<Coordinates> route) {
        double total = 0;
        for (int i = 1; i < route.size(); i++) {
            total += distanceMeters(route.get(i - 1), route.get(i));
        }
        return total;
    }

    /**
     * Average speed over a distance travelled in the given time.
     *
     * @return speed in km/h, or null when the elapsed time is not positive
     */
    public static Double speedKmh(double distanceKm, Duration elapsed) {
        if (elapsed == null || elapsed.isZero() || elapsed.isNegative()) return null;
        double hours = elapsed.toMillis() / 3_600_000.0;
        return distanceKm / hours;
    }

    public static boolean isValidLatitude(Double latitude) {
        return latitude != null && !latitude.isNaN() && latitude >= -90 && latitude <= 90;
    }

    public static boolean isValidLongitude(Double longitude) {
        return longitude != null && !longitude.isNaN() && longitude >= -180 && longitude <= 180;
    }

    public static boolean isValidCoordinates(Coordinates coordinates) {
        return coordinates != null
                && isValidLatitude(coordinates.getLatitude())
                && isValidLongitude(coordinates.getLongitude());
    }

    /** Wraps a longitude into [-180, 180]. */
    public static double normalizeLongitude(double longitude) {
        double normalized = ((longitude + 180) % 360 + 360) % 360 - 180;
        return normalized == -180 && longitude > 0 ? 180 : normalized;
    }

    /** Foot of the perpendicular from a point onto a segment, with its distance. */
    @Getter
    @AllArgsConstructor
    public static class ClosestPoint {
        private final Coordinates point;
        private final double distanceMeters;
    }
}
