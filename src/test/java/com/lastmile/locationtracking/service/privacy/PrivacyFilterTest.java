package com.lastmile.locationtracking.service.privacy;

import com.lastmile.locationtracking.entity.Coordinates;
import com.lastmile.locationtracking.entity.LocationSample;
import com.lastmile.locationtracking.entity.TrackingLevel;
import com.lastmile.locationtracking.util.GeoMath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for PrivacyFilter and the two coordinate generalizers.
 */
class PrivacyFilterTest {

    private static final Instant SAMPLE_TIME = Instant.parse("2024-03-01T12:07:30Z");

    private final PrivacyFilter seededFilter = new PrivacyFilter(new RandomOffsetGeneralizer(new Random(42)));

    private LocationSample buildSample(double lat, double lon) {
        return LocationSample.builder()
                .id(7L)
                .tripId("TRIP-1")
                .userId("courier-1")
                .coordinates(Coordinates.of(lat, lon))
                .accuracyM(12.0)
                .altitudeM(560.0)
                .bearingDeg(90.0)
                .speedMps(8.5)
                .batteryPct(64)
                .networkType("4G")
                .timestamp(SAMPLE_TIME)
                .build();
    }

    @Test
    @DisplayName("PRECISE: sample passes through unchanged")
    void preciseIsPassThrough() {
        LocationSample raw = buildSample(18.5204, 73.8567);

        LocationSample filtered = seededFilter.filter(raw, TrackingLevel.PRECISE);

        assertThat(filtered.getCoordinates()).isEqualTo(raw.getCoordinates());
        assertThat(filtered.getTimestamp()).isEqualTo(SAMPLE_TIME);
        assertThat(filtered.getBatteryPct()).isEqualTo(64);
        assertThat(filtered.getAccuracyM()).isEqualTo(12.0);
    }

    @Test
    @DisplayName("APPROXIMATE: 500 m blur, 5-minute timestamp, bearing/battery/network dropped")
    void approximateLevel() {
        LocationSample raw = buildSample(18.5204, 73.8567);

        LocationSample filtered = seededFilter.filter(raw, TrackingLevel.APPROXIMATE);

        assertThat(GeoMath.distanceMeters(raw.getCoordinates(), filtered.getCoordinates())).isLessThanOrEqualTo(500);
        assertThat(filtered.getTimestamp()).isEqualTo(Instant.parse("2024-03-01T12:05:00Z"));
        assertThat(filtered.getAccuracyM()).isEqualTo(500.0);
        assertThat(filtered.getBearingDeg()).isNull();
        assertThat(filtered.getBatteryPct()).isNull();
        assertThat(filtered.getNetworkType()).isNull();
        // kept at this level
        assertThat(filtered.getSpeedMps()).isEqualTo(8.5);
        assertThat(filtered.getAltitudeM()).isEqualTo(560.0);
        // raw sample untouched
        assertThat(raw.getCoordinates()).isEqualTo(Coordinates.of(18.5204, 73.8567));
        assertThat(raw.getBatteryPct()).isEqualTo(64);
    }

    @Test
    @DisplayName("MINIMAL: 30-minute timestamp and speed/bearing/altitude/battery/network dropped")
    void minimalLevel() {
        LocationSample filtered = seededFilter.filter(buildSample(18.5204, 73.8567), TrackingLevel.MINIMAL);

        assertThat(filtered.getTimestamp()).isEqualTo(Instant.parse("2024-03-01T12:00:00Z"));
        assertThat(filtered.getAccuracyM()).isEqualTo(5000.0);
        assertThat(filtered.getSpeedMps()).isNull();
        assertThat(filtered.getBearingDeg()).isNull();
        assertThat(filtered.getAltitudeM()).isNull();
        assertThat(filtered.getBatteryPct()).isNull();
        assertThat(filtered.getNetworkType()).isNull();
        assertThat(filtered.getTripId()).isEqualTo("TRIP-1");
    }

    @Test
    @DisplayName("MINIMAL: 10,000 random trials all stay within 5 km of the raw point")
    void minimalOffsetIsBounded() {
        Random points = new Random(7);
        for (int i = 0; i < 10_000; i++) {
            double lat = points.nextDouble() * 140 - 70;
            double lon = points.nextDouble() * 360 - 180;
            LocationSample raw = buildSample(lat, lon);

            LocationSample filtered = seededFilter.filter(raw, TrackingLevel.MINIMAL);

            assertThat(GeoMath.distanceMeters(raw.getCoordinates(), filtered.getCoordinates()))
                    .as("trial %d at (%f, %f)", i, lat, lon)
                    .isLessThanOrEqualTo(PrivacyFilter.MINIMAL_RADIUS_METERS);
        }
    }

    @Test
    @DisplayName("Same seed → same generalized output")
    void seededRandomIsReproducible() {
        LocationSample raw = buildSample(40.7128, -74.0060);

        LocationSample first = new PrivacyFilter(new RandomOffsetGeneralizer(new Random(99)))
                .filter(raw, TrackingLevel.APPROXIMATE);
        LocationSample second = new PrivacyFilter(new RandomOffsetGeneralizer(new Random(99)))
                .filter(raw, TrackingLevel.APPROXIMATE);

        assertThat(first.getCoordinates()).isEqualTo(second.getCoordinates());
    }

    @Test
    @DisplayName("Grid snapping is deterministic and within radius·√2/2")
    void gridSnap() {
        PrivacyFilter gridFilter = new PrivacyFilter(new GridSnapGeneralizer());
        LocationSample raw = buildSample(18.5204, 73.8567);
        LocationSample nearby = buildSample(18.5204, 73.8570);

        LocationSample a = gridFilter.filter(raw, TrackingLevel.MINIMAL);
        LocationSample b = gridFilter.filter(raw, TrackingLevel.MINIMAL);
        LocationSample c = gridFilter.filter(nearby, TrackingLevel.MINIMAL);

        assertThat(a.getCoordinates()).isEqualTo(b.getCoordinates());
        assertThat(c.getCoordinates()).isEqualTo(a.getCoordinates());
        assertThat(GeoMath.distanceMeters(raw.getCoordinates(), a.getCoordinates()))
                .isLessThanOrEqualTo(PrivacyFilter.MINIMAL_RADIUS_METERS * Math.sqrt(2) / 2);
    }

    @Test
    void floorToBucketIsEpochAligned() {
        assertThat(PrivacyFilter.floorToBucket(Instant.parse("2024-03-01T12:29:59Z"), 30))
                .isEqualTo(Instant.parse("2024-03-01T12:00:00Z"));
        assertThat(PrivacyFilter.floorToBucket(Instant.parse("2024-03-01T12:30:00Z"), 30))
                .isEqualTo(Instant.parse("2024-03-01T12:30:00Z"));
        assertThat(PrivacyFilter.floorToBucket(null, 5)).isNull();
    }
}
