package com.lastmile.locationtracking.service.geofence;

import com.lastmile.locationtracking.dto.DeliveryGeofencesRequest;
import com.lastmile.locationtracking.dto.GeofenceRequest;
import com.lastmile.locationtracking.dto.GeofenceStats;
import com.lastmile.locationtracking.entity.Coordinates;
import com.lastmile.locationtracking.entity.Geofence;
import com.lastmile.locationtracking.entity.GeofenceEvent;
import com.lastmile.locationtracking.entity.GeofenceEventType;
import com.lastmile.locationtracking.entity.GeofenceKind;
import com.lastmile.locationtracking.entity.GeometryType;
import com.lastmile.locationtracking.exception.ErrorCode;
import com.lastmile.locationtracking.exception.GeofenceGeometryException;
import com.lastmile.locationtracking.exception.GeofenceNotFoundException;
import com.lastmile.locationtracking.store.InMemoryGeofenceStore;
import com.lastmile.locationtracking.util.GeoMath;
import com.lastmile.locationtracking.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for GeofenceService: creation and update rules, delivery helper, expiry sweep, statistics.
 */
@ExtendWith(MockitoExtension.class)
class GeofenceServiceTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private CacheableGeofenceService cacheableGeofenceService;

    private InMemoryGeofenceStore store;
    private MutableClock clock;
    private GeofenceService geofenceService;

    // ── Test fixtures ─────────────────────────────────────────────────────────

    private static final Coordinates WAREHOUSE = Coordinates.of(18.5204, 73.8567);
    private static final Coordinates CUSTOMER  = Coordinates.of(18.5590, 73.7868);

    private static final List<Coordinates> YARD = List.of(
            Coordinates.of(18.519, 73.855), Coordinates.of(18.521, 73.855),
            Coordinates.of(18.521, 73.858), Coordinates.of(18.519, 73.858),
            Coordinates.of(18.519, 73.855));

    @BeforeEach
    void setUp() {
        store = new InMemoryGeofenceStore();
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        geofenceService = new GeofenceService(store, cacheableGeofenceService, clock);
    }

    private GeofenceRequest.GeofenceRequestBuilder circle(double radius) {
        return GeofenceRequest.builder()
                .name("Warehouse gate")
                .tripId("TRIP-1")
                .kind(GeofenceKind.PICKUP)
                .geometryType(GeometryType.CIRCLE)
                .center(WAREHOUSE)
                .radiusM(radius);
    }

    // ════════════════════════════════════════════════════════════════════════
    // create
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Valid circle is stored active, UTC by default, and the active cache is evicted")
    void createCircle() {
        Geofence saved = geofenceService.create(circle(150).build());

        assertThat(saved.getId()).isNotNull();
        assertThat(saved.isActive()).isTrue();
        assertThat(saved.getTimezone()).isEqualTo("UTC");
        assertThat(saved.policy().isOnEntry()).isTrue();
        assertThat(saved.policy().isOnExit()).isTrue();
        verify(cacheableGeofenceService).evictActiveGeofences();
    }

    @Test
    @DisplayName("Circle radius must be in (0, 10000] m")
    void circleRadiusBounds() {
        assertThatThrownBy(() -> geofenceService.create(circle(0).build()))
                .isInstanceOf(GeofenceGeometryException.class);
        assertThatThrownBy(() -> geofenceService.create(circle(10_001).build()))
                .isInstanceOf(GeofenceGeometryException.class);
        assertThat(geofenceService.create(circle(10_000).build()).getRadiusM()).isEqualTo(10_000.0);
    }

    @Test
    @DisplayName("Polygon ring is stored as JSON and read back unchanged")
    void createPolygon() {
        Geofence saved = geofenceService.create(GeofenceRequest.builder()
                .kind(GeofenceKind.RESTRICTED)
                .geometryType(GeometryType.POLYGON)
                .ring(YARD)
                .build());

        assertThat(saved.getTripId()).isNull();
        assertThat(GeofenceGeometries.parseRing(saved.getPolygonRing())).isEqualTo(YARD);
    }

    @Test
    @DisplayName("Open rings, short rings and invalid vertices are rejected")
    void polygonValidation() {
        List<Coordinates> open = YARD.subList(0, 4);
        List<Coordinates> tooShort = List.of(YARD.get(0), YARD.get(1), YARD.get(0));
        List<Coordinates> badVertex = List.of(
                Coordinates.of(18.519, 73.855), Coordinates.of(95.0, 73.855),
                Coordinates.of(18.521, 73.858), Coordinates.of(18.519, 73.855));

        for (List<Coordinates> ring : List.of(open, tooShort, badVertex)) {
            assertThatThrownBy(() -> geofenceService.create(GeofenceRequest.builder()
                    .kind(GeofenceKind.RESTRICTED)
                    .geometryType(GeometryType.POLYGON)
                    .ring(ring)
                    .build()))
                    .isInstanceOf(GeofenceGeometryException.class)
                    .extracting("errorCode").isEqualTo(ErrorCode.GEOFENCE_GEOMETRY_ERROR);
        }
        verifyNoInteractions(cacheableGeofenceService);
    }

    @Test
    @DisplayName("Unknown timezone and inverted active window are rejected")
    void scheduleValidation() {
        assertThatThrownBy(() -> geofenceService.create(circle(100).timezone("Mars/Olympus").build()))
                .isInstanceOf(GeofenceGeometryException.class)
                .hasMessageContaining("timezone");
        assertThatThrownBy(() -> geofenceService.create(circle(100)
                .activeFrom(LocalDateTime.of(2024, 3, 1, 18, 0))
                .activeUntil(LocalDateTime.of(2024, 3, 1, 9, 0))
                .build()))
                .isInstanceOf(GeofenceGeometryException.class);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Delivery helper
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Delivery geofences: pickup (entry/exit, dwell 300 s) and delivery (entry, dwell 600 s)")
    void deliveryGeofences() {
        List<Geofence> created = geofenceService.createDeliveryGeofences("TRIP-9",
                DeliveryGeofencesRequest.builder()
                        .deliveryNumber("DLV-1042")
                        .pickupLocation(WAREHOUSE)
                        .deliveryLocation(CUSTOMER)
                        .deliveryRadiusM(250.0)
                        .build());

        assertThat(created).hasSize(2);
        Geofence pickup = created.get(0);
        Geofence delivery = created.get(1);

        assertThat(pickup.getKind()).isEqualTo(GeofenceKind.PICKUP);
        assertThat(pickup.getName()).isEqualTo("Pickup - DLV-1042");
        assertThat(pickup.getRadiusM()).isEqualTo(100.0);
        assertThat(pickup.policy().isOnExit()).isTrue();
        assertThat(pickup.policy().getDwellDurationSec()).isEqualTo(300);

        assertThat(delivery.getKind()).isEqualTo(GeofenceKind.DELIVERY);
        assertThat(delivery.getRadiusM()).isEqualTo(250.0);
        assertThat(delivery.policy().isOnEntry()).isTrue();
        assertThat(delivery.policy().isOnExit()).isFalse();
        assertThat(delivery.policy().isDwellEnabled()).isTrue();
        assertThat(delivery.policy().getDwellDurationSec()).isEqualTo(600);
        assertThat(created).allSatisfy(g -> assertThat(g.getTripId()).isEqualTo("TRIP-9"));
    }

    // ════════════════════════════════════════════════════════════════════════
    // Deactivation
    // ════════════════════════════════════════════════════════════════════════

    // ════════════════════════════════════════════════════════════════════════
    // update
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("update replaces circle with polygon, keeps id and active flag, evicts the cache")
    void updateReplacesGeometry() {
        Geofence created = geofenceService.create(circle(150).build());
        clearInvocations(cacheableGeofenceService);

        Geofence updated = geofenceService.update(created.getId(), GeofenceRequest.builder()
                .name("Depot yard")
                .kind(GeofenceKind.RESTRICTED)
                .geometryType(GeometryType.POLYGON)
                .ring(YARD)
                .timezone("Asia/Kolkata")
                .build());

        assertThat(updated.getId()).isEqualTo(created.getId());
        assertThat(updated.isActive()).isTrue();
        assertThat(updated.getGeometryType()).isEqualTo(GeometryType.POLYGON);
        assertThat(updated.getCenter()).isNull();
        assertThat(updated.getTripId()).isNull();
        assertThat(updated.getTimezone()).isEqualTo("Asia/Kolkata");
        assertThat(store.findGeofence(created.getId()).orElseThrow().getName()).isEqualTo("Depot yard");
        verify(cacheableGeofenceService).evictActiveGeofences();
    }

    @Test
    @DisplayName("update with an open ring is rejected and the stored geofence is unchanged")
    void updateValidatesGeometry() {
        Geofence created = geofenceService.create(circle(150).build());
        clearInvocations(cacheableGeofenceService);
        GeofenceRequest openRing = GeofenceRequest.builder()
                .kind(GeofenceKind.RESTRICTED)
                .geometryType(GeometryType.POLYGON)
                .ring(YARD.subList(0, 4))
                .build();

        assertThatThrownBy(() -> geofenceService.update(created.getId(), openRing))
                .isInstanceOf(GeofenceGeometryException.class);

        Geofence stored = store.findGeofence(created.getId()).orElseThrow();
        assertThat(stored.getGeometryType()).isEqualTo(GeometryType.CIRCLE);
        assertThat(stored.getRadiusM()).isEqualTo(150.0);
        verifyNoInteractions(cacheableGeofenceService);
    }

    @Test
    @DisplayName("update of an unknown id → GEOFENCE_NOT_FOUND")
    void updateUnknown() {
        assertThatThrownBy(() -> geofenceService.update(404L, circle(100).build()))
                .isInstanceOf(GeofenceNotFoundException.class);
    }

    // ════════════════════════════════════════════════════════════════════════
    // statistics
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Stats count events per kind and average the recorded dwell times")
    void statsPerKind() {
        Geofence geofence = geofenceService.create(circle(150).build());
        Instant t0 = clock.instant();
        store.appendEvent(event(geofence, "courier-7", GeofenceEventType.ENTER, null, t0));
        store.appendEvent(event(geofence, "courier-7", GeofenceEventType.DWELL, 300L, t0.plusSeconds(300)));
        store.appendEvent(event(geofence, "courier-7", GeofenceEventType.EXIT, 420L, t0.plusSeconds(420)));
        store.appendEvent(event(geofence, "courier-8", GeofenceEventType.ENTER, null, t0.plusSeconds(500)));
        store.appendEvent(event(geofence, "courier-8", GeofenceEventType.DWELL, 600L, t0.plusSeconds(1100)));

        GeofenceStats stats = geofenceService.statsForGeofence(geofence.getId());

        assertThat(stats.getTotalEvents()).isEqualTo(5);
        assertThat(stats.getUniqueUsers()).isEqualTo(2);
        assertThat(stats.getFirstEventAt()).isEqualTo(t0);
        assertThat(stats.getLastEventAt()).isEqualTo(t0.plusSeconds(1100));
        assertThat(stats.getByKind().get(GeofenceEventType.ENTER).getCount()).isEqualTo(2);
        assertThat(stats.getByKind().get(GeofenceEventType.ENTER).getAverageDwellSec()).isNull();
        assertThat(stats.getByKind().get(GeofenceEventType.DWELL).getAverageDwellSec()).isEqualTo(450.0);
        assertThat(stats.getByKind().get(GeofenceEventType.DWELL).getMaxDwellSec()).isEqualTo(600L);
        assertThat(stats.getByKind().get(GeofenceEventType.EXIT).getCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("Stats of a geofence without events are empty; unknown id → GEOFENCE_NOT_FOUND")
    void statsEmptyAndUnknown() {
        Geofence geofence = geofenceService.create(circle(150).build());

        GeofenceStats stats = geofenceService.statsForGeofence(geofence.getId());

        assertThat(stats.getTotalEvents()).isZero();
        assertThat(stats.getByKind()).isEmpty();
        assertThat(stats.getFirstEventAt()).isNull();
        assertThatThrownBy(() -> geofenceService.statsForGeofence(404L))
                .isInstanceOf(GeofenceNotFoundException.class);
    }

    private static GeofenceEvent event(Geofence geofence, String userId, GeofenceEventType kind,
                                       Long dwellSeconds, Instant at) {
        return GeofenceEvent.builder()
                .geofenceId(geofence.getId())
                .userId(userId)
                .tripId(geofence.getTripId())
                .kind(kind)
                .coordinates(WAREHOUSE)
                .dwellSeconds(dwellSeconds)
                .triggeredAt(at)
                .build();
    }

    @Test
    @DisplayName("deactivate: unknown id → GEOFENCE_NOT_FOUND")
    void deactivateUnknown() {
        assertThatThrownBy(() -> geofenceService.deactivate(404L))
                .isInstanceOf(GeofenceNotFoundException.class);
    }

    @Test
    @DisplayName("deactivateExpired switches off only geofences whose window closed")
    void expirySweep() {
        Geofence expired = geofenceService.create(circle(100)
                .activeUntil(LocalDateTime.of(2024, 3, 1, 9, 0)).build());
        Geofence current = geofenceService.create(circle(100)
                .activeUntil(LocalDateTime.of(2024, 3, 1, 18, 0)).build());
        Geofence open = geofenceService.create(circle(100).build());

        int swept = geofenceService.deactivateExpired();

        assertThat(swept).isEqualTo(1);
        assertThat(store.findGeofence(expired.getId()).orElseThrow().isActive()).isFalse();
        assertThat(store.findGeofence(current.getId()).orElseThrow().isActive()).isTrue();
        assertThat(store.findGeofence(open.getId()).orElseThrow().isActive()).isTrue();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Distance
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Distance to a circle is d - r outside and 0 inside")
    void distanceToCircle() {
        Geofence gate = geofenceService.create(circle(100).build());

        double outside = geofenceService.distanceToGeofence(GeoMath.destination(WAREHOUSE, 90, 600), gate);
        double inside = geofenceService.distanceToGeofence(GeoMath.destination(WAREHOUSE, 90, 50), gate);

        assertThat(outside).isCloseTo(500, within(0.01));
        assertThat(inside).isZero();
    }

    @Test
    @DisplayName("Distance to a polygon is the distance to its nearest edge")
    void distanceToPolygon() {
        Geofence yard = geofenceService.create(GeofenceRequest.builder()
                .kind(GeofenceKind.RESTRICTED)
                .geometryType(GeometryType.POLYGON)
                .ring(YARD)
                .build());
        Coordinates south = Coordinates.of(18.518, 73.8565);

        double meters = geofenceService.distanceToGeofence(south, yard.getId());

        assertThat(meters).isCloseTo(GeoMath.distanceMeters(south, Coordinates.of(18.519, 73.8565)), within(0.5));
        assertThat(geofenceService.distanceToGeofence(Coordinates.of(18.520, 73.8565), yard)).isZero();
    }
}
