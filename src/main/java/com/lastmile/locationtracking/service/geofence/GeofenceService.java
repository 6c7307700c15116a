package com.lastmile.locationtracking.service.geofence;

import com.lastmile.locationtracking.dto.DeliveryGeofencesRequest;
import com.lastmile.locationtracking.dto.GeofenceRequest;
import com.lastmile.locationtracking.dto.GeofenceStats;
import com.lastmile.locationtracking.dto.LocationSampleRequest;
import com.lastmile.locationtracking.entity.Coordinates;
import com.lastmile.locationtracking.entity.Geofence;
import com.lastmile.locationtracking.entity.GeofenceEvent;
import com.lastmile.locationtracking.entity.GeofenceEventType;
import com.lastmile.locationtracking.entity.GeofenceKind;
import com.lastmile.locationtracking.entity.GeometryType;
import com.lastmile.locationtracking.entity.NotificationPolicy;
import com.lastmile.locationtracking.exception.ErrorCode;
import com.lastmile.locationtracking.exception.GeofenceGeometryException;
import com.lastmile.locationtracking.exception.GeofenceNotFoundException;
import com.lastmile.locationtracking.exception.InvalidLocationException;
import com.lastmile.locationtracking.store.GeofenceStore;
import com.lastmile.locationtracking.util.GeoMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.LongSummaryStatistics;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Geofence administration: creation and replacement with geometry validation,
 * deactivation, the scheduled expiry sweep, event queries and statistics.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GeofenceService {

    public static final double DEFAULT_DELIVERY_RADIUS_METERS = 100;
    public static final int PICKUP_DWELL_SECONDS = 300;
    public static final int DELIVERY_DWELL_SECONDS = 600;

    private final GeofenceStore geofenceStore;
    private final CacheableGeofenceService cacheableGeofenceService;
    private final Clock clock;

    /**
     * Validates and stores a geofence.
     *
     * @throws GeofenceGeometryException on a bad circle, ring, timezone or active window
     */
    public Geofence create(GeofenceRequest request) {
        Geofence saved = geofenceStore.saveGeofence(validated(request).active(true).build());
        cacheableGeofenceService.evictActiveGeofences();
        log.info("Geofence #{} created — {} {} '{}', trip: {}", saved.getId(), saved.getKind(),
                saved.getGeometryType(), saved.getName(), saved.getTripId() != null ? saved.getTripId() : "ALL");
        return saved;
    }

    /**
     * Replaces the definition of a geofence with the request, validated like
     * {@link #create}. Id, creation time and the active flag are kept.
     * Containment state of couriers is kept too, so the next sample of each
     * courier is compared against the new shape.
     *
     * @throws GeofenceNotFoundException for an unknown id
     * @throws GeofenceGeometryException on a bad circle, ring, timezone or active window
     */
    public Geofence update(Long geofenceId, GeofenceRequest request) {
        Geofence existing = getGeofence(geofenceId);
        Geofence replacement = validated(request)
                .id(existing.getId())
                .createdAt(existing.getCreatedAt())
                .active(existing.isActive())
                .build();

        Geofence saved = geofenceStore.saveGeofence(replacement);
        cacheableGeofenceService.evictActiveGeofences();
        log.info("Geofence #{} updated — {} {} '{}', trip: {}", saved.getId(), saved.getKind(),
                saved.getGeometryType(), saved.getName(), saved.getTripId() != null ? saved.getTripId() : "ALL");
        return saved;
    }

    /**
     * Pickup and drop-off circles for a delivery trip.
     *
     *   pickup   - notify on entry and exit, dwell after 300 s
     *   delivery - notify on entry, dwell after 600 s
     *
     * Radii default to 100 m. A point that is missing is skipped.
     */
    public List<Geofence> createDeliveryGeofences(String tripId, DeliveryGeofencesRequest request) {
        List<Geofence> created = new ArrayList<>(2);
        String label = request.getDeliveryNumber() != null ? request.getDeliveryNumber() : tripId;

        if (request.getPickupLocation() != null) {
            created.add(create(GeofenceRequest.builder()
                    .name("Pickup - " + label)
                    .tripId(tripId)
                    .kind(GeofenceKind.PICKUP)
                    .geometryType(GeometryType.CIRCLE)
                    .center(request.getPickupLocation())
                    .radiusM(radiusOrDefault(request.getPickupRadiusM()))
                    .notificationPolicy(NotificationPolicy.builder()
                            .onEntry(true).onExit(true).dwellEnabled(true)
                            .dwellDurationSec(PICKUP_DWELL_SECONDS).build())
                    .build()));
        }
        if (request.getDeliveryLocation() != null) {
            created.add(create(GeofenceRequest.builder()
                    .name("Delivery - " + label)
                    .tripId(tripId)
                    .kind(GeofenceKind.DELIVERY)
                    .geometryType(GeometryType.CIRCLE)
                    .center(request.getDeliveryLocation())
                    .radiusM(radiusOrDefault(request.getDeliveryRadiusM()))
                    .notificationPolicy(NotificationPolicy.builder()
                            .onEntry(true).onExit(false).dwellEnabled(true)
                            .dwellDurationSec(DELIVERY_DWELL_SECONDS).build())
                    .build()));
        }
        return created;
    }

    /**
     * @throws GeofenceNotFoundException for an unknown id
     */
    public Geofence deactivate(Long geofenceId) {
        Geofence geofence = geofenceStore.findGeofence(geofenceId)
                .orElseThrow(() -> new GeofenceNotFoundException(geofenceId));
        if (!geofence.isActive()) {
            return geofence;
        }
        geofence.setActive(false);
        Geofence saved = geofenceStore.saveGeofence(geofence);
        cacheableGeofenceService.evictActiveGeofences();
        log.info("Geofence #{} deactivated", geofenceId);
        return saved;
    }

    /** Switches off every geofence whose active window has closed. */
    @Scheduled(fixedDelayString = "${tracking.geofence.expiry-sweep-ms:60000}")
    public int deactivateExpired() {
        List<Geofence> expired = geofenceStore.findExpiredGeofences(clock.instant());
        if (expired.isEmpty()) {
            return 0;
        }
        for (Geofence geofence : expired) {
            geofence.setActive(false);
            geofenceStore.saveGeofence(geofence);
        }
        cacheableGeofenceService.evictActiveGeofences();
        log.info("Deactivated {} expired geofence(s)", expired.size());
        return expired.size();
    }

    public Geofence getGeofence(Long geofenceId) {
        return geofenceStore.findGeofence(geofenceId).orElseThrow(() -> new GeofenceNotFoundException(geofenceId));
    }

    /** Meters from the point to the geofence edge; 0 when inside. */
    public double distanceToGeofence(Coordinates point, Geofence geofence) {
        if (!GeoMath.isValidCoordinates(point)) {
            throw new InvalidLocationException(ErrorCode.INVALID_COORDINATES, "Invalid coordinates: " + point,
                    point == null ? null : LocationSampleRequest.builder()
                            .latitude(point.getLatitude()).longitude(point.getLongitude()).build());
        }
        return GeofenceGeometries.of(geofence).distanceMeters(point);
    }

    public double distanceToGeofence(Coordinates point, Long geofenceId) {
        return distanceToGeofence(point, getGeofence(geofenceId));
    }

    public List<GeofenceEvent> eventsForGeofence(Long geofenceId) {
        return geofenceStore.eventsForGeofence(geofenceId);
    }

    public List<GeofenceEvent> eventsForTrip(String tripId) {
        return geofenceStore.eventsForTrip(tripId);
    }

    /**
     * Counts per transition kind with dwell averages, over the whole event log of a geofence.
     *
     * @throws GeofenceNotFoundException for an unknown id
     */
    public GeofenceStats statsForGeofence(Long geofenceId) {
        getGeofence(geofenceId);
        List<GeofenceEvent> events = geofenceStore.eventsForGeofence(geofenceId);

        Map<GeofenceEventType, GeofenceStats.KindStats> byKind = new EnumMap<>(GeofenceEventType.class);
        Map<GeofenceEventType, List<GeofenceEvent>> grouped = events.stream()
                .collect(Collectors.groupingBy(GeofenceEvent::getKind));
        grouped.forEach((kind, ofKind) -> {
            LongSummaryStatistics dwell = ofKind.stream()
                    .map(GeofenceEvent::getDwellSeconds)
                    .filter(Objects::nonNull)
                    .mapToLong(Long::longValue)
                    .summaryStatistics();
            byKind.put(kind, GeofenceStats.KindStats.builder()
                    .count(ofKind.size())
                    .averageDwellSec(dwell.getCount() > 0 ? dwell.getAverage() : null)
                    .maxDwellSec(dwell.getCount() > 0 ? dwell.getMax() : null)
                    .build());
        });

        return GeofenceStats.builder()
                .geofenceId(geofenceId)
                .totalEvents(events.size())
                .uniqueUsers(events.stream().map(GeofenceEvent::getUserId).distinct().count())
                .firstEventAt(events.stream().map(GeofenceEvent::getTriggeredAt).min(Comparator.naturalOrder()).orElse(null))
                .lastEventAt(events.stream().map(GeofenceEvent::getTriggeredAt).max(Comparator.naturalOrder()).orElse(null))
                .byKind(byKind)
                .build();
    }

    /**
     * Geofence built from the request after geometry, timezone, window and
     * policy checks. The caller sets id, active flag and creation time.
     */
    private static Geofence.GeofenceBuilder validated(GeofenceRequest request) {
        if (request.getKind() == null || request.getGeometryType() == null) {
            throw new GeofenceGeometryException("kind and geometryType are required");
        }

        Geofence.GeofenceBuilder builder = Geofence.builder()
                .name(request.getName())
                .tripId(request.getTripId())
                .kind(request.getKind())
                .geometryType(request.getGeometryType())
                .notificationPolicy(request.getNotificationPolicy() != null
                        ? request.getNotificationPolicy()
                        : NotificationPolicy.builder().onEntry(true).onExit(true).build())
                .activeFrom(request.getActiveFrom())
                .activeUntil(request.getActiveUntil())
                .timezone(validateTimezone(request.getTimezone()));

        if (request.getGeometryType() == GeometryType.CIRCLE) {
            GeofenceGeometries.validateCircle(request.getCenter(), request.getRadiusM());
            builder.center(Coordinates.of(request.getCenter().getLatitude(), request.getCenter().getLongitude()))
                    .radiusM(request.getRadiusM());
        } else {
            GeofenceGeometries.validateRing(request.getRing());
            builder.polygonRing(GeofenceGeometries.toJson(request.getRing()));
        }

        if (request.getActiveFrom() != null && request.getActiveUntil() != null
                && !request.getActiveFrom().isBefore(request.getActiveUntil())) {
            throw new GeofenceGeometryException("activeFrom must be before activeUntil");
        }
        if (request.getNotificationPolicy() != null && request.getNotificationPolicy().getDwellDurationSec() <= 0) {
            throw new GeofenceGeometryException("dwellDurationSec must be positive");
        }
        return builder;
    }

    private static double radiusOrDefault(Double radiusM) {
        return radiusM != null ? radiusM : DEFAULT_DELIVERY_RADIUS_METERS;
    }

    private static String validateTimezone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return Geofence.DEFAULT_TIMEZONE;
        }
        try {
            return ZoneId.of(timezone).getId();
        } catch (DateTimeException e) {
            throw new GeofenceGeometryException("Invalid timezone: " + timezone, e);
        }
    }
}
