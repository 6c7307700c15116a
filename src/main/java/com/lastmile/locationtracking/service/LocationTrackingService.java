package com.lastmile.locationtracking.service;

import com.lastmile.locationtracking.dto.BatchResult;
import com.lastmile.locationtracking.dto.IngestResult;
import com.lastmile.locationtracking.dto.LocationHistory;
import com.lastmile.locationtracking.dto.LocationSampleRequest;
import com.lastmile.locationtracking.dto.StartTrackingRequest;
import com.lastmile.locationtracking.dto.TrackingEvent;
import com.lastmile.locationtracking.dto.TrackingEventType;
import com.lastmile.locationtracking.dto.TrackingSummary;
import com.lastmile.locationtracking.entity.Coordinates;
import com.lastmile.locationtracking.entity.GeofenceEvent;
import com.lastmile.locationtracking.entity.LocationSample;
import com.lastmile.locationtracking.entity.PrivacySettings;
import com.lastmile.locationtracking.entity.TrackingLevel;
import com.lastmile.locationtracking.entity.TrackingSession;
import com.lastmile.locationtracking.exception.SessionStateException;
import com.lastmile.locationtracking.service.privacy.PrivacyFilter;
import com.lastmile.locationtracking.store.TrackingStore;
import com.lastmile.locationtracking.util.GeoMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the tracking engine used by the controllers.
 *
 * Delegates session changes to {@link TrackingSessionManager} and sample
 * processing to {@link LocationIngestionPipeline}, then publishes the
 * resulting engine events through {@link TrackingEventBroadcaster}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LocationTrackingService {

    private final TrackingSessionManager sessionManager;
    private final LocationIngestionPipeline ingestionPipeline;
    private final TrackingStore trackingStore;
    private final PrivacyFilter privacyFilter;
    private final CurrentLocationCache currentLocationCache;
    private final TrackingEventBroadcaster broadcaster;
    private final Clock clock;

    public TrackingSession startTracking(String tripId, StartTrackingRequest request) {
        TrackingSession session = sessionManager.start(tripId, request.getUserId(),
                request.getSettings(), request.getPrivacySettings());
        broadcaster.publish(TrackingEvent.of(TrackingEventType.TRACKING_STARTED, tripId, session.getUserId(),
                clock.instant(), "tripId", tripId, "settings", session.getSettings()));
        return session;
    }

    public IngestResult ingestLocation(String tripId, String userId, LocationSampleRequest sample) {
        IngestResult result = ingestionPipeline.ingestOne(tripId, userId, sample);
        publishLocation(tripId, userId, result.getFilteredSample(), result.getGeofenceEvents());
        return result;
    }

    public BatchResult ingestLocationBatch(String tripId, String userId, List<LocationSampleRequest> samples) {
        BatchResult result = ingestionPipeline.ingestBatch(tripId, userId, samples);
        if (result.getLatestSample() != null) {
            publishLocation(tripId, userId, result.getLatestSample(), result.getGeofenceEvents());
        }
        return result;
    }

    public TrackingSummary stopTracking(String tripId, String reason) {
        return finished(sessionManager.stop(tripId, reason));
    }

    public TrackingSummary completeTracking(String tripId) {
        return finished(sessionManager.complete(tripId));
    }

    public TrackingSession pauseTracking(String tripId) {
        return sessionManager.pause(tripId);
    }

    public TrackingSession resumeTracking(String tripId) {
        return sessionManager.resume(tripId);
    }

    /**
     * Switches the privacy level of a trip. Cached current locations were
     * filtered with the old level, so they are dropped and rebuilt on the next read.
     */
    public TrackingSession updatePrivacy(String tripId, PrivacySettings privacySettings) {
        TrackingSession session = sessionManager.updatePrivacy(tripId, privacySettings);
        currentLocationCache.evictTrip(tripId);
        return session;
    }

    /**
     * @throws SessionStateException SESSION_NOT_FOUND
     */
    public TrackingSession getSession(String tripId) {
        return sessionManager.getSession(tripId).orElseThrow(() -> SessionStateException.notFound(tripId));
    }

    /**
     * Latest privacy-filtered position of a trip, or of one courier on it.
     *
     * Cache first; on a miss (or cache failure) the last stored sample is
     * filtered with the session's tracking level and written back to the cache.
     *
     * @param userId courier, or null for whoever reported last
     */
    public Optional<LocationSample> getCurrentLocation(String tripId, String userId) {
        Optional<LocationSample> cached = currentLocationCache.get(tripId, userId);
        if (cached.isPresent()) {
            return cached;
        }
        log.debug("[CACHE MISS] current location for trip {} — loading from DB", tripId);

        Optional<LocationSample> stored = userId != null
                ? trackingStore.lastSample(tripId, userId)
                : trackingStore.lastSample(tripId);
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        LocationSample filtered = privacyFilter.filter(stored.get(), trackingLevel(tripId));
        currentLocationCache.put(tripId, filtered.getUserId(), filtered);
        return Optional.of(filtered);
    }

    /**
     * Samples recorded between {@code from} and {@code to} (inclusive), oldest
     * first and privacy-filtered, with statistics computed on the stored route.
     *
     * @param from start of the range, or null for the beginning of the trip
     * @param to   end of the range, or null for now
     */
    public LocationHistory getHistory(String tripId, Instant from, Instant to) {
        Instant rangeFrom = from != null ? from : Instant.EPOCH;
        Instant rangeTo = to != null ? to : clock.instant();
        List<LocationSample> samples = trackingStore.samplesInRange(tripId, rangeFrom, rangeTo);
        TrackingLevel level = trackingLevel(tripId);

        return LocationHistory.builder()
                .tripId(tripId)
                .from(rangeFrom)
                .to(rangeTo)
                .samples(samples.stream().map(s -> privacyFilter.filter(s, level)).toList())
                .summary(summarize(samples))
                .build();
    }

    static LocationHistory.RouteSummary summarize(List<LocationSample> samples) {
        if (samples.isEmpty()) {
            return LocationHistory.RouteSummary.empty();
        }
        List<Coordinates> route = samples.stream().map(LocationSample::getCoordinates).toList();
        double distanceKm = GeoMath.routeDistanceMeters(route) / 1000.0;
        Duration elapsed = Duration.between(samples.get(0).getTimestamp(), samples.get(samples.size() - 1).getTimestamp());
        Double averageKmh = GeoMath.speedKmh(distanceKm, elapsed);
        double maxKmh = samples.stream()
                .map(LocationSample::speedKmh)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .max()
                .orElse(0);

        return LocationHistory.RouteSummary.builder()
                .totalPoints(samples.size())
                .totalDistanceKm(distanceKm)
                .durationMin(elapsed.toMillis() / 60_000.0)
                .averageSpeedKmh(averageKmh != null ? averageKmh : 0)
                .maxSpeedKmh(maxKmh)
                .build();
    }

    private TrackingSummary finished(TrackingSession session) {
        currentLocationCache.evictTrip(session.getTripId());
        TrackingSummary summary = TrackingSummary.of(session);
        broadcaster.publish(TrackingEvent.of(TrackingEventType.TRACKING_STOPPED, session.getTripId(),
                session.getUserId(), clock.instant(), "tripId", session.getTripId(), "summary", summary));
        return summary;
    }

    private void publishLocation(String tripId, String userId, LocationSample filtered, List<GeofenceEvent> events) {
        Instant now = clock.instant();
        broadcaster.publish(TrackingEvent.of(TrackingEventType.LOCATION_UPDATED, tripId, userId, now,
                "tripId", tripId, "userId", userId, "sample", filtered, "events", events));
        for (GeofenceEvent event : events) {
            broadcaster.publish(TrackingEvent.of(TrackingEventType.GEOFENCE_EVENT, tripId, userId, now,
                    "event", event));
        }
    }

    private TrackingLevel trackingLevel(String tripId) {
        return sessionManager.getSession(tripId).map(TrackingSession::trackingLevel).orElse(TrackingLevel.PRECISE);
    }
}
