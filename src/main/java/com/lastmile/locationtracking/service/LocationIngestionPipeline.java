package com.lastmile.locationtracking.service;

import com.lastmile.locationtracking.dto.BatchItemResult;
import com.lastmile.locationtracking.dto.BatchResult;
import com.lastmile.locationtracking.dto.IngestResult;
import com.lastmile.locationtracking.dto.LocationSampleRequest;
import com.lastmile.locationtracking.entity.Coordinates;
import com.lastmile.locationtracking.entity.GeofenceEvent;
import com.lastmile.locationtracking.entity.LocationSample;
import com.lastmile.locationtracking.entity.TrackingSession;
import com.lastmile.locationtracking.exception.InvalidLocationException;
import com.lastmile.locationtracking.exception.TrackingException;
import com.lastmile.locationtracking.service.geofence.GeofenceEvaluator;
import com.lastmile.locationtracking.service.privacy.PrivacyFilter;
import com.lastmile.locationtracking.store.RecordedSamples;
import com.lastmile.locationtracking.store.TrackingStore;
import com.lastmile.locationtracking.util.GeoMath;
import com.lastmile.locationtracking.util.KeyedLocks;
import lombok.AllArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Processes GPS samples of a courier on a trip.
 *
 * Steps (per sample):
 * 1. Validate ranges; a missing timestamp becomes server time
 * 2. Require an ACTIVE session
 * 3. Measure against the last stored sample of the same (trip, user):
 *    haversine delta, and speed when the device did not report one
 * 4. Persist the raw sample and the session counters in one transaction
 * 5. Cache the privacy-filtered view as the current location
 * 6. Evaluate geofences with the raw position
 *
 * A failed write in step 4 leaves nothing behind: no sample, no counter
 * change, no cache entry. Steps 2-6 run under the trip lock: a concurrent stop either happens before
 * the sample (which is then rejected) or after it, never in between.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LocationIngestionPipeline {

    private final LocationSampleValidator validator;
    private final TrackingSessionManager sessionManager;
    private final TrackingStore trackingStore;
    private final PrivacyFilter privacyFilter;
    private final CurrentLocationCache currentLocationCache;
    private final GeofenceEvaluator geofenceEvaluator;
    private final KeyedLocks locks;

    /**
     * @throws InvalidLocationException on a range violation; nothing is stored
     * @throws com.lastmile.locationtracking.exception.SessionStateException SESSION_NOT_ACTIVE
     * @throws com.lastmile.locationtracking.exception.StorageUnavailableException when the sample cannot be written
     */
    public IngestResult ingestOne(String tripId, String userId, LocationSampleRequest raw) {
        LocationSampleRequest sample = validator.validate(raw);

        return locks.withLock(KeyedLocks.tripKey(tripId), () -> {
            sessionManager.requireActive(tripId);

            LocationSample previous = trackingStore.lastSample(tripId, userId).orElse(null);
            Measurement measurement = measure(previous, sample);

            RecordedSamples recorded = sessionManager.recordSamples(tripId,
                    List.of(toEntity(tripId, userId, sample, measurement)), measurement.distanceKm);
            LocationSample saved = recorded.getSamples().get(0);
            TrackingSession updated = recorded.getSession();

            LocationSample filtered = privacyFilter.filter(saved, updated.trackingLevel());
            currentLocationCache.put(tripId, userId, filtered);
            List<GeofenceEvent> events = evaluateGeofences(tripId, userId, saved);

            log.debug("Sample #{} stored for trip {} — delta: {} km, total: {} km",
                    saved.getId(), tripId, String.format("%.3f", measurement.distanceKm),
                    String.format("%.3f", updated.getTotalDistanceKm()));

            return IngestResult.builder()
                    .sampleId(saved.getId())
                    .filteredSample(filtered)
                    .distanceDeltaKm(measurement.distanceKm)
                    .calculatedSpeedKmh(measurement.calculatedSpeedKmh)
                    .totalDistanceKm(updated.getTotalDistanceKm())
                    .geofenceEvents(events)
                    .build();
        });
    }

    /**
     * Ingests samples buffered by a device while offline.
     *
     * Items failing validation are reported individually and skipped. The
     * rest are ordered by timestamp, chained from the last stored sample
     * exactly as single ingestion would, and written with the session counters
     * in one transaction.
     * Only the latest accepted sample refreshes the current location and is
     * evaluated against geofences.
     *
     * @throws com.lastmile.locationtracking.exception.SessionStateException SESSION_NOT_ACTIVE for the whole batch
     * @throws com.lastmile.locationtracking.exception.StorageUnavailableException the write failed; nothing is stored or counted
     */
    public BatchResult ingestBatch(String tripId, String userId, List<LocationSampleRequest> raws) {
        return locks.withLock(KeyedLocks.tripKey(tripId), () -> {
            TrackingSession session = sessionManager.requireActive(tripId);
            log.info("Batch sync started — trip: {}, user: {}, {} buffered samples", tripId, userId, raws.size());

            BatchItemResult[] results = new BatchItemResult[raws.size()];
            List<IndexedSample> valid = new ArrayList<>(raws.size());
            for (int i = 0; i < raws.size(); i++) {
                try {
                    valid.add(new IndexedSample(i, validator.validate(raws.get(i))));
                } catch (InvalidLocationException e) {
                    results[i] = BatchItemResult.rejected(i, e.getErrorCode(), e.getMessage(), raws.get(i));
                }
            }
            // stable sort: equal timestamps keep submission order
            valid.sort(Comparator.comparing(item -> item.sample.getTimestamp()));

            LocationSample previous = trackingStore.lastSample(tripId, userId).orElse(null);
            List<LocationSample> toStore = new ArrayList<>(valid.size());
            double batchDistanceKm = 0;
            for (IndexedSample item : valid) {
                Measurement measurement = measure(previous, item.sample);
                batchDistanceKm += measurement.distanceKm;
                previous = toEntity(tripId, userId, item.sample, measurement);
                toStore.add(previous);
            }

            List<LocationSample> saved = List.of();
            if (!toStore.isEmpty()) {
                RecordedSamples recorded = sessionManager.recordSamples(tripId, toStore, batchDistanceKm);
                saved = recorded.getSamples();
                session = recorded.getSession();
            }
            for (int k = 0; k < saved.size(); k++) {
                IndexedSample item = valid.get(k);
                results[item.index] = BatchItemResult.accepted(item.index, saved.get(k).getId(), item.sample.getTimestamp());
            }

            LocationSample latestFiltered = null;
            List<GeofenceEvent> events = List.of();
            if (!saved.isEmpty()) {
                LocationSample latest = saved.get(saved.size() - 1);
                latestFiltered = privacyFilter.filter(latest, session.trackingLevel());
                currentLocationCache.put(tripId, userId, latestFiltered);
                events = evaluateGeofences(tripId, userId, latest);
            }

            int failed = raws.size() - saved.size();
            log.info("Batch sync complete — trip: {}, total: {}, processed: {}, failed: {}, distance: {} km",
                    tripId, raws.size(), saved.size(), failed, String.format("%.3f", batchDistanceKm));

            return BatchResult.builder()
                    .processed(raws.size())
                    .successful(saved.size())
                    .failed(failed)
                    .totalDistanceKm(batchDistanceKm)
                    .latestSample(latestFiltered)
                    .geofenceEvents(events)
                    .results(Arrays.asList(results))
                    .build();
        });
    }

    /**
     * Geofence failures do not undo an accepted sample: the sample and its
     * counters are already stored, so the error is logged and no events are reported.
     */
    private List<GeofenceEvent> evaluateGeofences(String tripId, String userId, LocationSample sample) {
        try {
            return geofenceEvaluator.evaluate(tripId, userId, sample.getCoordinates(), sample.getTimestamp());
        } catch (TrackingException e) {
            log.error("GEOFENCE: Evaluation failed for trip {}, user {} at {} — {} ({})",
                    tripId, userId, sample.getTimestamp(), e.getMessage(), e.getErrorCode());
            return List.of();
        }
    }

    private static Measurement measure(LocationSample previous, LocationSampleRequest sample) {
        if (previous == null) {
            return new Measurement(0, null);
        }
        double distanceKm = GeoMath.distanceKm(previous.getCoordinates(),
                Coordinates.of(sample.getLatitude(), sample.getLongitude()));
        Double speedKmh = null;
        if (sample.getSpeedMps() == null) {
            speedKmh = GeoMath.speedKmh(distanceKm, Duration.between(previous.getTimestamp(), sample.getTimestamp()));
        }
        return new Measurement(distanceKm, speedKmh);
    }

    private static LocationSample toEntity(String tripId, String userId,
                                           LocationSampleRequest sample, Measurement measurement) {
        Double speedMps = sample.getSpeedMps();
        if (speedMps == null && measurement.calculatedSpeedKmh != null) {
            speedMps = measurement.calculatedSpeedKmh / 3.6;
        }
        return LocationSample.builder()
                .tripId(tripId)
                .userId(userId)
                .coordinates(Coordinates.of(sample.getLatitude(), sample.getLongitude()))
                .accuracyM(sample.getAccuracyM())
                .altitudeM(sample.getAltitudeM())
                .bearingDeg(sample.getBearingDeg())
                .speedMps(speedMps)
                .batteryPct(sample.getBatteryPct())
                .networkType(sample.getNetworkType())
                .timestamp(sample.getTimestamp())
                .build();
    }

    @AllArgsConstructor
    private static class Measurement {
        private final double distanceKm;
        private final Double calculatedSpeedKmh;
    }

    @AllArgsConstructor
    private static class IndexedSample {
        private final int index;
        private final LocationSampleRequest sample;
    }
}
