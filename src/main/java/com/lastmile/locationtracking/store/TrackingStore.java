package com.lastmile.locationtracking.store;

import com.lastmile.locationtracking.entity.LocationSample;
import com.lastmile.locationtracking.entity.TrackingSession;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence port for tracking sessions and GPS samples.
 *
 * Implementations report any failure of the underlying store as
 * {@link com.lastmile.locationtracking.exception.StorageUnavailableException}.
 */
public interface TrackingStore {

    Optional<TrackingSession> findSession(String tripId);

    TrackingSession saveSession(TrackingSession session);

    /**
     * Stores accepted samples together with the session carrying their
     * counters, in one transaction: either both are written or neither is.
     */
    RecordedSamples recordSamples(TrackingSession session, List<LocationSample> samples);

    /** Latest sample (by timestamp) of one courier on a trip. */
    Optional<LocationSample> lastSample(String tripId, String userId);

    /** Latest sample (by timestamp) of any courier on a trip. */
    Optional<LocationSample> lastSample(String tripId);

    /** Samples with {@code from <= timestamp <= to}, oldest first. */
    List<LocationSample> samplesInRange(String tripId, Instant from, Instant to);
}
