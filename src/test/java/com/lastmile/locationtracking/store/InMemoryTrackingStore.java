package com.lastmile.locationtracking.store;

import com.lastmile.locationtracking.entity.LocationSample;
import com.lastmile.locationtracking.entity.TrackingSession;
import com.lastmile.locationtracking.exception.StorageUnavailableException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Map-backed {@link TrackingStore} for unit tests.
 * Stores copies, like a database would, and can be switched into failing modes.
 * {@link #recordSamples} checks both modes before changing anything, so a
 * failed write leaves no sample and no counter behind.
 */
public class InMemoryTrackingStore implements TrackingStore {

    private final Map<String, TrackingSession> sessions = new ConcurrentHashMap<>();
    private final List<LocationSample> samples = new ArrayList<>();
    private final AtomicLong ids = new AtomicLong();

    private volatile boolean failSampleWrites;
    private volatile boolean failSessionWrites;

    public void failSampleWrites(boolean fail) {
        this.failSampleWrites = fail;
    }

    public void failSessionWrites(boolean fail) {
        this.failSessionWrites = fail;
    }

    @Override
    public Optional<TrackingSession> findSession(String tripId) {
        return Optional.ofNullable(sessions.get(tripId)).map(TrackingSession::snapshot);
    }

    @Override
    public synchronized TrackingSession saveSession(TrackingSession session) {
        if (failSessionWrites) {
            throw new StorageUnavailableException("Storage unavailable during saveSession " + session.getTripId(), null);
        }
        if (session.getId() == null) {
            session.setId(ids.incrementAndGet());
        }
        sessions.put(session.getTripId(), session.snapshot());
        return session;
    }

    @Override
    public synchronized RecordedSamples recordSamples(TrackingSession session, List<LocationSample> batch) {
        if (failSampleWrites || failSessionWrites) {
            throw new StorageUnavailableException("Storage unavailable during recordSamples " + session.getTripId(), null);
        }
        List<LocationSample> stored = new ArrayList<>(batch.size());
        for (LocationSample sample : batch) {
            stored.add(addSample(sample));
        }
        return new RecordedSamples(saveSession(session), stored);
    }

    /** Seeds a sample directly, bypassing session counters. */
    public synchronized LocationSample addSample(LocationSample sample) {
        LocationSample copy = sample.toBuilder().id(ids.incrementAndGet()).build();
        samples.add(copy);
        return copy;
    }

    @Override
    public synchronized Optional<LocationSample> lastSample(String tripId, String userId) {
        return samples.stream()
                .filter(s -> s.getTripId().equals(tripId) && s.getUserId().equals(userId))
                .max(LATEST);
    }

    @Override
    public synchronized Optional<LocationSample> lastSample(String tripId) {
        return samples.stream().filter(s -> s.getTripId().equals(tripId)).max(LATEST);
    }

    @Override
    public synchronized List<LocationSample> samplesInRange(String tripId, Instant from, Instant to) {
        return samples.stream()
                .filter(s -> s.getTripId().equals(tripId))
                .filter(s -> !s.getTimestamp().isBefore(from) && !s.getTimestamp().isAfter(to))
                .sorted(Comparator.comparing(LocationSample::getTimestamp))
                .toList();
    }

    public synchronized List<LocationSample> allSamples(String tripId) {
        return samples.stream().filter(s -> s.getTripId().equals(tripId)).toList();
    }

    private static final Comparator<LocationSample> LATEST =
            Comparator.comparing(LocationSample::getTimestamp).thenComparing(LocationSample::getId);
}
