package com.lastmile.locationtracking.service;

import com.lastmile.locationtracking.entity.LocationSample;
import com.lastmile.locationtracking.entity.PrivacySettings;
import com.lastmile.locationtracking.entity.TrackingSession;
import com.lastmile.locationtracking.entity.TrackingSettings;
import com.lastmile.locationtracking.entity.TrackingStatus;
import com.lastmile.locationtracking.exception.CacheUnavailableException;
import com.lastmile.locationtracking.exception.SessionStateException;
import com.lastmile.locationtracking.store.LocationCache;
import com.lastmile.locationtracking.store.RecordedSamples;
import com.lastmile.locationtracking.store.TrackingStore;
import com.lastmile.locationtracking.util.KeyedLocks;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Owns the lifecycle of the tracking session of each trip.
 *
 * Transitions:
 *   start  : none → ACTIVE, PAUSED|STOPPED → ACTIVE (resume, counters kept)
 *   pause  : ACTIVE → PAUSED
 *   resume : PAUSED → ACTIVE
 *   stop   : ACTIVE|PAUSED → STOPPED
 *   complete: ACTIVE|PAUSED → COMPLETED (terminal)
 *
 * Every mutation is a read-modify-write on the stored row performed under the
 * trip lock, so counter increments from concurrent samples are never lost.
 * The session snapshot cache (key tracking_session:{tripId}) is refreshed
 * after each write and only serves reads.
 */
@Service
@Slf4j
public class TrackingSessionManager {

    private static final String SNAPSHOT_PREFIX = "tracking_session:";

    private final TrackingStore trackingStore;
    private final LocationCache cache;
    private final KeyedLocks locks;
    private final Clock clock;
    private final Duration snapshotTtl;

    public TrackingSessionManager(TrackingStore trackingStore,
                                  LocationCache cache,
                                  KeyedLocks locks,
                                  Clock clock,
                                  @Value("${tracking.cache.session-ttl-seconds:3600}") long snapshotTtlSeconds) {
        this.trackingStore = trackingStore;
        this.cache = cache;
        this.locks = locks;
        this.clock = clock;
        this.snapshotTtl = Duration.ofSeconds(snapshotTtlSeconds);
    }

    /**
     * Starts tracking for a trip, or resumes its paused/stopped session.
     * A resumed session keeps the user that started it; a different
     * {@code userId} is logged and ignored.
     *
     * @throws SessionStateException SESSION_ALREADY_ACTIVE if the trip is being tracked,
     *                               SESSION_NOT_ACTIVE if its session is already completed
     */
    public TrackingSession start(String tripId, String userId,
                                 TrackingSettings settings, PrivacySettings privacySettings) {
        return locks.withLock(KeyedLocks.tripKey(tripId), () -> {
            Optional<TrackingSession> existing = trackingStore.findSession(tripId);
            TrackingSession session;

            if (existing.isPresent()) {
                session = existing.get();
                if (session.getStatus() == TrackingStatus.ACTIVE) {
                    throw SessionStateException.alreadyActive(tripId);
                }
                if (session.getStatus() == TrackingStatus.COMPLETED) {
                    throw SessionStateException.notActive(tripId, session.getStatus());
                }
                if (userId != null && !Objects.equals(userId, session.getUserId())) {
                    log.warn("AUDIT: Trip {} resumed by {} but its session belongs to {} — owner kept",
                            tripId, userId, session.getUserId());
                }
                log.info("Resuming {} tracking session for trip {} — updates so far: {}, distance: {} km",
                        session.getStatus(), tripId, session.getTotalUpdates(),
                        String.format("%.3f", session.getTotalDistanceKm()));
                session.setStatus(TrackingStatus.ACTIVE);
                session.setStoppedAt(null);
                session.setStopReason(null);
                session.setTotalDurationMin(null);
                if (settings != null) {
                    session.setSettings(TrackingSettings.normalize(settings));
                }
                if (privacySettings != null) {
                    session.setPrivacySettings(PrivacySettings.normalize(privacySettings));
                }
            } else {
                session = TrackingSession.builder()
                        .tripId(tripId)
                        .userId(userId)
                        .status(TrackingStatus.ACTIVE)
                        .startedAt(clock.instant())
                        .totalUpdates(0)
                        .totalDistanceKm(0.0)
                        .settings(TrackingSettings.normalize(settings))
                        .privacySettings(PrivacySettings.normalize(privacySettings))
                        .build();
                log.info("Tracking session created for trip {} — user: {}, interval: {}s, level: {}",
                        tripId, userId, session.getSettings().getIntervalSec(), session.trackingLevel());
            }
            return persist(session);
        });
    }

    /**
     * Stores accepted samples and adds them, with {@code distanceKm}, to the
     * session totals. Samples and counters are written together: when the
     * write fails neither is stored and the cached snapshot is left as it was.
     *
     * @throws SessionStateException SESSION_NOT_FOUND or SESSION_NOT_ACTIVE
     * @throws com.lastmile.locationtracking.exception.StorageUnavailableException the write failed
     */
    public RecordedSamples recordSamples(String tripId, List<LocationSample> samples, double distanceKm) {
        return locks.withLock(KeyedLocks.tripKey(tripId), () -> {
            TrackingSession session = load(tripId);
            if (!session.isActive()) {
                throw SessionStateException.notActive(tripId, session.getStatus());
            }
            session.setTotalUpdates(session.getTotalUpdates() + samples.size());
            session.setTotalDistanceKm(session.getTotalDistanceKm() + distanceKm);

            RecordedSamples recorded = trackingStore.recordSamples(session, samples);
            TrackingSession snapshot = recorded.getSession().snapshot();
            cacheSnapshot(snapshot);
            return new RecordedSamples(snapshot, recorded.getSamples());
        });
    }

    /**
     * Changes the privacy level of a running or resumable session. Samples
     * already stored keep their raw coordinates; the level applies to every
     * read from now on.
     *
     * @throws SessionStateException SESSION_NOT_FOUND, or SESSION_NOT_ACTIVE once completed
     */
    public TrackingSession updatePrivacy(String tripId, PrivacySettings privacySettings) {
        return locks.withLock(KeyedLocks.tripKey(tripId), () -> {
            TrackingSession session = load(tripId);
            if (session.getStatus() == TrackingStatus.COMPLETED) {
                throw SessionStateException.notActive(tripId, session.getStatus());
            }
            PrivacySettings updated = PrivacySettings.normalize(privacySettings);
            log.info("AUDIT: Privacy level for trip {} changed: {} → {}",
                    tripId, session.trackingLevel(), updated.getTrackingLevel());
            session.setPrivacySettings(updated);
            return persist(session);
        });
    }

    /**
     * Stops tracking; the session can later be resumed with {@link #start}.
     *
     * @throws SessionStateException SESSION_NOT_FOUND, or SESSION_NOT_ACTIVE when already stopped/completed
     */
    public TrackingSession stop(String tripId, String reason) {
        return finish(tripId, TrackingStatus.STOPPED, reason);
    }

    /** Terminal variant of {@link #stop}: the trip cannot be tracked again. */
    public TrackingSession complete(String tripId) {
        return finish(tripId, TrackingStatus.COMPLETED, "completed");
    }

    public TrackingSession pause(String tripId) {
        return transition(tripId, TrackingStatus.ACTIVE, TrackingStatus.PAUSED);
    }

    public TrackingSession resume(String tripId) {
        return transition(tripId, TrackingStatus.PAUSED, TrackingStatus.ACTIVE);
    }

    /**
     * Current session of a trip. Served from the snapshot cache when possible;
     * a cache miss or cache failure reads storage. Storage failures propagate.
     */
    public Optional<TrackingSession> getSession(String tripId) {
        try {
            Optional<TrackingSession> cached = cache.get(SNAPSHOT_PREFIX + tripId, TrackingSession.class);
            if (cached.isPresent()) {
                return cached.map(TrackingSession::snapshot);
            }
        } catch (CacheUnavailableException e) {
            log.warn("[CACHE] Session snapshot read failed for trip {} — reading storage: {}", tripId, e.getMessage());
        }
        Optional<TrackingSession> stored = trackingStore.findSession(tripId).map(TrackingSession::snapshot);
        stored.ifPresent(this::cacheSnapshot);
        return stored;
    }

    /**
     * Fails closed: the session must be known to be ACTIVE.
     *
     * @throws SessionStateException SESSION_NOT_ACTIVE when missing or not ACTIVE
     */
    public TrackingSession requireActive(String tripId) {
        TrackingSession session = getSession(tripId)
                .orElseThrow(() -> SessionStateException.notActive(tripId, "NONE"));
        if (!session.isActive()) {
            throw SessionStateException.notActive(tripId, session.getStatus());
        }
        return session;
    }

    private TrackingSession finish(String tripId, TrackingStatus target, String reason) {
        return locks.withLock(KeyedLocks.tripKey(tripId), () -> {
            TrackingSession session = load(tripId);
            if (session.getStatus() != TrackingStatus.ACTIVE && session.getStatus() != TrackingStatus.PAUSED) {
                throw SessionStateException.notActive(tripId, session.getStatus());
            }
            Instant now = clock.instant();
            session.setStatus(target);
            session.setStoppedAt(now);
            session.setStopReason(reason);
            session.setTotalDurationMin(Duration.between(session.getStartedAt(), now).toMillis() / 60_000.0);

            TrackingSession saved = persist(session);
            log.info("Tracking {} for trip {} — updates: {}, distance: {} km, duration: {} min, reason: {}",
                    target, tripId, saved.getTotalUpdates(),
                    String.format("%.3f", saved.getTotalDistanceKm()),
                    String.format("%.1f", saved.getTotalDurationMin()),
                    reason != null ? reason : "Not specified");
            return saved;
        });
    }

    private TrackingSession transition(String tripId, TrackingStatus from, TrackingStatus to) {
        return locks.withLock(KeyedLocks.tripKey(tripId), () -> {
            TrackingSession session = load(tripId);
            if (session.getStatus() != from) {
                throw SessionStateException.notActive(tripId, session.getStatus());
            }
            session.setStatus(to);
            log.info("Tracking session for trip {}: {} → {}", tripId, from, to);
            return persist(session);
        });
    }

    private TrackingSession load(String tripId) {
        return trackingStore.findSession(tripId).orElseThrow(() -> SessionStateException.notFound(tripId));
    }

    private TrackingSession persist(TrackingSession session) {
        TrackingSession snapshot = trackingStore.saveSession(session).snapshot();
        cacheSnapshot(snapshot);
        return snapshot;
    }

    private void cacheSnapshot(TrackingSession snapshot) {
        try {
            cache.put(SNAPSHOT_PREFIX + snapshot.getTripId(), snapshot, snapshotTtl);
        } catch (CacheUnavailableException e) {
            log.warn("[CACHE] Could not cache session snapshot for trip {} — {}", snapshot.getTripId(), e.getMessage());
        }
    }
}
