package com.lastmile.locationtracking.store;

import com.lastmile.locationtracking.entity.LocationSample;
import com.lastmile.locationtracking.entity.TrackingSession;
import com.lastmile.locationtracking.exception.StorageUnavailableException;
import com.lastmile.locationtracking.repository.LocationSampleRepository;
import com.lastmile.locationtracking.repository.TrackingSessionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link TrackingStore} backed by Spring Data JPA.
 *
 * Reads and session writes run in the repository's own transaction, bounded by
 * {@code spring.transaction.default-timeout}. {@link #recordSamples} wraps the
 * sample inserts and the session update in one transaction. Query timeouts
 * come from {@code jakarta.persistence.query.timeout}.
 */
@Component
@Slf4j
public class JpaTrackingStore implements TrackingStore {

    private final TrackingSessionRepository sessionRepository;
    private final LocationSampleRepository sampleRepository;
    private final TransactionTemplate transactionTemplate;

    public JpaTrackingStore(TrackingSessionRepository sessionRepository,
                            LocationSampleRepository sampleRepository,
                            PlatformTransactionManager transactionManager) {
        this.sessionRepository = sessionRepository;
        this.sampleRepository = sampleRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public Optional<TrackingSession> findSession(String tripId) {
        return call("findSession " + tripId, () -> sessionRepository.findByTripId(tripId));
    }

    @Override
    public TrackingSession saveSession(TrackingSession session) {
        return call("saveSession " + session.getTripId(), () -> sessionRepository.save(session));
    }

    @Override
    public RecordedSamples recordSamples(TrackingSession session, List<LocationSample> samples) {
        return call("recordSamples " + session.getTripId() + " x" + samples.size(),
                () -> transactionTemplate.execute(status -> {
                    List<LocationSample> saved = sampleRepository.saveAll(samples);
                    TrackingSession savedSession = sessionRepository.saveAndFlush(session);
                    return new RecordedSamples(savedSession, saved);
                }));
    }

    @Override
    public Optional<LocationSample> lastSample(String tripId, String userId) {
        return call("lastSample " + tripId,
                () -> sampleRepository.findTopByTripIdAndUserIdOrderByTimestampDesc(tripId, userId));
    }

    @Override
    public Optional<LocationSample> lastSample(String tripId) {
        return call("lastSample " + tripId, () -> sampleRepository.findTopByTripIdOrderByTimestampDesc(tripId));
    }

    @Override
    public List<LocationSample> samplesInRange(String tripId, Instant from, Instant to) {
        return call("samplesInRange " + tripId,
                () -> sampleRepository.findByTripIdAndTimestampBetweenOrderByTimestampAsc(tripId, from, to));
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("[STORE] {} failed — {}", operation, e.getMessage());
            throw new StorageUnavailableException("Storage unavailable during " + operation, e);
        }
    }
}
