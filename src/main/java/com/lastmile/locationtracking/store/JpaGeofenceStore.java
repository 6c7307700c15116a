package com.lastmile.locationtracking.store;

import com.lastmile.locationtracking.entity.ContainmentState;
import com.lastmile.locationtracking.entity.Geofence;
import com.lastmile.locationtracking.entity.GeofenceEvent;
import com.lastmile.locationtracking.exception.StorageUnavailableException;
import com.lastmile.locationtracking.repository.ContainmentStateRepository;
import com.lastmile.locationtracking.repository.GeofenceEventRepository;
import com.lastmile.locationtracking.repository.GeofenceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link GeofenceStore} backed by Spring Data JPA.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaGeofenceStore implements GeofenceStore {

    private final GeofenceRepository geofenceRepository;
    private final ContainmentStateRepository containmentStateRepository;
    private final GeofenceEventRepository eventRepository;

    @Override
    public List<Geofence> getGeofencesForTrip(String tripId) {
        return call("getGeofencesForTrip " + tripId, () -> geofenceRepository.findActiveForTrip(tripId));
    }

    @Override
    public Optional<Geofence> findGeofence(Long geofenceId) {
        return call("findGeofence " + geofenceId, () -> geofenceRepository.findById(geofenceId));
    }

    @Override
    public Geofence saveGeofence(Geofence geofence) {
        return call("saveGeofence", () -> geofenceRepository.save(geofence));
    }

    @Override
    public List<Geofence> findExpiredGeofences(Instant now) {
        return call("findExpiredGeofences", () -> geofenceRepository.findByActiveTrueAndActiveUntilIsNotNull()
                .stream()
                .filter(g -> g.isExpiredAt(now))
                .toList());
    }

    @Override
    public Optional<ContainmentState> getContainmentState(String userId, Long geofenceId) {
        return call("getContainmentState " + userId + "/" + geofenceId,
                () -> containmentStateRepository.findById(new ContainmentState.Key(userId, geofenceId)));
    }

    @Override
    public ContainmentState putContainmentState(ContainmentState state) {
        return call("putContainmentState " + state.getUserId() + "/" + state.getGeofenceId(),
                () -> containmentStateRepository.save(state));
    }

    @Override
    public GeofenceEvent appendEvent(GeofenceEvent event) {
        return call("appendEvent " + event.getGeofenceId(), () -> eventRepository.save(event));
    }

    @Override
    public List<GeofenceEvent> eventsForGeofence(Long geofenceId) {
        return call("eventsForGeofence " + geofenceId,
                () -> eventRepository.findByGeofenceIdOrderByTriggeredAtAsc(geofenceId));
    }

    @Override
    public List<GeofenceEvent> eventsForTrip(String tripId) {
        return call("eventsForTrip " + tripId, () -> eventRepository.findByTripIdOrderByTriggeredAtAsc(tripId));
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
