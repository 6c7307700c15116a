package com.lastmile.locationtracking.store;

import com.lastmile.locationtracking.entity.ContainmentState;
import com.lastmile.locationtracking.entity.Geofence;
import com.lastmile.locationtracking.entity.GeofenceEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Map-backed {@link GeofenceStore} for unit tests.
 */
public class InMemoryGeofenceStore implements GeofenceStore {

    private final Map<Long, Geofence> geofences = new ConcurrentHashMap<>();
    private final Map<ContainmentState.Key, ContainmentState> states = new ConcurrentHashMap<>();
    private final List<GeofenceEvent> events = new ArrayList<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public List<Geofence> getGeofencesForTrip(String tripId) {
        return geofences.values().stream()
                .filter(Geofence::isActive)
                .filter(g -> g.getTripId() == null || Objects.equals(g.getTripId(), tripId))
                .sorted(Comparator.comparing(Geofence::getId))
                .toList();
    }

    @Override
    public Optional<Geofence> findGeofence(Long geofenceId) {
        return Optional.ofNullable(geofences.get(geofenceId));
    }

    @Override
    public Geofence saveGeofence(Geofence geofence) {
        if (geofence.getId() == null) {
            geofence.setId(ids.incrementAndGet());
        }
        geofences.put(geofence.getId(), geofence);
        return geofence;
    }

    @Override
    public List<Geofence> findExpiredGeofences(Instant now) {
        return geofences.values().stream()
                .filter(Geofence::isActive)
                .filter(g -> g.isExpiredAt(now))
                .toList();
    }

    @Override
    public Optional<ContainmentState> getContainmentState(String userId, Long geofenceId) {
        return Optional.ofNullable(states.get(new ContainmentState.Key(userId, geofenceId)))
                .map(s -> s.toBuilder().build());
    }

    @Override
    public ContainmentState putContainmentState(ContainmentState state) {
        states.put(new ContainmentState.Key(state.getUserId(), state.getGeofenceId()), state.toBuilder().build());
        return state;
    }

    @Override
    public synchronized GeofenceEvent appendEvent(GeofenceEvent event) {
        event.setId(ids.incrementAndGet());
        events.add(event);
        return event;
    }

    @Override
    public synchronized List<GeofenceEvent> eventsForGeofence(Long geofenceId) {
        return events.stream().filter(e -> e.getGeofenceId().equals(geofenceId)).toList();
    }

    @Override
    public synchronized List<GeofenceEvent> eventsForTrip(String tripId) {
        return events.stream().filter(e -> Objects.equals(e.getTripId(), tripId)).toList();
    }
}
