package com.lastmile.locationtracking.store;

import com.lastmile.locationtracking.entity.ContainmentState;
import com.lastmile.locationtracking.entity.Geofence;
import com.lastmile.locationtracking.entity.GeofenceEvent;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence port for geofences, per-(user, geofence) containment state and the event log.
 */
public interface GeofenceStore {

    /** Active geofences bound to the trip, plus those bound to no trip. */
    List<Geofence> getGeofencesForTrip(String tripId);

    Optional<Geofence> findGeofence(Long geofenceId);

    Geofence saveGeofence(Geofence geofence);

    /** Active geofences whose window ended before {@code now}. */
    List<Geofence> findExpiredGeofences(Instant now);

    Optional<ContainmentState> getContainmentState(String userId, Long geofenceId);

    ContainmentState putContainmentState(ContainmentState state);

    GeofenceEvent appendEvent(GeofenceEvent event);

    List<GeofenceEvent> eventsForGeofence(Long geofenceId);

    List<GeofenceEvent> eventsForTrip(String tripId);
}
