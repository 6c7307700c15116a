package com.lastmile.locationtracking.repository;

import com.lastmile.locationtracking.entity.GeofenceEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface GeofenceEventRepository extends JpaRepository<GeofenceEvent, Long> {

    List<GeofenceEvent> findByGeofenceIdOrderByTriggeredAtAsc(Long geofenceId);

    List<GeofenceEvent> findByTripIdOrderByTriggeredAtAsc(String tripId);
}
