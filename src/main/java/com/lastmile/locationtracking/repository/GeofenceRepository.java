package com.lastmile.locationtracking.repository;

import com.lastmile.locationtracking.entity.Geofence;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface GeofenceRepository extends JpaRepository<Geofence, Long> {

    /** Active geofences bound to the trip plus the global ones (tripId IS NULL). */
    @Query("SELECT g FROM Geofence g WHERE g.active = true AND (g.tripId = :tripId OR g.tripId IS NULL)")
    List<Geofence> findActiveForTrip(@Param("tripId") String tripId);

    /** Candidates for the expiry sweep; the window end is compared in each geofence's own zone. */
    List<Geofence> findByActiveTrueAndActiveUntilIsNotNull();
}
