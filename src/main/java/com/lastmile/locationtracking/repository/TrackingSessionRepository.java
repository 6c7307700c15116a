package com.lastmile.locationtracking.repository;

import com.lastmile.locationtracking.entity.TrackingSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TrackingSessionRepository extends JpaRepository<TrackingSession, Long> {

    Optional<TrackingSession> findByTripId(String tripId);
}
