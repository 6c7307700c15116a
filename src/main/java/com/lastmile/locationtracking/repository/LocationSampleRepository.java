package com.lastmile.locationtracking.repository;

import com.lastmile.locationtracking.entity.LocationSample;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for GPS samples; "latest" always means latest device timestamp.
 */
@Repository
public interface LocationSampleRepository extends JpaRepository<LocationSample, Long> {

    // Previous sample of the same courier, for incremental distance
    Optional<LocationSample> findTopByTripIdAndUserIdOrderByTimestampDesc(String tripId, String userId);

    Optional<LocationSample> findTopByTripIdOrderByTimestampDesc(String tripId);

    List<LocationSample> findByTripIdAndTimestampBetweenOrderByTimestampAsc(String tripId, Instant from, Instant to);
}
