package com.lastmile.locationtracking.service;

import com.lastmile.locationtracking.entity.LocationSample;
import com.lastmile.locationtracking.exception.CacheUnavailableException;
import com.lastmile.locationtracking.store.LocationCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Latest privacy-filtered sample per trip and per (trip, user).
 *
 * Keys:
 *   current_location:{tripId}:{userId} - one courier
 *   current_location:{tripId}          - whichever courier reported last
 *
 * Cache failures never fail the caller: writes are skipped and reads report
 * a miss, so the read path falls back to storage.
 */
@Service
@Slf4j
public class CurrentLocationCache {

    private static final String KEY_PREFIX = "current_location:";

    private final LocationCache cache;
    private final Duration ttl;

    public CurrentLocationCache(LocationCache cache,
                                @Value("${tracking.cache.current-location-ttl-seconds:300}") long ttlSeconds) {
        this.cache = cache;
        this.ttl = Duration.ofSeconds(ttlSeconds);
    }

    public void put(String tripId, String userId, LocationSample filteredSample) {
        try {
            cache.put(key(tripId, userId), filteredSample, ttl);
            cache.put(key(tripId, null), filteredSample, ttl);
        } catch (CacheUnavailableException e) {
            log.warn("[CACHE] Could not cache current location for trip {} — {}", tripId, e.getMessage());
        }
    }

    /**
     * @param userId courier to look up, or null for the latest courier of the trip
     */
    public Optional<LocationSample> get(String tripId, String userId) {
        try {
            return cache.get(key(tripId, userId), LocationSample.class);
        } catch (CacheUnavailableException e) {
            log.warn("[CACHE] Current location read failed for trip {} — falling back to storage: {}",
                    tripId, e.getMessage());
            return Optional.empty();
        }
    }

    /** Drops the trip entry and the entry of every courier on the trip. */
    public void evictTrip(String tripId) {
        try {
            cache.evict(key(tripId, null));
            cache.evictByPrefix(KEY_PREFIX + tripId + ":");
        } catch (CacheUnavailableException e) {
            log.warn("[CACHE] Could not evict current location for trip {} — {}", tripId, e.getMessage());
        }
    }

    private static String key(String tripId, String userId) {
        return userId != null ? KEY_PREFIX + tripId + ":" + userId : KEY_PREFIX + tripId;
    }
}
