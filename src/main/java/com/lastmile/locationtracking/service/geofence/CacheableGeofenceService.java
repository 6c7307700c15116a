package com.lastmile.locationtracking.service.geofence;

import com.lastmile.locationtracking.config.CacheConfig;
import com.lastmile.locationtracking.entity.Geofence;
import com.lastmile.locationtracking.store.GeofenceStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Cached lookup of the geofences a trip is watched against.
 *
 * Kept in its own bean: @Cacheable works through the Spring proxy, so calls
 * from inside GeofenceService or GeofenceEvaluator would bypass the cache.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CacheableGeofenceService {

    private final GeofenceStore geofenceStore;

    /**
     * Active geofences bound to the trip plus global ones.
     * Read on every sample.
     */
    @Cacheable(CacheConfig.CACHE_ACTIVE_GEOFENCES)
    public List<Geofence> getGeofencesForTrip(String tripId) {
        log.debug("[CACHE MISS] activeGeofences for trip {} — loading from DB", tripId);
        return geofenceStore.getGeofencesForTrip(tripId);
    }

    /** Cleared on every create/deactivate; a global geofence changes the list of every trip. */
    @CacheEvict(value = CacheConfig.CACHE_ACTIVE_GEOFENCES, allEntries = true)
    public void evictActiveGeofences() {
        log.info("[CACHE EVICT] activeGeofences cleared");
    }
}
