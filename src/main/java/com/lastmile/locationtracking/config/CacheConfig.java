package com.lastmile.locationtracking.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.support.SimpleCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Spring cache configuration backed by Caffeine.
 *
 *   activeGeofences - geofences watched by a trip, keyed by tripId.
 *                     Read on every location sample, written rarely.
 *                     TTL: 5 minutes. Max entries: 10 000.
 *
 * Eviction:
 *   1. Explicit → GeofenceService clears the cache whenever a geofence is
 *                 created or deactivated (global geofences touch every trip).
 *   2. TTL      → expireAfterWrite bounds staleness of the active window flag.
 *   3. Size     → maximumSize caps memory.
 *
 * Per-entry TTL data (current location, session snapshots) lives in
 * {@link com.lastmile.locationtracking.store.CaffeineLocationCache} instead.
 */
@Configuration
@EnableCaching
@Slf4j
public class CacheConfig {

    public static final String CACHE_ACTIVE_GEOFENCES = "activeGeofences";

    @Bean
    public CacheManager cacheManager() {
        log.info("[CACHE] Initialising Caffeine CacheManager — caches: '{}'", CACHE_ACTIVE_GEOFENCES);

        SimpleCacheManager manager = new SimpleCacheManager();
        manager.setCaches(List.of(
                buildCache(CACHE_ACTIVE_GEOFENCES, 5, 10_000)
        ));
        return manager;
    }

    private CaffeineCache buildCache(String name, int ttlMinutes, int maxSize) {
        return new CaffeineCache(name,
                Caffeine.newBuilder()
                        .expireAfterWrite(ttlMinutes, TimeUnit.MINUTES)
                        .maximumSize(maxSize)
                        .recordStats()
                        .build());
    }
}
