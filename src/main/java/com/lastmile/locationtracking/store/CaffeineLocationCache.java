package com.lastmile.locationtracking.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.lastmile.locationtracking.exception.CacheUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * In-process {@link LocationCache} on Caffeine.
 *
 * Every entry carries its own TTL (current location ~5 min, session
 * snapshot ~1 h), implemented with a variable {@link Expiry}.
 * maximumSize caps memory; Caffeine evicts the least useful entries first.
 */
@Component
@Slf4j
public class CaffeineLocationCache implements LocationCache {

    private final Cache<String, Entry> cache;

    public CaffeineLocationCache(@Value("${tracking.cache.max-entries:100000}") long maxEntries) {
        log.info("[CACHE] Initialising Caffeine location cache — max entries: {}", maxEntries);
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new Expiry<String, Entry>() {
                    @Override
                    public long expireAfterCreate(String key, Entry entry, long currentTime) {
                        return entry.ttl.toNanos();
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                        return entry.ttl.toNanos();
                    }

                    @Override
                    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .recordStats()
                .build();
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        try {
            Entry entry = cache.getIfPresent(key);
            if (entry == null || !type.isInstance(entry.value)) {
                return Optional.empty();
            }
            return Optional.of(type.cast(entry.value));
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("Cache read failed for " + key, e);
        }
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
        try {
            cache.put(key, new Entry(value, ttl));
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("Cache write failed for " + key, e);
        }
    }

    @Override
    public void evict(String key) {
        try {
            cache.invalidate(key);
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("Cache evict failed for " + key, e);
        }
    }

    @Override
    public void evictByPrefix(String prefix) {
        try {
            cache.asMap().keySet().removeIf(key -> key.startsWith(prefix));
        } catch (RuntimeException e) {
            throw new CacheUnavailableException("Cache evict failed for " + prefix + "*", e);
        }
    }

    private static final class Entry {
        private final Object value;
        private final Duration ttl;

        private Entry(Object value, Duration ttl) {
            this.value = value;
            this.ttl = ttl;
        }
    }
}
