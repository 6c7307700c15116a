package com.lastmile.locationtracking.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value cache with a time-to-live per entry.
 *
 * Any operation may throw
 * {@link com.lastmile.locationtracking.exception.CacheUnavailableException};
 * callers are expected to fall back to the persistence layer.
 */
public interface LocationCache {

    <T> Optional<T> get(String key, Class<T> type);

    void put(String key, Object value, Duration ttl);

    void evict(String key);

    /** Removes every entry whose key starts with {@code prefix}. */
    void evictByPrefix(String prefix);
}
