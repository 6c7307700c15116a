package com.lastmile.locationtracking.util;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.lastmile.locationtracking.exception.LockTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes read-modify-write sections per key.
 *
 * Used for the three keyed resources shared between requests: a trip's
 * session and sample chain ({@code trip:<id>}) and a user's containment
 * state in a geofence ({@code containment:<user>:<geofence>}).
 *
 * Locks live in a weak-valued Caffeine cache: a lock stays reachable while a
 * thread holds or waits on it and is collected afterwards, so idle keys do
 * not accumulate. Locks are reentrant, so a component may call another that
 * takes the same key. Acquisition is bounded by {@code tracking.lock-timeout-ms}.
 */
@Component
@Slf4j
public class KeyedLocks {

    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(key -> new ReentrantLock());

    private final long timeoutMs;

    public KeyedLocks(@Value("${tracking.lock-timeout-ms:5000}") long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public static String tripKey(String tripId) {
        return "trip:" + tripId;
    }

    public static String containmentKey(String userId, Long geofenceId) {
        return "containment:" + userId + ":" + geofenceId;
    }

    /**
     * Runs {@code action} while holding the lock for {@code key}.
     *
     * @throws LockTimeoutException if the lock is not obtained within the timeout
     */
    public <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = locks.get(key);
        boolean acquired;
        try {
            acquired = lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockTimeoutException(key, timeoutMs);
        }
        if (!acquired) {
            log.warn("[LOCK] Timed out after {} ms waiting for {}", timeoutMs, key);
            throw new LockTimeoutException(key, timeoutMs);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runWithLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }
}
