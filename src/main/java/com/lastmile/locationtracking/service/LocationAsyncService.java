package com.lastmile.locationtracking.service;

import com.lastmile.locationtracking.dto.LocationSampleRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Fire-and-forget ingestion for devices that only need an acknowledgement.
 *
 * The device gets 202 Accepted immediately; the sample runs through the
 * normal pipeline on the "locationTaskExecutor" pool. Kept in a separate bean
 * so the call goes through the @Async proxy.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LocationAsyncService {

    private final LocationTrackingService trackingService;

    @Async("locationTaskExecutor")
    public CompletableFuture<Void> ingestAsync(String tripId, String userId, LocationSampleRequest sample) {
        try {
            trackingService.ingestLocation(tripId, userId, sample);
        } catch (RuntimeException e) {
            log.error("Async location processing failed — trip: {}, user: {}, ts: {} — {}",
                    tripId, userId, sample != null ? sample.getTimestamp() : null, e.getMessage());
        }
        return CompletableFuture.completedFuture(null);
    }
}
