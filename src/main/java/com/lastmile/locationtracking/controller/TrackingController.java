package com.lastmile.locationtracking.controller;

import com.lastmile.locationtracking.dto.ApiResponse;
import com.lastmile.locationtracking.dto.BatchResult;
import com.lastmile.locationtracking.dto.IngestResult;
import com.lastmile.locationtracking.dto.LocationHistory;
import com.lastmile.locationtracking.dto.LocationSampleRequest;
import com.lastmile.locationtracking.dto.StartTrackingRequest;
import com.lastmile.locationtracking.dto.StopTrackingRequest;
import com.lastmile.locationtracking.dto.TrackingSummary;
import com.lastmile.locationtracking.entity.PrivacySettings;
import com.lastmile.locationtracking.entity.TrackingSession;
import com.lastmile.locationtracking.service.LocationAsyncService;
import com.lastmile.locationtracking.service.LocationTrackingService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

/**
 * REST API for tracking sessions and GPS ingestion.
 *
 * Endpoints:
 *   POST /api/tracking/{tripId}/start                       - start or resume tracking
 *   POST /api/tracking/{tripId}/stop                        - stop tracking (resumable)
 *   POST /api/tracking/{tripId}/complete                    - finish tracking for good
 *   POST /api/tracking/{tripId}/pause | /resume
 *   PUT  /api/tracking/{tripId}/privacy                     - change the privacy level
 *   GET  /api/tracking/{tripId}                             - session state and counters
 *   POST /api/tracking/{tripId}/users/{userId}/update       - one sample
 *   POST /api/tracking/{tripId}/users/{userId}/update/batch - buffered samples
 *   POST /api/tracking/{tripId}/users/{userId}/update/async - one sample, 202 Accepted
 *   GET  /api/tracking/{tripId}/current?userId=             - latest filtered position
 *   GET  /api/tracking/{tripId}/history?from=&to=           - route with summary
 */
@RestController
@RequestMapping("/api/tracking")
@Slf4j
public class TrackingController {

    private final LocationTrackingService trackingService;
    private final LocationAsyncService locationAsyncService;
    private final int maxBatchSize;

    public TrackingController(LocationTrackingService trackingService,
                              LocationAsyncService locationAsyncService,
                              @Value("${tracking.batch.max-size:100}") int maxBatchSize) {
        this.trackingService = trackingService;
        this.locationAsyncService = locationAsyncService;
        this.maxBatchSize = maxBatchSize;
    }

    @PostMapping("/{tripId}/start")
    public ResponseEntity<ApiResponse> start(@PathVariable String tripId,
                                             @Valid @RequestBody StartTrackingRequest request) {
        log.info("Start tracking requested — trip: {}, user: {}", tripId, request.getUserId());
        TrackingSession session = trackingService.startTracking(tripId, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(session, "Tracking started for trip " + tripId));
    }

    @PostMapping("/{tripId}/stop")
    public ResponseEntity<ApiResponse> stop(@PathVariable String tripId,
                                            @RequestBody(required = false) StopTrackingRequest request) {
        TrackingSummary summary = trackingService.stopTracking(tripId, request != null ? request.getReason() : null);
        return ResponseEntity.ok(ApiResponse.success(summary, "Tracking stopped for trip " + tripId));
    }

    @PostMapping("/{tripId}/complete")
    public ResponseEntity<ApiResponse> complete(@PathVariable String tripId) {
        TrackingSummary summary = trackingService.completeTracking(tripId);
        return ResponseEntity.ok(ApiResponse.success(summary, "Tracking completed for trip " + tripId));
    }

    @PostMapping("/{tripId}/pause")
    public ResponseEntity<ApiResponse> pause(@PathVariable String tripId) {
        return ResponseEntity.ok(ApiResponse.success(trackingService.pauseTracking(tripId), "Tracking paused"));
    }

    @PostMapping("/{tripId}/resume")
    public ResponseEntity<ApiResponse> resume(@PathVariable String tripId) {
        return ResponseEntity.ok(ApiResponse.success(trackingService.resumeTracking(tripId), "Tracking resumed"));
    }

    @PutMapping("/{tripId}/privacy")
    public ResponseEntity<ApiResponse> updatePrivacy(@PathVariable String tripId,
                                                     @RequestBody PrivacySettings privacySettings) {
        TrackingSession session = trackingService.updatePrivacy(tripId, privacySettings);
        return ResponseEntity.ok(ApiResponse.success(session,
                "Privacy level set to " + session.trackingLevel() + " for trip " + tripId));
    }

    @GetMapping("/{tripId}")
    public ResponseEntity<ApiResponse> session(@PathVariable String tripId) {
        return ResponseEntity.ok(ApiResponse.success(trackingService.getSession(tripId), "Tracking session found"));
    }

    @PostMapping("/{tripId}/users/{userId}/update")
    public ResponseEntity<ApiResponse> update(@PathVariable String tripId,
                                              @PathVariable String userId,
                                              @RequestBody LocationSampleRequest sample) {
        log.debug("Location update — trip: {}, user: {}", tripId, userId);
        IngestResult result = trackingService.ingestLocation(tripId, userId, sample);
        return ResponseEntity.ok(ApiResponse.success(result, "Location update processed successfully"));
    }

    /**
     * Buffered samples from a device that was offline. Invalid items are
     * reported per item; the rest are stored in timestamp order.
     */
    @PostMapping("/{tripId}/users/{userId}/update/batch")
    public ResponseEntity<ApiResponse> batchUpdate(@PathVariable String tripId,
                                                   @PathVariable String userId,
                                                   @RequestBody List<LocationSampleRequest> samples) {
        log.info("Batch location update received — trip: {}, user: {}, {} samples", tripId, userId, samples.size());

        if (samples.isEmpty()) {
            return ResponseEntity.badRequest()
                    .body(ApiResponse.error("Batch is empty — nothing to process"));
        }
        if (samples.size() > maxBatchSize) {
            log.warn("Batch rejected — size {} exceeds max allowed {}", samples.size(), maxBatchSize);
            return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                    .body(ApiResponse.error("Batch size " + samples.size() + " exceeds maximum allowed "
                            + maxBatchSize + ". Split into smaller batches."));
        }

        BatchResult result = trackingService.ingestLocationBatch(tripId, userId, samples);
        return ResponseEntity.ok(ApiResponse.success(result,
                "Batch processed: " + result.getSuccessful() + "/" + result.getProcessed()));
    }

    @PostMapping("/{tripId}/users/{userId}/update/async")
    public ResponseEntity<ApiResponse> updateAsync(@PathVariable String tripId,
                                                   @PathVariable String userId,
                                                   @RequestBody LocationSampleRequest sample) {
        locationAsyncService.ingestAsync(tripId, userId, sample);
        return ResponseEntity.accepted()
                .body(ApiResponse.success(null, "Location update accepted for async processing"));
    }

    @GetMapping("/{tripId}/current")
    public ResponseEntity<ApiResponse> current(@PathVariable String tripId,
                                               @RequestParam(required = false) String userId) {
        return trackingService.getCurrentLocation(tripId, userId)
                .map(sample -> ResponseEntity.ok(ApiResponse.success(sample, "Current location found")))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ApiResponse.error("No location recorded for trip " + tripId)));
    }

    @GetMapping("/{tripId}/history")
    public ResponseEntity<ApiResponse> history(
            @PathVariable String tripId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        LocationHistory history = trackingService.getHistory(tripId, from, to);
        return ResponseEntity.ok(ApiResponse.success(history,
                history.getSummary().getTotalPoints() + " location(s) found"));
    }
}
