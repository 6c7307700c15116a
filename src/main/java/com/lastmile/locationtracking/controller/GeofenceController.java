package com.lastmile.locationtracking.controller;

import com.lastmile.locationtracking.dto.ApiResponse;
import com.lastmile.locationtracking.dto.DeliveryGeofencesRequest;
import com.lastmile.locationtracking.dto.GeofenceRequest;
import com.lastmile.locationtracking.dto.GeofenceStats;
import com.lastmile.locationtracking.entity.Coordinates;
import com.lastmile.locationtracking.entity.Geofence;
import com.lastmile.locationtracking.entity.GeofenceEvent;
import com.lastmile.locationtracking.service.geofence.CacheableGeofenceService;
import com.lastmile.locationtracking.service.geofence.GeofenceService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for geofences and their event log.
 *
 * Endpoints:
 *   POST   /api/geofences                          - create a circle or polygon geofence
 *   POST   /api/geofences/trips/{tripId}/delivery  - pickup + drop-off geofences of a delivery
 *   GET    /api/geofences/trips/{tripId}           - geofences currently watched for a trip
 *   GET    /api/geofences/trips/{tripId}/events    - events raised on a trip
 *   GET    /api/geofences/{id}
 *   PUT    /api/geofences/{id}                     - replace the definition
 *   DELETE /api/geofences/{id}                     - deactivate
 *   GET    /api/geofences/{id}/distance?latitude=&longitude=
 *   GET    /api/geofences/{id}/events
 *   GET    /api/geofences/{id}/stats               - event counts and dwell averages
 */
@RestController
@RequestMapping("/api/geofences")
@RequiredArgsConstructor
@Slf4j
public class GeofenceController {

    private final GeofenceService geofenceService;
    private final CacheableGeofenceService cacheableGeofenceService;

    /**
     * Example: POST /api/geofences
     * {
     *   "name": "Warehouse gate",
     *   "kind": "PICKUP",
     *   "geometryType": "CIRCLE",
     *   "center": {"latitude": 18.5204, "longitude": 73.8567},
     *   "radiusM": 150,
     *   "notificationPolicy": {"onEntry": true, "onExit": true, "dwellEnabled": true, "dwellDurationSec": 300}
     * }
     */
    @PostMapping
    public ResponseEntity<ApiResponse> create(@RequestBody @Valid GeofenceRequest request) {
        Geofence saved = geofenceService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(saved, "Geofence created with ID: " + saved.getId()));
    }

    @PostMapping("/trips/{tripId}/delivery")
    public ResponseEntity<ApiResponse> createDelivery(@PathVariable String tripId,
                                                      @RequestBody DeliveryGeofencesRequest request) {
        List<Geofence> created = geofenceService.createDeliveryGeofences(tripId, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(created, created.size() + " geofence(s) created for trip " + tripId));
    }

    @GetMapping("/trips/{tripId}")
    public ResponseEntity<ApiResponse> forTrip(@PathVariable String tripId) {
        List<Geofence> geofences = cacheableGeofenceService.getGeofencesForTrip(tripId);
        return ResponseEntity.ok(ApiResponse.success(geofences, geofences.size() + " geofence(s) found"));
    }

    @GetMapping("/trips/{tripId}/events")
    public ResponseEntity<ApiResponse> tripEvents(@PathVariable String tripId) {
        List<GeofenceEvent> events = geofenceService.eventsForTrip(tripId);
        return ResponseEntity.ok(ApiResponse.success(events, events.size() + " event(s) found"));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse> getById(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(geofenceService.getGeofence(id), "Geofence found"));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse> update(@PathVariable Long id, @RequestBody @Valid GeofenceRequest request) {
        Geofence saved = geofenceService.update(id, request);
        return ResponseEntity.ok(ApiResponse.success(saved, "Geofence " + id + " updated"));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse> deactivate(@PathVariable Long id) {
        geofenceService.deactivate(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Geofence " + id + " deactivated"));
    }

    @GetMapping("/{id}/distance")
    public ResponseEntity<ApiResponse> distance(@PathVariable Long id,
                                                @RequestParam double latitude,
                                                @RequestParam double longitude) {
        double meters = geofenceService.distanceToGeofence(Coordinates.of(latitude, longitude), id);
        return ResponseEntity.ok(ApiResponse.success(
                Map.of("geofenceId", id, "distanceMeters", meters, "inside", meters == 0),
                "Distance calculated"));
    }

    @GetMapping("/{id}/events")
    public ResponseEntity<ApiResponse> events(@PathVariable Long id) {
        List<GeofenceEvent> events = geofenceService.eventsForGeofence(id);
        return ResponseEntity.ok(ApiResponse.success(events, events.size() + " event(s) found"));
    }

    @GetMapping("/{id}/stats")
    public ResponseEntity<ApiResponse> stats(@PathVariable Long id) {
        GeofenceStats stats = geofenceService.statsForGeofence(id);
        return ResponseEntity.ok(ApiResponse.success(stats, stats.getTotalEvents() + " event(s) recorded"));
    }
}
