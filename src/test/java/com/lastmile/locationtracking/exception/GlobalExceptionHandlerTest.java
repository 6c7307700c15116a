package com.lastmile.locationtracking.exception;

import com.lastmile.locationtracking.dto.ApiResponse;
import com.lastmile.locationtracking.dto.LocationSampleRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for GlobalExceptionHandler: error code to HTTP status mapping.
 */
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("Every error code maps to its documented status")
    void statusMapping() {
        assertThat(GlobalExceptionHandler.statusOf(ErrorCode.INVALID_COORDINATES)).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(GlobalExceptionHandler.statusOf(ErrorCode.INVALID_ACCURACY)).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(GlobalExceptionHandler.statusOf(ErrorCode.INVALID_SPEED)).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(GlobalExceptionHandler.statusOf(ErrorCode.GEOFENCE_GEOMETRY_ERROR)).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(GlobalExceptionHandler.statusOf(ErrorCode.SESSION_NOT_FOUND)).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(GlobalExceptionHandler.statusOf(ErrorCode.GEOFENCE_NOT_FOUND)).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(GlobalExceptionHandler.statusOf(ErrorCode.SESSION_NOT_ACTIVE)).isEqualTo(HttpStatus.CONFLICT);
        assertThat(GlobalExceptionHandler.statusOf(ErrorCode.SESSION_ALREADY_ACTIVE)).isEqualTo(HttpStatus.CONFLICT);
        assertThat(GlobalExceptionHandler.statusOf(ErrorCode.STORAGE_UNAVAILABLE)).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(GlobalExceptionHandler.statusOf(ErrorCode.CACHE_UNAVAILABLE)).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(GlobalExceptionHandler.statusOf(ErrorCode.LOCK_TIMEOUT)).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    @DisplayName("Rejected sample is echoed back with its error code")
    void invalidLocationEchoesInput() {
        LocationSampleRequest rejected = LocationSampleRequest.builder().latitude(95.0).longitude(10.0).build();

        ResponseEntity<ApiResponse> response = handler.handleInvalidLocation(
                new InvalidLocationException(ErrorCode.INVALID_COORDINATES, "Invalid coordinates: (95.0, 10.0)", rejected));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getErrorCode()).isEqualTo(ErrorCode.INVALID_COORDINATES);
        assertThat(response.getBody().getData()).isSameAs(rejected);
        assertThat(response.getBody().isSuccess()).isFalse();
    }

    @Test
    @DisplayName("Session conflicts → 409 with the error code in the body")
    void sessionConflict() {
        ResponseEntity<ApiResponse> response = handler.handleTrackingException(
                SessionStateException.alreadyActive("TRIP-1001"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().getErrorCode()).isEqualTo(ErrorCode.SESSION_ALREADY_ACTIVE);
    }

    @Test
    @DisplayName("Storage outage → 503")
    void storageUnavailable() {
        ResponseEntity<ApiResponse> response = handler.handleTrackingException(
                new StorageUnavailableException("Storage unavailable during recordSamples", new RuntimeException("db down")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    @DisplayName("Unexpected exception → 500")
    void unexpected() {
        ResponseEntity<ApiResponse> response = handler.handleGenericException(new IllegalStateException("boom"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().getMessage()).contains("boom");
    }
}
