package com.lastmile.locationtracking.exception;

import com.lastmile.locationtracking.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the application.
 *
 * Engine errors keep their {@link ErrorCode} in the body; rejected samples
 * are echoed back in {@code data} so the device can correct and resend them.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Handle validation errors from @Valid annotations
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        log.warn("Validation error occurred: {}", ex.getMessage());

        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(null, "Validation failed", errors));
    }

    @ExceptionHandler(InvalidLocationException.class)
    public ResponseEntity<ApiResponse> handleInvalidLocation(InvalidLocationException ex) {
        log.warn("Rejected location sample — {}: {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(ex.getErrorCode(), ex.getMessage(), ex.getRejected()));
    }

    @ExceptionHandler(TrackingException.class)
    public ResponseEntity<ApiResponse> handleTrackingException(TrackingException ex) {
        HttpStatus status = statusOf(ex.getErrorCode());
        if (status.is5xxServerError()) {
            log.error("Tracking engine error — {}: {}", ex.getErrorCode(), ex.getMessage(), ex);
        } else {
            log.warn("Request rejected — {}: {}", ex.getErrorCode(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(ApiResponse.error(ex.getErrorCode(), ex.getMessage(), null));
    }

    /**
     * Handle all other exceptions
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("An unexpected error occurred: " + ex.getMessage()));
    }

    static HttpStatus statusOf(ErrorCode code) {
        switch (code) {
            case INVALID_COORDINATES:
            case INVALID_ACCURACY:
            case INVALID_SPEED:
            case GEOFENCE_GEOMETRY_ERROR:
                return HttpStatus.BAD_REQUEST;
            case SESSION_NOT_FOUND:
            case GEOFENCE_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case SESSION_NOT_ACTIVE:
            case SESSION_ALREADY_ACTIVE:
                return HttpStatus.CONFLICT;
            case STORAGE_UNAVAILABLE:
            case CACHE_UNAVAILABLE:
            case LOCK_TIMEOUT:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
