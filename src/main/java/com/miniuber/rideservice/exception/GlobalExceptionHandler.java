package com.miniuber.rideservice.exception;

import com.miniuber.rideservice.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for the application.
 *
 * Error taxonomy → HTTP:
 *  - ResourceNotFoundException      → 404
 *  - InvalidTransitionException     → 409 (rejected lifecycle command)
 *  - GuardConflictException         → 409 (lost a race with another writer)
 *  - PricingConfigMissingException  → 503 (ride stays STARTED)
 *  - validation errors              → 400
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
        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = ((FieldError) error).getField();
            String errorMessage = error.getDefaultMessage();
            errors.put(fieldName, errorMessage);
        });

        ApiResponse response = ApiResponse.builder()
                .success(false)
                .message("Validation failed")
                .data(errors)
                .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiResponse> handleNotFound(ResourceNotFoundException ex) {
        log.warn("{}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error(ex.getMessage()));
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ApiResponse> handleInvalidTransition(InvalidTransitionException ex) {
        log.warn("Rejected lifecycle command: {}", ex.getMessage());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("code", ex.getCode());
        data.put("rideId", ex.getRideId());
        data.put("currentStatus", ex.getCurrentStatus().wireName());
        data.put("requestedStatus", ex.getRequestedStatus().wireName());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(
                ApiResponse.builder().success(false).message(ex.getMessage()).data(data).build());
    }

    @ExceptionHandler(GuardConflictException.class)
    public ResponseEntity<ApiResponse> handleConflict(GuardConflictException ex) {
        log.warn("Guarded write conflict: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(
                ApiResponse.builder().success(false).message(ex.getMessage())
                        .data(Map.of("code", ex.getCode())).build());
    }

    @ExceptionHandler(PricingConfigMissingException.class)
    public ResponseEntity<ApiResponse> handlePricingMissing(PricingConfigMissingException ex) {
        log.error("Ride completion refused: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
                ApiResponse.builder().success(false).message(ex.getMessage())
                        .data(Map.of("code", ex.getCode())).build());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.warn("Malformed request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(ApiResponse.error("Malformed request body"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ApiResponse.error(ex.getMessage()));
    }

    /**
     * Handle all other exceptions
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred", ex);

        ApiResponse response = ApiResponse.builder()
                .success(false)
                .message("An unexpected error occurred: " + ex.getMessage())
                .data(null)
                .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

}
