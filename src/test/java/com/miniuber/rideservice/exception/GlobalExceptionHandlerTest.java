package com.miniuber.rideservice.exception;

import com.miniuber.rideservice.dto.ApiResponse;
import com.miniuber.rideservice.entity.RideStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("InvalidTransition → 409 with current and requested status")
    void invalidTransition_is409() {
        ResponseEntity<ApiResponse> response = handler.handleInvalidTransition(
                new InvalidTransitionException(4L, RideStatus.STARTED, RideStatus.CANCELLED));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().isSuccess()).isFalse();
        Map<String, Object> data = (Map<String, Object>) response.getBody().getData();
        assertThat(data)
                .containsEntry("code", "INVALID_TRANSITION")
                .containsEntry("currentStatus", "started")
                .containsEntry("requestedStatus", "cancelled");
    }

    @Test
    @DisplayName("Missing pricing config → 503")
    void pricingMissing_is503() {
        ResponseEntity<ApiResponse> response =
                handler.handlePricingMissing(new PricingConfigMissingException("default"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().getMessage()).contains("default");
    }

    @Test
    @DisplayName("Not found → 404, conflict → 409")
    void notFoundAndConflict() {
        assertThat(handler.handleNotFound(new ResourceNotFoundException("Ride", 9L)).getStatusCode())
                .isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(handler.handleConflict(new GuardConflictException("raced")).getStatusCode())
                .isEqualTo(HttpStatus.CONFLICT);
    }
}
