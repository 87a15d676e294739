package com.miniuber.rideservice.controller;

import com.miniuber.rideservice.dto.ApiResponse;
import com.miniuber.rideservice.dto.CancelRideRequest;
import com.miniuber.rideservice.dto.CreateRideRequest;
import com.miniuber.rideservice.dto.RideTransitionRequest;
import com.miniuber.rideservice.entity.CancellationInitiator;
import com.miniuber.rideservice.entity.Ride;
import com.miniuber.rideservice.entity.RideStatus;
import com.miniuber.rideservice.service.RideLifecycleService;
import com.miniuber.rideservice.service.RideStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RideController.
 *
 *  1. create → 201 with the ride in wire format (status "create_ride")
 *  2. complete with occurredAt → forwarded to the lifecycle service
 *  3. arrive without a body → service clock used (null occurredAt)
 *  4. cancel → initiator forwarded
 *  5. pending list → only CREATE_RIDE rides from the store
 */
@ExtendWith(MockitoExtension.class)
class RideControllerTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private RideLifecycleService rideLifecycleService;
    @Mock private RideStore            rideStore;

    @InjectMocks
    private RideController rideController;

    // ── Test fixtures ─────────────────────────────────────────────────────────

    private static final Long RIDE_ID = 5L;
    private static final LocalDateTime CREATED = LocalDateTime.of(2024, 5, 1, 9, 0);

    private Ride ride(RideStatus status) {
        return Ride.builder()
                .id(RIDE_ID).riderId(1L)
                .driverId(status == RideStatus.CREATE_RIDE ? null : 2L)
                .pickupLatitude(12.9716).pickupLongitude(77.5946)
                .dropLatitude(13.0).dropLongitude(77.6)
                .status(status)
                .createdAt(CREATED)
                .distanceKm(3.2104)
                .build();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> data(ResponseEntity<ApiResponse> response) {
        return (Map<String, Object>) response.getBody().getData();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Test 1: create
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("POST /api/rides → 201, status create_ride")
    void createRide_returnsCreated() {
        CreateRideRequest request = CreateRideRequest.builder().riderId(1L)
                .pickupLatitude(12.9716).pickupLongitude(77.5946).dropLatitude(13.0).dropLongitude(77.6).build();
        when(rideLifecycleService.createRide(request)).thenReturn(ride(RideStatus.CREATE_RIDE));

        ResponseEntity<ApiResponse> response = rideController.createRide(request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(response.getBody().isSuccess()).isTrue();
        assertThat(data(response))
                .containsEntry("id", RIDE_ID)
                .containsEntry("status", "create_ride")
                .containsEntry("driverId", null)
                .containsEntry("distanceKm", 3.21)
                .containsEntry("createdAt", CREATED.toString());
    }

    // ════════════════════════════════════════════════════════════════════════
    // Test 2/3: lifecycle commands
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("POST /complete with occurredAt → forwarded, fare in response")
    void completeRide_forwardsOccurredAt() {
        LocalDateTime end = CREATED.plusMinutes(40);
        Ride completed = ride(RideStatus.COMPLETED);
        completed.setFare(new BigDecimal("192.00"));
        when(rideLifecycleService.completeRide(RIDE_ID, end)).thenReturn(completed);

        ResponseEntity<ApiResponse> response = rideController.completeRide(RIDE_ID, new RideTransitionRequest(end));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(data(response)).containsEntry("status", "completed")
                .containsEntry("fare", new BigDecimal("192.00"));
        assertThat(response.getBody().getMessage()).contains("192.00");
    }

    @Test
    @DisplayName("POST /arrive without a body → occurredAt null (service clock)")
    void arrive_withoutBody() {
        when(rideLifecycleService.markDriverArrived(RIDE_ID, null)).thenReturn(ride(RideStatus.DRIVER_ARRIVED));

        ResponseEntity<ApiResponse> response = rideController.markDriverArrived(RIDE_ID, null);

        assertThat(data(response)).containsEntry("status", "driver_arrived");
        verify(rideLifecycleService).markDriverArrived(RIDE_ID, null);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Test 4: cancel
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("POST /cancel → initiator forwarded, cancelledBy in response")
    void cancel_forwardsInitiator() {
        Ride cancelled = ride(RideStatus.CANCELLED);
        cancelled.setCancelledBy(CancellationInitiator.DRIVER);
        when(rideLifecycleService.cancelRide(eq(RIDE_ID), eq(CancellationInitiator.DRIVER), isNull()))
                .thenReturn(cancelled);

        ResponseEntity<ApiResponse> response =
                rideController.cancelRide(RIDE_ID, new CancelRideRequest(CancellationInitiator.DRIVER, null));

        assertThat(data(response)).containsEntry("status", "cancelled").containsEntry("cancelledBy", "DRIVER");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Test 5: pending list
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("GET /api/rides/pending → rides from listPendingRides")
    void pendingRides() {
        when(rideStore.listPendingRides()).thenReturn(List.of(ride(RideStatus.CREATE_RIDE)));

        ResponseEntity<ApiResponse> response = rideController.listPendingRides();

        assertThat((List<?>) response.getBody().getData()).hasSize(1);
        verify(rideStore, never()).listRides();
    }
}
