package com.miniuber.rideservice.controller;

import com.miniuber.rideservice.dto.ApiResponse;
import com.miniuber.rideservice.dto.CancelRideRequest;
import com.miniuber.rideservice.dto.CreateRideRequest;
import com.miniuber.rideservice.dto.RideTransitionRequest;
import com.miniuber.rideservice.entity.Ride;
import com.miniuber.rideservice.service.RideLifecycleService;
import com.miniuber.rideservice.service.RideStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ride requests and lifecycle commands.
 *
 *  GET  /api/rides                 all rides
 *  GET  /api/rides/pending         rides waiting for a driver
 *  GET  /api/rides/{id}
 *  POST /api/rides                 new ride in create_ride
 *  POST /api/rides/{id}/arrive     assigned → driver_arrived
 *  POST /api/rides/{id}/start      driver_arrived → started
 *  POST /api/rides/{id}/complete   started → completed (computes the fare)
 *  POST /api/rides/{id}/cancel     create_ride | assigned | driver_arrived → cancelled
 */
@RestController
@RequestMapping("/api/rides")
@RequiredArgsConstructor
@Slf4j
public class RideController {

    private final RideLifecycleService rideLifecycleService;
    private final RideStore rideStore;

    @GetMapping
    public ResponseEntity<ApiResponse> listRides() {
        List<Map<String, Object>> rides = rideStore.listRides().stream().map(RideController::toRideMap).toList();
        return ResponseEntity.ok(ApiResponse.success(rides, "Found " + rides.size() + " ride(s)"));
    }

    @GetMapping("/pending")
    public ResponseEntity<ApiResponse> listPendingRides() {
        List<Map<String, Object>> rides = rideStore.listPendingRides().stream().map(RideController::toRideMap).toList();
        return ResponseEntity.ok(ApiResponse.success(rides, rides.size() + " ride(s) waiting for a driver"));
    }

    @GetMapping("/{rideId}")
    public ResponseEntity<ApiResponse> getRide(@PathVariable Long rideId) {
        Ride ride = rideLifecycleService.getRide(rideId);
        return ResponseEntity.ok(ApiResponse.success(toRideMap(ride), "Ride #" + rideId));
    }

    @PostMapping
    public ResponseEntity<ApiResponse> createRide(@Valid @RequestBody CreateRideRequest request) {
        log.info("API: create ride for rider #{} ({}, {}) → ({}, {})", request.getRiderId(),
                request.getPickupLatitude(), request.getPickupLongitude(),
                request.getDropLatitude(), request.getDropLongitude());
        Ride ride = rideLifecycleService.createRide(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(toRideMap(ride), "Ride #" + ride.getId() + " created"));
    }

    @PostMapping("/{rideId}/arrive")
    public ResponseEntity<ApiResponse> markDriverArrived(@PathVariable Long rideId,
                                                         @RequestBody(required = false) RideTransitionRequest request) {
        Ride ride = rideLifecycleService.markDriverArrived(rideId, occurredAt(request));
        return ResponseEntity.ok(ApiResponse.success(toRideMap(ride), "Driver arrived for ride #" + rideId));
    }

    @PostMapping("/{rideId}/start")
    public ResponseEntity<ApiResponse> startRide(@PathVariable Long rideId,
                                                 @RequestBody(required = false) RideTransitionRequest request) {
        Ride ride = rideLifecycleService.startRide(rideId, occurredAt(request));
        return ResponseEntity.ok(ApiResponse.success(toRideMap(ride), "Ride #" + rideId + " started"));
    }

    @PostMapping("/{rideId}/complete")
    public ResponseEntity<ApiResponse> completeRide(@PathVariable Long rideId,
                                                    @RequestBody(required = false) RideTransitionRequest request) {
        Ride ride = rideLifecycleService.completeRide(rideId, occurredAt(request));
        return ResponseEntity.ok(ApiResponse.success(toRideMap(ride),
                "Ride #" + rideId + " completed, fare " + ride.getFare()));
    }

    @PostMapping("/{rideId}/cancel")
    public ResponseEntity<ApiResponse> cancelRide(@PathVariable Long rideId,
                                                  @Valid @RequestBody CancelRideRequest request) {
        Ride ride = rideLifecycleService.cancelRide(rideId, request.getInitiator(), request.getOccurredAt());
        return ResponseEntity.ok(ApiResponse.success(toRideMap(ride),
                "Ride #" + rideId + " cancelled by " + request.getInitiator()));
    }

    private static LocalDateTime occurredAt(RideTransitionRequest request) {
        return request != null ? request.getOccurredAt() : null;
    }

    static Map<String, Object> toRideMap(Ride r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id",               r.getId());
        m.put("riderId",          r.getRiderId());
        m.put("driverId",         r.getDriverId());
        m.put("status",           r.getStatus().wireName());
        m.put("pickupLatitude",   r.getPickupLatitude());
        m.put("pickupLongitude",  r.getPickupLongitude());
        m.put("dropLatitude",     r.getDropLatitude());
        m.put("dropLongitude",    r.getDropLongitude());
        m.put("distanceKm",       r.getDistanceKm() != null ? Math.round(r.getDistanceKm() * 1000.0) / 1000.0 : null);
        m.put("fare",             r.getFare());
        m.put("createdAt",        text(r.getCreatedAt()));
        m.put("driverAssignedAt", text(r.getDriverAssignedAt()));
        m.put("driverArrivedAt",  text(r.getDriverArrivedAt()));
        m.put("startedAt",        text(r.getStartedAt()));
        m.put("endedAt",          text(r.getEndedAt()));
        m.put("cancelledAt",      text(r.getCancelledAt()));
        m.put("cancelledBy",      r.getCancelledBy() != null ? r.getCancelledBy().name() : null);
        return m;
    }

    private static String text(LocalDateTime t) {
        return t != null ? t.toString() : null;
    }
}
