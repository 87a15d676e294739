package com.miniuber.rideservice.controller;

import com.miniuber.rideservice.dto.ApiResponse;
import com.miniuber.rideservice.entity.Driver;
import com.miniuber.rideservice.entity.RideOutcome;
import com.miniuber.rideservice.exception.ResourceNotFoundException;
import com.miniuber.rideservice.service.RideStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only driver views: position, status, active ride and recent history.
 */
@RestController
@RequestMapping("/api/drivers")
@RequiredArgsConstructor
public class DriverController {

    private final RideStore rideStore;

    @GetMapping
    public ResponseEntity<ApiResponse> listDrivers() {
        List<Map<String, Object>> drivers = rideStore.listDrivers().stream()
                .map(DriverController::toDriverMap).toList();
        return ResponseEntity.ok(ApiResponse.success(drivers, "Found " + drivers.size() + " driver(s)"));
    }

    @GetMapping("/{driverId}")
    public ResponseEntity<ApiResponse> getDriver(@PathVariable Long driverId) {
        Driver driver = rideStore.findDriver(driverId)
                .orElseThrow(() -> new ResourceNotFoundException("Driver", driverId));

        Map<String, Object> m = toDriverMap(driver);
        m.put("completedRides", rideStore.countOutcomes(driverId, RideOutcome.COMPLETED));
        m.put("driverCancellations", rideStore.countOutcomes(driverId, RideOutcome.CANCELLED));
        m.put("recentOutcomes", rideStore.recentOutcomes(driverId).stream().map(o -> {
            Map<String, Object> h = new LinkedHashMap<>();
            h.put("rideId",     o.getRideId());
            h.put("riderId",    o.getRiderId());
            h.put("outcome",    o.getOutcome().name());
            h.put("occurredAt", o.getOccurredAt().toString());
            return h;
        }).toList());
        return ResponseEntity.ok(ApiResponse.success(m, "Driver #" + driverId));
    }

    private static Map<String, Object> toDriverMap(Driver d) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id",           d.getId());
        m.put("name",         d.getName());
        m.put("latitude",     d.getLatitude());
        m.put("longitude",    d.getLongitude());
        m.put("status",       d.getStatus().name());
        m.put("activeRideId", d.getActiveRideId());
        return m;
    }
}
