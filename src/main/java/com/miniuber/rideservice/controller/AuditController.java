package com.miniuber.rideservice.controller;

import com.miniuber.rideservice.dto.ApiResponse;
import com.miniuber.rideservice.entity.RideEvent;
import com.miniuber.rideservice.service.RideAuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ride audit trail REST API.
 *
 *  GET /api/audit/rides/{rideId}       chronological events of one ride
 *  GET /api/audit/drivers/{driverId}   events involving a driver, newest first
 *
 * eventTimestamp is when the transition took effect; createdAt is server time of the write.
 */
@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
@Slf4j
public class AuditController {

    private final RideAuditService rideAuditService;

    @GetMapping("/rides/{rideId}")
    public ResponseEntity<ApiResponse> getEventsByRide(@PathVariable Long rideId) {
        log.info("AUDIT API: GET events for ride #{}", rideId);
        List<RideEvent> events = rideAuditService.getEventsByRideId(rideId);
        return ResponseEntity.ok(ApiResponse.success(toResponseList(events),
                "Found " + events.size() + " audit event(s) for ride #" + rideId));
    }

    @GetMapping("/drivers/{driverId}")
    public ResponseEntity<ApiResponse> getEventsByDriver(@PathVariable Long driverId) {
        log.info("AUDIT API: GET events for driver #{}", driverId);
        List<RideEvent> events = rideAuditService.getEventsByDriverId(driverId);
        return ResponseEntity.ok(ApiResponse.success(toResponseList(events),
                "Found " + events.size() + " audit event(s) for driver #" + driverId));
    }

    private List<Map<String, Object>> toResponseList(List<RideEvent> events) {
        return events.stream().map(e -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("id",             e.getId());
            m.put("rideId",         e.getRideId());
            m.put("riderId",        e.getRiderId());
            m.put("driverId",       e.getDriverId());
            m.put("eventType",      e.getEventType().name());
            m.put("detail",         e.getDetail());
            m.put("eventTimestamp", e.getTimestamp() != null ? e.getTimestamp().toString() : null);
            m.put("createdAt",      e.getCreatedAt() != null ? e.getCreatedAt().toString() : null);
            return m;
        }).toList();
    }
}
