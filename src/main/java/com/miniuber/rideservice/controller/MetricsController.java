package com.miniuber.rideservice.controller;

import com.miniuber.rideservice.dto.ApiResponse;
import com.miniuber.rideservice.dto.SimulationSummary;
import com.miniuber.rideservice.service.SimulationSummaryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /api/metrics: ride counts by status, average wait and ride time, per-driver
 * aggregates. Dispatcher counters live under /actuator/metrics/dispatch.*.
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final SimulationSummaryService simulationSummaryService;

    @GetMapping
    public ResponseEntity<ApiResponse> getSummary() {
        SimulationSummary summary = simulationSummaryService.summarize();
        return ResponseEntity.ok(ApiResponse.success(summary, "Simulation summary"));
    }
}
