package com.miniuber.rideservice.controller;

import com.miniuber.rideservice.dto.ApiResponse;
import com.miniuber.rideservice.service.DispatchAsyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /api/dispatch/run
 *
 * Starts a dispatch pass in the background and returns 202 immediately. If a pass
 * is already running the new one is skipped; results show up on /api/rides and
 * /topic/ride-events.
 */
@RestController
@RequestMapping("/api/dispatch")
@RequiredArgsConstructor
@Slf4j
public class DispatchController {

    private final DispatchAsyncService dispatchAsyncService;

    @PostMapping("/run")
    public ResponseEntity<ApiResponse> runDispatch() {
        log.info("API: manual dispatch pass requested");
        dispatchAsyncService.runPassAsync().whenComplete((report, ex) -> {
            if (ex != null) {
                log.error("Manual dispatch pass failed: {}", ex.getMessage(), ex);
            } else if (report.isExecuted()) {
                log.info("Manual dispatch pass done: {} pending, {} assigned, {} exhausted, {} failed",
                        report.getPendingRides(), report.getAssigned(), report.getExhausted(), report.getFailed());
            }
        });
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.success(null, "Dispatch pass triggered"));
    }
}
