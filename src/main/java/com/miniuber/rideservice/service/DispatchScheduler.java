package com.miniuber.rideservice.service;

import com.miniuber.rideservice.config.DispatchProperties;
import com.miniuber.rideservice.dto.AllocationResult;
import com.miniuber.rideservice.dto.DispatchPassReport;
import com.miniuber.rideservice.entity.Ride;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic dispatch pass over every pending ride, oldest first.
 *
 * At most one pass runs at a time: a scheduled tick or manual trigger that finds a
 * pass in progress returns a skipped report. A ride that throws is logged and
 * counted, and the pass moves on to the next one.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DispatchScheduler {

    private final RideStore rideStore;
    private final DriverAllocationService allocationService;
    private final DispatchProperties dispatchProperties;
    private final DispatchMetrics dispatchMetrics;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @Scheduled(fixedDelayString = "${dispatch.interval:PT10S}",
               initialDelayString = "${dispatch.initial-delay:PT10S}")
    public void scheduledPass() {
        if (!dispatchProperties.isSchedulerEnabled()) {
            return;
        }
        runPass();
    }

    public DispatchPassReport runPass() {
        if (!running.compareAndSet(false, true)) {
            log.info("Dispatch pass already running, skipping");
            dispatchMetrics.recordSkippedPass();
            return DispatchPassReport.skipped();
        }
        long startNanos = System.nanoTime();
        try {
            List<Ride> pending = rideStore.listPendingRides();
            if (pending.isEmpty()) {
                log.debug("Dispatch pass: no pending rides");
            } else {
                log.info("Dispatch pass started: {} pending ride(s)", pending.size());
            }

            int assigned = 0;
            int exhausted = 0;
            int aborted = 0;
            int failed = 0;
            for (Ride ride : pending) {
                try {
                    AllocationResult result = allocationService.allocate(ride.getId());
                    switch (result.getOutcome()) {
                        case ASSIGNED -> assigned++;
                        case EXHAUSTED -> exhausted++;
                        case ABORTED -> aborted++;
                    }
                } catch (Exception e) {
                    failed++;
                    dispatchMetrics.recordError();
                    log.error("Dispatch failed for ride #{}: {}", ride.getId(), e.getMessage(), e);
                }
            }

            long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
            dispatchMetrics.recordPass(durationMs);
            DispatchPassReport report = DispatchPassReport.builder()
                    .executed(true)
                    .pendingRides(pending.size())
                    .assigned(assigned)
                    .exhausted(exhausted)
                    .aborted(aborted)
                    .failed(failed)
                    .durationMs(durationMs)
                    .build();
            if (!pending.isEmpty()) {
                log.info("Dispatch pass finished in {} ms: assigned={}, unmatched={}, aborted={}, failed={}",
                        durationMs, assigned, exhausted, aborted, failed);
            }
            return report;
        } finally {
            running.set(false);
        }
    }
}
