package com.miniuber.rideservice.service;

import com.miniuber.rideservice.dto.AllocationOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for the dispatcher, exposed through /actuator/metrics.
 *
 *  dispatch.allocation{outcome=assigned|exhausted|aborted}
 *  dispatch.conflicts   lost tryAssign races
 *  dispatch.errors      rides that threw during a pass
 *  dispatch.pass        pass duration
 */
@Component
public class DispatchMetrics {

    private final Map<AllocationOutcome, Counter> allocations = new EnumMap<>(AllocationOutcome.class);
    private final Counter conflicts;
    private final Counter errors;
    private final Counter skippedPasses;
    private final Timer passTimer;

    public DispatchMetrics(MeterRegistry registry) {
        for (AllocationOutcome outcome : AllocationOutcome.values()) {
            allocations.put(outcome, Counter.builder("dispatch.allocation")
                    .description("Dispatch attempts by outcome")
                    .tag("outcome", outcome.name().toLowerCase())
                    .register(registry));
        }
        this.conflicts = Counter.builder("dispatch.conflicts")
                .description("Assignments lost to a concurrent writer")
                .register(registry);
        this.errors = Counter.builder("dispatch.errors")
                .description("Rides that failed with an exception during a pass")
                .register(registry);
        this.skippedPasses = Counter.builder("dispatch.pass.skipped")
                .description("Passes skipped because another pass was running")
                .register(registry);
        this.passTimer = Timer.builder("dispatch.pass")
                .description("Dispatch pass duration")
                .register(registry);
    }

    public void recordAllocation(AllocationOutcome outcome) {
        allocations.get(outcome).increment();
    }

    public void recordConflict() {
        conflicts.increment();
    }

    public void recordError() {
        errors.increment();
    }

    public void recordSkippedPass() {
        skippedPasses.increment();
    }

    public void recordPass(long durationMs) {
        passTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }
}
