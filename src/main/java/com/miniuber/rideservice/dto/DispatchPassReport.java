package com.miniuber.rideservice.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Summary of one dispatch pass over the pending rides.
 */
@Getter
@Builder
@ToString
public class DispatchPassReport {

    /** False when the pass was skipped because another pass was still running */
    private final boolean executed;

    private final int pendingRides;
    private final int assigned;
    private final int exhausted;
    private final int aborted;
    private final int failed;
    private final long durationMs;

    public static DispatchPassReport skipped() {
        return DispatchPassReport.builder().executed(false).build();
    }
}
