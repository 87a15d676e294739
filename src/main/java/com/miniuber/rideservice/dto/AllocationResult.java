package com.miniuber.rideservice.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class AllocationResult {

    private final Long rideId;
    private final AllocationOutcome outcome;

    /** Set only when outcome is ASSIGNED */
    private final Long driverId;
    private final Double distanceKm;

    /** Last radius searched */
    private final double radiusKm;

    /** Lost tryAssign races during this attempt */
    private final int conflicts;
}
