package com.miniuber.rideservice.dto;

import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Simulation metrics derived by scanning ride records.
 */
@Getter
@Builder
public class SimulationSummary {

    private final long totalRides;
    private final long completedRides;
    private final long unmatchedRides;
    private final long cancelledRides;

    /** Count per wire status name, every status present (0 when none) */
    private final Map<String, Long> ridesByStatus;

    private final double averageWaitMinutes;
    private final double averageRideMinutes;

    private final List<DriverSummary> drivers;
}
