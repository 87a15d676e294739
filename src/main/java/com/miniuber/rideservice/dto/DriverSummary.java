package com.miniuber.rideservice.dto;

import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Per-driver aggregates over completed and cancelled rides.
 */
@Getter
@Builder
public class DriverSummary {

    private final Long driverId;
    private final String name;
    private final long completedRides;
    private final long cancelledRides;
    private final BigDecimal totalFare;
    private final BigDecimal averageFare;
    private final double averageWaitMinutes;
    private final double averageRideMinutes;
}
