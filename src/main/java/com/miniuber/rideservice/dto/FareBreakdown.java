package com.miniuber.rideservice.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Fare components as computed for one ride; total is rounded to 2 decimals.
 */
@Getter
@Builder
@ToString
public class FareBreakdown {

    private final BigDecimal distanceKm;
    private final BigDecimal durationMinutes;
    private final BigDecimal waitMinutes;

    private final BigDecimal baseComponent;
    private final BigDecimal distanceComponent;
    private final BigDecimal timeComponent;
    private final BigDecimal waitingComponent;

    private final BigDecimal total;
}
