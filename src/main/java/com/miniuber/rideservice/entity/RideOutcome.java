package com.miniuber.rideservice.entity;

/**
 * How a ride ended for the driver who held it. Recorded in the driver's ride history.
 */
public enum RideOutcome {
    COMPLETED,
    CANCELLED
}
