package com.miniuber.rideservice.entity;

/**
 * Driver availability. A driver in ASSIGNED or ON_TRIP holds exactly one active ride.
 */
public enum DriverStatus {
    IDLE,
    ASSIGNED,
    ON_TRIP
}
