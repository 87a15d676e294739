package com.miniuber.rideservice.entity;

/**
 * Who cancelled a ride. Only driver cancellations count against the driver's history.
 */
public enum CancellationInitiator {
    RIDER,
    DRIVER,
    SYSTEM
}
