package com.miniuber.rideservice.entity;

/**
 * Enum for all ride audit event types.
 *
 * Stored as a String in the DB via @Enumerated(EnumType.STRING).
 */
public enum RideEventType {

    /** Ride request accepted into CREATE_RIDE */
    RIDE_CREATED,

    /** Dispatcher bound a driver to the ride */
    DRIVER_ASSIGNED,

    /** Driver reached the pickup point */
    DRIVER_ARRIVED,

    /** Rider picked up */
    RIDE_STARTED,

    /** Ride ended and fare computed */
    RIDE_COMPLETED,

    /** Ride cancelled by rider, driver or system */
    RIDE_CANCELLED
}
