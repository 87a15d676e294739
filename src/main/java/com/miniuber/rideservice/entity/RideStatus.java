package com.miniuber.rideservice.entity;

/**
 * Ride lifecycle states.
 *
 * CREATE_RIDE → ASSIGNED → DRIVER_ARRIVED → STARTED → COMPLETED
 * CANCELLED is reachable from CREATE_RIDE, ASSIGNED and DRIVER_ARRIVED only.
 *
 * Stored as a String in the DB via @Enumerated(EnumType.STRING);
 * {@link #wireName()} is the lower-case name used in API payloads.
 */
public enum RideStatus {

    /** Awaiting driver assignment */
    CREATE_RIDE,

    /** A driver has been assigned and is heading to the pickup */
    ASSIGNED,

    /** Driver is waiting at the pickup point */
    DRIVER_ARRIVED,

    /** Rider on board */
    STARTED,

    /** Terminal: fare computed */
    COMPLETED,

    /** Terminal: cancelled before the ride started */
    CANCELLED;

    /** True while a driver is bound to the ride. */
    public boolean hasActiveDriver() {
        return this == ASSIGNED || this == DRIVER_ARRIVED || this == STARTED;
    }

    public boolean canTransitionTo(RideStatus next) {
        return switch (this) {
            case CREATE_RIDE -> next == ASSIGNED || next == CANCELLED;
            case ASSIGNED -> next == DRIVER_ARRIVED || next == CANCELLED;
            case DRIVER_ARRIVED -> next == STARTED || next == CANCELLED;
            case STARTED -> next == COMPLETED;
            case COMPLETED, CANCELLED -> false;
        };
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
