package com.miniuber.rideservice.dto;

/**
 * Result of one dispatch attempt for one ride.
 */
public enum AllocationOutcome {

    /** A driver was bound to the ride */
    ASSIGNED,

    /** Radius ceiling reached with no eligible driver; the ride stays pending */
    EXHAUSTED,

    /** The ride stopped being pending (cancelled, or assigned by someone else) */
    ABORTED
}
