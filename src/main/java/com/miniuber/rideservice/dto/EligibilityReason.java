package com.miniuber.rideservice.dto;

/**
 * Reason code reported by the eligibility filter, in rule order.
 */
public enum EligibilityReason {
    ELIGIBLE,
    DRIVER_NOT_IDLE,
    RECENT_RIDE_WITH_RIDER,
    CONSECUTIVE_CANCELLATIONS
}
