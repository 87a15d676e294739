package com.miniuber.rideservice.exception;

import com.miniuber.rideservice.entity.RideStatus;

/**
 * A lifecycle command was issued against a ride whose current status forbids it,
 * e.g. cancelling a STARTED ride or completing a ride twice.
 */
public class InvalidTransitionException extends RideServiceException {

    private final Long rideId;
    private final RideStatus currentStatus;
    private final RideStatus requestedStatus;

    public InvalidTransitionException(Long rideId, RideStatus currentStatus, RideStatus requestedStatus) {
        super("INVALID_TRANSITION", "Ride #" + rideId + " cannot move from "
                + currentStatus.wireName() + " to " + requestedStatus.wireName());
        this.rideId = rideId;
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }

    public Long getRideId() {
        return rideId;
    }

    public RideStatus getCurrentStatus() {
        return currentStatus;
    }

    public RideStatus getRequestedStatus() {
        return requestedStatus;
    }
}
