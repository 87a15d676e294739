package com.miniuber.rideservice.exception;

/**
 * A guarded write matched no row: the ride or driver changed between the read
 * and the write. Rolls back the surrounding transaction.
 */
public class GuardConflictException extends RideServiceException {

    public GuardConflictException(String message) {
        super("CONFLICT", message);
    }
}
