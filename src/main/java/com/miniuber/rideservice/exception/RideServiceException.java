package com.miniuber.rideservice.exception;

/**
 * Base type for every error the ride service surfaces to its callers.
 * The code is stable and is echoed in API error responses.
 */
public class RideServiceException extends RuntimeException {

    private final String code;

    public RideServiceException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
