package com.miniuber.rideservice.exception;

public class ResourceNotFoundException extends RideServiceException {

    public ResourceNotFoundException(String resource, Object id) {
        super("NOT_FOUND", resource + " not found: " + id);
    }
}
