package com.miniuber.rideservice.exception;

/**
 * No PricingConfig exists for the active key, so a ride cannot be completed.
 */
public class PricingConfigMissingException extends RideServiceException {

    public PricingConfigMissingException(String key) {
        super("PRICING_CONFIG_MISSING", "No pricing configuration found for key '" + key + "'");
    }
}
