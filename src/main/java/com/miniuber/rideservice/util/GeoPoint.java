package com.miniuber.rideservice.util;

import lombok.Value;

/**
 * Immutable latitude/longitude pair in decimal degrees.
 */
@Value(staticConstructor = "of")
public class GeoPoint {

    double latitude;
    double longitude;
}
