package com.miniuber.rideservice.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.*;

/**
 * DTO for a new ride request (produces a ride in create_ride)
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateRideRequest {

    @NotNull(message = "Rider ID is required")
    private Long riderId;

    @NotNull(message = "Pickup latitude is required")
    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double pickupLatitude;

    @NotNull(message = "Pickup longitude is required")
    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double pickupLongitude;

    @NotNull(message = "Drop-off latitude is required")
    @DecimalMin("-90.0") @DecimalMax("90.0")
    private Double dropLatitude;

    @NotNull(message = "Drop-off longitude is required")
    @DecimalMin("-180.0") @DecimalMax("180.0")
    private Double dropLongitude;

    // Optional simulated creation time; server clock when absent
    private java.time.LocalDateTime requestedAt;
}
