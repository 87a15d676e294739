package com.miniuber.rideservice.dto;

import com.miniuber.rideservice.entity.CancellationInitiator;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.time.LocalDateTime;

/**
 * DTO for a ride cancellation
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CancelRideRequest {

    @NotNull(message = "Initiator is required (RIDER, DRIVER or SYSTEM)")
    private CancellationInitiator initiator;

    private LocalDateTime occurredAt;
}
