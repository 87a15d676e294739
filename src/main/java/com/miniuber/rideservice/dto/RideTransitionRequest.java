package com.miniuber.rideservice.dto;

import lombok.*;

import java.time.LocalDateTime;

/**
 * Optional body for arrive / start / complete commands.
 * occurredAt lets a simulation drive the ride on its own clock.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RideTransitionRequest {

    private LocalDateTime occurredAt;
}
