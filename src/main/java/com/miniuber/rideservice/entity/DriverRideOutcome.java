package com.miniuber.rideservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * One entry of a driver's bounded ride history.
 *
 * Eligibility reads this table two ways:
 *  - last two outcomes per driver           → idx_outcome_driver_time
 *  - completed rides per (driver, rider)    → idx_outcome_driver_rider
 *
 * occurredAt is the ride's completion time for COMPLETED and the cancellation
 * time for CANCELLED (simulated clock when the caller supplies one).
 */
@Entity
@Table(
    name = "driver_ride_outcomes",
    indexes = {
        @Index(name = "idx_outcome_driver_time",  columnList = "driver_id, occurred_at"),
        @Index(name = "idx_outcome_driver_rider", columnList = "driver_id, rider_id, outcome, occurred_at")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DriverRideOutcome {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "driver_id", nullable = false)
    private Long driverId;

    @Column(name = "ride_id", nullable = false)
    private Long rideId;

    @Column(name = "rider_id", nullable = false)
    private Long riderId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RideOutcome outcome;

    @Column(name = "occurred_at", nullable = false)
    private LocalDateTime occurredAt;
}
