package com.miniuber.rideservice.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Entity representing a Driver.
 *
 * Drivers are stationary between rides: the coordinate only changes when a ride
 * completes (moved to the drop-off point). Status and activeRideId are written
 * exclusively through the guarded updates in DriverRepository.
 */
@Entity
@Table(
    name = "drivers",
    indexes = {
        @Index(name = "idx_driver_status_location", columnList = "status, latitude, longitude")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Driver {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private DriverStatus status = DriverStatus.IDLE;

    /** Ride currently bound to this driver; null while IDLE */
    @Column(name = "active_ride_id")
    private Long activeRideId;

    /** Bumped by every guarded update */
    @Version
    private Long version;
}
