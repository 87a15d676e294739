package com.miniuber.rideservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Entity representing a Ride request and its lifecycle.
 *
 * Status transitions follow {@link RideStatus}; every transition after creation is a
 * guarded UPDATE in RideRepository (WHERE status = expected), never a load-modify-save.
 */
@Entity
@Table(
    name = "rides",
    indexes = {
        @Index(name = "idx_ride_status_created", columnList = "status, created_at"),
        @Index(name = "idx_ride_driver_id",      columnList = "driver_id"),
        @Index(name = "idx_ride_rider_id",       columnList = "rider_id")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Ride {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "rider_id", nullable = false)
    private Long riderId;

    /** Assigned driver; null until the dispatcher matches the ride */
    @Column(name = "driver_id")
    private Long driverId;

    @Column(nullable = false)
    private Double pickupLatitude;

    @Column(nullable = false)
    private Double pickupLongitude;

    @Column(nullable = false)
    private Double dropLatitude;

    @Column(nullable = false)
    private Double dropLongitude;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RideStatus status;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime driverAssignedAt;

    private LocalDateTime driverArrivedAt;

    private LocalDateTime startedAt;

    private LocalDateTime endedAt;

    private LocalDateTime cancelledAt;

    @Enumerated(EnumType.STRING)
    private CancellationInitiator cancelledBy;

    // Straight-line pickup → drop-off distance in km
    private Double distanceKm;

    // Set exactly once, when the ride reaches COMPLETED
    @Column(precision = 12, scale = 2)
    private BigDecimal fare;

    @Version
    private Long version;
}
