package com.miniuber.rideservice.entity;

import jakarta.persistence.*;
import lombok.*;
import java.time.LocalDateTime;

/**
 * Audit record of a ride lifecycle event.
 *
 * Fields:
 *  - rideId / riderId / driverId : who was involved
 *  - eventType                   : typed enum (RideEventType)
 *  - detail                      : free text, e.g. "fare=192.00" or "radius=3km"
 *  - timestamp                   : when the transition took effect (may be simulated time)
 *  - createdAt                   : SERVER time when the DB record was written
 */
@Entity
@Table(
    name = "ride_events",
    indexes = {
        @Index(name = "idx_ride_event_ride_id",   columnList = "ride_id"),
        @Index(name = "idx_ride_event_driver_id", columnList = "driver_id")
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RideEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "ride_id", nullable = false)
    private Long rideId;

    @Column(name = "rider_id", nullable = false)
    private Long riderId;

    @Column(name = "driver_id")
    private Long driverId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false)
    private RideEventType eventType;

    private String detail;

    @Column(name = "event_timestamp", nullable = false)
    private LocalDateTime timestamp;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }
}
