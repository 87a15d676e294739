package com.miniuber.rideservice.service;

import com.miniuber.rideservice.config.PricingProperties;
import com.miniuber.rideservice.dto.CreateRideRequest;
import com.miniuber.rideservice.dto.FareBreakdown;
import com.miniuber.rideservice.entity.*;
import com.miniuber.rideservice.exception.GuardConflictException;
import com.miniuber.rideservice.exception.InvalidTransitionException;
import com.miniuber.rideservice.exception.ResourceNotFoundException;
import com.miniuber.rideservice.util.GeoDistance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Externally triggered ride commands: create, driver arrival, start, complete, cancel.
 *
 * Each command validates the requested transition against the current snapshot, then
 * performs one guarded write through RideStore. A write that loses to another writer
 * is re-examined: if the ride has moved to a status that forbids the command the
 * caller gets InvalidTransitionException, otherwise GuardConflictException.
 *
 * Commands take an optional occurredAt so a simulation can run on its own clock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RideLifecycleService {

    private final RideStore rideStore;
    private final FareCalculator fareCalculator;
    private final PricingConfigService pricingConfigService;
    private final PricingProperties pricingProperties;
    private final RideEventPublisher rideEventPublisher;
    private final Clock clock;

    public Ride createRide(CreateRideRequest request) {
        Rider rider = rideStore.findRider(request.getRiderId())
                .orElseThrow(() -> new ResourceNotFoundException("Rider", request.getRiderId()));

        LocalDateTime createdAt = resolve(request.getRequestedAt());
        double distanceKm = GeoDistance.distanceKm(
                request.getPickupLatitude(), request.getPickupLongitude(),
                request.getDropLatitude(), request.getDropLongitude());

        Ride ride = rideStore.createRide(Ride.builder()
                .riderId(rider.getId())
                .pickupLatitude(request.getPickupLatitude())
                .pickupLongitude(request.getPickupLongitude())
                .dropLatitude(request.getDropLatitude())
                .dropLongitude(request.getDropLongitude())
                .status(RideStatus.CREATE_RIDE)
                .createdAt(createdAt)
                .distanceKm(distanceKm)
                .build());

        rideEventPublisher.publish(ride, null, RideEventType.RIDE_CREATED,
                String.format("distance=%.3fkm", distanceKm), createdAt);
        return ride;
    }

    public Ride getRide(Long rideId) {
        return rideStore.findRide(rideId)
                .orElseThrow(() -> new ResourceNotFoundException("Ride", rideId));
    }

    /** ASSIGNED → DRIVER_ARRIVED */
    public Ride markDriverArrived(Long rideId, LocalDateTime occurredAt) {
        Ride ride = getRide(rideId);
        requireTransition(ride, RideStatus.DRIVER_ARRIVED);
        LocalDateTime at = resolve(occurredAt);

        if (!rideStore.markDriverArrived(rideId, at)) {
            throw conflict(rideId, RideStatus.DRIVER_ARRIVED);
        }
        log.info("Ride #{} - DRIVER_ARRIVED: driver #{} at pickup", rideId, ride.getDriverId());
        rideEventPublisher.publish(ride, ride.getDriverId(), RideEventType.DRIVER_ARRIVED, null, at);
        return getRide(rideId);
    }

    /** DRIVER_ARRIVED → STARTED; the driver goes ON_TRIP. */
    public Ride startRide(Long rideId, LocalDateTime occurredAt) {
        Ride ride = getRide(rideId);
        requireTransition(ride, RideStatus.STARTED);
        LocalDateTime at = resolve(occurredAt);

        if (!rideStore.startRide(rideId, ride.getDriverId(), at)) {
            throw conflict(rideId, RideStatus.STARTED);
        }
        log.info("Ride #{} - START_RIDE: driver #{} on trip", rideId, ride.getDriverId());
        rideEventPublisher.publish(ride, ride.getDriverId(), RideEventType.RIDE_STARTED, null, at);
        return getRide(rideId);
    }

    /**
     * STARTED → COMPLETED. The pricing config is resolved before anything is written,
     * so a missing config leaves the ride STARTED and the driver ON_TRIP.
     */
    public Ride completeRide(Long rideId, LocalDateTime occurredAt) {
        Ride ride = getRide(rideId);
        requireTransition(ride, RideStatus.COMPLETED);
        LocalDateTime at = resolve(occurredAt);

        PricingConfig config = pricingConfigService.getConfig(pricingProperties.getActiveKey());
        FareBreakdown fare = fareCalculator.calculate(ride, at, config);

        if (!rideStore.completeRide(ride, at, fare.getDistanceKm().doubleValue(), fare.getTotal())) {
            throw conflict(rideId, RideStatus.COMPLETED);
        }
        log.info("Ride #{} - END_RIDE: {} km, {} min ride, {} min wait",
                rideId, fare.getDistanceKm(), fare.getDurationMinutes(), fare.getWaitMinutes());
        log.info("Ride #{} - Fare breakdown: Base={}, Distance={}, Time={}, Waiting={}, Total={}",
                rideId, fare.getBaseComponent(), fare.getDistanceComponent(), fare.getTimeComponent(),
                fare.getWaitingComponent(), fare.getTotal());
        rideEventPublisher.publish(ride, ride.getDriverId(), RideEventType.RIDE_COMPLETED,
                "fare=" + fare.getTotal(), at);
        return getRide(rideId);
    }

    /**
     * Cancels a ride in CREATE_RIDE, ASSIGNED or DRIVER_ARRIVED. A ride that changes
     * status underneath (typically the dispatcher assigning it) is re-read and the
     * cancellation retried once against the new status.
     */
    public Ride cancelRide(Long rideId, CancellationInitiator initiator, LocalDateTime occurredAt) {
        LocalDateTime at = resolve(occurredAt);
        for (int attempt = 1; attempt <= 2; attempt++) {
            Ride ride = getRide(rideId);
            requireTransition(ride, RideStatus.CANCELLED);

            if (rideStore.cancelRide(ride, ride.getStatus(), initiator, at)) {
                log.info("Ride #{} - CANCELLED by {} (was {}, driver #{})",
                        rideId, initiator, ride.getStatus().wireName(), ride.getDriverId());
                rideEventPublisher.publish(ride, ride.getDriverId(), RideEventType.RIDE_CANCELLED,
                        "by=" + initiator + " from=" + ride.getStatus().wireName(), at);
                return getRide(rideId);
            }
            log.warn("Ride #{}: cancellation lost a race (attempt {})", rideId, attempt);
        }
        throw conflict(rideId, RideStatus.CANCELLED);
    }

    private void requireTransition(Ride ride, RideStatus next) {
        if (!ride.getStatus().canTransitionTo(next)) {
            throw new InvalidTransitionException(ride.getId(), ride.getStatus(), next);
        }
    }

    private RuntimeException conflict(Long rideId, RideStatus requested) {
        RideStatus current = rideStore.findRideStatus(rideId)
                .orElseThrow(() -> new ResourceNotFoundException("Ride", rideId));
        if (!current.canTransitionTo(requested)) {
            return new InvalidTransitionException(rideId, current, requested);
        }
        return new GuardConflictException("Ride #" + rideId + " was modified concurrently while moving to "
                + requested.wireName() + "; retry the request");
    }

    private LocalDateTime resolve(LocalDateTime occurredAt) {
        return occurredAt != null ? occurredAt : LocalDateTime.now(clock);
    }
}
