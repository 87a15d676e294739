package com.miniuber.rideservice.service;

import com.miniuber.rideservice.config.DispatchProperties;
import com.miniuber.rideservice.dto.AllocationOutcome;
import com.miniuber.rideservice.dto.AllocationResult;
import com.miniuber.rideservice.dto.EligibilityReason;
import com.miniuber.rideservice.dto.EligibilityResult;
import com.miniuber.rideservice.entity.*;
import com.miniuber.rideservice.util.GeoDistance;
import com.miniuber.rideservice.util.GeoPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Nearest-eligible-driver search for one pending ride.
 *
 * Radius grows from initial-radius-km by radius-increment-km while it stays below
 * max-radius-km (1..19 km with the defaults). At each radius:
 *  1. stop (ABORTED) if the ride is no longer CREATE_RIDE
 *  2. load IDLE drivers within the radius, drop the ineligible ones
 *  3. try to bind the closest one (lowest id when distances match to the metre)
 *
 * A lost tryAssign race re-reads the ride: gone from CREATE_RIDE means ABORTED,
 * otherwise the same radius is retried once with fresh candidates before moving on.
 * Reaching the ceiling leaves the ride pending (EXHAUSTED) for the next pass.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DriverAllocationService {

    private static final double RADIUS_EPSILON = 1e-9;
    private static final int ATTEMPTS_PER_RADIUS = 2;

    private final RideStore rideStore;
    private final EligibilityFilter eligibilityFilter;
    private final DispatchProperties dispatchProperties;
    private final RideEventPublisher rideEventPublisher;
    private final DispatchMetrics dispatchMetrics;
    private final Clock clock;

    public AllocationResult allocate(Long rideId) {
        Optional<Ride> snapshot = rideStore.findRide(rideId);
        if (snapshot.isEmpty() || snapshot.get().getStatus() != RideStatus.CREATE_RIDE) {
            log.info("Ride #{} is no longer pending, skipping allocation", rideId);
            return finish(aborted(rideId, 0.0, 0));
        }
        Ride ride = snapshot.get();
        GeoPoint pickup = GeoPoint.of(ride.getPickupLatitude(), ride.getPickupLongitude());

        double initial = dispatchProperties.getInitialRadiusKm();
        double increment = dispatchProperties.getRadiusIncrementKm();
        double ceiling = dispatchProperties.getMaxRadiusKm();
        int conflicts = 0;
        double radius = initial;

        for (int step = 0; radius < ceiling - RADIUS_EPSILON; radius = initial + (++step) * increment) {
            for (int attempt = 1; attempt <= ATTEMPTS_PER_RADIUS; attempt++) {
                if (!isPending(rideId)) {
                    log.info("Ride #{} left CREATE_RIDE during search at {} km, aborting", rideId, radius);
                    return finish(aborted(rideId, radius, conflicts));
                }

                LocalDateTime now = LocalDateTime.now(clock);
                List<Candidate> candidates = eligibleCandidates(ride, pickup, radius, now);
                if (candidates.isEmpty()) {
                    break;
                }

                Candidate best = candidates.get(0);
                if (rideStore.tryAssign(rideId, best.driver.getId(),
                        RideStatus.CREATE_RIDE, DriverStatus.IDLE, now)) {
                    log.info("Ride #{} assigned to driver #{} ({} km away, radius {} km)",
                            rideId, best.driver.getId(), String.format("%.3f", best.distanceKm), radius);
                    rideEventPublisher.publish(ride, best.driver.getId(), RideEventType.DRIVER_ASSIGNED,
                            String.format("distance=%.3fkm radius=%skm", best.distanceKm, radius), now);
                    return finish(AllocationResult.builder()
                            .rideId(rideId)
                            .outcome(AllocationOutcome.ASSIGNED)
                            .driverId(best.driver.getId())
                            .distanceKm(best.distanceKm)
                            .radiusKm(radius)
                            .conflicts(conflicts)
                            .build());
                }

                conflicts++;
                dispatchMetrics.recordConflict();
                log.warn("Ride #{}: lost assignment race for driver #{} at {} km (attempt {})",
                        rideId, best.driver.getId(), radius, attempt);
                if (!isPending(rideId)) {
                    return finish(aborted(rideId, radius, conflicts));
                }
            }
        }

        double lastRadius = Math.max(0.0, radius - increment);
        log.warn("No eligible driver for ride #{} within {} km; ride stays pending", rideId, lastRadius);
        return finish(AllocationResult.builder()
                .rideId(rideId)
                .outcome(AllocationOutcome.EXHAUSTED)
                .radiusKm(lastRadius)
                .conflicts(conflicts)
                .build());
    }

    /** Eligible drivers within the radius, closest first (to the metre), lowest id on ties. */
    private List<Candidate> eligibleCandidates(Ride ride, GeoPoint pickup, double radiusKm, LocalDateTime now) {
        List<Driver> nearby = rideStore.listDriversWithin(pickup, radiusKm);
        Map<EligibilityReason, Integer> excluded = new EnumMap<>(EligibilityReason.class);
        List<Candidate> eligible = new ArrayList<>();

        for (Driver driver : nearby) {
            EligibilityResult result = eligibilityFilter.evaluate(ride, driver, now);
            if (result.isEligible()) {
                double distance = GeoDistance.distanceKm(pickup, GeoPoint.of(driver.getLatitude(), driver.getLongitude()));
                eligible.add(new Candidate(driver, distance));
            } else {
                excluded.merge(result.getReason(), 1, Integer::sum);
            }
        }

        eligible.sort(Comparator.comparingLong((Candidate c) -> c.distanceMetres)
                .thenComparing(c -> c.driver.getId()));

        log.debug("Ride #{} radius {} km: {} nearby, {} eligible, excluded {}",
                ride.getId(), radiusKm, nearby.size(), eligible.size(), excluded);
        return eligible;
    }

    private boolean isPending(Long rideId) {
        return rideStore.findRideStatus(rideId).filter(s -> s == RideStatus.CREATE_RIDE).isPresent();
    }

    private static AllocationResult aborted(Long rideId, double radiusKm, int conflicts) {
        return AllocationResult.builder()
                .rideId(rideId)
                .outcome(AllocationOutcome.ABORTED)
                .radiusKm(radiusKm)
                .conflicts(conflicts)
                .build();
    }

    private AllocationResult finish(AllocationResult result) {
        dispatchMetrics.recordAllocation(result.getOutcome());
        return result;
    }

    private static final class Candidate {
        private final Driver driver;
        private final double distanceKm;
        private final long distanceMetres;

        private Candidate(Driver driver, double distanceKm) {
            this.driver = driver;
            this.distanceKm = distanceKm;
            this.distanceMetres = Math.round(distanceKm * 1000.0);
        }
    }
}
