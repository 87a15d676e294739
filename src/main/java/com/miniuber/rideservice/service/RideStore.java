package com.miniuber.rideservice.service;

import com.miniuber.rideservice.config.DispatchProperties;
import com.miniuber.rideservice.entity.*;
import com.miniuber.rideservice.repository.*;
import com.miniuber.rideservice.util.GeoDistance;
import com.miniuber.rideservice.util.GeoPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Single owner of every Ride / Driver / driver-history mutation.
 *
 * Each write is one TransactionTemplate unit made of guarded UPDATEs. When any
 * guard matches zero rows the unit is marked rollback-only and the method returns
 * false: nothing was written and the caller decides whether to retry, abort or
 * report a conflict.
 *
 * Reads return detached snapshots; callers hand identifiers back to mutate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RideStore {

    private final RideRepository rideRepository;
    private final DriverRepository driverRepository;
    private final RiderRepository riderRepository;
    private final DriverRideOutcomeRepository outcomeRepository;
    private final TransactionTemplate transactionTemplate;
    private final DispatchProperties dispatchProperties;

    // ────────────────────────────────────────────────────────────────────────
    // Reads
    // ────────────────────────────────────────────────────────────────────────

    /** Rides in CREATE_RIDE, oldest first, id breaking ties. */
    public List<Ride> listPendingRides() {
        return rideRepository.findByStatusOrderByCreatedAtAscIdAsc(RideStatus.CREATE_RIDE);
    }

    /**
     * IDLE drivers within {@code radiusKm} of {@code center}: bounding-box query in
     * the database, exact haversine check here.
     */
    public List<Driver> listDriversWithin(GeoPoint center, double radiusKm) {
        double[] box = GeoDistance.boundingBox(center, radiusKm);
        List<Driver> boxed = driverRepository.findByStatusWithinBox(
                DriverStatus.IDLE, box[0], box[1], box[2], box[3]);
        List<Driver> within = boxed.stream()
                .filter(d -> GeoDistance.isWithinRadius(center, GeoPoint.of(d.getLatitude(), d.getLongitude()), radiusKm))
                .collect(Collectors.toList());
        log.debug("listDriversWithin({} km of {}): {} in box, {} within radius",
                radiusKm, center, boxed.size(), within.size());
        return within;
    }

    public Optional<Ride> findRide(Long rideId) {
        return rideRepository.findById(rideId);
    }

    public Optional<RideStatus> findRideStatus(Long rideId) {
        return rideRepository.findStatusById(rideId);
    }

    public Optional<Driver> findDriver(Long driverId) {
        return driverRepository.findById(driverId);
    }

    public Optional<Rider> findRider(Long riderId) {
        return riderRepository.findById(riderId);
    }

    public List<Ride> listRides() {
        return rideRepository.findAllByOrderByIdAsc();
    }

    public List<Driver> listDrivers() {
        return driverRepository.findAllByOrderByIdAsc();
    }

    public List<Rider> listRiders() {
        return riderRepository.findAllByOrderByIdAsc();
    }

    /** Up to two most recent outcomes for the driver, newest first. */
    public List<DriverRideOutcome> recentOutcomes(Long driverId) {
        return outcomeRepository.findTop2ByDriverIdOrderByOccurredAtDescIdDesc(driverId);
    }

    /** True when the driver completed a ride for this rider strictly after {@code after}. */
    public boolean hasCompletedRideWith(Long driverId, Long riderId, LocalDateTime after) {
        return outcomeRepository.existsByDriverIdAndRiderIdAndOutcomeAndOccurredAtAfter(
                driverId, riderId, RideOutcome.COMPLETED, after);
    }

    public long countOutcomes(Long driverId, RideOutcome outcome) {
        return outcomeRepository.countByDriverIdAndOutcome(driverId, outcome);
    }

    // ────────────────────────────────────────────────────────────────────────
    // Writes
    // ────────────────────────────────────────────────────────────────────────

    public Ride createRide(Ride ride) {
        Ride saved = rideRepository.save(ride);
        log.info("Ride #{} created for rider #{} (status={})", saved.getId(), saved.getRiderId(),
                saved.getStatus().wireName());
        return saved;
    }

    /**
     * Binds driver and ride atomically. Returns false, writing nothing, when the ride
     * is no longer in {@code expectedRideStatus} (or already has a driver) or the
     * driver is no longer in {@code expectedDriverStatus} (or already holds a ride).
     */
    public boolean tryAssign(Long rideId, Long driverId,
                             RideStatus expectedRideStatus, DriverStatus expectedDriverStatus,
                             LocalDateTime assignedAt) {
        return inGuardedTransaction(tx -> {
            if (rideRepository.assignDriver(rideId, expectedRideStatus, RideStatus.ASSIGNED,
                    driverId, assignedAt) == 0) {
                log.debug("tryAssign: ride #{} no longer {}", rideId, expectedRideStatus);
                return rollback(tx);
            }
            if (driverRepository.bindRide(driverId, expectedDriverStatus, DriverStatus.ASSIGNED, rideId) == 0) {
                log.debug("tryAssign: driver #{} no longer {}", driverId, expectedDriverStatus);
                return rollback(tx);
            }
            return true;
        });
    }

    /** ASSIGNED → DRIVER_ARRIVED; the driver record is untouched. */
    public boolean markDriverArrived(Long rideId, LocalDateTime at) {
        return inGuardedTransaction(tx -> {
            if (rideRepository.markDriverArrived(rideId, RideStatus.ASSIGNED, RideStatus.DRIVER_ARRIVED, at) == 0) {
                return rollback(tx);
            }
            return true;
        });
    }

    /** DRIVER_ARRIVED → STARTED, driver ASSIGNED → ON_TRIP. */
    public boolean startRide(Long rideId, Long driverId, LocalDateTime at) {
        return inGuardedTransaction(tx -> {
            if (rideRepository.markStarted(rideId, RideStatus.DRIVER_ARRIVED, RideStatus.STARTED, at) == 0) {
                return rollback(tx);
            }
            if (driverRepository.updateStatusForRide(driverId, rideId,
                    DriverStatus.ASSIGNED, DriverStatus.ON_TRIP) == 0) {
                return rollback(tx);
            }
            return true;
        });
    }

    /**
     * STARTED → COMPLETED with distance and fare; frees the driver at the drop-off
     * point and appends a COMPLETED outcome to its history.
     */
    public boolean completeRide(Ride ride, LocalDateTime endedAt, double distanceKm, BigDecimal fare) {
        Long rideId = ride.getId();
        Long driverId = ride.getDriverId();
        return inGuardedTransaction(tx -> {
            if (rideRepository.markCompleted(rideId, RideStatus.STARTED, RideStatus.COMPLETED,
                    endedAt, distanceKm, fare) == 0) {
                return rollback(tx);
            }
            if (driverRepository.releaseRideAt(driverId, rideId, DriverStatus.ON_TRIP, DriverStatus.IDLE,
                    ride.getDropLatitude(), ride.getDropLongitude()) == 0) {
                return rollback(tx);
            }
            appendOutcome(driverId, ride, RideOutcome.COMPLETED, endedAt);
            return true;
        });
    }

    /**
     * Cancels a ride still in {@code expectedStatus}. A bound driver goes back to IDLE;
     * a CANCELLED outcome is recorded only when the driver initiated.
     */
    public boolean cancelRide(Ride ride, RideStatus expectedStatus,
                              CancellationInitiator initiator, LocalDateTime at) {
        Long rideId = ride.getId();
        Long driverId = ride.getDriverId();
        return inGuardedTransaction(tx -> {
            if (rideRepository.markCancelled(rideId, expectedStatus, RideStatus.CANCELLED, initiator, at) == 0) {
                return rollback(tx);
            }
            if (driverId != null && expectedStatus.hasActiveDriver()) {
                if (driverRepository.releaseRide(driverId, rideId, DriverStatus.ASSIGNED, DriverStatus.IDLE) == 0) {
                    return rollback(tx);
                }
                if (initiator == CancellationInitiator.DRIVER) {
                    appendOutcome(driverId, ride, RideOutcome.CANCELLED, at);
                }
            }
            return true;
        });
    }

    // ────────────────────────────────────────────────────────────────────────
    // Helpers
    // ────────────────────────────────────────────────────────────────────────

    private void appendOutcome(Long driverId, Ride ride, RideOutcome outcome, LocalDateTime at) {
        outcomeRepository.save(DriverRideOutcome.builder()
                .driverId(driverId)
                .rideId(ride.getId())
                .riderId(ride.getRiderId())
                .outcome(outcome)
                .occurredAt(at)
                .build());
        pruneHistory(driverId, at);
    }

    /**
     * Keeps the newest history-capacity outcomes, plus any COMPLETED outcome still
     * inside the same-rider cooldown window.
     */
    void pruneHistory(Long driverId, LocalDateTime now) {
        List<DriverRideOutcome> history = outcomeRepository.findByDriverIdOrderByOccurredAtDescIdDesc(driverId);
        int capacity = dispatchProperties.effectiveHistoryCapacity();
        if (history.size() <= capacity) {
            return;
        }
        LocalDateTime cooldownStart = now.minus(dispatchProperties.getSameRiderCooldown());
        List<DriverRideOutcome> expired = history.subList(capacity, history.size()).stream()
                .filter(o -> o.getOutcome() != RideOutcome.COMPLETED || !o.getOccurredAt().isAfter(cooldownStart))
                .collect(Collectors.toList());
        if (!expired.isEmpty()) {
            outcomeRepository.deleteAllInBatch(expired);
            log.debug("Pruned {} outcome(s) from driver #{} history", expired.size(), driverId);
        }
    }

    private boolean inGuardedTransaction(Function<TransactionStatus, Boolean> work) {
        return Boolean.TRUE.equals(transactionTemplate.execute(work::apply));
    }

    private static boolean rollback(TransactionStatus tx) {
        tx.setRollbackOnly();
        return false;
    }
}
