package com.miniuber.rideservice.repository;

import com.miniuber.rideservice.entity.DriverRideOutcome;
import com.miniuber.rideservice.entity.RideOutcome;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for the per-driver ride history used by the eligibility rules.
 */
@Repository
public interface DriverRideOutcomeRepository extends JpaRepository<DriverRideOutcome, Long> {

    /** Two most recent outcomes, newest first (consecutive-cancellation rule). */
    List<DriverRideOutcome> findTop2ByDriverIdOrderByOccurredAtDescIdDesc(Long driverId);

    /** Full history for one driver, newest first (pruning). */
    List<DriverRideOutcome> findByDriverIdOrderByOccurredAtDescIdDesc(Long driverId);

    /**
     * Same-rider cooldown lookup; uses idx_outcome_driver_rider.
     * True when a matching outcome happened strictly after {@code after}.
     */
    boolean existsByDriverIdAndRiderIdAndOutcomeAndOccurredAtAfter(
            Long driverId, Long riderId, RideOutcome outcome, LocalDateTime after);

    long countByDriverIdAndOutcome(Long driverId, RideOutcome outcome);
}
