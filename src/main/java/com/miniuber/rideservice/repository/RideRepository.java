package com.miniuber.rideservice.repository;

import com.miniuber.rideservice.entity.CancellationInitiator;
import com.miniuber.rideservice.entity.Ride;
import com.miniuber.rideservice.entity.RideStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Ride entity.
 *
 * Every status change is a guarded UPDATE: the WHERE clause carries the expected
 * prior status, and the returned row count tells the caller whether the guard held
 * (1) or another writer got there first (0).
 */
@Repository
public interface RideRepository extends JpaRepository<Ride, Long> {

    /** Pending rides, oldest first (fairness); id breaks creation-time ties. */
    List<Ride> findByStatusOrderByCreatedAtAscIdAsc(RideStatus status);

    List<Ride> findAllByOrderByIdAsc();

    @Query("SELECT r.status FROM Ride r WHERE r.id = :id")
    Optional<RideStatus> findStatusById(@Param("id") Long id);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Ride r SET r.status = :next, r.driverId = :driverId, r.driverAssignedAt = :at, "
            + "r.version = r.version + 1 "
            + "WHERE r.id = :id AND r.status = :expected AND r.driverId IS NULL")
    int assignDriver(@Param("id") Long id,
                     @Param("expected") RideStatus expected,
                     @Param("next") RideStatus next,
                     @Param("driverId") Long driverId,
                     @Param("at") LocalDateTime at);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Ride r SET r.status = :next, r.driverArrivedAt = :at, r.version = r.version + 1 "
            + "WHERE r.id = :id AND r.status = :expected")
    int markDriverArrived(@Param("id") Long id,
                          @Param("expected") RideStatus expected,
                          @Param("next") RideStatus next,
                          @Param("at") LocalDateTime at);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Ride r SET r.status = :next, r.startedAt = :at, r.version = r.version + 1 "
            + "WHERE r.id = :id AND r.status = :expected")
    int markStarted(@Param("id") Long id,
                    @Param("expected") RideStatus expected,
                    @Param("next") RideStatus next,
                    @Param("at") LocalDateTime at);

    /** Fare is only ever written here, and only while the ride is still STARTED. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Ride r SET r.status = :next, r.endedAt = :at, r.distanceKm = :distanceKm, "
            + "r.fare = :fare, r.version = r.version + 1 "
            + "WHERE r.id = :id AND r.status = :expected AND r.fare IS NULL")
    int markCompleted(@Param("id") Long id,
                      @Param("expected") RideStatus expected,
                      @Param("next") RideStatus next,
                      @Param("at") LocalDateTime at,
                      @Param("distanceKm") Double distanceKm,
                      @Param("fare") BigDecimal fare);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Ride r SET r.status = :next, r.cancelledAt = :at, r.cancelledBy = :initiator, "
            + "r.version = r.version + 1 "
            + "WHERE r.id = :id AND r.status = :expected")
    int markCancelled(@Param("id") Long id,
                      @Param("expected") RideStatus expected,
                      @Param("next") RideStatus next,
                      @Param("initiator") CancellationInitiator initiator,
                      @Param("at") LocalDateTime at);
}
