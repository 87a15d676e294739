package com.miniuber.rideservice.repository;

import com.miniuber.rideservice.entity.Driver;
import com.miniuber.rideservice.entity.DriverStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for Driver entity.
 *
 * Status changes are guarded UPDATEs keyed by (id, expected status) and, when a
 * driver is being released, by the ride it is expected to hold. A return value of
 * 0 means the guard failed and nothing was written.
 */
@Repository
public interface DriverRepository extends JpaRepository<Driver, Long> {

    List<Driver> findAllByOrderByIdAsc();

    /**
     * Bounding-box pre-filter for the radius search; callers apply the exact
     * haversine check on the result.
     */
    @Query("SELECT d FROM Driver d WHERE d.status = :status "
            + "AND d.latitude BETWEEN :minLat AND :maxLat "
            + "AND d.longitude BETWEEN :minLon AND :maxLon")
    List<Driver> findByStatusWithinBox(@Param("status") DriverStatus status,
                                       @Param("minLat") double minLat,
                                       @Param("maxLat") double maxLat,
                                       @Param("minLon") double minLon,
                                       @Param("maxLon") double maxLon);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Driver d SET d.status = :next, d.activeRideId = :rideId, d.version = d.version + 1 "
            + "WHERE d.id = :id AND d.status = :expected AND d.activeRideId IS NULL")
    int bindRide(@Param("id") Long id,
                 @Param("expected") DriverStatus expected,
                 @Param("next") DriverStatus next,
                 @Param("rideId") Long rideId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Driver d SET d.status = :next, d.version = d.version + 1 "
            + "WHERE d.id = :id AND d.status = :expected AND d.activeRideId = :rideId")
    int updateStatusForRide(@Param("id") Long id,
                            @Param("rideId") Long rideId,
                            @Param("expected") DriverStatus expected,
                            @Param("next") DriverStatus next);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Driver d SET d.status = :next, d.activeRideId = NULL, d.version = d.version + 1 "
            + "WHERE d.id = :id AND d.status = :expected AND d.activeRideId = :rideId")
    int releaseRide(@Param("id") Long id,
                    @Param("rideId") Long rideId,
                    @Param("expected") DriverStatus expected,
                    @Param("next") DriverStatus next);

    /** Release after completion: the driver stays where the ride dropped off. */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Driver d SET d.status = :next, d.activeRideId = NULL, "
            + "d.latitude = :latitude, d.longitude = :longitude, d.version = d.version + 1 "
            + "WHERE d.id = :id AND d.status = :expected AND d.activeRideId = :rideId")
    int releaseRideAt(@Param("id") Long id,
                      @Param("rideId") Long rideId,
                      @Param("expected") DriverStatus expected,
                      @Param("next") DriverStatus next,
                      @Param("latitude") double latitude,
                      @Param("longitude") double longitude);
}
