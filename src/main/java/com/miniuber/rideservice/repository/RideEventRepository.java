package com.miniuber.rideservice.repository;

import com.miniuber.rideservice.entity.RideEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for RideEvent audit records.
 */
@Repository
public interface RideEventRepository extends JpaRepository<RideEvent, Long> {

    /** Audit trail for one ride in recording order (timestamps may be simulated). */
    List<RideEvent> findByRideIdOrderByIdAsc(Long rideId);

    /** Most recently recorded events involving a driver first. */
    List<RideEvent> findByDriverIdOrderByIdDesc(Long driverId);
}
