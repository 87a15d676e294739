package com.miniuber.rideservice.repository;

import com.miniuber.rideservice.entity.Rider;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for Rider entity
 */
@Repository
public interface RiderRepository extends JpaRepository<Rider, Long> {

    List<Rider> findAllByOrderByIdAsc();
}
