package com.miniuber.rideservice.repository;

import com.miniuber.rideservice.entity.PricingConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository interface for PricingConfig, keyed by configuration key
 */
@Repository
public interface PricingConfigRepository extends JpaRepository<PricingConfig, String> {
}
