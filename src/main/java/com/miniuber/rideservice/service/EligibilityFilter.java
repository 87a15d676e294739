package com.miniuber.rideservice.service;

import com.miniuber.rideservice.config.DispatchProperties;
import com.miniuber.rideservice.dto.EligibilityReason;
import com.miniuber.rideservice.dto.EligibilityResult;
import com.miniuber.rideservice.entity.Driver;
import com.miniuber.rideservice.entity.DriverRideOutcome;
import com.miniuber.rideservice.entity.DriverStatus;
import com.miniuber.rideservice.entity.Ride;
import com.miniuber.rideservice.entity.RideOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Decides whether a candidate driver may take a ride. Rules run in order and the
 * first failure is reported:
 *
 *  1. driver is IDLE
 *  2. driver has not completed a ride for the same rider within the cooldown window
 *     (ineligible during (T, T + cooldown), eligible again at T + cooldown)
 *  3. driver's last two outcomes are not both CANCELLED
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EligibilityFilter {

    private final RideStore rideStore;
    private final DispatchProperties dispatchProperties;

    public EligibilityResult evaluate(Ride ride, Driver driver, LocalDateTime now) {
        if (driver.getStatus() != DriverStatus.IDLE) {
            return reject(ride, driver, EligibilityReason.DRIVER_NOT_IDLE);
        }

        LocalDateTime cooldownStart = now.minus(dispatchProperties.getSameRiderCooldown());
        if (rideStore.hasCompletedRideWith(driver.getId(), ride.getRiderId(), cooldownStart)) {
            return reject(ride, driver, EligibilityReason.RECENT_RIDE_WITH_RIDER);
        }

        List<DriverRideOutcome> recent = rideStore.recentOutcomes(driver.getId());
        if (recent.size() >= 2
                && recent.get(0).getOutcome() == RideOutcome.CANCELLED
                && recent.get(1).getOutcome() == RideOutcome.CANCELLED) {
            return reject(ride, driver, EligibilityReason.CONSECUTIVE_CANCELLATIONS);
        }

        return EligibilityResult.eligible();
    }

    private EligibilityResult reject(Ride ride, Driver driver, EligibilityReason reason) {
        log.debug("Driver #{} excluded for ride #{}: {}", driver.getId(), ride.getId(), reason);
        return EligibilityResult.rejected(reason);
    }
}
