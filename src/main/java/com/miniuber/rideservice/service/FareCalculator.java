package com.miniuber.rideservice.service;

import com.miniuber.rideservice.dto.FareBreakdown;
import com.miniuber.rideservice.entity.PricingConfig;
import com.miniuber.rideservice.entity.Ride;
import com.miniuber.rideservice.util.GeoDistance;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Stateless fare computation.
 *
 *   fare = base + km × perKm + rideMinutes × perMinute + waitMinutes × perWaitMinute
 *
 * Ride time is start → end, wait time is driver arrival → start. Both are clamped at
 * zero and count as zero when a timestamp is missing. The total is rounded half-up
 * to 2 decimals.
 */
@Component
public class FareCalculator {

    private static final int MONEY_SCALE = 2;
    private static final int WORK_SCALE = 6;
    private static final BigDecimal MILLIS_PER_MINUTE = BigDecimal.valueOf(60_000);

    /**
     * Fare for a ride about to complete at {@code endedAt}; distance is the
     * straight-line pickup to drop-off distance.
     */
    public FareBreakdown calculate(Ride ride, LocalDateTime endedAt, PricingConfig config) {
        double distanceKm = GeoDistance.distanceKm(
                ride.getPickupLatitude(), ride.getPickupLongitude(),
                ride.getDropLatitude(), ride.getDropLongitude());
        return calculate(distanceKm,
                between(ride.getStartedAt(), endedAt),
                between(ride.getDriverArrivedAt(), ride.getStartedAt()),
                config);
    }

    public FareBreakdown calculate(double distanceKm, Duration rideTime, Duration waitTime, PricingConfig config) {
        BigDecimal km = BigDecimal.valueOf(Math.max(0.0, distanceKm));
        BigDecimal rideMinutes = toMinutes(rideTime);
        BigDecimal waitMinutes = toMinutes(waitTime);

        BigDecimal base = config.getBaseFare();
        BigDecimal distancePart = km.multiply(config.getRatePerKm());
        BigDecimal timePart = rideMinutes.multiply(config.getRatePerMinute());
        BigDecimal waitingPart = waitMinutes.multiply(config.getWaitingChargePerMinute());

        BigDecimal total = base.add(distancePart).add(timePart).add(waitingPart)
                .setScale(MONEY_SCALE, RoundingMode.HALF_UP);

        return FareBreakdown.builder()
                .distanceKm(km.setScale(3, RoundingMode.HALF_UP))
                .durationMinutes(rideMinutes.setScale(MONEY_SCALE, RoundingMode.HALF_UP))
                .waitMinutes(waitMinutes.setScale(MONEY_SCALE, RoundingMode.HALF_UP))
                .baseComponent(base.setScale(MONEY_SCALE, RoundingMode.HALF_UP))
                .distanceComponent(distancePart.setScale(MONEY_SCALE, RoundingMode.HALF_UP))
                .timeComponent(timePart.setScale(MONEY_SCALE, RoundingMode.HALF_UP))
                .waitingComponent(waitingPart.setScale(MONEY_SCALE, RoundingMode.HALF_UP))
                .total(total)
                .build();
    }

    private static Duration between(LocalDateTime from, LocalDateTime to) {
        if (from == null || to == null) {
            return Duration.ZERO;
        }
        return Duration.between(from, to);
    }

    private static BigDecimal toMinutes(Duration duration) {
        if (duration == null || duration.isNegative()) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(duration.toMillis()).divide(MILLIS_PER_MINUTE, WORK_SCALE, RoundingMode.HALF_UP);
    }
}
