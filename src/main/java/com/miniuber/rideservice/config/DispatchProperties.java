package com.miniuber.rideservice.config;

import lombok.Getter;
import lombok.Setter;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Dispatcher tuning, bound from the {@code dispatch.*} properties.
 *
 * Radius search: start at initialRadiusKm, grow by radiusIncrementKm, stop after maxRadiusKm.
 */
@ConfigurationProperties(prefix = "dispatch")
@Validated
@Getter
@Setter
public class DispatchProperties {

    @Positive
    private double initialRadiusKm = 1.0;

    @Positive
    private double radiusIncrementKm = 1.0;

    @Positive
    private double maxRadiusKm = 20.0;

    /** Delay between the end of one dispatch pass and the start of the next */
    private Duration interval = Duration.ofSeconds(10);

    private Duration initialDelay = Duration.ofSeconds(10);

    private boolean schedulerEnabled = true;

    /** A driver may not be re-matched with the same rider within this window after completing a ride */
    private Duration sameRiderCooldown = Duration.ofMinutes(30);

    /** Outcomes kept per driver beyond the cooldown window; at least 2 */
    private int historyCapacity = 10;

    public int effectiveHistoryCapacity() {
        return Math.max(2, historyCapacity);
    }
}
