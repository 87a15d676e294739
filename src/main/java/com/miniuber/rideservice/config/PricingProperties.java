package com.miniuber.rideservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Pricing settings bound from {@code pricing.*}.
 *
 * activeKey selects the PricingConfig row used at fare time; defaults seed that row
 * on startup when it is absent.
 */
@ConfigurationProperties(prefix = "pricing")
@Getter
@Setter
public class PricingProperties {

    private String activeKey = "default";

    private boolean seedDefaults = true;

    private Defaults defaults = new Defaults();

    @Getter
    @Setter
    public static class Defaults {
        private BigDecimal baseFare = new BigDecimal("20");
        private BigDecimal ratePerKm = new BigDecimal("10");
        private BigDecimal ratePerMinute = new BigDecimal("2");
        private BigDecimal waitingChargePerMinute = new BigDecimal("1");
    }
}
