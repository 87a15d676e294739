package com.miniuber.rideservice.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/**
 * Pricing rates, looked up by configuration key (normally "default").
 */
@Entity
@Table(name = "pricing_config")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PricingConfig {

    @Id
    @Column(name = "config_key", length = 50)
    private String key;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal baseFare;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal ratePerKm;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal ratePerMinute;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal waitingChargePerMinute;
}
