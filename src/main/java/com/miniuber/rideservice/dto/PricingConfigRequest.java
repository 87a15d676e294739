package com.miniuber.rideservice.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.math.BigDecimal;

/**
 * DTO for creating or replacing a pricing configuration
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PricingConfigRequest {

    @NotNull @DecimalMin("0.0")
    private BigDecimal baseFare;

    @NotNull @DecimalMin("0.0")
    private BigDecimal ratePerKm;

    @NotNull @DecimalMin("0.0")
    private BigDecimal ratePerMinute;

    @NotNull @DecimalMin("0.0")
    private BigDecimal waitingChargePerMinute;
}
