package com.miniuber.rideservice.config;

import com.miniuber.rideservice.entity.Driver;
import com.miniuber.rideservice.entity.PricingConfig;
import com.miniuber.rideservice.entity.Rider;
import com.miniuber.rideservice.repository.DriverRepository;
import com.miniuber.rideservice.repository.PricingConfigRepository;
import com.miniuber.rideservice.repository.RiderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Data loader that runs on application startup.
 *
 * - Seeds the active PricingConfig from pricing.defaults.* when the row is absent.
 * - With seed.sample-data=true, inserts a small fixed fleet of riders and drivers
 *   around Bangalore MG Road so the dispatcher has something to match.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DataLoader implements CommandLineRunner {

    private static final double CENTER_LAT = 12.9716;
    private static final double CENTER_LON = 77.5946;

    // Offsets in degrees from the centre; 0.01° latitude ≈ 1.1 km
    private static final double[][] DRIVER_OFFSETS = {
            {0.002, 0.001}, {-0.004, 0.006}, {0.011, -0.003}, {-0.015, -0.012},
            {0.021, 0.018}, {-0.030, 0.025}, {0.045, -0.040}, {0.070, 0.060}
    };

    private static final double[][] RIDER_OFFSETS = {
            {0.000, 0.000}, {0.008, -0.009}, {-0.019, 0.014}, {0.033, 0.027}, {-0.052, -0.031}
    };

    private final PricingConfigRepository pricingConfigRepository;
    private final DriverRepository driverRepository;
    private final RiderRepository riderRepository;
    private final PricingProperties pricingProperties;

    @Value("${seed.sample-data:false}")
    private boolean seedSampleData;

    @Override
    public void run(String... args) throws Exception {
        log.info("Starting data initialization...");

        seedPricingConfig();

        if (!seedSampleData) {
            log.info("Sample data disabled (seed.sample-data=false)");
            return;
        }

        // Check if data already exists to avoid duplicates
        if (driverRepository.count() > 0 || riderRepository.count() > 0) {
            log.info("Riders/drivers already exist, skipping sample data");
            return;
        }

        for (int i = 0; i < RIDER_OFFSETS.length; i++) {
            riderRepository.save(Rider.builder()
                    .name("Rider " + (i + 1))
                    .latitude(CENTER_LAT + RIDER_OFFSETS[i][0])
                    .longitude(CENTER_LON + RIDER_OFFSETS[i][1])
                    .build());
        }

        for (int i = 0; i < DRIVER_OFFSETS.length; i++) {
            driverRepository.save(Driver.builder()
                    .name("Driver " + (i + 1))
                    .latitude(CENTER_LAT + DRIVER_OFFSETS[i][0])
                    .longitude(CENTER_LON + DRIVER_OFFSETS[i][1])
                    .build());
        }

        List<Driver> drivers = driverRepository.findAllByOrderByIdAsc();
        log.info("Data initialization completed successfully!");
        log.info("========================================");
        log.info("Sample Data Summary:");
        log.info("Riders: {}", riderRepository.count());
        log.info("Drivers: {} (all IDLE)", drivers.size());
        drivers.forEach(d -> log.info("  Driver #{} '{}' at ({}, {})",
                d.getId(), d.getName(), d.getLatitude(), d.getLongitude()));
        log.info("========================================");
    }

    private void seedPricingConfig() {
        String key = pricingProperties.getActiveKey();
        if (!pricingProperties.isSeedDefaults()) {
            log.info("Pricing defaults seeding disabled");
            return;
        }
        if (pricingConfigRepository.existsById(key)) {
            log.info("Pricing config '{}' already present", key);
            return;
        }
        PricingProperties.Defaults d = pricingProperties.getDefaults();
        pricingConfigRepository.save(PricingConfig.builder()
                .key(key)
                .baseFare(d.getBaseFare())
                .ratePerKm(d.getRatePerKm())
                .ratePerMinute(d.getRatePerMinute())
                .waitingChargePerMinute(d.getWaitingChargePerMinute())
                .build());
        log.info("Pricing config '{}' seeded: base={}, perKm={}, perMin={}, perWaitMin={}",
                key, d.getBaseFare(), d.getRatePerKm(), d.getRatePerMinute(), d.getWaitingChargePerMinute());
    }
}
