package com.miniuber.rideservice.service;

import com.miniuber.rideservice.config.CacheConfig;
import com.miniuber.rideservice.dto.PricingConfigRequest;
import com.miniuber.rideservice.entity.PricingConfig;
import com.miniuber.rideservice.exception.PricingConfigMissingException;
import com.miniuber.rideservice.repository.PricingConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

/**
 * Cached access to PricingConfig rows.
 *
 * Kept apart from the lifecycle service so every lookup goes through the cache proxy.
 * Missing keys raise PricingConfigMissingException and are never cached.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PricingConfigService {

    private final PricingConfigRepository pricingConfigRepository;

    @Cacheable(value = CacheConfig.CACHE_PRICING_CONFIGS, key = "#key")
    public PricingConfig getConfig(String key) {
        log.debug("[CACHE MISS] pricingConfigs['{}']: loading from DB", key);
        return pricingConfigRepository.findById(key)
                .orElseThrow(() -> new PricingConfigMissingException(key));
    }

    @CacheEvict(value = CacheConfig.CACHE_PRICING_CONFIGS, key = "#key")
    public PricingConfig update(String key, PricingConfigRequest request) {
        PricingConfig saved = pricingConfigRepository.save(PricingConfig.builder()
                .key(key)
                .baseFare(request.getBaseFare())
                .ratePerKm(request.getRatePerKm())
                .ratePerMinute(request.getRatePerMinute())
                .waitingChargePerMinute(request.getWaitingChargePerMinute())
                .build());
        log.info("[CACHE EVICT] pricingConfigs['{}']: base={}, perKm={}, perMin={}, perWaitMin={}",
                key, saved.getBaseFare(), saved.getRatePerKm(), saved.getRatePerMinute(),
                saved.getWaitingChargePerMinute());
        return saved;
    }
}
