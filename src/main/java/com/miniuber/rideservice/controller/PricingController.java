package com.miniuber.rideservice.controller;

import com.miniuber.rideservice.dto.ApiResponse;
import com.miniuber.rideservice.dto.PricingConfigRequest;
import com.miniuber.rideservice.entity.PricingConfig;
import com.miniuber.rideservice.service.PricingConfigService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/pricing")
@RequiredArgsConstructor
@Slf4j
public class PricingController {

    private final PricingConfigService pricingConfigService;

    @GetMapping("/{key}")
    public ResponseEntity<ApiResponse> getConfig(@PathVariable String key) {
        PricingConfig config = pricingConfigService.getConfig(key);
        return ResponseEntity.ok(ApiResponse.success(config, "Pricing config '" + key + "'"));
    }

    /** Creates or replaces the config; the cached entry is evicted. */
    @PutMapping("/{key}")
    public ResponseEntity<ApiResponse> updateConfig(@PathVariable String key,
                                                    @Valid @RequestBody PricingConfigRequest request) {
        log.info("API: update pricing config '{}'", key);
        PricingConfig saved = pricingConfigService.update(key, request);
        return ResponseEntity.ok(ApiResponse.success(saved, "Pricing config '" + key + "' saved"));
    }
}
