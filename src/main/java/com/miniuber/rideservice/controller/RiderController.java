package com.miniuber.rideservice.controller;

import com.miniuber.rideservice.dto.ApiResponse;
import com.miniuber.rideservice.entity.Rider;
import com.miniuber.rideservice.service.RideStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/riders")
@RequiredArgsConstructor
public class RiderController {

    private final RideStore rideStore;

    @GetMapping
    public ResponseEntity<ApiResponse> listRiders() {
        List<Rider> riders = rideStore.listRiders();
        return ResponseEntity.ok(ApiResponse.success(riders, "Found " + riders.size() + " rider(s)"));
    }
}
