package com.miniuber.rideservice.service;

import com.miniuber.rideservice.entity.RideEvent;
import com.miniuber.rideservice.repository.RideEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read-only queries over the ride_events audit log.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RideAuditService {

    private final RideEventRepository rideEventRepository;

    /**
     * Full audit trail of a ride in recording order:
     *   RIDE_CREATED → DRIVER_ASSIGNED → DRIVER_ARRIVED → RIDE_STARTED → RIDE_COMPLETED
     */
    @Transactional(readOnly = true)
    public List<RideEvent> getEventsByRideId(Long rideId) {
        List<RideEvent> events = rideEventRepository.findByRideIdOrderByIdAsc(rideId);
        log.info("AUDIT: Found {} event(s) for ride #{}", events.size(), rideId);
        return events;
    }

    @Transactional(readOnly = true)
    public List<RideEvent> getEventsByDriverId(Long driverId) {
        List<RideEvent> events = rideEventRepository.findByDriverIdOrderByIdDesc(driverId);
        log.info("AUDIT: Found {} event(s) for driver #{}", events.size(), driverId);
        return events;
    }
}
