package com.miniuber.rideservice.service;

import com.miniuber.rideservice.config.WebSocketConfig;
import com.miniuber.rideservice.entity.Ride;
import com.miniuber.rideservice.entity.RideEvent;
import com.miniuber.rideservice.entity.RideEventType;
import com.miniuber.rideservice.repository.RideEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Records a committed ride transition in the ride_events audit table and pushes it
 * to WebSocket subscribers on /topic/ride-events.
 *
 * Called after the guarded write has committed, so a failure here is logged and
 * never turns a successful transition into an error.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RideEventPublisher {

    private final RideEventRepository rideEventRepository;
    private final SimpMessagingTemplate messagingTemplate;

    public void publish(Ride ride, Long driverId, RideEventType type, String detail, LocalDateTime at) {
        try {
            rideEventRepository.save(RideEvent.builder()
                    .rideId(ride.getId())
                    .riderId(ride.getRiderId())
                    .driverId(driverId)
                    .eventType(type)
                    .detail(detail)
                    .timestamp(at)
                    .build());
        } catch (RuntimeException e) {
            log.error("AUDIT: failed to record {} for ride #{}: {}", type, ride.getId(), e.getMessage(), e);
        }

        Map<String, Object> payload = new HashMap<>();
        payload.put("type", "RIDE_EVENT");
        payload.put("eventType", type.name());
        payload.put("rideId", ride.getId());
        payload.put("riderId", ride.getRiderId());
        payload.put("driverId", driverId);
        payload.put("detail", detail);
        payload.put("timestamp", at.toString());
        try {
            messagingTemplate.convertAndSend(WebSocketConfig.RIDE_EVENTS_TOPIC, payload);
        } catch (MessagingException e) {
            log.warn("WebSocket push failed for {} on ride #{}: {}", type, ride.getId(), e.getMessage());
        }
        log.debug("Published {} for ride #{}", type, ride.getId());
    }
}
