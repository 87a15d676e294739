package com.miniuber.rideservice.service;

import com.miniuber.rideservice.dto.DriverSummary;
import com.miniuber.rideservice.dto.SimulationSummary;
import com.miniuber.rideservice.entity.Driver;
import com.miniuber.rideservice.entity.Ride;
import com.miniuber.rideservice.entity.RideStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Simulation metrics computed by scanning ride records.
 *
 * Wait time is driver arrival → ride start; ride duration is start → end. Both are
 * averaged over completed rides that carry the timestamps.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SimulationSummaryService {

    private final RideStore rideStore;

    public SimulationSummary summarize() {
        List<Ride> rides = rideStore.listRides();
        List<Driver> drivers = rideStore.listDrivers();

        Map<RideStatus, Long> counts = new EnumMap<>(RideStatus.class);
        for (RideStatus status : RideStatus.values()) {
            counts.put(status, 0L);
        }
        rides.forEach(r -> counts.merge(r.getStatus(), 1L, Long::sum));

        Map<String, Long> byStatus = new LinkedHashMap<>();
        counts.forEach((status, count) -> byStatus.put(status.wireName(), count));

        List<Ride> completed = rides.stream()
                .filter(r -> r.getStatus() == RideStatus.COMPLETED)
                .collect(Collectors.toList());

        Map<Long, List<Ride>> ridesByDriver = rides.stream()
                .filter(r -> r.getDriverId() != null)
                .collect(Collectors.groupingBy(Ride::getDriverId));

        List<DriverSummary> driverSummaries = new ArrayList<>();
        for (Driver driver : drivers) {
            List<Ride> driverRides = ridesByDriver.getOrDefault(driver.getId(), List.of());
            driverSummaries.add(summarizeDriver(driver, driverRides));
        }

        SimulationSummary summary = SimulationSummary.builder()
                .totalRides(rides.size())
                .completedRides(counts.get(RideStatus.COMPLETED))
                .unmatchedRides(counts.get(RideStatus.CREATE_RIDE))
                .cancelledRides(counts.get(RideStatus.CANCELLED))
                .ridesByStatus(byStatus)
                .averageWaitMinutes(averageMinutes(completed, Ride::getDriverArrivedAt, Ride::getStartedAt))
                .averageRideMinutes(averageMinutes(completed, Ride::getStartedAt, Ride::getEndedAt))
                .drivers(driverSummaries)
                .build();

        log.info("Summary: {} ride(s), {} completed, {} unmatched, {} cancelled",
                summary.getTotalRides(), summary.getCompletedRides(),
                summary.getUnmatchedRides(), summary.getCancelledRides());
        return summary;
    }

    private DriverSummary summarizeDriver(Driver driver, List<Ride> rides) {
        List<Ride> completed = rides.stream()
                .filter(r -> r.getStatus() == RideStatus.COMPLETED)
                .collect(Collectors.toList());
        long cancelled = rides.stream()
                .filter(r -> r.getStatus() == RideStatus.CANCELLED)
                .count();

        BigDecimal totalFare = completed.stream()
                .map(Ride::getFare)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
        BigDecimal averageFare = completed.isEmpty()
                ? BigDecimal.ZERO.setScale(2)
                : totalFare.divide(BigDecimal.valueOf(completed.size()), 2, RoundingMode.HALF_UP);

        return DriverSummary.builder()
                .driverId(driver.getId())
                .name(driver.getName())
                .completedRides(completed.size())
                .cancelledRides(cancelled)
                .totalFare(totalFare)
                .averageFare(averageFare)
                .averageWaitMinutes(averageMinutes(completed, Ride::getDriverArrivedAt, Ride::getStartedAt))
                .averageRideMinutes(averageMinutes(completed, Ride::getStartedAt, Ride::getEndedAt))
                .build();
    }

    private static double averageMinutes(List<Ride> rides,
                                         Function<Ride, LocalDateTime> from,
                                         Function<Ride, LocalDateTime> to) {
        return rides.stream()
                .filter(r -> from.apply(r) != null && to.apply(r) != null)
                .mapToDouble(r -> Duration.between(from.apply(r), to.apply(r)).toMillis() / 60_000.0)
                .average()
                .orElse(0.0);
    }
}
