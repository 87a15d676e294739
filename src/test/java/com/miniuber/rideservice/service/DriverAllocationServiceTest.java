package com.miniuber.rideservice.service;

import com.miniuber.rideservice.config.DispatchProperties;
import com.miniuber.rideservice.dto.AllocationOutcome;
import com.miniuber.rideservice.dto.AllocationResult;
import com.miniuber.rideservice.dto.EligibilityReason;
import com.miniuber.rideservice.dto.EligibilityResult;
import com.miniuber.rideservice.entity.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DriverAllocationService: expanding-radius search.
 *
 *  1. closest eligible driver wins, lowest id when distances match to the metre
 *  2. radius grows 1 → 2 → 3 km until a driver appears
 *  3. nothing below 20 km → EXHAUSTED after 1..19 km, 20 km never searched
 *  4. ineligible drivers are skipped even when closer
 *  5. lost race → same radius retried with fresh candidates
 *  6. lost race and ride no longer pending → ABORTED
 *  7. ride cancelled between radii → ABORTED without any assignment attempt
 *  8. two lost races at one radius → next radius
 *  9. ride already assigned before the search → ABORTED immediately
 */
@ExtendWith(MockitoExtension.class)
class DriverAllocationServiceTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private RideStore          rideStore;
    @Mock private EligibilityFilter  eligibilityFilter;
    @Mock private RideEventPublisher rideEventPublisher;

    private SimpleMeterRegistry meterRegistry;
    private DriverAllocationService allocationService;

    // ── Test fixtures ─────────────────────────────────────────────────────────

    private static final Long RIDE_ID = 42L;
    private static final double PICKUP_LAT = 12.9716;
    private static final double PICKUP_LON = 77.5946;
    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 10, 0);

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
        allocationService = new DriverAllocationService(rideStore, eligibilityFilter, new DispatchProperties(),
                rideEventPublisher, new DispatchMetrics(meterRegistry), clock);
    }

    private Ride pendingRide() {
        return Ride.builder()
                .id(RIDE_ID).riderId(1L)
                .pickupLatitude(PICKUP_LAT).pickupLongitude(PICKUP_LON)
                .dropLatitude(13.0).dropLongitude(77.6)
                .status(RideStatus.CREATE_RIDE)
                .createdAt(NOW.minusMinutes(1))
                .build();
    }

    /** Driver north (+) or south (-) of the pickup by {@code latOffset} degrees. */
    private Driver driver(long id, double latOffset) {
        return Driver.builder().id(id).name("Driver " + id)
                .latitude(PICKUP_LAT + latOffset).longitude(PICKUP_LON)
                .status(DriverStatus.IDLE)
                .build();
    }

    private void givenPendingRide() {
        when(rideStore.findRide(RIDE_ID)).thenReturn(Optional.of(pendingRide()));
    }

    private void givenStillPending() {
        when(rideStore.findRideStatus(RIDE_ID)).thenReturn(Optional.of(RideStatus.CREATE_RIDE));
    }

    private void givenAllEligible() {
        when(eligibilityFilter.evaluate(any(), any(), any())).thenReturn(EligibilityResult.eligible());
    }

    private double allocations(String outcome) {
        return meterRegistry.get("dispatch.allocation").tag("outcome", outcome).counter().count();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Test 1: nearest wins, lowest id breaks ties
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Equidistant drivers → lowest driver id is assigned")
    void nearestDriver_tieBrokenByLowestId() {
        givenPendingRide();
        givenStillPending();
        givenAllEligible();
        // 5 and 2 sit 0.005° north / south: same distance to the metre, 9 is farther
        when(rideStore.listDriversWithin(any(), eq(1.0)))
                .thenReturn(List.of(driver(9, 0.008), driver(5, 0.005), driver(2, -0.005)));
        when(rideStore.tryAssign(RIDE_ID, 2L, RideStatus.CREATE_RIDE, DriverStatus.IDLE, NOW)).thenReturn(true);

        AllocationResult result = allocationService.allocate(RIDE_ID);

        assertThat(result.getOutcome()).isEqualTo(AllocationOutcome.ASSIGNED);
        assertThat(result.getDriverId()).isEqualTo(2L);
        assertThat(result.getRadiusKm()).isEqualTo(1.0);
        assertThat(result.getConflicts()).isZero();
        verify(rideEventPublisher).publish(any(Ride.class), eq(2L), eq(RideEventType.DRIVER_ASSIGNED), anyString(), eq(NOW));
        assertThat(allocations("assigned")).isEqualTo(1.0);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Test 2: expanding radius
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("No driver within 1 or 2 km → found at 3 km")
    void radiusExpandsUntilDriverFound() {
        givenPendingRide();
        givenStillPending();
        givenAllEligible();
        when(rideStore.listDriversWithin(any(), eq(1.0))).thenReturn(List.of());
        when(rideStore.listDriversWithin(any(), eq(2.0))).thenReturn(List.of());
        when(rideStore.listDriversWithin(any(), eq(3.0))).thenReturn(List.of(driver(4, 0.025)));
        when(rideStore.tryAssign(eq(RIDE_ID), eq(4L), any(), any(), any())).thenReturn(true);

        AllocationResult result = allocationService.allocate(RIDE_ID);

        assertThat(result.getOutcome()).isEqualTo(AllocationOutcome.ASSIGNED);
        assertThat(result.getDriverId()).isEqualTo(4L);
        assertThat(result.getRadiusKm()).isEqualTo(3.0);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Test 3: exhaustion
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Nobody below 20 km → EXHAUSTED after searching 1..19 km, no write")
    void noDriverUpToCeiling_exhausted() {
        givenPendingRide();
        givenStillPending();
        when(rideStore.listDriversWithin(any(), anyDouble())).thenReturn(List.of());

        AllocationResult result = allocationService.allocate(RIDE_ID);

        assertThat(result.getOutcome()).isEqualTo(AllocationOutcome.EXHAUSTED);
        assertThat(result.getDriverId()).isNull();
        assertThat(result.getRadiusKm()).isEqualTo(19.0);
        verify(rideStore, times(19)).listDriversWithin(any(), anyDouble());
        verify(rideStore).listDriversWithin(any(), eq(19.0));
        verify(rideStore, never()).listDriversWithin(any(), eq(20.0));
        verify(rideStore, never()).tryAssign(any(), any(), any(), any(), any());
        verifyNoInteractions(rideEventPublisher);
        assertThat(allocations("exhausted")).isEqualTo(1.0);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Test 4: ineligible drivers are skipped
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Closer but ineligible driver is skipped for a farther eligible one")
    void ineligibleDriverSkipped() {
        givenPendingRide();
        givenStillPending();
        Driver near = driver(1, 0.001);
        Driver far = driver(2, 0.006);
        when(rideStore.listDriversWithin(any(), eq(1.0))).thenReturn(List.of(near, far));
        when(eligibilityFilter.evaluate(any(), eq(near), any()))
                .thenReturn(EligibilityResult.rejected(EligibilityReason.RECENT_RIDE_WITH_RIDER));
        when(eligibilityFilter.evaluate(any(), eq(far), any())).thenReturn(EligibilityResult.eligible());
        when(rideStore.tryAssign(eq(RIDE_ID), eq(2L), any(), any(), any())).thenReturn(true);

        AllocationResult result = allocationService.allocate(RIDE_ID);

        assertThat(result.getDriverId()).isEqualTo(2L);
        verify(rideStore, never()).tryAssign(eq(RIDE_ID), eq(1L), any(), any(), any());
    }

    // ════════════════════════════════════════════════════════════════════════
    // Test 5/6: conflicts
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Lost race → same radius retried with refreshed candidates")
    void conflict_retriesSameRadius() {
        givenPendingRide();
        givenStillPending();
        givenAllEligible();
        when(rideStore.listDriversWithin(any(), eq(1.0)))
                .thenReturn(List.of(driver(1, 0.001), driver(2, 0.004)))
                .thenReturn(List.of(driver(2, 0.004)));
        when(rideStore.tryAssign(eq(RIDE_ID), eq(1L), any(), any(), any())).thenReturn(false);
        when(rideStore.tryAssign(eq(RIDE_ID), eq(2L), any(), any(), any())).thenReturn(true);

        AllocationResult result = allocationService.allocate(RIDE_ID);

        assertThat(result.getOutcome()).isEqualTo(AllocationOutcome.ASSIGNED);
        assertThat(result.getDriverId()).isEqualTo(2L);
        assertThat(result.getRadiusKm()).isEqualTo(1.0);
        assertThat(result.getConflicts()).isEqualTo(1);
        assertThat(meterRegistry.get("dispatch.conflicts").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Lost race and ride already taken elsewhere → ABORTED")
    void conflict_rideNoLongerPending_aborted() {
        givenPendingRide();
        when(rideStore.findRideStatus(RIDE_ID))
                .thenReturn(Optional.of(RideStatus.CREATE_RIDE))
                .thenReturn(Optional.of(RideStatus.ASSIGNED));
        givenAllEligible();
        when(rideStore.listDriversWithin(any(), eq(1.0))).thenReturn(List.of(driver(1, 0.001)));
        when(rideStore.tryAssign(eq(RIDE_ID), eq(1L), any(), any(), any())).thenReturn(false);

        AllocationResult result = allocationService.allocate(RIDE_ID);

        assertThat(result.getOutcome()).isEqualTo(AllocationOutcome.ABORTED);
        assertThat(result.getConflicts()).isEqualTo(1);
        verify(rideStore, times(1)).tryAssign(any(), any(), any(), any(), any());
        verifyNoInteractions(rideEventPublisher);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Test 7: cancellation observed mid-search
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Ride cancelled after the 1 km search → ABORTED at 2 km, nothing written")
    void cancelledMidSearch_aborted() {
        givenPendingRide();
        when(rideStore.findRideStatus(RIDE_ID))
                .thenReturn(Optional.of(RideStatus.CREATE_RIDE))
                .thenReturn(Optional.of(RideStatus.CANCELLED));
        when(rideStore.listDriversWithin(any(), eq(1.0))).thenReturn(List.of());

        AllocationResult result = allocationService.allocate(RIDE_ID);

        assertThat(result.getOutcome()).isEqualTo(AllocationOutcome.ABORTED);
        assertThat(result.getRadiusKm()).isEqualTo(2.0);
        verify(rideStore, never()).listDriversWithin(any(), eq(2.0));
        verify(rideStore, never()).tryAssign(any(), any(), any(), any(), any());
        assertThat(allocations("aborted")).isEqualTo(1.0);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Test 8: bounded retry
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Second lost race at 1 km → search moves on to 2 km")
    void twoConflicts_moveToNextRadius() {
        givenPendingRide();
        givenStillPending();
        givenAllEligible();
        when(rideStore.listDriversWithin(any(), eq(1.0))).thenReturn(List.of(driver(1, 0.001)));
        when(rideStore.listDriversWithin(any(), eq(2.0))).thenReturn(List.of(driver(3, 0.015)));
        when(rideStore.tryAssign(eq(RIDE_ID), eq(1L), any(), any(), any())).thenReturn(false);
        when(rideStore.tryAssign(eq(RIDE_ID), eq(3L), any(), any(), any())).thenReturn(true);

        AllocationResult result = allocationService.allocate(RIDE_ID);

        assertThat(result.getOutcome()).isEqualTo(AllocationOutcome.ASSIGNED);
        assertThat(result.getDriverId()).isEqualTo(3L);
        assertThat(result.getRadiusKm()).isEqualTo(2.0);
        assertThat(result.getConflicts()).isEqualTo(2);
        verify(rideStore, times(2)).listDriversWithin(any(), eq(1.0));
    }

    // ════════════════════════════════════════════════════════════════════════
    // Test 9: ride not pending to begin with
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Ride already assigned → ABORTED without searching")
    void notPending_abortedImmediately() {
        Ride assigned = pendingRide();
        assigned.setStatus(RideStatus.ASSIGNED);
        when(rideStore.findRide(RIDE_ID)).thenReturn(Optional.of(assigned));

        AllocationResult result = allocationService.allocate(RIDE_ID);

        assertThat(result.getOutcome()).isEqualTo(AllocationOutcome.ABORTED);
        verify(rideStore, never()).listDriversWithin(any(), anyDouble());
    }
}
