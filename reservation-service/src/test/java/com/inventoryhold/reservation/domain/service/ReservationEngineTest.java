package com.inventoryhold.reservation.domain.service;

import com.inventoryhold.common.exception.ResourceNotFoundException;
import com.inventoryhold.reservation.domain.model.CancelOutcome;
import com.inventoryhold.reservation.domain.model.InventoryUnit;
import com.inventoryhold.reservation.domain.model.Reservation;
import com.inventoryhold.reservation.domain.model.ReservationStatus;
import com.inventoryhold.reservation.domain.model.ReserveIdempotency;
import com.inventoryhold.reservation.domain.repository.InventoryUnitRepository;
import com.inventoryhold.reservation.domain.repository.ReservationRepository;
import com.inventoryhold.reservation.domain.repository.ReserveIdempotencyRepository;
import com.inventoryhold.reservation.domain.strategy.CapacityHoldStrategy;
import com.inventoryhold.reservation.exception.InsufficientCapacityException;
import com.inventoryhold.reservation.exception.InvalidReservationInputException;
import com.inventoryhold.reservation.exception.InvalidReservationStateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link ReservationEngine}: strategy selection, hold window, idempotent replay,
 * confirm strictness, cancel leniency and the expiry pass.
 */
@ExtendWith(MockitoExtension.class)
class ReservationEngineTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 10, 0);
    private static final LocalDateTime CREATED_AT = NOW.minusMinutes(20);
    private static final String UNIT_ID = "FL-100";
    private static final String BOOKING_ID = "booking-42";
    private static final String KEY = "reserve-booking-42";

    @Mock
    private CapacityHoldStrategy strategy;
    @Mock
    private InventoryUnitRepository inventoryUnitRepository;
    @Mock
    private ReservationRepository reservationRepository;
    @Mock
    private ReserveIdempotencyRepository reserveIdempotencyRepository;

    private ReservationEngine engine;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        engine = new ReservationEngine(
                Map.of("pessimistic", strategy),
                inventoryUnitRepository,
                reservationRepository,
                reserveIdempotencyRepository,
                clock);
        ReflectionTestUtils.setField(engine, "strategyType", "pessimistic");
        ReflectionTestUtils.setField(engine, "holdTtlMinutes", 15);
    }

    @Test
    @DisplayName("reserve() holds capacity and records a PENDING reservation expiring after the hold window")
    void reserve_holdsAndRecordsPending() {
        given(reservationRepository.save(any(Reservation.class))).willAnswer(inv -> withId(inv.getArgument(0)));

        Reservation reservation = engine.reserve(UNIT_ID, BOOKING_ID, 2, null);

        verify(strategy).hold(UNIT_ID, 2, NOW);
        assertThat(reservation.getStatus()).isEqualTo(ReservationStatus.PENDING);
        assertThat(reservation.getQuantity()).isEqualTo(2);
        assertThat(reservation.getExternalBookingId()).isEqualTo(BOOKING_ID);
        assertThat(reservation.getExpiresAt()).isEqualTo(NOW.plusMinutes(15));
        assertThat(reservation.getCreatedAt()).isEqualTo(NOW);
        verify(reserveIdempotencyRepository, never()).save(any());
    }

    @Test
    @DisplayName("reserve() does not record a reservation when the hold is rejected")
    void reserve_insufficientCapacity_noReservation() {
        willThrow(new InsufficientCapacityException(UNIT_ID, 3, 1)).given(strategy).hold(UNIT_ID, 3, NOW);

        assertThatThrownBy(() -> engine.reserve(UNIT_ID, BOOKING_ID, 3, null))
                .isInstanceOf(InsufficientCapacityException.class);

        verify(reservationRepository, never()).save(any());
    }

    @Test
    @DisplayName("reserve() with a new idempotency key records the key against the new reservation")
    void reserve_withNewKey_recordsKey() {
        given(reserveIdempotencyRepository.findById(KEY)).willReturn(Optional.empty());
        given(reservationRepository.save(any(Reservation.class))).willAnswer(inv -> withId(inv.getArgument(0)));

        Reservation reservation = engine.reserve(UNIT_ID, BOOKING_ID, 1, KEY);

        verify(strategy).hold(UNIT_ID, 1, NOW);
        verify(reserveIdempotencyRepository).save(argThat(record ->
                record.getIdempotencyKey().equals(KEY)
                        && record.getReservationId().equals(reservation.getId())
                        && record.isNew()));
    }

    @Test
    @DisplayName("reserve() with a known idempotency key replays the recorded reservation without holding capacity")
    void reserve_withKnownKey_replays() {
        Reservation previous = withId(Reservation.pending(UNIT_ID, BOOKING_ID, 1, CREATED_AT, NOW.plusMinutes(5)));
        given(reserveIdempotencyRepository.findById(KEY))
                .willReturn(Optional.of(new ReserveIdempotency(KEY, previous.getId(), NOW.minusMinutes(10))));
        given(reservationRepository.findById(previous.getId())).willReturn(Optional.of(previous));

        Reservation result = engine.reserve(UNIT_ID, BOOKING_ID, 1, KEY);

        assertThat(result).isSameAs(previous);
        verify(strategy, never()).hold(anyString(), anyInt(), any());
        verify(reservationRepository, never()).save(any());
    }

    @Test
    @DisplayName("reserve() with a known idempotency key but different arguments is invalid input")
    void reserve_withKnownKey_differentRequest() {
        Reservation previous = withId(Reservation.pending(UNIT_ID, BOOKING_ID, 1, CREATED_AT, NOW.plusMinutes(5)));
        given(reserveIdempotencyRepository.findById(KEY))
                .willReturn(Optional.of(new ReserveIdempotency(KEY, previous.getId(), NOW.minusMinutes(10))));
        given(reservationRepository.findById(previous.getId())).willReturn(Optional.of(previous));

        assertThatThrownBy(() -> engine.reserve(UNIT_ID, BOOKING_ID, 3, KEY))
                .isInstanceOf(InvalidReservationInputException.class)
                .hasMessageContaining(KEY);
        verify(strategy, never()).hold(anyString(), anyInt(), any());
    }

    @Test
    @DisplayName("unknown strategy name falls back to pessimistic")
    void reserve_unknownStrategy_fallsBack() {
        ReflectionTestUtils.setField(engine, "strategyType", "optimistic");
        given(reservationRepository.save(any(Reservation.class))).willAnswer(inv -> withId(inv.getArgument(0)));

        engine.reserve(UNIT_ID, BOOKING_ID, 1, null);

        verify(strategy).hold(UNIT_ID, 1, NOW);
    }

    @Test
    @DisplayName("confirm() moves a PENDING reservation to CONFIRMED without touching the unit")
    void confirm_pending() {
        Reservation pending = withId(Reservation.pending(UNIT_ID, BOOKING_ID, 1, CREATED_AT, NOW.plusMinutes(5)));
        given(reservationRepository.findByIdForUpdate(pending.getId())).willReturn(Optional.of(pending));

        Reservation result = engine.confirm(pending.getId());

        assertThat(result.getStatus()).isEqualTo(ReservationStatus.CONFIRMED);
        assertThat(result.getExpiresAt()).isNull();
        verify(inventoryUnitRepository, never()).findByIdForUpdate(anyString());
    }

    @Test
    @DisplayName("confirm() twice is InvalidState")
    void confirm_twice_invalidState() {
        Reservation pending = withId(Reservation.pending(UNIT_ID, BOOKING_ID, 1, CREATED_AT, NOW.plusMinutes(5)));
        given(reservationRepository.findByIdForUpdate(pending.getId())).willReturn(Optional.of(pending));
        engine.confirm(pending.getId());

        assertThatThrownBy(() -> engine.confirm(pending.getId()))
                .isInstanceOf(InvalidReservationStateException.class)
                .extracting("currentStatus")
                .isEqualTo(ReservationStatus.CONFIRMED);
    }

    @Test
    @DisplayName("confirm() of an unknown reservation is NotFound")
    void confirm_unknown_notFound() {
        UUID id = UUID.randomUUID();
        given(reservationRepository.findByIdForUpdate(id)).willReturn(Optional.empty());

        assertThatThrownBy(() -> engine.confirm(id)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("cancel() of a PENDING reservation releases its quantity, locking reservation before unit")
    void cancel_pending_releasesCapacity() {
        Reservation pending = withId(Reservation.pending(UNIT_ID, BOOKING_ID, 2, CREATED_AT, NOW.plusMinutes(5)));
        InventoryUnit unit = unit(UNIT_ID, 0);
        given(reservationRepository.findByIdForUpdate(pending.getId())).willReturn(Optional.of(pending));
        given(inventoryUnitRepository.findByIdForUpdate(UNIT_ID)).willReturn(Optional.of(unit));

        CancelOutcome outcome = engine.cancel(pending.getId());

        assertThat(outcome).isEqualTo(CancelOutcome.CANCELLED);
        assertThat(pending.getStatus()).isEqualTo(ReservationStatus.CANCELLED);
        assertThat(unit.getAvailableCapacity()).isEqualTo(2);
        assertThat(unit.getUpdatedAt()).isEqualTo(NOW);
        assertThat(pending.getUpdatedAt()).isEqualTo(NOW);
        InOrder lockOrder = inOrder(reservationRepository, inventoryUnitRepository);
        lockOrder.verify(reservationRepository).findByIdForUpdate(pending.getId());
        lockOrder.verify(inventoryUnitRepository).findByIdForUpdate(UNIT_ID);
    }

    @Test
    @DisplayName("cancel() of a confirmed or unknown reservation is ALREADY_HANDLED and changes nothing")
    void cancel_resolvedOrUnknown_alreadyHandled() {
        Reservation confirmed = withId(Reservation.pending(UNIT_ID, BOOKING_ID, 2, CREATED_AT, NOW.plusMinutes(5)));
        confirmed.confirm(NOW.minusMinutes(10));
        UUID unknown = UUID.randomUUID();
        given(reservationRepository.findByIdForUpdate(confirmed.getId())).willReturn(Optional.of(confirmed));
        given(reservationRepository.findByIdForUpdate(unknown)).willReturn(Optional.empty());

        assertThat(engine.cancel(confirmed.getId())).isEqualTo(CancelOutcome.ALREADY_HANDLED);
        assertThat(engine.cancel(unknown)).isEqualTo(CancelOutcome.ALREADY_HANDLED);

        assertThat(confirmed.getStatus()).isEqualTo(ReservationStatus.CONFIRMED);
        verify(inventoryUnitRepository, never()).findByIdForUpdate(anyString());
    }

    @Test
    @DisplayName("cancel() still resolves the reservation when its unit is gone")
    void cancel_missingUnit_stillCancels() {
        Reservation pending = withId(Reservation.pending(UNIT_ID, BOOKING_ID, 1, CREATED_AT, NOW.plusMinutes(5)));
        given(reservationRepository.findByIdForUpdate(pending.getId())).willReturn(Optional.of(pending));
        given(inventoryUnitRepository.findByIdForUpdate(UNIT_ID)).willReturn(Optional.empty());

        assertThat(engine.cancel(pending.getId())).isEqualTo(CancelOutcome.CANCELLED);
        assertThat(pending.getStatus()).isEqualTo(ReservationStatus.CANCELLED);
    }

    @Test
    @DisplayName("expireOverdue() expires overdue rows, skips raced ones and credits each unit once")
    void expireOverdue_creditsPerUnit() {
        Reservation a1 = withId(Reservation.pending("A", "b-1", 1, CREATED_AT, NOW.minusMinutes(2)));
        Reservation a2 = withId(Reservation.pending("A", "b-2", 2, CREATED_AT, NOW.minusMinutes(1)));
        Reservation b1 = withId(Reservation.pending("B", "b-3", 1, CREATED_AT, NOW.minusMinutes(1)));
        Reservation raced = withId(Reservation.pending("B", "b-4", 4, CREATED_AT, NOW.minusMinutes(3)));
        raced.confirm(NOW.minusMinutes(10));
        InventoryUnit unitA = unit("A", 0);
        InventoryUnit unitB = unit("B", 5);
        given(reservationRepository.findOverduePendingForUpdate(NOW)).willReturn(List.of(a1, raced, a2, b1));
        given(inventoryUnitRepository.findByIdForUpdate("A")).willReturn(Optional.of(unitA));
        given(inventoryUnitRepository.findByIdForUpdate("B")).willReturn(Optional.of(unitB));

        int expired = engine.expireOverdue(NOW);

        assertThat(expired).isEqualTo(3);
        assertThat(List.of(a1, a2, b1)).extracting(Reservation::getStatus).containsOnly(ReservationStatus.EXPIRED);
        assertThat(raced.getStatus()).isEqualTo(ReservationStatus.CONFIRMED);
        assertThat(unitA.getAvailableCapacity()).isEqualTo(3);
        assertThat(unitB.getAvailableCapacity()).isEqualTo(6);
        assertThat(a1.getUpdatedAt()).isEqualTo(NOW);
        assertThat(unitA.getUpdatedAt()).isEqualTo(NOW);
        InOrder unitOrder = inOrder(inventoryUnitRepository);
        unitOrder.verify(inventoryUnitRepository).findByIdForUpdate("A");
        unitOrder.verify(inventoryUnitRepository).findByIdForUpdate("B");
    }

    @Test
    @DisplayName("expireOverdue() with nothing overdue touches no unit")
    void expireOverdue_nothingOverdue() {
        given(reservationRepository.findOverduePendingForUpdate(NOW)).willReturn(List.of());

        assertThat(engine.expireOverdue(NOW)).isZero();
        verify(inventoryUnitRepository, never()).findByIdForUpdate(anyString());
    }

    private static Reservation withId(Reservation reservation) {
        ReflectionTestUtils.setField(reservation, "id", UUID.randomUUID());
        return reservation;
    }

    private static InventoryUnit unit(String id, int available) {
        return InventoryUnit.builder()
                .id(id)
                .unitType("FLIGHT")
                .totalCapacity(10)
                .availableCapacity(available)
                .build();
    }
}
