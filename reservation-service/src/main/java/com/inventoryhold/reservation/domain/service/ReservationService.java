package com.inventoryhold.reservation.domain.service;

import com.inventoryhold.common.exception.ResourceNotFoundException;
import com.inventoryhold.common.exception.ServiceUnavailableException;
import com.inventoryhold.reservation.domain.model.CancelOutcome;
import com.inventoryhold.reservation.domain.model.InventoryUnit;
import com.inventoryhold.reservation.domain.model.Reservation;
import com.inventoryhold.reservation.exception.InvalidReservationInputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point for the booking orchestrator: reserve, confirm, cancel.
 *
 * Deliberately not transactional. Input is rejected here before {@link ReservationEngine} opens a
 * transaction, and storage failures raised inside the engine or at commit time arrive here after the
 * rollback, where they become a retryable {@link ServiceUnavailableException}.
 *
 * Idempotency is asymmetric: confirm fails on anything but a pending reservation, cancel succeeds on
 * anything (compensations may be delivered more than once).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationService {

    static final int DEFAULT_QUANTITY = 1;
    // column widths in V1__create_inventory_tables.sql
    static final int MAX_UNIT_ID_LENGTH = 64;
    static final int MAX_CORRELATION_ID_LENGTH = 255;
    private static final String STORAGE_FAULT_MSG = "Reservation store temporarily unavailable. Retry later.";

    private final ReservationEngine engine;
    private final Clock clock;

    /**
     * Holds capacity for a booking.
     *
     * @param quantity defaults to 1 when null
     * @param idempotencyKey optional; repeating a reserve with the same key returns the same reservation
     */
    public Reservation reserve(String inventoryUnitId, String externalBookingId, Integer quantity,
                               String idempotencyKey) {
        if (inventoryUnitId == null || inventoryUnitId.isBlank()) {
            throw new InvalidReservationInputException("inventoryUnitId is required");
        }
        requireMaxLength("inventoryUnitId", inventoryUnitId, MAX_UNIT_ID_LENGTH);
        if (externalBookingId == null || externalBookingId.isBlank()) {
            throw new InvalidReservationInputException("externalBookingId is required");
        }
        requireMaxLength("externalBookingId", externalBookingId, MAX_CORRELATION_ID_LENGTH);
        int effectiveQuantity = quantity == null ? DEFAULT_QUANTITY : quantity;
        if (effectiveQuantity <= 0) {
            throw new InvalidReservationInputException("quantity must be positive, got " + effectiveQuantity);
        }
        String key = idempotencyKey == null || idempotencyKey.isBlank() ? null : idempotencyKey;
        if (key != null) {
            requireMaxLength("idempotencyKey", key, MAX_CORRELATION_ID_LENGTH);
        }

        return withStorageFaultTranslation("reserve", () ->
                engine.reserve(inventoryUnitId, externalBookingId, effectiveQuantity, key));
    }

    /**
     * @throws ResourceNotFoundException if no such reservation exists
     * @throws com.inventoryhold.reservation.exception.InvalidReservationStateException if it is not pending
     */
    public Reservation confirm(String reservationId) {
        UUID id = parseReservationId(reservationId)
                .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));
        return withStorageFaultTranslation("confirm", () -> engine.confirm(id));
    }

    /**
     * Compensating action. Succeeds for unknown and already-resolved reservations.
     */
    public CancelOutcome cancel(String reservationId) {
        Optional<UUID> id = parseReservationId(reservationId);
        if (id.isEmpty()) {
            log.info("Cancel of unknown reservation id {}: assuming already handled", reservationId);
            return CancelOutcome.ALREADY_HANDLED;
        }
        return withStorageFaultTranslation("cancel", () -> engine.cancel(id.get()));
    }

    /**
     * Expires overdue pending reservations as of now. Called by the expiry sweeper.
     */
    public int expireOverdueReservations() {
        LocalDateTime now = LocalDateTime.now(clock);
        return withStorageFaultTranslation("expire", () -> engine.expireOverdue(now));
    }

    public Reservation getReservation(String reservationId) {
        UUID id = parseReservationId(reservationId)
                .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));
        return withStorageFaultTranslation("get reservation", () -> engine.getReservation(id));
    }

    public InventoryUnit getInventoryUnit(String inventoryUnitId) {
        return withStorageFaultTranslation("get inventory unit", () -> engine.getInventoryUnit(inventoryUnitId));
    }

    private <T> T withStorageFaultTranslation(String operation, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException | TransactionException e) {
            log.warn("Storage fault during {}: {}", operation, e.getMessage());
            throw new ServiceUnavailableException(STORAGE_FAULT_MSG, e);
        }
    }

    private static void requireMaxLength(String field, String value, int maxLength) {
        if (value.length() > maxLength) {
            throw new InvalidReservationInputException(
                    field + " must be at most " + maxLength + " characters, got " + value.length());
        }
    }

    private Optional<UUID> parseReservationId(String reservationId) {
        if (reservationId == null || reservationId.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(reservationId));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
