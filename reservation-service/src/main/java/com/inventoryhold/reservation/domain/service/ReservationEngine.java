package com.inventoryhold.reservation.domain.service;

import com.inventoryhold.common.exception.ResourceNotFoundException;
import com.inventoryhold.reservation.domain.model.CancelOutcome;
import com.inventoryhold.reservation.domain.model.InventoryUnit;
import com.inventoryhold.reservation.domain.model.Reservation;
import com.inventoryhold.reservation.domain.model.ReserveIdempotency;
import com.inventoryhold.reservation.domain.repository.InventoryUnitRepository;
import com.inventoryhold.reservation.domain.repository.ReservationRepository;
import com.inventoryhold.reservation.domain.repository.ReserveIdempotencyRepository;
import com.inventoryhold.reservation.domain.strategy.CapacityHoldStrategy;
import com.inventoryhold.reservation.exception.InvalidReservationInputException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Transactional state machine over the inventory store and the reservation ledger.
 *
 * Every public method is one atomic unit of work: either all of its row changes commit or none do.
 * Lock order is reservation row first, then unit row; reserve locks only the unit and inserts a new
 * reservation, so no two operations can wait on each other in a cycle.
 *
 * Arguments are expected to be validated already; see {@link ReservationService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationEngine {

    static final String DEFAULT_STRATEGY = "pessimistic";

    /**
     * All CapacityHoldStrategy beans keyed by bean name.
     */
    private final Map<String, CapacityHoldStrategy> holdStrategies;
    private final InventoryUnitRepository inventoryUnitRepository;
    private final ReservationRepository reservationRepository;
    private final ReserveIdempotencyRepository reserveIdempotencyRepository;
    private final Clock clock;

    @Value("${inventory.reservation.strategy:pessimistic}")
    private String strategyType = DEFAULT_STRATEGY;

    @Value("${inventory.reservation.hold-ttl-minutes:15}")
    private int holdTtlMinutes = 15;

    @PostConstruct
    public void init() {
        log.info("Initialized ReservationEngine with strategy {} and hold window of {} min",
                getHoldStrategy().getStrategyType(), holdTtlMinutes);
    }

    /**
     * Takes capacity from the unit and records a PENDING reservation that expires after the hold window.
     * With an idempotency key that was already used, returns the reservation it produced instead.
     */
    @Transactional
    public Reservation reserve(String inventoryUnitId, String externalBookingId, int quantity, String idempotencyKey) {
        if (idempotencyKey != null) {
            Optional<Reservation> replay = findReplay(idempotencyKey, inventoryUnitId, externalBookingId, quantity);
            if (replay.isPresent()) {
                return replay.get();
            }
        }

        LocalDateTime now = LocalDateTime.now(clock);
        getHoldStrategy().hold(inventoryUnitId, quantity, now);

        Reservation reservation = reservationRepository.save(Reservation.pending(
                inventoryUnitId, externalBookingId, quantity, now, now.plusMinutes(holdTtlMinutes)));

        if (idempotencyKey != null) {
            reserveIdempotencyRepository.save(new ReserveIdempotency(idempotencyKey, reservation.getId(), now));
        }

        log.info("Reserved {} on inventory unit {} for booking {}: reservation {} expires at {}",
                quantity, inventoryUnitId, externalBookingId, reservation.getId(), reservation.getExpiresAt());
        return reservation;
    }

    /**
     * PENDING → CONFIRMED. Capacity stays deducted for good, so the unit row is not touched.
     *
     * @throws com.inventoryhold.reservation.exception.InvalidReservationStateException unless the
     *         reservation is PENDING, including on a second confirm
     */
    @Transactional
    public Reservation confirm(UUID reservationId) {
        Reservation reservation = reservationRepository.findByIdForUpdate(reservationId)
                .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));

        reservation.confirm(LocalDateTime.now(clock));

        log.info("Confirmed reservation {} (unit {}, booking {})",
                reservationId, reservation.getInventoryUnitId(), reservation.getExternalBookingId());
        return reservation;
    }

    /**
     * Compensating action: PENDING → CANCELLED and the held quantity goes back to the unit.
     * Absent or already-resolved reservations are reported as handled, not as errors.
     */
    @Transactional
    public CancelOutcome cancel(UUID reservationId) {
        Optional<Reservation> locked = reservationRepository.findByIdForUpdate(reservationId);
        if (locked.isEmpty() || !locked.get().isPending()) {
            log.info("Cancel of reservation {}: not found or not pending ({}), assuming already handled",
                    reservationId, locked.map(r -> r.getStatus().name()).orElse("absent"));
            return CancelOutcome.ALREADY_HANDLED;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        Reservation reservation = locked.get();
        reservation.cancel(now);
        creditUnit(reservation.getInventoryUnitId(), reservation.getQuantity(), now);

        log.info("Cancelled reservation {}, released {} on inventory unit {}",
                reservationId, reservation.getQuantity(), reservation.getInventoryUnitId());
        return CancelOutcome.CANCELLED;
    }

    /**
     * Expires every PENDING reservation whose hold window ended before {@code now} and gives its
     * quantity back, all in one transaction.
     *
     * Rows are re-checked after locking; one that a concurrent confirm or cancel resolved first is
     * skipped. Units are credited once per unit, in ascending id order.
     *
     * @return number of reservations expired
     */
    @Transactional
    public int expireOverdue(LocalDateTime now) {
        List<Reservation> overdue = reservationRepository.findOverduePendingForUpdate(now);
        if (overdue.isEmpty()) {
            return 0;
        }

        Map<String, Integer> releasedByUnit = new TreeMap<>();
        int expired = 0;
        for (Reservation reservation : overdue) {
            if (!reservation.isOverdue(now)) {
                log.debug("Skipping reservation {}: already {}", reservation.getId(), reservation.getStatus());
                continue;
            }
            reservation.expire(now);
            releasedByUnit.merge(reservation.getInventoryUnitId(), reservation.getQuantity(), Integer::sum);
            expired++;
        }

        releasedByUnit.forEach((unitId, quantity) -> creditUnit(unitId, quantity, now));
        return expired;
    }

    @Transactional(readOnly = true)
    public Reservation getReservation(UUID reservationId) {
        return reservationRepository.findById(reservationId)
                .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));
    }

    /**
     * Non-authoritative snapshot of a unit; never use it to decide whether a reserve will succeed.
     */
    @Transactional(readOnly = true)
    public InventoryUnit getInventoryUnit(String inventoryUnitId) {
        return inventoryUnitRepository.findById(inventoryUnitId)
                .orElseThrow(() -> new ResourceNotFoundException("InventoryUnit", inventoryUnitId));
    }

    private Optional<Reservation> findReplay(String idempotencyKey, String inventoryUnitId,
                                             String externalBookingId, int quantity) {
        return reserveIdempotencyRepository.findById(idempotencyKey)
                .map(record -> reservationRepository.findById(record.getReservationId())
                        .orElseThrow(() -> new IllegalStateException(
                                "Idempotency key " + idempotencyKey + " points to missing reservation "
                                        + record.getReservationId())))
                .map(previous -> {
                    boolean sameRequest = previous.getInventoryUnitId().equals(inventoryUnitId)
                            && previous.getExternalBookingId().equals(externalBookingId)
                            && previous.getQuantity() == quantity;
                    if (!sameRequest) {
                        throw new InvalidReservationInputException(
                                "Idempotency key " + idempotencyKey + " was already used for a different reserve request");
                    }
                    log.info("Idempotent replay of reservation {} for key {}", previous.getId(), idempotencyKey);
                    return previous;
                });
    }

    private void creditUnit(String inventoryUnitId, int quantity, LocalDateTime now) {
        inventoryUnitRepository.findByIdForUpdate(inventoryUnitId)
                .ifPresentOrElse(
                        unit -> {
                            unit.release(quantity, now);
                            log.debug("Credited {} back to inventory unit {} (available {})",
                                    quantity, inventoryUnitId, unit.getAvailableCapacity());
                        },
                        () -> log.warn("Inventory unit {} no longer exists; {} released units were dropped",
                                inventoryUnitId, quantity));
    }

    /**
     * Looks up the configured strategy by bean name, falling back to pessimistic.
     */
    private CapacityHoldStrategy getHoldStrategy() {
        CapacityHoldStrategy strategy = holdStrategies.get(strategyType.toLowerCase());
        if (strategy == null) {
            log.warn("Unknown capacity hold strategy: {}. Available strategies: {}. Defaulting to {}",
                    strategyType, holdStrategies.keySet(), DEFAULT_STRATEGY);
            strategy = holdStrategies.get(DEFAULT_STRATEGY);
            if (strategy == null) {
                throw new IllegalStateException(
                        DEFAULT_STRATEGY + " strategy not found. Available strategies: " + holdStrategies.keySet());
            }
        }
        return strategy;
    }
}
