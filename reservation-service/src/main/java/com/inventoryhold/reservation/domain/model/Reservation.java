package com.inventoryhold.reservation.domain.model;

import com.inventoryhold.reservation.exception.InvalidReservationStateException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A capacity hold on one inventory unit for one external booking.
 *
 * While PENDING the quantity is already deducted from the unit and {@code expiresAt} is set.
 * Leaving PENDING clears {@code expiresAt}. Rows are never deleted.
 */
@Entity
@Table(name = "reservations", indexes = {
        @Index(name = "idx_reservations_status_expires", columnList = "status,expires_at"),
        @Index(name = "idx_reservations_unit", columnList = "inventory_unit_id")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Reservation {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "inventory_unit_id", nullable = false, updatable = false, length = 64)
    private String inventoryUnitId;

    @Column(name = "external_booking_id", nullable = false, updatable = false)
    private String externalBookingId;

    @Column(name = "quantity", nullable = false, updatable = false)
    private Integer quantity;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ReservationStatus status;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * @param now the caller's clock reading; becomes {@code createdAt} so it lines up with {@code expiresAt}
     */
    public static Reservation pending(String inventoryUnitId, String externalBookingId,
                                      int quantity, LocalDateTime now, LocalDateTime expiresAt) {
        return Reservation.builder()
                .inventoryUnitId(inventoryUnitId)
                .externalBookingId(externalBookingId)
                .quantity(quantity)
                .status(ReservationStatus.PENDING)
                .expiresAt(expiresAt)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public boolean isPending() {
        return status == ReservationStatus.PENDING;
    }

    /**
     * True when the hold window has elapsed strictly before {@code now}.
     */
    public boolean isOverdue(LocalDateTime now) {
        return isPending() && expiresAt != null && expiresAt.isBefore(now);
    }

    public void confirm(LocalDateTime now) {
        transitionTo(ReservationStatus.CONFIRMED, now);
    }

    public void cancel(LocalDateTime now) {
        transitionTo(ReservationStatus.CANCELLED, now);
    }

    public void expire(LocalDateTime now) {
        transitionTo(ReservationStatus.EXPIRED, now);
    }

    private void transitionTo(ReservationStatus target, LocalDateTime now) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidReservationStateException(id, status, target);
        }
        status = target;
        expiresAt = null;
        updatedAt = now;
    }
}
