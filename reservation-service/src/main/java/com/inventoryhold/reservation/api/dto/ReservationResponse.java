package com.inventoryhold.reservation.api.dto;

import com.inventoryhold.reservation.domain.model.Reservation;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Reservation view returned by reserve, confirm and lookup.
 */
public record ReservationResponse(
        UUID reservationId,
        String inventoryUnitId,
        String externalBookingId,
        Integer quantity,
        String status,
        LocalDateTime expiresAt,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static ReservationResponse from(Reservation reservation) {
        return new ReservationResponse(
                reservation.getId(),
                reservation.getInventoryUnitId(),
                reservation.getExternalBookingId(),
                reservation.getQuantity(),
                reservation.getStatus().name(),
                reservation.getExpiresAt(),
                reservation.getCreatedAt(),
                reservation.getUpdatedAt());
    }
}
