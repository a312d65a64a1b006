package com.inventoryhold.reservation.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * Request body for reserving capacity on an inventory unit.
 *
 * @param externalBookingId caller's correlation id, stored as-is
 * @param quantity          optional, defaults to 1
 * @param idempotencyKey    optional. Repeating a request with the same key returns the same reservation.
 */
public record ReserveRequest(
        @NotBlank(message = "externalBookingId is required")
        @Size(max = 255, message = "externalBookingId must be at most 255 characters")
        String externalBookingId,

        @Positive(message = "Quantity must be positive")
        Integer quantity,

        @Size(max = 255, message = "idempotencyKey must be at most 255 characters")
        String idempotencyKey
) {
}
