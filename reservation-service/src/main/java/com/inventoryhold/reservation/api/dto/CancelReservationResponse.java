package com.inventoryhold.reservation.api.dto;

import com.inventoryhold.reservation.domain.model.CancelOutcome;

public record CancelReservationResponse(
        String reservationId,
        CancelOutcome outcome
) {
}
