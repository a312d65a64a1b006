package com.inventoryhold.reservation.exception;

import com.inventoryhold.common.exception.BusinessException;
import com.inventoryhold.reservation.domain.model.ReservationStatus;
import lombok.Getter;

import java.util.UUID;

/**
 * A transition was requested on a reservation that already left PENDING.
 * Raised by confirm so the orchestrator can tell a double-confirm apart from a success.
 */
@Getter
public class InvalidReservationStateException extends BusinessException {

    public static final String ERROR_CODE = "INVALID_STATE";

    private final ReservationStatus currentStatus;

    public InvalidReservationStateException(UUID reservationId, ReservationStatus currentStatus,
                                            ReservationStatus requestedStatus) {
        super(String.format("Reservation %s is %s and cannot become %s",
                reservationId, currentStatus, requestedStatus), ERROR_CODE);
        this.currentStatus = currentStatus;
    }
}
