package com.inventoryhold.reservation.exception;

import com.inventoryhold.common.exception.BusinessException;

/**
 * Caller supplied a missing or malformed argument. Raised before any transaction is opened.
 */
public class InvalidReservationInputException extends BusinessException {

    public static final String ERROR_CODE = "INVALID_INPUT";

    public InvalidReservationInputException(String message) {
        super(message, ERROR_CODE);
    }
}
