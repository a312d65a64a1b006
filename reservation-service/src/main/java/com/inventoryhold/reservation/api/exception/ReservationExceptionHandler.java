package com.inventoryhold.reservation.api.exception;

import com.inventoryhold.common.dto.BaseResponse;
import com.inventoryhold.reservation.exception.InsufficientCapacityException;
import com.inventoryhold.reservation.exception.InvalidReservationStateException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Conflicts with current inventory or reservation state are 409, not the generic 400 of
 * {@link com.inventoryhold.common.exception.GlobalExceptionHandler}.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ReservationExceptionHandler {

    @ExceptionHandler(InsufficientCapacityException.class)
    public ResponseEntity<BaseResponse<Void>> handleInsufficientCapacity(InsufficientCapacityException ex) {
        log.info("Reserve rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(InvalidReservationStateException.class)
    public ResponseEntity<BaseResponse<Void>> handleInvalidState(InvalidReservationStateException ex) {
        log.warn("Invalid reservation transition: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode()));
    }
}
