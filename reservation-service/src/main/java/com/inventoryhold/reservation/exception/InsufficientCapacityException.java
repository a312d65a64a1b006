package com.inventoryhold.reservation.exception;

import com.inventoryhold.common.exception.BusinessException;

/**
 * Reserve could not be satisfied from the unit's available capacity.
 * Retrying only makes sense once other holds have been cancelled or expired.
 */
public class InsufficientCapacityException extends BusinessException {

    public static final String ERROR_CODE = "INSUFFICIENT_CAPACITY";

    public InsufficientCapacityException(String inventoryUnitId, int requested, int available) {
        super(String.format("Insufficient capacity on inventory unit %s: requested %d, available %d",
                inventoryUnitId, requested, available), ERROR_CODE);
    }

    public InsufficientCapacityException(String inventoryUnitId, int requested) {
        super(String.format("Insufficient capacity on inventory unit %s when reserving %d",
                inventoryUnitId, requested), ERROR_CODE);
    }
}
