package com.inventoryhold.reservation.domain.strategy;

import java.time.LocalDateTime;

/**
 * Concurrency-control mechanism used by reserve to take capacity from an inventory unit.
 *
 * Implementations (bean names):
 * - pessimistic: SELECT FOR UPDATE on the unit row, check, decrement
 * - distributed: Redisson lock per unit around a guarded atomic UPDATE
 *
 * Implementations join the caller's transaction, so the deduction commits or rolls back together
 * with the reservation row.
 */
public interface CapacityHoldStrategy {

    /**
     * Takes {@code quantity} from the unit's available capacity and stamps the unit with {@code now}.
     *
     * @throws com.inventoryhold.common.exception.ResourceNotFoundException if the unit does not exist
     * @throws com.inventoryhold.reservation.exception.InsufficientCapacityException if less than
     *         {@code quantity} is available
     */
    void hold(String inventoryUnitId, int quantity, LocalDateTime now);

    /**
     * @return strategy type (PESSIMISTIC_LOCK, DISTRIBUTED_LOCK)
     */
    String getStrategyType();
}
