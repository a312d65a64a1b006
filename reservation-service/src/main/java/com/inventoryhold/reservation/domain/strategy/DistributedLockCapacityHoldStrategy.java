package com.inventoryhold.reservation.domain.strategy;

import com.inventoryhold.common.exception.ResourceNotFoundException;
import com.inventoryhold.common.exception.ServiceUnavailableException;
import com.inventoryhold.reservation.domain.repository.InventoryUnitRepository;
import com.inventoryhold.reservation.exception.InsufficientCapacityException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.concurrent.TimeUnit;

/**
 * Capacity hold using a Redisson lock per unit plus a guarded atomic UPDATE.
 *
 * The Redis lock queues reserves for the same unit across service instances before they reach the
 * database. The UPDATE itself is what prevents oversell:
 *
 *   UPDATE inventory_units
 *   SET available_capacity = available_capacity - :quantity, updated_at = :now
 *   WHERE id = :id AND available_capacity >= :quantity;
 *
 * It takes the row lock until the enclosing transaction ends, so cancel and the expiry sweeper
 * (which lock the same row) stay serialized with it.
 */
@Slf4j
@Component("distributed")
@ConditionalOnProperty(name = "inventory.reservation.strategy", havingValue = "distributed")
@RequiredArgsConstructor
public class DistributedLockCapacityHoldStrategy implements CapacityHoldStrategy {

    static final String LOCK_PREFIX = "lock:inventory-unit:";

    private final InventoryUnitRepository inventoryUnitRepository;
    private final RedissonClient redissonClient;

    @Value("${inventory.reservation.lock-wait-seconds:5}")
    private long lockWaitSeconds = 5;

    @Value("${inventory.reservation.lock-lease-seconds:30}")
    private long lockLeaseSeconds = 30;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void hold(String inventoryUnitId, int quantity, LocalDateTime now) {
        String lockKey = LOCK_PREFIX + inventoryUnitId;
        RLock lock = redissonClient.getLock(lockKey);

        try {
            boolean acquired = lock.tryLock(lockWaitSeconds, lockLeaseSeconds, TimeUnit.SECONDS);
            if (!acquired) {
                throw new ServiceUnavailableException(
                        "Timed out waiting for lock on inventory unit " + inventoryUnitId + ". Please retry.");
            }

            log.debug("Acquired distributed lock: {}", lockKey);
            holdWithAtomicUpdate(inventoryUnitId, quantity, now);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException("Interrupted while waiting for lock on inventory unit "
                    + inventoryUnitId, e);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("Released distributed lock: {}", lockKey);
            }
        }
    }

    @Override
    public String getStrategyType() {
        return "DISTRIBUTED_LOCK";
    }

    private void holdWithAtomicUpdate(String inventoryUnitId, int quantity, LocalDateTime now) {
        int updatedRows = inventoryUnitRepository.decreaseCapacityAtomically(inventoryUnitId, quantity, now);
        if (updatedRows == 1) {
            return;
        }
        // 0 rows: either no such unit or not enough capacity
        if (!inventoryUnitRepository.existsById(inventoryUnitId)) {
            throw new ResourceNotFoundException("InventoryUnit", inventoryUnitId);
        }
        throw new InsufficientCapacityException(inventoryUnitId, quantity);
    }
}
