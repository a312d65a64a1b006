package com.inventoryhold.reservation.domain.strategy;

import com.inventoryhold.common.exception.ResourceNotFoundException;
import com.inventoryhold.reservation.domain.model.InventoryUnit;
import com.inventoryhold.reservation.domain.repository.InventoryUnitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Capacity hold using a database row lock (SELECT FOR UPDATE).
 *
 * Flow:
 * 1. Lock the unit row; concurrent reserves on the same unit queue behind it
 * 2. Check available capacity
 * 3. Decrement (flushed by dirty checking at commit)
 * 4. Lock is released when the enclosing transaction commits or rolls back
 */
@Slf4j
@Component("pessimistic")
@RequiredArgsConstructor
public class PessimisticLockCapacityHoldStrategy implements CapacityHoldStrategy {

    private final InventoryUnitRepository inventoryUnitRepository;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void hold(String inventoryUnitId, int quantity, LocalDateTime now) {
        InventoryUnit unit = inventoryUnitRepository.findByIdForUpdate(inventoryUnitId)
                .orElseThrow(() -> new ResourceNotFoundException("InventoryUnit", inventoryUnitId));

        log.debug("Locked inventory unit {} (available {})", inventoryUnitId, unit.getAvailableCapacity());
        unit.hold(quantity, now);
    }

    @Override
    public String getStrategyType() {
        return "PESSIMISTIC_LOCK";
    }
}
