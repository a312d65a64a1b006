package com.inventoryhold.reservation.api.dto;

import com.inventoryhold.reservation.domain.model.InventoryUnit;

/**
 * Display-only view of a unit's capacity. May be stale by the time the caller acts on it.
 */
public record InventoryUnitResponse(
        String inventoryUnitId,
        String unitType,
        Integer totalCapacity,
        Integer availableCapacity
) {
    public static InventoryUnitResponse from(InventoryUnit unit) {
        return new InventoryUnitResponse(
                unit.getId(),
                unit.getUnitType(),
                unit.getTotalCapacity(),
                unit.getAvailableCapacity());
    }
}
