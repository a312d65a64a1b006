package com.inventoryhold.reservation.domain.model;

import com.inventoryhold.reservation.exception.InsufficientCapacityException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A bookable unit with finite capacity (a flight's seats, a room type's rooms, a car class's fleet).
 *
 * Units are provisioned upstream. This service only moves {@code availableCapacity}, and only while
 * holding the row lock.
 */
@Entity
@Table(name = "inventory_units")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryUnit {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "unit_type", nullable = false, length = 32)
    private String unitType;

    @Column(name = "total_capacity", nullable = false)
    private Integer totalCapacity;

    @Column(name = "available_capacity", nullable = false)
    private Integer availableCapacity;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * Defaults for rows provisioned without timestamps. Capacity moves set {@code updatedAt}
     * themselves from the engine's clock.
     */
    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        if (availableCapacity == null) {
            availableCapacity = totalCapacity;
        }
    }

    /**
     * Takes {@code quantity} units out of the available capacity.
     * Caller must hold the row lock.
     */
    public void hold(int quantity, LocalDateTime now) {
        if (availableCapacity < quantity) {
            throw new InsufficientCapacityException(id, quantity, availableCapacity);
        }
        availableCapacity -= quantity;
        updatedAt = now;
    }

    /**
     * Gives back capacity taken by a pending reservation that was cancelled or expired.
     * Caller must hold the row lock.
     */
    public void release(int quantity, LocalDateTime now) {
        availableCapacity += quantity;
        updatedAt = now;
    }
}
