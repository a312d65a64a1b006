package com.inventoryhold.reservation.domain.repository;

import com.inventoryhold.reservation.domain.model.InventoryUnit;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Inventory store. Every capacity mutation goes through one of the locking methods below;
 * plain {@link #findById} reads are for display only.
 */
public interface InventoryUnitRepository extends JpaRepository<InventoryUnit, String> {

    /**
     * Loads the unit with SELECT FOR UPDATE. Other lockers of the same row wait until the
     * current transaction ends and then see its committed capacity.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM InventoryUnit u WHERE u.id = :id")
    Optional<InventoryUnit> findByIdForUpdate(@Param("id") String id);

    /**
     * Single guarded UPDATE used by the distributed strategy.
     *
     * Returns 1 when capacity was taken, 0 when the unit is missing or has less than
     * {@code quantity} available. The guard keeps capacity non-negative even without the
     * distributed lock. Bypasses entity callbacks, so {@code updatedAt} is set here.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           UPDATE InventoryUnit u
           SET u.availableCapacity = u.availableCapacity - :quantity,
               u.updatedAt = :now
           WHERE u.id = :id
             AND u.availableCapacity >= :quantity
           """)
    int decreaseCapacityAtomically(@Param("id") String id, @Param("quantity") int quantity,
                                   @Param("now") LocalDateTime now);
}
