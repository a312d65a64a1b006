package com.inventoryhold.reservation.domain.repository;

import com.inventoryhold.reservation.domain.model.Reservation;
import com.inventoryhold.reservation.domain.model.ReservationStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ReservationRepository extends JpaRepository<Reservation, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Reservation r WHERE r.id = :id")
    Optional<Reservation> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Pending reservations whose hold window ended before {@code now}, locked in id order.
     * Served by the (status, expires_at) index.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
           SELECT r FROM Reservation r
           WHERE r.status = :status
             AND r.expiresAt < :now
           ORDER BY r.id
           """)
    List<Reservation> findOverdueForUpdate(@Param("status") ReservationStatus status,
                                           @Param("now") LocalDateTime now);

    default List<Reservation> findOverduePendingForUpdate(LocalDateTime now) {
        return findOverdueForUpdate(ReservationStatus.PENDING, now);
    }
}
