package com.inventoryhold.reservation.domain.repository;

import com.inventoryhold.reservation.domain.model.ReserveIdempotency;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ReserveIdempotencyRepository extends JpaRepository<ReserveIdempotency, String> {
}
