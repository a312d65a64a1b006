package com.inventoryhold.reservation.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Records which reservation a caller-supplied idempotency key produced.
 * Written in the same transaction as the reservation itself.
 *
 * Always inserted, never merged: two concurrent reserves with the same key must collide on the
 * primary key instead of one silently overwriting the other.
 */
@Entity
@Table(name = "reserve_idempotency")
@Getter
@NoArgsConstructor
public class ReserveIdempotency implements Persistable<String> {

    @Id
    @Column(name = "idempotency_key", length = 255)
    private String idempotencyKey;

    @Column(name = "reservation_id", nullable = false)
    private UUID reservationId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Transient
    private boolean fresh = true;

    public ReserveIdempotency(String idempotencyKey, UUID reservationId, LocalDateTime createdAt) {
        this.idempotencyKey = idempotencyKey;
        this.reservationId = reservationId;
        this.createdAt = createdAt;
    }

    @Override
    public String getId() {
        return idempotencyKey;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        fresh = false;
    }
}
