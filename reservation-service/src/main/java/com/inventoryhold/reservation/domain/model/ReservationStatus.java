package com.inventoryhold.reservation.domain.model;

/**
 * Reservation lifecycle. PENDING is the only non-terminal state, and nothing ever moves back into it.
 */
public enum ReservationStatus {
    PENDING,
    CONFIRMED,
    CANCELLED,
    EXPIRED;

    public boolean isTerminal() {
        return this != PENDING;
    }

    public boolean canTransitionTo(ReservationStatus target) {
        return this == PENDING && target.isTerminal();
    }
}
