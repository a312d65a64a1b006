package com.inventoryhold.reservation.domain.model;

/**
 * Result of a cancel call. Both values are successes.
 */
public enum CancelOutcome {
    /** The reservation was pending; it is now cancelled and its capacity is back on the unit. */
    CANCELLED,
    /** No such reservation, or it was already confirmed, cancelled or expired. Nothing changed. */
    ALREADY_HANDLED
}
