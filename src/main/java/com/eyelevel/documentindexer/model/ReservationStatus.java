package com.eyelevel.documentindexer.model;

/**
 * Lifecycle of a {@link CreditReservation}. A reservation leaves {@code ACTIVE} exactly once.
 */
public enum ReservationStatus {
    /**
     * Credits are held and waiting for the job outcome.
     */
    ACTIVE,
    /**
     * The job succeeded and the actual cost was charged.
     */
    CONSUMED,
    /**
     * The job failed and the held credits were released.
     */
    CANCELLED,
    /**
     * The hold outlived its TTL and was released by the expiry sweep.
     */
    EXPIRED
}
