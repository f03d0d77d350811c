package com.eyelevel.documentindexer.service.credit;

import com.eyelevel.documentindexer.model.CreditReservation;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Reserve, then consume or cancel, credits for an operation. Every call is keyed by the
 * caller's operation id and may be repeated safely.
 */
public interface CreditLedger {

    /**
     * Holds {@code credits} for {@code operationId}. Returns the existing reservation when one
     * was already created for the operation.
     */
    CreditReservation createReservation(UUID userId, int credits, String operationId, Duration ttl);

    /**
     * Settles the reservation, charging {@code creditsConsumed} (at most the reserved amount).
     * Consuming an already consumed reservation does nothing.
     *
     * @throws com.eyelevel.documentindexer.exception.CreditReservationException if the reservation is
     *                                                                           missing, cancelled or expired.
     */
    CreditReservation consumeReservation(String operationId, String ledgerOperationId, int creditsConsumed);

    /**
     * Releases the reservation. Cancelling a cancelled or expired reservation does nothing.
     *
     * @throws com.eyelevel.documentindexer.exception.CreditReservationException if the reservation is
     *                                                                           missing or already consumed.
     */
    CreditReservation cancelReservation(String operationId);

    /**
     * Moves active reservations whose TTL elapsed before {@code now} to EXPIRED.
     *
     * @return number of reservations expired.
     */
    int expireStale(LocalDateTime now);
}
