package com.eyelevel.documentindexer.exception;

import java.io.Serial;

/**
 * Thrown when a ledger call contradicts the current state of a reservation, for example consuming a
 * reservation that was already cancelled.
 */
public class CreditReservationException extends IndexingException {
    @Serial
    private static final long serialVersionUID = -8807321937146712002L;

    public CreditReservationException(String message) {
        super(message);
    }
}
