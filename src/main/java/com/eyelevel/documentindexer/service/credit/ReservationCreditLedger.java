package com.eyelevel.documentindexer.service.credit;

import com.eyelevel.documentindexer.exception.CreditReservationException;
import com.eyelevel.documentindexer.model.CreditReservation;
import com.eyelevel.documentindexer.model.ReservationStatus;
import com.eyelevel.documentindexer.repository.CreditReservationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link CreditLedger} kept in the {@code credit_reservation} table. Reserve, consume and cancel join
 * the caller's transaction without demarcating their own, so a rejected ledger call does not mark
 * the job's transaction rollback-only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationCreditLedger implements CreditLedger {

    private final CreditReservationRepository creditReservationRepository;

    @Override
    public CreditReservation createReservation(UUID userId, int credits, String operationId, Duration ttl) {
        if (credits < 0) {
            throw new CreditReservationException("Cannot reserve a negative amount: " + credits);
        }
        Optional<CreditReservation> existing = creditReservationRepository.findByOperationId(operationId);
        if (existing.isPresent()) {
            log.info("Reservation for operation '{}' already exists with status {}. Reusing it.", operationId,
                     existing.get().getStatus());
            return existing.get();
        }
        CreditReservation reservation = CreditReservation.builder()
                                                         .userId(userId)
                                                         .operationId(operationId)
                                                         .creditsReserved(credits)
                                                         .status(ReservationStatus.ACTIVE)
                                                         .expiresAt(LocalDateTime.now().plus(ttl))
                                                         .build();
        CreditReservation saved = creditReservationRepository.saveAndFlush(reservation);
        log.info("Reserved {} credits for operation '{}' (reservation {}).", credits, operationId,
                 saved.getReservationId());
        return saved;
    }

    @Override
    public CreditReservation consumeReservation(String operationId, String ledgerOperationId, int creditsConsumed) {
        CreditReservation reservation = getByOperationId(operationId);
        return switch (reservation.getStatus()) {
            case ACTIVE -> {
                if (creditsConsumed < 0 || creditsConsumed > reservation.getCreditsReserved()) {
                    throw new CreditReservationException(
                            "Cannot consume " + creditsConsumed + " credits from a reservation of "
                            + reservation.getCreditsReserved() + " for operation '" + operationId + "'");
                }
                reservation.setCreditsConsumed(creditsConsumed);
                reservation.setLedgerOperationId(ledgerOperationId);
                reservation.setStatus(ReservationStatus.CONSUMED);
                CreditReservation saved = creditReservationRepository.saveAndFlush(reservation);
                log.info("Consumed {} of {} reserved credits for operation '{}'.", creditsConsumed,
                         reservation.getCreditsReserved(), operationId);
                yield saved;
            }
            case CONSUMED -> {
                log.info("Reservation for operation '{}' is already consumed. Nothing to do.", operationId);
                yield reservation;
            }
            case CANCELLED, EXPIRED -> throw new CreditReservationException(
                    "Reservation for operation '" + operationId + "' is " + reservation.getStatus()
                    + " and cannot be consumed");
        };
    }

    @Override
    public CreditReservation cancelReservation(String operationId) {
        CreditReservation reservation = getByOperationId(operationId);
        return switch (reservation.getStatus()) {
            case ACTIVE -> {
                reservation.setStatus(ReservationStatus.CANCELLED);
                CreditReservation saved = creditReservationRepository.saveAndFlush(reservation);
                log.info("Cancelled reservation of {} credits for operation '{}'.",
                         reservation.getCreditsReserved(), operationId);
                yield saved;
            }
            case CANCELLED, EXPIRED -> {
                log.info("Reservation for operation '{}' is already {}. Nothing to cancel.", operationId,
                         reservation.getStatus());
                yield reservation;
            }
            case CONSUMED -> throw new CreditReservationException(
                    "Reservation for operation '" + operationId + "' is already consumed and cannot be cancelled");
        };
    }

    @Override
    @Transactional
    public int expireStale(LocalDateTime now) {
        int expired = creditReservationRepository.expireActiveBefore(now, ReservationStatus.ACTIVE,
                                                                     ReservationStatus.EXPIRED);
        if (expired > 0) {
            log.info("Expired {} credit reservations past their TTL.", expired);
        }
        return expired;
    }

    private CreditReservation getByOperationId(String operationId) {
        return creditReservationRepository.findByOperationId(operationId)
                                          .orElseThrow(() -> new CreditReservationException(
                                                  "No reservation found for operation '" + operationId + "'"));
    }
}
