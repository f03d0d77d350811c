package com.eyelevel.documentindexer.scheduler;

import com.eyelevel.documentindexer.service.credit.CreditLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Periodically expires credit reservations whose job never consumed or cancelled them, for
 * example because the process died mid-pipeline.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationExpiryScheduler {

    private final CreditLedger creditLedger;

    @Scheduled(fixedDelayString = "${app.scheduler.reservation-expiry-interval-ms:60000}")
    public void expireReservations() {
        log.debug("Starting scheduled credit reservation expiry sweep...");
        try {
            creditLedger.expireStale(LocalDateTime.now());
        } catch (Exception e) {
            log.error("Credit reservation expiry sweep failed. It will run again on the next schedule.", e);
        }
    }
}
