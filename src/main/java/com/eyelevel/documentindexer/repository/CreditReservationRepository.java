package com.eyelevel.documentindexer.repository;

import com.eyelevel.documentindexer.model.CreditReservation;
import com.eyelevel.documentindexer.model.ReservationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Spring Data JPA repository for the {@link CreditReservation} entity.
 */
@Repository
public interface CreditReservationRepository extends JpaRepository<CreditReservation, Long> {

    Optional<CreditReservation> findByOperationId(String operationId);

    @Transactional
    @Modifying
    @Query("UPDATE CreditReservation r SET r.status = :expired WHERE r.status = :active AND r.expiresAt < :now")
    int expireActiveBefore(@Param("now") LocalDateTime now,
                           @Param("active") ReservationStatus active,
                           @Param("expired") ReservationStatus expired);
}
