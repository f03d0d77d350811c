package com.eyelevel.documentindexer.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Credits held for one operation until its outcome is known. The caller-supplied
 * {@code operationId} is unique, which makes every ledger call idempotent per job.
 */
@Entity
@Table(name = "credit_reservation",
       uniqueConstraints = @UniqueConstraint(name = "uq_reservation_operation", columnNames = "operation_id"),
       indexes = @Index(name = "idx_reservation_status_expires", columnList = "status, expires_at"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreditReservation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "reservation_id")
    private Long reservationId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "operation_id", nullable = false, updatable = false, length = 120)
    private String operationId;

    @Column(name = "credits_reserved", nullable = false)
    private int creditsReserved;

    @Builder.Default
    @Column(name = "credits_consumed", nullable = false)
    private int creditsConsumed = 0;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReservationStatus status;

    /**
     * Identifier of the ledger entry written when the reservation was consumed.
     */
    @Column(name = "ledger_operation_id", length = 140)
    private String ledgerOperationId;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
