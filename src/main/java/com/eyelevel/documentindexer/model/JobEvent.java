package com.eyelevel.documentindexer.model;

import com.eyelevel.documentindexer.model.converter.JsonMapConverter;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One entry of a job's append-only timeline. Rows are written once and never updated;
 * {@code sequenceNo} gives a stable order even when two events share a timestamp.
 */
@Entity
@Immutable
@Table(name = "indexing_job_event",
       uniqueConstraints = @UniqueConstraint(name = "uq_job_event_sequence", columnNames = {"job_id", "sequence_no"}))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "job")
public class JobEvent {

    public static final int MAX_MESSAGE_LENGTH = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "event_id", updatable = false, nullable = false)
    private UUID eventId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "job_id", nullable = false, updatable = false)
    private IndexingJob job;

    @Column(name = "sequence_no", nullable = false, updatable = false)
    private int sequenceNo;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 40, updatable = false)
    private JobEventType eventType;

    @Enumerated(EnumType.STRING)
    @Column(length = 20, updatable = false)
    private PipelinePhase phase;

    @Column(name = "progress_pct", updatable = false)
    private Integer progressPct;

    @Column(length = MAX_MESSAGE_LENGTH, updatable = false)
    private String message;

    @Builder.Default
    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT", nullable = false, updatable = false)
    private Map<String, Object> payload = new HashMap<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
