package com.eyelevel.documentindexer.model;

import com.eyelevel.documentindexer.model.converter.FloatVectorConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A vector computed for one chunk of a file with one embedding model.
 * <p>
 * (fileId, chunkIndex, embeddingModel) is unique and acts as the idempotency key of the embed
 * phase. Rows are never hard-deleted; {@code active = false} is a logical delete.
 * {@code chunkId} records which chunk the vector was computed from without a database constraint,
 * so re-chunking a file does not cascade into its embeddings.
 */
@Entity
@Table(name = "document_embedding",
       uniqueConstraints = @UniqueConstraint(name = "uq_embedding_file_chunk_model",
                                             columnNames = {"file_id", "chunk_index", "embedding_model"}),
       indexes = @Index(name = "idx_embedding_file_active", columnList = "file_id, is_active"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentEmbedding {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "embedding_id", updatable = false, nullable = false)
    private UUID embeddingId;

    @Column(name = "file_id", nullable = false)
    private UUID fileId;

    @Column(name = "chunk_id", nullable = false)
    private UUID chunkId;

    @Column(name = "chunk_index", nullable = false)
    private int chunkIndex;

    @Column(name = "embedding_model", nullable = false, length = 100)
    private String embeddingModel;

    @Column(nullable = false)
    private int dimension;

    @ToString.Exclude
    @Convert(converter = FloatVectorConverter.class)
    @Column(name = "embedding_vector", columnDefinition = "TEXT", nullable = false)
    private float[] vector;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "deactivated_at")
    private LocalDateTime deactivatedAt;
}
