package com.eyelevel.documentindexer.model;

import com.eyelevel.documentindexer.model.converter.JsonMapConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A window of converted text belonging to exactly one file. The whole set for a file is replaced
 * each time the file is re-chunked.
 */
@Entity
@Table(name = "document_chunk",
       uniqueConstraints = @UniqueConstraint(name = "uq_chunk_file_index", columnNames = {"file_id", "chunk_index"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentChunk {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "chunk_id", updatable = false, nullable = false)
    private UUID chunkId;

    @Column(name = "file_id", nullable = false)
    private UUID fileId;

    @Column(name = "chunk_index", nullable = false)
    private int chunkIndex;

    @Column(name = "chunk_text", columnDefinition = "TEXT", nullable = false)
    private String chunkText;

    @Column(name = "token_count", nullable = false)
    private int tokenCount;

    @Column(name = "source_page_start")
    private Integer sourcePageStart;

    @Column(name = "source_page_end")
    private Integer sourcePageEnd;

    @Builder.Default
    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> metadata = new HashMap<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
