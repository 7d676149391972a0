package com.swipeengine.entity;

import com.swipeengine.repository.converter.VectorConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

/**
 * Columns shared by the per-type embedding tables.
 */
@Data
@NoArgsConstructor
@MappedSuperclass
public abstract class EmbeddingEntity {

    @Id
    @Column(name = "entity_id", nullable = false, length = 64)
    private String entityId;

    @Convert(converter = VectorConverter.class)
    @Column(name = "embedding", columnDefinition = "vector")
    private float[] embedding;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb")
    private Map<String, Object> metadata;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected EmbeddingEntity(String entityId, float[] embedding, Map<String, Object> metadata) {
        this.entityId = entityId;
        this.embedding = embedding;
        this.metadata = metadata;
    }

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        updatedAt = Instant.now();
    }
}
