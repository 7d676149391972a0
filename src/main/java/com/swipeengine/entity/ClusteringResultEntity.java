package com.swipeengine.entity;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the clustering_results table.
 * One row per persisted clustering run; the newest row per entity type is current.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "clustering_results", indexes = {
        @Index(name = "idx_clustering_type_created", columnList = "entity_type, created_at")
})
public class ClusteringResultEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "entity_type", nullable = false, length = 16)
    private String entityType;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "clusters", nullable = false, columnDefinition = "jsonb")
    private JsonNode clusters;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "assignments", nullable = false, columnDefinition = "jsonb")
    private JsonNode assignments;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata", columnDefinition = "jsonb")
    private JsonNode metadata;

    @Column(name = "quality", nullable = false)
    private double quality;

    // Stats
    @Column(name = "cluster_count", nullable = false)
    private int clusterCount;

    @Column(name = "total_items", nullable = false)
    private long totalItems;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
