package com.swipeengine.repository;

import com.swipeengine.entity.ClusteringResultEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository for persisted clustering runs.
 */
@Repository
public interface ClusteringResultRepository extends JpaRepository<ClusteringResultEntity, UUID> {

    /**
     * Most recent run for an entity type.
     */
    Optional<ClusteringResultEntity> findFirstByEntityTypeOrderByCreatedAtDesc(String entityType);
}
