package com.swipeengine.repository.jpa;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.swipeengine.config.CacheConfiguration;
import com.swipeengine.entity.ClusteringResultEntity;
import com.swipeengine.model.Cluster;
import com.swipeengine.model.ClusteringMetadata;
import com.swipeengine.model.ClusteringRecord;
import com.swipeengine.model.EntityType;
import com.swipeengine.repository.ClusteringResultRepository;
import com.swipeengine.repository.ClusteringResultStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Clustering result store on the clustering_results table.
 *
 * Clusters, assignments and run metadata are stored as jsonb documents. The
 * latest result per entity type is cached and evicted on every save.
 */
@Slf4j
@Repository
public class JpaClusteringResultStore implements ClusteringResultStore {

    private static final TypeReference<List<Cluster>> CLUSTER_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, String>> ASSIGNMENTS = new TypeReference<>() {
    };

    private final ClusteringResultRepository repository;
    private final ObjectMapper objectMapper;

    public JpaClusteringResultStore(ClusteringResultRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional
    @CacheEvict(cacheNames = CacheConfiguration.LATEST_CLUSTERING_CACHE, key = "#record.entityType")
    public void saveClusteringResult(ClusteringRecord record) {
        ClusteringResultEntity entity = ClusteringResultEntity.builder()
                .entityType(record.getEntityType().getValue())
                .clusters(objectMapper.valueToTree(record.getClusters()))
                .assignments(objectMapper.valueToTree(record.getAssignments()))
                .metadata(objectMapper.valueToTree(record.getMetadata()))
                .quality(record.getQuality())
                .clusterCount(record.getClusters().size())
                .totalItems(record.getMetadata() != null ? record.getMetadata().getTotalItems() : 0L)
                .createdAt(record.getCreatedAt())
                .build();

        ClusteringResultEntity saved = repository.save(entity);
        log.debug("Saved {} clustering result {}", record.getEntityType(), saved.getId());
    }

    @Override
    @Transactional(readOnly = true)
    @Cacheable(cacheNames = CacheConfiguration.LATEST_CLUSTERING_CACHE, key = "#entityType")
    public Optional<ClusteringRecord> findLatest(EntityType entityType) {
        return repository.findFirstByEntityTypeOrderByCreatedAtDesc(entityType.getValue())
                .map(this::toRecord);
    }

    ClusteringRecord toRecord(ClusteringResultEntity entity) {
        return ClusteringRecord.builder()
                .entityType(EntityType.fromValue(entity.getEntityType()))
                .clusters(objectMapper.convertValue(entity.getClusters(), CLUSTER_LIST))
                .assignments(objectMapper.convertValue(entity.getAssignments(), ASSIGNMENTS))
                .quality(entity.getQuality())
                .metadata(entity.getMetadata() != null
                        ? objectMapper.convertValue(entity.getMetadata(), ClusteringMetadata.class)
                        : null)
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
