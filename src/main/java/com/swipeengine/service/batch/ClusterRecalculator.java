package com.swipeengine.service.batch;

import com.swipeengine.model.ClusteringMetadata;
import com.swipeengine.model.ClusteringRecord;
import com.swipeengine.model.ClusteringResult;
import com.swipeengine.model.EntityType;
import com.swipeengine.model.PersistenceResult;
import com.swipeengine.repository.ClusteringResultSink;
import com.swipeengine.repository.EmbeddingSource;
import com.swipeengine.service.clustering.ClusteringOutput;
import com.swipeengine.service.clustering.DbscanClustering;
import com.swipeengine.service.clustering.DbscanConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Optional;

/**
 * Recalculates clusters of a population from its current embeddings.
 *
 * Flow:
 * 1. Collect every embedding of the entity type
 * 2. Short-circuit with an empty result when nothing can be clustered
 * 3. Run DBSCAN and score the partition
 * 4. Attach run metadata and persist through the sink, if any
 *
 * Collection and clustering errors propagate to the caller. Persistence is
 * best-effort: a failed save is logged and the computed result is still
 * returned.
 */
@Slf4j
public class ClusterRecalculator {

    private final EmbeddingBatchCollector collector;
    private final DbscanClustering clustering;
    private final ClusteringResultSink sink;

    public ClusterRecalculator(EmbeddingBatchCollector collector,
                               DbscanClustering clustering,
                               Optional<ClusteringResultSink> sink) {
        this.collector = collector;
        this.clustering = clustering;
        this.sink = sink.orElse(null);
    }

    public ClusterRecalculator(EmbeddingBatchCollector collector, DbscanClustering clustering) {
        this(collector, clustering, Optional.empty());
    }

    /**
     * Recalculate user clusters with the default DBSCAN parameters.
     */
    public ClusteringResult recalculateUserClusters(EmbeddingSource userEmbeddings) {
        return recalculate(EntityType.USER, userEmbeddings, null);
    }

    /**
     * Recalculate post clusters with the default DBSCAN parameters.
     */
    public ClusteringResult recalculatePostClusters(EmbeddingSource postEmbeddings) {
        return recalculate(EntityType.POST, postEmbeddings, null);
    }

    public ClusteringResult recalculate(EntityType entityType, EmbeddingSource source) {
        return recalculate(entityType, source, null);
    }

    /**
     * Recalculate clusters for one entity type.
     *
     * @param entityType population to cluster
     * @param source     where its embeddings live
     * @param overrides  DBSCAN parameters for this run, or null for the defaults
     * @return freshly computed result
     */
    public ClusteringResult recalculate(EntityType entityType, EmbeddingSource source, DbscanConfig overrides) {
        log.info("Recalculating {} clusters...", entityType);
        long startTime = System.nanoTime();

        CollectedBatch batch = collector.collect(source, entityType);

        if (batch.isEmpty()) {
            log.warn("No {} embeddings found for clustering ({} records read)", entityType, batch.getTotalItems());
            return ClusteringResult.empty(entityType, batch.getTotalItems(), Instant.now());
        }

        DbscanClustering algorithm = overrides != null ? clustering.withConfig(overrides) : clustering;
        ClusteringOutput output = algorithm.process(batch.getVectors(), batch.getEntities());

        ClusteringResult result = ClusteringResult.builder()
                .clusters(output.getClusters())
                .assignments(output.getAssignments())
                .quality(quality(output.getClusters().size(), batch.getTotalItems()))
                .converged(true)
                .iterations(1)
                .metadata(ClusteringMetadata.builder()
                        .totalItems(batch.getTotalItems())
                        .entityType(entityType)
                        .createdAt(Instant.now())
                        .build())
                .build();

        if (sink != null) {
            // Durability is best-effort: the error is reported and dropped here
            persist(ClusteringRecord.of(entityType, result)).ifFailure(error ->
                    log.error("Failed to persist {} clusters, returning unsaved result", entityType, error));
        }

        log.info("{} clustering finished in {}ms: {} clusters, {} assigned, {} noise, quality={}",
                entityType,
                (System.nanoTime() - startTime) / 1_000_000,
                result.getClusters().size(),
                result.getAssignments().size(),
                output.getNoiseCount(),
                String.format("%.2f", result.getQuality()));

        return result;
    }

    /**
     * min(1, clusters / sqrt(totalItems)), or 0 without clusters.
     */
    static double quality(int clusterCount, long totalItems) {
        if (clusterCount <= 0 || totalItems <= 0) {
            return 0.0;
        }
        return Math.min(1.0, clusterCount / Math.sqrt(totalItems));
    }

    /**
     * Wrap the sink call so that only its own failure becomes a result.
     */
    private PersistenceResult persist(ClusteringRecord record) {
        try {
            sink.saveClusteringResult(record);
            log.info("Persisted {} clusters for {}", record.getClusters().size(), record.getEntityType());
            return PersistenceResult.success();
        } catch (RuntimeException e) {
            return PersistenceResult.failure(e);
        }
    }
}
