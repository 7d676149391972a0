package com.swipeengine.config;

import com.swipeengine.model.EntityType;
import com.swipeengine.repository.ClusteringResultStore;
import com.swipeengine.repository.EmbeddingSource;
import com.swipeengine.repository.IdSource;
import com.swipeengine.repository.PostEmbeddingRepository;
import com.swipeengine.repository.UserEmbeddingRepository;
import com.swipeengine.repository.jpa.JdbcIdSource;
import com.swipeengine.repository.jpa.JpaEmbeddingSource;
import com.swipeengine.service.batch.BatchCoordinator;
import com.swipeengine.service.batch.ClusterRecalculator;
import com.swipeengine.service.batch.EmbeddingBatchCollector;
import com.swipeengine.service.batch.EmbeddingRefresher;
import com.swipeengine.service.clustering.DbscanClustering;
import com.swipeengine.service.embedding.EmbeddingComputeService;
import com.swipeengine.service.embedding.HttpEmbeddingComputeService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Wiring of the batch pipeline: sources, clustering, refresh and the coordinator.
 */
@Slf4j
@Configuration
public class BatchConfiguration {

    private final SwipeEngineProperties properties;

    public BatchConfiguration(SwipeEngineProperties properties) {
        this.properties = properties;
    }

    @Bean
    public DbscanClustering dbscanClustering() {
        return new DbscanClustering(properties.getClustering().toDbscanConfig());
    }

    @Bean
    public EmbeddingBatchCollector embeddingBatchCollector() {
        return new EmbeddingBatchCollector(properties.getBatch().getBatchSize());
    }

    @Bean
    public ClusterRecalculator clusterRecalculator(EmbeddingBatchCollector collector,
                                                   DbscanClustering clustering,
                                                   ClusteringResultStore store) {
        return new ClusterRecalculator(collector, clustering, Optional.of(store));
    }

    @Bean
    public EmbeddingComputeService embeddingComputeService(WebClient webClient) {
        return new HttpEmbeddingComputeService(webClient, properties.getCompute());
    }

    @Bean
    public EmbeddingRefresher embeddingRefresher(EmbeddingComputeService computeService, JdbcTemplate jdbcTemplate) {
        SwipeEngineProperties.BatchConfig batch = properties.getBatch();
        return new EmbeddingRefresher(
                computeService,
                idSources(jdbcTemplate),
                batch.getBatchSize(),
                batch.getMaxItemsPerRun(),
                batch.getRefreshConcurrency());
    }

    @Bean
    public BatchCoordinator batchCoordinator(EmbeddingRefresher refresher,
                                             ClusterRecalculator recalculator,
                                             UserEmbeddingRepository userEmbeddings,
                                             PostEmbeddingRepository postEmbeddings,
                                             TaskScheduler batchTaskScheduler) {
        Map<EntityType, EmbeddingSource> embeddingSources = new EnumMap<>(EntityType.class);
        embeddingSources.put(EntityType.USER, new JpaEmbeddingSource(userEmbeddings));
        embeddingSources.put(EntityType.POST, new JpaEmbeddingSource(postEmbeddings));

        return new BatchCoordinator(refresher, recalculator, embeddingSources, batchTaskScheduler,
                properties.getBatch());
    }

    // ===========================
    // Private Helper Methods
    // ===========================

    private Map<EntityType, IdSource> idSources(JdbcTemplate jdbcTemplate) {
        Map<EntityType, IdSource> idSources = new EnumMap<>(EntityType.class);
        properties.getSources().forEach((key, source) -> {
            EntityType entityType = EntityType.fromValue(key);
            idSources.put(entityType, new JdbcIdSource(jdbcTemplate, source.getIdTable(), source.getIdColumn()));
            log.info("Listing {} ids from {}.{}", entityType, source.getIdTable(), source.getIdColumn());
        });
        return idSources;
    }
}
