package com.swipeengine.config;

import com.swipeengine.model.EntityType;
import com.swipeengine.service.clustering.DbscanConfig;
import com.swipeengine.service.similarity.DistanceFunction;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the swipe engine.
 */
@Data
@Component
@ConfigurationProperties(prefix = "swipe")
public class SwipeEngineProperties {

    private BatchConfig batch = new BatchConfig();
    private ClusteringConfig clustering = new ClusteringConfig();
    private ComputeConfig compute = new ComputeConfig();
    private Map<String, SourceConfig> sources = new HashMap<>();
    private CacheConfig cache = new CacheConfig();

    @Data
    public static class BatchConfig {
        private boolean autoStart = true;
        private Duration embeddingUpdateInterval = Duration.ofHours(12);
        private Duration clusteringInterval = Duration.ofHours(24);
        private int batchSize = 100;
        private int maxItemsPerRun = 5000;
        private int refreshConcurrency = 16;
        private List<EntityType> clusterEntityTypes = new ArrayList<>(List.of(EntityType.POST));
    }

    @Data
    public static class ClusteringConfig {
        private double epsilon = 0.3;
        private int minPoints = 5;
        private DistanceFunction distanceFunction = DistanceFunction.COSINE;

        public DbscanConfig toDbscanConfig() {
            return DbscanConfig.builder()
                    .epsilon(epsilon)
                    .minPoints(minPoints)
                    .distanceFunction(distanceFunction)
                    .build();
        }
    }

    @Data
    public static class ComputeConfig {
        private String baseUrl = "http://localhost:8081";
        private Duration timeout = Duration.ofSeconds(30);
        private int maxRetries = 2;
        private Duration retryBackoff = Duration.ofSeconds(1);
    }

    /**
     * Table and column listing the ids of one entity type.
     */
    @Data
    public static class SourceConfig {
        private String idTable;
        private String idColumn = "id";
    }

    @Data
    public static class CacheConfig {
        private int maxSize = 100;
        private Duration expireAfterWrite = Duration.ofHours(24);
    }
}
