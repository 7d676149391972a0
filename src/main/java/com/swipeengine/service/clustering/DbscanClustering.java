package com.swipeengine.service.clustering;

import com.swipeengine.model.Cluster;
import com.swipeengine.model.Entity;
import com.swipeengine.service.similarity.VectorDistance;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DBSCAN (Density-Based Spatial Clustering of Applications with Noise) over
 * embedding vectors.
 *
 * Flow:
 * 1. Visit points in input order; a point with fewer than minPoints
 *    neighbors within epsilon is provisionally noise
 * 2. Otherwise start a new cluster and grow it breadth-first; reached
 *    core points contribute their own neighbors to the queue
 * 3. Noise reached during expansion becomes a border point of that cluster
 * 4. Summarize every cluster (centroid, size, density)
 *
 * Cluster ids ("dbscan-1", "dbscan-2", ...) follow first-visit order, so
 * identical input always yields identical output. Instances are immutable
 * and safe to share between threads.
 */
@Slf4j
public class DbscanClustering {

    private static final int UNDEFINED = 0;
    private static final int NOISE = -1;
    private static final String CLUSTER_ID_PREFIX = "dbscan-";

    private final DbscanConfig config;

    public DbscanClustering() {
        this(DbscanConfig.defaults());
    }

    public DbscanClustering(DbscanConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("DBSCAN config is required");
        }
        this.config = config.validate();
    }

    public DbscanConfig getConfig() {
        return config;
    }

    /**
     * Copy of this algorithm running with different parameters.
     */
    public DbscanClustering withConfig(DbscanConfig overrides) {
        return new DbscanClustering(overrides);
    }

    /**
     * Partition vectors into clusters plus noise.
     *
     * @param vectors  embedding vectors, all of the same dimension
     * @param entities entities parallel to {@code vectors}
     * @return clusters and entity-to-cluster assignments (noise excluded)
     */
    public ClusteringOutput process(float[][] vectors, List<Entity> entities) {
        if (vectors == null || entities == null) {
            throw new IllegalArgumentException("Vectors and entities are required");
        }
        if (vectors.length != entities.size()) {
            throw new IllegalArgumentException(String.format(
                    "Number of vectors (%d) does not match number of entities (%d)",
                    vectors.length, entities.size()));
        }
        if (vectors.length == 0) {
            return ClusteringOutput.empty();
        }

        requireUniformDimension(vectors);

        long startTime = System.nanoTime();
        int[] labels = label(vectors);
        ClusteringOutput output = summarize(vectors, entities, labels);

        log.debug("DBSCAN found {} clusters and {} noise points among {} vectors in {}ms (epsilon={}, minPoints={}, distance={})",
                output.getClusters().size(), output.getNoiseCount(), vectors.length,
                (System.nanoTime() - startTime) / 1_000_000,
                config.getEpsilon(), config.getMinPoints(), config.getDistanceFunction().getValue());

        return output;
    }

    // ===========================
    // Private Helper Methods
    // ===========================

    /**
     * Assign a cluster number (1-based) or NOISE to every point.
     */
    private int[] label(float[][] vectors) {
        int n = vectors.length;
        int[] labels = new int[n];
        int clusterId = 0;

        for (int pointIdx = 0; pointIdx < n; pointIdx++) {
            if (labels[pointIdx] != UNDEFINED) {
                continue;
            }

            List<Integer> neighbors = findNeighbors(pointIdx, vectors);
            if (neighbors.size() < config.getMinPoints()) {
                labels[pointIdx] = NOISE;
                continue;
            }

            clusterId++;
            labels[pointIdx] = clusterId;

            Deque<Integer> queue = new ArrayDeque<>(neighbors.size());
            for (int neighbor : neighbors) {
                if (neighbor != pointIdx) {
                    queue.add(neighbor);
                }
            }

            while (!queue.isEmpty()) {
                int current = queue.poll();

                if (labels[current] == NOISE) {
                    // Border point: belongs to the cluster but does not extend it
                    labels[current] = clusterId;
                    continue;
                }
                if (labels[current] != UNDEFINED) {
                    continue;
                }

                labels[current] = clusterId;
                List<Integer> currentNeighbors = findNeighbors(current, vectors);
                if (currentNeighbors.size() >= config.getMinPoints()) {
                    for (int neighbor : currentNeighbors) {
                        if (labels[neighbor] == UNDEFINED || labels[neighbor] == NOISE) {
                            queue.add(neighbor);
                        }
                    }
                }
            }
        }

        return labels;
    }

    /**
     * Indices within epsilon of the point, the point itself included.
     * Every point's neighborhood is requested at most once per run.
     */
    private List<Integer> findNeighbors(int pointIdx, float[][] vectors) {
        List<Integer> neighbors = new ArrayList<>();
        float[] point = vectors[pointIdx];

        for (int i = 0; i < vectors.length; i++) {
            if (i == pointIdx
                    || VectorDistance.distance(point, vectors[i], config.getDistanceFunction()) <= config.getEpsilon()) {
                neighbors.add(i);
            }
        }
        return neighbors;
    }

    private ClusteringOutput summarize(float[][] vectors, List<Entity> entities, int[] labels) {
        int clusterCount = 0;
        int noiseCount = 0;
        for (int label : labels) {
            clusterCount = Math.max(clusterCount, label);
            if (label == NOISE) {
                noiseCount++;
            }
        }

        List<List<Integer>> members = new ArrayList<>(clusterCount);
        for (int i = 0; i < clusterCount; i++) {
            members.add(new ArrayList<>());
        }
        for (int idx = 0; idx < labels.length; idx++) {
            if (labels[idx] > 0) {
                members.get(labels[idx] - 1).add(idx);
            }
        }

        Instant now = Instant.now();
        List<Cluster> clusters = new ArrayList<>(clusterCount);
        Map<String, String> assignments = new LinkedHashMap<>();

        for (int c = 0; c < clusterCount; c++) {
            List<Integer> memberIdx = members.get(c);
            String id = CLUSTER_ID_PREFIX + (c + 1);
            float[] centroid = centroid(vectors, memberIdx);

            clusters.add(Cluster.builder()
                    .id(id)
                    .name(id)
                    .centroid(centroid)
                    .size(memberIdx.size())
                    .density(density(vectors, memberIdx, centroid))
                    .createdAt(now)
                    .updatedAt(now)
                    .build());

            for (int idx : memberIdx) {
                assignments.put(entities.get(idx).getId(), id);
            }
        }

        return ClusteringOutput.builder()
                .clusters(Collections.unmodifiableList(clusters))
                .assignments(Collections.unmodifiableMap(assignments))
                .noiseCount(noiseCount)
                .build();
    }

    /**
     * Element-wise mean of the member vectors.
     */
    private float[] centroid(float[][] vectors, List<Integer> memberIdx) {
        int dimension = vectors[memberIdx.get(0)].length;
        double[] sum = new double[dimension];

        for (int idx : memberIdx) {
            float[] vector = vectors[idx];
            for (int d = 0; d < dimension; d++) {
                sum[d] += vector[d];
            }
        }

        float[] centroid = new float[dimension];
        for (int d = 0; d < dimension; d++) {
            centroid[d] = (float) (sum[d] / memberIdx.size());
        }
        return centroid;
    }

    /**
     * size / (1 + mean member distance to the centroid): grows with member
     * count, shrinks with spread.
     */
    private double density(float[][] vectors, List<Integer> memberIdx, float[] centroid) {
        double totalDistance = 0.0;
        for (int idx : memberIdx) {
            totalDistance += VectorDistance.distance(vectors[idx], centroid, config.getDistanceFunction());
        }
        double spread = totalDistance / memberIdx.size();
        return memberIdx.size() / (1.0 + spread);
    }

    private void requireUniformDimension(float[][] vectors) {
        int dimension = -1;
        for (int i = 0; i < vectors.length; i++) {
            float[] vector = vectors[i];
            if (vector == null || vector.length == 0) {
                throw new IllegalArgumentException("Vector at index " + i + " is null or empty");
            }
            if (dimension == -1) {
                dimension = vector.length;
            } else if (vector.length != dimension) {
                throw new IllegalArgumentException(String.format(
                        "Vector at index %d has dimension %d, expected %d", i, vector.length, dimension));
            }
        }
    }
}
