package com.swipeengine.service.batch;

import com.swipeengine.config.SwipeEngineProperties;
import com.swipeengine.model.BatchRunReport;
import com.swipeengine.model.ClusteringResult;
import com.swipeengine.model.EntityType;
import com.swipeengine.model.RefreshSummary;
import com.swipeengine.repository.EmbeddingSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic driver of the two batch jobs: the embedding refresh pass and the
 * cluster recalculation pass.
 *
 * Each job runs on its own fixed-rate timer whose first tick fires
 * immediately on start. A tick never overlaps the next tick of the same
 * timer; the two timers may overlap each other. Ticks never throw.
 */
@Slf4j
public class BatchCoordinator {

    private final EmbeddingRefresher refresher;
    private final ClusterRecalculator recalculator;
    private final Map<EntityType, EmbeddingSource> embeddingSources;
    private final TaskScheduler scheduler;
    private final Duration embeddingUpdateInterval;
    private final Duration clusteringInterval;
    private final List<EntityType> clusterEntityTypes;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledFuture<?> embeddingTimer;
    private ScheduledFuture<?> clusteringTimer;

    public BatchCoordinator(EmbeddingRefresher refresher,
                            ClusterRecalculator recalculator,
                            Map<EntityType, EmbeddingSource> embeddingSources,
                            TaskScheduler scheduler,
                            SwipeEngineProperties.BatchConfig config) {
        if (refresher == null || recalculator == null || scheduler == null) {
            throw new IllegalArgumentException("Refresher, recalculator and scheduler are required");
        }
        this.refresher = refresher;
        this.recalculator = recalculator;
        this.embeddingSources = Map.copyOf(embeddingSources);
        this.scheduler = scheduler;
        this.embeddingUpdateInterval = requirePositive(config.getEmbeddingUpdateInterval(), "embeddingUpdateInterval");
        this.clusteringInterval = requirePositive(config.getClusteringInterval(), "clusteringInterval");
        this.clusterEntityTypes = List.copyOf(config.getClusterEntityTypes());
    }

    /**
     * Schedule both timers. A second call while running only logs a warning.
     * If scheduling fails, nothing stays scheduled and the error is rethrown.
     */
    public synchronized void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Batch coordinator is already running");
            return;
        }

        log.info("Starting batch coordinator (embedding refresh every {}, clustering every {} for {})",
                embeddingUpdateInterval, clusteringInterval, clusterEntityTypes);

        Instant now = Instant.now();
        try {
            embeddingTimer = scheduler.scheduleAtFixedRate(this::embeddingTick, now, embeddingUpdateInterval);
            clusteringTimer = scheduler.scheduleAtFixedRate(this::clusteringTick, now, clusteringInterval);
        } catch (RuntimeException e) {
            // Roll back to Stopped so a later start() can retry
            cancel(embeddingTimer);
            cancel(clusteringTimer);
            embeddingTimer = null;
            clusteringTimer = null;
            running.set(false);
            log.error("Failed to schedule batch timers, coordinator left stopped", e);
            throw e;
        }
    }

    /**
     * Cancel both timers. Passes already in flight run to completion.
     */
    public synchronized void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }

        cancel(embeddingTimer);
        cancel(clusteringTimer);
        embeddingTimer = null;
        clusteringTimer = null;

        log.info("Batch coordinator stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Run the refresh pass and then the clustering pass on the calling thread,
     * independently of the timers.
     *
     * @return what each step produced and which steps failed
     */
    public BatchRunReport forceUpdate() {
        log.info("Forcing batch update");
        BatchRunReport.BatchRunReportBuilder report = BatchRunReport.builder();

        for (EntityType entityType : refreshEntityTypes()) {
            try {
                RefreshSummary summary = refresher.refresh(entityType);
                report.refresh(entityType, summary);
            } catch (Exception e) {
                log.error("Forced {} embedding refresh failed", entityType, e);
                report.failure("refresh " + entityType + ": " + e.getMessage());
            }
        }

        for (EntityType entityType : clusterEntityTypes) {
            EmbeddingSource source = embeddingSources.get(entityType);
            if (source == null) {
                log.warn("No embedding source for {}, skipping clustering", entityType);
                continue;
            }
            try {
                ClusteringResult result = recalculator.recalculate(entityType, source);
                report.clustering(entityType, result);
            } catch (Exception e) {
                log.error("Forced {} cluster recalculation failed", entityType, e);
                report.failure("clustering " + entityType + ": " + e.getMessage());
            }
        }

        BatchRunReport result = report.build();
        log.info("Forced batch update finished with {} failure(s)", result.getFailures().size());
        return result;
    }

    // ===========================
    // Private Helper Methods
    // ===========================

    private void embeddingTick() {
        for (EntityType entityType : refreshEntityTypes()) {
            try {
                refresher.refresh(entityType);
            } catch (Exception e) {
                log.error("Scheduled {} embedding refresh failed", entityType, e);
            }
        }
    }

    private void clusteringTick() {
        for (EntityType entityType : clusterEntityTypes) {
            EmbeddingSource source = embeddingSources.get(entityType);
            if (source == null) {
                log.warn("No embedding source for {}, skipping clustering", entityType);
                continue;
            }
            try {
                recalculator.recalculate(entityType, source);
            } catch (Exception e) {
                log.error("Scheduled {} cluster recalculation failed", entityType, e);
            }
        }
    }

    private List<EntityType> refreshEntityTypes() {
        return Arrays.stream(EntityType.values())
                .filter(refresher::supports)
                .toList();
    }

    private static void cancel(ScheduledFuture<?> timer) {
        if (timer != null) {
            timer.cancel(false);
        }
    }

    private static Duration requirePositive(Duration interval, String name) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration, got " + interval);
        }
        return interval;
    }
}
