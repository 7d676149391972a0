package com.swipeengine.service.batch;

import com.swipeengine.model.ClusteringRecord;
import com.swipeengine.model.ClusteringResult;
import com.swipeengine.model.EmbeddingRecord;
import com.swipeengine.model.EntityType;
import com.swipeengine.repository.ClusteringResultSink;
import com.swipeengine.repository.EmbeddingSource;
import com.swipeengine.service.clustering.DbscanClustering;
import com.swipeengine.service.clustering.DbscanConfig;
import com.swipeengine.service.similarity.DistanceFunction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Optional;

import static com.swipeengine.service.batch.EmbeddingBatchCollectorTest.listSource;
import static com.swipeengine.service.batch.EmbeddingBatchCollectorTest.record;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * Tests for ClusterRecalculator.
 */
class ClusterRecalculatorTest {

    private EmbeddingBatchCollector collector;
    private DbscanClustering clustering;
    private ClusteringResultSink sink;

    private final List<EmbeddingRecord> twoGroups = List.of(
            record("a1", 1.0f, 0.0f),
            record("a2", 0.99f, 0.01f),
            record("a3", 0.98f, 0.02f),
            record("b1", 0.0f, 1.0f),
            record("b2", 0.01f, 0.99f),
            record("b3", 0.02f, 0.98f),
            record("lonely", -1.0f, 0.0f));

    @BeforeEach
    void setUp() {
        collector = new EmbeddingBatchCollector(100);
        clustering = new DbscanClustering(DbscanConfig.builder()
                .epsilon(0.05)
                .minPoints(2)
                .distanceFunction(DistanceFunction.COSINE)
                .build());
        sink = mock(ClusteringResultSink.class);
    }

    @Test
    void testRecalculatePersistsAndReturnsResult() {
        ClusterRecalculator recalculator = new ClusterRecalculator(collector, clustering, Optional.of(sink));

        ClusteringResult result = recalculator.recalculatePostClusters(listSource(twoGroups));

        assertEquals(2, result.getClusters().size());
        assertEquals(6, result.getAssignments().size());
        assertTrue(result.clusterOf("lonely").isEmpty());
        assertTrue(result.isConverged());
        assertEquals(1, result.getIterations());
        assertEquals(7, result.getMetadata().getTotalItems());
        assertEquals(EntityType.POST, result.getMetadata().getEntityType());
        assertEquals(Math.min(1.0, 2 / Math.sqrt(7)), result.getQuality(), 1e-9);

        ArgumentCaptor<ClusteringRecord> captor = ArgumentCaptor.forClass(ClusteringRecord.class);
        verify(sink).saveClusteringResult(captor.capture());
        assertEquals(EntityType.POST, captor.getValue().getEntityType());
        assertEquals(result.getAssignments(), captor.getValue().getAssignments());
    }

    @Test
    void testEmptySourceReturnsEmptyResultWithoutPersisting() {
        ClusterRecalculator recalculator = new ClusterRecalculator(collector, clustering, Optional.of(sink));

        ClusteringResult result = recalculator.recalculateUserClusters(listSource(List.of()));

        assertTrue(result.isEmpty());
        assertTrue(result.getAssignments().isEmpty());
        assertEquals(0.0, result.getQuality());
        assertTrue(result.isConverged());
        assertEquals(0, result.getIterations());
        assertEquals(EntityType.USER, result.getMetadata().getEntityType());
        verifyNoInteractions(sink);
    }

    @Test
    void testOnlyMalformedRecordsReportTotalItems() {
        ClusterRecalculator recalculator = new ClusterRecalculator(collector, clustering, Optional.of(sink));

        ClusteringResult result = recalculator.recalculate(EntityType.USER,
                listSource(List.of(record("x"), record("y"))));

        assertTrue(result.isEmpty());
        assertEquals(2, result.getMetadata().getTotalItems());
        verifyNoInteractions(sink);
    }

    @Test
    void testPersistenceFailureDoesNotReachCaller() {
        doThrow(new IllegalStateException("database down")).when(sink).saveClusteringResult(any());
        ClusterRecalculator recalculator = new ClusterRecalculator(collector, clustering, Optional.of(sink));

        ClusteringResult result = assertDoesNotThrow(
                () -> recalculator.recalculate(EntityType.POST, listSource(twoGroups)));

        assertEquals(2, result.getClusters().size());
        verify(sink).saveClusteringResult(any());
    }

    @Test
    void testSourceErrorPropagates() {
        EmbeddingSource failing = mock(EmbeddingSource.class);
        when(failing.findAllEmbeddings(anyInt(), anyInt())).thenThrow(new IllegalStateException("query failed"));
        ClusterRecalculator recalculator = new ClusterRecalculator(collector, clustering, Optional.of(sink));

        assertThrows(IllegalStateException.class, () -> recalculator.recalculate(EntityType.POST, failing));
        verifyNoInteractions(sink);
    }

    @Test
    void testWorksWithoutSink() {
        ClusterRecalculator recalculator = new ClusterRecalculator(collector, clustering);

        ClusteringResult result = recalculator.recalculate(EntityType.POST, listSource(twoGroups));

        assertEquals(2, result.getClusters().size());
    }

    @Test
    void testOverridesApplyToSingleRun() {
        ClusterRecalculator recalculator = new ClusterRecalculator(collector, clustering);
        DbscanConfig loose = clustering.getConfig().toBuilder().epsilon(1.5).build();

        ClusteringResult overridden = recalculator.recalculate(EntityType.POST, listSource(twoGroups), loose);
        ClusteringResult regular = recalculator.recalculate(EntityType.POST, listSource(twoGroups));

        assertEquals(1, overridden.getClusters().size());
        assertEquals(7, overridden.getAssignments().size());
        assertEquals(2, regular.getClusters().size());
    }

    @Test
    void testQualityBounds() {
        assertEquals(0.0, ClusterRecalculator.quality(0, 100));
        assertEquals(0.0, ClusterRecalculator.quality(3, 0));
        assertEquals(0.5, ClusterRecalculator.quality(5, 100), 1e-9);
        assertEquals(1.0, ClusterRecalculator.quality(4, 4));
        assertEquals(1.0, ClusterRecalculator.quality(50, 100));
    }
}
