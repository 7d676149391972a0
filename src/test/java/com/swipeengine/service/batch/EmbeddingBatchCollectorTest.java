package com.swipeengine.service.batch;

import com.swipeengine.model.EmbeddingRecord;
import com.swipeengine.model.EntityType;
import com.swipeengine.repository.EmbeddingSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for EmbeddingBatchCollector.
 */
class EmbeddingBatchCollectorTest {

    private EmbeddingBatchCollector collector;

    @BeforeEach
    void setUp() {
        collector = new EmbeddingBatchCollector(100);
    }

    static EmbeddingRecord record(String id, float... vector) {
        return EmbeddingRecord.builder().entityId(id).vector(vector).metadata(Map.of()).build();
    }

    /**
     * In-memory source honoring limit/offset that records every page request.
     */
    static class ListSource implements EmbeddingSource {
        final List<EmbeddingRecord> records;
        final List<List<Integer>> calls = new ArrayList<>();

        ListSource(List<EmbeddingRecord> records) {
            this.records = records;
        }

        @Override
        public List<EmbeddingRecord> findAllEmbeddings(int limit, int offset) {
            calls.add(List.of(limit, offset));
            return records.subList(Math.min(offset, records.size()), Math.min(offset + limit, records.size()));
        }
    }

    static ListSource listSource(List<EmbeddingRecord> records) {
        return new ListSource(records);
    }

    @Test
    void testPagesUntilShortPage() {
        List<EmbeddingRecord> records = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            records.add(record("post-" + i, i, 1.0f));
        }
        ListSource source = listSource(records);

        CollectedBatch batch = collector.collect(source, EntityType.POST);

        assertEquals(150, batch.size());
        assertEquals(150, batch.getTotalItems());
        assertEquals(List.of(List.of(100, 0), List.of(100, 100)), source.calls);
        assertEquals("post-0", batch.getEntities().get(0).getId());
        assertEquals(EntityType.POST, batch.getEntities().get(149).getType());
    }

    @Test
    void testStopsOnEmptyPageAfterFullPage() {
        List<EmbeddingRecord> records = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            records.add(record("u" + i, 1.0f));
        }
        ListSource source = listSource(records);

        CollectedBatch batch = collector.collect(source, EntityType.USER);

        assertEquals(100, batch.size());
        assertEquals(List.of(List.of(100, 0), List.of(100, 100)), source.calls);
    }

    @Test
    void testMalformedRecordsSkippedButCounted() {
        List<EmbeddingRecord> records = List.of(
                record("ok-1", 1.0f, 0.0f),
                EmbeddingRecord.builder().entityId("no-vector").build(),
                record("empty"),
                record("wrong-dimension", 1.0f, 0.0f, 0.0f),
                record("ok-2", 0.0f, 1.0f));

        CollectedBatch batch = collector.collect(listSource(records), EntityType.POST);

        assertEquals(2, batch.size());
        assertEquals(5, batch.getTotalItems());
        assertEquals(3, batch.getSkipped());
        assertEquals(batch.getVectors().length, batch.getEntities().size());
        assertEquals("ok-2", batch.getEntities().get(1).getId());
    }

    @Test
    void testCollectedVectorsAreCopies() {
        float[] vector = {1.0f, 2.0f};
        CollectedBatch batch = collector.collect(listSource(List.of(record("p1", vector))), EntityType.POST);

        vector[0] = 99.0f;

        assertArrayEquals(new float[]{1.0f, 2.0f}, batch.getVectors()[0]);
    }

    @Test
    void testEmptySource() {
        CollectedBatch batch = collector.collect(listSource(List.of()), EntityType.USER);

        assertTrue(batch.isEmpty());
        assertEquals(0, batch.getTotalItems());
    }

    @Test
    void testSourceErrorPropagates() {
        EmbeddingSource source = mock(EmbeddingSource.class);
        when(source.findAllEmbeddings(100, 0)).thenReturn(Collections.nCopies(100, record("p", 1.0f)));
        when(source.findAllEmbeddings(100, 100)).thenThrow(new IllegalStateException("connection lost"));

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> collector.collect(source, EntityType.POST));
        assertEquals("connection lost", error.getMessage());
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new EmbeddingBatchCollector(0));
        assertThrows(IllegalArgumentException.class, () -> collector.collect(null, EntityType.POST));
    }
}
