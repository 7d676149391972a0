package com.swipeengine.repository.jpa;

import com.swipeengine.entity.UserEmbeddingEntity;
import com.swipeengine.model.EmbeddingRecord;
import com.swipeengine.repository.UserEmbeddingRepository;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for JpaEmbeddingSource.
 */
class JpaEmbeddingSourceTest {

    @Test
    void testMapsEntitiesToRecords() {
        UserEmbeddingRepository repository = mock(UserEmbeddingRepository.class);
        when(repository.findPage(2, 0)).thenReturn(List.of(
                new UserEmbeddingEntity("u1", new float[]{0.1f, 0.2f}, Map.of("locale", "en")),
                new UserEmbeddingEntity("u2", null, null)));

        List<EmbeddingRecord> records = new JpaEmbeddingSource(repository).findAllEmbeddings(2, 0);

        assertEquals(2, records.size());
        assertEquals("u1", records.get(0).getEntityId());
        assertArrayEquals(new float[]{0.1f, 0.2f}, records.get(0).getVector());
        assertEquals("en", records.get(0).getMetadata().get("locale"));
        assertFalse(records.get(1).hasVector());
        assertTrue(records.get(1).getMetadata().isEmpty());
    }
}
