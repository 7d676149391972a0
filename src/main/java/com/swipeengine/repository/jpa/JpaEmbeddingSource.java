package com.swipeengine.repository.jpa;

import com.swipeengine.entity.EmbeddingEntity;
import com.swipeengine.model.EmbeddingRecord;
import com.swipeengine.repository.EmbeddingEntityRepository;
import com.swipeengine.repository.EmbeddingSource;

import java.util.List;
import java.util.Map;

/**
 * Embedding source backed by one of the pgvector embedding tables.
 */
public class JpaEmbeddingSource implements EmbeddingSource {

    private final EmbeddingEntityRepository<? extends EmbeddingEntity> repository;

    public JpaEmbeddingSource(EmbeddingEntityRepository<? extends EmbeddingEntity> repository) {
        this.repository = repository;
    }

    @Override
    public List<EmbeddingRecord> findAllEmbeddings(int limit, int offset) {
        return repository.findPage(limit, offset).stream()
                .map(JpaEmbeddingSource::toRecord)
                .toList();
    }

    private static EmbeddingRecord toRecord(EmbeddingEntity entity) {
        return EmbeddingRecord.builder()
                .entityId(entity.getEntityId())
                .vector(entity.getEmbedding())
                .metadata(entity.getMetadata() != null ? entity.getMetadata() : Map.of())
                .build();
    }
}
