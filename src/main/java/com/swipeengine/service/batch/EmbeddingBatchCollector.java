package com.swipeengine.service.batch;

import com.swipeengine.model.EmbeddingRecord;
import com.swipeengine.model.Entity;
import com.swipeengine.model.EntityType;
import com.swipeengine.repository.EmbeddingSource;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads every embedding of a population from a paginated source.
 *
 * Paging stops on the first page shorter than the batch size. Records with
 * a null or empty vector, or whose dimension differs from the first accepted
 * vector, are skipped but still counted in {@code totalItems}. Source errors
 * propagate unchanged; nothing collected so far is returned.
 */
@Slf4j
public class EmbeddingBatchCollector {

    private final int batchSize;

    public EmbeddingBatchCollector(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
        }
        this.batchSize = batchSize;
    }

    public int getBatchSize() {
        return batchSize;
    }

    /**
     * Collect all embeddings of one entity type.
     *
     * @param source     embedding source to page through
     * @param entityType type tag for the produced entities
     * @return parallel vectors and entities plus the number of records seen
     */
    public CollectedBatch collect(EmbeddingSource source, EntityType entityType) {
        if (source == null) {
            throw new IllegalArgumentException("Embedding source is required for " + entityType);
        }

        List<float[]> vectors = new ArrayList<>();
        List<Entity> entities = new ArrayList<>();
        int dimension = -1;
        int offset = 0;
        long totalItems = 0;
        int pages = 0;

        while (true) {
            List<EmbeddingRecord> page = source.findAllEmbeddings(batchSize, offset);
            int pageSize = page == null ? 0 : page.size();
            totalItems += pageSize;
            pages++;

            if (pageSize == 0) {
                break;
            }

            for (EmbeddingRecord record : page) {
                if (record == null || !record.hasVector()) {
                    log.warn("Skipping {} {}: missing embedding vector",
                            entityType, record == null ? null : record.getEntityId());
                    continue;
                }

                float[] vector = record.getVector();
                if (dimension == -1) {
                    dimension = vector.length;
                } else if (vector.length != dimension) {
                    log.warn("Skipping {} {}: embedding has dimension {}, expected {}",
                            entityType, record.getEntityId(), vector.length, dimension);
                    continue;
                }

                vectors.add(vector.clone());
                entities.add(Entity.builder()
                        .id(record.getEntityId())
                        .type(entityType)
                        .metadata(record.getMetadata() != null ? record.getMetadata() : Map.of())
                        .build());
            }

            offset += pageSize;
            log.debug("Collected page {} of {} embeddings ({} records, offset now {})",
                    pages, entityType, pageSize, offset);

            if (pageSize < batchSize) {
                break;
            }
        }

        log.info("Collected {} {} embeddings from {} records ({} skipped)",
                vectors.size(), entityType, totalItems, totalItems - vectors.size());

        return new CollectedBatch(vectors.toArray(new float[0][]), List.copyOf(entities), totalItems);
    }
}
