package com.swipeengine.repository;

import com.swipeengine.model.EmbeddingRecord;

import java.util.List;

/**
 * Paginated read access to stored embeddings of one entity type.
 *
 * Implementations must order pages stably so that consecutive calls neither
 * repeat nor skip records, and return fewer than {@code limit} records
 * exactly when the data is exhausted.
 */
public interface EmbeddingSource {

    /**
     * Fetch one page of embeddings.
     *
     * @param limit  maximum number of records
     * @param offset number of records to skip
     * @return page of records, possibly with null or empty vectors
     */
    List<EmbeddingRecord> findAllEmbeddings(int limit, int offset);
}
