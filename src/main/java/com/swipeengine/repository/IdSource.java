package com.swipeengine.repository;

import java.util.List;

/**
 * Paginated listing of entity ids, same pagination contract as
 * {@link EmbeddingSource}.
 */
public interface IdSource {

    List<String> findAllIds(int limit, int offset);
}
