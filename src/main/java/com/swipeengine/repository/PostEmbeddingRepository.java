package com.swipeengine.repository;

import com.swipeengine.entity.PostEmbeddingEntity;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for post embeddings.
 */
@Repository
public interface PostEmbeddingRepository extends EmbeddingEntityRepository<PostEmbeddingEntity> {

    @Override
    @Query(value = """
            SELECT * FROM post_embeddings
            ORDER BY entity_id
            LIMIT :limit OFFSET :offset
            """, nativeQuery = true)
    List<PostEmbeddingEntity> findPage(@Param("limit") int limit, @Param("offset") int offset);
}
