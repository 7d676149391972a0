package com.swipeengine.repository;

import com.swipeengine.entity.UserEmbeddingEntity;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for user embeddings.
 */
@Repository
public interface UserEmbeddingRepository extends EmbeddingEntityRepository<UserEmbeddingEntity> {

    @Override
    @Query(value = """
            SELECT * FROM user_embeddings
            ORDER BY entity_id
            LIMIT :limit OFFSET :offset
            """, nativeQuery = true)
    List<UserEmbeddingEntity> findPage(@Param("limit") int limit, @Param("offset") int offset);
}
