package com.swipeengine.repository;

import com.swipeengine.entity.EmbeddingEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.repository.NoRepositoryBean;

import java.util.List;

/**
 * Common page query of the per-type embedding repositories.
 */
@NoRepositoryBean
public interface EmbeddingEntityRepository<T extends EmbeddingEntity> extends JpaRepository<T, String> {

    /**
     * Page of embeddings ordered by entity id.
     */
    List<T> findPage(int limit, int offset);
}
