package com.swipeengine.service.embedding;

import com.swipeengine.model.EntityType;
import reactor.core.publisher.Mono;

/**
 * Service that (re)computes and stores the embedding of a single entity.
 * Implementations can be remote (HTTP) or in-process.
 */
public interface EmbeddingComputeService {

    /**
     * Refresh the embedding of one entity.
     *
     * @param entityType kind of entity
     * @param entityId   entity identifier
     * @return completes when the embedding is up to date, errors otherwise
     */
    Mono<Void> refreshEmbedding(EntityType entityType, String entityId);

    default Mono<Void> refreshUserEmbedding(String userId) {
        return refreshEmbedding(EntityType.USER, userId);
    }

    default Mono<Void> refreshPostEmbedding(String postId) {
        return refreshEmbedding(EntityType.POST, postId);
    }
}
