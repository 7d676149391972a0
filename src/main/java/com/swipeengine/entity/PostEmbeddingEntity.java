package com.swipeengine.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.Map;

/**
 * JPA entity for the post_embeddings table.
 */
@Entity
@Table(name = "post_embeddings")
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class PostEmbeddingEntity extends EmbeddingEntity {

    public PostEmbeddingEntity(String postId, float[] embedding, Map<String, Object> metadata) {
        super(postId, embedding, metadata);
    }
}
