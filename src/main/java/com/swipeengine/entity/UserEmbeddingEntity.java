package com.swipeengine.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.Map;

/**
 * JPA entity for the user_embeddings table.
 */
@Entity
@Table(name = "user_embeddings")
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class UserEmbeddingEntity extends EmbeddingEntity {

    public UserEmbeddingEntity(String userId, float[] embedding, Map<String, Object> metadata) {
        super(userId, embedding, metadata);
    }
}
