package com.raditha.similarity.ann;

import org.jspecify.annotations.Nullable;

/**
 * Supplies precomputed semantic embeddings for functions.
 * Producing the vectors (model inference, caching) is the caller's concern.
 */
@FunctionalInterface
public interface EmbeddingProvider {

    /**
     * Provider used when no embeddings are available.
     */
    EmbeddingProvider NONE = functionId -> null;

    /**
     * @param functionId Function whose embedding is requested
     * @return the embedding, or null when none exists for this function
     */
    float @Nullable [] getEmbedding(String functionId);
}
