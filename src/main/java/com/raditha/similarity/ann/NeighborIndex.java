package com.raditha.similarity.ann;

import com.raditha.similarity.config.TuningConfig;

import java.util.List;

/**
 * Approximate nearest neighbour search over fixed-length embeddings.
 * Results are ranked by exact cosine similarity, best first, ties broken by id.
 */
public interface NeighborIndex {

    /**
     * A neighbour returned by {@link #search}.
     */
    record Neighbor(String id, double similarity) {
    }

    /**
     * @throws IllegalArgumentException if the embedding length does not match the index
     */
    void add(String id, float[] embedding);

    int size();

    List<Neighbor> search(float[] query, int topK);

    /**
     * Build the index selected by {@link TuningConfig#annAlgorithm()}.
     */
    static NeighborIndex create(int dimensions, TuningConfig tuning) {
        return switch (tuning.annAlgorithm()) {
            case LSH -> new EmbeddingIndex(dimensions, tuning.annPlanes(), tuning.annTables(), tuning.seed());
            case HIERARCHICAL -> new ClusterIndex(dimensions, tuning.annClusters(), tuning.seed());
            case HYBRID -> new HybridIndex(
                    new EmbeddingIndex(dimensions, tuning.annPlanes(), tuning.annTables(), tuning.seed()),
                    new ClusterIndex(dimensions, tuning.annClusters(), tuning.seed()));
        };
    }
}
