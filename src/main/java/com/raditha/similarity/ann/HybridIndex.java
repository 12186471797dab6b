package com.raditha.similarity.ann;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Queries a hyperplane index and a cluster index with twice the requested
 * depth and merges their candidates. Both report exact cosine, so a neighbour
 * found by either keeps the same similarity.
 */
public class HybridIndex implements NeighborIndex {

    private final NeighborIndex hashed;
    private final NeighborIndex clustered;

    public HybridIndex(NeighborIndex hashed, NeighborIndex clustered) {
        this.hashed = hashed;
        this.clustered = clustered;
    }

    @Override
    public void add(String id, float[] embedding) {
        hashed.add(id, embedding);
        clustered.add(id, embedding);
    }

    @Override
    public int size() {
        return hashed.size();
    }

    @Override
    public List<Neighbor> search(float[] query, int topK) {
        Map<String, Neighbor> merged = new LinkedHashMap<>();
        for (Neighbor neighbor : hashed.search(query, topK * 2)) {
            merged.put(neighbor.id(), neighbor);
        }
        for (Neighbor neighbor : clustered.search(query, topK * 2)) {
            merged.putIfAbsent(neighbor.id(), neighbor);
        }
        return EmbeddingIndex.best(new ArrayList<>(merged.values()), topK);
    }
}
