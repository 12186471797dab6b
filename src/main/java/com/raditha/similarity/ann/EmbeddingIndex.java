package com.raditha.similarity.ann;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Approximate nearest neighbour index over embeddings using random hyperplane
 * partitions.
 * <p>
 * Every table hashes a vector to the sign pattern of its projections onto
 * {@code planes} Gaussian hyperplanes. A query reads its own bucket in each
 * table plus the buckets one sign flip away, then ranks the union of
 * candidates by exact cosine similarity. Recall is not guaranteed.
 */
public class EmbeddingIndex implements NeighborIndex {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingIndex.class);

    private final int dimensions;
    private final int planes;
    private final float[][][] hyperplanes;
    private final List<Map<Integer, List<Integer>>> tables;
    private final List<String> ids = new ArrayList<>();
    private final List<float[]> vectors = new ArrayList<>();

    /**
     * @param dimensions Embedding length
     * @param planes     Hyperplanes per table (bucket key bits)
     * @param numTables  Independent hash tables
     * @param seed       Seed for the hyperplanes
     */
    public EmbeddingIndex(int dimensions, int planes, int numTables, long seed) {
        if (dimensions < 1 || planes < 1 || planes > 30 || numTables < 1) {
            throw new IllegalArgumentException(String.format(
                    "Invalid index shape: dimensions=%d planes=%d tables=%d", dimensions, planes, numTables));
        }
        this.dimensions = dimensions;
        this.planes = planes;
        this.hyperplanes = new float[numTables][planes][dimensions];
        this.tables = new ArrayList<>();

        Random random = new Random(seed);
        for (int t = 0; t < numTables; t++) {
            for (int p = 0; p < planes; p++) {
                for (int d = 0; d < dimensions; d++) {
                    hyperplanes[t][p][d] = (float) random.nextGaussian();
                }
            }
            tables.add(new HashMap<>());
        }
    }

    @Override
    public void add(String id, float[] embedding) {
        if (embedding.length != dimensions) {
            throw new IllegalArgumentException(String.format(
                    "Embedding dimension mismatch: expected %d, got %d", dimensions, embedding.length));
        }
        int index = ids.size();
        ids.add(id);
        vectors.add(embedding.clone());
        for (int t = 0; t < tables.size(); t++) {
            tables.get(t).computeIfAbsent(bucketOf(t, embedding), k -> new ArrayList<>()).add(index);
        }
    }

    @Override
    public int size() {
        return ids.size();
    }

    /**
     * Top-k indexed vectors by cosine similarity among the visited candidates.
     */
    @Override
    public List<Neighbor> search(float[] query, int topK) {
        if (ids.isEmpty()) {
            return List.of();
        }
        Set<Integer> candidates = new LinkedHashSet<>();
        for (int t = 0; t < tables.size(); t++) {
            int bucket = bucketOf(t, query);
            addBucket(candidates, t, bucket);
            // buckets one bit flip away
            for (int p = 0; p < planes; p++) {
                addBucket(candidates, t, bucket ^ (1 << p));
            }
        }

        List<Neighbor> results = new ArrayList<>(candidates.size());
        for (int index : candidates) {
            results.add(new Neighbor(ids.get(index), cosineSimilarity(query, vectors.get(index))));
        }
        log.debug("Visited {} candidates out of {} vectors", candidates.size(), ids.size());
        return best(results, topK);
    }

    static List<Neighbor> best(List<Neighbor> neighbors, int topK) {
        neighbors.sort(Comparator.comparingDouble(Neighbor::similarity).reversed()
                .thenComparing(Neighbor::id));
        return neighbors.size() > topK ? neighbors.subList(0, topK) : neighbors;
    }

    private void addBucket(Set<Integer> candidates, int table, int bucket) {
        List<Integer> members = tables.get(table).get(bucket);
        if (members != null) {
            candidates.addAll(members);
        }
    }

    private int bucketOf(int table, float[] vector) {
        int key = 0;
        for (int p = 0; p < planes; p++) {
            double dot = 0;
            float[] plane = hyperplanes[table][p];
            for (int d = 0; d < dimensions; d++) {
                dot += plane[d] * vector[d];
            }
            if (dot > 0) {
                key |= 1 << p;
            }
        }
        return key;
    }

    /**
     * Cosine similarity clamped to [-1, 1]; zero when either vector has no length.
     */
    public static double cosineSimilarity(float[] a, float[] b) {
        double dotProduct = 0;
        double normA = 0;
        double normB = 0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        if (normA == 0 || normB == 0) return 0;
        double cosine = dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(-1.0, Math.min(1.0, cosine));
    }
}
