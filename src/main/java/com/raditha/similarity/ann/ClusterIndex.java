package com.raditha.similarity.ann;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Approximate nearest neighbour index that partitions embeddings with k-means.
 * <p>
 * Partitions are rebuilt lazily on the first search after an insert: centroids
 * are seeded with k-means++ from a fixed {@link Random} seed, then refined by
 * Lloyd iterations until no centroid moves further than
 * {@link #CONVERGENCE_THRESHOLD} or {@link #MAX_ITERATIONS} is reached. A query
 * visits the members of the {@code ceil(clusters * searchFraction)} closest
 * centroids and ranks them by exact cosine similarity.
 */
public class ClusterIndex implements NeighborIndex {

    private static final Logger log = LoggerFactory.getLogger(ClusterIndex.class);

    static final int MAX_ITERATIONS = 50;
    static final double CONVERGENCE_THRESHOLD = 0.001;
    public static final double DEFAULT_SEARCH_FRACTION = 0.3;

    private final int dimensions;
    private final int maxClusters;
    private final long seed;
    private final double searchFraction;
    private final List<String> ids = new ArrayList<>();
    private final List<float[]> vectors = new ArrayList<>();

    private double[][] centroids = new double[0][];
    private List<List<Integer>> members = List.of();
    private boolean stale = true;

    public ClusterIndex(int dimensions, int maxClusters, long seed) {
        this(dimensions, maxClusters, seed, DEFAULT_SEARCH_FRACTION);
    }

    /**
     * @param dimensions     Embedding length
     * @param maxClusters    Upper bound on the number of partitions
     * @param seed           Seed for centroid initialisation
     * @param searchFraction Share of the partitions visited per query, in (0, 1]
     */
    public ClusterIndex(int dimensions, int maxClusters, long seed, double searchFraction) {
        if (dimensions < 1 || maxClusters < 1 || !(searchFraction > 0.0 && searchFraction <= 1.0)) {
            throw new IllegalArgumentException(String.format(
                    "Invalid index shape: dimensions=%d clusters=%d searchFraction=%s",
                    dimensions, maxClusters, searchFraction));
        }
        this.dimensions = dimensions;
        this.maxClusters = maxClusters;
        this.seed = seed;
        this.searchFraction = searchFraction;
    }

    @Override
    public void add(String id, float[] embedding) {
        if (embedding.length != dimensions) {
            throw new IllegalArgumentException(String.format(
                    "Embedding dimension mismatch: expected %d, got %d", dimensions, embedding.length));
        }
        ids.add(id);
        vectors.add(embedding.clone());
        stale = true;
    }

    @Override
    public int size() {
        return ids.size();
    }

    /**
     * Number of partitions after the last rebuild.
     */
    public int clusterCount() {
        ensureBuilt();
        return centroids.length;
    }

    @Override
    public List<Neighbor> search(float[] query, int topK) {
        if (ids.isEmpty()) {
            return List.of();
        }
        ensureBuilt();

        Integer[] order = new Integer[centroids.length];
        double[] distances = new double[centroids.length];
        for (int c = 0; c < centroids.length; c++) {
            order[c] = c;
            distances[c] = squaredDistance(query, centroids[c]);
        }
        Arrays.sort(order, Comparator.comparingDouble((Integer c) -> distances[c]).thenComparingInt(c -> c));

        int visit = Math.max(1, (int) Math.ceil(centroids.length * searchFraction));
        List<Neighbor> results = new ArrayList<>();
        for (int i = 0; i < visit; i++) {
            for (int index : members.get(order[i])) {
                results.add(new Neighbor(ids.get(index),
                        EmbeddingIndex.cosineSimilarity(query, vectors.get(index))));
            }
        }
        log.debug("Searched {} of {} clusters, {} candidates", visit, centroids.length, results.size());
        return EmbeddingIndex.best(results, topK);
    }

    private void ensureBuilt() {
        if (!stale) {
            return;
        }
        stale = false;
        int k = Math.min(maxClusters, ids.size());
        if (k == 0) {
            centroids = new double[0][];
            members = List.of();
            return;
        }
        centroids = initialCentroids(k);
        int[] assignment = new int[ids.size()];
        int iterations = 0;
        double shift = Double.MAX_VALUE;
        while (iterations < MAX_ITERATIONS && shift > CONVERGENCE_THRESHOLD) {
            assign(assignment);
            shift = recompute(assignment);
            iterations++;
        }
        assign(assignment);

        members = new ArrayList<>(k);
        for (int c = 0; c < k; c++) {
            members.add(new ArrayList<>());
        }
        for (int i = 0; i < assignment.length; i++) {
            members.get(assignment[i]).add(i);
        }
        log.debug("Partitioned {} vectors into {} clusters after {} iterations", ids.size(), k, iterations);
    }

    /**
     * k-means++: every further centroid is drawn with probability proportional
     * to its squared distance from the closest centroid chosen so far.
     */
    private double[][] initialCentroids(int k) {
        Random random = new Random(seed);
        int n = vectors.size();
        double[][] chosen = new double[k][];
        chosen[0] = toDouble(vectors.get(random.nextInt(n)));

        double[] closest = new double[n];
        Arrays.fill(closest, Double.MAX_VALUE);
        for (int c = 1; c < k; c++) {
            double total = 0;
            for (int i = 0; i < n; i++) {
                closest[i] = Math.min(closest[i], squaredDistance(vectors.get(i), chosen[c - 1]));
                total += closest[i];
            }
            // a zero total leaves only duplicates of chosen centroids
            int pick = c % n;
            if (total > 0) {
                double target = random.nextDouble() * total;
                for (int i = 0; i < n; i++) {
                    if (closest[i] > 0) {
                        pick = i;
                        target -= closest[i];
                        if (target <= 0) {
                            break;
                        }
                    }
                }
            }
            chosen[c] = toDouble(vectors.get(pick));
        }
        return chosen;
    }

    private void assign(int[] assignment) {
        for (int i = 0; i < vectors.size(); i++) {
            int best = 0;
            double bestDistance = Double.MAX_VALUE;
            for (int c = 0; c < centroids.length; c++) {
                double distance = squaredDistance(vectors.get(i), centroids[c]);
                if (distance < bestDistance) {
                    bestDistance = distance;
                    best = c;
                }
            }
            assignment[i] = best;
        }
    }

    /**
     * Move every centroid to the mean of its members. Empty clusters keep their
     * centroid.
     *
     * @return the largest distance any centroid moved
     */
    private double recompute(int[] assignment) {
        double[][] sums = new double[centroids.length][dimensions];
        int[] counts = new int[centroids.length];
        for (int i = 0; i < assignment.length; i++) {
            float[] vector = vectors.get(i);
            double[] sum = sums[assignment[i]];
            for (int d = 0; d < dimensions; d++) {
                sum[d] += vector[d];
            }
            counts[assignment[i]]++;
        }

        double maxShift = 0;
        for (int c = 0; c < centroids.length; c++) {
            if (counts[c] == 0) {
                continue;
            }
            double moved = 0;
            for (int d = 0; d < dimensions; d++) {
                double mean = sums[c][d] / counts[c];
                double delta = mean - centroids[c][d];
                moved += delta * delta;
                centroids[c][d] = mean;
            }
            maxShift = Math.max(maxShift, Math.sqrt(moved));
        }
        return maxShift;
    }

    private static double squaredDistance(float[] vector, double[] centroid) {
        double sum = 0;
        for (int d = 0; d < vector.length; d++) {
            double delta = vector[d] - centroid[d];
            sum += delta * delta;
        }
        return sum;
    }

    private static double[] toDouble(float[] vector) {
        double[] copy = new double[vector.length];
        for (int d = 0; d < vector.length; d++) {
            copy[d] = vector[d];
        }
        return copy;
    }
}
