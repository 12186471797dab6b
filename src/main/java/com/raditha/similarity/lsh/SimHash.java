package com.raditha.similarity.lsh;

import com.raditha.similarity.model.Fingerprint;
import com.raditha.similarity.normalization.Fnv;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SimHash fingerprint generator over canonical token shingles.
 * <p>
 * Each shingle (token n-gram, n in [minShingle, maxShingle]) is weighted by
 * its number of occurrences. For every output bit a pseudo-random +1/-1
 * hyperplane component is derived from the shingle hash and the seed; the bit
 * is set when the weighted sum over all shingles is positive. The expected
 * Hamming distance between two fingerprints grows with the cosine distance
 * of their shingle vectors.
 */
public class SimHash {

    private final int bits;
    private final int minShingle;
    private final int maxShingle;
    private final long[] seeds;

    /**
     * @param bits       Fingerprint width, 64 or 128
     * @param minShingle Smallest n-gram size
     * @param maxShingle Largest n-gram size
     * @param seed       Hyperplane seed
     */
    public SimHash(int bits, int minShingle, int maxShingle, long seed) {
        if (bits != 64 && bits != 128) {
            throw new IllegalArgumentException("bits must be 64 or 128, got " + bits);
        }
        if (minShingle < 1 || maxShingle < minShingle) {
            throw new IllegalArgumentException(
                    String.format("Invalid shingle range [%d, %d]", minShingle, maxShingle));
        }
        this.bits = bits;
        this.minShingle = minShingle;
        this.maxShingle = maxShingle;
        this.seeds = generateSeeds(bits / 64, seed);
    }

    public int getBits() {
        return bits;
    }

    /**
     * Fingerprint a token stream. An empty stream yields the all-zero fingerprint.
     */
    public Fingerprint compute(List<String> tokens) {
        Map<String, Integer> shingles = shingleWeights(tokens);
        long[] sums = new long[bits];

        for (Map.Entry<String, Integer> shingle : shingles.entrySet()) {
            long shingleHash = Fnv.hash(shingle.getKey());
            int weight = shingle.getValue();
            for (int word = 0; word < seeds.length; word++) {
                // one 64-bit draw gives the signs of 64 hyperplane components
                long signs = Fnv.scramble(shingleHash ^ seeds[word]);
                for (int bit = 0; bit < 64; bit++) {
                    if ((signs & (1L << bit)) != 0) {
                        sums[word * 64 + bit] += weight;
                    } else {
                        sums[word * 64 + bit] -= weight;
                    }
                }
            }
        }

        long[] words = new long[seeds.length];
        for (int i = 0; i < bits; i++) {
            if (sums[i] > 0) {
                words[i >>> 6] |= 1L << (i & 63);
            }
        }
        return new Fingerprint(words, bits);
    }

    /**
     * Count token n-grams of every configured size. Streams shorter than the
     * smallest size contribute one shingle made of all their tokens.
     */
    Map<String, Integer> shingleWeights(List<String> tokens) {
        Map<String, Integer> weights = new LinkedHashMap<>();
        if (tokens.isEmpty()) {
            return weights;
        }
        if (tokens.size() < minShingle) {
            weights.put(String.join(" ", tokens), 1);
            return weights;
        }
        for (int n = minShingle; n <= maxShingle && n <= tokens.size(); n++) {
            for (int i = 0; i + n <= tokens.size(); i++) {
                String shingle = n + ":" + String.join(" ", tokens.subList(i, i + n));
                weights.merge(shingle, 1, Integer::sum);
            }
        }
        return weights;
    }

    private static long[] generateSeeds(int n, long seed) {
        long[] s = new long[n];
        for (int i = 0; i < n; i++) {
            s[i] = Fnv.scramble(seed + i * 0x9e3779b97f4a7c15L);
        }
        return s;
    }
}
