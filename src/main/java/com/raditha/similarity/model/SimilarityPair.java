package com.raditha.similarity.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * An unordered pair of functions reported by one detector.
 * The ids are stored in lexicographic order so equal pairs compare equal
 * regardless of discovery order.
 *
 * @param firstId     Lexicographically smaller function id
 * @param secondId    Lexicographically larger function id
 * @param detector    Detector that reported the pair
 * @param score       Detector specific similarity (0.0-1.0)
 * @param explanation Reason code, e.g. "identical structure"
 * @param metadata    Detector specific facts, sorted by key
 */
public record SimilarityPair(
        String firstId,
        String secondId,
        DetectorId detector,
        double score,
        String explanation,
        Map<String, Object> metadata) {

    public SimilarityPair {
        if (firstId.equals(secondId)) {
            throw new IllegalArgumentException("A pair needs two distinct functions: " + firstId);
        }
        if (firstId.compareTo(secondId) > 0) {
            String swap = firstId;
            firstId = secondId;
            secondId = swap;
        }
        if (score < 0.0 || score > 1.0 || Double.isNaN(score)) {
            throw new IllegalArgumentException("score must be between 0.0 and 1.0, got " + score);
        }
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(metadata));
    }

    public static SimilarityPair of(String a, String b, DetectorId detector, double score, String explanation) {
        return new SimilarityPair(a, b, detector, score, explanation, Map.of());
    }

    /**
     * Key identifying the unordered pair independent of detector.
     */
    public PairKey key() {
        return new PairKey(firstId, secondId);
    }

    /**
     * Unordered pair identity.
     */
    public record PairKey(String firstId, String secondId) implements Comparable<PairKey> {

        public static PairKey of(String a, String b) {
            return a.compareTo(b) <= 0 ? new PairKey(a, b) : new PairKey(b, a);
        }

        @Override
        public int compareTo(PairKey o) {
            int c = firstId.compareTo(o.firstId);
            return c != 0 ? c : secondId.compareTo(o.secondId);
        }
    }
}
