package com.raditha.similarity.config;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Nearest neighbour index used by the semantic detector.
 */
public enum AnnAlgorithm {
    /** Random hyperplane hash tables. */
    LSH("lsh"),
    /** k-means partitions searched through the closest centroids. */
    HIERARCHICAL("hierarchical"),
    /** Candidates from both indexes, ranked together by cosine. */
    HYBRID("hybrid");

    private final String tag;

    AnnAlgorithm(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static AnnAlgorithm fromTag(String tag) {
        for (AnnAlgorithm algorithm : values()) {
            if (algorithm.tag.equalsIgnoreCase(tag == null ? "" : tag.trim())) {
                return algorithm;
            }
        }
        throw new InvalidOptionsException("Unknown ANN algorithm '" + tag + "'. Known algorithms: "
                + Arrays.stream(values()).map(AnnAlgorithm::tag).collect(Collectors.joining(", ")));
    }
}
