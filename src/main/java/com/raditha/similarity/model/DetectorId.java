package com.raditha.similarity.model;

import com.raditha.similarity.config.InvalidOptionsException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Closed set of similarity detectors.
 */
public enum DetectorId {
    EXACT_HASH("exact-hash"),
    STRUCTURAL_WEIGHTED("structural-weighted"),
    CANONICAL_MERKLE("canonical-merkle"),
    LSH_FINGERPRINT("lsh-fingerprint"),
    SEMANTIC_ANN("semantic-ann");

    private final String tag;

    DetectorId(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Resolve a detector from its tag.
     *
     * @throws InvalidOptionsException if no detector carries this tag
     */
    public static DetectorId fromTag(String tag) {
        for (DetectorId id : values()) {
            if (id.tag.equalsIgnoreCase(tag == null ? "" : tag.trim())) {
                return id;
            }
        }
        throw new InvalidOptionsException("Unknown detector '" + tag + "'. Known detectors: "
                + Arrays.stream(values()).map(DetectorId::tag).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return tag;
    }
}
