package com.raditha.similarity.detection;

import com.raditha.similarity.model.DetectorId;
import com.raditha.similarity.model.FunctionRepresentation;
import com.raditha.similarity.model.SimilarityPair;

import java.util.List;
import java.util.Optional;

/**
 * A similarity detector over a fixed set of function representations.
 * <p>
 * Implementations are side-effect free: they never mutate the representations
 * and keep no state between calls, so several detectors may run concurrently
 * on the same input. Every implementation drops pairs scoring below the
 * threshold, ignores functions under the minimum size and honours the
 * cross-file switch.
 */
public interface SimilarityDetector {

    DetectorId id();

    /**
     * Detect similar pairs.
     *
     * @param representations Functions to compare
     * @param options         Threshold and scoping filters
     * @return pairs ordered by function ids
     */
    List<SimilarityPair> detect(List<FunctionRepresentation> representations, DetectionOptions options);

    /**
     * Why this detector cannot produce results for the given input, if it cannot.
     */
    default Optional<String> unavailableReason(List<FunctionRepresentation> representations) {
        return Optional.empty();
    }
}
