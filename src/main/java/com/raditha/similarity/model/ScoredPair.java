package com.raditha.similarity.model;

/**
 * A kept detector pair with the confidence it was given inside its group.
 *
 * @param pair       Detector pair on an internal edge
 * @param confidence Final confidence and the adjustments that produced it
 */
public record ScoredPair(SimilarityPair pair, ConfidenceScore confidence) {
}
