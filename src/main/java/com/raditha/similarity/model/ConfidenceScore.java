package com.raditha.similarity.model;

import java.util.List;

/**
 * Final confidence of a pair with the adjustments that produced it.
 *
 * @param finalScore  Adjusted score clamped to [0,1]
 * @param baseScore   Detector reported score
 * @param adjustments Adjustments in the order they were applied
 */
public record ConfidenceScore(double finalScore, double baseScore, List<Adjustment> adjustments) {

    public ConfidenceScore {
        adjustments = List.copyOf(adjustments);
    }

    public double totalAdjustment() {
        return adjustments.stream().mapToDouble(Adjustment::delta).sum();
    }
}
