package com.raditha.similarity.clustering;

import com.raditha.similarity.SimilarityException;
import com.raditha.similarity.model.DetectorId;

import java.util.Set;

/**
 * Thrown when a consensus strategy cannot be applied to the enabled detectors,
 * for example weights naming a detector that is not enabled.
 */
public class AggregationException extends SimilarityException {

    private final Set<DetectorId> unknownDetectors;

    public AggregationException(String message, Set<DetectorId> unknownDetectors) {
        super(message);
        this.unknownDetectors = Set.copyOf(unknownDetectors);
    }

    public Set<DetectorId> getUnknownDetectors() {
        return unknownDetectors;
    }
}
