package com.raditha.similarity.detection;

import com.raditha.similarity.config.TuningConfig;
import com.raditha.similarity.model.DetectorId;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * The closed set of detector implementations, one per {@link DetectorId}.
 */
public final class DetectorRegistry {

    private final Map<DetectorId, SimilarityDetector> detectors;

    public DetectorRegistry(TuningConfig tuning) {
        CanonicalMerkleDetector merkle = new CanonicalMerkleDetector();
        Map<DetectorId, SimilarityDetector> all = new EnumMap<>(DetectorId.class);
        all.put(DetectorId.EXACT_HASH, new ExactHashDetector());
        all.put(DetectorId.STRUCTURAL_WEIGHTED, new StructuralWeightedDetector(tuning));
        all.put(DetectorId.CANONICAL_MERKLE, merkle);
        all.put(DetectorId.LSH_FINGERPRINT, new LSHFingerprintDetector(tuning, merkle));
        all.put(DetectorId.SEMANTIC_ANN, new SemanticAnnDetector(tuning));
        this.detectors = Collections.unmodifiableMap(all);
    }

    private DetectorRegistry(Map<DetectorId, SimilarityDetector> detectors) {
        this.detectors = Collections.unmodifiableMap(new EnumMap<>(detectors));
    }

    /**
     * Copy of this registry with the detector for {@code detector.id()} swapped out.
     */
    public DetectorRegistry replace(SimilarityDetector detector) {
        Map<DetectorId, SimilarityDetector> copy = new EnumMap<>(detectors);
        copy.put(detector.id(), detector);
        return new DetectorRegistry(copy);
    }

    public SimilarityDetector get(DetectorId id) {
        return detectors.get(id);
    }

    /**
     * All detectors in {@link DetectorId} order.
     */
    public Map<DetectorId, SimilarityDetector> all() {
        return detectors;
    }
}
