package com.raditha.similarity.detection;

import com.raditha.similarity.SimilarityException;
import com.raditha.similarity.model.DetectorId;

/**
 * Thrown when a detector cannot run on the given inputs, e.g. semantic search
 * without embeddings. The manager degrades such detectors to an empty result.
 */
public class DetectorUnavailableException extends SimilarityException {

    private final DetectorId detector;

    public DetectorUnavailableException(DetectorId detector, String reason) {
        super(detector.tag() + " unavailable: " + reason);
        this.detector = detector;
    }

    public DetectorUnavailableException(DetectorId detector, String reason, Throwable cause) {
        super(detector.tag() + " failed: " + reason, cause);
        this.detector = detector;
    }

    public DetectorId getDetector() {
        return detector;
    }
}
