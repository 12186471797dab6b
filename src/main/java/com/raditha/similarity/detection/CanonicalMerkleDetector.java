package com.raditha.similarity.detection;

import com.raditha.similarity.model.DetectorId;
import com.raditha.similarity.model.FunctionRepresentation;
import com.raditha.similarity.model.SimilarityPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Structural hash equality under its own provenance tag. Also serves as the
 * confirmation stage for LSH fingerprint candidates.
 */
public class CanonicalMerkleDetector implements SimilarityDetector {

    private static final Logger logger = LoggerFactory.getLogger(CanonicalMerkleDetector.class);

    @Override
    public DetectorId id() {
        return DetectorId.CANONICAL_MERKLE;
    }

    @Override
    public List<SimilarityPair> detect(List<FunctionRepresentation> representations, DetectionOptions options) {
        List<FunctionRepresentation> eligible = CandidateFilter.eligible(representations, options);
        List<SimilarityPair> pairs = new ArrayList<>();

        for (List<FunctionRepresentation> bucket
                : ExactHashDetector.bucketBy(eligible, FunctionRepresentation::structuralHash)) {
            ExactHashDetector.emitPairs(bucket, options, (a, b) ->
                    pairs.add(new SimilarityPair(a.functionId(), b.functionId(), id(), 1.0,
                            "canonical merkle match",
                            Map.of("merkleRoot", a.structuralHashHex(), "bucketSize", bucket.size()))));
        }

        logger.debug("canonical-merkle: {} pairs from {} functions", pairs.size(), eligible.size());
        return CandidateFilter.ordered(pairs);
    }

    /**
     * True when both functions share the same canonical Merkle root.
     */
    public boolean confirms(FunctionRepresentation a, FunctionRepresentation b) {
        return a.structuralHash() == b.structuralHash();
    }
}
