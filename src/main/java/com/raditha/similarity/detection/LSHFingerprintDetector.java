package com.raditha.similarity.detection;

import com.raditha.similarity.config.TuningConfig;
import com.raditha.similarity.lsh.FingerprintLSHIndex;
import com.raditha.similarity.model.DetectorId;
import com.raditha.similarity.model.FunctionRepresentation;
import com.raditha.similarity.model.SimilarityPair;
import com.raditha.similarity.model.SimilarityPair.PairKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Two stage near-duplicate search over bit fingerprints.
 * <p>
 * Stage 1 buckets every fingerprint band and takes functions that share at
 * least one band as candidates. Stage 2 confirms each candidate with the exact
 * Hamming distance; the score is {@code 1 - distance / bits}. Each call builds
 * its own band index, which is read-only once filled.
 */
public class LSHFingerprintDetector implements SimilarityDetector {

    private static final Logger logger = LoggerFactory.getLogger(LSHFingerprintDetector.class);

    private final TuningConfig tuning;
    private final CanonicalMerkleDetector merkle;

    public LSHFingerprintDetector(TuningConfig tuning, CanonicalMerkleDetector merkle) {
        this.tuning = tuning;
        this.merkle = merkle;
    }

    @Override
    public DetectorId id() {
        return DetectorId.LSH_FINGERPRINT;
    }

    @Override
    public List<SimilarityPair> detect(List<FunctionRepresentation> representations, DetectionOptions options) {
        List<FunctionRepresentation> eligible = CandidateFilter.eligible(representations, options);
        if (eligible.size() < 2) {
            return List.of();
        }

        FingerprintLSHIndex index = new FingerprintLSHIndex(
                tuning.bands(), tuning.bandWidth(), tuning.maxBucketSize());
        Map<String, FunctionRepresentation> byId = new HashMap<>();
        for (FunctionRepresentation r : eligible) {
            index.add(r.functionId(), r.fingerprint());
            byId.put(r.functionId(), r);
        }

        Map<PairKey, Integer> candidates = index.candidatePairs();
        List<SimilarityPair> pairs = new ArrayList<>();
        for (Map.Entry<PairKey, Integer> candidate : candidates.entrySet()) {
            FunctionRepresentation a = byId.get(candidate.getKey().firstId());
            FunctionRepresentation b = byId.get(candidate.getKey().secondId());
            if (!CandidateFilter.inScope(a, b, options)) {
                continue;
            }
            int distance = a.fingerprint().hammingDistance(b.fingerprint());
            double score = 1.0 - (double) distance / a.fingerprint().bits();
            if (score < options.threshold()) {
                continue;
            }
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("hammingDistance", distance);
            metadata.put("bands", candidate.getValue());
            metadata.put("merkleConfirmed", merkle.confirms(a, b));
            pairs.add(new SimilarityPair(a.functionId(), b.functionId(), id(), score,
                    distance == 0 ? "identical fingerprint" : "near-duplicate fingerprint", metadata));
        }

        logger.debug("lsh-fingerprint: {} candidates, {} confirmed, {} oversized buckets reduced to exact matches",
                candidates.size(), pairs.size(), index.getOversizedBuckets());
        return CandidateFilter.ordered(pairs);
    }
}
