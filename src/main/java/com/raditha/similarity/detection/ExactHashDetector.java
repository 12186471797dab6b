package com.raditha.similarity.detection;

import com.raditha.similarity.model.DetectorId;
import com.raditha.similarity.model.FunctionRepresentation;
import com.raditha.similarity.model.SimilarityPair;
import com.raditha.similarity.model.SimilarityPair.PairKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToLongFunction;

/**
 * Buckets functions by canonical structural hash (score 1.0) and, for the
 * remaining pairs, by signature hash (score 0.6).
 */
public class ExactHashDetector implements SimilarityDetector {

    private static final Logger logger = LoggerFactory.getLogger(ExactHashDetector.class);

    static final double STRUCTURE_SCORE = 1.0;
    static final double SIGNATURE_SCORE = 0.6;

    @Override
    public DetectorId id() {
        return DetectorId.EXACT_HASH;
    }

    @Override
    public List<SimilarityPair> detect(List<FunctionRepresentation> representations, DetectionOptions options) {
        List<FunctionRepresentation> eligible = CandidateFilter.eligible(representations, options);
        List<SimilarityPair> pairs = new ArrayList<>();
        Set<PairKey> emitted = new HashSet<>();

        if (STRUCTURE_SCORE >= options.threshold()) {
            for (List<FunctionRepresentation> bucket : bucketBy(eligible, FunctionRepresentation::structuralHash)) {
                emitPairs(bucket, options, (a, b) -> {
                    emitted.add(PairKey.of(a.functionId(), b.functionId()));
                    pairs.add(new SimilarityPair(a.functionId(), b.functionId(), id(), STRUCTURE_SCORE,
                            "identical structure", Map.of("structuralHash", a.structuralHashHex())));
                });
            }
        }

        if (SIGNATURE_SCORE >= options.threshold()) {
            for (List<FunctionRepresentation> bucket : bucketBy(eligible, FunctionRepresentation::signatureHash)) {
                emitPairs(bucket, options, (a, b) -> {
                    if (emitted.add(PairKey.of(a.functionId(), b.functionId()))) {
                        pairs.add(new SimilarityPair(a.functionId(), b.functionId(), id(), SIGNATURE_SCORE,
                                "matching signature", Map.of("signature", a.signature().toDisplayString())));
                    }
                });
            }
        }

        logger.debug("exact-hash: {} pairs from {} functions", pairs.size(), eligible.size());
        return CandidateFilter.ordered(pairs);
    }

    /**
     * Group by a 64-bit key, keeping only buckets with at least two members.
     */
    static List<List<FunctionRepresentation>> bucketBy(List<FunctionRepresentation> representations,
                                                       ToLongFunction<FunctionRepresentation> key) {
        Map<Long, List<FunctionRepresentation>> buckets = new LinkedHashMap<>();
        for (FunctionRepresentation r : representations) {
            buckets.computeIfAbsent(key.applyAsLong(r), k -> new ArrayList<>()).add(r);
        }
        return buckets.values().stream().filter(b -> b.size() > 1).toList();
    }

    /**
     * Every in-scope pair of a bucket.
     */
    static void emitPairs(List<FunctionRepresentation> bucket, DetectionOptions options, PairSink sink) {
        for (int i = 0; i < bucket.size(); i++) {
            for (int j = i + 1; j < bucket.size(); j++) {
                if (CandidateFilter.inScope(bucket.get(i), bucket.get(j), options)) {
                    sink.accept(bucket.get(i), bucket.get(j));
                }
            }
        }
    }

    @FunctionalInterface
    interface PairSink {
        void accept(FunctionRepresentation first, FunctionRepresentation second);
    }
}
