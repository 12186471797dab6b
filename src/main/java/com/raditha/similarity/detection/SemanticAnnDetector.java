package com.raditha.similarity.detection;

import com.raditha.similarity.ann.NeighborIndex;
import com.raditha.similarity.ann.NeighborIndex.Neighbor;
import com.raditha.similarity.config.TuningConfig;
import com.raditha.similarity.model.DetectorId;
import com.raditha.similarity.model.FunctionRepresentation;
import com.raditha.similarity.model.SimilarityPair;
import com.raditha.similarity.model.SimilarityPair.PairKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Semantic nearest neighbour search over supplied embeddings.
 * Emits {@code score = cosine similarity} for the top-k neighbours of every
 * function. Functions without an embedding are ignored; with no embeddings
 * at all the detector returns nothing.
 */
public class SemanticAnnDetector implements SimilarityDetector {

    private static final Logger logger = LoggerFactory.getLogger(SemanticAnnDetector.class);

    private final TuningConfig tuning;

    public SemanticAnnDetector(TuningConfig tuning) {
        this.tuning = tuning;
    }

    @Override
    public DetectorId id() {
        return DetectorId.SEMANTIC_ANN;
    }

    @Override
    public Optional<String> unavailableReason(List<FunctionRepresentation> representations) {
        if (representations.stream().noneMatch(FunctionRepresentation::hasEmbedding)) {
            return Optional.of("no embeddings supplied");
        }
        return Optional.empty();
    }

    @Override
    public List<SimilarityPair> detect(List<FunctionRepresentation> representations, DetectionOptions options) {
        List<FunctionRepresentation> embedded = CandidateFilter.eligible(representations, options).stream()
                .filter(FunctionRepresentation::hasEmbedding)
                .toList();
        if (embedded.isEmpty()) {
            logger.warn("semantic-ann: no embeddings supplied, returning no pairs");
            return List.of();
        }

        int dimensions = embedded.get(0).embedding().length;
        NeighborIndex index = NeighborIndex.create(dimensions, tuning);
        Map<String, FunctionRepresentation> byId = new HashMap<>();
        for (FunctionRepresentation r : embedded) {
            if (r.embedding().length != dimensions) {
                logger.warn("semantic-ann: ignoring {} with {} dimensions, expected {}",
                        r.functionId(), r.embedding().length, dimensions);
                continue;
            }
            index.add(r.functionId(), r.embedding());
            byId.put(r.functionId(), r);
        }

        List<SimilarityPair> pairs = new ArrayList<>();
        Set<PairKey> processed = new HashSet<>();
        for (FunctionRepresentation r : embedded) {
            if (!byId.containsKey(r.functionId())) {
                continue;
            }
            // one extra slot because the query usually finds itself
            List<Neighbor> neighbors = index.search(r.embedding(), tuning.annTopK() + 1);
            int rank = 0;
            for (Neighbor neighbor : neighbors) {
                if (neighbor.id().equals(r.functionId())) {
                    continue;
                }
                rank++;
                FunctionRepresentation other = byId.get(neighbor.id());
                if (!processed.add(PairKey.of(r.functionId(), other.functionId()))) {
                    continue;
                }
                double score = Math.max(0.0, neighbor.similarity());
                if (score < options.threshold() || !CandidateFilter.inScope(r, other, options)) {
                    continue;
                }
                pairs.add(new SimilarityPair(r.functionId(), other.functionId(), id(), score,
                        "semantic neighbour", Map.of("cosine", neighbor.similarity(), "rank", rank)));
            }
        }

        logger.debug("semantic-ann: {} pairs from {} embedded functions ({} index)",
                pairs.size(), byId.size(), tuning.annAlgorithm().tag());
        return CandidateFilter.ordered(pairs);
    }
}
