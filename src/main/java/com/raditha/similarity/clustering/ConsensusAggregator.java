package com.raditha.similarity.clustering;

import com.raditha.similarity.config.ConsensusStrategy;
import com.raditha.similarity.model.DetectorId;
import com.raditha.similarity.model.FunctionRepresentation;
import com.raditha.similarity.model.RefactoringImpact;
import com.raditha.similarity.model.SimilarityGroup;
import com.raditha.similarity.model.SimilarityPair;
import com.raditha.similarity.model.SimilarityPair.PairKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Merges the pairs of several detectors into similarity groups.
 * <p>
 * All pairs form an undirected multigraph with one edge per function pair and
 * one vote per detector that reported it. The strategy decides which edges
 * survive; surviving edges are clustered into connected components with
 * union-find. Output is sorted by similarity (highest first), then by member
 * ids, so identical input always yields identical output.
 */
public class ConsensusAggregator {

    private static final Logger logger = LoggerFactory.getLogger(ConsensusAggregator.class);

    // absorbs rounding in threshold products such as 0.6 * 5
    private static final double EPSILON = 1e-9;

    static final Comparator<SimilarityGroup> GROUP_ORDER =
            Comparator.comparingDouble(SimilarityGroup::similarity).reversed()
                    .thenComparing(g -> String.join("\n", g.members()));

    private final Map<String, FunctionRepresentation> representations;

    /**
     * Aggregator without size information; groups get no line count and LOW impact.
     */
    public ConsensusAggregator() {
        this(Map.of());
    }

    /**
     * @param representations Function representations by id, used for size and impact
     */
    public ConsensusAggregator(Map<String, FunctionRepresentation> representations) {
        this.representations = representations;
    }

    /**
     * Aggregate with the detectors present in the map as the enabled set.
     *
     * @throws AggregationException if a weighted strategy names a detector not in the map
     */
    public List<SimilarityGroup> aggregate(Map<DetectorId, List<SimilarityPair>> perDetectorPairs,
                                           ConsensusStrategy strategy) {
        return aggregate(perDetectorPairs, strategy, perDetectorPairs.keySet());
    }

    /**
     * Aggregate the results of the detectors that completed.
     *
     * @param perDetectorPairs    Pairs of every completed detector
     * @param strategy            Consensus rule
     * @param configuredDetectors Detectors enabled for the run, including degraded ones
     * @throws AggregationException if a weighted strategy names a detector that is not configured
     */
    public List<SimilarityGroup> aggregate(Map<DetectorId, List<SimilarityPair>> perDetectorPairs,
                                           ConsensusStrategy strategy,
                                           Set<DetectorId> configuredDetectors) {
        validate(strategy, configuredDetectors);

        int enabled = perDetectorPairs.size();
        if (enabled == 0) {
            return List.of();
        }

        Map<PairKey, Map<DetectorId, SimilarityPair>> edges = collectEdges(perDetectorPairs);
        Map<PairKey, Map<DetectorId, SimilarityPair>> kept = new TreeMap<>();
        for (Map.Entry<PairKey, Map<DetectorId, SimilarityPair>> edge : edges.entrySet()) {
            if (accepts(strategy, edge.getValue().keySet(), enabled)) {
                kept.put(edge.getKey(), edge.getValue());
            }
        }
        logger.debug("{} consensus kept {} of {} edges from {} detectors",
                strategy.name(), kept.size(), edges.size(), enabled);

        UnionFind unionFind = new UnionFind();
        Set<String> nodes = new TreeSet<>();
        for (PairKey key : kept.keySet()) {
            unionFind.union(key.firstId(), key.secondId());
            nodes.add(key.firstId());
            nodes.add(key.secondId());
        }

        List<SimilarityGroup> groups = new ArrayList<>();
        for (List<String> component : unionFind.components(nodes)) {
            if (component.size() >= 2) {
                groups.add(buildGroup(component, kept, strategy));
            }
        }
        groups.sort(GROUP_ORDER);
        return groups;
    }

    /**
     * Check that the strategy only references configured detectors.
     *
     * @throws AggregationException otherwise
     */
    public static void validate(ConsensusStrategy strategy, Set<DetectorId> configuredDetectors) {
        if (strategy instanceof ConsensusStrategy.Weighted weighted) {
            Set<DetectorId> unknown = EnumSet.noneOf(DetectorId.class);
            for (DetectorId id : weighted.weights().keySet()) {
                if (!configuredDetectors.contains(id)) {
                    unknown.add(id);
                }
            }
            if (!unknown.isEmpty()) {
                throw new AggregationException(
                        "Weighted consensus references detectors that are not enabled: " + unknown, unknown);
            }
        }
    }

    /**
     * Decide whether an edge reported by {@code voters} survives.
     */
    static boolean accepts(ConsensusStrategy strategy, Set<DetectorId> voters, int enabled) {
        int votes = voters.size();
        if (strategy instanceof ConsensusStrategy.Union) {
            return votes >= 1;
        }
        if (strategy instanceof ConsensusStrategy.Intersection) {
            return votes == enabled;
        }
        if (strategy instanceof ConsensusStrategy.Majority majority) {
            int required = (int) Math.ceil(majority.threshold() * enabled - EPSILON);
            return votes >= Math.max(1, required);
        }
        if (strategy instanceof ConsensusStrategy.Weighted weighted) {
            double sum = 0.0;
            for (DetectorId voter : voters) {
                sum += weighted.weightOf(voter);
            }
            return sum >= weighted.threshold() - EPSILON;
        }
        throw new IllegalArgumentException("Unsupported consensus strategy: " + strategy);
    }

    /**
     * Index pairs by edge; duplicate reports from one detector keep the highest score.
     */
    private Map<PairKey, Map<DetectorId, SimilarityPair>> collectEdges(
            Map<DetectorId, List<SimilarityPair>> perDetectorPairs) {
        Map<PairKey, Map<DetectorId, SimilarityPair>> edges = new TreeMap<>();
        for (Map.Entry<DetectorId, List<SimilarityPair>> entry : perDetectorPairs.entrySet()) {
            for (SimilarityPair pair : entry.getValue()) {
                Map<DetectorId, SimilarityPair> votes =
                        edges.computeIfAbsent(pair.key(), k -> new EnumMap<>(DetectorId.class));
                votes.merge(entry.getKey(), pair, (old, neu) -> neu.score() > old.score() ? neu : old);
            }
        }
        return edges;
    }

    private SimilarityGroup buildGroup(List<String> component,
                                       Map<PairKey, Map<DetectorId, SimilarityPair>> kept,
                                       ConsensusStrategy strategy) {
        Set<String> members = new HashSet<>(component);
        List<SimilarityPair> pairs = new ArrayList<>();
        Set<DetectorId> contributing = EnumSet.noneOf(DetectorId.class);
        Set<String> explanations = new TreeSet<>();
        Map<String, Integer> votes = new TreeMap<>();
        int edgeCount = 0;
        double scoreSum = 0.0;

        for (Map.Entry<PairKey, Map<DetectorId, SimilarityPair>> edge : kept.entrySet()) {
            if (!members.contains(edge.getKey().firstId())) {
                continue;
            }
            edgeCount++;
            for (Map.Entry<DetectorId, SimilarityPair> vote : edge.getValue().entrySet()) {
                SimilarityPair pair = vote.getValue();
                pairs.add(pair);
                contributing.add(vote.getKey());
                explanations.add(pair.explanation());
                votes.merge(vote.getKey().tag(), 1, Integer::sum);
                scoreSum += pair.score();
            }
        }

        double similarity = pairs.isEmpty() ? 0.0 : Math.min(1.0, scoreSum / pairs.size());
        int linesOfCode = 0;
        double complexity = 0.0;
        for (String id : component) {
            FunctionRepresentation r = representations.get(id);
            if (r != null) {
                linesOfCode += r.linesOfCode();
                complexity += r.cyclomaticComplexity();
            }
        }
        RefactoringImpact impact = RefactoringImpact.classify(complexity / component.size(), linesOfCode);

        Map<String, Object> metadata = new TreeMap<>();
        metadata.put("edgeCount", edgeCount);
        metadata.put("detectorVotes", Collections.unmodifiableMap(votes));
        metadata.put("strategy", strategy.name());

        return new SimilarityGroup(
                component,
                similarity,
                similarity,
                "consensus-" + strategy.name(),
                new ArrayList<>(contributing),
                String.join("; ", explanations),
                metadata,
                impact,
                linesOfCode,
                pairs,
                List.of());
    }
}
