package com.raditha.similarity.analyzer;

import com.raditha.similarity.ann.EmbeddingProvider;
import com.raditha.similarity.clustering.ConfidenceCalculator;
import com.raditha.similarity.clustering.ConsensusAggregator;
import com.raditha.similarity.config.InvalidOptionsException;
import com.raditha.similarity.config.SimilarityOptions;
import com.raditha.similarity.config.TuningConfig;
import com.raditha.similarity.detection.DetectionOptions;
import com.raditha.similarity.detection.DetectorRegistry;
import com.raditha.similarity.detection.DetectorUnavailableException;
import com.raditha.similarity.detection.SimilarityDetector;
import com.raditha.similarity.model.ConfidenceScore;
import com.raditha.similarity.model.DetectorId;
import com.raditha.similarity.model.FunctionInfo;
import com.raditha.similarity.model.FunctionRepresentation;
import com.raditha.similarity.model.ScoredPair;
import com.raditha.similarity.model.SimilarityGroup;
import com.raditha.similarity.model.SimilarityPair;
import com.raditha.similarity.representation.RepresentationBuildResult;
import com.raditha.similarity.representation.RepresentationBuilder;
import com.raditha.similarity.representation.RepresentationCache;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Main orchestrator for similarity detection.
 * Validates options, builds representations once, runs the enabled detectors
 * concurrently, merges their results by consensus, scores confidence and
 * returns groups ordered by priority.
 * <p>
 * A detector that is unavailable or fails is degraded to an empty result with
 * a warning; only configuration errors abort a run. Interrupting the calling
 * thread cancels the run at the next stage boundary.
 */
public class SimilarityManager {

    private static final Logger logger = LoggerFactory.getLogger(SimilarityManager.class);

    static final Comparator<SimilarityGroup> PRIORITY_ORDER =
            Comparator.comparingDouble(SimilarityGroup::priority).reversed()
                    .thenComparing(Comparator.comparingDouble(SimilarityGroup::similarity).reversed())
                    .thenComparing(g -> g.members().get(0));

    private final TuningConfig tuning;
    private final EmbeddingProvider embeddings;
    private final @Nullable RepresentationCache cache;
    private final DetectorRegistry registry;

    /**
     * Create manager with default tuning and no embeddings.
     */
    public SimilarityManager() {
        this(TuningConfig.defaults(), EmbeddingProvider.NONE, null);
    }

    public SimilarityManager(TuningConfig tuning, EmbeddingProvider embeddings) {
        this(tuning, embeddings, null);
    }

    /**
     * @param tuning     Algorithm constants
     * @param embeddings Source of optional embeddings
     * @param cache      Caller owned representation cache, or null
     */
    public SimilarityManager(TuningConfig tuning, EmbeddingProvider embeddings,
                             @Nullable RepresentationCache cache) {
        this(tuning, embeddings, cache, new DetectorRegistry(tuning));
    }

    /**
     * @param registry Detector implementations to run
     */
    public SimilarityManager(TuningConfig tuning, EmbeddingProvider embeddings,
                             @Nullable RepresentationCache cache, DetectorRegistry registry) {
        this.tuning = tuning;
        this.embeddings = embeddings;
        this.cache = cache;
        this.registry = registry;
    }

    /**
     * Detect groups of similar functions.
     *
     * @param functions Functions to compare
     * @param options   Run options
     * @return groups sorted by priority, highest first
     * @throws InvalidOptionsException if options are missing or malformed
     * @throws com.raditha.similarity.clustering.AggregationException if weights name disabled detectors
     * @throws CancellationException if the calling thread is interrupted
     */
    public List<SimilarityGroup> detectSimilarities(List<FunctionInfo> functions, SimilarityOptions options) {
        return analyze(functions, options).groups();
    }

    /**
     * Run the full pipeline and report groups together with warnings and skips.
     */
    public SimilarityReport analyze(List<FunctionInfo> functions, SimilarityOptions options) {
        if (options == null) {
            throw new InvalidOptionsException("options cannot be null");
        }
        DetectionOptions detectionOptions = DetectionOptions.from(options);
        Set<DetectorId> requested = options.enabledDetectorIds();
        if (!requested.isEmpty()) {
            ConsensusAggregator.validate(options.consensus(), requested);
        }
        List<String> warnings = new ArrayList<>();

        // Step 1: Build representations once
        checkCancelled("representation building");
        RepresentationBuilder builder = new RepresentationBuilder(tuning, embeddings, cache);
        RepresentationBuildResult built = builder.build(functions == null ? List.of() : functions);
        warnings.addAll(built.warnings());
        List<FunctionRepresentation> representations = built.representations();

        // Step 2: Select detectors
        Set<DetectorId> selected = requested.isEmpty() ? availableDetectors(representations) : requested;
        ConsensusAggregator.validate(options.consensus(), selected);

        // Step 3: Run detectors
        checkCancelled("detection");
        Map<DetectorId, List<SimilarityPair>> results =
                runDetectors(selected, representations, detectionOptions, warnings);
        Map<DetectorId, Integer> pairCounts = new EnumMap<>(DetectorId.class);
        results.forEach((id, pairs) -> pairCounts.put(id, pairs.size()));

        // Step 4: Consensus
        checkCancelled("aggregation");
        Map<String, FunctionRepresentation> byId = new LinkedHashMap<>();
        representations.forEach(r -> byId.put(r.functionId(), r));
        List<SimilarityGroup> aggregated =
                new ConsensusAggregator(byId).aggregate(results, options.consensus(), selected);

        // Step 5: Confidence, filtering and ordering
        checkCancelled("scoring");
        ConfidenceCalculator calculator = new ConfidenceCalculator(byId);
        List<SimilarityGroup> groups = aggregated.stream()
                .map(group -> applyConfidence(group, calculator))
                .filter(group -> group.size() >= 2 && group.similarity() >= options.threshold())
                .sorted(PRIORITY_ORDER)
                .toList();

        SimilarityReport report = new SimilarityReport(groups, warnings, built.skipped(), pairCounts,
                functions == null ? 0 : functions.size(), representations.size(), options);
        logger.info(report.getSummary());
        groups.forEach(group -> logger.debug("  {}", group.formatSummary()));
        return report;
    }

    /**
     * Default detector set: every detector whose inputs are present.
     */
    private Set<DetectorId> availableDetectors(List<FunctionRepresentation> representations) {
        Set<DetectorId> available = new LinkedHashSet<>();
        for (Map.Entry<DetectorId, SimilarityDetector> entry : registry.all().entrySet()) {
            if (entry.getValue().unavailableReason(representations).isEmpty()) {
                available.add(entry.getKey());
            }
        }
        return available;
    }

    private Map<DetectorId, List<SimilarityPair>> runDetectors(Set<DetectorId> selected,
                                                               List<FunctionRepresentation> representations,
                                                               DetectionOptions options,
                                                               List<String> warnings) {
        Map<DetectorId, Future<List<SimilarityPair>>> running = new EnumMap<>(DetectorId.class);
        Map<DetectorId, List<SimilarityPair>> results = new EnumMap<>(DetectorId.class);
        if (selected.isEmpty()) {
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(selected.size(), Runtime.getRuntime().availableProcessors()), new DetectorThreadFactory());
        try {
            for (DetectorId id : selected) {
                SimilarityDetector detector = registry.get(id);
                Optional<String> unavailable = detector.unavailableReason(representations);
                if (unavailable.isPresent()) {
                    degrade(new DetectorUnavailableException(id, unavailable.get()), warnings);
                    continue;
                }
                running.put(id, executor.submit(() -> detector.detect(representations, options)));
            }

            for (Map.Entry<DetectorId, Future<List<SimilarityPair>>> entry : running.entrySet()) {
                try {
                    results.put(entry.getKey(), entry.getValue().get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    degrade(new DetectorUnavailableException(entry.getKey(), String.valueOf(cause.getMessage()),
                            cause), warnings);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.values().forEach(f -> f.cancel(true));
            CancellationException cancelled = new CancellationException("Similarity analysis cancelled during detection");
            cancelled.initCause(e);
            throw cancelled;
        } finally {
            executor.shutdownNow();
        }
        return results;
    }

    private void degrade(DetectorUnavailableException e, List<String> warnings) {
        if (e.getCause() != null) {
            logger.warn(e.getMessage(), e.getCause());
        } else {
            logger.warn(e.getMessage());
        }
        warnings.add(e.getMessage());
    }

    /**
     * Score every kept pair of a group, keep each score on the group and store
     * their mean as the group confidence.
     */
    private SimilarityGroup applyConfidence(SimilarityGroup group, ConfidenceCalculator calculator) {
        int variants = calculator.overloadVariants(group.members());
        List<ScoredPair> scored = new ArrayList<>();
        double total = 0.0;
        for (SimilarityPair pair : group.pairs()) {
            ConfidenceScore score = calculator.score(pair, group.size(), variants);
            scored.add(new ScoredPair(pair, score));
            total += score.finalScore();
        }
        double confidence = scored.isEmpty() ? group.similarity() : total / scored.size();
        return group.withScoring(confidence, scored, Map.of("overloadVariants", variants));
    }

    private static void checkCancelled(String stage) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Similarity analysis cancelled before " + stage);
        }
    }

    private static final class DetectorThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "similarity-detector-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
