package com.raditha.similarity.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.raditha.similarity.model.DetectorId;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Loads similarity detector configuration from a YAML document with
 * programmatic overrides.
 * <p>
 * Configuration priority: explicit overrides > similarity.yml > defaults
 */
public final class SimilaritySettings {

    private static final Logger logger = LoggerFactory.getLogger(SimilaritySettings.class);

    static final String CONFIG_KEY = "similarity_detector";
    static final String DEFAULT_RESOURCE = "similarity.yml";

    private static final YAMLMapper MAPPER = new YAMLMapper();

    private final SimilarityOptions options;
    private final TuningConfig tuning;

    private SimilaritySettings(SimilarityOptions options, TuningConfig tuning) {
        this.options = options;
        this.tuning = tuning;
    }

    public SimilarityOptions options() {
        return options;
    }

    public TuningConfig tuning() {
        return tuning;
    }

    /**
     * Options with explicit overrides applied.
     *
     * @param thresholdOverride threshold in (0,1], null to keep the loaded value
     * @param minLinesOverride  minimum lines, null to keep the loaded value
     * @param presetOverride    preset name replacing the loaded options, null to keep them
     */
    public SimilarityOptions options(@Nullable Double thresholdOverride, @Nullable Integer minLinesOverride,
                                     @Nullable String presetOverride) {
        SimilarityOptions base = presetOverride != null ? SimilarityOptions.forPreset(presetOverride) : options;
        if (thresholdOverride != null) {
            base = base.withThreshold(thresholdOverride);
        }
        if (minLinesOverride != null) {
            base = base.withMinLines(minLinesOverride);
        }
        return base;
    }

    /**
     * Built-in defaults, no YAML involved.
     */
    public static SimilaritySettings defaults() {
        return new SimilaritySettings(SimilarityOptions.moderate(), TuningConfig.defaults());
    }

    /**
     * Load {@code similarity.yml} from the classpath, falling back to defaults
     * when the resource is absent.
     */
    public static SimilaritySettings load() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public static SimilaritySettings loadResource(String resource) {
        try (InputStream in = SimilaritySettings.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.debug("No {} on the classpath, using defaults", resource);
                return defaults();
            }
            return fromMap(MAPPER.readValue(in, new TypeReference<Map<String, Object>>() {}));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }

    public static SimilaritySettings load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            logger.info("Loading similarity settings from {}", path);
            return fromMap(MAPPER.readValue(in, new TypeReference<Map<String, Object>>() {}));
        }
    }

    /**
     * Build settings from an already parsed YAML document.
     */
    public static SimilaritySettings fromMap(@Nullable Map<String, Object> document) {
        Object raw = document == null ? null : document.get(CONFIG_KEY);
        if (!(raw instanceof Map)) {
            return defaults();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) raw;
        return new SimilaritySettings(buildOptions(config), buildTuning(config));
    }

    private static SimilarityOptions buildOptions(Map<String, Object> config) {
        SimilarityOptions base = SimilarityOptions.forPreset(getString(config, "preset", "moderate"));

        double threshold = getDouble(config, "threshold", base.threshold());
        int minLines = getInt(config, "min_lines", base.minLines());
        boolean crossFile = getBoolean(config, "cross_file", base.crossFile());
        List<String> enabled = getListString(config, "enabled_detectors");
        ConsensusStrategy consensus = buildConsensus(config, base.consensus());

        return new SimilarityOptions(threshold, minLines, crossFile, enabled, consensus);
    }

    private static ConsensusStrategy buildConsensus(Map<String, Object> config, ConsensusStrategy fallback) {
        Map<String, Object> consensus = getMap(config, "consensus");
        if (consensus.isEmpty()) {
            return fallback;
        }
        String strategy = getString(consensus, "strategy", fallback.name());
        return switch (strategy.toLowerCase()) {
            case "majority" -> new ConsensusStrategy.Majority(getDouble(consensus, "threshold", 0.5));
            case "intersection" -> ConsensusStrategy.intersection();
            case "union" -> ConsensusStrategy.union();
            case "weighted" -> new ConsensusStrategy.Weighted(
                    buildDetectorWeights(getMap(consensus, "weights")),
                    getDouble(consensus, "threshold", 0.5));
            default -> throw new InvalidOptionsException("Unknown consensus strategy '" + strategy + "'");
        };
    }

    private static Map<DetectorId, Double> buildDetectorWeights(Map<String, Object> weightsMap) {
        Map<DetectorId, Double> weights = new EnumMap<>(DetectorId.class);
        for (Map.Entry<String, Object> entry : weightsMap.entrySet()) {
            if (!(entry.getValue() instanceof Number number)) {
                throw new InvalidOptionsException("Weight for " + entry.getKey() + " must be a number");
            }
            weights.put(DetectorId.fromTag(entry.getKey()), number.doubleValue());
        }
        return weights;
    }

    private static TuningConfig buildTuning(Map<String, Object> config) {
        TuningConfig defaults = TuningConfig.defaults();
        Map<String, Object> lsh = getMap(config, "lsh");
        Map<String, Object> ann = getMap(config, "ann");
        return new TuningConfig(
                getInt(lsh, "fingerprint_bits", defaults.fingerprintBits()),
                getInt(lsh, "bands", defaults.bands()),
                getInt(lsh, "shingle_min", defaults.shingleMin()),
                getInt(lsh, "shingle_max", defaults.shingleMax()),
                getInt(lsh, "max_bucket_size", defaults.maxBucketSize()),
                defaults.seed(),
                buildWeights(config),
                getDouble(config, "size_ratio", defaults.sizeRatio()),
                getInt(ann, "planes", defaults.annPlanes()),
                getInt(ann, "tables", defaults.annTables()),
                getInt(ann, "top_k", defaults.annTopK()),
                AnnAlgorithm.fromTag(getString(ann, "algorithm", defaults.annAlgorithm().tag())),
                getInt(ann, "clusters", defaults.annClusters()));
    }

    private static StructuralWeights buildWeights(Map<String, Object> config) {
        Map<String, Object> weightsMap = getMap(config, "structural_weights");
        if (weightsMap.isEmpty()) {
            return StructuralWeights.balanced();
        }
        StructuralWeights defaults = StructuralWeights.balanced();
        return new StructuralWeights(
                getDouble(weightsMap, "branch", defaults.branchWeight()),
                getDouble(weightsMap, "loop", defaults.loopWeight()),
                getDouble(weightsMap, "depth", defaults.depthWeight()),
                getDouble(weightsMap, "statements", defaults.statementWeight()),
                getDouble(weightsMap, "parameters", defaults.parameterWeight()));
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Map.of();
    }

    private static List<String> getListString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
