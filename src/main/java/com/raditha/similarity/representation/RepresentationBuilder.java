package com.raditha.similarity.representation;

import com.raditha.similarity.ann.EmbeddingProvider;
import com.raditha.similarity.config.TuningConfig;
import com.raditha.similarity.lsh.SimHash;
import com.raditha.similarity.model.Fingerprint;
import com.raditha.similarity.model.FunctionInfo;
import com.raditha.similarity.model.FunctionRepresentation;
import com.raditha.similarity.model.SkipRecord;
import com.raditha.similarity.model.StructuralFeatures;
import com.raditha.similarity.normalization.ASTCanonicalizer;
import com.raditha.similarity.normalization.ASTCanonicalizer.CanonicalForm;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Derives the comparable artifacts of each function: canonical Merkle hash,
 * SimHash fingerprint, signature hash, structural features and the optional
 * embedding.
 * <p>
 * Building is deterministic: the same functions and tuning always produce the
 * same digests. A function that cannot be represented is skipped with a
 * recorded reason; the batch always completes.
 */
public class RepresentationBuilder {

    private static final Logger logger = LoggerFactory.getLogger(RepresentationBuilder.class);

    private final TuningConfig tuning;
    private final EmbeddingProvider embeddings;
    private final @Nullable RepresentationCache cache;
    private final ASTCanonicalizer canonicalizer = new ASTCanonicalizer();
    private final FeatureExtractor featureExtractor = new FeatureExtractor();
    private final SimHash simHash;

    public RepresentationBuilder(TuningConfig tuning) {
        this(tuning, EmbeddingProvider.NONE, null);
    }

    /**
     * @param tuning     Fingerprint and shingle settings
     * @param embeddings Source of optional embeddings
     * @param cache      Caller owned cache, or null to always rebuild
     */
    public RepresentationBuilder(TuningConfig tuning, EmbeddingProvider embeddings,
                                 @Nullable RepresentationCache cache) {
        this.tuning = tuning;
        this.embeddings = embeddings;
        this.cache = cache;
        this.simHash = new SimHash(tuning.fingerprintBits(), tuning.shingleMin(), tuning.shingleMax(),
                tuning.seed());
    }

    /**
     * Build representations for a batch of functions.
     *
     * @param functions Functions in caller order
     * @return representations in input order plus skip records and warnings
     */
    public RepresentationBuildResult build(List<FunctionInfo> functions) {
        List<FunctionRepresentation> built = new ArrayList<>();
        List<SkipRecord> skipped = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (FunctionInfo function : functions) {
            if (function == null || function.id() == null) {
                skipped.add(new SkipRecord("<unknown>", "function record without id"));
                continue;
            }
            if (!seen.add(function.id())) {
                skipped.add(new SkipRecord(function.id(), "duplicate function id"));
                continue;
            }
            try {
                FunctionRepresentation representation = buildOne(function);
                built.add(attachEmbedding(representation, warnings));
            } catch (RepresentationBuildException e) {
                logger.warn("Skipping {}: {}", e.getFunctionId(), e.getMessage());
                skipped.add(new SkipRecord(e.getFunctionId(), e.getMessage()));
            } catch (StackOverflowError e) {
                // record equality on a cached tree still recurses
                logger.warn("Skipping {}: syntax tree too deep", function.id());
                skipped.add(new SkipRecord(function.id(), "syntax tree too deep"));
            }
        }

        logger.debug("Built {} representations, skipped {}", built.size(), skipped.size());
        return new RepresentationBuildResult(built, skipped, warnings);
    }

    /**
     * Build the structural part of one representation, without embedding.
     *
     * @throws RepresentationBuildException if the function's syntax tree is unusable
     */
    public FunctionRepresentation buildOne(FunctionInfo function) {
        if (cache != null) {
            Optional<FunctionRepresentation> cached = cache.lookup(function, tuning);
            if (cached.isPresent()) {
                return cached.get();
            }
        }

        CanonicalForm canonical = canonicalizer.canonicalize(function.id(), function.ast());
        Fingerprint fingerprint = simHash.compute(canonical.tokens());
        StructuralFeatures features = featureExtractor.extract(function.ast(), function.signature());
        int complexity = function.metrics() != null && function.metrics().cyclomaticComplexity() > 0
                ? function.metrics().cyclomaticComplexity()
                : FeatureExtractor.estimateComplexity(features);
        int tokenCount = function.tokens().isEmpty() ? canonical.tokens().size() : function.tokens().size();

        FunctionRepresentation representation = new FunctionRepresentation(
                function.id(),
                function.name(),
                function.filePath(),
                function.lineRange(),
                tokenCount,
                canonical.merkleHash(),
                fingerprint,
                canonicalizer.signatureHash(function.signature()),
                function.signature(),
                features,
                function.linesOfCode(),
                complexity,
                null);

        if (cache != null) {
            cache.store(function, tuning, representation);
        }
        return representation;
    }

    private FunctionRepresentation attachEmbedding(FunctionRepresentation representation, List<String> warnings) {
        float[] embedding;
        try {
            embedding = embeddings.getEmbedding(representation.functionId());
        } catch (RuntimeException e) {
            String warning = String.format("Embedding lookup failed for %s: %s",
                    representation.functionId(), e.getMessage());
            logger.warn(warning);
            warnings.add(warning);
            return representation;
        }
        if (embedding == null) {
            return representation;
        }
        String problem = validateEmbedding(embedding);
        if (problem != null) {
            String warning = String.format("Dropped embedding of %s: %s", representation.functionId(), problem);
            logger.warn(warning);
            warnings.add(warning);
            return representation;
        }
        return new FunctionRepresentation(
                representation.functionId(),
                representation.displayName(),
                representation.filePath(),
                representation.lineRange(),
                representation.tokenCount(),
                representation.structuralHash(),
                representation.fingerprint(),
                representation.signatureHash(),
                representation.signature(),
                representation.features(),
                representation.linesOfCode(),
                representation.cyclomaticComplexity(),
                embedding.clone());
    }

    private static @Nullable String validateEmbedding(float[] embedding) {
        if (embedding.length == 0) {
            return "empty vector";
        }
        for (float value : embedding) {
            if (Float.isNaN(value) || Float.isInfinite(value)) {
                return "non-finite component";
            }
        }
        return null;
    }
}
