package com.raditha.similarity.representation;

import com.raditha.similarity.model.FunctionRepresentation;
import com.raditha.similarity.model.SkipRecord;

import java.util.List;

/**
 * Output of one representation build.
 *
 * @param representations Successfully built representations, in input order
 * @param skipped         Functions excluded from comparison
 * @param warnings        Non fatal notes, e.g. embeddings that were dropped
 */
public record RepresentationBuildResult(
        List<FunctionRepresentation> representations,
        List<SkipRecord> skipped,
        List<String> warnings) {

    public RepresentationBuildResult {
        representations = List.copyOf(representations);
        skipped = List.copyOf(skipped);
        warnings = List.copyOf(warnings);
    }
}
