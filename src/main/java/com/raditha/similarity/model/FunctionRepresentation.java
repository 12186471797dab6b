package com.raditha.similarity.model;

import org.jspecify.annotations.Nullable;

/**
 * Bundle of comparable artifacts derived from one function.
 * Built once per analysis run and shared read-only by all detectors.
 *
 * @param functionId           Stable identity
 * @param displayName          Function name as declared
 * @param filePath             Source file
 * @param lineRange            Line span
 * @param tokenCount           Number of lexical tokens
 * @param structuralHash       Alpha-renamed Merkle root of the body
 * @param fingerprint          SimHash style bit fingerprint
 * @param signatureHash        Digest over name, parameter types and return type
 * @param signature            Declared signature
 * @param features             Structural feature vector
 * @param linesOfCode          Lines of code
 * @param cyclomaticComplexity McCabe complexity, 0 when unknown
 * @param embedding            Semantic embedding, absent when not supplied
 */
public record FunctionRepresentation(
        String functionId,
        String displayName,
        String filePath,
        LineRange lineRange,
        int tokenCount,
        long structuralHash,
        Fingerprint fingerprint,
        long signatureHash,
        FunctionSignature signature,
        StructuralFeatures features,
        int linesOfCode,
        int cyclomaticComplexity,
        float @Nullable [] embedding) {

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    public String structuralHashHex() {
        return String.format("%016x", structuralHash);
    }
}
