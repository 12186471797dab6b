package com.raditha.similarity.model;

/**
 * Small structural feature vector used by the structural-weighted detector.
 *
 * @param branchCount     Conditional constructs (if, switch, ternary, catch)
 * @param loopCount       Loop constructs
 * @param nestingDepth    Maximum nesting of branches and loops
 * @param statementCount  Statements excluding blocks
 * @param parameterCount  Declared parameters
 */
public record StructuralFeatures(
        int branchCount,
        int loopCount,
        int nestingDepth,
        int statementCount,
        int parameterCount) {

    public int[] toArray() {
        return new int[] { branchCount, loopCount, nestingDepth, statementCount, parameterCount };
    }
}
