package com.raditha.similarity.model;

/**
 * Size and complexity metrics computed by the external analyzer.
 *
 * @param linesOfCode          Physical lines of the function
 * @param cyclomaticComplexity McCabe complexity
 */
public record FunctionMetrics(int linesOfCode, int cyclomaticComplexity) {
}
