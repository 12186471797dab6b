package com.raditha.similarity.model;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A function record as extracted by the external parser/analyzer.
 *
 * @param id        Stable identity of the function
 * @param name      Display name
 * @param filePath  Source file containing the function
 * @param startLine First line of the function
 * @param endLine   Last line of the function (inclusive)
 * @param ast       Body syntax tree, null when the parser could not produce one
 * @param tokens    Lexical tokens of the function
 * @param signature Declared signature
 * @param metrics   Optional size/complexity metrics
 */
public record FunctionInfo(
        String id,
        String name,
        String filePath,
        int startLine,
        int endLine,
        @Nullable AstNode ast,
        List<String> tokens,
        FunctionSignature signature,
        @Nullable FunctionMetrics metrics) {

    public FunctionInfo {
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
        if (signature == null) {
            signature = new FunctionSignature(name, List.of(), "void");
        }
    }

    public LineRange lineRange() {
        return new LineRange(startLine, Math.max(startLine, endLine));
    }

    /**
     * Lines of code, preferring the analyzer's metric when present.
     */
    public int linesOfCode() {
        if (metrics != null && metrics.linesOfCode() > 0) {
            return metrics.linesOfCode();
        }
        return lineRange().getLineCount();
    }
}
