package com.raditha.similarity.model;

/**
 * Line span of a function inside its source file.
 *
 * @param startLine Starting line number (1-indexed)
 * @param endLine   Ending line number (1-indexed, inclusive)
 */
public record LineRange(int startLine, int endLine) {

    public LineRange {
        if (endLine < startLine) {
            throw new IllegalArgumentException(
                    String.format("endLine (%d) must not precede startLine (%d)", endLine, startLine));
        }
    }

    /**
     * Create from a JavaParser range.
     */
    public static LineRange from(com.github.javaparser.Range jpRange) {
        return new LineRange(jpRange.begin.line, jpRange.end.line);
    }

    /**
     * Get total number of lines in this range.
     */
    public int getLineCount() {
        return endLine - startLine + 1;
    }

    /**
     * Format as "L45-52" for display.
     */
    public String toDisplayString() {
        if (startLine == endLine) {
            return "L" + startLine;
        }
        return "L" + startLine + "-" + endLine;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
