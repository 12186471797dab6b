package com.raditha.similarity.model;

/**
 * Rough payoff of consolidating a similarity group.
 */
public enum RefactoringImpact {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Classify from the group's average complexity and combined size.
     *
     * @param averageComplexity   Mean cyclomatic complexity of the members
     * @param combinedLinesOfCode Sum of member lines of code
     */
    public static RefactoringImpact classify(double averageComplexity, int combinedLinesOfCode) {
        if (averageComplexity > 8 && combinedLinesOfCode > 100) {
            return HIGH;
        }
        if (averageComplexity > 5 || combinedLinesOfCode > 50) {
            return MEDIUM;
        }
        return LOW;
    }
}
