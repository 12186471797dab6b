package com.raditha.similarity.representation;

import com.raditha.similarity.SimilarityException;

/**
 * Thrown when a single function cannot be turned into a representation.
 * The builder recovers by skipping that function.
 */
public class RepresentationBuildException extends SimilarityException {

    private final String functionId;

    public RepresentationBuildException(String functionId, String message) {
        super(message);
        this.functionId = functionId;
    }

    public String getFunctionId() {
        return functionId;
    }
}
