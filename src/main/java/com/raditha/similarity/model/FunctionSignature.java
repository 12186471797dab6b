package com.raditha.similarity.model;

import java.util.List;

/**
 * Declared shape of a function.
 *
 * @param name           Display name of the function
 * @param parameterTypes Parameter types in declaration order
 * @param returnType     Declared return type ("void" when nothing is returned)
 */
public record FunctionSignature(String name, List<String> parameterTypes, String returnType) {

    public FunctionSignature {
        parameterTypes = parameterTypes == null ? List.of() : List.copyOf(parameterTypes);
    }

    /**
     * Format as {@code name(A, B): R}.
     */
    public String toDisplayString() {
        return name + "(" + String.join(", ", parameterTypes) + "): " + returnType;
    }
}
