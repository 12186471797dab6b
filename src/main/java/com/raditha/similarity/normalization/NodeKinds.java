package com.raditha.similarity.normalization;

import java.util.Set;

/**
 * Classification of syntax node kinds used for structural features.
 * Recognizes JavaParser class names as well as the snake_case kinds
 * produced by grammar based parsers.
 */
public final class NodeKinds {

    private static final Set<String> BRANCHES = Set.of(
            "IfStmt", "SwitchStmt", "SwitchExpr", "ConditionalExpr", "CatchClause",
            "if_statement", "switch_statement", "switch_expression", "conditional_expression",
            "ternary_expression", "catch_clause");

    private static final Set<String> LOOPS = Set.of(
            "ForStmt", "ForEachStmt", "WhileStmt", "DoStmt",
            "for_statement", "enhanced_for_statement", "for_in_statement", "for_of_statement",
            "while_statement", "do_statement");

    private static final Set<String> NON_STATEMENTS = Set.of(
            "BlockStmt", "block", "statement_block", "EmptyStmt", "empty_statement");

    private NodeKinds() {
    }

    public static boolean isBranch(String kind) {
        return BRANCHES.contains(kind);
    }

    public static boolean isLoop(String kind) {
        return LOOPS.contains(kind);
    }

    /**
     * Control structures increase nesting depth.
     */
    public static boolean isControl(String kind) {
        return isBranch(kind) || isLoop(kind);
    }

    /**
     * True for statements other than blocks and empty statements.
     */
    public static boolean isStatement(String kind) {
        if (NON_STATEMENTS.contains(kind)) {
            return false;
        }
        return kind.endsWith("Stmt") || kind.endsWith("_statement")
                || (kind.startsWith("local_") && kind.endsWith("_declaration"));
    }
}
