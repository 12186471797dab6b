package com.raditha.similarity.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FunctionInfoTest {

    @Test
    void testLinesOfCodePrefersMetrics() {
        FunctionInfo withMetrics = new FunctionInfo("id", "f", "A.java", 10, 29, null, List.of(),
                null, new FunctionMetrics(12, 3));
        FunctionInfo withoutMetrics = new FunctionInfo("id", "f", "A.java", 10, 29, null, List.of(),
                null, null);

        assertEquals(12, withMetrics.linesOfCode());
        assertEquals(20, withoutMetrics.linesOfCode());
        assertEquals("L10-29", withoutMetrics.lineRange().toDisplayString());
    }

    @Test
    void testMissingSignatureDefaultsToName() {
        FunctionInfo info = new FunctionInfo("id", "f", "A.java", 3, 3, null, null, null, null);

        assertEquals("f(): void", info.signature().toDisplayString());
        assertTrue(info.tokens().isEmpty());
        assertEquals("L3", info.lineRange().toString());
    }

    @Test
    void testAstNodeHelpers() {
        AstNode tree = AstNode.node("BlockStmt",
                AstNode.node("ReturnStmt", AstNode.local("x")),
                AstNode.operator("BinaryExpr", "+", AstNode.literal("IntegerLiteralExpr", "1"),
                        AstNode.name("SimpleName", "size")));

        assertEquals(6, tree.size());
        assertFalse(tree.isLeaf());
        assertTrue(tree.children().get(0).children().get(0).isLeaf());
        assertEquals(AstNode.Role.LOCAL, tree.children().get(0).children().get(0).role());
        assertEquals("+", tree.children().get(1).value());
    }
}
