package com.raditha.similarity.normalization;

import com.raditha.similarity.Functions;
import com.raditha.similarity.model.AstNode;
import com.raditha.similarity.model.FunctionSignature;
import com.raditha.similarity.normalization.ASTCanonicalizer.CanonicalForm;
import com.raditha.similarity.representation.RepresentationBuildException;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.StringLength;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.raditha.similarity.model.AstNode.literal;
import static com.raditha.similarity.model.AstNode.local;
import static com.raditha.similarity.model.AstNode.name;
import static com.raditha.similarity.model.AstNode.node;
import static com.raditha.similarity.model.AstNode.operator;
import static org.junit.jupiter.api.Assertions.*;

class ASTCanonicalizerTest {

    private ASTCanonicalizer canonicalizer;

    @BeforeEach
    void setUp() {
        canonicalizer = new ASTCanonicalizer();
    }

    @Test
    void testLocalsAreRenamedInFirstSeenOrder() {
        AstNode assign = operator("AssignExpr", "=", local("total"),
                operator("BinaryExpr", "*", local("price"), local("qty")));

        CanonicalForm form = canonicalizer.canonicalize("f", node("ExpressionStmt", assign));

        assertEquals(List.of("ExpressionStmt", "AssignExpr:=", "v0", "BinaryExpr:*", "v1", "v2"), form.tokens());
        assertEquals(3, form.localCount());
    }

    @Test
    void testRenamingLocalsKeepsHash() {
        CanonicalForm a = canonicalizer.canonicalize("a", Functions.sumBody("acc", "item", "values"));
        CanonicalForm b = canonicalizer.canonicalize("b", Functions.sumBody("total", "n", "numbers"));

        assertEquals(a.merkleHash(), b.merkleHash());
        assertEquals(a.tokens(), b.tokens());
    }

    @Property(tries = 50)
    void renamingNeverChangesHash(@ForAll @AlphaChars @StringLength(min = 1, max = 8) String acc,
                                  @ForAll @AlphaChars @StringLength(min = 1, max = 8) String item) {
        CanonicalForm reference = new ASTCanonicalizer().canonicalize("ref", Functions.sumBody("x", "y", "z"));
        String list = acc + item + "List";
        if (acc.equals(item)) {
            item = item + "2";
        }
        CanonicalForm renamed = new ASTCanonicalizer().canonicalize("renamed", Functions.sumBody(acc, item, list));

        assertEquals(reference.merkleHash(), renamed.merkleHash());
    }

    @Test
    void testNonLocalNamesAndLiteralKindsMatter() {
        AstNode callFoo = node("ExpressionStmt", node("MethodCallExpr", name("SimpleName", "foo"), local("x")));
        AstNode callBar = node("ExpressionStmt", node("MethodCallExpr", name("SimpleName", "bar"), local("x")));
        AstNode one = node("ReturnStmt", literal("IntegerLiteralExpr", "1"));
        AstNode two = node("ReturnStmt", literal("IntegerLiteralExpr", "2"));
        AstNode text = node("ReturnStmt", literal("StringLiteralExpr", "1"));

        assertNotEquals(canonicalizer.canonicalize("f", callFoo).merkleHash(),
                canonicalizer.canonicalize("f", callBar).merkleHash());
        assertEquals(canonicalizer.canonicalize("f", one).merkleHash(),
                canonicalizer.canonicalize("f", two).merkleHash());
        assertNotEquals(canonicalizer.canonicalize("f", one).merkleHash(),
                canonicalizer.canonicalize("f", text).merkleHash());
    }

    @Test
    void testOperatorsMatter() {
        AstNode plus = node("ReturnStmt", operator("BinaryExpr", "+", local("a"), local("b")));
        AstNode minus = node("ReturnStmt", operator("BinaryExpr", "-", local("a"), local("b")));

        assertNotEquals(canonicalizer.canonicalize("f", plus).merkleHash(),
                canonicalizer.canonicalize("f", minus).merkleHash());
    }

    @Test
    void testReorderingStatementsChangesHash() {
        CanonicalForm original = canonicalizer.canonicalize("f", Functions.loggingBody("msg", "count", false));
        CanonicalForm reordered = canonicalizer.canonicalize("f", Functions.loggingBody("msg", "count", true));

        assertNotEquals(original.merkleHash(), reordered.merkleHash());
        assertEquals(original.tokens().size(), reordered.tokens().size());
    }

    @Test
    void testAliasingIsDistinguished() {
        // a + b versus a + a
        AstNode distinct = node("ReturnStmt", operator("BinaryExpr", "+", local("a"), local("b")));
        AstNode aliased = node("ReturnStmt", operator("BinaryExpr", "+", local("a"), local("a")));

        assertNotEquals(canonicalizer.canonicalize("f", distinct).merkleHash(),
                canonicalizer.canonicalize("f", aliased).merkleHash());
    }

    @Test
    void testMissingOrEmptyAstIsRejected() {
        RepresentationBuildException missing = assertThrows(RepresentationBuildException.class,
                () -> canonicalizer.canonicalize("f", null));
        assertEquals("f", missing.getFunctionId());
        assertTrue(missing.getMessage().contains("missing AST"));

        RepresentationBuildException empty = assertThrows(RepresentationBuildException.class,
                () -> canonicalizer.canonicalize("g", node("BlockStmt")));
        assertTrue(empty.getMessage().contains("empty AST"));
    }

    @Test
    void testMalformedAstIsRejected() {
        AstNode localWithChildren = new AstNode("LocalName", "x", AstNode.Role.LOCAL, List.of(local("y")));
        AstNode blankKind = node("BlockStmt", new AstNode(" ", null, AstNode.Role.NODE, List.of()));
        AstNode unnamedLocal = node("BlockStmt", new AstNode("LocalName", "", AstNode.Role.LOCAL, List.of()));

        assertThrows(RepresentationBuildException.class,
                () -> canonicalizer.canonicalize("f", node("BlockStmt", localWithChildren)));
        assertThrows(RepresentationBuildException.class, () -> canonicalizer.canonicalize("f", blankKind));
        assertThrows(RepresentationBuildException.class, () -> canonicalizer.canonicalize("f", unnamedLocal));
    }

    @Test
    void testSignatureHash() {
        FunctionSignature sum = new FunctionSignature("sum", List.of("List<Integer>"), "int");
        FunctionSignature sameSum = new FunctionSignature("sum", List.of("List<Integer>"), "int");
        FunctionSignature overload = new FunctionSignature("sum", List.of("int[]"), "int");
        FunctionSignature longSum = new FunctionSignature("sum", List.of("List<Integer>"), "long");

        assertEquals(canonicalizer.signatureHash(sum), canonicalizer.signatureHash(sameSum));
        assertNotEquals(canonicalizer.signatureHash(sum), canonicalizer.signatureHash(overload));
        assertNotEquals(canonicalizer.signatureHash(sum), canonicalizer.signatureHash(longSum));
    }
}
