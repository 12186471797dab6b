package com.raditha.similarity.model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Language neutral syntax tree node handed to the similarity core by an
 * external parser.
 * <p>
 * The {@code kind} names the syntactic construct (for Java sources this is the
 * JavaParser node class, e.g. {@code IfStmt}). Leaves carry their text in
 * {@code value}; structural nodes may carry an operator there.
 *
 * @param kind     Syntactic kind of the node
 * @param value    Identifier text, literal text or operator (may be null)
 * @param role     How the canonicalizer treats this node
 * @param children Ordered child nodes
 */
public record AstNode(String kind, String value, Role role, List<AstNode> children) {

    /**
     * Canonicalization role of a node.
     */
    public enum Role {
        /** Parameter or local variable, renamed during canonicalization */
        LOCAL,
        /** Non-local identifier (method, field, type name), kept verbatim */
        NAME,
        /** Literal, reduced to its kind */
        LITERAL,
        /** Structural node */
        NODE
    }

    public AstNode {
        children = children == null ? List.of() : List.copyOf(children);
        Objects.requireNonNull(role, "role");
    }

    /**
     * Structural node without operator.
     */
    public static AstNode node(String kind, AstNode... children) {
        return new AstNode(kind, null, Role.NODE, List.of(children));
    }

    /**
     * Structural node carrying an operator such as {@code +} or {@code ==}.
     */
    public static AstNode operator(String kind, String operator, AstNode... children) {
        return new AstNode(kind, operator, Role.NODE, List.of(children));
    }

    public static AstNode local(String name) {
        return new AstNode("LocalName", name, Role.LOCAL, List.of());
    }

    public static AstNode name(String kind, String name) {
        return new AstNode(kind, name, Role.NAME, List.of());
    }

    public static AstNode literal(String kind, String text) {
        return new AstNode(kind, text, Role.LITERAL, List.of());
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Count nodes in this subtree, including this node.
     */
    public int size() {
        int total = 0;
        Deque<AstNode> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            AstNode node = pending.pop();
            total++;
            node.children.forEach(pending::push);
        }
        return total;
    }
}
