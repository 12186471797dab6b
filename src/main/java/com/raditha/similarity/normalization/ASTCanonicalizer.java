package com.raditha.similarity.normalization;

import com.raditha.similarity.model.AstNode;
import com.raditha.similarity.model.FunctionSignature;
import com.raditha.similarity.representation.RepresentationBuildException;
import org.jspecify.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Canonicalizes a function body for rename-insensitive comparison.
 * <p>
 * Local identifiers are replaced by {@code v0, v1, ...} in first-seen preorder
 * position, literals are reduced to their kind and every other node keeps its
 * kind (and operator, where present). Node order is preserved, so reordering
 * statements changes the Merkle hash while renaming locals does not.
 *
 * Example:
 * Original: total = price * qty;
 * Canonical: AssignExpr:= v0 BinaryExpr:* v1 v2
 */
public class ASTCanonicalizer {

    /**
     * Result of canonicalizing one body.
     *
     * @param tokens     Canonical preorder token stream
     * @param merkleHash 64-bit Merkle root
     * @param localCount Distinct local identifiers encountered
     */
    public record CanonicalForm(List<String> tokens, long merkleHash, int localCount) {
        public CanonicalForm {
            tokens = List.copyOf(tokens);
        }
    }

    /**
     * Canonicalize the body of one function.
     *
     * @param functionId Function being canonicalized, used in failure reports
     * @param root       Body syntax tree
     * @throws RepresentationBuildException if the tree is missing, empty or malformed
     */
    public CanonicalForm canonicalize(String functionId, @Nullable AstNode root) {
        if (root == null) {
            throw new RepresentationBuildException(functionId, "missing AST");
        }
        if (root.isLeaf() && root.role() == AstNode.Role.NODE) {
            throw new RepresentationBuildException(functionId, "empty AST");
        }
        Walk walk = new Walk(functionId);
        long hash = walk.visit(root);
        return new CanonicalForm(walk.tokens, hash, walk.locals.size());
    }

    /**
     * Digest over display name, parameter types and return type.
     */
    public long signatureHash(FunctionSignature signature) {
        long h = Fnv.hash(String.valueOf(signature.name()));
        h = Fnv.hash(h, "(");
        for (String type : signature.parameterTypes()) {
            h = Fnv.hash(h, type);
            h = Fnv.hash(h, ",");
        }
        h = Fnv.hash(h, ")");
        return Fnv.hash(h, signature.returnType() == null ? "void" : signature.returnType());
    }

    // Per-call state
    private static final class Walk {
        private final String functionId;
        private final Map<String, String> locals = new HashMap<>();
        private final List<String> tokens = new ArrayList<>();

        private Walk(String functionId) {
            this.functionId = functionId;
        }

        /**
         * Preorder token emission and postorder hashing over an explicit stack.
         */
        private long visit(AstNode root) {
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(open(root));
            long hash = 0L;
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.next < frame.childHashes.length) {
                    stack.push(open(frame.node.children().get(frame.next)));
                    continue;
                }
                stack.pop();
                hash = frame.node.isLeaf() ? frame.seed : Fnv.mix(frame.seed, frame.childHashes);
                Frame parent = stack.peek();
                if (parent != null) {
                    parent.childHashes[parent.next++] = hash;
                }
            }
            return hash;
        }

        private Frame open(AstNode node) {
            String kind = node.kind();
            if (kind == null || kind.isBlank()) {
                throw new RepresentationBuildException(functionId, "malformed AST: node without kind");
            }
            if (node.role() != AstNode.Role.NODE && !node.isLeaf()) {
                throw new RepresentationBuildException(functionId,
                        "malformed AST: " + node.role() + " node " + kind + " has children");
            }

            String token = canonicalToken(node);
            tokens.add(token);

            if (node.isLeaf()) {
                return new Frame(node, Fnv.hash(Fnv.hash(kind), "|" + token));
            }
            long parent = Fnv.hash(kind);
            if (node.value() != null) {
                parent = Fnv.hash(parent, "|" + node.value());
            }
            return new Frame(node, parent);
        }

        private String canonicalToken(AstNode node) {
            return switch (node.role()) {
                case LOCAL -> {
                    String name = requireValue(node);
                    yield locals.computeIfAbsent(name, n -> "v" + locals.size());
                }
                case NAME -> requireValue(node);
                case LITERAL -> node.kind();
                case NODE -> node.value() == null ? node.kind() : node.kind() + ":" + node.value();
            };
        }

        private String requireValue(AstNode node) {
            if (node.value() == null || node.value().isEmpty()) {
                throw new RepresentationBuildException(functionId,
                        "malformed AST: " + node.kind() + " identifier without text");
            }
            return node.value();
        }
    }

    private static final class Frame {
        private final AstNode node;
        private final long seed;
        private final long[] childHashes;
        private int next;

        private Frame(AstNode node, long seed) {
            this.node = node;
            this.seed = seed;
            this.childHashes = new long[node.children().size()];
        }
    }
}
