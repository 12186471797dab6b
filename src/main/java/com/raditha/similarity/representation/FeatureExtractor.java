package com.raditha.similarity.representation;

import com.raditha.similarity.model.AstNode;
import com.raditha.similarity.model.FunctionSignature;
import com.raditha.similarity.model.StructuralFeatures;
import com.raditha.similarity.normalization.NodeKinds;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Computes the structural feature vector of a function body.
 */
public class FeatureExtractor {

    public StructuralFeatures extract(AstNode body, FunctionSignature signature) {
        Counter counter = new Counter();
        counter.walk(body);
        return new StructuralFeatures(
                counter.branches,
                counter.loops,
                counter.maxDepth,
                counter.statements,
                signature.parameterTypes().size());
    }

    /**
     * McCabe style estimate used when the analyzer supplied no metric:
     * one plus the number of decision points.
     */
    public static int estimateComplexity(StructuralFeatures features) {
        return 1 + features.branchCount() + features.loopCount();
    }

    private static final class Counter {
        private int branches;
        private int loops;
        private int statements;
        private int maxDepth;

        private record Pending(AstNode node, int depth) {
        }

        private void walk(AstNode root) {
            Deque<Pending> pending = new ArrayDeque<>();
            pending.push(new Pending(root, 0));
            while (!pending.isEmpty()) {
                Pending next = pending.pop();
                int childDepth = visit(next.node(), next.depth());
                for (AstNode child : next.node().children()) {
                    pending.push(new Pending(child, childDepth));
                }
            }
        }

        /**
         * Count one node and return the depth of its children.
         */
        private int visit(AstNode node, int depth) {
            String kind = node.kind();
            int childDepth = depth;
            if (NodeKinds.isBranch(kind)) {
                branches++;
            }
            if (NodeKinds.isLoop(kind)) {
                loops++;
            }
            if (NodeKinds.isControl(kind)) {
                childDepth = depth + 1;
                maxDepth = Math.max(maxDepth, childDepth);
            }
            if (NodeKinds.isStatement(kind)) {
                statements++;
            }
            return childDepth;
        }
    }
}
