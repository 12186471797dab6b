package com.raditha.similarity.clustering;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Disjoint sets over function ids with path compression.
 */
final class UnionFind {

    private final Map<String, String> parent = new HashMap<>();

    String find(String id) {
        String root = parent.computeIfAbsent(id, k -> k);
        if (!root.equals(id)) {
            root = find(root);
            parent.put(id, root);
        }
        return root;
    }

    /**
     * Merge two sets; the lexicographically smaller root wins so the result
     * does not depend on union order.
     */
    void union(String a, String b) {
        String rootA = find(a);
        String rootB = find(b);
        if (rootA.equals(rootB)) {
            return;
        }
        if (rootA.compareTo(rootB) < 0) {
            parent.put(rootB, rootA);
        } else {
            parent.put(rootA, rootB);
        }
    }

    /**
     * Components keyed by root, members in insertion order of {@code ids}.
     */
    Collection<List<String>> components(Collection<String> ids) {
        Map<String, List<String>> components = new TreeMap<>();
        for (String id : ids) {
            components.computeIfAbsent(find(id), k -> new ArrayList<>()).add(id);
        }
        return components.values();
    }
}
