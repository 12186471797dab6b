package com.raditha.similarity.clustering;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UnionFindTest {

    @Test
    void testComponentsDoNotDependOnUnionOrder() {
        UnionFind forward = new UnionFind();
        forward.union("a", "b");
        forward.union("c", "d");
        forward.union("b", "c");

        UnionFind backward = new UnionFind();
        backward.union("c", "b");
        backward.union("d", "c");
        backward.union("b", "a");

        assertEquals("a", forward.find("d"));
        assertEquals("a", backward.find("d"));
        assertEquals(new ArrayList<>(forward.components(List.of("a", "b", "c", "d", "e"))),
                new ArrayList<>(backward.components(List.of("a", "b", "c", "d", "e"))));
    }

    @Test
    void testSingletons() {
        UnionFind unionFind = new UnionFind();

        assertEquals("x", unionFind.find("x"));
        assertEquals(List.of(List.of("x"), List.of("y")), new ArrayList<>(unionFind.components(List.of("x", "y"))));
    }
}
