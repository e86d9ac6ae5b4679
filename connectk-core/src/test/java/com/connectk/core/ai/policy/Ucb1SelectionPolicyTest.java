package com.connectk.core.ai.policy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.connectk.core.BoardGeometry;
import com.connectk.core.ConfigurationException;
import com.connectk.core.GameState;
import com.connectk.core.ai.tree.SearchNode;
import com.connectk.core.ai.tree.SearchTree;
import java.util.HashSet;
import java.util.Set;
import java.util.SplittableRandom;
import org.junit.jupiter.api.Test;

class Ucb1SelectionPolicyTest {

    @Test
    void unvisitedChildScoresInfinity() {
        Ucb1SelectionPolicy policy = new Ucb1SelectionPolicy(Math.sqrt(2.0));
        assertEquals(Double.POSITIVE_INFINITY, policy.score(10L, 0L, 0.0));
    }

    @Test
    void combinesAverageAndExplorationTerm() {
        Ucb1SelectionPolicy policy = new Ucb1SelectionPolicy(Math.sqrt(2.0));
        assertEquals(Math.sqrt(2.0), policy.getExplorationConstant());
        double expected = 0.6 + Math.sqrt(2.0) * Math.sqrt(Math.log(100.0) / 10.0);
        assertEquals(expected, policy.score(100L, 10L, 6.0), 1e-12);
    }

    @Test
    void prefersUnvisitedChild() {
        SearchTree tree = SearchTree.createRoot(new GameState(BoardGeometry.CONNECT_FOUR));
        SearchNode visited = tree.expand(tree.root(), 0);
        tree.backpropagate(visited, 1L, mover -> 1.0);
        SearchNode fresh = tree.expand(tree.root(), 1);

        SearchNode selected = new Ucb1SelectionPolicy(1.0).select(tree, tree.root(), new SplittableRandom(1));

        assertSame(fresh, selected);
    }

    @Test
    void withoutExplorationPicksBestAverage() {
        SearchTree tree = SearchTree.createRoot(new GameState(BoardGeometry.CONNECT_FOUR));
        SearchNode weak = tree.expand(tree.root(), 0);
        SearchNode strong = tree.expand(tree.root(), 1);
        tree.backpropagate(weak, 4L, mover -> 1.0);
        tree.backpropagate(strong, 1L, mover -> 1.0);

        SearchNode selected = new Ucb1SelectionPolicy(0.0).select(tree, tree.root(), new SplittableRandom(1));

        assertSame(strong, selected, "Average 1.0 beats average 0.25");
    }

    @Test
    void breaksTiesUniformlyWhenRandomised() {
        SearchTree tree = tiedTree();
        Set<Integer> chosen = new HashSet<>();
        SplittableRandom random = new SplittableRandom(42);
        Ucb1SelectionPolicy policy = new Ucb1SelectionPolicy(Math.sqrt(2.0), true);

        for (int i = 0; i < 200; i++) {
            chosen.add(policy.select(tree, tree.root(), random).move());
        }

        assertEquals(Set.of(0, 1, 2), chosen, "Every tied child should be picked eventually");
    }

    @Test
    void keepsFirstChildWhenTieBreakIsDeterministic() {
        SearchTree tree = tiedTree();
        Ucb1SelectionPolicy policy = new Ucb1SelectionPolicy(Math.sqrt(2.0), false);
        SplittableRandom random = new SplittableRandom(42);

        for (int i = 0; i < 20; i++) {
            assertEquals(0, policy.select(tree, tree.root(), random).move());
        }
    }

    @Test
    void rejectsInvalidExplorationConstant() {
        assertThrows(ConfigurationException.class, () -> new Ucb1SelectionPolicy(-0.1));
        assertThrows(ConfigurationException.class, () -> new Ucb1SelectionPolicy(Double.NaN));
    }

    @Test
    void refusesToSelectFromLeaf() {
        SearchTree tree = SearchTree.createRoot(new GameState(BoardGeometry.CONNECT_FOUR));
        Ucb1SelectionPolicy policy = new Ucb1SelectionPolicy(1.0);
        assertThrows(IllegalStateException.class, () -> policy.select(tree, tree.root(), new SplittableRandom(1)));
        assertTrue(tree.root().hasUnexpandedMoves());
    }

    private static SearchTree tiedTree() {
        SearchTree tree = SearchTree.createRoot(new GameState(BoardGeometry.CONNECT_FOUR));
        for (int move = 0; move < 3; move++) {
            SearchNode child = tree.expand(tree.root(), move);
            tree.backpropagate(child, 2L, mover -> 1.0);
        }
        return tree;
    }
}
