package com.connectk.core.ai;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.connectk.core.BoardGeometry;
import com.connectk.core.GameState;
import com.connectk.core.NoMovesAvailableException;
import com.connectk.core.ai.policy.ExpansionOrder;
import com.connectk.core.ai.policy.RewardScheme;
import com.connectk.core.ai.tree.SearchNode;
import com.connectk.core.ai.tree.SearchTree;
import it.unimi.dsi.fastutil.ints.IntList;
import org.junit.jupiter.api.Test;

class MctsEngineTest {

    private static final BoardGeometry C4 = BoardGeometry.CONNECT_FOUR;

    /** FIRST holds columns 0-2 on the bottom row and wins immediately with column 3. */
    private static final int[] IMMEDIATE_WIN = {0, 6, 1, 6, 2, 5};

    @Test
    void rootVisitsMatchIterationBudget() {
        MctsEngine engine = new MctsEngine(config(7L).iterations(300).build());
        GameState start = new GameState(C4);

        SearchResult first = engine.search(start);

        assertEquals(300L, first.iterations());
        assertEquals(300L, first.telemetry().rootVisits());
        assertEquals(first.telemetry().rootVisits(), first.telemetry().totalChildVisits());
        assertEquals(300L, engine.getLastIterationCount());

        SearchResult second = engine.search(start);

        assertEquals(600L, second.telemetry().rootVisits(), "Searching the same position again reuses the tree");
    }

    @Test
    void everyNodeCountsItsOwnRolloutPlusItsChildren() {
        MctsEngine engine = new MctsEngine(config(3L).iterations(500).build());
        engine.search(new GameState(C4));
        SearchTree tree = engine.getTree();

        for (int i = 0; i < tree.size(); i++) {
            SearchNode node = tree.node(i);
            long childVisits = 0L;
            IntList children = node.children();
            for (int c = 0; c < children.size(); c++) {
                childVisits += tree.node(children.getInt(c)).visits();
            }
            if (node == tree.root()) {
                assertEquals(node.visits(), childVisits, "Root visits come only from its children");
            } else if (!node.isTerminal()) {
                assertEquals(node.visits(), childVisits + 1L, "Mismatch at " + node);
            }
        }
        assertDoesNotThrow(tree::verifyConsistency);
    }

    @Test
    void sameSeedGivesSameSearch() {
        GameState position = GameState.fromMoves(C4, 3, 3, 4);

        SearchResult a = new MctsEngine(config(2024L).iterations(400).build()).search(position);
        SearchResult b = new MctsEngine(config(2024L).iterations(400).build()).search(position);

        assertEquals(a.move(), b.move());
        assertEquals(a.telemetry().rootChildren(), b.telemetry().rootChildren());
        assertEquals(a.telemetry().treeSize(), b.telemetry().treeSize());
    }

    @Test
    void searchesTheEmptyBoard() {
        MctsEngine engine = new MctsEngine(config(1L).iterations(2000).build());

        SearchResult result = engine.search(new GameState(C4));

        assertTrue(result.move() >= 0 && result.move() < 7);
        assertEquals(7, result.telemetry().rootChildren().size());
        assertTrue(result.telemetry().treeDepth() >= 1);
        assertTrue(result.telemetry().treeSize() <= 2001, "An iteration adds at most one node");
    }

    @Test
    void chosenMoveIsTheMostVisitedChild() {
        SearchResult result = new MctsEngine(config(5L).iterations(800).build())
                .search(GameState.fromMoves(C4, 2, 4, 3));
        long chosenVisits = result.telemetry().child(result.move()).visits();

        for (SearchTelemetry.ChildStatistics child : result.telemetry().rootChildren()) {
            assertTrue(child.visits() <= chosenVisits, "Column " + child.move() + " was visited more");
        }
    }

    @Test
    void findsImmediateWinForAlmostEverySeed() {
        GameState position = GameState.fromMoves(C4, IMMEDIATE_WIN);
        int hits = 0;
        for (long seed = 0; seed < 10; seed++) {
            MctsEngine engine = new MctsEngine(config(seed).iterations(500).build());
            if (engine.findBestMove(position) == 3) {
                hits++;
            }
        }
        assertTrue(hits >= 9, "Winning column chosen for only " + hits + " of 10 seeds");
    }

    @Test
    void findsImmediateWinWithSignedRewards() {
        MctsEngine engine = new MctsEngine(config(11L).iterations(2000)
                .rewardScheme(RewardScheme.PLUS_MINUS_ONE)
                .build());

        SearchResult result = engine.search(GameState.fromMoves(C4, IMMEDIATE_WIN));

        assertEquals(3, result.move());
        assertEquals(1.0, result.telemetry().child(3).averageReward(), 1e-12);
    }

    @Test
    void rejectsTerminalPosition() {
        MctsEngine engine = new MctsEngine(config(1L).iterations(10).build());
        GameState won = GameState.fromMoves(C4, 0, 1, 0, 1, 0, 1, 0);

        assertThrows(NoMovesAvailableException.class, () -> engine.search(won));
    }

    @Test
    void timeBudgetRunsUntilDeadline() {
        MctsEngine engine = new MctsEngine(config(9L).timeMillis(20).build());

        SearchResult result = engine.search(new GameState(C4));

        assertTrue(result.timeLimited());
        assertTrue(result.iterations() >= 1L);
        assertTrue(result.telemetry().elapsedMillis() >= 20.0);
        assertEquals(result.iterations(), result.telemetry().rootVisits());
    }

    @Test
    void explicitBudgetOverridesConfiguredOne() {
        MctsEngine engine = new MctsEngine(config(9L).iterations(5000).build());

        SearchResult result = engine.search(new GameState(C4), SearchBudget.iterations(40));

        assertEquals(40L, result.iterations());
        assertFalse(result.timeLimited());
    }

    @Test
    void committedMoveKeepsChildStatistics() {
        MctsEngine engine = new MctsEngine(config(4L).iterations(600).build());
        SearchResult result = engine.search(new GameState(C4));
        int sizeBefore = engine.getTree().size();
        long childVisits = result.telemetry().child(result.move()).visits();

        engine.commitMove(result.move());

        SearchTree tree = engine.getTree();
        assertEquals(childVisits, tree.root().visits());
        assertEquals(result.move(), tree.root().state().getLastColumn());
        assertTrue(tree.size() < sizeBefore, "Sibling subtrees must be pruned");
        assertDoesNotThrow(tree::verifyConsistency);
    }

    @Test
    void laterPositionInSameGameReusesSubtree() {
        MctsEngine engine = new MctsEngine(config(8L).iterations(1500).expansionOrder(ExpansionOrder.ASCENDING).build());
        GameState start = new GameState(C4);
        engine.search(start);
        SearchTree tree = engine.getTree();
        SearchNode child = tree.child(tree.root(), 3);
        assertNotNull(child);
        SearchNode grandchild = tree.child(child, 3);
        assertNotNull(grandchild);
        long reused = grandchild.visits();

        GameState later = start.applyMove(3).applyMove(3);
        SearchResult result = engine.search(later, SearchBudget.iterations(200));

        assertSame(tree, engine.getTree());
        assertSame(grandchild, engine.getTree().root());
        assertEquals(reused + 200L, result.telemetry().rootVisits());
    }

    @Test
    void unrelatedPositionRebuildsTree() {
        MctsEngine engine = new MctsEngine(config(8L).iterations(100).build());
        engine.search(GameState.fromMoves(C4, 0));
        SearchTree first = engine.getTree();

        SearchResult result = engine.search(GameState.fromMoves(C4, 1));

        assertNotSame(first, engine.getTree());
        assertEquals(100L, result.telemetry().rootVisits());
    }

    @Test
    void resetDiscardsTree() {
        MctsEngine engine = new MctsEngine(config(8L).iterations(50).build());
        engine.search(new GameState(C4));

        engine.reset();

        assertNull(engine.getTree());
        engine.commitMove(3);
    }

    @Test
    void multipleRolloutsPerLeafCountAsVisits() {
        MctsEngine engine = new MctsEngine(config(6L).iterations(100).rolloutsPerLeaf(3).build());

        SearchResult result = engine.search(new GameState(C4));

        assertEquals(100L, result.iterations());
        assertEquals(300L, result.telemetry().rootVisits());
        assertDoesNotThrow(engine.getTree()::verifyConsistency);
    }

    @Test
    void deterministicVariantsPassInvariantChecks() {
        MctsConfig deterministic = config(0L).iterations(1000)
                .expansionOrder(ExpansionOrder.ASCENDING)
                .randomTieBreak(false)
                .rewardScheme(RewardScheme.HALF_DRAW)
                .verifyInvariants(true)
                .build();

        SearchResult result = assertDoesNotThrow(() -> new MctsEngine(deterministic)
                .search(GameState.fromMoves(new BoardGeometry(4, 4, 3), 1, 2)));

        assertEquals(1000L, result.telemetry().rootVisits());
    }

    @Test
    void searchesNearlyFullBoards() {
        // only column 2 is open: the root has one child
        GameState state = GameState.fromMoves(new BoardGeometry(3, 1, 3), 0, 1);
        SearchResult result = new MctsEngine(config(1L).iterations(25).verifyInvariants(true).build()).search(state);

        assertEquals(2, result.move());
        assertEquals(25L, result.telemetry().child(2).visits());
    }

    @Test
    void resultRequiresTelemetry() {
        assertThrows(NullPointerException.class, () -> new SearchResult(0, 1L, false, null));
    }

    private static MctsConfig.Builder config(long seed) {
        return MctsConfig.builder().seed(seed);
    }
}
