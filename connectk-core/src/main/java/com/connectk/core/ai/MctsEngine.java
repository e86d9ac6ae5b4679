package com.connectk.core.ai;

import com.connectk.core.GameResult;
import com.connectk.core.GameState;
import com.connectk.core.NoMovesAvailableException;
import com.connectk.core.Player;
import com.connectk.core.ai.policy.RandomRolloutPolicy;
import com.connectk.core.ai.policy.RewardScheme;
import com.connectk.core.ai.policy.RolloutPolicy;
import com.connectk.core.ai.policy.SelectionPolicy;
import com.connectk.core.ai.policy.Ucb1SelectionPolicy;
import com.connectk.core.ai.tree.SearchNode;
import com.connectk.core.ai.tree.SearchTree;
import it.unimi.dsi.fastutil.ints.IntList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.SplittableRandom;
import java.util.logging.Logger;

/**
 * Monte Carlo tree searcher with iteration and time budgets.
 *
 * <p>Each iteration selects a path with the {@link SelectionPolicy}, expands one new node, plays
 * {@link MctsConfig#rolloutsPerLeaf()} random games from it and backs the outcomes up to the root.
 * The engine keeps its tree between searches: when asked about a position that continues the
 * current root's move history, it advances the root instead of starting over.
 *
 * <p>All randomness comes from one generator seeded by {@link MctsConfig#seed()}, so two engines
 * with the same configuration fed the same positions make the same choices. Instances are not
 * thread-safe.
 */
public final class MctsEngine implements Searcher {

    private static final Logger LOGGER = Logger.getLogger(MctsEngine.class.getName());

    private final MctsConfig config;
    private final SplittableRandom random;
    private final SelectionPolicy selectionPolicy;
    private final RolloutPolicy rolloutPolicy;
    private final GameResult[] outcomes;

    private SearchTree tree;
    private long lastIterations;

    public MctsEngine(MctsConfig config) {
        this(config, new Ucb1SelectionPolicy(config.explorationConstant(), config.randomTieBreak()),
                new RandomRolloutPolicy());
    }

    public MctsEngine(MctsConfig config, SelectionPolicy selectionPolicy, RolloutPolicy rolloutPolicy) {
        this.config = Objects.requireNonNull(config, "config");
        this.selectionPolicy = Objects.requireNonNull(selectionPolicy, "selectionPolicy");
        this.rolloutPolicy = Objects.requireNonNull(rolloutPolicy, "rolloutPolicy");
        this.random = new SplittableRandom(config.seed());
        this.outcomes = new GameResult[config.rolloutsPerLeaf()];
    }

    public MctsConfig getConfig() {
        return config;
    }

    /**
     * Returns the tree kept from the last search, or {@code null} before the first search or after
     * {@link #reset()}.
     */
    public SearchTree getTree() {
        return tree;
    }

    public long getLastIterationCount() {
        return lastIterations;
    }

    /**
     * Discards the search tree, e.g. when a new game starts.
     */
    public void reset() {
        tree = null;
    }

    public int findBestMove(GameState state) {
        return search(state).move();
    }

    /**
     * Searches with the configured budget.
     */
    public SearchResult search(GameState state) {
        return search(state, config.budget());
    }

    @Override
    public SearchResult search(GameState state, SearchBudget budget) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(budget, "budget");

        if (state.isTerminal()) {
            throw new NoMovesAvailableException("Cannot search moves in a terminal position (" + state.getResult() + ")");
        }

        SearchTree searchTree = treeFor(state);
        long start = System.nanoTime();
        long deadline = budget.isTimed() ? saturatingAdd(start, budget.timeLimit().toNanos()) : Long.MAX_VALUE;

        long iterations = 0L;
        do {
            iterate(searchTree);
            iterations++;
        } while (budget.isTimed() ? System.nanoTime() < deadline : iterations < budget.iterations());

        if (config.verifyInvariants()) {
            searchTree.verifyConsistency();
        }

        SearchNode root = searchTree.root();
        SearchNode best = selectRobustChild(searchTree, root);
        long elapsed = System.nanoTime() - start;
        SearchTelemetry telemetry = new SearchTelemetry(rootStatistics(searchTree, root), root.visits(),
                searchTree.size(), searchTree.depth(), elapsed);

        lastIterations = iterations;
        final long completed = iterations;
        LOGGER.info(() -> String.format("MCTS ran %d iterations in %.1f ms (nodes=%d, depth=%d, move=%d, visits=%d)",
                completed, telemetry.elapsedMillis(), telemetry.treeSize(), telemetry.treeDepth(), best.move(),
                best.visits()));

        return new SearchResult(best.move(), iterations, budget.isTimed(), telemetry);
    }

    /**
     * Advances the kept tree by a move that was actually played. Does nothing when no tree is kept.
     */
    public void commitMove(int move) {
        if (tree != null) {
            tree.advanceRoot(move);
        }
    }

    private SearchTree treeFor(GameState state) {
        if (tree != null) {
            GameState rootState = tree.root().state();
            if (state.extendsHistoryOf(rootState)) {
                for (int i = rootState.getMoveNumber(); i < state.getMoveNumber(); i++) {
                    tree.advanceRoot(state.moveAt(i));
                }
                return tree;
            }
        }
        tree = SearchTree.createRoot(state);
        return tree;
    }

    private void iterate(SearchTree searchTree) {
        SearchNode node = searchTree.root();
        while (!node.isTerminal() && !node.hasUnexpandedMoves()) {
            node = selectionPolicy.select(searchTree, node, random);
        }

        if (!node.isTerminal()) {
            int move = config.expansionOrder().pick(node.unexpandedMoves(), random);
            node = searchTree.expand(node, move);
        }

        for (int i = 0; i < outcomes.length; i++) {
            outcomes[i] = rolloutPolicy.rollout(node.state(), random);
        }

        RewardScheme scheme = config.rewardScheme();
        searchTree.backpropagate(node, outcomes.length, mover -> totalReward(scheme, mover));
    }

    private double totalReward(RewardScheme scheme, Player mover) {
        double total = 0.0;
        for (GameResult outcome : outcomes) {
            total += scheme.reward(outcome, mover);
        }
        return total;
    }

    private SearchNode selectRobustChild(SearchTree searchTree, SearchNode root) {
        SearchNode best = null;
        IntList children = root.children();
        for (int i = 0; i < children.size(); i++) {
            SearchNode child = searchTree.node(children.getInt(i));
            if (best == null || isPreferred(child, best)) {
                best = child;
            }
        }
        if (best == null) {
            throw new IllegalStateException("Search finished without expanding the root");
        }
        return best;
    }

    // most visits, then best average reward, then lowest column
    private static boolean isPreferred(SearchNode candidate, SearchNode incumbent) {
        if (candidate.visits() != incumbent.visits()) {
            return candidate.visits() > incumbent.visits();
        }
        int byReward = Double.compare(candidate.averageReward(), incumbent.averageReward());
        if (byReward != 0) {
            return byReward > 0;
        }
        return candidate.move() < incumbent.move();
    }

    private static List<SearchTelemetry.ChildStatistics> rootStatistics(SearchTree searchTree, SearchNode root) {
        List<SearchTelemetry.ChildStatistics> statistics = new ArrayList<>();
        IntList children = root.children();
        for (int i = 0; i < children.size(); i++) {
            SearchNode child = searchTree.node(children.getInt(i));
            statistics.add(new SearchTelemetry.ChildStatistics(child.move(), child.visits(), child.averageReward()));
        }
        statistics.sort(Comparator.comparingInt(SearchTelemetry.ChildStatistics::move));
        return statistics;
    }

    private static long saturatingAdd(long a, long b) {
        long result = a + b;
        if (((a ^ result) & (b ^ result)) < 0) {
            return Long.MAX_VALUE;
        }
        return result;
    }
}
