package com.connectk.core.ai.policy;

import com.connectk.core.ConfigurationException;
import com.connectk.core.ai.tree.SearchNode;
import com.connectk.core.ai.tree.SearchTree;
import it.unimi.dsi.fastutil.ints.IntList;
import java.util.SplittableRandom;

/**
 * Select the child with the maximum UCB1 score. Scores are computed on demand from the stored
 * visit and reward totals because they depend on the parent's current visit count.
 */
public final class Ucb1SelectionPolicy implements SelectionPolicy {

    private final double explorationConstant;
    private final boolean randomTieBreak;

    public Ucb1SelectionPolicy(double explorationConstant) {
        this(explorationConstant, true);
    }

    /**
     * @param explorationConstant weight of the exploration term, finite and non-negative
     * @param randomTieBreak      {@code true} to pick uniformly among equal best scores, {@code false}
     *                            to keep the first child in expansion order
     */
    public Ucb1SelectionPolicy(double explorationConstant, boolean randomTieBreak) {
        if (!Double.isFinite(explorationConstant) || explorationConstant < 0.0) {
            throw new ConfigurationException("Exploration constant must be finite and non-negative, was "
                    + explorationConstant);
        }
        this.explorationConstant = explorationConstant;
        this.randomTieBreak = randomTieBreak;
    }

    public double getExplorationConstant() {
        return explorationConstant;
    }

    @Override
    public SearchNode select(SearchTree tree, SearchNode parent, SplittableRandom random) {
        IntList children = parent.children();
        if (children.isEmpty()) {
            throw new IllegalStateException("Cannot select among the children of a leaf: " + parent);
        }
        double logParentVisits = Math.log(Math.max(1L, parent.visits()));

        SearchNode best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        int ties = 0;
        for (int i = 0; i < children.size(); i++) {
            SearchNode child = tree.node(children.getInt(i));
            double score = score(logParentVisits, child.visits(), child.reward());
            if (best == null || score > bestScore) {
                best = child;
                bestScore = score;
                ties = 1;
            } else if (score == bestScore && randomTieBreak) {
                // reservoir sampling keeps each tied child with equal probability
                ties++;
                if (random.nextInt(ties) == 0) {
                    best = child;
                }
            }
        }
        return best;
    }

    /**
     * Returns the UCB1 score of a child: infinite when it has not been visited yet.
     *
     * @param parentVisits visit count of the parent node
     * @param childVisits  visit count of the child
     * @param childReward  accumulated reward of the child, from the parent's mover's view
     */
    public double score(long parentVisits, long childVisits, double childReward) {
        return score(Math.log(Math.max(1L, parentVisits)), childVisits, childReward);
    }

    private double score(double logParentVisits, long childVisits, double childReward) {
        if (childVisits == 0L) {
            return Double.POSITIVE_INFINITY;
        }
        return childReward / childVisits + explorationConstant * Math.sqrt(logParentVisits / childVisits);
    }
}
