package com.connectk.core.ai.policy;

import it.unimi.dsi.fastutil.ints.IntList;
import java.util.SplittableRandom;

/**
 * Order in which a node's untried moves are turned into children.
 */
public enum ExpansionOrder {

    /**
     * Uniformly random among the untried moves, drawn from the search's seeded generator.
     */
    RANDOM {
        @Override
        public int pick(IntList unexpandedMoves, SplittableRandom random) {
            return unexpandedMoves.getInt(random.nextInt(unexpandedMoves.size()));
        }
    },

    /**
     * Lowest untried column first.
     */
    ASCENDING {
        @Override
        public int pick(IntList unexpandedMoves, SplittableRandom random) {
            int lowest = unexpandedMoves.getInt(0);
            for (int i = 1; i < unexpandedMoves.size(); i++) {
                lowest = Math.min(lowest, unexpandedMoves.getInt(i));
            }
            return lowest;
        }
    };

    /**
     * Returns the move to expand next.
     *
     * @param unexpandedMoves a non-empty list of untried moves
     */
    public abstract int pick(IntList unexpandedMoves, SplittableRandom random);
}
