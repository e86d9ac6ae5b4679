package com.connectk.core.ai;

import com.connectk.core.ConfigurationException;
import com.connectk.core.ai.policy.ExpansionOrder;
import com.connectk.core.ai.policy.RewardScheme;

/**
 * Immutable tuning knobs of {@link MctsEngine}.
 *
 * @param explorationConstant weight C of the UCB1 exploration term
 * @param budget              default budget for each search
 * @param seed                seed of the engine's random generator
 * @param expansionOrder      order in which untried moves become children
 * @param rewardScheme        rewards for win, draw and loss
 * @param randomTieBreak      break equal UCB1 scores at random rather than by expansion order
 * @param rolloutsPerLeaf     random playouts run from each newly expanded node
 * @param verifyInvariants    check the whole tree after every search
 */
public record MctsConfig(
        double explorationConstant,
        SearchBudget budget,
        long seed,
        ExpansionOrder expansionOrder,
        RewardScheme rewardScheme,
        boolean randomTieBreak,
        int rolloutsPerLeaf,
        boolean verifyInvariants) {

    public static final double DEFAULT_EXPLORATION = Math.sqrt(2.0);
    public static final long DEFAULT_ITERATIONS = 2000L;

    public MctsConfig {
        if (!Double.isFinite(explorationConstant) || explorationConstant < 0.0) {
            throw new ConfigurationException("Exploration constant must be finite and non-negative, was "
                    + explorationConstant);
        }
        if (budget == null) {
            throw new ConfigurationException("budget must not be null");
        }
        if (expansionOrder == null) {
            throw new ConfigurationException("expansionOrder must not be null");
        }
        if (rewardScheme == null) {
            throw new ConfigurationException("rewardScheme must not be null");
        }
        if (rolloutsPerLeaf < 1) {
            throw new ConfigurationException("rolloutsPerLeaf must be at least 1");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder initialised with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .explorationConstant(explorationConstant)
                .budget(budget)
                .seed(seed)
                .expansionOrder(expansionOrder)
                .rewardScheme(rewardScheme)
                .randomTieBreak(randomTieBreak)
                .rolloutsPerLeaf(rolloutsPerLeaf)
                .verifyInvariants(verifyInvariants);
    }

    public static final class Builder {
        private double explorationConstant = DEFAULT_EXPLORATION;
        private SearchBudget budget = SearchBudget.iterations(DEFAULT_ITERATIONS);
        private long seed;
        private ExpansionOrder expansionOrder = ExpansionOrder.RANDOM;
        private RewardScheme rewardScheme = RewardScheme.ZERO_ONE;
        private boolean randomTieBreak = true;
        private int rolloutsPerLeaf = 1;
        private boolean verifyInvariants;

        private Builder() {
        }

        public Builder explorationConstant(double v) {
            explorationConstant = v;
            return this;
        }

        public Builder budget(SearchBudget v) {
            budget = v;
            return this;
        }

        public Builder iterations(long v) {
            budget = SearchBudget.iterations(v);
            return this;
        }

        public Builder timeMillis(long v) {
            budget = SearchBudget.timeMillis(v);
            return this;
        }

        public Builder seed(long v) {
            seed = v;
            return this;
        }

        public Builder expansionOrder(ExpansionOrder v) {
            expansionOrder = v;
            return this;
        }

        public Builder rewardScheme(RewardScheme v) {
            rewardScheme = v;
            return this;
        }

        public Builder randomTieBreak(boolean v) {
            randomTieBreak = v;
            return this;
        }

        public Builder rolloutsPerLeaf(int v) {
            rolloutsPerLeaf = v;
            return this;
        }

        public Builder verifyInvariants(boolean v) {
            verifyInvariants = v;
            return this;
        }

        public MctsConfig build() {
            return new MctsConfig(explorationConstant, budget, seed, expansionOrder, rewardScheme, randomTieBreak,
                    rolloutsPerLeaf, verifyInvariants);
        }
    }
}
