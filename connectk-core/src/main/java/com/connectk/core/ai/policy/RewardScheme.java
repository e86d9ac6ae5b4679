package com.connectk.core.ai.policy;

import com.connectk.core.GameResult;
import com.connectk.core.Player;
import java.util.Objects;

/**
 * Reward credited to a node for one rollout outcome, from the view of the player who moved into
 * that node.
 */
public enum RewardScheme {
    ZERO_ONE(1.0, 0.0, 0.0),
    PLUS_MINUS_ONE(1.0, 0.0, -1.0),
    HALF_DRAW(1.0, 0.5, 0.0);

    private final double win;
    private final double draw;
    private final double loss;

    RewardScheme(double win, double draw, double loss) {
        this.win = win;
        this.draw = draw;
        this.loss = loss;
    }

    /**
     * Returns the reward {@code mover} earns from a finished game.
     *
     * @throws IllegalArgumentException if {@code result} is still ongoing
     */
    public double reward(GameResult result, Player mover) {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(mover, "mover");
        switch (result.status()) {
            case WIN:
                return result.winner() == mover ? win : loss;
            case DRAW:
                return draw;
            default:
                throw new IllegalArgumentException("Cannot reward an ongoing game");
        }
    }

    public double win() {
        return win;
    }

    public double draw() {
        return draw;
    }

    public double loss() {
        return loss;
    }
}
