package com.connectk.core.ai.policy;

import com.connectk.core.GameResult;
import com.connectk.core.GameState;
import java.util.SplittableRandom;

/**
 * Plays a position out to the end to estimate its value.
 */
public interface RolloutPolicy {

    /**
     * Plays from {@code state} until the game is over and returns the outcome. A terminal
     * {@code state} returns its own result.
     */
    GameResult rollout(GameState state, SplittableRandom random);
}
