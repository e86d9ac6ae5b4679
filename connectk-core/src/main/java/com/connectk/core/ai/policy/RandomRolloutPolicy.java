package com.connectk.core.ai.policy;

import com.connectk.core.GameResult;
import com.connectk.core.GameState;
import com.connectk.core.ai.state.RolloutState;
import java.util.SplittableRandom;

/**
 * A simple random rollout policy: every ply picks uniformly among the open columns.
 * Plays on a reusable mutable buffer, so an instance must not be shared between threads.
 */
public final class RandomRolloutPolicy implements RolloutPolicy {

    private final RolloutState scratch = new RolloutState();

    @Override
    public GameResult rollout(GameState state, SplittableRandom random) {
        if (state.isTerminal()) {
            return state.getResult();
        }
        scratch.reset(state);
        while (!scratch.isTerminal()) {
            scratch.play(scratch.openColumnAt(random.nextInt(scratch.openColumnCount())));
        }
        return scratch.result();
    }
}
