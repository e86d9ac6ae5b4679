package com.connectk.core.ai;

import com.connectk.core.ConnectKEngine;
import com.connectk.core.GameResult;
import com.connectk.core.GameState;
import com.connectk.core.Player;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Plays engine-versus-engine games. Both sides share one {@link ConnectKEngine}, so the search
 * tree is carried from move to move and only the played subtree survives each turn.
 */
public final class SelfPlay {

    private static final Logger LOGGER = Logger.getLogger(SelfPlay.class.getName());

    private final ConnectKEngine engine;

    private int gamesPlayed;
    private int firstPlayerWins;
    private int secondPlayerWins;
    private int draws;
    private long totalMoves;

    public SelfPlay(ConnectKEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    public void playGames(int gameCount) {
        if (gameCount < 1) {
            throw new IllegalArgumentException("Game count must be at least 1");
        }
        for (int i = 0; i < gameCount; i++) {
            playGame();
        }
    }

    /**
     * Plays one game from the empty board and returns its final state.
     */
    public GameState playGame() {
        GameState state = engine.newGame();
        while (!state.isTerminal()) {
            int move = engine.bestMove(state);
            state = engine.applyMove(state, move);
        }

        GameResult result = state.getResult();
        gamesPlayed++;
        totalMoves += state.getMoveNumber();
        if (result.isWinFor(Player.FIRST)) {
            firstPlayerWins++;
        } else if (result.isWinFor(Player.SECOND)) {
            secondPlayerWins++;
        } else {
            draws++;
        }

        final int gameNumber = gamesPlayed;
        final int moves = state.getMoveNumber();
        LOGGER.info(() -> String.format("Completed self-play game %d: %s after %d moves (first=%d, second=%d, draws=%d)",
                gameNumber, result, moves, firstPlayerWins, secondPlayerWins, draws));
        return state;
    }

    public int getGamesPlayed() {
        return gamesPlayed;
    }

    public int getFirstPlayerWins() {
        return firstPlayerWins;
    }

    public int getSecondPlayerWins() {
        return secondPlayerWins;
    }

    public int getDraws() {
        return draws;
    }

    public double getAverageGameLength() {
        return gamesPlayed == 0 ? 0.0 : (double) totalMoves / gamesPlayed;
    }
}
