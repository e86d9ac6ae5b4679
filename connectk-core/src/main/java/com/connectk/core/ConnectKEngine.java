package com.connectk.core;

import com.connectk.core.ai.MctsConfig;
import com.connectk.core.ai.MctsEngine;
import com.connectk.core.ai.SearchBudget;
import com.connectk.core.ai.SearchResult;
import java.util.Objects;

/**
 * Entry point for front-ends: binds one board geometry to one {@link MctsEngine} and keeps the
 * engine's search tree for the game in progress.
 */
public final class ConnectKEngine {

    private final BoardGeometry geometry;
    private final MctsEngine engine;

    public ConnectKEngine(BoardGeometry geometry, MctsConfig config) {
        this.geometry = Objects.requireNonNull(geometry, "geometry");
        this.engine = new MctsEngine(Objects.requireNonNull(config, "config"));
    }

    /**
     * Validates the geometry and search settings and creates an engine.
     *
     * @throws ConfigurationException if {@code connectLength > max(width, height)}, any dimension is
     *                                below 1, or the exploration constant or budget is invalid
     */
    public static ConnectKEngine configure(int width, int height, int connectLength, double explorationConstant,
            SearchBudget budget, long seed) {
        BoardGeometry geometry = new BoardGeometry(width, height, connectLength);
        MctsConfig config = MctsConfig.builder()
                .explorationConstant(explorationConstant)
                .budget(budget)
                .seed(seed)
                .build();
        return new ConnectKEngine(geometry, config);
    }

    public BoardGeometry getGeometry() {
        return geometry;
    }

    public MctsEngine getSearcher() {
        return engine;
    }

    /**
     * Returns an empty board with {@link Player#FIRST} to move and forgets the previous game's tree.
     */
    public GameState newGame() {
        engine.reset();
        return new GameState(geometry);
    }

    /**
     * Runs the configured budget and returns the chosen column.
     *
     * @throws NoMovesAvailableException if {@code state} is already won or drawn
     */
    public int bestMove(GameState state) {
        return analyse(state).move();
    }

    /**
     * Runs the configured budget and returns the chosen column with the statistics of every root
     * child.
     *
     * @throws NoMovesAvailableException if {@code state} is already won or drawn
     */
    public SearchResult analyse(GameState state) {
        checkGeometry(state);
        return engine.search(state);
    }

    /**
     * Plays {@code column} in {@code state}.
     *
     * @throws InvalidMoveException if the column is out of range or full, or the game is over
     */
    public GameState applyMove(GameState state, int column) {
        checkGeometry(state);
        return state.applyMove(column);
    }

    public GameResult result(GameState state) {
        return Objects.requireNonNull(state, "state").getResult();
    }

    private void checkGeometry(GameState state) {
        Objects.requireNonNull(state, "state");
        if (!geometry.equals(state.getGeometry())) {
            throw new IllegalArgumentException("State geometry " + state.getGeometry()
                    + " does not match engine geometry " + geometry);
        }
    }
}
