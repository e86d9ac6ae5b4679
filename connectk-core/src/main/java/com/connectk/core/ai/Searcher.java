package com.connectk.core.ai;

import com.connectk.core.GameState;

/**
 * Generic interface for move search implementations.
 */
public interface Searcher {

    /**
     * Executes a search for the best move in the provided {@link GameState} under the supplied
     * {@link SearchBudget}.
     *
     * @param state the starting state to analyse
     * @param budget the limits guiding the search execution
     * @return the result of the search
     * @throws com.connectk.core.NoMovesAvailableException if {@code state} is already terminal
     */
    SearchResult search(GameState state, SearchBudget budget);
}
