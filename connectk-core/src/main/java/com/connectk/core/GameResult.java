package com.connectk.core;

import java.util.Objects;

/**
 * Outcome classification of a position: still ongoing, won by one player, or drawn.
 *
 * @param status the classification
 * @param winner the winning player for {@link Status#WIN}, otherwise {@code null}
 */
public record GameResult(Status status, Player winner) {

    public static final GameResult ONGOING = new GameResult(Status.ONGOING, null);
    public static final GameResult DRAW = new GameResult(Status.DRAW, null);
    private static final GameResult FIRST_WINS = new GameResult(Status.WIN, Player.FIRST);
    private static final GameResult SECOND_WINS = new GameResult(Status.WIN, Player.SECOND);

    public GameResult {
        Objects.requireNonNull(status, "status");
        if ((status == Status.WIN) != (winner != null)) {
            throw new IllegalArgumentException("A winner is required exactly for WIN results");
        }
    }

    /**
     * Returns the shared result instance for a win by the given player.
     */
    public static GameResult win(Player winner) {
        return Objects.requireNonNull(winner, "winner") == Player.FIRST ? FIRST_WINS : SECOND_WINS;
    }

    public boolean isOver() {
        return status != Status.ONGOING;
    }

    /**
     * Returns {@code true} if this result is a win for {@code player}.
     */
    public boolean isWinFor(Player player) {
        return status == Status.WIN && winner == player;
    }

    @Override
    public String toString() {
        return status == Status.WIN ? "WIN(" + winner + ")" : status.name();
    }

    public enum Status {
        ONGOING,
        WIN,
        DRAW
    }
}
