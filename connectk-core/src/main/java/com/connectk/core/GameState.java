package com.connectk.core;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable representation of a connect-K position.
 * The state keeps the board occupancy, the player to move, the last placed token and the
 * sequence of columns played since the empty board. The outcome is determined once, when the
 * move that produced the state is applied.
 */
public final class GameState {

    private static final int[] NO_MOVES = new int[0];

    private final Board board;
    private final Player currentPlayer;
    private final int lastColumn;
    private final int lastRow;
    private final int[] history;
    private final GameResult result;

    /**
     * Creates the initial empty state with {@link Player#FIRST} to move.
     */
    public GameState(BoardGeometry geometry) {
        this(new Board(geometry), Player.FIRST, -1, -1, NO_MOVES, GameResult.ONGOING);
    }

    private GameState(Board board, Player currentPlayer, int lastColumn, int lastRow, int[] history,
            GameResult result) {
        this.board = board;
        this.currentPlayer = currentPlayer;
        this.lastColumn = lastColumn;
        this.lastRow = lastRow;
        this.history = history;
        this.result = result;
    }

    /**
     * Replays {@code moves} from the empty board.
     *
     * @throws InvalidMoveException if any move cannot be played; the message names its index
     */
    public static GameState fromMoves(BoardGeometry geometry, int... moves) {
        Objects.requireNonNull(moves, "moves");
        GameState state = new GameState(geometry);
        for (int i = 0; i < moves.length; i++) {
            try {
                state = state.applyMove(moves[i]);
            } catch (InvalidMoveException ex) {
                throw new InvalidMoveException(moves[i],
                        "Invalid move sequence at index " + i + ": " + ex.getMessage());
            }
        }
        return state;
    }

    /**
     * Returns the board associated with this state.
     */
    public Board getBoard() {
        return board;
    }

    public BoardGeometry getGeometry() {
        return board.getGeometry();
    }

    /**
     * Returns the player whose turn it is.
     */
    public Player getCurrentPlayer() {
        return currentPlayer;
    }

    /**
     * Returns the column of the most recent move, or {@code -1} on an empty board.
     */
    public int getLastColumn() {
        return lastColumn;
    }

    /**
     * Returns the row of the most recent move, or {@code -1} on an empty board.
     */
    public int getLastRow() {
        return lastRow;
    }

    /**
     * Returns the number of moves played so far.
     */
    public int getMoveNumber() {
        return history.length;
    }

    /**
     * Returns a copy of the columns played since the empty board, oldest first.
     */
    public int[] getMoveHistory() {
        return history.clone();
    }

    /**
     * Returns {@code true} if this state's history starts with every move of {@code earlier}'s
     * history on the same geometry, i.e. {@code earlier} is an ancestor of (or equal to) this state.
     */
    public boolean extendsHistoryOf(GameState earlier) {
        Objects.requireNonNull(earlier, "earlier");
        if (!getGeometry().equals(earlier.getGeometry()) || earlier.history.length > history.length) {
            return false;
        }
        return Arrays.equals(history, 0, earlier.history.length, earlier.history, 0, earlier.history.length);
    }

    /**
     * Returns the move played at position {@code index} in the history.
     */
    public int moveAt(int index) {
        return history[index];
    }

    /**
     * Returns the legal columns in ascending order; empty once the game is over.
     */
    public int[] legalMoves() {
        if (result.isOver()) {
            return NO_MOVES;
        }
        BoardGeometry geometry = getGeometry();
        int[] moves = new int[geometry.width()];
        int count = 0;
        for (int column = 0; column < geometry.width(); column++) {
            if (board.columnHeight(column) < geometry.height()) {
                moves[count++] = column;
            }
        }
        return count == moves.length ? moves : Arrays.copyOf(moves, count);
    }

    /**
     * Returns {@code true} if {@code column} can be played in this state.
     */
    public boolean isLegal(int column) {
        return !result.isOver() && getGeometry().containsColumn(column) && !board.isColumnFull(column);
    }

    /**
     * Applies the provided move and returns the resulting state.
     *
     * @throws InvalidMoveException if the column is out of range or full, or the game is over
     */
    public GameState applyMove(int column) {
        if (result.isOver()) {
            throw new InvalidMoveException(column, "Game is already over (" + result + ")");
        }
        Board updatedBoard = board.withToken(column, currentPlayer);
        int row = updatedBoard.columnHeight(column) - 1;

        GameResult updatedResult;
        if (updatedBoard.completesLine(column, row)) {
            updatedResult = GameResult.win(currentPlayer);
        } else if (updatedBoard.isFull()) {
            updatedResult = GameResult.DRAW;
        } else {
            updatedResult = GameResult.ONGOING;
        }

        int[] updatedHistory = Arrays.copyOf(history, history.length + 1);
        updatedHistory[history.length] = column;
        return new GameState(updatedBoard, currentPlayer.opponent(), column, row, updatedHistory, updatedResult);
    }

    /**
     * Returns the player who completed a line, if any.
     */
    public Optional<Player> winner() {
        return Optional.ofNullable(result.winner());
    }

    /**
     * Returns {@code true} if the board is full and nobody has won.
     */
    public boolean isDraw() {
        return result.status() == GameResult.Status.DRAW;
    }

    /**
     * Returns {@code true} if the game is won or drawn.
     */
    public boolean isTerminal() {
        return result.isOver();
    }

    public GameResult getResult() {
        return result;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof GameState)) {
            return false;
        }
        GameState that = (GameState) other;
        return currentPlayer == that.currentPlayer && board.equals(that.board);
    }

    @Override
    public int hashCode() {
        return 31 * board.hashCode() + currentPlayer.hashCode();
    }

    @Override
    public String toString() {
        return board + "To move: " + currentPlayer + ", result: " + result + '\n';
    }
}
