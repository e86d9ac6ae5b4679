package com.connectk.core.ai.state;

import com.connectk.core.Board;
import com.connectk.core.BoardGeometry;
import com.connectk.core.GameResult;
import com.connectk.core.GameState;
import com.connectk.core.LineDetector;
import com.connectk.core.Player;

/**
 * Mutable playout buffers that allow random rollouts without per-ply allocations.
 *
 * <p>The open columns are kept in a compact array: when a column fills up, the last open column is
 * swapped into its slot. The order therefore depends only on the moves played, which keeps seeded
 * rollouts reproducible.
 */
public final class RolloutState {

    private BoardGeometry geometry;
    private byte[] cells = new byte[0];
    private int[] heights = new int[0];
    private int[] openColumns = new int[0];
    private int openCount;
    private int tokenCount;
    private Player toMove;
    private GameResult result;

    /**
     * Resets this buffer to mirror the provided {@link GameState}.
     */
    public void reset(GameState state) {
        BoardGeometry stateGeometry = state.getGeometry();
        if (!stateGeometry.equals(geometry)) {
            geometry = stateGeometry;
            cells = new byte[stateGeometry.cellCount()];
            heights = new int[stateGeometry.width()];
            openColumns = new int[stateGeometry.width()];
        }
        Board board = state.getBoard();
        board.copyCells(cells);
        board.copyHeights(heights);
        openCount = 0;
        for (int column = 0; column < geometry.width(); column++) {
            if (heights[column] < geometry.height()) {
                openColumns[openCount++] = column;
            }
        }
        tokenCount = board.countTokens();
        toMove = state.getCurrentPlayer();
        result = state.getResult();
    }

    public boolean isTerminal() {
        return result.isOver();
    }

    public GameResult result() {
        return result;
    }

    public Player toMove() {
        return toMove;
    }

    public int tokenCount() {
        return tokenCount;
    }

    /**
     * Returns the number of columns that still accept a token.
     */
    public int openColumnCount() {
        return result.isOver() ? 0 : openCount;
    }

    public int openColumnAt(int index) {
        if (index < 0 || index >= openCount) {
            throw new IndexOutOfBoundsException("Open column index " + index + " of " + openCount);
        }
        return openColumns[index];
    }

    /**
     * Drops a token for the player to move into {@code column} and updates the outcome.
     */
    public void play(int column) {
        if (result.isOver()) {
            throw new IllegalStateException("Cannot continue a finished rollout");
        }
        int height = geometry.height();
        int row = heights[column];
        if (row >= height) {
            throw new IllegalStateException("Rollout played into full column " + column);
        }
        cells[column * height + row] = toMove == Player.FIRST ? (byte) 1 : (byte) 2;
        heights[column] = row + 1;
        tokenCount++;

        if (row + 1 == height) {
            for (int i = 0; i < openCount; i++) {
                if (openColumns[i] == column) {
                    openColumns[i] = openColumns[--openCount];
                    break;
                }
            }
        }

        if (LineDetector.completesLine(cells, geometry.width(), height, geometry.connectLength(), column, row)) {
            result = GameResult.win(toMove);
        } else if (tokenCount == geometry.cellCount()) {
            result = GameResult.DRAW;
        }
        toMove = toMove.opponent();
    }
}
