package com.connectk.core;

/**
 * Thrown when a move names a column outside the board, a full column, or is played in a finished
 * game. Callers recover by choosing another move.
 */
public class InvalidMoveException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int column;

    public InvalidMoveException(int column, String message) {
        super(message);
        this.column = column;
    }

    /**
     * Returns the rejected column.
     */
    public int getColumn() {
        return column;
    }
}
