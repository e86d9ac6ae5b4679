package com.connectk.core;

/**
 * The two sides of a connect-K match. {@link #FIRST} always moves first on an empty board.
 */
public enum Player {
    FIRST('X'),
    SECOND('O');

    private final char symbol;

    Player(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the other side.
     */
    public Player opponent() {
        return this == FIRST ? SECOND : FIRST;
    }

    /**
     * Returns the character used to draw this player's tokens.
     */
    public char symbol() {
        return symbol;
    }

    byte cellValue() {
        return (byte) (ordinal() + 1);
    }

    static Player fromCellValue(byte value) {
        switch (value) {
            case 1:
                return FIRST;
            case 2:
                return SECOND;
            default:
                return null;
        }
    }
}
