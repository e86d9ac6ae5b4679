package com.connectk.core;

/**
 * Thrown when a move is requested for a position that is already won or drawn.
 */
public class NoMovesAvailableException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public NoMovesAvailableException(String message) {
        super(message);
    }
}
