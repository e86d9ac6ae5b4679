package com.connectk.core;

/**
 * Dimensions of a connect-K board and the number of aligned tokens that wins.
 *
 * @param width         number of columns, at least 1
 * @param height        number of rows, at least 1
 * @param connectLength tokens needed in a row, between 1 and {@code max(width, height)}
 */
public record BoardGeometry(int width, int height, int connectLength) {

    /**
     * Classic Connect-Four: seven columns, six rows, four in a row.
     */
    public static final BoardGeometry CONNECT_FOUR = new BoardGeometry(7, 6, 4);

    public BoardGeometry {
        if (width < 1) {
            throw new ConfigurationException("Board width must be at least 1, was " + width);
        }
        if (height < 1) {
            throw new ConfigurationException("Board height must be at least 1, was " + height);
        }
        if (connectLength < 1) {
            throw new ConfigurationException("Connect length must be at least 1, was " + connectLength);
        }
        if (connectLength > Math.max(width, height)) {
            throw new ConfigurationException("Connect length " + connectLength
                    + " cannot fit on a " + width + "x" + height + " board");
        }
    }

    /**
     * Returns the total number of cells on the board.
     */
    public int cellCount() {
        return width * height;
    }

    /**
     * Returns {@code true} if the column index lies inside the board.
     */
    public boolean containsColumn(int column) {
        return column >= 0 && column < width;
    }
}
