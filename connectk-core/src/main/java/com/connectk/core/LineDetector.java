package com.connectk.core;

/**
 * Win detection on a raw column-major cell array, shared by the immutable {@link Board} and the
 * mutable rollout buffers.
 *
 * <p>Cells are addressed as {@code column * height + row}, row 0 at the bottom. Only the four lines
 * through the given cell are scanned, at most {@code connectLength - 1} cells in each direction.
 */
public final class LineDetector {

    private static final int[][] DIRECTIONS = {
        {1, 0},
        {0, 1},
        {1, 1},
        {1, -1}
    };

    private LineDetector() {
    }

    /**
     * Returns {@code true} if the token at ({@code column}, {@code row}) is part of an unbroken line
     * of at least {@code connectLength} same-owner tokens.
     */
    public static boolean completesLine(byte[] cells, int width, int height, int connectLength, int column, int row) {
        byte owner = cells[column * height + row];
        if (owner == 0) {
            return false;
        }
        for (int[] direction : DIRECTIONS) {
            int count = 1
                    + countRun(cells, width, height, connectLength, column, row, direction[0], direction[1], owner)
                    + countRun(cells, width, height, connectLength, column, row, -direction[0], -direction[1], owner);
            if (count >= connectLength) {
                return true;
            }
        }
        return false;
    }

    private static int countRun(byte[] cells, int width, int height, int connectLength, int column, int row,
            int stepColumn, int stepRow, byte owner) {
        int run = 0;
        int c = column + stepColumn;
        int r = row + stepRow;
        while (run < connectLength - 1 && c >= 0 && c < width && r >= 0 && r < height
                && cells[c * height + r] == owner) {
            run++;
            c += stepColumn;
            r += stepRow;
        }
        return run;
    }
}
