package com.connectk.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable connect-K grid. Columns fill bottom-to-top; each cell is empty or owned by a
 * {@link Player}. The board does not track whose turn it is, see {@link GameState}.
 */
public final class Board {

    private final BoardGeometry geometry;
    private final byte[] cells;
    private final int[] heights;
    private final int tokenCount;

    /**
     * Creates an empty board with the provided geometry.
     */
    public Board(BoardGeometry geometry) {
        this(Objects.requireNonNull(geometry, "geometry"), new byte[geometry.cellCount()],
                new int[geometry.width()], 0);
    }

    private Board(BoardGeometry geometry, byte[] cells, int[] heights, int tokenCount) {
        this.geometry = geometry;
        this.cells = cells;
        this.heights = heights;
        this.tokenCount = tokenCount;
    }

    public BoardGeometry getGeometry() {
        return geometry;
    }

    /**
     * Returns the number of tokens already stacked in the column.
     */
    public int columnHeight(int column) {
        checkColumn(column);
        return heights[column];
    }

    public boolean isColumnFull(int column) {
        return columnHeight(column) == geometry.height();
    }

    /**
     * Returns {@code true} if every column is full.
     */
    public boolean isFull() {
        return tokenCount == geometry.cellCount();
    }

    /**
     * Returns the number of occupied cells.
     */
    public int countTokens() {
        return tokenCount;
    }

    /**
     * Returns the owner of the cell, or {@code null} if it is empty.
     */
    public Player ownerAt(int column, int row) {
        checkColumn(column);
        if (row < 0 || row >= geometry.height()) {
            throw new IllegalArgumentException("Row index out of range: " + row);
        }
        return Player.fromCellValue(cells[column * geometry.height() + row]);
    }

    /**
     * Returns a new board with a token of {@code player} dropped on top of {@code column}.
     */
    public Board withToken(int column, Player player) {
        Objects.requireNonNull(player, "player");
        if (!geometry.containsColumn(column)) {
            throw new InvalidMoveException(column, "Column out of range: " + column);
        }
        int row = heights[column];
        if (row == geometry.height()) {
            throw new InvalidMoveException(column, "Column " + column + " is already full");
        }
        byte[] updatedCells = cells.clone();
        updatedCells[column * geometry.height() + row] = player.cellValue();
        int[] updatedHeights = heights.clone();
        updatedHeights[column] = row + 1;
        return new Board(geometry, updatedCells, updatedHeights, tokenCount + 1);
    }

    /**
     * Returns {@code true} if the token at the given cell completes a line of the geometry's
     * connect length.
     */
    public boolean completesLine(int column, int row) {
        return LineDetector.completesLine(cells, geometry.width(), geometry.height(), geometry.connectLength(),
                column, row);
    }

    /**
     * Copies the column-major cell values into {@code target}: 0 empty, 1 first player, 2 second.
     */
    public void copyCells(byte[] target) {
        System.arraycopy(cells, 0, target, 0, cells.length);
    }

    /**
     * Copies the per-column token counts into {@code target}.
     */
    public void copyHeights(int[] target) {
        System.arraycopy(heights, 0, target, 0, heights.length);
    }

    private void checkColumn(int column) {
        if (!geometry.containsColumn(column)) {
            throw new IllegalArgumentException("Column index out of range: " + column);
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Board)) {
            return false;
        }
        Board that = (Board) other;
        return geometry.equals(that.geometry) && Arrays.equals(cells, that.cells);
    }

    @Override
    public int hashCode() {
        return 31 * geometry.hashCode() + Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int row = geometry.height() - 1; row >= 0; row--) {
            for (int column = 0; column < geometry.width(); column++) {
                Player owner = Player.fromCellValue(cells[column * geometry.height() + row]);
                sb.append("| ").append(owner == null ? ' ' : owner.symbol()).append(' ');
            }
            sb.append("|\n");
        }
        for (int column = 0; column < geometry.width(); column++) {
            sb.append(String.format("%3d ", column));
        }
        return sb.append('\n').toString();
    }
}
