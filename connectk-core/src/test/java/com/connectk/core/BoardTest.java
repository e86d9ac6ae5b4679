package com.connectk.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class BoardTest {

    @Test
    void initialBoardIsEmpty() {
        Board board = new Board(BoardGeometry.CONNECT_FOUR);
        assertEquals(0, board.countTokens());
        for (int column = 0; column < 7; column++) {
            assertEquals(0, board.columnHeight(column));
            for (int row = 0; row < 6; row++) {
                assertNull(board.ownerAt(column, row));
            }
        }
    }

    @Test
    void withTokenStacksFromTheBottom() {
        Board board = new Board(BoardGeometry.CONNECT_FOUR);
        Board updated = board.withToken(3, Player.FIRST).withToken(3, Player.SECOND);

        assertEquals(0, board.countTokens(), "Placing a token must not change the earlier board");
        assertEquals(2, updated.countTokens());
        assertEquals(2, updated.columnHeight(3));
        assertEquals(Player.FIRST, updated.ownerAt(3, 0));
        assertEquals(Player.SECOND, updated.ownerAt(3, 1));
    }

    @Test
    void rejectsFullAndOutOfRangeColumns() {
        Board board = new Board(new BoardGeometry(2, 1, 1)).withToken(0, Player.FIRST);

        InvalidMoveException full = assertThrows(InvalidMoveException.class, () -> board.withToken(0, Player.SECOND));
        assertEquals(0, full.getColumn());
        assertThrows(InvalidMoveException.class, () -> board.withToken(2, Player.SECOND));
        assertThrows(InvalidMoveException.class, () -> board.withToken(-1, Player.SECOND));
        assertTrue(board.isColumnFull(0));
        assertFalse(board.isColumnFull(1));
    }

    @Test
    void rendersTopRowFirst() {
        Board board = new Board(new BoardGeometry(2, 2, 2)).withToken(1, Player.FIRST);

        assertEquals("|   |   |\n|   | X |\n  0   1 \n", board.toString());
    }
}
