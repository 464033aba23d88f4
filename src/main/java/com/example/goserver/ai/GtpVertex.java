package com.example.goserver.ai;

import com.example.goserver.model.domain.Position;
import com.example.goserver.model.domain.StoneColor;

/**
 * GTP coordinates: column letters A-T without I, row 1 on the edge opposite y = 0.
 */
public final class GtpVertex {

    static final String COLUMNS = "ABCDEFGHJKLMNOPQRST";
    public static final String PASS = "pass";

    private GtpVertex() {
    }

    public static String encode(Position position, int boardSize) {
        if (position == null) {
            return PASS;
        }
        checkBoardSize(boardSize);
        if (position.x() < 0 || position.x() >= boardSize || position.y() < 0 || position.y() >= boardSize) {
            throw new IllegalArgumentException("Position " + position + " is outside a " + boardSize + " board");
        }
        return COLUMNS.charAt(position.x()) + Integer.toString(boardSize - position.y());
    }

    /**
     * @return the position, or null for a pass
     */
    public static Position decode(String vertex, int boardSize) {
        checkBoardSize(boardSize);
        String v = vertex == null ? "" : vertex.trim().toUpperCase();
        if (v.isEmpty()) {
            throw new IllegalArgumentException("Empty vertex");
        }
        if (v.equals("PASS")) {
            return null;
        }
        int x = COLUMNS.indexOf(v.charAt(0));
        if (x < 0 || x >= boardSize) {
            throw new IllegalArgumentException("Bad vertex column in " + vertex);
        }
        int row;
        try {
            row = Integer.parseInt(v.substring(1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Bad vertex row in " + vertex, e);
        }
        if (row < 1 || row > boardSize) {
            throw new IllegalArgumentException("Bad vertex row in " + vertex);
        }
        return new Position(x, boardSize - row);
    }

    public static String color(StoneColor color) {
        return color == StoneColor.BLACK ? "black" : "white";
    }

    private static void checkBoardSize(int boardSize) {
        if (boardSize < 2 || boardSize > COLUMNS.length()) {
            throw new IllegalArgumentException("GTP supports boards up to " + COLUMNS.length());
        }
    }
}
