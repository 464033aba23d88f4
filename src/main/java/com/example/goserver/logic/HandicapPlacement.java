package com.example.goserver.logic;

import com.example.goserver.model.domain.Position;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fixed handicap stone points per board size, in placement order.
 */
public final class HandicapPlacement {

    public static final int MIN_HANDICAP = 2;
    public static final int MAX_HANDICAP = 9;

    private static final Map<Integer, int[][]> STAR_POINTS = Map.of(
            9, new int[][]{{2, 2}, {6, 6}, {6, 2}, {2, 6}, {4, 4}, {4, 2}, {4, 6}, {2, 4}, {6, 4}},
            13, new int[][]{{3, 3}, {9, 9}, {9, 3}, {3, 9}, {6, 6}, {6, 3}, {6, 9}, {3, 6}, {9, 6}},
            15, new int[][]{{3, 3}, {11, 11}, {11, 3}, {3, 11}, {7, 7}, {7, 3}, {7, 11}, {3, 7}, {11, 7}},
            19, new int[][]{{3, 3}, {15, 15}, {15, 3}, {3, 15}, {9, 9}, {9, 3}, {9, 15}, {3, 9}, {15, 9}},
            21, new int[][]{{3, 3}, {17, 17}, {17, 3}, {3, 17}, {10, 10}, {10, 3}, {10, 17}, {3, 10}, {17, 10}}
    );

    private HandicapPlacement() {
    }

    public static boolean supportsBoardSize(int boardSize) {
        return STAR_POINTS.containsKey(boardSize);
    }

    /**
     * Points for {@code handicap} stones; empty for 0.
     */
    public static List<Position> positions(int boardSize, int handicap) {
        if (handicap == 0) {
            return List.of();
        }
        if (handicap < MIN_HANDICAP || handicap > MAX_HANDICAP) {
            throw new IllegalArgumentException("Handicap must be 0 or between " + MIN_HANDICAP + " and " + MAX_HANDICAP);
        }
        int[][] points = STAR_POINTS.get(boardSize);
        if (points == null) {
            throw new IllegalArgumentException("No handicap points for board size " + boardSize);
        }
        List<Position> result = new ArrayList<>(handicap);
        for (int i = 0; i < handicap; i++) {
            result.add(new Position(points[i][0], points[i][1]));
        }
        return result;
    }
}
