package com.example.goserver.model.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Square Go board. Cells hold the color of the stone on them, or {@code null} when empty,
 * so a position can never hold two stones.
 */
public class Board {

    private final int size;
    private final StoneColor[][] grid;

    public Board(int size) {
        if (size < 2) {
            throw new IllegalArgumentException("Board size must be at least 2");
        }
        this.size = size;
        this.grid = new StoneColor[size][size];
    }

    public int getSize() {
        return size;
    }

    public boolean contains(Position p) {
        return p != null && p.x() >= 0 && p.x() < size && p.y() >= 0 && p.y() < size;
    }

    public StoneColor get(Position p) {
        return contains(p) ? grid[p.y()][p.x()] : null;
    }

    public boolean isEmpty(Position p) {
        return get(p) == null;
    }

    public void set(Position p, StoneColor color) {
        if (!contains(p)) {
            throw new IllegalArgumentException("Position " + p + " is outside a " + size + "x" + size + " board");
        }
        grid[p.y()][p.x()] = color;
    }

    public void remove(Position p) {
        set(p, null);
    }

    /** Orthogonal neighbors that lie on the board. */
    public List<Position> neighbors(Position p) {
        List<Position> result = new ArrayList<>(4);
        addIfOnBoard(result, p.x() - 1, p.y());
        addIfOnBoard(result, p.x() + 1, p.y());
        addIfOnBoard(result, p.x(), p.y() - 1);
        addIfOnBoard(result, p.x(), p.y() + 1);
        return result;
    }

    public List<Position> diagonals(Position p) {
        List<Position> result = new ArrayList<>(4);
        addIfOnBoard(result, p.x() - 1, p.y() - 1);
        addIfOnBoard(result, p.x() + 1, p.y() - 1);
        addIfOnBoard(result, p.x() - 1, p.y() + 1);
        addIfOnBoard(result, p.x() + 1, p.y() + 1);
        return result;
    }

    private void addIfOnBoard(List<Position> out, int x, int y) {
        if (x >= 0 && x < size && y >= 0 && y < size) {
            out.add(new Position(x, y));
        }
    }

    /** Stones in row-major order. */
    public List<Stone> getStones() {
        List<Stone> stones = new ArrayList<>();
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                if (grid[y][x] != null) {
                    stones.add(new Stone(new Position(x, y), grid[y][x]));
                }
            }
        }
        return stones;
    }

    public int countStones(StoneColor color) {
        int count = 0;
        for (StoneColor[] row : grid) {
            for (StoneColor cell : row) {
                if (cell == color) {
                    count++;
                }
            }
        }
        return count;
    }

    public Board copy() {
        Board copy = new Board(size);
        for (int y = 0; y < size; y++) {
            System.arraycopy(grid[y], 0, copy.grid[y], 0, size);
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Board)) {
            return false;
        }
        Board other = (Board) o;
        return size == other.size && Arrays.deepEquals(grid, other.grid);
    }

    @Override
    public int hashCode() {
        return 31 * size + Arrays.deepHashCode(grid);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (StoneColor[] row : grid) {
            for (StoneColor cell : row) {
                sb.append(cell == null ? '.' : cell == StoneColor.BLACK ? 'X' : 'O');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
