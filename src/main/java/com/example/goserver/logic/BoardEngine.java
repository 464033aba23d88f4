package com.example.goserver.logic;

import com.example.goserver.model.domain.Board;
import com.example.goserver.model.domain.Position;
import com.example.goserver.model.domain.Stone;
import com.example.goserver.model.domain.StoneColor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Stone placement rules: captures, suicide and ko.
 * Stateless and thread-safe; the caller owns the Board it passes in.
 */
public class BoardEngine {

    /**
     * Places a stone and removes any opponent groups left without liberties.
     * On a rule violation the board is left exactly as it was.
     */
    public PlacementResult place(Board board, Position position, StoneColor color, Position koPosition) {
        if (!board.contains(position))
            throw new RuleViolationException(RuleViolationException.Reason.OUT_OF_BOUNDS);
        if (!board.isEmpty(position))
            throw new RuleViolationException(RuleViolationException.Reason.OCCUPIED);
        if (position.equals(koPosition))
            throw new RuleViolationException(RuleViolationException.Reason.KO);

        board.set(position, color);

        // Collect every dead neighbor group first, then remove them together
        Set<Position> captured = new LinkedHashSet<>();
        for (Position neighbor : board.neighbors(position)) {
            if (board.get(neighbor) != color.opposite() || captured.contains(neighbor)) {
                continue;
            }
            Set<Position> group = findGroup(board, neighbor);
            if (countLiberties(board, group) == 0) {
                captured.addAll(group);
            }
        }
        for (Position p : captured) {
            board.remove(p);
        }

        Set<Position> ownGroup = findGroup(board, position);
        int ownLiberties = countLiberties(board, ownGroup);
        if (ownLiberties == 0) {
            // Only reachable when nothing was captured
            board.remove(position);
            throw new RuleViolationException(RuleViolationException.Reason.SUICIDE);
        }

        Position newKo = null;
        if (captured.size() == 1 && ownGroup.size() == 1 && ownLiberties == 1) {
            newKo = captured.iterator().next();
        }
        return new PlacementResult(position, color, List.copyOf(captured), newKo);
    }

    /** Connected stones of the same color as the stone at {@code start}. Empty set for an empty point. */
    public Set<Position> findGroup(Board board, Position start) {
        Set<Position> group = new LinkedHashSet<>();
        StoneColor color = board.get(start);
        if (color == null) {
            return group;
        }
        Deque<Position> stack = new ArrayDeque<>();
        stack.push(start);
        group.add(start);
        while (!stack.isEmpty()) {
            Position current = stack.pop();
            for (Position n : board.neighbors(current)) {
                if (board.get(n) == color && group.add(n)) {
                    stack.push(n);
                }
            }
        }
        return group;
    }

    public Set<Position> liberties(Board board, Set<Position> group) {
        Set<Position> liberties = new LinkedHashSet<>();
        for (Position stone : group) {
            for (Position n : board.neighbors(stone)) {
                if (board.isEmpty(n)) {
                    liberties.add(n);
                }
            }
        }
        return liberties;
    }

    public int countLiberties(Board board, Set<Position> group) {
        return liberties(board, group).size();
    }

    /** Partitions all stones on the board into connected groups. */
    public List<Set<Position>> allGroups(Board board) {
        List<Set<Position>> groups = new ArrayList<>();
        Set<Position> seen = new LinkedHashSet<>();
        for (Stone stone : board.getStones()) {
            if (seen.contains(stone.position())) {
                continue;
            }
            Set<Position> group = findGroup(board, stone.position());
            seen.addAll(group);
            groups.add(group);
        }
        return groups;
    }
}
