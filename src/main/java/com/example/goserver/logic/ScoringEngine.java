package com.example.goserver.logic;

import com.example.goserver.model.domain.Board;
import com.example.goserver.model.domain.CapturedStones;
import com.example.goserver.model.domain.Position;
import com.example.goserver.model.domain.Ruleset;
import com.example.goserver.model.domain.ScoreBreakdown;
import com.example.goserver.model.domain.ScoreResult;
import com.example.goserver.model.domain.Stone;
import com.example.goserver.model.domain.StoneColor;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Territory counting and per-ruleset score formulas, plus dead-stone marking.
 * Stateless apart from the dead-group heuristic switch.
 */
public class ScoringEngine {

    private static final int AUTO_DETECT_MIN_GROUP = 3;
    private static final int AUTO_DETECT_MAX_CANDIDATE = 5;

    private final BoardEngine boardEngine;
    private final boolean autoDetectDeadGroups;

    public ScoringEngine(BoardEngine boardEngine) {
        this(boardEngine, false);
    }

    public ScoringEngine(BoardEngine boardEngine, boolean autoDetectDeadGroups) {
        this.boardEngine = boardEngine;
        this.autoDetectDeadGroups = autoDetectDeadGroups;
    }

    public ScoreResult score(Board board, Set<Position> deadStones, CapturedStones captured, Ruleset ruleset, double komi) {
        List<Position> blackTerritory = new ArrayList<>();
        List<Position> whiteTerritory = new ArrayList<>();
        List<Position> neutral = new ArrayList<>();
        collectTerritory(board, deadStones, blackTerritory, whiteTerritory, neutral);

        int blackLive = 0;
        int whiteLive = 0;
        int blackDead = 0;
        int whiteDead = 0;
        for (Stone stone : board.getStones()) {
            boolean dead = deadStones.contains(stone.position());
            if (stone.color() == StoneColor.BLACK) {
                if (dead) blackDead++; else blackLive++;
            } else {
                if (dead) whiteDead++; else whiteLive++;
            }
        }

        ScoreBreakdown black = breakdown(ruleset, blackTerritory.size(), blackLive,
                captured.getBlack() + whiteDead, 0);
        ScoreBreakdown white = breakdown(ruleset, whiteTerritory.size(), whiteLive,
                captured.getWhite() + blackDead, komi);

        StoneColor winner = null;
        if (black.getTotal() > white.getTotal()) {
            winner = StoneColor.BLACK;
        } else if (white.getTotal() > black.getTotal()) {
            winner = StoneColor.WHITE;
        }
        String code = resultCode(winner, Math.abs(black.getTotal() - white.getTotal()));
        return new ScoreResult(ruleset, blackTerritory, whiteTerritory, neutral, black, white, winner, code);
    }

    private ScoreBreakdown breakdown(Ruleset ruleset, int territory, int liveStones, int prisoners, double komi) {
        int stones;
        int captures;
        switch (ruleset) {
            case CHINESE:
            case KOREAN:
                stones = liveStones;
                captures = 0;
                break;
            case JAPANESE:
                stones = 0;
                captures = prisoners;
                break;
            case AGA:
            case ING:
                stones = liveStones;
                captures = prisoners;
                break;
            default:
                throw new IllegalArgumentException("Unsupported ruleset " + ruleset);
        }
        return new ScoreBreakdown(territory, stones, captures, komi, territory + stones + captures + komi);
    }

    static String resultCode(StoneColor winner, double margin) {
        if (winner == null) {
            return "Draw";
        }
        String formatted = BigDecimal.valueOf(margin).stripTrailingZeros().toPlainString();
        return winner.code() + "+" + formatted;
    }

    /**
     * Flood fills every empty or dead-marked point. A region touching live stones of exactly one
     * color belongs to that color; anything else is dame.
     */
    private void collectTerritory(Board board, Set<Position> deadStones,
                                  List<Position> blackOut, List<Position> whiteOut, List<Position> neutralOut) {
        int size = board.getSize();
        boolean[][] visited = new boolean[size][size];
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                Position start = new Position(x, y);
                if (visited[y][x] || !isOpen(board, deadStones, start)) {
                    continue;
                }
                List<Position> region = new ArrayList<>();
                Set<StoneColor> borders = EnumSet.noneOf(StoneColor.class);
                Deque<Position> queue = new ArrayDeque<>();
                queue.add(start);
                visited[y][x] = true;
                while (!queue.isEmpty()) {
                    Position current = queue.poll();
                    region.add(current);
                    for (Position n : board.neighbors(current)) {
                        if (isOpen(board, deadStones, n)) {
                            if (!visited[n.y()][n.x()]) {
                                visited[n.y()][n.x()] = true;
                                queue.add(n);
                            }
                        } else {
                            borders.add(board.get(n));
                        }
                    }
                }
                if (borders.size() == 1) {
                    (borders.contains(StoneColor.BLACK) ? blackOut : whiteOut).addAll(region);
                } else {
                    neutralOut.addAll(region);
                }
            }
        }
    }

    private boolean isOpen(Board board, Set<Position> deadStones, Position p) {
        return board.isEmpty(p) || deadStones.contains(p);
    }

    /**
     * Flips the whole group at {@code position}: if more than half of it is already marked the
     * group is released, otherwise all of it is marked dead.
     *
     * @return the new dead-stone set; the input is not modified
     */
    public Set<Position> toggleDeadStone(Board board, Set<Position> deadStones, Position position) {
        if (board.isEmpty(position)) {
            throw new IllegalStateException("No stone at position " + position);
        }
        Set<Position> group = boardEngine.findGroup(board, position);
        Set<Position> affected = new LinkedHashSet<>(group);
        if (autoDetectDeadGroups && group.size() >= AUTO_DETECT_MIN_GROUP) {
            affected.addAll(likelyDeadCompanions(board, group));
        }

        long alreadyDead = group.stream().filter(deadStones::contains).count();
        Set<Position> updated = new LinkedHashSet<>(deadStones);
        if (alreadyDead * 2 > group.size()) {
            updated.removeAll(affected);
        } else {
            updated.addAll(affected);
        }
        return updated;
    }

    public boolean isAutoDetectDeadGroups() {
        return autoDetectDeadGroups;
    }

    // Small same-colored groups elsewhere on the board that look dead
    private Set<Position> likelyDeadCompanions(Board board, Set<Position> toggled) {
        StoneColor color = board.get(toggled.iterator().next());
        Set<Position> result = new LinkedHashSet<>();
        Set<Position> seen = new LinkedHashSet<>(toggled);
        for (Stone stone : board.getStones()) {
            if (stone.color() != color || seen.contains(stone.position())) {
                continue;
            }
            Set<Position> group = boardEngine.findGroup(board, stone.position());
            seen.addAll(group);
            if (group.size() <= AUTO_DETECT_MAX_CANDIDATE && isGroupLikelyDead(board, group)) {
                result.addAll(group);
            }
        }
        return result;
    }

    /**
     * Crude life check: no liberties, or one or two liberties where at least one is a false eye.
     */
    public boolean isGroupLikelyDead(Board board, Set<Position> group) {
        if (group.isEmpty()) {
            return false;
        }
        Set<Position> liberties = boardEngine.liberties(board, group);
        if (liberties.isEmpty()) {
            return true;
        }
        if (liberties.size() > 2) {
            return false;
        }
        StoneColor color = board.get(group.iterator().next());
        for (Position liberty : liberties) {
            if (isFalseEye(board, liberty, color)) {
                return true;
            }
        }
        return false;
    }

    private boolean isFalseEye(Board board, Position point, StoneColor owner) {
        int opponentDiagonals = 0;
        for (Position d : board.diagonals(point)) {
            if (board.get(d) == owner.opposite()) {
                opponentDiagonals++;
            }
        }
        return opponentDiagonals >= 2;
    }
}
