package com.example.goserver.ai;

import com.example.goserver.model.domain.Position;
import com.example.goserver.model.domain.StoneColor;

import java.util.List;

/**
 * Immutable copy of what an engine needs to reproduce a game: setup stones plus every move.
 */
public record AiPosition(int boardSize, double komi, List<Position> handicapStones, List<Move> moves) {

    public AiPosition {
        handicapStones = List.copyOf(handicapStones);
        moves = List.copyOf(moves);
    }

    /** A played move; {@code position} is null for a pass. */
    public record Move(StoneColor color, Position position) {
    }
}
