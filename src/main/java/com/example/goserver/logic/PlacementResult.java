package com.example.goserver.logic;

import com.example.goserver.model.domain.Position;
import com.example.goserver.model.domain.StoneColor;

import java.util.List;

/**
 * Outcome of an accepted placement. {@code koPosition} is the point the opponent may not
 * play next, or null.
 */
public record PlacementResult(Position position, StoneColor color, List<Position> captured, Position koPosition) {

    public int capturedCount() {
        return captured.size();
    }
}
