package com.example.goserver.model.dto;

import com.example.goserver.model.domain.CapturedStones;
import com.example.goserver.model.domain.ClockSnapshot;
import com.example.goserver.model.domain.Position;
import com.example.goserver.model.domain.ResultReason;
import com.example.goserver.model.domain.ScoreResult;
import com.example.goserver.model.domain.StoneColor;

import java.util.List;
import java.util.Set;

/**
 * Payloads carried by {@link GameEvent}, one per incremental event kind.
 */
public final class GameEvents {

    private GameEvents() {
    }

    public record MoveMade(int moveIndex, StoneColor color, Position position, boolean pass,
                           List<Position> captured, Position koPosition, CapturedStones capturedStones,
                           StoneColor nextTurn) {
    }

    public record TimeUpdate(StoneColor currentTurn, ClockSnapshot black, ClockSnapshot white) {
    }

    public record ByoYomiReset(StoneColor color, int periodsLeft, long timeLeftMs) {
    }

    public record PlayerTimeout(StoneColor color, StoneColor winner, String result, String message) {
    }

    public record PlayerJoined(String playerId, String username, StoneColor color, boolean spectator) {
    }

    public record DeadStonesUpdated(Set<Position> deadStones, ScoreResult preview) {
    }

    public record ScoreConfirmation(boolean black, boolean white) {
    }

    public record GameFinished(String result, StoneColor winner, ResultReason reason, ScoreResult score) {
    }

    public record UndoRequested(String requestedBy, int moveIndex) {
    }

    public record UndoResolved(boolean accepted, int moveIndex) {
    }

    public record PlayAgain(String requestedBy) {
    }

    public record NewGame(String previousGameId, String gameId, String code) {
    }
}
