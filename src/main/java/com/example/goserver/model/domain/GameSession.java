package com.example.goserver.model.domain;

import com.example.goserver.ai.AiEngine;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;

/**
 * One game room. Every mutation happens while holding the session's monitor
 * ({@code synchronized (session)}); the rules live in GameEngine.
 */
@Data
@NoArgsConstructor
public class GameSession {

    private String id;
    private String code;
    private GameConfig config;
    private double komi;
    private Board board;
    private List<Position> handicapStones = new ArrayList<>();
    private StoneColor currentTurn;
    private GameStatus status = GameStatus.WAITING;
    private List<MoveRecord> history = new ArrayList<>();
    private CapturedStones capturedStones = new CapturedStones();
    private Position koPosition;
    private int consecutivePasses;
    private List<Player> players = new ArrayList<>();
    private Set<String> spectators = new LinkedHashSet<>();
    private Set<Position> deadStones = new LinkedHashSet<>();
    private Map<StoneColor, Boolean> scoreConfirmation = new EnumMap<>(StoneColor.class);
    private long lastMoveTimestamp;
    private long createdAt;
    private GameResult result;
    private UndoRequest undoRequest;
    private boolean aiUndoUsed;
    private String playAgainRequestedBy;
    private String successorId;

    // Bumped on every change to board or history; lets async AI results detect staleness.
    private long revision;

    // Runtime handles, never part of a snapshot
    @ToString.Exclude
    private transient ScheduledFuture<?> evictionTimer;
    @ToString.Exclude
    private transient AiEngine aiEngine;
    @ToString.Exclude
    private transient Future<?> pendingAiMove;

    public Optional<Player> findPlayer(String playerId) {
        return players.stream().filter(p -> p.getId().equals(playerId)).findFirst();
    }

    public Player requirePlayer(String playerId) {
        return findPlayer(playerId)
                .orElseThrow(() -> new IllegalStateException("Player " + playerId + " is not seated in this game"));
    }

    public Player playerOf(StoneColor color) {
        return players.stream().filter(p -> p.getColor() == color).findFirst().orElse(null);
    }

    public Player currentPlayer() {
        return currentTurn == null ? null : playerOf(currentTurn);
    }

    public boolean isVsAi() {
        return config != null && config.isVsAi();
    }

    public boolean isFull() {
        return players.size() >= 2;
    }

    public void bumpRevision() {
        revision++;
    }

    public void resetScoreConfirmation() {
        scoreConfirmation.put(StoneColor.BLACK, false);
        scoreConfirmation.put(StoneColor.WHITE, false);
    }

    public boolean bothConfirmed() {
        return Boolean.TRUE.equals(scoreConfirmation.get(StoneColor.BLACK))
                && Boolean.TRUE.equals(scoreConfirmation.get(StoneColor.WHITE));
    }
}
