package com.example.goserver.logic;

import com.example.goserver.model.domain.Board;
import com.example.goserver.model.domain.CapturedStones;
import com.example.goserver.model.domain.ClockSnapshot;
import com.example.goserver.model.domain.GameResult;
import com.example.goserver.model.domain.GameSession;
import com.example.goserver.model.domain.GameStatus;
import com.example.goserver.model.domain.MoveRecord;
import com.example.goserver.model.domain.Player;
import com.example.goserver.model.domain.Position;
import com.example.goserver.model.domain.ScoreResult;
import com.example.goserver.model.domain.StoneColor;
import com.example.goserver.model.domain.TimeControl;
import com.example.goserver.model.domain.UndoRequest;
import com.example.goserver.model.dto.GameEventType;
import com.example.goserver.model.dto.GameEvents;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Session state machine: waiting -> playing -> scoring -> finished, with scoring -> playing as the
 * cancel edge. Holds no state of its own; callers serialize access per session
 * ({@code synchronized (session)}).
 *
 * <p>Rejected commands throw {@link IllegalStateException} (or {@link RuleViolationException})
 * before anything in the session changes.
 */
@Slf4j
public class GameEngine {

    private final BoardEngine boardEngine;
    private final ScoringEngine scoringEngine;
    private final TimeControlStateMachine timeControl;
    private final GameSetup setup;
    private final GameEventPublisher publisher;
    private final Clock clock;

    public GameEngine(BoardEngine boardEngine,
                      ScoringEngine scoringEngine,
                      TimeControlStateMachine timeControl,
                      GameSetup setup,
                      GameEventPublisher publisher,
                      Clock clock) {
        this.boardEngine = boardEngine;
        this.scoringEngine = scoringEngine;
        this.timeControl = timeControl;
        this.setup = setup;
        this.publisher = publisher;
        this.clock = clock;
    }

    // ---- seating ----

    /**
     * Seats a player, or adds a spectator once both seats are taken.
     *
     * @return the seat color, or null for a spectator
     */
    public StoneColor join(GameSession session, String playerId, String username, boolean asSpectator) {
        Player existing = session.findPlayer(playerId).orElse(null);
        if (existing != null) {
            publisher.publishState(session);
            return existing.getColor();
        }
        if (!asSpectator && !session.isFull() && session.getStatus() == GameStatus.WAITING) {
            StoneColor color = session.getPlayers().isEmpty()
                    ? setup.hostColor(session.getConfig())
                    : session.getPlayers().get(0).getColor().opposite();
            setup.seat(session, playerId, username, color, false);
            publisher.publish(session, GameEventType.PLAYER_JOINED,
                    new GameEvents.PlayerJoined(playerId, username, color, false));
            if (session.isFull()) {
                startGame(session);
            } else {
                publisher.publishState(session);
            }
            return color;
        }
        session.getSpectators().add(playerId);
        publisher.publish(session, GameEventType.PLAYER_JOINED,
                new GameEvents.PlayerJoined(playerId, username, null, true));
        publisher.publishState(session);
        return null;
    }

    public void startGame(GameSession session) {
        if (session.getStatus() != GameStatus.WAITING) {
            return;
        }
        if (!session.isFull()) {
            throw new IllegalStateException("Two players are needed to start");
        }
        session.setStatus(GameStatus.PLAYING);
        session.setLastMoveTimestamp(clock.millis());
        session.bumpRevision();
        log.info("Game {} started ({}x{}, {}, handicap {})", session.getId(), session.getConfig().getBoardSize(),
                session.getConfig().getBoardSize(), session.getConfig().getRuleset(), session.getConfig().getHandicap());
        publisher.publishState(session);
    }

    /** Re-sends the full snapshot, e.g. to a client that just reconnected. */
    public void publishState(GameSession session) {
        publisher.publishState(session);
    }

    // ---- moves ----

    public void applyMove(GameSession session, String playerId, Position position) {
        applyMove(session, playerId, position, elapsedSinceLastMove(session));
    }

    /**
     * Places a stone for {@code playerId}, charging {@code reportedMs} to their clock. If the charge
     * times the player out, the game ends and the stone is not placed.
     *
     * <p>The charge never exceeds the time since the clock baseline: a tick that committed a period
     * boundary in the meantime has already charged the earlier part.
     */
    public void applyMove(GameSession session, String playerId, Position position, long reportedMs) {
        long elapsedMs = uncommitted(session, reportedMs);
        Player mover = requireTurn(session, playerId);
        if (position == null) {
            throw new IllegalArgumentException("Position is required");
        }
        Board next = session.getBoard().copy();
        PlacementResult placement = boardEngine.place(next, position, mover.getColor(), session.getKoPosition());

        if (!chargeClock(session, mover, elapsedMs)) {
            return;
        }

        long now = clock.millis();
        session.setBoard(next);
        session.getCapturedStones().add(mover.getColor(), placement.capturedCount());
        session.setKoPosition(placement.koPosition());
        session.setConsecutivePasses(0);
        session.getHistory().add(MoveRecord.placement(position, mover.getColor(), playerId, now, elapsedMs,
                placement.capturedCount(), mover.getClock().snapshot()));
        completeTurn(session, now);

        publisher.publish(session, GameEventType.MOVE_MADE, new GameEvents.MoveMade(
                session.getHistory().size() - 1, mover.getColor(), position, false, placement.captured(),
                session.getKoPosition(), session.getCapturedStones().copy(), session.getCurrentTurn()));
        publishTimeUpdate(session);
        publisher.publishState(session);
    }

    public void applyPass(GameSession session, String playerId) {
        applyPass(session, playerId, elapsedSinceLastMove(session));
    }

    public void applyPass(GameSession session, String playerId, long reportedMs) {
        long elapsedMs = uncommitted(session, reportedMs);
        Player mover = requireTurn(session, playerId);
        if (!chargeClock(session, mover, elapsedMs)) {
            return;
        }

        long now = clock.millis();
        session.setKoPosition(null);
        session.setConsecutivePasses(session.getConsecutivePasses() + 1);
        session.getHistory().add(MoveRecord.pass(mover.getColor(), playerId, now, elapsedMs, mover.getClock().snapshot()));
        completeTurn(session, now);

        publisher.publish(session, GameEventType.MOVE_MADE, new GameEvents.MoveMade(
                session.getHistory().size() - 1, mover.getColor(), null, true, List.of(),
                null, session.getCapturedStones().copy(), session.getCurrentTurn()));

        if (session.getConsecutivePasses() >= 2) {
            enterScoring(session);
        } else {
            publishTimeUpdate(session);
            publisher.publishState(session);
        }
    }

    private void completeTurn(GameSession session, long now) {
        session.setCurrentTurn(session.getCurrentTurn().opposite());
        session.setLastMoveTimestamp(now);
        session.setUndoRequest(null);
        session.bumpRevision();
    }

    /** @return false when the charge timed the mover out and the game is over */
    private boolean chargeClock(GameSession session, Player mover, long elapsedMs) {
        TimeControl tc = session.getConfig().getTimeControl();
        ClockTransition transition = timeControl.chargeElapsed(mover.getClock(), tc, elapsedMs);
        if (transition == ClockTransition.TIMEOUT) {
            finishByTimeout(session, mover.getColor());
            return false;
        }
        timeControl.applyIncrement(mover.getClock(), tc);
        if (transition.isByoYomiEvent()) {
            publishByoYomiReset(session, mover);
        }
        return true;
    }

    // ---- clock ----

    /**
     * Advances the live clock of the player on move. Called by the background ticker and on
     * client heartbeats.
     */
    public void tick(GameSession session) {
        if (session.getStatus() != GameStatus.PLAYING) {
            return;
        }
        Player onMove = session.currentPlayer();
        if (onMove == null) {
            return;
        }
        long now = clock.millis();
        TickResult result = timeControl.tick(onMove.getClock(), session.getConfig().getTimeControl(),
                now - session.getLastMoveTimestamp());
        if (result.timedOut()) {
            finishByTimeout(session, onMove.getColor());
            return;
        }
        if (result.committed()) {
            log.debug("Game {}: {} clock crossed a period boundary ({})", session.getId(), onMove.getColor(),
                    result.transition());
            session.setLastMoveTimestamp(now);
            publishByoYomiReset(session, onMove);
        }
        publishTimeUpdate(session);
    }

    public ClockSnapshot projectClock(GameSession session, Player player) {
        if (session.getStatus() == GameStatus.PLAYING && player.getColor() == session.getCurrentTurn()) {
            return timeControl.project(player.getClock(), session.getConfig().getTimeControl(),
                    elapsedSinceLastMove(session));
        }
        return player.getClock().snapshot();
    }

    private void publishTimeUpdate(GameSession session) {
        Player black = session.playerOf(StoneColor.BLACK);
        Player white = session.playerOf(StoneColor.WHITE);
        publisher.publish(session, GameEventType.TIME_UPDATE, new GameEvents.TimeUpdate(session.getCurrentTurn(),
                black == null ? null : projectClock(session, black),
                white == null ? null : projectClock(session, white)));
    }

    private void publishByoYomiReset(GameSession session, Player player) {
        publisher.publish(session, GameEventType.BYO_YOMI_RESET, new GameEvents.ByoYomiReset(player.getColor(),
                player.getClock().getByoYomiPeriodsLeft(), player.getClock().getByoYomiTimeLeftMs()));
    }

    private long elapsedSinceLastMove(GameSession session) {
        return Math.max(0, clock.millis() - session.getLastMoveTimestamp());
    }

    private long uncommitted(GameSession session, long elapsedMs) {
        return Math.min(Math.max(0, elapsedMs), elapsedSinceLastMove(session));
    }

    // ---- scoring ----

    private void enterScoring(GameSession session) {
        session.setStatus(GameStatus.SCORING);
        session.setDeadStones(new LinkedHashSet<>());
        session.resetScoreConfirmation();
        session.bumpRevision();
        log.info("Game {} entered scoring", session.getId());
        publisher.publish(session, GameEventType.SCORING_PHASE_STARTED,
                new GameEvents.DeadStonesUpdated(Set.of(), currentScore(session)));
        publisher.publishState(session);
    }

    /**
     * Moves a playing game straight to scoring, used when the AI opponent stops responding.
     */
    public void forceScoring(GameSession session) {
        if (session.getStatus() != GameStatus.PLAYING) {
            return;
        }
        log.warn("Game {} forced into scoring", session.getId());
        enterScoring(session);
    }

    public void toggleDeadStone(GameSession session, String playerId, Position position) {
        requireStatus(session, GameStatus.SCORING, "Dead stones can only be marked during scoring");
        session.requirePlayer(playerId);
        Set<Position> updated = scoringEngine.toggleDeadStone(session.getBoard(), session.getDeadStones(), position);
        session.setDeadStones(new LinkedHashSet<>(updated));
        // A confirmation only covers the marking it was given for
        session.resetScoreConfirmation();
        publisher.publish(session, GameEventType.DEAD_STONES_UPDATED,
                new GameEvents.DeadStonesUpdated(Set.copyOf(updated), currentScore(session)));
        publisher.publishState(session);
    }

    public void confirmScore(GameSession session, String playerId, boolean confirmed) {
        requireStatus(session, GameStatus.SCORING, "Score can only be confirmed during scoring");
        Player player = session.requirePlayer(playerId);
        session.getScoreConfirmation().put(player.getColor(), confirmed);
        Player opponent = session.playerOf(player.getColor().opposite());
        if (confirmed && opponent != null && opponent.isAi()) {
            session.getScoreConfirmation().put(opponent.getColor(), true);
        }
        publisher.publish(session, GameEventType.SCORE_CONFIRMATION_UPDATE, new GameEvents.ScoreConfirmation(
                Boolean.TRUE.equals(session.getScoreConfirmation().get(StoneColor.BLACK)),
                Boolean.TRUE.equals(session.getScoreConfirmation().get(StoneColor.WHITE))));
        if (session.bothConfirmed()) {
            finish(session, GameResult.scored(currentScore(session)));
        } else {
            publisher.publishState(session);
        }
    }

    public void cancelScoring(GameSession session, String playerId) {
        requireStatus(session, GameStatus.SCORING, "Game is not in scoring");
        session.requirePlayer(playerId);
        session.setStatus(GameStatus.PLAYING);
        session.setDeadStones(new LinkedHashSet<>());
        session.resetScoreConfirmation();
        session.setConsecutivePasses(0);
        session.setLastMoveTimestamp(clock.millis());
        session.bumpRevision();
        log.info("Game {} resumed play from scoring", session.getId());
        publisher.publish(session, GameEventType.SCORING_CANCELED, null);
        publisher.publishState(session);
    }

    public ScoreResult currentScore(GameSession session) {
        return scoringEngine.score(session.getBoard(), session.getDeadStones(), session.getCapturedStones(),
                session.getConfig().getRuleset(), session.getKomi());
    }

    // ---- undo ----

    public void requestUndo(GameSession session, String playerId, int moveIndex) {
        requireStatus(session, GameStatus.PLAYING, "Undo is only possible during play");
        session.requirePlayer(playerId);
        validateUndoIndex(session, moveIndex);

        if (session.isVsAi()) {
            if (session.isAiUndoUsed()) {
                throw new IllegalStateException("Undo has already been used in this game");
            }
            replayTo(session, moveIndex);
            session.setAiUndoUsed(true);
            publisher.publish(session, GameEventType.UNDO_RESOLVED, new GameEvents.UndoResolved(true, moveIndex));
            publisher.publishState(session);
            return;
        }
        if (session.getUndoRequest() != null) {
            throw new IllegalStateException("An undo request is already pending");
        }
        session.setUndoRequest(new UndoRequest(playerId, moveIndex));
        publisher.publish(session, GameEventType.UNDO_REQUESTED, new GameEvents.UndoRequested(playerId, moveIndex));
        publisher.publishState(session);
    }

    public void respondUndo(GameSession session, String playerId, boolean accepted) {
        UndoRequest request = session.getUndoRequest();
        if (request == null) {
            throw new IllegalStateException("No undo request is pending");
        }
        session.requirePlayer(playerId);
        if (request.getRequestedBy().equals(playerId)) {
            throw new IllegalStateException("The opponent has to answer an undo request");
        }
        session.setUndoRequest(null);
        if (accepted) {
            validateUndoIndex(session, request.getMoveIndex());
            replayTo(session, request.getMoveIndex());
        }
        publisher.publish(session, GameEventType.UNDO_RESOLVED,
                new GameEvents.UndoResolved(accepted, request.getMoveIndex()));
        publisher.publishState(session);
    }

    private void validateUndoIndex(GameSession session, int moveIndex) {
        if (moveIndex < 0 || moveIndex >= session.getHistory().size()) {
            throw new IllegalArgumentException("Cannot undo to move " + moveIndex + " of " + session.getHistory().size());
        }
    }

    /**
     * Rebuilds board, captures and ko from the handicap setup by replaying the first
     * {@code moveIndex} history entries. Entries that no longer apply are dropped with a warning.
     */
    public void replayTo(GameSession session, int moveIndex) {
        Board board = new Board(session.getConfig().getBoardSize());
        for (Position p : session.getHandicapStones()) {
            board.set(p, StoneColor.BLACK);
        }
        CapturedStones captured = new CapturedStones();
        Position ko = null;
        List<MoveRecord> kept = new ArrayList<>();

        List<MoveRecord> replay = session.getHistory().subList(0, moveIndex);
        for (int i = 0; i < replay.size(); i++) {
            MoveRecord record = replay.get(i);
            if (record.getColor() == null) {
                log.warn("Game {}: skipping history entry {} without a color", session.getId(), i);
                continue;
            }
            if (record.isPass()) {
                ko = null;
                kept.add(record);
                continue;
            }
            if (record.getPosition() == null) {
                log.warn("Game {}: skipping placement {} without a position", session.getId(), i);
                continue;
            }
            try {
                PlacementResult placed = boardEngine.place(board, record.getPosition(), record.getColor(), ko);
                captured.add(record.getColor(), placed.capturedCount());
                ko = placed.koPosition();
                kept.add(record);
            } catch (RuleViolationException e) {
                log.warn("Game {}: skipping history entry {} ({})", session.getId(), i, e.getMessage());
            }
        }

        int trailingPasses = 0;
        for (int i = kept.size() - 1; i >= 0 && kept.get(i).isPass(); i--) {
            trailingPasses++;
        }

        session.setBoard(board);
        session.setCapturedStones(captured);
        session.setKoPosition(ko);
        session.setHistory(kept);
        session.setConsecutivePasses(trailingPasses >= 2 ? 0 : trailingPasses);
        session.setCurrentTurn(kept.isEmpty()
                ? GameSetup.firstToMove(session.getConfig())
                : kept.get(kept.size() - 1).getColor().opposite());
        session.setLastMoveTimestamp(clock.millis());
        session.bumpRevision();
        log.info("Game {} rolled back to move {}", session.getId(), kept.size());
    }

    // ---- endings ----

    public void resign(GameSession session, String playerId) {
        if (session.getStatus() != GameStatus.PLAYING && session.getStatus() != GameStatus.SCORING) {
            throw new IllegalStateException("Game is not in progress");
        }
        Player player = session.requirePlayer(playerId);
        log.info("Game {}: {} resigned", session.getId(), player.getColor());
        finish(session, GameResult.resignation(player.getColor().opposite()));
    }

    public void finishByTimeout(GameSession session, StoneColor loser) {
        GameResult result = GameResult.timeout(loser.opposite());
        publisher.publish(session, GameEventType.PLAYER_TIMEOUT, new GameEvents.PlayerTimeout(loser,
                result.getWinner(), result.getCode(), capitalize(loser) + " ran out of time"));
        finish(session, result);
    }

    private void finish(GameSession session, GameResult result) {
        session.setStatus(GameStatus.FINISHED);
        session.setResult(result);
        session.setUndoRequest(null);
        session.bumpRevision();
        log.info("Game {} finished: {}", session.getId(), result.getCode());
        publisher.publish(session, GameEventType.GAME_FINISHED, new GameEvents.GameFinished(result.getCode(),
                result.getWinner(), result.getReason(), result.getScore()));
        publisher.publishState(session);
    }

    // ---- play again ----

    /**
     * @return true when the new game should be created now
     */
    public boolean requestPlayAgain(GameSession session, String playerId) {
        requireStatus(session, GameStatus.FINISHED, "Game has not finished");
        session.requirePlayer(playerId);
        if (session.isVsAi()) {
            return true;
        }
        String pending = session.getPlayAgainRequestedBy();
        if (pending != null && !pending.equals(playerId)) {
            return true;
        }
        session.setPlayAgainRequestedBy(playerId);
        publisher.publish(session, GameEventType.PLAY_AGAIN_REQUESTED, new GameEvents.PlayAgain(playerId));
        publisher.publishState(session);
        return false;
    }

    /**
     * @return true when the request was accepted and the new game should be created now
     */
    public boolean respondPlayAgain(GameSession session, String playerId, boolean accepted) {
        requireStatus(session, GameStatus.FINISHED, "Game has not finished");
        session.requirePlayer(playerId);
        String pending = session.getPlayAgainRequestedBy();
        if (pending == null) {
            throw new IllegalStateException("No play-again request is pending");
        }
        if (pending.equals(playerId)) {
            throw new IllegalStateException("The opponent has to answer a play-again request");
        }
        if (!accepted) {
            session.setPlayAgainRequestedBy(null);
            publisher.publish(session, GameEventType.PLAY_AGAIN_DECLINED, new GameEvents.PlayAgain(pending));
            publisher.publishState(session);
            return false;
        }
        return true;
    }

    /**
     * Builds and starts the follow-up game; the caller registers it and retires {@code previous}.
     */
    public GameSession createSuccessor(GameSession previous) {
        GameSession next = setup.createSuccessor(previous);
        previous.setSuccessorId(next.getId());
        previous.setPlayAgainRequestedBy(null);
        startGame(next);
        publisher.publish(previous, GameEventType.NEW_GAME,
                new GameEvents.NewGame(previous.getId(), next.getId(), next.getCode()));
        return next;
    }

    // ---- guards ----

    private Player requireTurn(GameSession session, String playerId) {
        requireStatus(session, GameStatus.PLAYING, "Game is not in progress");
        Player player = session.requirePlayer(playerId);
        if (player.getColor() != session.getCurrentTurn()) {
            throw new IllegalStateException("Not your turn");
        }
        return player;
    }

    private void requireStatus(GameSession session, GameStatus expected, String message) {
        if (session.getStatus() != expected) {
            throw new IllegalStateException(message);
        }
    }

    private static String capitalize(StoneColor color) {
        String name = color.name().toLowerCase();
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
