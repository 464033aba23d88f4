package com.example.goserver.service;

import com.example.goserver.ai.AiCancelledException;
import com.example.goserver.ai.AiEngine;
import com.example.goserver.ai.AiPosition;
import com.example.goserver.ai.AiUnresponsiveException;
import com.example.goserver.ai.GeneratedMove;
import com.example.goserver.config.GoServerProperties;
import com.example.goserver.logic.GameEngine;
import com.example.goserver.logic.RuleViolationException;
import com.example.goserver.model.domain.GameSession;
import com.example.goserver.model.domain.GameStatus;
import com.example.goserver.model.domain.MoveRecord;
import com.example.goserver.model.domain.Player;
import com.example.goserver.model.domain.StoneColor;
import com.example.goserver.repository.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drives the AI side of a game. The engine is queried without holding the session lock; the
 * answer is applied only if the session is still registered and nothing changed in the meantime.
 */
@Slf4j
@Service
public class AiMoveService {

    private final SessionRegistry registry;
    private final GameEngine gameEngine;
    private final ScheduledExecutorService aiExecutor;
    private final GoServerProperties properties;

    public AiMoveService(SessionRegistry registry,
                         GameEngine gameEngine,
                         @Qualifier("aiExecutor") ScheduledExecutorService aiExecutor,
                         GoServerProperties properties) {
        this.registry = registry;
        this.gameEngine = gameEngine;
        this.aiExecutor = aiExecutor;
        this.properties = properties;
    }

    /**
     * Queues an AI move when the AI is on turn and none is queued yet. Call with the session lock held.
     */
    public void scheduleIfAiTurn(GameSession session) {
        if (!aiOnTurn(session)) {
            return;
        }
        Future<?> pending = session.getPendingAiMove();
        if (pending != null && !pending.isDone()) {
            return;
        }
        String gameId = session.getId();
        long revision = session.getRevision();
        long delayMs = properties.getAi().getMoveDelay().toMillis();
        Future<?> future = aiExecutor.schedule(() -> play(gameId, revision), delayMs, TimeUnit.MILLISECONDS);
        if (session.getPendingAiMove() == null || session.getPendingAiMove().isDone()) {
            session.setPendingAiMove(future);
        }
    }

    /**
     * Stops a queued or running AI move. Call with the session lock held.
     */
    public void cancel(GameSession session) {
        Future<?> pending = session.getPendingAiMove();
        if (pending != null) {
            pending.cancel(true);
        }
        session.setPendingAiMove(null);
    }

    void play(String gameId, long revision) {
        GameSession session = registry.lookup(gameId).orElse(null);
        if (session == null) {
            return;
        }
        AiEngine ai;
        StoneColor color;
        AiPosition position;
        synchronized (session) {
            if (!isCurrent(session, revision)) {
                session.setPendingAiMove(null);
                scheduleIfAiTurn(session);
                return;
            }
            ai = session.getAiEngine();
            color = session.getCurrentTurn();
            position = snapshot(session);
        }

        GeneratedMove move;
        try {
            move = ai.generateMove(position, color);
        } catch (AiCancelledException e) {
            log.debug("Game {}: AI move cancelled", gameId);
            return;
        } catch (AiUnresponsiveException e) {
            synchronized (session) {
                session.setPendingAiMove(null);
                if (isCurrent(session, revision)) {
                    log.warn("Game {}: AI stopped responding, moving to scoring", gameId, e);
                    gameEngine.forceScoring(session);
                }
            }
            return;
        }

        synchronized (session) {
            session.setPendingAiMove(null);
            if (!isCurrent(session, revision)) {
                log.debug("Game {}: discarding AI answer for revision {}", gameId, revision);
                scheduleIfAiTurn(session);
                return;
            }
            apply(session, move);
            scheduleIfAiTurn(session);
        }
    }

    private void apply(GameSession session, GeneratedMove move) {
        String aiId = session.currentPlayer().getId();
        switch (move.type()) {
            case RESIGN:
                log.info("Game {}: AI resigned", session.getId());
                gameEngine.resign(session, aiId);
                break;
            case PASS:
                gameEngine.applyPass(session, aiId, move.thinkingTimeMs());
                break;
            case PLACE:
            default:
                try {
                    gameEngine.applyMove(session, aiId, move.position(), move.thinkingTimeMs());
                } catch (RuleViolationException e) {
                    log.warn("Game {}: AI move {} rejected ({}), passing instead", session.getId(),
                            move.position(), e.getReason());
                    gameEngine.applyPass(session, aiId, move.thinkingTimeMs());
                }
                break;
        }
    }

    private boolean isCurrent(GameSession session, long revision) {
        return registry.lookup(session.getId()).orElse(null) == session
                && session.getRevision() == revision
                && aiOnTurn(session);
    }

    private static boolean aiOnTurn(GameSession session) {
        if (session.getStatus() != GameStatus.PLAYING || session.getAiEngine() == null) {
            return false;
        }
        Player onMove = session.currentPlayer();
        return onMove != null && onMove.isAi();
    }

    static AiPosition snapshot(GameSession session) {
        List<AiPosition.Move> moves = new ArrayList<>();
        for (MoveRecord record : session.getHistory()) {
            moves.add(new AiPosition.Move(record.getColor(), record.isPass() ? null : record.getPosition()));
        }
        return new AiPosition(session.getConfig().getBoardSize(), session.getKomi(),
                session.getHandicapStones(), moves);
    }
}
