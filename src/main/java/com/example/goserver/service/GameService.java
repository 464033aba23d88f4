package com.example.goserver.service;

import com.example.goserver.ai.AiEngine;
import com.example.goserver.ai.AiEngineFactory;
import com.example.goserver.ai.AiPosition;
import com.example.goserver.config.GoServerProperties;
import com.example.goserver.logic.GameEngine;
import com.example.goserver.logic.GameSetup;
import com.example.goserver.logic.SgfExporter;
import com.example.goserver.model.domain.GameConfig;
import com.example.goserver.model.domain.GameSession;
import com.example.goserver.model.domain.Position;
import com.example.goserver.model.domain.StoneColor;
import com.example.goserver.model.dto.CreateGameRequest;
import com.example.goserver.model.dto.GameStateDTO;
import com.example.goserver.model.dto.SeatResponse;
import com.example.goserver.repository.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Entry point for every game command. Looks the session up, takes its lock, and hands the command
 * to {@link GameEngine}; afterwards gives the AI a chance to move.
 */
@Slf4j
@Service
public class GameService {

    static final String AI_ID_PREFIX = "ai_";

    private final SessionRegistry registry;
    private final GameEngine gameEngine;
    private final GameSetup setup;
    private final AiEngineFactory aiEngineFactory;
    private final AiMoveService aiMoveService;
    private final GameTimerService gameTimerService;
    private final GameStateMapper mapper;
    private final SgfExporter sgfExporter;
    private final GoServerProperties properties;
    private final Clock clock;

    public GameService(SessionRegistry registry,
                       GameEngine gameEngine,
                       GameSetup setup,
                       AiEngineFactory aiEngineFactory,
                       AiMoveService aiMoveService,
                       GameTimerService gameTimerService,
                       GameStateMapper mapper,
                       SgfExporter sgfExporter,
                       GoServerProperties properties,
                       Clock clock) {
        this.registry = registry;
        this.gameEngine = gameEngine;
        this.setup = setup;
        this.aiEngineFactory = aiEngineFactory;
        this.aiMoveService = aiMoveService;
        this.gameTimerService = gameTimerService;
        this.mapper = mapper;
        this.sgfExporter = sgfExporter;
        this.properties = properties;
        this.clock = clock;
    }

    // --- Lifecycle ---

    public SeatResponse createGame(CreateGameRequest request) {
        GameConfig config = setup.normalize(request.getConfig());
        String playerId = isBlank(request.getPlayerId()) ? UUID.randomUUID().toString() : request.getPlayerId();
        String username = isBlank(request.getUsername()) ? "Player" : request.getUsername();

        GameSession session = setup.createSession(config);
        AiEngine ai = config.isVsAi() ? aiEngineFactory.acquire(config.getAiLevel()) : null;
        try {
            synchronized (session) {
                StoneColor color = gameEngine.join(session, playerId, username, false);
                if (ai != null) {
                    session.setAiEngine(ai);
                    setup.seat(session, AI_ID_PREFIX + UUID.randomUUID(), config.getAiLevel().displayName(),
                            color.opposite(), true);
                    gameEngine.startGame(session);
                }
                registry.insert(session);
                armEviction(session);
                aiMoveService.scheduleIfAiTurn(session);
                log.info("Game {} created by {} (code {}, {}x{}{})", session.getId(), username, session.getCode(),
                        config.getBoardSize(), config.getBoardSize(), ai != null ? ", vs AI " + config.getAiLevel() : "");
                return new SeatResponse(session.getId(), session.getCode(), playerId, color);
            }
        } catch (RuntimeException e) {
            if (ai != null) {
                ai.close();
            }
            throw e;
        }
    }

    public SeatResponse joinGame(String gameId, String playerId, String username, boolean spectator) {
        GameSession session = requireSession(gameId);
        String id = isBlank(playerId) ? UUID.randomUUID().toString() : playerId;
        String name = isBlank(username) ? "Guest" : username;
        synchronized (session) {
            StoneColor color = gameEngine.join(session, id, name, spectator);
            gameTimerService.cancelEviction(session);
            aiMoveService.scheduleIfAiTurn(session);
            return new SeatResponse(session.getId(), session.getCode(), id, color);
        }
    }

    /**
     * Removes a session and releases everything it holds. Unknown ids are ignored.
     */
    public void evict(String gameId) {
        registry.remove(gameId).ifPresent(session -> {
            synchronized (session) {
                release(session);
            }
            log.info("Game {} evicted", gameId);
        });
    }

    public void scheduleEviction(String gameId, Runnable onExpiry) {
        registry.lookup(gameId).ifPresent(session -> {
            synchronized (session) {
                gameTimerService.scheduleEviction(session, properties.getSession().getEvictionGrace(), onExpiry);
            }
        });
    }

    public void cancelEviction(String gameId) {
        registry.lookup(gameId).ifPresent(session -> {
            synchronized (session) {
                gameTimerService.cancelEviction(session);
            }
        });
    }

    private void armEviction(GameSession session) {
        String gameId = session.getId();
        gameTimerService.scheduleEviction(session, properties.getSession().getEvictionGrace(), () -> evict(gameId));
    }

    private void release(GameSession session) {
        gameTimerService.cancelEviction(session);
        aiMoveService.cancel(session);
        AiEngine ai = session.getAiEngine();
        if (ai != null) {
            ai.close();
            session.setAiEngine(null);
        }
    }

    // --- Play ---

    public void makeMove(String gameId, String playerId, Position position) {
        update(gameId, session -> gameEngine.applyMove(session, playerId, position));
    }

    public void passTurn(String gameId, String playerId) {
        update(gameId, session -> gameEngine.applyPass(session, playerId));
    }

    public void resign(String gameId, String playerId) {
        update(gameId, session -> gameEngine.resign(session, playerId));
    }

    public void requestUndo(String gameId, String playerId, int moveIndex) {
        update(gameId, session -> gameEngine.requestUndo(session, playerId, moveIndex));
    }

    public void respondUndo(String gameId, String playerId, boolean accepted) {
        update(gameId, session -> gameEngine.respondUndo(session, playerId, accepted));
    }

    // --- Scoring ---

    public void toggleDeadStone(String gameId, String playerId, Position position) {
        update(gameId, session -> gameEngine.toggleDeadStone(session, playerId, position));
    }

    public void confirmScore(String gameId, String playerId, boolean confirmed) {
        update(gameId, session -> gameEngine.confirmScore(session, playerId, confirmed));
    }

    public void cancelScoring(String gameId, String playerId) {
        update(gameId, session -> gameEngine.cancelScoring(session, playerId));
    }

    /**
     * Engine's own estimate of the result, for display next to the authoritative score.
     *
     * @return the engine's {@code final_score} answer, or null when the game has no AI
     */
    public String aiScoreEstimate(String gameId) {
        GameSession session = requireSession(gameId);
        AiEngine ai;
        AiPosition position;
        synchronized (session) {
            ai = session.getAiEngine();
            if (ai == null) {
                return null;
            }
            position = AiMoveService.snapshot(session);
        }
        return ai.finalScore(position);
    }

    // --- Play again ---

    /**
     * @return the id of the new game once both sides agreed, otherwise null
     */
    public String requestPlayAgain(String gameId, String playerId) {
        GameSession session = requireSession(gameId);
        synchronized (session) {
            if (!gameEngine.requestPlayAgain(session, playerId)) {
                return null;
            }
            return startSuccessor(session).getId();
        }
    }

    /**
     * @return the id of the new game when accepted, otherwise null
     */
    public String respondPlayAgain(String gameId, String playerId, boolean accepted) {
        GameSession session = requireSession(gameId);
        synchronized (session) {
            if (!gameEngine.respondPlayAgain(session, playerId, accepted)) {
                return null;
            }
            return startSuccessor(session).getId();
        }
    }

    private GameSession startSuccessor(GameSession previous) {
        AiEngine ai = previous.isVsAi() ? aiEngineFactory.acquire(previous.getConfig().getAiLevel()) : null;
        GameSession next;
        try {
            next = gameEngine.createSuccessor(previous);
            next.setAiEngine(ai);
            registry.insert(next);
        } catch (RuntimeException e) {
            if (ai != null) {
                ai.close();
            }
            throw e;
        }
        registry.remove(previous.getId());
        release(previous);
        log.info("Game {} replaced by {}", previous.getId(), next.getId());
        synchronized (next) {
            armEviction(next);
            aiMoveService.scheduleIfAiTurn(next);
        }
        return next;
    }

    // --- Clock ---

    /**
     * Client heartbeat: brings the clock of the player on move up to date.
     */
    public void heartbeat(String gameId) {
        update(gameId, gameEngine::tick);
    }

    public void tickAll() {
        for (GameSession session : registry.snapshot()) {
            synchronized (session) {
                try {
                    gameEngine.tick(session);
                } catch (RuntimeException e) {
                    log.error("Clock tick failed for game {}", session.getId(), e);
                }
            }
        }
    }

    // --- Queries ---

    public GameStateDTO getGame(String gameId) {
        return query(gameId, mapper::toDTO);
    }

    public GameStateDTO findByCode(String code) {
        GameSession session = registry.lookupByCode(code).orElseThrow(() -> new GameNotFoundException(code));
        synchronized (session) {
            return mapper.toDTO(session);
        }
    }

    /** Re-broadcasts the full state, e.g. after a client reconnects. */
    public void sync(String gameId) {
        GameSession session = requireSession(gameId);
        synchronized (session) {
            gameEngine.publishState(session);
        }
    }

    public String exportSgf(String gameId) {
        return query(gameId, session -> sgfExporter.export(session, LocalDate.now(clock)));
    }

    public boolean isParticipant(String gameId, String playerId) {
        return query(gameId, session -> session.findPlayer(playerId).isPresent()
                || session.getSpectators().contains(playerId));
    }

    // --- Helpers ---

    private GameSession requireSession(String gameId) {
        return registry.lookup(gameId).orElseThrow(() -> new GameNotFoundException(gameId));
    }

    private void update(String gameId, Consumer<GameSession> command) {
        GameSession session = requireSession(gameId);
        synchronized (session) {
            command.accept(session);
            aiMoveService.scheduleIfAiTurn(session);
        }
    }

    private <T> T query(String gameId, Function<GameSession, T> reader) {
        GameSession session = requireSession(gameId);
        synchronized (session) {
            return reader.apply(session);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
