package com.example.goserver.logic;

import com.example.goserver.model.domain.Board;
import com.example.goserver.model.domain.ColorPreference;
import com.example.goserver.model.domain.GameConfig;
import com.example.goserver.model.domain.GameSession;
import com.example.goserver.model.domain.GameStatus;
import com.example.goserver.model.domain.GameType;
import com.example.goserver.model.domain.Player;
import com.example.goserver.model.domain.Position;
import com.example.goserver.model.domain.StoneColor;
import com.example.goserver.model.domain.TimeControl;
import com.example.goserver.model.domain.TimeControlMode;

import java.time.Clock;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Validates game settings, fills in presets, and builds fresh sessions.
 */
public class GameSetup {

    public static final Set<Integer> BOARD_SIZES = Set.of(9, 13, 15, 19, 21);
    public static final int MAX_AI_BOARD_SIZE = 19;

    static final int DEFAULT_BYO_YOMI_PERIODS = 5;
    static final int DEFAULT_BYO_YOMI_SECONDS = 30;
    static final int DEFAULT_BLITZ_SECONDS = 10;
    static final int MIN_BLITZ_SECONDS = 5;

    private static final String CODE_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int CODE_LENGTH = 6;

    private final TimeControlStateMachine timeControl;
    private final Clock clock;

    public GameSetup(TimeControlStateMachine timeControl, Clock clock) {
        this.timeControl = timeControl;
        this.clock = clock;
    }

    /**
     * Returns a validated copy of {@code raw} with komi and time control resolved.
     */
    public GameConfig normalize(GameConfig raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Game settings are required");
        }
        GameConfig config = raw.copy();
        if (!BOARD_SIZES.contains(config.getBoardSize())) {
            throw new IllegalArgumentException("Unsupported board size " + config.getBoardSize());
        }
        if (config.isVsAi() && config.getBoardSize() > MAX_AI_BOARD_SIZE) {
            throw new IllegalArgumentException("AI games support boards up to " + MAX_AI_BOARD_SIZE + "x" + MAX_AI_BOARD_SIZE);
        }
        int handicap = config.getHandicap();
        if (handicap != 0 && (handicap < HandicapPlacement.MIN_HANDICAP || handicap > HandicapPlacement.MAX_HANDICAP)) {
            throw new IllegalArgumentException("Handicap must be 0 or between 2 and 9");
        }
        if (config.getRuleset() == null) {
            throw new IllegalArgumentException("Ruleset is required");
        }
        if (config.getGameType() == null) {
            config.setGameType(GameType.EVEN);
        }
        if (config.getColorPreference() == null) {
            config.setColorPreference(ColorPreference.BLACK);
        }
        if (handicap > 0) {
            config.setKomi(0.5);
        } else if (config.getKomi() == null) {
            config.setKomi(config.getRuleset().defaultKomi());
        }
        config.setTimeControl(resolveTimeControl(config));
        return config;
    }

    private TimeControl resolveTimeControl(GameConfig config) {
        TimeControl tc = config.getTimeControl();
        boolean blitzGame = config.getGameType() == GameType.BLITZ
                || (tc != null && tc.getMode() == TimeControlMode.BLITZ);
        if (blitzGame) {
            TimeControl blitz = TimeControl.blitz(tc == null || tc.getTimePerMoveSeconds() == 0
                    ? DEFAULT_BLITZ_SECONDS : tc.getTimePerMoveSeconds());
            if (tc != null && (tc.getMainTimeSeconds() > 0 || tc.getByoYomiPeriods() > 0)) {
                throw new IllegalArgumentException("Blitz games use a per-move timer only");
            }
            if (blitz.getTimePerMoveSeconds() < MIN_BLITZ_SECONDS) {
                throw new IllegalArgumentException("Blitz needs at least " + MIN_BLITZ_SECONDS + " seconds per move");
            }
            return blitz;
        }
        if (tc == null) {
            int mainMinutes = recommendedMainTimeMinutes(config.getBoardSize());
            if (config.getGameType() == GameType.TEACHING) {
                mainMinutes *= 2;
            }
            return TimeControl.standard(mainMinutes * 60, DEFAULT_BYO_YOMI_PERIODS, DEFAULT_BYO_YOMI_SECONDS);
        }
        if (tc.getMainTimeSeconds() < 0 || tc.getByoYomiPeriods() < 0 || tc.getByoYomiSeconds() < 0
                || tc.getFischerIncrementSeconds() < 0) {
            throw new IllegalArgumentException("Time settings cannot be negative");
        }
        if (tc.getByoYomiPeriods() > 0 && tc.getByoYomiSeconds() == 0) {
            throw new IllegalArgumentException("Byo-yomi periods need a period length");
        }
        TimeControl standard = tc.copy();
        standard.setMode(TimeControlMode.STANDARD);
        standard.setTimePerMoveSeconds(0);
        return standard;
    }

    public static int recommendedMainTimeMinutes(int boardSize) {
        switch (boardSize) {
            case 9:
                return 10;
            case 13:
                return 20;
            case 15:
                return 30;
            case 19:
                return 45;
            case 21:
                return 60;
            default:
                return 30;
        }
    }

    /**
     * Builds a waiting session with handicap stones placed. {@code config} must be normalized.
     */
    public GameSession createSession(GameConfig config) {
        GameSession session = new GameSession();
        session.setId(UUID.randomUUID().toString());
        session.setCode(newCode());
        session.setConfig(config);
        session.setKomi(config.getKomi());
        session.setCreatedAt(clock.millis());

        Board board = new Board(config.getBoardSize());
        for (Position p : HandicapPlacement.positions(config.getBoardSize(), config.getHandicap())) {
            board.set(p, StoneColor.BLACK);
            session.getHandicapStones().add(p);
        }
        session.setBoard(board);
        session.setCurrentTurn(firstToMove(config));
        session.setStatus(GameStatus.WAITING);
        session.resetScoreConfirmation();
        return session;
    }

    public static StoneColor firstToMove(GameConfig config) {
        return config.getHandicap() > 0 ? StoneColor.WHITE : StoneColor.BLACK;
    }

    public StoneColor hostColor(GameConfig config) {
        switch (config.getColorPreference()) {
            case WHITE:
                return StoneColor.WHITE;
            case RANDOM:
                return ThreadLocalRandom.current().nextBoolean() ? StoneColor.BLACK : StoneColor.WHITE;
            case BLACK:
            default:
                return StoneColor.BLACK;
        }
    }

    public Player seat(GameSession session, String playerId, String username, StoneColor color, boolean ai) {
        if (session.isFull()) {
            throw new IllegalStateException("Game already has two players");
        }
        if (session.playerOf(color) != null) {
            throw new IllegalStateException(color + " is already taken");
        }
        Player player = new Player(playerId, username, color, ai);
        player.setClock(timeControl.initialClock(session.getConfig().getTimeControl()));
        session.getPlayers().add(player);
        return player;
    }

    /**
     * Same settings, same seats, fresh board and clocks.
     */
    public GameSession createSuccessor(GameSession previous) {
        GameSession next = createSession(previous.getConfig().copy());
        for (Player p : previous.getPlayers()) {
            seat(next, p.getId(), p.getUsername(), p.getColor(), p.isAi());
        }
        next.getSpectators().addAll(previous.getSpectators());
        return next;
    }

    private String newCode() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(CODE_LENGTH);
        for (int i = 0; i < CODE_LENGTH; i++) {
            sb.append(CODE_ALPHABET.charAt(random.nextInt(CODE_ALPHABET.length())));
        }
        return sb.toString();
    }
}
