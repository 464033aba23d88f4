package com.example.goserver.model.dto;

import com.example.goserver.model.domain.CapturedStones;
import com.example.goserver.model.domain.ClockSnapshot;
import com.example.goserver.model.domain.GameResult;
import com.example.goserver.model.domain.GameStatus;
import com.example.goserver.model.domain.GameType;
import com.example.goserver.model.domain.MoveRecord;
import com.example.goserver.model.domain.Position;
import com.example.goserver.model.domain.Ruleset;
import com.example.goserver.model.domain.Stone;
import com.example.goserver.model.domain.StoneColor;
import com.example.goserver.model.domain.TimeControl;
import com.example.goserver.model.domain.UndoRequest;
import lombok.Data;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Full snapshot sent as the {@code GAME_STATE} event and from the REST API.
 * Clock values are projected to {@code serverTime}; clients only display them.
 */
@Data
public class GameStateDTO {
    private String gameId;
    private String code;
    private GameStatus status;
    private String statusMessage;

    private int boardSize;
    private Ruleset ruleset;
    private GameType gameType;
    private double komi;
    private int handicap;
    private TimeControl timeControl;
    private boolean vsAi;

    private List<Stone> stones;
    private StoneColor currentTurn;
    private Position koPosition;
    private CapturedStones capturedStones;
    private List<MoveRecord> history;

    private List<PlayerView> players;
    private Set<String> spectators;

    private Set<Position> deadStones;
    private Map<StoneColor, Boolean> scoreConfirmation;
    private GameResult result;

    private UndoRequest undoRequest;
    private boolean aiUndoUsed;
    private String playAgainRequestedBy;
    private String successorId;

    private long lastMoveTimestamp;
    private long serverTime;

    @Data
    public static class PlayerView {
        private String id;
        private String username;
        private StoneColor color;
        private boolean ai;
        private ClockSnapshot clock;
    }
}
