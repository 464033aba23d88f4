package com.example.goserver.service;

import com.example.goserver.logic.TimeControlStateMachine;
import com.example.goserver.model.domain.ClockSnapshot;
import com.example.goserver.model.domain.GameResult;
import com.example.goserver.model.domain.GameSession;
import com.example.goserver.model.domain.GameStatus;
import com.example.goserver.model.domain.Player;
import com.example.goserver.model.domain.StoneColor;
import com.example.goserver.model.dto.GameStateDTO;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Turns a session into its wire snapshot. Must be called with the session lock held.
 */
@Component
public class GameStateMapper {

    private final TimeControlStateMachine timeControl;
    private final Clock clock;

    public GameStateMapper(TimeControlStateMachine timeControl, Clock clock) {
        this.timeControl = timeControl;
        this.clock = clock;
    }

    public GameStateDTO toDTO(GameSession session) {
        long now = clock.millis();
        GameStateDTO dto = new GameStateDTO();
        dto.setGameId(session.getId());
        dto.setCode(session.getCode());
        dto.setStatus(session.getStatus());
        dto.setStatusMessage(statusMessage(session));

        dto.setBoardSize(session.getConfig().getBoardSize());
        dto.setRuleset(session.getConfig().getRuleset());
        dto.setGameType(session.getConfig().getGameType());
        dto.setKomi(session.getKomi());
        dto.setHandicap(session.getConfig().getHandicap());
        dto.setTimeControl(session.getConfig().getTimeControl());
        dto.setVsAi(session.isVsAi());

        dto.setStones(session.getBoard().getStones());
        dto.setCurrentTurn(session.getCurrentTurn());
        dto.setKoPosition(session.getKoPosition());
        dto.setCapturedStones(session.getCapturedStones().copy());
        dto.setHistory(new ArrayList<>(session.getHistory()));

        List<GameStateDTO.PlayerView> players = new ArrayList<>();
        for (Player p : session.getPlayers()) {
            GameStateDTO.PlayerView view = new GameStateDTO.PlayerView();
            view.setId(p.getId());
            view.setUsername(p.getUsername());
            view.setColor(p.getColor());
            view.setAi(p.isAi());
            view.setClock(projectedClock(session, p, now));
            players.add(view);
        }
        dto.setPlayers(players);
        dto.setSpectators(new LinkedHashSet<>(session.getSpectators()));

        dto.setDeadStones(new LinkedHashSet<>(session.getDeadStones()));
        dto.setScoreConfirmation(new EnumMap<>(session.getScoreConfirmation()));
        dto.setResult(session.getResult());
        dto.setUndoRequest(session.getUndoRequest());
        dto.setAiUndoUsed(session.isAiUndoUsed());
        dto.setPlayAgainRequestedBy(session.getPlayAgainRequestedBy());
        dto.setSuccessorId(session.getSuccessorId());
        dto.setLastMoveTimestamp(session.getLastMoveTimestamp());
        dto.setServerTime(now);
        return dto;
    }

    private ClockSnapshot projectedClock(GameSession session, Player player, long now) {
        if (player.getClock() == null) {
            return null;
        }
        if (session.getStatus() == GameStatus.PLAYING && player.getColor() == session.getCurrentTurn()) {
            return timeControl.project(player.getClock(), session.getConfig().getTimeControl(),
                    Math.max(0, now - session.getLastMoveTimestamp()));
        }
        return player.getClock().snapshot();
    }

    private String statusMessage(GameSession session) {
        switch (session.getStatus()) {
            case WAITING:
                return "Waiting for an opponent (code " + session.getCode() + ")";
            case PLAYING:
                Player onMove = session.currentPlayer();
                String name = onMove == null ? "" : " (" + onMove.getUsername() + ")";
                return describe(session.getCurrentTurn()) + " to play" + name;
            case SCORING:
                return "Mark dead stones, then confirm the score";
            case FINISHED:
                GameResult result = session.getResult();
                return result == null ? "Game over" : "Game over: " + result.getCode();
            default:
                return "";
        }
    }

    private static String describe(StoneColor color) {
        return color == StoneColor.BLACK ? "Black" : "White";
    }
}
