package com.example.goserver.controller;

import com.example.goserver.logic.RuleViolationException;
import com.example.goserver.model.dto.ConfirmScoreRequest;
import com.example.goserver.model.dto.ErrorResponse;
import com.example.goserver.model.dto.JoinRequest;
import com.example.goserver.model.dto.MoveRequest;
import com.example.goserver.model.dto.SeatResponse;
import com.example.goserver.model.dto.UndoCommand;
import com.example.goserver.service.GameNotFoundException;
import com.example.goserver.service.GameService;
import com.example.goserver.service.PresenceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;

@Slf4j
@Controller
public class GameSocketController {

    private final GameService gameService;
    private final PresenceService presenceService;

    public GameSocketController(GameService gameService, PresenceService presenceService) {
        this.gameService = gameService;
        this.presenceService = presenceService;
    }

    /**
     * Seats the caller (or adds them as spectator) and binds this connection to the game.
     * Client sends to: /app/game/{gameId}/join, answer on /user/queue/seat
     */
    @MessageMapping("/game/{gameId}/join")
    @SendToUser(destinations = "/queue/seat", broadcast = false)
    public SeatResponse join(@DestinationVariable String gameId, JoinRequest request,
                             SimpMessageHeaderAccessor headers) {
        SeatResponse seat = gameService.joinGame(gameId, request.getPlayerId(), request.getUsername(),
                request.isSpectator());
        presenceService.bind(headers.getSessionId(), gameId, seat.getPlayerId());
        return seat;
    }

    @MessageMapping("/game/{gameId}/leave")
    public void leave(@DestinationVariable String gameId, SimpMessageHeaderAccessor headers) {
        presenceService.leave(headers.getSessionId(), gameId);
    }

    @MessageMapping("/game/{gameId}/move")
    public void move(@DestinationVariable String gameId, MoveRequest move, SimpMessageHeaderAccessor headers) {
        gameService.makeMove(gameId, player(gameId, headers), move.toPosition());
    }

    @MessageMapping("/game/{gameId}/pass")
    public void pass(@DestinationVariable String gameId, SimpMessageHeaderAccessor headers) {
        gameService.passTurn(gameId, player(gameId, headers));
    }

    @MessageMapping("/game/{gameId}/resign")
    public void resign(@DestinationVariable String gameId, SimpMessageHeaderAccessor headers) {
        gameService.resign(gameId, player(gameId, headers));
    }

    @MessageMapping("/game/{gameId}/undo/request")
    public void requestUndo(@DestinationVariable String gameId, UndoCommand command,
                            SimpMessageHeaderAccessor headers) {
        gameService.requestUndo(gameId, player(gameId, headers), command.getMoveIndex());
    }

    @MessageMapping("/game/{gameId}/undo/respond")
    public void respondUndo(@DestinationVariable String gameId, UndoCommand command,
                            SimpMessageHeaderAccessor headers) {
        gameService.respondUndo(gameId, player(gameId, headers), command.isAccepted());
    }

    @MessageMapping("/game/{gameId}/score/toggle")
    public void toggleDeadStone(@DestinationVariable String gameId, MoveRequest stone,
                                SimpMessageHeaderAccessor headers) {
        gameService.toggleDeadStone(gameId, player(gameId, headers), stone.toPosition());
    }

    @MessageMapping("/game/{gameId}/score/confirm")
    public void confirmScore(@DestinationVariable String gameId, ConfirmScoreRequest request,
                             SimpMessageHeaderAccessor headers) {
        gameService.confirmScore(gameId, player(gameId, headers), request.isConfirmed());
    }

    @MessageMapping("/game/{gameId}/score/cancel")
    public void cancelScoring(@DestinationVariable String gameId, SimpMessageHeaderAccessor headers) {
        gameService.cancelScoring(gameId, player(gameId, headers));
    }

    @MessageMapping("/game/{gameId}/play-again/request")
    public void requestPlayAgain(@DestinationVariable String gameId, SimpMessageHeaderAccessor headers) {
        String next = gameService.requestPlayAgain(gameId, player(gameId, headers));
        if (next != null) {
            presenceService.follow(gameId, next);
        }
    }

    @MessageMapping("/game/{gameId}/play-again/respond")
    public void respondPlayAgain(@DestinationVariable String gameId, UndoCommand command,
                                 SimpMessageHeaderAccessor headers) {
        String next = gameService.respondPlayAgain(gameId, player(gameId, headers), command.isAccepted());
        if (next != null) {
            presenceService.follow(gameId, next);
        }
    }

    @MessageMapping("/game/{gameId}/heartbeat")
    public void heartbeat(@DestinationVariable String gameId, SimpMessageHeaderAccessor headers) {
        player(gameId, headers);
        gameService.heartbeat(gameId);
    }

    @MessageMapping("/game/{gameId}/sync")
    public void sync(@DestinationVariable String gameId) {
        gameService.sync(gameId);
    }

    private String player(String gameId, SimpMessageHeaderAccessor headers) {
        return presenceService.requirePlayer(headers.getSessionId(), gameId);
    }

    @MessageExceptionHandler
    @SendToUser(destinations = "/queue/errors", broadcast = false)
    public ErrorResponse handleError(Exception e) {
        if (e instanceof RuleViolationException) {
            return ErrorResponse.of(((RuleViolationException) e).getReason().name(), e);
        }
        if (e instanceof GameNotFoundException) {
            return ErrorResponse.of("NOT_FOUND", e);
        }
        if (e instanceof IllegalArgumentException) {
            return ErrorResponse.of("BAD_REQUEST", e);
        }
        if (e instanceof IllegalStateException) {
            return ErrorResponse.of("CONFLICT", e);
        }
        log.error("Unexpected error handling a game message", e);
        return new ErrorResponse("INTERNAL", "Unexpected server error");
    }
}
