package com.example.goserver.controller;

import com.example.goserver.logic.RuleViolationException;
import com.example.goserver.model.domain.Position;
import com.example.goserver.model.domain.StoneColor;
import com.example.goserver.model.dto.ErrorResponse;
import com.example.goserver.model.dto.JoinRequest;
import com.example.goserver.model.dto.MoveRequest;
import com.example.goserver.model.dto.SeatResponse;
import com.example.goserver.model.dto.UndoCommand;
import com.example.goserver.service.GameNotFoundException;
import com.example.goserver.service.GameService;
import com.example.goserver.service.PresenceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GameSocketControllerTest {

    private GameSocketController controller;
    private SimpMessageHeaderAccessor headers;

    @Mock
    private GameService gameService;
    @Mock
    private PresenceService presenceService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        controller = new GameSocketController(gameService, presenceService);
        headers = SimpMessageHeaderAccessor.create();
        headers.setSessionId("ws-1");
    }

    @Test
    void testJoinBindsConnection() {
        when(gameService.joinGame("g1", "p1", "Alice", false))
                .thenReturn(new SeatResponse("g1", "ABC123", "p1", StoneColor.BLACK));

        SeatResponse seat = controller.join("g1", new JoinRequest("p1", "Alice", false), headers);

        assertEquals(StoneColor.BLACK, seat.getColor());
        verify(presenceService).bind("ws-1", "g1", "p1");
    }

    @Test
    void testMoveUsesBoundPlayer() {
        when(presenceService.requirePlayer("ws-1", "g1")).thenReturn("p1");

        controller.move("g1", new MoveRequest(3, 4), headers);

        verify(gameService).makeMove("g1", "p1", new Position(3, 4));
    }

    @Test
    void testUnboundConnectionCannotPlay() {
        when(presenceService.requirePlayer("ws-1", "g1"))
                .thenThrow(new IllegalStateException("Join the game before sending commands"));

        assertThrows(IllegalStateException.class, () -> controller.pass("g1", headers));
        verify(gameService, never()).passTurn(anyString(), anyString());
    }

    @Test
    void testAcceptedPlayAgainMovesConnections() {
        when(presenceService.requirePlayer("ws-1", "g1")).thenReturn("p2");
        when(gameService.respondPlayAgain("g1", "p2", true)).thenReturn("g2");

        controller.respondPlayAgain("g1", new UndoCommand(0, true), headers);

        verify(presenceService).follow("g1", "g2");
    }

    @Test
    void testPendingPlayAgainKeepsConnections() {
        when(presenceService.requirePlayer("ws-1", "g1")).thenReturn("p1");

        controller.requestPlayAgain("g1", headers);

        verify(presenceService, never()).follow(anyString(), anyString());
    }

    @Test
    void testErrorCodes() {
        assertEquals("KO", controller.handleError(new RuleViolationException(RuleViolationException.Reason.KO)).error());
        assertEquals("SUICIDE",
                controller.handleError(new RuleViolationException(RuleViolationException.Reason.SUICIDE)).error());
        assertEquals("NOT_FOUND", controller.handleError(new GameNotFoundException("g1")).error());
        assertEquals("BAD_REQUEST", controller.handleError(new IllegalArgumentException("bad")).error());
        assertEquals("CONFLICT", controller.handleError(new IllegalStateException("Not your turn")).error());

        ErrorResponse internal = controller.handleError(new NullPointerException());
        assertEquals("INTERNAL", internal.error());
    }
}
