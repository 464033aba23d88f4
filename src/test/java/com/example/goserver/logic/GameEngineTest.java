package com.example.goserver.logic;

import com.example.goserver.model.domain.Board;
import com.example.goserver.model.domain.GameConfig;
import com.example.goserver.model.domain.GameSession;
import com.example.goserver.model.domain.GameStatus;
import com.example.goserver.model.domain.MoveRecord;
import com.example.goserver.model.domain.Position;
import com.example.goserver.model.domain.ResultReason;
import com.example.goserver.model.domain.Ruleset;
import com.example.goserver.model.domain.StoneColor;
import com.example.goserver.model.domain.TimeControl;
import com.example.goserver.model.dto.GameEventType;
import com.example.goserver.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static com.example.goserver.model.domain.StoneColor.BLACK;
import static com.example.goserver.model.domain.StoneColor.WHITE;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;

class GameEngineTest {

    @Mock
    private GameEventPublisher publisher;

    private MutableClock clock;
    private GameSetup setup;
    private GameEngine engine;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        clock = new MutableClock();
        BoardEngine boardEngine = new BoardEngine();
        TimeControlStateMachine timeControl = new TimeControlStateMachine();
        setup = new GameSetup(timeControl, clock);
        engine = new GameEngine(boardEngine, new ScoringEngine(boardEngine), timeControl, setup, publisher, clock);
    }

    private static Position p(int x, int y) {
        return new Position(x, y);
    }

    private static GameConfig config(TimeControl tc) {
        GameConfig config = new GameConfig();
        config.setBoardSize(9);
        config.setRuleset(Ruleset.CHINESE);
        config.setTimeControl(tc);
        return config;
    }

    private GameSession startedGame(TimeControl tc) {
        GameSession session = setup.createSession(setup.normalize(config(tc)));
        engine.join(session, "p1", "Alice", false);
        engine.join(session, "p2", "Bob", false);
        return session;
    }

    private GameSession startedGame() {
        return startedGame(TimeControl.standard(600, 5, 30));
    }

    @Test
    void testSecondPlayerStartsTheGameAndLaterJoinersSpectate() {
        GameSession session = setup.createSession(setup.normalize(config(null)));

        assertEquals(BLACK, engine.join(session, "p1", "Alice", false));
        assertEquals(GameStatus.WAITING, session.getStatus());
        assertEquals(WHITE, engine.join(session, "p2", "Bob", false));
        assertEquals(GameStatus.PLAYING, session.getStatus());

        assertNull(engine.join(session, "p3", "Carol", false));
        assertTrue(session.getSpectators().contains("p3"));
        // Rejoining keeps the seat
        assertEquals(WHITE, engine.join(session, "p2", "Bob", false));
        assertEquals(2, session.getPlayers().size());
        verify(publisher, atLeastOnce()).publish(eq(session), eq(GameEventType.PLAYER_JOINED), any());
    }

    @Test
    void testThreeStonesWithoutCaptures() {
        GameSession session = startedGame();

        engine.applyMove(session, "p1", p(4, 4));
        engine.applyMove(session, "p2", p(3, 4));
        engine.applyMove(session, "p1", p(2, 4));

        assertEquals(3, session.getBoard().getStones().size());
        assertEquals(0, session.getCapturedStones().getBlack());
        assertEquals(0, session.getCapturedStones().getWhite());
        assertEquals(WHITE, session.getCurrentTurn());
        assertEquals(3, session.getHistory().size());
    }

    @Test
    void testMoveOutOfTurnIsRejected() {
        GameSession session = startedGame();
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> engine.applyMove(session, "p2", p(0, 0)));
        assertEquals("Not your turn", e.getMessage());
    }

    @Test
    void testIllegalMoveLeavesSessionUntouched() {
        GameSession session = startedGame();
        engine.applyMove(session, "p1", p(4, 4));
        clock.advanceSeconds(20);
        long revision = session.getRevision();
        long whiteTime = session.playerOf(WHITE).getClock().getMainTimeRemainingMs();

        assertThrows(RuleViolationException.class, () -> engine.applyMove(session, "p2", p(4, 4)));

        assertEquals(1, session.getHistory().size());
        assertEquals(WHITE, session.getCurrentTurn());
        assertEquals(revision, session.getRevision());
        assertEquals(whiteTime, session.playerOf(WHITE).getClock().getMainTimeRemainingMs());
    }

    @Test
    void testMoveChargesElapsedTime() {
        GameSession session = startedGame();
        clock.advanceSeconds(10);

        engine.applyMove(session, "p1", p(4, 4));

        assertEquals(590_000, session.playerOf(BLACK).getClock().getMainTimeRemainingMs());
        MoveRecord record = session.getHistory().get(0);
        assertEquals(10_000, record.getTimeSpentMs());
        assertEquals(590_000, record.getClock().mainTimeRemainingMs());
    }

    @Test
    void testMoveAfterTimeRanOutLosesOnTime() {
        GameSession session = startedGame(TimeControl.standard(60, 0, 0));
        clock.advanceSeconds(61);

        engine.applyMove(session, "p1", p(4, 4));

        assertEquals(GameStatus.FINISHED, session.getStatus());
        assertEquals("W+T", session.getResult().getCode());
        assertEquals(ResultReason.TIMEOUT, session.getResult().getReason());
        assertTrue(session.getBoard().getStones().isEmpty());
        verify(publisher).publish(eq(session), eq(GameEventType.PLAYER_TIMEOUT), any());
    }

    @Test
    void testTickTimesOutPlayerOnMove() {
        GameSession session = startedGame(TimeControl.blitz(10));
        clock.advanceSeconds(11);

        engine.tick(session);

        assertEquals(GameStatus.FINISHED, session.getStatus());
        assertEquals(WHITE, session.getResult().getWinner());
    }

    @Test
    void testTickIntoByoYomiAnnouncesReset() {
        GameSession session = startedGame(TimeControl.standard(60, 3, 30));
        clock.advanceSeconds(61);

        engine.tick(session);

        assertEquals(GameStatus.PLAYING, session.getStatus());
        assertTrue(session.playerOf(BLACK).getClock().isInByoYomi());
        verify(publisher).publish(eq(session), eq(GameEventType.BYO_YOMI_RESET), any());
    }

    @Test
    void testReportedThinkingTimeIsNotChargedTwiceAfterTickCommit() {
        GameSession session = startedGame(TimeControl.standard(10, 3, 5));
        clock.advanceSeconds(11);
        engine.tick(session);
        assertEquals(3, session.playerOf(BLACK).getClock().getByoYomiPeriodsLeft());

        // Engine-style report covering the whole 12s, of which the tick already charged 11s
        clock.advanceSeconds(1);
        engine.applyMove(session, "p1", p(4, 4), 12_000);

        assertEquals(GameStatus.PLAYING, session.getStatus());
        assertEquals(3, session.playerOf(BLACK).getClock().getByoYomiPeriodsLeft());
        assertEquals(1_000, session.getHistory().get(0).getTimeSpentMs());
    }

    @Test
    void testReportedTimeWithinBaselineIsChargedAsReported() {
        GameSession session = startedGame();
        clock.advanceSeconds(5);

        engine.applyPass(session, "p1", 3_000);

        assertEquals(597_000, session.playerOf(BLACK).getClock().getMainTimeRemainingMs());
    }

    @Test
    void testTwoPassesStartScoringAndCancelNeedsTwoNewPasses() {
        GameSession session = startedGame();
        engine.applyMove(session, "p1", p(2, 2));
        engine.applyPass(session, "p2");
        assertEquals(GameStatus.PLAYING, session.getStatus());
        engine.applyPass(session, "p1");
        assertEquals(GameStatus.SCORING, session.getStatus());

        engine.cancelScoring(session, "p2");
        assertEquals(GameStatus.PLAYING, session.getStatus());
        assertEquals(0, session.getConsecutivePasses());

        engine.applyPass(session, "p2");
        assertEquals(GameStatus.PLAYING, session.getStatus());
        engine.applyPass(session, "p1");
        assertEquals(GameStatus.SCORING, session.getStatus());
    }

    @Test
    void testPassClearsKo() {
        GameSession session = startedGame();
        session.setKoPosition(p(1, 1));
        engine.applyPass(session, "p1");
        assertNull(session.getKoPosition());
    }

    @Test
    void testBothConfirmationsFinishByScore() {
        GameSession session = startedGame();
        engine.applyMove(session, "p1", p(2, 2));
        engine.applyMove(session, "p2", p(6, 6));
        engine.applyPass(session, "p1");
        engine.applyPass(session, "p2");

        engine.confirmScore(session, "p1", true);
        assertEquals(GameStatus.SCORING, session.getStatus());
        engine.confirmScore(session, "p2", true);

        assertEquals(GameStatus.FINISHED, session.getStatus());
        assertEquals(ResultReason.SCORE, session.getResult().getReason());
        assertEquals("W+7.5", session.getResult().getCode());
    }

    @Test
    void testChangingDeadStonesResetsConfirmations() {
        GameSession session = startedGame();
        engine.applyMove(session, "p1", p(2, 2));
        engine.applyMove(session, "p2", p(6, 6));
        engine.applyPass(session, "p1");
        engine.applyPass(session, "p2");

        engine.confirmScore(session, "p1", true);
        engine.toggleDeadStone(session, "p2", p(6, 6));

        assertTrue(session.getDeadStones().contains(p(6, 6)));
        assertFalse(session.getScoreConfirmation().get(BLACK));
        assertEquals(GameStatus.SCORING, session.getStatus());
    }

    @Test
    void testDeadStonesOnlyDuringScoring() {
        GameSession session = startedGame();
        engine.applyMove(session, "p1", p(2, 2));
        assertThrows(IllegalStateException.class, () -> engine.toggleDeadStone(session, "p2", p(2, 2)));
    }

    @Test
    void testUndoReplaysToEarlierBoard() {
        GameSession session = startedGame();
        engine.applyMove(session, "p1", p(2, 2));
        engine.applyMove(session, "p2", p(6, 6));
        Board afterTwo = session.getBoard().copy();
        engine.applyMove(session, "p1", p(2, 6));
        engine.applyMove(session, "p2", p(6, 2));

        engine.requestUndo(session, "p1", 2);
        assertNotNull(session.getUndoRequest());
        assertThrows(IllegalStateException.class, () -> engine.respondUndo(session, "p1", true));

        engine.respondUndo(session, "p2", true);

        assertEquals(afterTwo, session.getBoard());
        assertEquals(2, session.getHistory().size());
        assertEquals(BLACK, session.getCurrentTurn());
        assertNull(session.getUndoRequest());
    }

    @Test
    void testUndoRecomputesCaptures() {
        GameSession session = startedGame();
        // Black captures the white stone at (0,0)
        engine.applyMove(session, "p1", p(1, 0));
        engine.applyMove(session, "p2", p(0, 0));
        engine.applyMove(session, "p1", p(0, 1));
        assertEquals(1, session.getCapturedStones().getBlack());

        engine.requestUndo(session, "p2", 2);
        engine.respondUndo(session, "p1", true);

        assertEquals(0, session.getCapturedStones().getBlack());
        assertEquals(WHITE, session.getBoard().get(p(0, 0)));
    }

    @Test
    void testDeclinedUndoKeepsPosition() {
        GameSession session = startedGame();
        engine.applyMove(session, "p1", p(2, 2));
        engine.requestUndo(session, "p1", 0);
        engine.respondUndo(session, "p2", false);
        assertEquals(1, session.getHistory().size());
    }

    @Test
    void testReplaySkipsEntriesThatNoLongerApply() {
        GameSession session = startedGame();
        engine.applyMove(session, "p1", p(2, 2));
        engine.applyMove(session, "p2", p(6, 6));
        session.getHistory().add(MoveRecord.placement(p(2, 2), BLACK, "p1", 0, 0, 0, null));

        engine.replayTo(session, 3);

        assertEquals(2, session.getHistory().size());
        assertEquals(2, session.getBoard().getStones().size());
    }

    @Test
    void testAiGameAllowsOneImmediateUndo() {
        GameConfig config = config(null);
        config.setVsAi(true);
        GameSession session = setup.createSession(setup.normalize(config));
        engine.join(session, "p1", "Alice", false);
        setup.seat(session, "ai_1", "KataGo (normal)", WHITE, true);
        engine.startGame(session);
        engine.applyMove(session, "p1", p(2, 2));
        engine.applyMove(session, "ai_1", p(6, 6));

        engine.requestUndo(session, "p1", 0);

        assertTrue(session.getBoard().getStones().isEmpty());
        assertTrue(session.isAiUndoUsed());
        assertThrows(IllegalStateException.class, () -> engine.requestUndo(session, "p1", 0));
    }

    @Test
    void testResignation() {
        GameSession session = startedGame();
        engine.resign(session, "p1");
        assertEquals(GameStatus.FINISHED, session.getStatus());
        assertEquals("W+R", session.getResult().getCode());
        assertThrows(IllegalStateException.class, () -> engine.resign(session, "p2"));
    }

    @Test
    void testHandicapGameStartsWithWhite() {
        GameConfig config = config(null);
        config.setHandicap(2);
        GameSession session = setup.createSession(setup.normalize(config));
        engine.join(session, "p1", "Alice", false);
        engine.join(session, "p2", "Bob", false);

        assertEquals(WHITE, session.getCurrentTurn());
        assertEquals(0.5, session.getKomi());
        assertEquals(2, session.getBoard().countStones(BLACK));
        assertThrows(IllegalStateException.class, () -> engine.applyMove(session, "p1", p(0, 0)));
    }

    @Test
    void testPlayAgainNeedsBothSides() {
        GameSession session = startedGame();
        engine.resign(session, "p2");

        assertFalse(engine.requestPlayAgain(session, "p1"));
        assertEquals("p1", session.getPlayAgainRequestedBy());
        assertThrows(IllegalStateException.class, () -> engine.respondPlayAgain(session, "p1", true));
        assertTrue(engine.respondPlayAgain(session, "p2", true));

        GameSession next = engine.createSuccessor(session);

        assertEquals(next.getId(), session.getSuccessorId());
        assertEquals(GameStatus.PLAYING, next.getStatus());
        assertEquals(BLACK, next.findPlayer("p1").orElseThrow().getColor());
        assertTrue(next.getBoard().getStones().isEmpty());
        assertEquals(600_000, next.playerOf(BLACK).getClock().getMainTimeRemainingMs());
        verify(publisher).publish(eq(session), eq(GameEventType.NEW_GAME), any());
    }

    @Test
    void testDeclinedPlayAgainClearsRequest() {
        GameSession session = startedGame();
        engine.resign(session, "p2");
        engine.requestPlayAgain(session, "p1");

        assertFalse(engine.respondPlayAgain(session, "p2", false));
        assertNull(session.getPlayAgainRequestedBy());
    }

    @Test
    void testStrangerCannotAct() {
        GameSession session = startedGame();
        assertThrows(IllegalStateException.class, () -> engine.applyPass(session, "nobody"));
        StoneColor turn = session.getCurrentTurn();
        assertEquals(BLACK, turn);
    }
}
