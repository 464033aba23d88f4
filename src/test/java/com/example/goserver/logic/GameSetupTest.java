package com.example.goserver.logic;

import com.example.goserver.model.domain.GameConfig;
import com.example.goserver.model.domain.GameSession;
import com.example.goserver.model.domain.GameStatus;
import com.example.goserver.model.domain.GameType;
import com.example.goserver.model.domain.Position;
import com.example.goserver.model.domain.Ruleset;
import com.example.goserver.model.domain.TimeControl;
import com.example.goserver.model.domain.TimeControlMode;
import com.example.goserver.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.goserver.model.domain.StoneColor.BLACK;
import static org.junit.jupiter.api.Assertions.*;

class GameSetupTest {

    private GameSetup setup;

    @BeforeEach
    void setUp() {
        setup = new GameSetup(new TimeControlStateMachine(), new MutableClock());
    }

    private static GameConfig config(int size) {
        GameConfig config = new GameConfig();
        config.setBoardSize(size);
        return config;
    }

    @Test
    void testDefaultsFollowRulesetAndBoardSize() {
        GameConfig normalized = setup.normalize(config(19));

        assertEquals(Ruleset.JAPANESE, normalized.getRuleset());
        assertEquals(6.5, normalized.getKomi());
        TimeControl tc = normalized.getTimeControl();
        assertEquals(45 * 60, tc.getMainTimeSeconds());
        assertEquals(5, tc.getByoYomiPeriods());
        assertEquals(30, tc.getByoYomiSeconds());
    }

    @Test
    void testTeachingGamesDoubleMainTime() {
        GameConfig config = config(9);
        config.setGameType(GameType.TEACHING);
        assertEquals(20 * 60, setup.normalize(config).getTimeControl().getMainTimeSeconds());
    }

    @Test
    void testChineseKomiAndExplicitKomi() {
        GameConfig config = config(13);
        config.setRuleset(Ruleset.CHINESE);
        assertEquals(7.5, setup.normalize(config).getKomi());

        config.setKomi(5.5);
        assertEquals(5.5, setup.normalize(config).getKomi());
    }

    @Test
    void testHandicapForcesHalfPointKomi() {
        GameConfig config = config(19);
        config.setHandicap(4);
        config.setKomi(6.5);
        assertEquals(0.5, setup.normalize(config).getKomi());
    }

    @Test
    void testInvalidSettingsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> setup.normalize(config(10)));

        GameConfig handicapOne = config(19);
        handicapOne.setHandicap(1);
        assertThrows(IllegalArgumentException.class, () -> setup.normalize(handicapOne));

        GameConfig bigAi = config(21);
        bigAi.setVsAi(true);
        assertThrows(IllegalArgumentException.class, () -> setup.normalize(bigAi));

        GameConfig fastBlitz = config(9);
        fastBlitz.setTimeControl(TimeControl.blitz(3));
        assertThrows(IllegalArgumentException.class, () -> setup.normalize(fastBlitz));
    }

    @Test
    void testBlitzGameTypeGetsPerMoveTimer() {
        GameConfig config = config(9);
        config.setGameType(GameType.BLITZ);

        TimeControl tc = setup.normalize(config).getTimeControl();

        assertEquals(TimeControlMode.BLITZ, tc.getMode());
        assertEquals(10, tc.getTimePerMoveSeconds());
        assertEquals(0, tc.getMainTimeSeconds());
    }

    @Test
    void testNormalizeDoesNotTouchInput() {
        GameConfig raw = config(9);
        setup.normalize(raw);
        assertNull(raw.getKomi());
        assertNull(raw.getTimeControl());
    }

    @Test
    void testSessionPlacesHandicapOnStarPoints() {
        GameConfig config = config(19);
        config.setHandicap(3);

        GameSession session = setup.createSession(setup.normalize(config));

        assertEquals(List.of(new Position(3, 3), new Position(15, 15), new Position(15, 3)),
                session.getHandicapStones());
        assertEquals(BLACK, session.getBoard().get(new Position(15, 3)));
        assertEquals(GameStatus.WAITING, session.getStatus());
        assertEquals(6, session.getCode().length());
        assertNotNull(session.getId());
    }

    @Test
    void testSeatRejectsTakenColor() {
        GameSession session = setup.createSession(setup.normalize(config(9)));
        setup.seat(session, "p1", "Alice", BLACK, false);
        assertThrows(IllegalStateException.class, () -> setup.seat(session, "p2", "Bob", BLACK, false));
    }
}
