package com.example.goserver.logic;

import com.example.goserver.model.domain.Board;
import com.example.goserver.model.domain.CapturedStones;
import com.example.goserver.model.domain.Position;
import com.example.goserver.model.domain.Ruleset;
import com.example.goserver.model.domain.ScoreResult;
import com.example.goserver.model.domain.StoneColor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static com.example.goserver.model.domain.StoneColor.BLACK;
import static com.example.goserver.model.domain.StoneColor.WHITE;
import static org.junit.jupiter.api.Assertions.*;

class ScoringEngineTest {

    private ScoringEngine scoring;
    private Board board;

    @BeforeEach
    void setUp() {
        scoring = new ScoringEngine(new BoardEngine());
        board = new Board(9);
    }

    private static Position p(int x, int y) {
        return new Position(x, y);
    }

    private void wall(int x, StoneColor color) {
        for (int y = 0; y < 9; y++) {
            board.set(p(x, y), color);
        }
    }

    @Test
    void testChineseCountsAreaAndCoversTheBoard() {
        wall(4, BLACK);
        wall(5, WHITE);

        ScoreResult result = scoring.score(board, Set.of(), new CapturedStones(), Ruleset.CHINESE, 7.5);

        assertEquals(36, result.getBlackTerritory().size());
        assertEquals(27, result.getWhiteTerritory().size());
        assertTrue(result.getNeutralPoints().isEmpty());
        assertEquals(45.0, result.getBlack().getTotal());
        assertEquals(43.5, result.getWhite().getTotal());
        assertEquals(BLACK, result.getWinner());
        assertEquals("B+1.5", result.getResultCode());

        int covered = result.getBlackTerritory().size() + result.getBlack().getStones()
                + result.getWhiteTerritory().size() + result.getWhite().getStones()
                + result.getNeutralPoints().size();
        assertEquals(81, covered);
    }

    @Test
    void testJapaneseCountsTerritoryAndPrisoners() {
        wall(4, BLACK);
        wall(5, WHITE);
        CapturedStones captured = new CapturedStones();
        captured.add(BLACK, 2);

        ScoreResult result = scoring.score(board, Set.of(), captured, Ruleset.JAPANESE, 6.5);

        assertEquals(0, result.getBlack().getStones());
        assertEquals(38.0, result.getBlack().getTotal());
        assertEquals(33.5, result.getWhite().getTotal());
        assertEquals("B+4.5", result.getResultCode());
    }

    @Test
    void testDeadStonesBecomeTerritoryAndPrisoners() {
        wall(4, BLACK);
        wall(5, WHITE);
        board.set(p(1, 1), WHITE);

        ScoreResult alive = scoring.score(board, Set.of(), new CapturedStones(), Ruleset.JAPANESE, 6.5);
        assertTrue(alive.getNeutralPoints().size() > 0);

        ScoreResult dead = scoring.score(board, Set.of(p(1, 1)), new CapturedStones(), Ruleset.JAPANESE, 6.5);
        assertEquals(36, dead.getBlackTerritory().size());
        assertEquals(1, dead.getBlack().getCaptures());
        assertEquals(37.0, dead.getBlack().getTotal());
    }

    @Test
    void testNeutralPointsAndDraw() {
        wall(3, BLACK);
        wall(5, WHITE);

        ScoreResult result = scoring.score(board, Set.of(), new CapturedStones(), Ruleset.CHINESE, 0);

        assertEquals(9, result.getNeutralPoints().size());
        assertEquals(27, result.getBlackTerritory().size());
        assertEquals(27, result.getWhiteTerritory().size());
        assertNull(result.getWinner());
        assertEquals("Draw", result.getResultCode());
    }

    @Test
    void testAgaCountsStonesAndPrisoners() {
        wall(4, BLACK);
        wall(5, WHITE);
        CapturedStones captured = new CapturedStones();
        captured.add(WHITE, 3);

        ScoreResult result = scoring.score(board, Set.of(), captured, Ruleset.AGA, 7.5);

        assertEquals(45.0, result.getBlack().getTotal());
        assertEquals(27 + 9 + 3 + 7.5, result.getWhite().getTotal());
        assertEquals("W+1.5", result.getResultCode());
    }

    @Test
    void testKoreanCountsAreaWithSmallerKomi() {
        wall(4, BLACK);
        wall(5, WHITE);
        CapturedStones captured = new CapturedStones();
        captured.add(BLACK, 4);

        ScoreResult result = scoring.score(board, Set.of(), captured, Ruleset.KOREAN, 6.5);

        assertEquals(36, result.getBlack().getTerritory());
        assertEquals(9, result.getBlack().getStones());
        assertEquals(0, result.getBlack().getCaptures());
        assertEquals(45.0, result.getBlack().getTotal());
        assertEquals(6.5, result.getWhite().getKomi());
        assertEquals(42.5, result.getWhite().getTotal());
        assertEquals(BLACK, result.getWinner());
        assertEquals("B+2.5", result.getResultCode());
    }

    @Test
    void testIngAddsPrisonersToAreaScore() {
        wall(4, BLACK);
        wall(5, WHITE);
        CapturedStones captured = new CapturedStones();
        captured.add(WHITE, 2);

        ScoreResult result = scoring.score(board, Set.of(), captured, Ruleset.ING, 8.0);

        assertEquals(45.0, result.getBlack().getTotal());
        assertEquals(27, result.getWhite().getTerritory());
        assertEquals(9, result.getWhite().getStones());
        assertEquals(2, result.getWhite().getCaptures());
        assertEquals(8.0, result.getWhite().getKomi());
        assertEquals(46.0, result.getWhite().getTotal());
        assertEquals(WHITE, result.getWinner());
        assertEquals("W+1", result.getResultCode());
    }

    @Test
    void testResultCodeDropsTrailingZeros() {
        assertEquals("W+4", ScoringEngine.resultCode(WHITE, 4.0));
        assertEquals("B+0.5", ScoringEngine.resultCode(BLACK, 0.5));
        assertEquals("Draw", ScoringEngine.resultCode(null, 0));
    }

    @Test
    void testToggleMarksAndReleasesWholeGroup() {
        board.set(p(2, 2), WHITE);
        board.set(p(2, 3), WHITE);

        Set<Position> marked = scoring.toggleDeadStone(board, Set.of(), p(2, 2));
        assertEquals(Set.of(p(2, 2), p(2, 3)), marked);

        Set<Position> released = scoring.toggleDeadStone(board, marked, p(2, 3));
        assertTrue(released.isEmpty());
    }

    @Test
    void testToggleOnEmptyPointIsRejected() {
        assertThrows(IllegalStateException.class, () -> scoring.toggleDeadStone(board, Set.of(), p(0, 0)));
    }

    @Test
    void testAutoDetectExtendsToLikelyDeadGroups() {
        // White (1,1) with a single false-eye liberty at (1,2)
        board.set(p(1, 1), WHITE);
        board.set(p(0, 1), BLACK);
        board.set(p(1, 0), BLACK);
        board.set(p(2, 1), BLACK);
        // Healthy white stone far away
        board.set(p(4, 4), WHITE);
        // Toggled group of three
        board.set(p(6, 6), WHITE);
        board.set(p(6, 7), WHITE);
        board.set(p(7, 6), WHITE);

        ScoringEngine plain = new ScoringEngine(new BoardEngine(), false);
        assertEquals(3, plain.toggleDeadStone(board, Set.of(), p(6, 6)).size());

        ScoringEngine auto = new ScoringEngine(new BoardEngine(), true);
        Set<Position> marked = auto.toggleDeadStone(board, Set.of(), p(6, 6));
        assertTrue(marked.contains(p(1, 1)));
        assertFalse(marked.contains(p(4, 4)));
        assertEquals(4, marked.size());
    }
}
