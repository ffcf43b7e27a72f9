package logic;

import component.GameConfig;
import org.junit.Test;

import static org.junit.Assert.*;

public class ScoreServiceTest {

    private final ScoreService scoring = new ScoreService(GameConfig.tetris());

    @Test
    public void testLineClearScoreScalesWithLinesAndLevel() {
        assertEquals(0, scoring.lineClearScore(0, 1));
        assertEquals(100, scoring.lineClearScore(1, 1));
        assertEquals(400, scoring.lineClearScore(4, 1));
        assertEquals(600, scoring.lineClearScore(2, 3));
    }

    @Test
    public void testHardDropBonusEvenWithoutLines() {
        assertEquals(20, scoring.placementScore(0, 1, true));
        assertEquals(120, scoring.placementScore(1, 1, true));
        assertEquals(0, scoring.placementScore(0, 5, false));
    }

    @Test
    public void testCustomConstants() {
        GameConfig cfg = GameConfig.builder().pointsPerLine(40).hardDropBonus(0).build();
        ScoreService custom = new ScoreService(cfg);
        assertEquals(80, custom.placementScore(2, 1, true));
    }
}
