package component;

import logic.BoardLogic;
import logic.GamePhase;
import logic.RandomSource;
import org.junit.After;
import org.junit.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class GameLoopTest {

    // 20ms 고정 간격
    private static final GameConfig FAST = GameConfig.tetris().toBuilder().dropInterval(20, 0, 20).build();

    private GameLoop loop;

    @After
    public void tearDown() {
        if (loop != null) loop.shutdown();
    }

    @Test
    public void testGameLoopStartStop() {
        BoardLogic logic = new BoardLogic(FAST, RandomSource.seeded(1));
        loop = new GameLoop(logic, () -> {});

        loop.start();
        assertTrue(loop.isRunning());
        assertFalse(loop.isArmed());   // 세션 시작 전

        logic.start();
        assertTrue(loop.isArmed());
        assertEquals(20, loop.getCurrentInterval());

        loop.stop();
        assertFalse(loop.isRunning());
        assertFalse(loop.isArmed());
    }

    @Test
    public void testGameLoopCallsMoveDown() throws Exception {
        BoardLogic logic = new BoardLogic(FAST, RandomSource.seeded(1));
        CountDownLatch latch = new CountDownLatch(3);
        loop = new GameLoop(logic, latch::countDown);

        loop.start();
        logic.start();

        assertTrue(latch.await(1000, TimeUnit.MILLISECONDS));
        assertTrue(loop.getTickCount() >= 3);
    }

    @Test
    public void testPauseCancelsTimer() throws Exception {
        BoardLogic logic = new BoardLogic(FAST, RandomSource.seeded(1));
        loop = new GameLoop(logic, () -> {});
        loop.start();
        logic.start();

        logic.pause();
        assertFalse(loop.isArmed());
        Thread.sleep(50);   // 진행 중이던 틱 정리

        long ticks = loop.getTickCount();
        Thread.sleep(150);
        assertEquals(ticks, loop.getTickCount());
        assertEquals(GamePhase.PAUSED, logic.getPhase());

        logic.resume();
        assertTrue(loop.isArmed());
    }

    @Test
    public void testGameLoopStopsOnGameOver() {
        BoardLogic logic = new BoardLogic(FAST, RandomSource.seeded(1), (g, p, c) -> true);
        loop = new GameLoop(logic, () -> {});
        loop.start();

        logic.start();   // 스폰 즉시 충돌

        assertTrue(logic.isGameOver());
        assertFalse(loop.isArmed());
    }

    @Test
    public void testRestartRearmsWithNewSession() throws Exception {
        BoardLogic logic = new BoardLogic(FAST, RandomSource.seeded(1));
        loop = new GameLoop(logic, () -> {});
        loop.start();

        logic.start();
        logic.start();
        assertTrue(loop.isArmed());

        long ticks = loop.getTickCount();
        Thread.sleep(150);
        // 새 세션 토큰으로 무장됐으니 틱이 계속 반영된다
        assertTrue(loop.getTickCount() > ticks);
    }

    @Test
    public void testLevelUpRearmsWithCurrentInterval() {
        BoardLogic logic = new BoardLogic(FAST, RandomSource.seeded(1));
        loop = new GameLoop(logic, () -> {});
        loop.start();
        logic.start();

        loop.onLevelUp(2, 950);

        assertTrue(loop.isArmed());
        assertEquals(logic.getDropInterval(), loop.getCurrentInterval());
    }

    @Test
    public void testShutdownStopsTicks() throws Exception {
        BoardLogic logic = new BoardLogic(FAST, RandomSource.seeded(1));
        loop = new GameLoop(logic, () -> {});
        loop.start();
        logic.start();

        loop.shutdown();
        long ticks = loop.getTickCount();
        Thread.sleep(100);

        assertEquals(ticks, loop.getTickCount());
        assertFalse(loop.isArmed());
        loop = null;
    }
}
