package component.score;

import component.GameConfig;
import logic.BoardLogic;
import logic.GamePhase;
import logic.SessionState;
import org.junit.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.*;

public class HighScoreHookTest {

    private final ScoreBoard board = ScoreBoard.inMemory();

    @Test
    public void testSavesWhenHighScore() {
        HighScoreHook hook = new HighScoreHook(board, "lineDestroyer", score -> "lee");
        assertEquals(0, hook.record(300));
        assertEquals("lee", board.getHighScores("lineDestroyer", 1).get(0).name());
    }

    @Test
    public void testSkipsPromptWhenNotHighScore() {
        for (int i = 0; i < 10; i++) {
            board.saveScore("p" + i, 1000, "lineDestroyer");
        }
        AtomicInteger asked = new AtomicInteger();
        HighScoreHook hook = new HighScoreHook(board, "lineDestroyer", score -> {
            asked.incrementAndGet();
            return "x";
        });

        assertEquals(-1, hook.record(10));
        assertEquals(0, asked.get());
    }

    @Test
    public void testBlankNameSkips() {
        HighScoreHook hook = new HighScoreHook(board, "lineDestroyer", score -> null);
        assertEquals(-1, hook.record(300));
        assertTrue(board.getAllHighScores(10).isEmpty());
    }

    @Test
    public void testStoreFailureIsContained() {
        ScoreBoard failing = new ScoreBoard(null, System::currentTimeMillis) {
            @Override
            public synchronized boolean isHighScore(String gameId, int score) {
                throw new IllegalStateException("db down");
            }
        };
        HighScoreHook hook = new HighScoreHook(failing, "lineDestroyer", score -> "x");
        assertEquals(-1, hook.record(300));
    }

    @Test
    public void testGameOverReachesStoreAndFailureDoesNotBlockGameOver() {
        // 스폰 즉시 충돌 → GAME_OVER(score 0)
        BoardLogic logic = new BoardLogic(GameConfig.lineDestroyer(), bound -> 0, (g, p, c) -> true);
        AtomicInteger prompts = new AtomicInteger();
        HighScoreHook hook = new HighScoreHook(board, "lineDestroyer", score -> {
            prompts.incrementAndGet();
            throw new IllegalStateException("dialog crashed");
        });
        logic.addListener(hook);

        logic.start();
        assertEquals(GamePhase.GAME_OVER, logic.getPhase());

        hook.close();   // 대기 중인 처리 마무리
        assertEquals(1, prompts.get());
        assertTrue(board.getAllHighScores(10).isEmpty());
    }

    @Test
    public void testEngineStaysReadableWhileNamePromptIsOpen() throws Exception {
        BoardLogic logic = new BoardLogic(GameConfig.lineDestroyer(), bound -> 0, (g, p, c) -> true);
        CountDownLatch promptOpen = new CountDownLatch(1);
        CountDownLatch nameTyped = new CountDownLatch(1);
        HighScoreHook hook = new HighScoreHook(board, "lineDestroyer", score -> {
            promptOpen.countDown();
            try {
                nameTyped.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "park";
        });
        logic.addListener(hook);

        logic.start();
        assertTrue("이름 입력창이 열려야 함", promptOpen.await(2, TimeUnit.SECONDS));

        // 입력창이 열린 동안 다른 스레드(렌더러)가 상태를 읽을 수 있어야 한다
        CountDownLatch read = new CountDownLatch(1);
        AtomicReference<SessionState> seen = new AtomicReference<>();
        Thread renderer = new Thread(() -> {
            seen.set(logic.getSnapshot());
            read.countDown();
        });
        renderer.start();
        assertTrue("엔진 조회가 입력창에 막힘", read.await(500, TimeUnit.MILLISECONDS));
        assertEquals(GamePhase.GAME_OVER, seen.get().phase());

        nameTyped.countDown();
        hook.close();
        assertEquals("park", board.getHighScores("lineDestroyer", 1).get(0).name());
    }

    @Test
    public void testCallerExecutorRunsInline() {
        BoardLogic logic = new BoardLogic(GameConfig.lineDestroyer(), bound -> 0, (g, p, c) -> true);
        logic.addListener(new HighScoreHook(board, "lineDestroyer", score -> "kim", Runnable::run));

        logic.start();

        // 같은 스레드에서 바로 저장됨
        assertEquals(1, board.getHighScores("lineDestroyer", 10).size());
    }
}
