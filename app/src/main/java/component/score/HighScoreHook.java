package component.score;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import logic.GameListener;

/**
 * 게임 오버 → 하이스코어 확인 → 이름 입력 → 저장.
 * GAME_OVER 전이는 이미 끝난 뒤라 저장 실패가 게임 흐름에 영향을 주지 않는다.
 * 이벤트는 엔진 락 안에서 오므로 입력/저장은 전용 스레드에서 처리한다.
 */
public class HighScoreHook implements GameListener, AutoCloseable {

    private final ScoreBoard scoreBoard;
    private final String gameId;
    private final NamePrompt prompt;
    private final Executor executor;
    private final ExecutorService owned;   // 직접 만든 경우에만 close 에서 정리

    public HighScoreHook(ScoreBoard scoreBoard, String gameId, NamePrompt prompt) {
        this(scoreBoard, gameId, prompt, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "high-score-" + gameId);
            t.setDaemon(true);
            return t;
        }), true);
    }

    /** executor: 호출자가 관리한다 (Runnable::run 이면 엔진 스레드에서 바로 실행) */
    public HighScoreHook(ScoreBoard scoreBoard, String gameId, NamePrompt prompt, Executor executor) {
        this(scoreBoard, gameId, prompt, executor, false);
    }

    private HighScoreHook(ScoreBoard scoreBoard, String gameId, NamePrompt prompt,
                          Executor executor, boolean ownsExecutor) {
        this.scoreBoard = scoreBoard;
        this.gameId = gameId;
        this.prompt = prompt;
        this.executor = executor;
        this.owned = ownsExecutor ? (ExecutorService) executor : null;
    }

    @Override
    public void onGameOver(int finalScore) {
        executor.execute(() -> record(finalScore));
    }

    /**
     * @return 저장된 순위, 저장하지 않았으면 -1
     */
    int record(int finalScore) {
        try {
            if (!scoreBoard.isHighScore(gameId, finalScore)) {
                System.out.println("[HighScore] " + finalScore + " is not a high score for " + gameId);
                return -1;
            }
            String name = prompt.askName(finalScore);
            if (name == null || name.isBlank()) {
                System.out.println("[HighScore] skipped by player");
                return -1;
            }
            return scoreBoard.saveScore(name, finalScore, gameId);
        } catch (RuntimeException ex) {
            System.err.println("[HighScore] failed to record score " + finalScore + ": " + ex.getMessage());
            return -1;
        }
    }

    /** 대기 중인 저장을 마저 처리하고 전용 스레드를 정리 (최대 2초) */
    @Override
    public void close() {
        if (owned == null) return;
        owned.shutdown();
        try {
            if (!owned.awaitTermination(2, TimeUnit.SECONDS)) {
                System.err.println("[HighScore] pending prompt abandoned");
                owned.shutdownNow();
            }
        } catch (InterruptedException e) {
            owned.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
