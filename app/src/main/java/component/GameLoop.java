package component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import logic.BoardLogic;
import logic.GameListener;
import logic.GamePhase;

/**
 * GameLoop (단일 스레드 스케줄러 버전)
 * - PLAYING 진입 시 dropInterval 주기로 자동 낙하 무장
 * - 레벨업으로 간격이 바뀌면 재무장, PAUSED / GAME_OVER / stop 시 취소
 * - 무장할 때 세션 토큰을 캡처하므로 이전 세션의 틱은 BoardLogic 에서 버려진다
 * - 타이머 상태 변경은 BoardLogic 모니터 안에서만 일어난다
 */
public class GameLoop implements GameListener {
    private final BoardLogic logic;
    private final Runnable repaint;
    private final ScheduledExecutorService scheduler;
    private final AtomicLong tickCount = new AtomicLong(0);

    private ScheduledFuture<?> task;   // guarded by logic
    private int currentInterval = 0;   // guarded by logic
    private volatile boolean running = false;

    public GameLoop(BoardLogic logic, Runnable repaint) {
        this.logic = logic;
        this.repaint = (repaint != null) ? repaint : () -> {};
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "block-puzzle-loop");
            t.setDaemon(true);
            return t;
        });
        logic.addListener(this);
    }

    /* ===== 메인 제어 ===== */

    /** 루프 활성화. 세션이 이미 PLAYING 이면 바로 무장한다 */
    public void start() {
        synchronized (logic) {
            if (running) return;
            running = true;
            if (logic.getPhase() == GamePhase.PLAYING) {
                arm();
            }
        }
    }

    public void stop() {
        synchronized (logic) {
            running = false;
            cancel();
        }
    }

    /** 화면 종료 시: 타이머 취소 + 스레드 정리 */
    public void shutdown() {
        stop();
        logic.removeListener(this);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(1, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        System.out.println("[GameLoop] Cleanup completed");
    }

    /* ===== 세션 이벤트 ===== */

    @Override
    public void onPhaseChanged(GamePhase from, GamePhase to) {
        synchronized (logic) {
            if (to == GamePhase.PLAYING) {
                arm();
            } else {
                cancel();
            }
        }
    }

    @Override
    public void onLevelUp(int level, int dropIntervalMs) {
        synchronized (logic) {
            if (task != null) {
                arm();
            }
        }
    }

    /* ===== 내부 ===== */

    private void arm() {
        cancel();
        if (!running || scheduler.isShutdown()) return;

        final long token = logic.getGeneration();
        int interval = Math.max(1, logic.getDropInterval());
        currentInterval = interval;
        task = scheduler.scheduleAtFixedRate(() -> runTick(token), interval, interval, TimeUnit.MILLISECONDS);
    }

    private void cancel() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
        currentInterval = 0;
    }

    private void runTick(long token) {
        try {
            if (logic.tick(token)) {
                tickCount.incrementAndGet();
                repaint.run();
            }
        } catch (Throwable t) {
            // 예외가 나가면 scheduleAtFixedRate 가 조용히 멈춘다
            System.err.println("[GameLoop] tick failed: " + t);
            t.printStackTrace();
        }
    }

    /* ===== 유틸 ===== */
    public boolean isRunning() { return running; }

    public boolean isArmed() {
        synchronized (logic) {
            return task != null;
        }
    }

    public int getCurrentInterval() {
        synchronized (logic) {
            return currentInterval;
        }
    }

    public long getTickCount() { return tickCount.get(); }
}
