package logic;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import component.GameConfig;
import component.SpeedManager;

/**
 * BoardLogic
 * -----------------------
 * - 한 플레이 화면의 세션 상태 머신 (IDLE → PLAYING ⇄ PAUSED → GAME_OVER)
 * - 모든 명령과 자동 낙하 틱은 이 객체의 모니터로 직렬화된다
 * - 허용되지 않는 명령은 예외 없이 무시된다 (반환값 false)
 */
public class BoardLogic {

    private final GameConfig config;
    private final MovementService move;
    private final ClearService clear = new ClearService();
    private final ScoreService scoring;
    private final SpeedManager speedManager;
    private final PieceGenerator generator;

    private final List<GameListener> listeners = new CopyOnWriteArrayList<>();

    private Grid grid;
    private GamePiece curr;
    private GamePhase phase = GamePhase.IDLE;
    private int score = 0;
    private int linesCleared = 0;

    // 세션마다 증가. 이전 세션의 타이머 틱을 걸러내는 토큰
    private long generation = 0;

    public BoardLogic(GameConfig config) {
        this(config, RandomSource.system(), CollisionOverride.NONE);
    }

    public BoardLogic(GameConfig config, RandomSource random) {
        this(config, random, CollisionOverride.NONE);
    }

    public BoardLogic(GameConfig config, RandomSource random, CollisionOverride override) {
        this.config = Objects.requireNonNull(config, "config");
        this.move = new MovementService(override);
        this.scoring = new ScoreService(config);
        this.speedManager = new SpeedManager(config);
        this.generator = new PieceGenerator(random);
        this.grid = Grid.createEmpty(config.boardWidth(), config.boardHeight());
        System.out.println("[BoardLogic] created: " + config);
    }

    // ============================================
    // 리스너
    // ============================================
    public void addListener(GameListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(GameListener listener) {
        listeners.remove(listener);
    }

    // ============================================
    // 생명주기 명령
    // ============================================

    /** 어느 상태에서든 새 세션으로 PLAYING 진입 */
    public synchronized void start() {
        GamePhase old = phase;

        grid = Grid.createEmpty(config.boardWidth(), config.boardHeight());
        curr = null;
        score = 0;
        linesCleared = 0;
        speedManager.resetLevel();
        generator.reset();
        generation++;

        phase = GamePhase.PLAYING;
        System.out.println("[BoardLogic] start: " + config.gameId() + " (session " + generation + ")");
        // PLAYING → PLAYING 재시작도 알린다 (타이머 재무장)
        fireListeners(l -> l.onPhaseChanged(old, GamePhase.PLAYING));

        // currentPiece == null → 바로 스폰
        spawnNext();
        fireStateChanged();
    }

    /** 세션 폐기 (화면 종료 등). IDLE 로 돌아가고 남은 타이머 틱은 무효가 된다 */
    public synchronized void reset() {
        GamePhase old = phase;
        grid = Grid.createEmpty(config.boardWidth(), config.boardHeight());
        curr = null;
        score = 0;
        linesCleared = 0;
        speedManager.resetLevel();
        generation++;
        phase = GamePhase.IDLE;
        System.out.println("[BoardLogic] reset complete.");
        firePhaseChanged(old, phase);
        fireStateChanged();
    }

    public synchronized boolean pause() {
        if (phase != GamePhase.PLAYING) {
            return false;
        }
        phase = GamePhase.PAUSED;
        System.out.println("[BoardLogic] paused");
        firePhaseChanged(GamePhase.PLAYING, GamePhase.PAUSED);
        fireStateChanged();
        return true;
    }

    public synchronized boolean resume() {
        if (phase == GamePhase.GAME_OVER) {
            System.out.println("[BoardLogic] resume ignored (game over)");
            return false;
        }
        if (phase != GamePhase.PAUSED) {
            return false;
        }
        phase = GamePhase.PLAYING;
        System.out.println("[BoardLogic] resumed");
        firePhaseChanged(GamePhase.PAUSED, GamePhase.PLAYING);
        fireStateChanged();
        return true;
    }

    /** P 키: 현재 phase 에 따라 pause / resume */
    public synchronized boolean togglePause() {
        return phase == GamePhase.PLAYING ? pause() : resume();
    }

    // ============================================
    // 이동 입력
    // ============================================
    public synchronized boolean moveLeft() {
        return shift(-1);
    }

    public synchronized boolean moveRight() {
        return shift(1);
    }

    private boolean shift(int dx) {
        if (!canAct())
            return false;
        // 막힌 좌우 이동은 고정을 일으키지 않는다
        if (!move.canMove(grid, curr, dx, 0))
            return false;
        curr = curr.moveTo(curr.position().translate(dx, 0));
        fireStateChanged();
        return true;
    }

    /** 한 칸 내리기. 막혀 있으면 고정 → 줄 제거 → 다음 조각 */
    public synchronized boolean moveDown() {
        if (!canAct())
            return false;

        if (move.canMove(grid, curr, 0, 1)) {
            curr = curr.moveTo(curr.position().translate(0, 1));
        } else {
            lockPiece(curr, false);
        }
        fireStateChanged();
        return true;
    }

    /**
     * 타이머가 호출하는 자동 낙하.
     * 무장할 때 받은 세대 토큰이 현재 세션과 다르면 무시한다.
     */
    public synchronized boolean tick(long sessionToken) {
        if (sessionToken != generation) {
            return false;
        }
        return moveDown();
    }

    /** 벽 킥 없이 단순 시계 방향 회전. 충돌하면 아무 일도 없다 */
    public synchronized boolean rotate() {
        if (!canAct())
            return false;

        GamePiece rotated = curr.withTetromino(curr.tetromino().rotated());
        if (!move.isValidMove(grid, rotated, rotated.position()))
            return false;

        curr = rotated;
        fireStateChanged();
        return true;
    }

    public synchronized boolean hardDrop() {
        if (!canAct())
            return false;

        Position landing = move.calculateDropPosition(grid, curr);
        lockPiece(curr.moveTo(landing), true);
        fireStateChanged();
        return true;
    }

    private boolean canAct() {
        return phase == GamePhase.PLAYING && curr != null;
    }

    // ============================================
    // 고정 / 줄 제거 / 점수
    // ============================================
    private void lockPiece(GamePiece piece, boolean hardDrop) {
        grid = move.placePiece(grid, piece);
        curr = null;
        fireListeners(l -> l.onPiecePlaced(piece, hardDrop));

        ClearResult result = clear.clearLines(grid);
        grid = result.grid();
        int lines = result.linesCleared();

        // 점수는 이번 고정 전의 레벨 기준
        int delta = scoring.placementScore(lines, speedManager.getLevel(), hardDrop);
        score += delta;

        if (lines > 0) {
            linesCleared += lines;
            boolean leveledUp = speedManager.updateForLines(linesCleared);
            int total = linesCleared;
            fireListeners(l -> l.onLinesCleared(lines, total, delta));

            if (leveledUp) {
                int level = speedManager.getLevel();
                int interval = speedManager.getDropInterval();
                System.out.println("[BoardLogic] level up → " + level + " (drop " + interval + "ms)");
                fireListeners(l -> l.onLevelUp(level, interval));
            }
        }

        spawnNext();
    }

    private void spawnNext() {
        Tetromino next = generator.take();
        GamePiece spawned = new GamePiece(next, PieceGenerator.spawnPosition(grid.width()));

        if (!move.isValidMove(grid, spawned, spawned.position())) {
            gameOver();
            return;
        }
        curr = spawned;
    }

    private void gameOver() {
        if (phase == GamePhase.GAME_OVER) {
            return;
        }
        GamePhase old = phase;
        phase = GamePhase.GAME_OVER;
        curr = null;
        System.out.println("[GAME OVER] " + config.gameId() + " score: " + score);

        int finalScore = score;
        firePhaseChanged(old, GamePhase.GAME_OVER);
        fireListeners(l -> l.onGameOver(finalScore));
    }

    // ============================================
    // 조회
    // ============================================
    public synchronized SessionState getSnapshot() {
        return new SessionState(grid, curr, generator.peekNext(), score, speedManager.getLevel(),
                linesCleared, phase, speedManager.getDropInterval(), generation);
    }

    /** 고정 칸 = 1, 떨어지는 조각의 보이는 칸 = 2 */
    public synchronized int[][] renderBoard() {
        int[][] display = grid.toArray();
        if (curr != null) {
            Tetromino t = curr.tetromino();
            Position p = curr.position();
            for (int y = 0; y < t.height(); y++) {
                for (int x = 0; x < t.width(); x++) {
                    if (!t.isFilled(x, y)) continue;
                    int bx = p.x() + x;
                    int by = p.y() + y;
                    if (by >= 0 && by < grid.height() && bx >= 0 && bx < grid.width()) {
                        display[by][bx] = 2;
                    }
                }
            }
        }
        return display;
    }

    public synchronized Grid getGrid() { return grid; }
    public synchronized GamePiece getCurrentPiece() { return curr; }
    public synchronized Tetromino getNextTetromino() { return generator.peekNext(); }
    public synchronized int getScore() { return score; }
    public synchronized int getLevel() { return speedManager.getLevel(); }
    public synchronized int getLinesCleared() { return linesCleared; }
    public synchronized GamePhase getPhase() { return phase; }
    public synchronized boolean isGameOver() { return phase == GamePhase.GAME_OVER; }
    public synchronized int getDropInterval() { return speedManager.getDropInterval(); }
    public synchronized long getGeneration() { return generation; }
    public GameConfig getConfig() { return config; }

    // === 테스트용 ===
    synchronized void setGrid(Grid newGrid) {
        if (newGrid.width() != grid.width() || newGrid.height() != grid.height()) {
            throw new IllegalArgumentException("grid size mismatch");
        }
        this.grid = newGrid;
    }

    synchronized void setCurrentPiece(GamePiece piece) {
        this.curr = piece;
    }

    // ============================================
    // 이벤트 발행
    // ============================================
    private interface ListenerCall {
        void call(GameListener l);
    }

    private void fireListeners(ListenerCall call) {
        for (GameListener l : listeners) {
            try {
                call.call(l);
            } catch (RuntimeException ex) {
                // 구독자 실패는 엔진 상태에 영향을 주지 않는다
                System.err.println("[BoardLogic] listener failed: " + ex);
                ex.printStackTrace();
            }
        }
    }

    private void firePhaseChanged(GamePhase from, GamePhase to) {
        if (from == to) return;
        fireListeners(l -> l.onPhaseChanged(from, to));
    }

    private void fireStateChanged() {
        if (listeners.isEmpty()) return;
        SessionState snapshot = getSnapshot();
        fireListeners(l -> l.onStateChanged(snapshot));
    }
}
