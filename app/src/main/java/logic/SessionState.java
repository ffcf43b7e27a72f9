package logic;

/**
 * SessionState
 * -----------------------
 * - 렌더러가 다시 그리는 데 필요한 세션 전체의 읽기 전용 스냅샷
 * - Grid/Tetromino/GamePiece 가 모두 불변이라 얕은 보관으로 충분하다
 */
public final class SessionState {

    private final Grid grid;
    private final GamePiece currentPiece;
    private final Tetromino nextPiece;
    private final int score;
    private final int level;
    private final int linesCleared;
    private final GamePhase phase;
    private final int dropIntervalMs;
    private final long generation;

    SessionState(Grid grid, GamePiece currentPiece, Tetromino nextPiece, int score, int level,
                 int linesCleared, GamePhase phase, int dropIntervalMs, long generation) {
        this.grid = grid;
        this.currentPiece = currentPiece;
        this.nextPiece = nextPiece;
        this.score = score;
        this.level = level;
        this.linesCleared = linesCleared;
        this.phase = phase;
        this.dropIntervalMs = dropIntervalMs;
        this.generation = generation;
    }

    public Grid grid() { return grid; }

    /** null 이면 다음 조각 스폰 대기 (또는 게임 오버) */
    public GamePiece currentPiece() { return currentPiece; }

    public Tetromino nextPiece() { return nextPiece; }
    public int score() { return score; }
    public int level() { return level; }
    public int linesCleared() { return linesCleared; }
    public GamePhase phase() { return phase; }
    public int dropIntervalMs() { return dropIntervalMs; }
    public long generation() { return generation; }

    @Override
    public String toString() {
        return "SessionState{phase=" + phase + ", score=" + score + ", level=" + level
                + ", lines=" + linesCleared + ", drop=" + dropIntervalMs + "ms, piece=" + currentPiece
                + ", next=" + (nextPiece == null ? null : nextPiece.type()) + "}";
    }
}
