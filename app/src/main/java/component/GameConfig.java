package component;

import logic.Grid;

/**
 * 게임 변형(Tetris / Line Destroyer)별 파라미터.
 * 하나의 엔진을 이 설정으로 두 번 인스턴스화한다.
 */
public final class GameConfig {
    public enum Mode { TETRIS, LINE_DESTROYER }

    private final Mode mode;
    private final String gameId;
    private final int boardWidth;
    private final int boardHeight;
    private final int pointsPerLine;
    private final int hardDropBonus;
    private final int linesPerLevel;
    private final int baseDropInterval;
    private final int dropIntervalStep;
    private final int minDropInterval;
    private final boolean highScoresEnabled;

    private GameConfig(Builder b) {
        this.mode = b.mode;
        this.gameId = b.gameId;
        this.boardWidth = b.boardWidth;
        this.boardHeight = b.boardHeight;
        this.pointsPerLine = b.pointsPerLine;
        this.hardDropBonus = b.hardDropBonus;
        this.linesPerLevel = b.linesPerLevel;
        this.baseDropInterval = b.baseDropInterval;
        this.dropIntervalStep = b.dropIntervalStep;
        this.minDropInterval = b.minDropInterval;
        this.highScoresEnabled = b.highScoresEnabled;
    }

    public static GameConfig tetris() {
        return builder().mode(Mode.TETRIS).gameId("tetris").build();
    }

    /** Line Destroyer: 규칙은 동일, 게임 오버 시 하이스코어 저장 */
    public static GameConfig lineDestroyer() {
        return builder().mode(Mode.LINE_DESTROYER).gameId("lineDestroyer").highScoresEnabled(true).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .mode(mode).gameId(gameId)
                .boardSize(boardWidth, boardHeight)
                .pointsPerLine(pointsPerLine).hardDropBonus(hardDropBonus)
                .linesPerLevel(linesPerLevel)
                .dropInterval(baseDropInterval, dropIntervalStep, minDropInterval)
                .highScoresEnabled(highScoresEnabled);
    }

    public Mode mode() { return mode; }
    public String gameId() { return gameId; }
    public int boardWidth() { return boardWidth; }
    public int boardHeight() { return boardHeight; }
    public int pointsPerLine() { return pointsPerLine; }
    public int hardDropBonus() { return hardDropBonus; }
    public int linesPerLevel() { return linesPerLevel; }
    public int baseDropInterval() { return baseDropInterval; }
    public int dropIntervalStep() { return dropIntervalStep; }
    public int minDropInterval() { return minDropInterval; }
    public boolean highScoresEnabled() { return highScoresEnabled; }

    @Override public String toString() {
        return "GameConfig{mode=" + mode + ", id=" + gameId + ", board=" + boardWidth + "x" + boardHeight
                + ", drop=" + baseDropInterval + "/-" + dropIntervalStep + "/min" + minDropInterval
                + ", hs=" + highScoresEnabled + "}";
    }

    public static final class Builder {
        private Mode mode = Mode.TETRIS;
        private String gameId = "tetris";
        private int boardWidth = Grid.WIDTH;
        private int boardHeight = Grid.HEIGHT;
        private int pointsPerLine = 100;
        private int hardDropBonus = 20;
        private int linesPerLevel = 10;
        private int baseDropInterval = 1000;
        private int dropIntervalStep = 50;
        private int minDropInterval = 50;
        private boolean highScoresEnabled = false;

        private Builder() {}

        public Builder mode(Mode mode) { this.mode = mode; return this; }
        public Builder gameId(String gameId) { this.gameId = gameId; return this; }
        public Builder boardSize(int width, int height) { this.boardWidth = width; this.boardHeight = height; return this; }
        public Builder pointsPerLine(int points) { this.pointsPerLine = points; return this; }
        public Builder hardDropBonus(int bonus) { this.hardDropBonus = bonus; return this; }
        public Builder linesPerLevel(int lines) { this.linesPerLevel = lines; return this; }

        public Builder dropInterval(int base, int step, int min) {
            this.baseDropInterval = base;
            this.dropIntervalStep = step;
            this.minDropInterval = min;
            return this;
        }

        public Builder highScoresEnabled(boolean enabled) { this.highScoresEnabled = enabled; return this; }

        public GameConfig build() {
            if (mode == null) throw new IllegalArgumentException("mode is required");
            if (gameId == null || gameId.isBlank()) throw new IllegalArgumentException("gameId is required");
            if (boardWidth < 4 || boardHeight < 4) {
                throw new IllegalArgumentException("board too small: " + boardWidth + "x" + boardHeight);
            }
            if (pointsPerLine < 0 || hardDropBonus < 0) throw new IllegalArgumentException("score constants must be >= 0");
            if (linesPerLevel <= 0) throw new IllegalArgumentException("linesPerLevel must be > 0");
            if (minDropInterval <= 0 || baseDropInterval < minDropInterval || dropIntervalStep < 0) {
                throw new IllegalArgumentException("invalid drop interval: base=" + baseDropInterval
                        + ", step=" + dropIntervalStep + ", min=" + minDropInterval);
            }
            return new GameConfig(this);
        }
    }
}
